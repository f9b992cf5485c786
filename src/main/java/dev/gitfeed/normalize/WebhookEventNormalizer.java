package dev.gitfeed.normalize;

import dev.gitfeed.domain.enums.EventAction;
import dev.gitfeed.domain.enums.EventClassification;
import dev.gitfeed.domain.valueobject.WebhookEvent;
import dev.gitfeed.dto.request.WebhookPayload;
import dev.gitfeed.dto.request.WebhookPayload.Commit;
import dev.gitfeed.dto.request.WebhookPayload.PullRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.util.List;

import static dev.gitfeed.domain.valueobject.WebhookEvent.UNKNOWN_AUTHOR;

/**
 * Maps push and pull_request payloads onto the canonical {@link WebhookEvent}.
 *
 * <p>The classifier picks the action; this class only extracts fields. PULL_REQUEST
 * and MERGE share one extraction path and differ only in which timestamp wins.
 *
 * <p>Missing optional fields fall back to defaults ({@code "Unknown"}, empty string,
 * current time). Payloads whose structure cannot be read at all yield
 * {@link NormalizationResult.Status#PARSE_FAILURE} instead of an exception.
 */
@Component
public class WebhookEventNormalizer {

    private static final Logger log = LoggerFactory.getLogger(WebhookEventNormalizer.class);

    static final String BRANCH_REF_PREFIX = "refs/heads/";
    static final int SHORT_SHA_LENGTH = 7;

    // A missing pull_request object reads like an empty one.
    private static final PullRequest EMPTY_PULL_REQUEST =
            new PullRequest(null, null, null, null, null, null, null, null);

    private final ObjectMapper objectMapper;
    private final EventClassifier classifier;
    private final TimestampNormalizer timestamps;

    public WebhookEventNormalizer(ObjectMapper objectMapper,
                                  EventClassifier classifier,
                                  TimestampNormalizer timestamps) {
        this.objectMapper = objectMapper;
        this.classifier = classifier;
        this.timestamps = timestamps;
    }

    /**
     * Normalizes a raw JSON body. The body is only deserialized for event types that
     * can produce an event, so payloads of ignored types are never inspected.
     */
    public NormalizationResult normalize(String eventType, String rawBody) {
        if (!classifier.isTracked(eventType)) {
            log.debug("Ignoring unsupported event type '{}'", eventType);
            return NormalizationResult.unsupported(eventType);
        }
        WebhookPayload payload;
        try {
            payload = objectMapper.readValue(rawBody, WebhookPayload.class);
        } catch (JacksonException | IllegalArgumentException e) {
            log.warn("Unreadable {} payload: {}", eventType, e.getMessage());
            return NormalizationResult.parseFailure("invalid payload");
        }
        return normalize(eventType, payload);
    }

    public NormalizationResult normalize(String eventType, WebhookPayload payload) {
        EventClassification classification = classifier.classify(eventType, payload);
        if (!classification.isSupported()) {
            log.debug("Ignoring unsupported event type '{}'", eventType);
            return NormalizationResult.unsupported(eventType);
        }
        if (payload == null) {
            log.warn("Empty {} payload", eventType);
            return NormalizationResult.parseFailure("empty payload");
        }
        try {
            WebhookEvent event = classification == EventClassification.PUSH
                    ? fromPush(payload)
                    : fromPullRequest(payload, classification.action().orElseThrow());
            log.debug("Normalized {} into {}", eventType, event);
            return NormalizationResult.normalized(event);
        } catch (RuntimeException e) {
            log.warn("Failed to extract {} event: {}", eventType, e.toString());
            return NormalizationResult.parseFailure(e.getMessage());
        }
    }

    WebhookEvent fromPush(WebhookPayload payload) {
        Commit head = payload.headCommit();
        String branch = branchName(payload.ref());
        String author = Fallbacks.firstNonBlankOr(UNKNOWN_AUTHOR,
                () -> pusherName(payload),
                () -> firstCommitAuthor(payload.commits()));
        String requestId = head == null ? "" : shortSha(head.id());
        String timestamp = Fallbacks.firstNonBlank(
                        () -> head == null ? null : head.timestamp(),
                        () -> pushedAt(payload.repository()))
                .map(timestamps::normalize)
                .orElseGet(timestamps::now);
        return new WebhookEvent(requestId, author, EventAction.PUSH, branch, branch, timestamp);
    }

    WebhookEvent fromPullRequest(WebhookPayload payload, EventAction action) {
        PullRequest p = payload.pullRequest() != null ? payload.pullRequest() : EMPTY_PULL_REQUEST;
        String author = Fallbacks.firstNonBlankOr(UNKNOWN_AUTHOR,
                () -> p.user() == null ? null : p.user().login());
        String fromBranch = p.head() == null || p.head().ref() == null ? "" : p.head().ref();
        String toBranch = p.base() == null || p.base().ref() == null ? "" : p.base().ref();
        String requestId = p.number() == null ? "" : Long.toString(p.number());
        String timestamp = (action == EventAction.MERGE
                        ? Fallbacks.firstNonBlank(p::mergedAt, p::updatedAt)
                        : Fallbacks.firstNonBlank(p::createdAt))
                .map(timestamps::normalize)
                .orElseGet(timestamps::now);
        return new WebhookEvent(requestId, author, action, fromBranch, toBranch, timestamp);
    }

    /** Strips {@code refs/heads/}; tag and other refs pass through unchanged. */
    static String branchName(String ref) {
        if (ref == null) {
            return "";
        }
        return ref.startsWith(BRANCH_REF_PREFIX) ? ref.substring(BRANCH_REF_PREFIX.length()) : ref;
    }

    static String shortSha(String sha) {
        if (sha == null) {
            return "";
        }
        return sha.length() <= SHORT_SHA_LENGTH ? sha : sha.substring(0, SHORT_SHA_LENGTH);
    }

    /** A pusher literally named "Unknown" is treated as absent. */
    private static String pusherName(WebhookPayload payload) {
        if (payload.pusher() == null || UNKNOWN_AUTHOR.equals(payload.pusher().name())) {
            return null;
        }
        return payload.pusher().name();
    }

    private static String firstCommitAuthor(List<Commit> commits) {
        if (commits == null || commits.isEmpty()) {
            return null;
        }
        Commit first = commits.get(0);
        return first == null || first.author() == null ? null : first.author().name();
    }

    private static String pushedAt(WebhookPayload.Repository repository) {
        if (repository == null || repository.pushedAt() == null) {
            return null;
        }
        Object value = repository.pushedAt();
        if (value instanceof Number number) {
            return Long.toString(number.longValue());
        }
        return value.toString();
    }
}
