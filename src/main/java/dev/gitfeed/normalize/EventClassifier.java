package dev.gitfeed.normalize;

import dev.gitfeed.domain.enums.EventClassification;
import dev.gitfeed.dto.request.WebhookPayload;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Decides which canonical action, if any, a notification represents.
 *
 * <p>Only a pull_request closed with {@code merged: true} is a MERGE. Every other
 * pull_request action (opened, reopened, closed without merging, edited...) collapses
 * to PULL_REQUEST.
 */
@Component
public class EventClassifier {

    static final String PUSH = "push";
    static final String PULL_REQUEST = "pull_request";
    private static final Set<String> TRACKED = Set.of(PUSH, PULL_REQUEST);

    /** Whether the event type can produce an event at all. Needs no payload. */
    public boolean isTracked(String eventType) {
        return TRACKED.contains(canonical(eventType));
    }

    public EventClassification classify(String eventType, WebhookPayload payload) {
        return switch (canonical(eventType)) {
            case PUSH -> EventClassification.PUSH;
            case PULL_REQUEST -> isMergedClose(payload) ? EventClassification.MERGE : EventClassification.PULL_REQUEST;
            default -> EventClassification.UNSUPPORTED;
        };
    }

    private static boolean isMergedClose(WebhookPayload payload) {
        return payload != null
                && "closed".equalsIgnoreCase(payload.action())
                && payload.pullRequest() != null
                && Boolean.TRUE.equals(payload.pullRequest().merged());
    }

    private static String canonical(String eventType) {
        return eventType == null ? "" : eventType.trim().toLowerCase(Locale.ROOT);
    }
}
