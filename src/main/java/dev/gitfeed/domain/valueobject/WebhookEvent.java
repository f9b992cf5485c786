package dev.gitfeed.domain.valueobject;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.gitfeed.domain.enums.EventAction;

import java.util.Objects;

/**
 * Canonical record for one source-control action, as stored and as served by the feed.
 *
 * <p>{@code timestamp} is always {@code yyyy-MM-ddTHH:mm:ssZ} in UTC, which keeps
 * lexicographic and chronological order identical.
 */
public record WebhookEvent(
        @JsonProperty("request_id") String requestId,
        String author,
        EventAction action,
        @JsonProperty("from_branch") String fromBranch,
        @JsonProperty("to_branch") String toBranch,
        String timestamp
) {
    /** Author placeholder when no upstream field names one. */
    public static final String UNKNOWN_AUTHOR = "Unknown";

    public WebhookEvent {
        Objects.requireNonNull(action, "action required");
        Objects.requireNonNull(timestamp, "timestamp required");
        if (requestId == null) requestId = "";
        if (author == null) author = UNKNOWN_AUTHOR;
        if (fromBranch == null) fromBranch = "";
        if (toBranch == null) toBranch = "";
    }
}
