package dev.gitfeed.normalize;

import dev.gitfeed.domain.valueobject.WebhookEvent;

/**
 * Outcome of normalizing one notification: an event, a deliberate skip, or a
 * request-scoped parse failure.
 */
public record NormalizationResult(Status status, WebhookEvent event, String reason) {

    public enum Status { NORMALIZED, UNSUPPORTED, PARSE_FAILURE }

    public NormalizationResult {
        if (status == null) throw new IllegalArgumentException("status required");
        if (status == Status.NORMALIZED && event == null)
            throw new IllegalArgumentException("event required when normalized");
    }

    public static NormalizationResult normalized(WebhookEvent event) {
        return new NormalizationResult(Status.NORMALIZED, event, null);
    }

    public static NormalizationResult unsupported(String eventType) {
        return new NormalizationResult(Status.UNSUPPORTED, null, "unsupported event type: " + eventType);
    }

    public static NormalizationResult parseFailure(String reason) {
        return new NormalizationResult(Status.PARSE_FAILURE, null, reason);
    }
}
