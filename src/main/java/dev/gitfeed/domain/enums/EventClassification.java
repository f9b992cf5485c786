package dev.gitfeed.domain.enums;

import java.util.Optional;

/**
 * Outcome of classifying an inbound notification. UNSUPPORTED is a silent-ignore
 * signal, not an error.
 */
public enum EventClassification {
    PUSH(EventAction.PUSH),
    PULL_REQUEST(EventAction.PULL_REQUEST),
    MERGE(EventAction.MERGE),
    UNSUPPORTED(null);

    private final EventAction action;

    EventClassification(EventAction action) {
        this.action = action;
    }

    public Optional<EventAction> action() {
        return Optional.ofNullable(action);
    }

    public boolean isSupported() {
        return action != null;
    }
}
