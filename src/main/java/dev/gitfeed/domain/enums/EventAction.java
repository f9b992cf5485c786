package dev.gitfeed.domain.enums;

/**
 * Canonical action of a stored event. PR opened → PULL_REQUEST, PR closed + merged → MERGE.
 */
public enum EventAction {
    PUSH, PULL_REQUEST, MERGE
}
