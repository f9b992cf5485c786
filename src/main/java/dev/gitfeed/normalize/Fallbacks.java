package dev.gitfeed.normalize;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Ordered candidate lookup for payload fields that have several possible sources.
 */
public final class Fallbacks {

    private Fallbacks() {}

    /**
     * Returns the first candidate that yields a non-blank value. Candidates are
     * evaluated lazily and in order, so later ones may be expensive or
     * time-dependent.
     */
    @SafeVarargs
    public static Optional<String> firstNonBlank(Supplier<String>... candidates) {
        for (Supplier<String> candidate : candidates) {
            String value = candidate.get();
            if (value != null && !value.isBlank()) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /** {@link #firstNonBlank} with a constant default. */
    @SafeVarargs
    public static String firstNonBlankOr(String defaultValue, Supplier<String>... candidates) {
        return firstNonBlank(candidates).orElse(defaultValue);
    }
}
