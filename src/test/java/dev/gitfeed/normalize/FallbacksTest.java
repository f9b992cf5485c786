package dev.gitfeed.normalize;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class FallbacksTest {

    @Test
    @DisplayName("first non-blank candidate wins")
    void firstNonBlankWins() {
        assertThat(Fallbacks.firstNonBlank(() -> null, () -> "  ", () -> "second", () -> "third"))
                .contains("second");
    }

    @Test
    @DisplayName("empty when every candidate is null or blank")
    void emptyWhenNoCandidateHasValue() {
        assertThat(Fallbacks.firstNonBlank(() -> null, () -> "")).isEmpty();
        assertThat(Fallbacks.firstNonBlankOr("Unknown", () -> null)).isEqualTo("Unknown");
    }

    @Test
    @DisplayName("later candidates are not evaluated once one matches")
    void evaluatesLazily() {
        AtomicInteger calls = new AtomicInteger();
        String value = Fallbacks.firstNonBlankOr("default",
                () -> "first",
                () -> { calls.incrementAndGet(); return "second"; });

        assertThat(value).isEqualTo("first");
        assertThat(calls).hasValue(0);
    }
}
