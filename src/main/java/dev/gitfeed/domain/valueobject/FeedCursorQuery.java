package dev.gitfeed.domain.valueobject;

import dev.gitfeed.domain.entity.StoredEvent;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

import java.util.Optional;

/**
 * Filter and ordering for one feed poll.
 *
 * <p>No cursor matches every event; a cursor matches events whose timestamp is
 * strictly greater. The comparison is on the string form, which is only sound
 * because canonical timestamps are fixed-width and zero-padded.
 */
public record FeedCursorQuery(Optional<String> cursor) {

    static final String TIMESTAMP = "timestamp";
    static final String ID = "id";

    private static final FeedCursorQuery ALL = new FeedCursorQuery(Optional.empty());

    public FeedCursorQuery {
        if (cursor == null) cursor = Optional.empty();
    }

    /** Blank or missing cursors mean "from the beginning". */
    public static FeedCursorQuery of(String since) {
        if (since == null || since.isBlank()) {
            return ALL;
        }
        return new FeedCursorQuery(Optional.of(since.trim()));
    }

    public static FeedCursorQuery all() {
        return ALL;
    }

    public Specification<StoredEvent> toSpecification() {
        return cursor.<Specification<StoredEvent>>map(c ->
                        (root, query, cb) -> cb.greaterThan(root.<String>get(TIMESTAMP), c))
                .orElseGet(() -> (root, query, cb) -> cb.conjunction());
    }

    /** Ascending timestamp; insertion order for ties. */
    public Sort sort() {
        return Sort.by(Sort.Direction.ASC, TIMESTAMP).and(Sort.by(Sort.Direction.ASC, ID));
    }
}
