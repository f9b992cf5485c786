package dev.gitfeed.normalize;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;

/**
 * Converts upstream timestamps to the canonical {@code yyyy-MM-ddTHH:mm:ssZ} UTC form.
 *
 * <p>GitHub is inconsistent across payloads: commit timestamps carry the committer's
 * offset ({@code 2024-05-01T10:15:30+05:30}), PR timestamps use {@code Z}, and
 * {@code repository.pushed_at} in push payloads is epoch seconds. Values without an
 * offset are taken as UTC.
 *
 * <p>Never throws. Unparseable input resolves to the current instant, so a bad
 * timestamp cannot block storing the event.
 */
@Component
public class TimestampNormalizer {

    private static final Logger log = LoggerFactory.getLogger(TimestampNormalizer.class);

    public static final DateTimeFormatter CANONICAL =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    // The canonical form only holds four-digit years.
    static final Instant EARLIEST = Instant.parse("0000-01-01T00:00:00Z");
    static final Instant LATEST = Instant.parse("9999-12-31T23:59:59Z");

    private final Clock clock;

    public TimestampNormalizer(Clock clock) {
        this.clock = clock;
    }

    public String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            log.warn("Missing timestamp, using current time");
            return now();
        }
        try {
            return CANONICAL.format(inRange(parse(raw.trim()).truncatedTo(ChronoUnit.SECONDS)));
        } catch (DateTimeException e) {
            log.warn("Unparseable timestamp '{}', using current time: {}", raw, e.getMessage());
            return now();
        }
    }

    /** Current instant in canonical form. */
    public String now() {
        return CANONICAL.format(clock.instant().truncatedTo(ChronoUnit.SECONDS));
    }

    private static Instant parse(String value) {
        if (isEpochSeconds(value)) {
            return Instant.ofEpochSecond(Long.parseLong(value));
        }
        if (value.length() == 10) {
            return LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE)
                    .atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        String iso = value.length() > 10 && value.charAt(10) == ' '
                ? value.substring(0, 10) + 'T' + value.substring(11)
                : value;
        TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                .parseBest(iso, ZonedDateTime::from, LocalDateTime::from);
        if (parsed instanceof ZonedDateTime zoned) {
            return zoned.toInstant();
        }
        return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
    }

    private static Instant inRange(Instant instant) {
        if (instant.isBefore(EARLIEST) || instant.isAfter(LATEST)) {
            throw new DateTimeException("Timestamp outside years 0000-9999: " + instant);
        }
        return instant;
    }

    private static boolean isEpochSeconds(String value) {
        if (value.length() > 12) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
