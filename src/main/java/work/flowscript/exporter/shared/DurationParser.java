package work.flowscript.exporter.shared;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses user-friendly timeouts such as {@code 500ms}, {@code 1.5s}, {@code 2m} or {@code 1h}.
 * A bare number is read as milliseconds, the unit Playwright timeouts use.
 */
public final class DurationParser {
    private static final Pattern FORMAT = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(ms|s|m|h)?");
    private static final Map<String, Long> MILLIS_PER_UNIT = Map.of(
        "ms", 1L,
        "s", 1_000L,
        "m", 60_000L,
        "h", 3_600_000L
    );
    private static final BigDecimal MAX_MILLIS = BigDecimal.valueOf(Long.MAX_VALUE);

    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        var matcher = FORMAT.matcher(raw.trim().toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid duration: " + raw);
        }
        var unit = matcher.group(2) == null ? "ms" : matcher.group(2);
        var millis = new BigDecimal(matcher.group(1)).multiply(BigDecimal.valueOf(MILLIS_PER_UNIT.get(unit)));
        if (millis.compareTo(MAX_MILLIS) > 0) {
            throw new IllegalArgumentException("Duration out of range: " + raw);
        }
        // sub-millisecond fractions are truncated
        return Optional.of(Duration.ofMillis(millis.longValue()));
    }
}
