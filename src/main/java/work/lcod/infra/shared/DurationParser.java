package work.lcod.infra.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses timeout strings such as {@code 30s}, {@code 5m}, {@code 1h30m} or {@code 1500ms}.
 * A bare number is read as milliseconds.
 */
public final class DurationParser {
    private static final Pattern SEGMENT = Pattern.compile("(\\d+(?:\\.\\d+)?)(ms|s|m|h)");

    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        if ("0".equals(trimmed)) {
            return Optional.of(Duration.ZERO);
        }
        if (trimmed.chars().allMatch(Character::isDigit)) {
            return Optional.of(Duration.ofMillis(Long.parseLong(trimmed)));
        }
        var matcher = SEGMENT.matcher(trimmed);
        int position = 0;
        double millis = 0;
        while (matcher.find()) {
            if (matcher.start() != position) {
                return Optional.empty();
            }
            double value = Double.parseDouble(matcher.group(1));
            long multiplier = switch (matcher.group(2)) {
                case "ms" -> 1L;
                case "s" -> 1_000L;
                case "m" -> 60_000L;
                default -> 3_600_000L;
            };
            millis += value * multiplier;
            position = matcher.end();
        }
        if (position != trimmed.length()) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofMillis(Math.round(millis)));
    }
}
