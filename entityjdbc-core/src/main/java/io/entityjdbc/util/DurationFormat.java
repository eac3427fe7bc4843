package io.entityjdbc.util;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility for formatting and parsing Duration's.
 */
public abstract class DurationFormat {
    private static final Pattern DURATION_PATTERN
            = Pattern.compile("([0-9]+)\\s*(ms|[smhdw])", Pattern.CASE_INSENSITIVE);

    private DurationFormat() {
    }

    /**
     * Parse a duration expression with time unit tokens, or when absent, milliseconds.
     *
     * @param durationOrMillis time duration expression
     * @return a duration
     */
    public static Duration parseDuration(String durationOrMillis) {
        Assert.hasText(durationOrMillis, "duration expression is empty");
        Matcher matcher = DURATION_PATTERN.matcher(durationOrMillis.toLowerCase(Locale.ENGLISH));
        Duration duration = Duration.ZERO;
        if (matcher.find()) {
            do {
                int ordinal = Integer.parseInt(matcher.group(1));
                String token = matcher.group(2);
                switch (token) {
                    case "ms":
                        duration = duration.plus(Duration.ofMillis(ordinal));
                        break;
                    case "s":
                        duration = duration.plus(Duration.ofSeconds(ordinal));
                        break;
                    case "m":
                        duration = duration.plus(Duration.ofMinutes(ordinal));
                        break;
                    case "h":
                        duration = duration.plus(Duration.ofHours(ordinal));
                        break;
                    case "d":
                        duration = duration.plus(Duration.ofDays(ordinal));
                        break;
                    case "w":
                        duration = duration.plus(Duration.ofDays(ordinal * 7L));
                        break;
                    default:
                        throw new IllegalArgumentException("Invalid token: " + token);
                }
            } while (matcher.find());
            return duration;
        } else {
            return Duration.ofMillis(Long.parseLong(durationOrMillis.trim()));
        }
    }

    /**
     * Format a duration as a compact expression accepted by {@link #parseDuration(String)},
     * for example {@code 1m 3s 250ms}.
     *
     * @param duration the duration to format
     * @return duration expression
     */
    public static String formatDuration(Duration duration) {
        Assert.notNull(duration, "duration is null");
        if (duration.isZero() || duration.isNegative()) {
            return duration.toMillis() + "ms";
        }
        StringBuilder sb = new StringBuilder();
        append(sb, duration.toDaysPart(), "d");
        append(sb, duration.toHoursPart(), "h");
        append(sb, duration.toMinutesPart(), "m");
        append(sb, duration.toSecondsPart(), "s");
        append(sb, duration.toMillisPart(), "ms");
        return sb.length() > 0 ? sb.toString() : "0ms";
    }

    private static void append(StringBuilder sb, long value, String token) {
        if (value > 0) {
            if (sb.length() > 0) {
                sb.append(" ");
            }
            sb.append(value).append(token);
        }
    }
}
