package io.entityjdbc.util;

import java.time.Duration;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit-test")
public class DurationFormatTest {
    @Test
    public void whenParsingDurationExpressions_expectDurations() {
        Assertions.assertEquals(Duration.ofMillis(150), DurationFormat.parseDuration("150ms"));
        Assertions.assertEquals(Duration.ofMinutes(2).plus(Duration.ofSeconds(3).plus(Duration.ofMillis(125))),
                DurationFormat.parseDuration("2m 3s 125ms"));
        Assertions.assertEquals(Duration.ofMillis(0), DurationFormat.parseDuration("0"));
        Assertions.assertEquals(Duration.ofMillis(0), DurationFormat.parseDuration("0s"));
        Assertions.assertEquals(Duration.ofMillis(30), DurationFormat.parseDuration("30"));
        Assertions.assertEquals(Duration.ofSeconds(30), DurationFormat.parseDuration("30s"));
        Assertions.assertEquals(Duration.ofMinutes(30), DurationFormat.parseDuration("30m"));
        Assertions.assertEquals(Duration.ofHours(30), DurationFormat.parseDuration("30h"));
        Assertions.assertEquals(Duration.ofDays(14), DurationFormat.parseDuration("2w"));
        Assertions.assertEquals(Duration.ofHours(10).plus(Duration.ofMinutes(3).plus(Duration.ofSeconds(15))),
                DurationFormat.parseDuration("10h3m15s"));
    }

    @Test
    public void whenParsingInvalidExpression_expectException() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> DurationFormat.parseDuration(""));
        Assertions.assertThrows(NumberFormatException.class, () -> DurationFormat.parseDuration("soon"));
    }

    @Test
    public void whenFormattingDurations_expectParsableExpressions() {
        Assertions.assertEquals("0ms", DurationFormat.formatDuration(Duration.ZERO));
        Assertions.assertEquals("1m 3s 250ms",
                DurationFormat.formatDuration(Duration.ofMinutes(1).plusSeconds(3).plusMillis(250)));
        Assertions.assertEquals("30s", DurationFormat.formatDuration(Duration.ofSeconds(30)));
        Assertions.assertEquals(Duration.ofHours(26).plusMillis(5),
                DurationFormat.parseDuration(DurationFormat.formatDuration(Duration.ofHours(26).plusMillis(5))));
    }
}
