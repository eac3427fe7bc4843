package io.entityjdbc.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit-test")
public class AssertTest {
    @Test
    public void whenAssertingConditions_expectConditionsToHold() {
        Assertions.assertDoesNotThrow(() -> Assert.notNull(1, "null!"));
        Assertions.assertDoesNotThrow(() -> Assert.isTrue(true, "!"));
        Assertions.assertDoesNotThrow(() -> Assert.hasText("a", "!"));
        Assertions.assertDoesNotThrow(() -> Assert.state(true, "!"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Assert.notNull(null, "!"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Assert.isTrue(false, "!"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Assert.hasText("", "!"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Assert.hasText("  ", "!"));
        Assertions.assertThrows(IllegalStateException.class, () -> Assert.state(false, "!"));
    }
}
