package work.flowscript.exporter.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DurationParserTest {
    @Test
    void parsesSeconds() {
        Optional<Duration> duration = DurationParser.parse("30s");
        assertTrue(duration.isPresent());
        assertEquals(Duration.ofSeconds(30), duration.get());
    }

    @Test
    void parsesExplicitMilliseconds() {
        assertEquals(Duration.ofMillis(250), DurationParser.parse(" 250MS ").orElseThrow());
    }

    @Test
    void parsesMinutesAndHours() {
        assertEquals(Duration.ofMinutes(2), DurationParser.parse("2m").orElseThrow());
        assertEquals(Duration.ofHours(1), DurationParser.parse("1h").orElseThrow());
    }

    @Test
    void acceptsFractionsAndSpacing() {
        assertEquals(Duration.ofMillis(1500), DurationParser.parse("1.5s").orElseThrow());
        assertEquals(Duration.ofMillis(90_000), DurationParser.parse("1.5 m").orElseThrow());
        assertEquals(Duration.ofMillis(2), DurationParser.parse("2.9").orElseThrow());
    }

    @Test
    void bareNumberIsMilliseconds() {
        assertEquals(Duration.ofMillis(1500), DurationParser.parse("1500").orElseThrow());
        assertEquals(Duration.ZERO, DurationParser.parse("0").orElseThrow());
    }

    @Test
    void blankIsAbsent() {
        assertTrue(DurationParser.parse("  ").isEmpty());
        assertTrue(DurationParser.parse(null).isEmpty());
    }

    @Test
    void rejectsGarbageAndNegatives() {
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("soon"));
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("-5s"));
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("5 days"));
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("99999999999999999999h"));
    }
}
