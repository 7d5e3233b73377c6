package work.lcod.infra.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
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
    void parsesMinutes() {
        Optional<Duration> duration = DurationParser.parse("2m");
        assertTrue(duration.isPresent());
        assertEquals(Duration.ofMinutes(2), duration.get());
    }

    @Test
    void parsesCombinedSegments() {
        assertEquals(Optional.of(Duration.ofMinutes(90)), DurationParser.parse("1h30m"));
        assertEquals(Optional.of(Duration.ofMillis(2500)), DurationParser.parse("2s500ms"));
        assertEquals(Optional.of(Duration.ofSeconds(90)), DurationParser.parse("1.5m"));
    }

    @Test
    void parsesMillisecondsByDefault() {
        Optional<Duration> duration = DurationParser.parse("1500");
        assertTrue(duration.isPresent());
        assertEquals(Duration.ofMillis(1500), duration.get());
    }

    @Test
    void handlesZero() {
        Optional<Duration> duration = DurationParser.parse("0");
        assertTrue(duration.isPresent());
        assertEquals(Duration.ZERO, duration.get());
    }

    @Test
    void rejectsMalformedInput() {
        assertTrue(DurationParser.parse("soon").isEmpty());
        assertTrue(DurationParser.parse("5 minutes").isEmpty());
        assertTrue(DurationParser.parse("10d").isEmpty());
        assertTrue(DurationParser.parse("").isEmpty());
        assertTrue(DurationParser.parse(null).isEmpty());
    }
}
