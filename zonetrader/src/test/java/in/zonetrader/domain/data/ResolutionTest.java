package in.zonetrader.domain.data;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ResolutionTest {

    @Test
    void testBucketStartFloorsFromUtcMidnight() {
        Instant t = Instant.parse("2024-03-01T09:37:12Z");

        assertEquals(Instant.parse("2024-03-01T09:37:00Z"), Resolution.M1.bucketStart(t));
        assertEquals(Instant.parse("2024-03-01T09:30:00Z"), Resolution.M15.bucketStart(t));
        assertEquals(Instant.parse("2024-03-01T09:00:00Z"), Resolution.H1.bucketStart(t));
        assertEquals(Instant.parse("2024-03-01T08:00:00Z"), Resolution.H4.bucketStart(t));
        assertEquals(Instant.parse("2024-03-01T00:00:00Z"), Resolution.D1.bucketStart(t));
    }

    @Test
    void testCoarserThan() {
        assertTrue(Resolution.H4.isCoarserThan(Resolution.M15));
        assertFalse(Resolution.M15.isCoarserThan(Resolution.M15));
        assertFalse(Resolution.M5.isCoarserThan(Resolution.H1));
    }

    @Test
    void testCoarserBarClosesWithLastExecutionBarOfItsBucket() {
        Instant h4Start = Instant.parse("2024-03-01T08:00:00Z");

        assertFalse(Resolution.H4.isClosedBy(h4Start, Resolution.M15, Instant.parse("2024-03-01T11:30:00Z")),
            "H4 bar still forming while 15 minutes remain");
        assertTrue(Resolution.H4.isClosedBy(h4Start, Resolution.M15, Instant.parse("2024-03-01T11:45:00Z")),
            "H4 bar closes with the 11:45 M15 bar");
        assertTrue(Resolution.H4.isClosedBy(h4Start, Resolution.M15, Instant.parse("2024-03-01T12:00:00Z")));
    }

    @Test
    void testCandleRejectsHighBelowLow() {
        assertThrows(IllegalArgumentException.class, () ->
            Candle.of("EURUSD", Resolution.M15, Instant.parse("2024-03-01T00:00:00Z"), 1.1, 1.0, 1.2, 1.1, 0));
    }
}
