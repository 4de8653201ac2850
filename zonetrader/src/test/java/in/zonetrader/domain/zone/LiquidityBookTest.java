package in.zonetrader.domain.zone;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LiquidityBookTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");
    private static final BigDecimal TOLERANCE = new BigDecimal("0.0005");

    @Test
    void testNearbyLowerRankedLevelIsMerged() {
        LiquidityBook book = new LiquidityBook(50);
        assertTrue(book.add(level("1.1050", LiquiditySource.EQUAL_HIGHS), TOLERANCE));

        assertFalse(book.add(level("1.1053", LiquiditySource.SWING_HIGH), TOLERANCE));
        assertEquals(1, book.size(LiquiditySide.BUY_SIDE));
    }

    @Test
    void testHigherRankedLevelReplacesNearbyOne() {
        LiquidityBook book = new LiquidityBook(50);
        book.add(level("1.1050", LiquiditySource.SWING_HIGH), TOLERANCE);

        assertTrue(book.add(level("1.1052", LiquiditySource.PREVIOUS_DAY_HIGH), TOLERANCE));

        List<LiquidityLevel> levels = book.unconsumed(LiquiditySide.BUY_SIDE);
        assertEquals(1, levels.size());
        assertEquals(LiquiditySource.PREVIOUS_DAY_HIGH, levels.get(0).getSource());
    }

    @Test
    void testConsumedLevelIsNeverRevived() {
        LiquidityBook book = new LiquidityBook(50);
        LiquidityLevel level = level("1.0950", LiquiditySource.SWING_LOW);
        book.add(level, TOLERANCE);
        level.consume(T0.plusSeconds(900));

        assertTrue(book.unconsumed().isEmpty());
        assertThrows(IllegalStateException.class, () -> level.consume(T0.plusSeconds(1800)));
        assertTrue(book.add(level("1.0950", LiquiditySource.SWING_LOW), TOLERANCE),
            "A fresh level at the same price is a new level");
    }

    @Test
    void testSideIsBounded() {
        LiquidityBook book = new LiquidityBook(2);
        book.add(level("1.10", LiquiditySource.SWING_HIGH), TOLERANCE);
        book.add(level("1.11", LiquiditySource.SWING_HIGH), TOLERANCE);
        book.add(level("1.12", LiquiditySource.SWING_HIGH), TOLERANCE);

        List<LiquidityLevel> levels = book.unconsumed(LiquiditySide.BUY_SIDE);
        assertEquals(2, levels.size());
        assertEquals(0, new BigDecimal("1.11").compareTo(levels.get(0).getPrice()));
    }

    private static LiquidityLevel level(String price, LiquiditySource source) {
        return new LiquidityLevel(new BigDecimal(price), source, T0);
    }
}
