package in.zonetrader.service.zone;

import in.zonetrader.config.ZoneConfig;
import in.zonetrader.domain.data.Candle;
import in.zonetrader.domain.data.Resolution;
import in.zonetrader.domain.zone.Polarity;
import in.zonetrader.domain.zone.Zone;
import in.zonetrader.domain.zone.ZoneKind;
import in.zonetrader.domain.zone.ZoneStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Zone lifecycle on a 15-bar uptrend that ends in a bullish gap.
 *
 * Price unit 1, so the M15 minimum gap is 5. The gap forms on bar 14 with band [113.5, 119].
 */
class ZoneTrackerTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    private ZoneTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new ZoneTracker("IDX", Resolution.M15, ZoneConfig.defaults(), BigDecimal.ONE);
    }

    @Test
    @DisplayName("Gap forms FRESH, turns TESTED at 50% fill, INVALIDATED on a close below")
    void testGapLifecycle() {
        Zone gap = buildUptrendWithGap();

        assertEquals(ZoneKind.GAP, gap.getKind());
        assertEquals(Polarity.BULLISH, gap.getPolarity());
        assertEquals(ZoneStatus.FRESH, gap.getStatus());
        assertEquals(0, new BigDecimal("119").compareTo(gap.getTop()));
        assertEquals(0, new BigDecimal("113.5").compareTo(gap.getBottom()));
        assertEquals(time(14), gap.getFormedAt());

        // Trades exactly halfway down the band, closes inside
        tracker.onBar(bar(15, 124, 125, 116.25, 118), List.of());
        assertEquals(ZoneStatus.TESTED, gap.getStatus());
        assertEquals(0, new BigDecimal("50").compareTo(gap.getFillPercent()), "Fill: " + gap.getFillPercent());
        assertTrue(gap.isActive());

        // Closes below the gap low
        tracker.onBar(bar(16, 118, 118.5, 110, 111), List.of());
        assertEquals(ZoneStatus.INVALIDATED, gap.getStatus());
        assertEquals(0, new BigDecimal("100").compareTo(gap.getFillPercent()));
        assertEquals(time(16), gap.getLastTransitionAt());
        assertFalse(gap.isActive());
    }

    @Test
    @DisplayName("Invalidated gap retested and rejected from below flips to bearish, then retires")
    void testGapFlip() {
        Zone gap = buildUptrendWithGap();
        tracker.onBar(bar(15, 124, 125, 116.25, 118), List.of());
        tracker.onBar(bar(16, 118, 118.5, 110, 111), List.of());

        // Back up into the band, close below it again
        tracker.onBar(bar(17, 111, 114, 110.5, 112), List.of());
        assertEquals(ZoneStatus.FLIPPED, gap.getStatus());
        assertEquals(Polarity.BEARISH, gap.getPolarity());
        assertEquals(0, gap.getTop().compareTo(gap.invalidationEdge()), "Bearish zone invalidates at its top");
        assertTrue(gap.isActive());

        // Close above the flipped zone
        tracker.onBar(bar(18, 112, 121, 111.5, 120), List.of());
        assertEquals(ZoneStatus.FLIPPED, gap.getStatus());
        assertFalse(gap.isActive(), "Flipped zone closed through no longer reacts");
    }

    @Test
    void testZoneIsNotTransitionedOnItsFormingBar() {
        Zone gap = buildUptrendWithGap();

        assertEquals(time(14), gap.getLastTransitionAt());
        assertEquals(0, BigDecimal.ZERO.compareTo(gap.getFillPercent()));
    }

    @Test
    void testAtrWarmsUpAfterPeriodPlusOneBars() {
        for (int i = 0; i < 14; i++) {
            tracker.onBar(trendBar(i), List.of());
            assertNull(tracker.currentAtr(), "ATR must not exist after " + (i + 1) + " bars");
        }
        tracker.onBar(trendBar(14), List.of());
        assertNotNull(tracker.currentAtr());
    }

    @Test
    void testFillPercentDirection() {
        Zone bullish = new Zone("IDX", Resolution.M15, ZoneKind.ORDER_BLOCK, Polarity.BULLISH,
            new BigDecimal("110"), new BigDecimal("100"), T0);
        Zone bearish = new Zone("IDX", Resolution.M15, ZoneKind.ORDER_BLOCK, Polarity.BEARISH,
            new BigDecimal("110"), new BigDecimal("100"), T0);
        Candle touch = bar(1, 108, 108, 107.5, 108);

        assertEquals(0, new BigDecimal("25").compareTo(ZoneTracker.fillPercent(bullish, touch)));
        assertEquals(0, new BigDecimal("80").compareTo(ZoneTracker.fillPercent(bearish, touch)));
    }

    private Zone buildUptrendWithGap() {
        for (int i = 0; i < 13; i++) {
            ZoneTracker.ZoneUpdate update = tracker.onBar(trendBar(i), List.of());
            assertTrue(update.formed().isEmpty(), "Steady trend must not form zones, bar " + i);
        }
        tracker.onBar(bar(13, 113, 120, 112.5, 119), List.of());
        ZoneTracker.ZoneUpdate update = tracker.onBar(bar(14, 119, 126, 119, 125), List.of());

        Optional<Zone> gap = update.formedOfKind(ZoneKind.GAP);
        assertTrue(gap.isPresent(), "Gap expected on bar 14");
        assertEquals(1, tracker.zoneBook().size());
        return gap.get();
    }

    private static Candle trendBar(int i) {
        return bar(i, 100 + i, 101.5 + i, 99.5 + i, 101 + i);
    }

    private static Instant time(int index) {
        return T0.plusSeconds(900L * index);
    }

    private static Candle bar(int index, double o, double h, double l, double c) {
        return Candle.of("IDX", Resolution.M15, time(index), o, h, l, c, 100);
    }
}
