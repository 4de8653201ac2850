package in.zonetrader.service.zone;

import in.zonetrader.domain.data.Candle;
import in.zonetrader.domain.zone.Polarity;
import in.zonetrader.domain.zone.Zone;
import in.zonetrader.domain.zone.ZoneKind;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Gap Detector - 3-bar imbalance left untraded by the middle bar.
 *
 * Bars k-2, k-1, k:
 * - Bullish when low(k) - high(k-2) >= minGap, band [high(k-2), low(k)]
 * - Bearish when low(k-2) - high(k) >= minGap, band [high(k), low(k-2)]
 */
public final class GapDetector {

    private GapDetector() {}

    /**
     * Check whether the last three bars of the window leave a gap.
     *
     * @param window Bars oldest first; only the last three are read
     * @param minGap Minimum gap as a price distance (units x price unit)
     * @return New FRESH zone formed at the last bar, or empty
     */
    public static Optional<Zone> detect(List<Candle> window, BigDecimal minGap) {
        if (window == null || window.size() < 3) {
            return Optional.empty();
        }

        Candle first = window.get(window.size() - 3);
        Candle third = window.get(window.size() - 1);

        BigDecimal bullishGap = third.low().subtract(first.high());
        if (bullishGap.signum() > 0 && bullishGap.compareTo(minGap) >= 0) {
            return Optional.of(new Zone(
                third.instrument(), third.resolution(), ZoneKind.GAP, Polarity.BULLISH,
                third.low(), first.high(), third.timestamp()));
        }

        BigDecimal bearishGap = first.low().subtract(third.high());
        if (bearishGap.signum() > 0 && bearishGap.compareTo(minGap) >= 0) {
            return Optional.of(new Zone(
                third.instrument(), third.resolution(), ZoneKind.GAP, Polarity.BEARISH,
                first.low(), third.high(), third.timestamp()));
        }

        return Optional.empty();
    }
}
