package in.zonetrader.service.zone;

import in.zonetrader.domain.data.Candle;
import in.zonetrader.domain.zone.Polarity;
import in.zonetrader.domain.zone.Zone;
import in.zonetrader.domain.zone.ZoneKind;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Order Block Detector - Last counter-direction bar before an impulse.
 *
 * Bullish: bar i-1 bearish, bar i bullish with body > ratio x body(i-1) and close > high(i-1)
 * Bearish: bar i-1 bullish, bar i bearish with body > ratio x body(i-1) and close < low(i-1)
 *
 * Band = range of bar i-1 padded by wickAllowance x range on both sides.
 */
public final class OrderBlockDetector {

    private OrderBlockDetector() {}

    /**
     * Check whether the last bar of the window completes an order block.
     *
     * @param window        Bars oldest first; only the last two are read
     * @param impulseRatio  Minimum impulse body / order-block body
     * @param wickAllowance Band padding as a fraction of the order-block range
     * @return New FRESH zone formed at the last bar, or empty
     */
    public static Optional<Zone> detect(List<Candle> window, BigDecimal impulseRatio, BigDecimal wickAllowance) {
        if (window == null || window.size() < 2) {
            return Optional.empty();
        }

        Candle block = window.get(window.size() - 2);
        Candle impulse = window.get(window.size() - 1);

        Polarity polarity;
        if (block.isBearish() && impulse.isBullish()
                && impulse.close().compareTo(block.high()) > 0) {
            polarity = Polarity.BULLISH;
        } else if (block.isBullish() && impulse.isBearish()
                && impulse.close().compareTo(block.low()) < 0) {
            polarity = Polarity.BEARISH;
        } else {
            return Optional.empty();
        }

        if (impulse.bodySize().compareTo(block.bodySize().multiply(impulseRatio)) <= 0) {
            return Optional.empty();
        }

        BigDecimal padding = block.range().multiply(wickAllowance);
        return Optional.of(new Zone(
            impulse.instrument(),
            impulse.resolution(),
            ZoneKind.ORDER_BLOCK,
            polarity,
            block.high().add(padding),
            block.low().subtract(padding),
            impulse.timestamp()
        ));
    }
}
