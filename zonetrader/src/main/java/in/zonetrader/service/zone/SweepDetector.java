package in.zonetrader.service.zone;

import in.zonetrader.domain.data.Candle;
import in.zonetrader.domain.zone.LiquidityLevel;
import in.zonetrader.domain.zone.LiquiditySide;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Sweep Detector - Wick through a watched level that closes back on the originating side.
 *
 * Buy-side: high > level + tolerance and close < level
 * Sell-side: low < level - tolerance and close > level
 *
 * Only levels that existed when the bar opened are eligible. The detector does not consume
 * levels; the caller does.
 */
public final class SweepDetector {

    private SweepDetector() {}

    /**
     * @param bar       Bar to test
     * @param levels    Unconsumed levels (either side)
     * @param tolerance Volatility-scaled tolerance (price distance)
     * @return At most one sweep per side
     */
    public static List<Sweep> detect(Candle bar, List<LiquidityLevel> levels, BigDecimal tolerance) {
        List<Sweep> sweeps = new ArrayList<>(2);
        detectSide(bar, levels, tolerance, LiquiditySide.BUY_SIDE).ifPresent(sweeps::add);
        detectSide(bar, levels, tolerance, LiquiditySide.SELL_SIDE).ifPresent(sweeps::add);
        return sweeps;
    }

    private static Optional<Sweep> detectSide(Candle bar, List<LiquidityLevel> levels,
                                              BigDecimal tolerance, LiquiditySide side) {
        List<LiquidityLevel> swept = new ArrayList<>();
        BigDecimal reference = null;

        for (LiquidityLevel level : levels) {
            if (level.isConsumed() || level.getSide() != side
                    || level.getCreatedAt().isAfter(bar.timestamp())) {
                continue;
            }
            BigDecimal price = level.getPrice();
            boolean hit;
            if (side == LiquiditySide.BUY_SIDE) {
                hit = bar.high().compareTo(price.add(tolerance)) > 0 && bar.close().compareTo(price) < 0;
            } else {
                hit = bar.low().compareTo(price.subtract(tolerance)) < 0 && bar.close().compareTo(price) > 0;
            }
            if (hit) {
                swept.add(level);
                if (reference == null
                        || (side == LiquiditySide.BUY_SIDE ? price.compareTo(reference) > 0
                                                            : price.compareTo(reference) < 0)) {
                    reference = price;
                }
            }
        }

        if (swept.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal extreme = side == LiquiditySide.BUY_SIDE ? bar.high() : bar.low();
        return Optional.of(new Sweep(bar.timestamp(), side, List.copyOf(swept), reference, extreme));
    }
}
