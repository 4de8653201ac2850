package in.zonetrader.service.zone;

import in.zonetrader.config.ZoneConfig;
import in.zonetrader.domain.structure.StructureState;
import in.zonetrader.domain.zone.RangePosition;
import in.zonetrader.domain.zone.RangeZone;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Range Position Calculator - Discount / premium location inside the active swing range.
 *
 * position = (price - swingLow) / (swingHigh - swingLow)
 * - position < buyThreshold  = DISCOUNT (optimal inside [discountOptimalLow, discountOptimalHigh])
 * - position > sellThreshold = PREMIUM  (optimal inside [premiumOptimalLow, premiumOptimalHigh])
 * - otherwise EQUILIBRIUM
 */
public final class RangePositionCalculator {

    private RangePositionCalculator() {}

    /**
     * Locate a price using the latest confirmed swings of a structure state.
     *
     * @return Empty when the state has no usable range yet
     */
    public static Optional<RangePosition> calculate(BigDecimal price, StructureState structure, ZoneConfig config) {
        if (structure == null || !structure.hasRange()) {
            return Optional.empty();
        }
        return Optional.of(calculate(price, structure.lastSwingHigh().price(), structure.lastSwingLow().price(), config));
    }

    public static RangePosition calculate(BigDecimal price, BigDecimal swingHigh, BigDecimal swingLow, ZoneConfig config) {
        BigDecimal range = swingHigh.subtract(swingLow);
        if (range.signum() <= 0) {
            throw new IllegalArgumentException(
                String.format("Swing high %s must be above swing low %s", swingHigh, swingLow));
        }

        BigDecimal position = price.subtract(swingLow).divide(range, 6, RoundingMode.HALF_UP);

        if (position.compareTo(config.buyThreshold()) < 0) {
            boolean optimal = within(position, config.discountOptimalLow(), config.discountOptimalHigh());
            return new RangePosition(position, RangeZone.DISCOUNT, optimal);
        }
        if (position.compareTo(config.sellThreshold()) > 0) {
            boolean optimal = within(position, config.premiumOptimalLow(), config.premiumOptimalHigh());
            return new RangePosition(position, RangeZone.PREMIUM, optimal);
        }
        return new RangePosition(position, RangeZone.EQUILIBRIUM, false);
    }

    private static boolean within(BigDecimal value, BigDecimal low, BigDecimal high) {
        return value.compareTo(low) >= 0 && value.compareTo(high) <= 0;
    }
}
