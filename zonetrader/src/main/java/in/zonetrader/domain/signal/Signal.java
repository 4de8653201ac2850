package in.zonetrader.domain.signal;

import in.zonetrader.domain.data.Direction;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Directional trade decision produced once for a qualifying bar.
 *
 * confidence is normalized to [0, 100].
 */
public record Signal(
    String instrument,
    Direction direction,
    BigDecimal entry,
    BigDecimal stop,
    BigDecimal target,
    BigDecimal confidence,
    SignalStrength strength,
    BigDecimal sizeMultiplier,
    List<String> reasons,
    Instant barTime
) {
    public Signal {
        reasons = List.copyOf(reasons);
        if (confidence.signum() < 0 || confidence.compareTo(new BigDecimal("100")) > 0) {
            throw new IllegalArgumentException("Confidence out of [0, 100]: " + confidence);
        }
    }

    /**
     * Stop distance as a price difference (may be zero for a degenerate signal).
     */
    public BigDecimal risk() {
        return entry.subtract(stop).abs();
    }

    /**
     * The same signal filled across the spread: a LONG pays entry + spread, a SHORT entry - spread.
     * Stop and target stay where the signal put them.
     */
    public Signal withSpread(BigDecimal spread) {
        if (spread == null || spread.signum() == 0) {
            return this;
        }
        BigDecimal filled = entry.add(spread.multiply(direction.sign()));
        return new Signal(instrument, direction, filled, stop, target, confidence, strength,
            sizeMultiplier, reasons, barTime);
    }
}
