package in.zonetrader.domain.signal;

import java.math.BigDecimal;

/**
 * Confidence band of a signal and the position size multiplier it earns.
 */
public enum SignalStrength {
    WEAK(BigDecimal.ZERO, new BigDecimal("0.5")),
    MODERATE(new BigDecimal("70"), new BigDecimal("0.7")),
    STRONG(new BigDecimal("80"), new BigDecimal("0.85")),
    VERY_STRONG(new BigDecimal("90"), BigDecimal.ONE);

    private final BigDecimal threshold;
    private final BigDecimal multiplier;

    SignalStrength(BigDecimal threshold, BigDecimal multiplier) {
        this.threshold = threshold;
        this.multiplier = multiplier;
    }

    /**
     * Lower confidence bound (inclusive) of this band.
     */
    public BigDecimal getThreshold() {
        return threshold;
    }

    /**
     * Position size multiplier: VERY_STRONG = 1.0x, STRONG = 0.85x, MODERATE = 0.7x, WEAK = 0.5x
     */
    public BigDecimal getMultiplier() {
        return multiplier;
    }

    public static SignalStrength fromConfidence(BigDecimal confidence) {
        if (confidence.compareTo(VERY_STRONG.threshold) >= 0) return VERY_STRONG;
        if (confidence.compareTo(STRONG.threshold) >= 0) return STRONG;
        if (confidence.compareTo(MODERATE.threshold) >= 0) return MODERATE;
        return WEAK;
    }
}
