package in.zonetrader.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Configuration for open-position management.
 *
 * All distances are R multiples, where R is the initial stop distance.
 */
public record ManagementConfig(
    @JsonProperty("trailingEnabled")
    boolean trailingEnabled,

    @JsonProperty("trailingActivationR")
    BigDecimal trailingActivationR,     // Favourable excursion before the stop trails

    @JsonProperty("trailingDistanceR")
    BigDecimal trailingDistanceR,       // Stop distance behind the best price

    @JsonProperty("breakEvenEnabled")
    boolean breakEvenEnabled,

    @JsonProperty("breakEvenTriggerR")
    BigDecimal breakEvenTriggerR,       // Favourable excursion before moving to break-even

    @JsonProperty("breakEvenOffsetR")
    BigDecimal breakEvenOffsetR,        // Stop placed at entry + offset (locks a little profit)

    @JsonProperty("partialEnabled")
    boolean partialEnabled,

    @JsonProperty("partialTriggerR")
    BigDecimal partialTriggerR,         // Excursion at which part of the position is closed

    @JsonProperty("partialFraction")
    BigDecimal partialFraction          // Fraction of the size closed (0.5 = half)
) {
    public static ManagementConfig defaults() {
        return new ManagementConfig(
            true,
            new BigDecimal("1.5"),
            new BigDecimal("1.0"),
            true,
            new BigDecimal("1.0"),
            new BigDecimal("0.1"),
            true,
            new BigDecimal("1.0"),
            new BigDecimal("0.5")
        );
    }

    /**
     * All management rules off: positions exit only at stop, target or end of data.
     */
    public static ManagementConfig disabled() {
        return new ManagementConfig(
            false, BigDecimal.ZERO, BigDecimal.ZERO,
            false, BigDecimal.ZERO, BigDecimal.ZERO,
            false, BigDecimal.ZERO, BigDecimal.ZERO
        );
    }

    public boolean isValid() {
        return (!trailingEnabled || (trailingActivationR.signum() > 0 && trailingDistanceR.signum() > 0))
            && (!breakEvenEnabled || (breakEvenTriggerR.signum() > 0 && breakEvenOffsetR.signum() >= 0
                && breakEvenOffsetR.compareTo(breakEvenTriggerR) < 0))
            && (!partialEnabled || (partialTriggerR.signum() > 0
                && partialFraction.signum() > 0 && partialFraction.compareTo(BigDecimal.ONE) < 0));
    }
}
