package in.zonetrader.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Configuration for swing confirmation and structural breaks.
 */
public record StructureConfig(
    @JsonProperty("confirmWindow")
    int confirmWindow,                      // Bars on each side with strictly less extreme prices

    @JsonProperty("displacementMultiplier")
    BigDecimal displacementMultiplier,      // Break bar body must exceed this x mean range; 0 = off

    @JsonProperty("displacementLookback")
    int displacementLookback                // Bars averaged for the displacement filter
) {
    public static StructureConfig defaults() {
        return new StructureConfig(
            2,
            BigDecimal.ZERO,
            10
        );
    }

    public boolean displacementEnabled() {
        return displacementMultiplier != null && displacementMultiplier.signum() > 0;
    }

    public boolean isValid() {
        return confirmWindow >= 1
            && displacementMultiplier != null && displacementMultiplier.signum() >= 0
            && displacementLookback >= 1;
    }
}
