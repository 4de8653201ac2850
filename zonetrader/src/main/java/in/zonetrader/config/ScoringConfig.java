package in.zonetrader.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Configuration for the confluence scorer.
 *
 * Weights are raw; the score is normalized by their sum so the maximum is exactly 100.
 */
public record ScoringConfig(
    @JsonProperty("macroTrendWeight")
    BigDecimal macroTrendWeight,

    @JsonProperty("intermediateStructureWeight")
    BigDecimal intermediateStructureWeight,

    @JsonProperty("executionZoneWeight")
    BigDecimal executionZoneWeight,

    @JsonProperty("sweepWeight")
    BigDecimal sweepWeight,

    @JsonProperty("rangePositionWeight")
    BigDecimal rangePositionWeight,

    @JsonProperty("minConfidence")
    BigDecimal minConfidence,               // 0..100

    @JsonProperty("stopBufferAtrMultiple")
    BigDecimal stopBufferAtrMultiple,       // Stop = zone edge -/+ multiple x ATR

    @JsonProperty("minRewardMultiple")
    BigDecimal minRewardMultiple,           // Target must clear multiple x stop distance

    @JsonProperty("sweepRecencyBars")
    int sweepRecencyBars                    // Sweep zones younger than this confirm a signal
) {
    public static ScoringConfig defaults() {
        return new ScoringConfig(
            new BigDecimal("40"),
            new BigDecimal("30"),
            new BigDecimal("25"),
            new BigDecimal("20"),
            new BigDecimal("15"),
            new BigDecimal("70"),
            new BigDecimal("0.25"),
            new BigDecimal("2.0"),
            10
        );
    }

    public BigDecimal totalWeight() {
        return macroTrendWeight
            .add(intermediateStructureWeight)
            .add(executionZoneWeight)
            .add(sweepWeight)
            .add(rangePositionWeight);
    }

    public boolean isValid() {
        return macroTrendWeight.signum() >= 0
            && intermediateStructureWeight.signum() >= 0
            && executionZoneWeight.signum() >= 0
            && sweepWeight.signum() >= 0
            && rangePositionWeight.signum() >= 0
            && totalWeight().signum() > 0
            && minConfidence.signum() >= 0 && minConfidence.compareTo(new BigDecimal("100")) <= 0
            && stopBufferAtrMultiple.signum() >= 0
            && minRewardMultiple.signum() > 0
            && sweepRecencyBars > 0;
    }
}
