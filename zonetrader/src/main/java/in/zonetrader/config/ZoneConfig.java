package in.zonetrader.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.zonetrader.domain.data.Resolution;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

/**
 * Configuration for zone detection and tracking.
 *
 * Impulse ratio and minimum gap are keyed by resolution; fast resolutions are stricter.
 */
public record ZoneConfig(
    @JsonProperty("maxZonesPerSide")
    int maxZonesPerSide,                            // Per kind per polarity, oldest evicted first

    @JsonProperty("impulseRatio")
    Map<Resolution, BigDecimal> impulseRatio,       // Impulse body / order-block body

    @JsonProperty("minGapUnits")
    Map<Resolution, BigDecimal> minGapUnits,        // Minimum gap in price units

    @JsonProperty("wickAllowance")
    BigDecimal wickAllowance,                       // Band padding as fraction of order-block range

    @JsonProperty("atrPeriod")
    int atrPeriod,

    @JsonProperty("sweepToleranceAtrMultiple")
    BigDecimal sweepToleranceAtrMultiple,           // Liquidity tolerance = multiple x ATR

    @JsonProperty("equalLevelLookback")
    int equalLevelLookback,                         // Prior swings compared for equal highs/lows

    @JsonProperty("equalLevelMinTouches")
    int equalLevelMinTouches,                       // Extremes within tolerance to form a level

    @JsonProperty("maxLiquidityLevels")
    int maxLiquidityLevels,                         // Per side, oldest evicted first

    @JsonProperty("buyThreshold")
    BigDecimal buyThreshold,                        // Range position below = DISCOUNT

    @JsonProperty("sellThreshold")
    BigDecimal sellThreshold,                       // Range position above = PREMIUM

    @JsonProperty("discountOptimalLow")
    BigDecimal discountOptimalLow,

    @JsonProperty("discountOptimalHigh")
    BigDecimal discountOptimalHigh,

    @JsonProperty("premiumOptimalLow")
    BigDecimal premiumOptimalLow,

    @JsonProperty("premiumOptimalHigh")
    BigDecimal premiumOptimalHigh
) {
    public static ZoneConfig defaults() {
        Map<Resolution, BigDecimal> impulse = new EnumMap<>(Resolution.class);
        impulse.put(Resolution.M1, new BigDecimal("3.0"));
        impulse.put(Resolution.M5, new BigDecimal("2.5"));
        impulse.put(Resolution.M15, new BigDecimal("2.0"));
        impulse.put(Resolution.M30, new BigDecimal("1.8"));
        impulse.put(Resolution.H1, new BigDecimal("1.5"));
        impulse.put(Resolution.H4, new BigDecimal("1.3"));
        impulse.put(Resolution.D1, new BigDecimal("1.2"));

        Map<Resolution, BigDecimal> minGap = new EnumMap<>(Resolution.class);
        minGap.put(Resolution.M1, new BigDecimal("2"));
        minGap.put(Resolution.M5, new BigDecimal("3"));
        minGap.put(Resolution.M15, new BigDecimal("5"));
        minGap.put(Resolution.M30, new BigDecimal("6"));
        minGap.put(Resolution.H1, new BigDecimal("8"));
        minGap.put(Resolution.H4, new BigDecimal("15"));
        minGap.put(Resolution.D1, new BigDecimal("25"));

        return new ZoneConfig(
            10,
            impulse,
            minGap,
            new BigDecimal("0.1"),
            14,
            new BigDecimal("0.1"),
            10,
            2,
            50,
            new BigDecimal("0.5"),
            new BigDecimal("0.5"),
            new BigDecimal("0.21"),
            new BigDecimal("0.38"),
            new BigDecimal("0.62"),
            new BigDecimal("0.79")
        );
    }

    /**
     * Impulse ratio for a resolution.
     *
     * @throws IllegalArgumentException if the table has no entry for it
     */
    public BigDecimal impulseRatioFor(Resolution resolution) {
        BigDecimal ratio = impulseRatio == null ? null : impulseRatio.get(resolution);
        if (ratio == null) {
            throw new IllegalArgumentException("No impulse ratio configured for " + resolution);
        }
        return ratio;
    }

    /**
     * Minimum gap in price units for a resolution.
     *
     * @throws IllegalArgumentException if the table has no entry for it
     */
    public BigDecimal minGapUnitsFor(Resolution resolution) {
        BigDecimal units = minGapUnits == null ? null : minGapUnits.get(resolution);
        if (units == null) {
            throw new IllegalArgumentException("No minimum gap configured for " + resolution);
        }
        return units;
    }

    public boolean isValid() {
        return maxZonesPerSide > 0
            && impulseRatio != null && !impulseRatio.isEmpty()
            && minGapUnits != null && !minGapUnits.isEmpty()
            && wickAllowance != null && wickAllowance.signum() >= 0
            && atrPeriod > 0
            && sweepToleranceAtrMultiple != null && sweepToleranceAtrMultiple.signum() >= 0
            && equalLevelLookback > 0
            && equalLevelMinTouches >= 2
            && maxLiquidityLevels > 0
            && buyThreshold.compareTo(sellThreshold) <= 0
            && discountOptimalLow.compareTo(discountOptimalHigh) < 0
            && discountOptimalHigh.compareTo(buyThreshold) <= 0
            && premiumOptimalLow.compareTo(sellThreshold) >= 0
            && premiumOptimalLow.compareTo(premiumOptimalHigh) < 0;
    }
}
