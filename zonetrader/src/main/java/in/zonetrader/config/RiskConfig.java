package in.zonetrader.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.zonetrader.domain.data.InstrumentClass;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

/**
 * Configuration for position sizing and account-level risk limits.
 *
 * Count and duration limits use 0 to switch the limit off.
 */
public record RiskConfig(
    @JsonProperty("riskFraction")
    BigDecimal riskFraction,                        // Balance fraction risked per trade (0.01 = 1%)

    @JsonProperty("globalMaxSize")
    BigDecimal globalMaxSize,                       // Absolute size cap for any instrument

    @JsonProperty("classMaxSize")
    Map<InstrumentClass, BigDecimal> classMaxSize,  // Absolute size cap per instrument class

    @JsonProperty("sanityMultiple")
    BigDecimal sanityMultiple,                      // Raw size above multiple x global max = anomaly

    @JsonProperty("dailyLossLimitFraction")
    BigDecimal dailyLossLimitFraction,              // Day's realized loss / opening balance; 0 = off

    @JsonProperty("maxOpenPositions")
    int maxOpenPositions,                           // Concurrent positions across instruments

    @JsonProperty("maxDailyTrades")
    int maxDailyTrades,                             // Positions opened per UTC day

    @JsonProperty("lossCooldownMinutes")
    int lossCooldownMinutes,                        // Per-instrument pause after a losing position

    @JsonProperty("winCooldownMinutes")
    int winCooldownMinutes,                         // Per-instrument pause after a winning position

    @JsonProperty("maxConsecutiveLosses")
    int maxConsecutiveLosses,                       // Losing streak that triggers the long pause

    @JsonProperty("lossStreakPauseMinutes")
    int lossStreakPauseMinutes                      // Length of the long pause
) {
    public static RiskConfig defaults() {
        Map<InstrumentClass, BigDecimal> classMax = new EnumMap<>(InstrumentClass.class);
        classMax.put(InstrumentClass.CURRENCY_PAIR, new BigDecimal("5"));
        classMax.put(InstrumentClass.METAL, new BigDecimal("2"));
        classMax.put(InstrumentClass.INDEX, new BigDecimal("3"));
        classMax.put(InstrumentClass.DIGITAL_ASSET, new BigDecimal("1"));

        return new RiskConfig(
            new BigDecimal("0.01"),
            new BigDecimal("10"),
            classMax,
            new BigDecimal("10"),
            new BigDecimal("0.03"),
            3,
            5,
            30,
            5,
            3,
            120
        );
    }

    /**
     * Cap for an instrument class; falls back to the global cap when the class has no entry.
     */
    public BigDecimal maxSizeFor(InstrumentClass instrumentClass) {
        BigDecimal cap = classMaxSize == null ? null : classMaxSize.get(instrumentClass);
        return cap != null ? cap : globalMaxSize;
    }

    public boolean isValid() {
        return riskFraction != null && riskFraction.signum() > 0 && riskFraction.compareTo(BigDecimal.ONE) < 0
            && globalMaxSize != null && globalMaxSize.signum() > 0
            && sanityMultiple != null && sanityMultiple.compareTo(BigDecimal.ONE) >= 0
            && dailyLossLimitFraction != null && dailyLossLimitFraction.signum() >= 0
            && dailyLossLimitFraction.compareTo(BigDecimal.ONE) <= 0
            && maxOpenPositions >= 0 && maxDailyTrades >= 0
            && lossCooldownMinutes >= 0 && winCooldownMinutes >= 0
            && maxConsecutiveLosses >= 0 && lossStreakPauseMinutes >= 0;
    }
}
