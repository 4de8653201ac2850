package in.zonetrader.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.zonetrader.domain.data.Resolution;

import java.math.BigDecimal;

/**
 * Configuration for a replay run.
 */
public record BacktestConfig(
    @JsonProperty("initialBalance")
    BigDecimal initialBalance,

    @JsonProperty("executionResolution")
    Resolution executionResolution,

    @JsonProperty("intermediateResolution")
    Resolution intermediateResolution,

    @JsonProperty("macroResolution")
    Resolution macroResolution,

    @JsonProperty("periodsPerYear")
    int periodsPerYear              // Annualization for the Sharpe ratio (trading days)
) {
    public static BacktestConfig defaults() {
        return new BacktestConfig(
            new BigDecimal("10000"),
            Resolution.M15,
            Resolution.H4,
            Resolution.D1,
            252
        );
    }

    public boolean isValid() {
        return initialBalance != null && initialBalance.signum() > 0
            && intermediateResolution.isCoarserThan(executionResolution)
            && macroResolution.isCoarserThan(intermediateResolution)
            && periodsPerYear > 0;
    }
}
