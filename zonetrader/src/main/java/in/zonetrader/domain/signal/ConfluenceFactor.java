package in.zonetrader.domain.signal;

import in.zonetrader.config.ScoringConfig;

import java.math.BigDecimal;

/**
 * Evidence combined by the confluence scorer. Each factor yields a credit in [0, 1].
 */
public enum ConfluenceFactor {
    MACRO_TREND,
    INTERMEDIATE_STRUCTURE,
    EXECUTION_ZONE,
    SWEEP_CONFIRMATION,
    RANGE_POSITION;

    /**
     * Raw weight of this factor.
     */
    public BigDecimal weight(ScoringConfig config) {
        return switch (this) {
            case MACRO_TREND -> config.macroTrendWeight();
            case INTERMEDIATE_STRUCTURE -> config.intermediateStructureWeight();
            case EXECUTION_ZONE -> config.executionZoneWeight();
            case SWEEP_CONFIRMATION -> config.sweepWeight();
            case RANGE_POSITION -> config.rangePositionWeight();
        };
    }
}
