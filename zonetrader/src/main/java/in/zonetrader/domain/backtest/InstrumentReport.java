package in.zonetrader.domain.backtest;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-instrument outcome of a run.
 *
 * haltReason is null unless the instrument was halted by a data or detector error.
 */
public record InstrumentReport(
    String instrument,
    boolean halted,
    String haltReason,
    int barsProcessed,
    int signals,
    int trades,
    BigDecimal netPnl,
    Map<DropKind, Integer> drops
) {
    public InstrumentReport {
        drops = drops.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(drops));
    }

    public int dropCount(DropKind kind) {
        return drops.getOrDefault(kind, 0);
    }
}
