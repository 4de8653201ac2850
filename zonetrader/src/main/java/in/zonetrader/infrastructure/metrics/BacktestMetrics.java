package in.zonetrader.infrastructure.metrics;

import in.zonetrader.domain.backtest.DropKind;
import in.zonetrader.domain.data.Direction;
import in.zonetrader.domain.trade.ExitReason;

import java.math.BigDecimal;

/**
 * Replay metrics for monitoring runs.
 *
 * Key metrics:
 * - Signals emitted per instrument and direction
 * - Signals dropped per instrument and drop kind
 * - Trades closed per instrument and exit reason
 * - Current equity
 * - Instrument halts
 */
public interface BacktestMetrics {

    /**
     * Record an emitted signal.
     *
     * @param instrument Instrument symbol
     * @param direction Signal direction
     */
    void recordSignal(String instrument, Direction direction);

    /**
     * Record a dropped (or flagged) signal.
     *
     * @param instrument Instrument symbol
     * @param kind Why it was dropped
     */
    void recordDrop(String instrument, DropKind kind);

    /**
     * Record a closed trade (full or partial).
     *
     * @param instrument Instrument symbol
     * @param reason Exit reason
     * @param pnl Realized P&L
     */
    void recordTradeClosed(String instrument, ExitReason reason, BigDecimal pnl);

    /**
     * Record current equity.
     */
    void recordEquity(BigDecimal equity);

    /**
     * Record an instrument halted by a data or detector error.
     *
     * @param instrument Instrument symbol
     * @param errorType Exception class name
     */
    void recordHalt(String instrument, String errorType);
}
