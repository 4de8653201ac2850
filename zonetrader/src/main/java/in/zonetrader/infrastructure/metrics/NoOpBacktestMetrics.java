package in.zonetrader.infrastructure.metrics;

import in.zonetrader.domain.backtest.DropKind;
import in.zonetrader.domain.data.Direction;
import in.zonetrader.domain.trade.ExitReason;

import java.math.BigDecimal;

/**
 * Metrics sink that records nothing.
 */
public final class NoOpBacktestMetrics implements BacktestMetrics {

    public static final NoOpBacktestMetrics INSTANCE = new NoOpBacktestMetrics();

    private NoOpBacktestMetrics() {}

    @Override
    public void recordSignal(String instrument, Direction direction) {}

    @Override
    public void recordDrop(String instrument, DropKind kind) {}

    @Override
    public void recordTradeClosed(String instrument, ExitReason reason, BigDecimal pnl) {}

    @Override
    public void recordEquity(BigDecimal equity) {}

    @Override
    public void recordHalt(String instrument, String errorType) {}
}
