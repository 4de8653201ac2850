package in.zonetrader.infrastructure.metrics;

import in.zonetrader.domain.backtest.DropKind;
import in.zonetrader.domain.data.Direction;
import in.zonetrader.domain.trade.ExitReason;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;

/**
 * Prometheus implementation of BacktestMetrics interface.
 *
 * Key Metrics:
 * - zonetrader_signals_total{instrument, direction} - Signals emitted
 * - zonetrader_signals_dropped_total{instrument, kind} - Signals dropped or flagged
 * - zonetrader_trades_closed_total{instrument, exit_reason} - Closed trades
 * - zonetrader_trade_pnl{instrument} - Realized P&L distribution
 * - zonetrader_equity - Current equity
 * - zonetrader_instrument_halts_total{instrument, error} - Halted instruments
 *
 * Usage:
 * <pre>
 * CollectorRegistry registry = new CollectorRegistry();
 * BacktestMetrics metrics = new PrometheusBacktestMetrics(registry);
 * </pre>
 */
public class PrometheusBacktestMetrics implements BacktestMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusBacktestMetrics.class);

    private final CollectorRegistry registry;

    private final Counter signalCounter;
    private final Counter dropCounter;
    private final Counter tradeCounter;
    private final Histogram tradePnl;
    private final Gauge equity;
    private final Counter haltCounter;

    public PrometheusBacktestMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusBacktestMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.signalCounter = Counter.build()
            .name("zonetrader_signals_total")
            .help("Total number of signals emitted")
            .labelNames("instrument", "direction")
            .register(registry);

        this.dropCounter = Counter.build()
            .name("zonetrader_signals_dropped_total")
            .help("Total number of signals dropped or flagged")
            .labelNames("instrument", "kind")
            .register(registry);

        this.tradeCounter = Counter.build()
            .name("zonetrader_trades_closed_total")
            .help("Total number of closed trades")
            .labelNames("instrument", "exit_reason")
            .register(registry);

        this.tradePnl = Histogram.build()
            .name("zonetrader_trade_pnl")
            .help("Realized P&L per closed trade")
            .labelNames("instrument")
            .buckets(-1000, -500, -100, -50, 0, 50, 100, 500, 1000)
            .register(registry);

        this.equity = Gauge.build()
            .name("zonetrader_equity")
            .help("Current account equity")
            .register(registry);

        this.haltCounter = Counter.build()
            .name("zonetrader_instrument_halts_total")
            .help("Total number of instruments halted by errors")
            .labelNames("instrument", "error")
            .register(registry);

        log.info("[PrometheusBacktestMetrics] Initialized");
    }

    @Override
    public void recordSignal(String instrument, Direction direction) {
        signalCounter.labels(instrument, direction.name()).inc();
    }

    @Override
    public void recordDrop(String instrument, DropKind kind) {
        dropCounter.labels(instrument, kind.name()).inc();
    }

    @Override
    public void recordTradeClosed(String instrument, ExitReason reason, BigDecimal pnl) {
        tradeCounter.labels(instrument, reason.name()).inc();
        tradePnl.labels(instrument).observe(pnl.doubleValue());
    }

    @Override
    public void recordEquity(BigDecimal value) {
        equity.set(value.doubleValue());
    }

    @Override
    public void recordHalt(String instrument, String errorType) {
        haltCounter.labels(instrument, errorType).inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
