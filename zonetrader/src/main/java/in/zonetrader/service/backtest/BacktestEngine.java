package in.zonetrader.service.backtest;

import in.zonetrader.config.EngineConfig;
import in.zonetrader.domain.backtest.BacktestSummary;
import in.zonetrader.domain.backtest.DropKind;
import in.zonetrader.domain.backtest.EquityPoint;
import in.zonetrader.domain.backtest.InstrumentReport;
import in.zonetrader.domain.data.Candle;
import in.zonetrader.domain.data.InstrumentMeta;
import in.zonetrader.domain.data.Resolution;
import in.zonetrader.domain.signal.Signal;
import in.zonetrader.domain.trade.ClosedTrade;
import in.zonetrader.domain.trade.ExitReason;
import in.zonetrader.domain.trade.Position;
import in.zonetrader.infrastructure.metrics.BacktestMetrics;
import in.zonetrader.service.candle.CandleAggregator;
import in.zonetrader.service.candle.CandleStore;
import in.zonetrader.service.candle.OutOfOrderDataException;
import in.zonetrader.service.risk.AccountState;
import in.zonetrader.service.risk.PositionSizer;
import in.zonetrader.service.risk.RiskException;
import in.zonetrader.service.signal.ConfluenceScorer;
import in.zonetrader.service.signal.MultiResolutionSnapshot;
import in.zonetrader.service.signal.SessionFilter;
import in.zonetrader.service.signal.TradingEmbargo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Backtest Engine - Deterministic bar-by-bar replay across instruments.
 *
 * Bars of all instruments are merged in global chronological order (ties by instrument symbol).
 * Per execution bar:
 * 1. Refresh coarser structure with bars closed by this bar, then execution structure and zones
 * 2. POSITION_OPEN: exit checks, then management (see {@link TradeManager})
 * 3. IDLE: inside a trading session, score. A signal on a day past the daily loss limit is
 *    dropped before it counts. Otherwise it is counted and published, checked against the embargo
 *    oracle, then sized and opened through the account in one atomic step
 *
 * A data or detector error halts only the affected instrument, including a failure to load its
 * bars. The latest execution bar in the candle store is the instrument's mark. Positions still
 * open at the end are closed at the instrument's last close (END_OF_DATA).
 *
 * One engine may run many times; every run starts from fresh state.
 */
public final class BacktestEngine {
    private static final Logger log = LoggerFactory.getLogger(BacktestEngine.class);

    private final EngineConfig config;
    private final Resolution execution;
    private final Map<String, InstrumentMeta> instruments;
    private final CandleSource source;
    private final TradingEmbargo embargo;
    private final BacktestMetrics metrics;
    private final List<TradeListener> listeners = new ArrayList<>();

    public BacktestEngine(EngineConfig config, CandleSource source, TradingEmbargo embargo, BacktestMetrics metrics) {
        List<String> errors = config.validate();
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Invalid configuration sections: " + errors);
        }
        this.config = config;
        this.execution = config.backtest().executionResolution();
        this.instruments = config.instrumentsBySymbol();
        this.source = source;
        this.embargo = embargo;
        this.metrics = metrics;
    }

    public void addListener(TradeListener listener) {
        listeners.add(listener);
    }

    /**
     * Replay every configured instrument.
     */
    public BacktestSummary run() {
        return run(instruments.keySet());
    }

    /**
     * Replay the given instruments.
     *
     * @throws IllegalArgumentException if an instrument has no metadata
     */
    public BacktestSummary run(Collection<String> symbols) {
        Run run = new Run();

        PriorityQueue<Cursor> queue = new PriorityQueue<>(
            Comparator.comparing(Cursor::timestamp).thenComparing(Cursor::symbol));

        for (String symbol : new TreeSet<>(symbols)) {
            InstrumentMeta meta = instruments.get(symbol);
            if (meta == null) {
                throw new IllegalArgumentException("No instrument metadata for " + symbol);
            }
            List<Candle> executionBars = List.of();
            InstrumentPipeline pipeline;
            try {
                executionBars = source.load(symbol, execution);
                List<Candle> intermediate = loadOrResample(symbol, config.backtest().intermediateResolution(), executionBars);
                List<Candle> macro = loadOrResample(symbol, config.backtest().macroResolution(), executionBars);
                pipeline = new InstrumentPipeline(symbol, meta, config, run.store, intermediate, macro);
            } catch (RuntimeException e) {
                // Unreadable or inconsistent input: this instrument does not run
                pipeline = new InstrumentPipeline(symbol, meta, config, run.store, List.of(), List.of());
                halt(run, pipeline, e, null);
            }
            run.pipelines.put(symbol, pipeline);
            if (!executionBars.isEmpty() && pipeline.state() != PipelineState.HALTED) {
                queue.add(new Cursor(symbol, executionBars, 0));
            }
            log.info("[REPLAY] {} loaded {} {} bars", symbol, executionBars.size(), execution);
        }

        Instant currentTime = null;
        while (!queue.isEmpty()) {
            Cursor cursor = queue.poll();
            Candle bar = cursor.bar();

            if (currentTime != null && !bar.timestamp().equals(currentTime)) {
                recordEquity(run, currentTime);
            }
            currentTime = bar.timestamp();

            InstrumentPipeline pipeline = run.pipelines.get(cursor.symbol());
            processBar(run, pipeline, bar);

            if (cursor.index() + 1 < cursor.bars().size() && pipeline.state() != PipelineState.HALTED) {
                queue.add(new Cursor(cursor.symbol(), cursor.bars(), cursor.index() + 1));
            }
        }

        // Close what is still open at each instrument's last close
        for (InstrumentPipeline pipeline : run.pipelines.values()) {
            if (run.account.hasOpenPosition(pipeline.instrument())) {
                String symbol = pipeline.instrument();
                Candle last = run.store.getLatest(symbol, execution);
                ClosedTrade trade = run.account.close(symbol, last.close(), last.timestamp(),
                    ExitReason.END_OF_DATA, pipeline.meta());
                onClosed(run, pipeline, trade);
                pipeline.setState(PipelineState.IDLE);
            }
        }
        if (currentTime != null) {
            recordEquity(run, currentTime);
        }

        Map<String, InstrumentReport> reports = new TreeMap<>();
        run.pipelines.forEach((symbol, pipeline) -> reports.put(symbol, pipeline.report()));

        BacktestSummary summary = PerformanceCalculator.summarize(
            config.backtest().initialBalance(),
            run.account.getBalance(),
            run.trades,
            run.equityCurve,
            config.backtest().periodsPerYear(),
            reports);
        log.info("[REPLAY] Completed: {}", summary.getSummary());
        return summary;
    }

    private void processBar(Run run, InstrumentPipeline pipeline, Candle bar) {
        if (pipeline.state() == PipelineState.HALTED) {
            return;
        }
        String symbol = pipeline.instrument();

        MultiResolutionSnapshot snapshot;
        try {
            snapshot = pipeline.advance(bar);
        } catch (OutOfOrderDataException e) {
            halt(run, pipeline, e, bar.timestamp());
            return;
        } catch (RuntimeException e) {
            // Detector failure: abort this instrument only
            halt(run, pipeline, e, bar.timestamp());
            return;
        }

        if (pipeline.state() == PipelineState.POSITION_OPEN) {
            Position position = run.account.getPosition(symbol);
            for (ClosedTrade trade : run.tradeManager.onBar(position, bar, pipeline.meta())) {
                onClosed(run, pipeline, trade);
            }
            if (!run.account.hasOpenPosition(symbol)) {
                pipeline.setState(PipelineState.IDLE);
            }
            return;
        }

        if (!run.sessions.isOpen(pipeline.meta().instrumentClass(), bar.timestamp())) {
            return;
        }

        Optional<Signal> candidate = run.scorer.evaluate(symbol, snapshot);
        if (candidate.isEmpty()) {
            return;
        }
        Signal signal = candidate.get();

        if (run.account.isSuppressed(bar.timestamp())) {
            drop(pipeline, DropKind.DAILY_LOSS_LIMIT);
            log.info("[REPLAY] {} signal suppressed by daily loss limit @ {}", symbol, bar.timestamp());
            return;
        }

        pipeline.setState(PipelineState.SIGNAL_PENDING);
        pipeline.recordSignal();
        metrics.recordSignal(symbol, signal.direction());
        notifySignal(signal);

        if (!embargo.isTradingPermitted(symbol, bar.timestamp())) {
            drop(pipeline, DropKind.EMBARGO);
            log.info("[REPLAY] {} signal embargoed @ {}", symbol, bar.timestamp());
            return;
        }

        try {
            Position position = run.account.open(signal, pipeline.meta(), run.sizer, bar.timestamp());
            if (position.getOrderSize().anomaly()) {
                pipeline.recordDrop(DropKind.ANOMALY_SIZE);
                metrics.recordDrop(symbol, DropKind.ANOMALY_SIZE);
            }
            pipeline.setState(PipelineState.POSITION_OPEN);
        } catch (RiskException e) {
            log.warn("[RISK] Signal dropped: {}", e.getMessage());
            drop(pipeline, dropKind(e.getKind()));
        }
    }

    private void drop(InstrumentPipeline pipeline, DropKind kind) {
        pipeline.recordDrop(kind);
        metrics.recordDrop(pipeline.instrument(), kind);
        pipeline.setState(PipelineState.IDLE);
    }

    private void halt(Run run, InstrumentPipeline pipeline, RuntimeException error, Instant at) {
        String symbol = pipeline.instrument();
        log.error("[REPLAY] {} halted: {}", symbol, error.getMessage(), error);
        metrics.recordHalt(symbol, error.getClass().getSimpleName());

        if (run.account.hasOpenPosition(symbol)) {
            Position position = run.account.getPosition(symbol);
            Candle last = run.store.getLatest(symbol, execution);
            BigDecimal mark = last != null ? last.close() : position.getEntry();
            Instant closeAt = last != null ? last.timestamp() : (at != null ? at : position.getOpenedAt());
            onClosed(run, pipeline, run.account.close(symbol, mark, closeAt, ExitReason.DATA_HALT, pipeline.meta()));
        }
        pipeline.halt(error.getClass().getSimpleName() + ": " + error.getMessage());
    }

    private void onClosed(Run run, InstrumentPipeline pipeline, ClosedTrade trade) {
        run.trades.add(trade);
        pipeline.recordTrade(trade.pnl(), trade.exitReason() != ExitReason.PARTIAL);
        metrics.recordTradeClosed(trade.instrument(), trade.exitReason(), trade.pnl());
        for (TradeListener listener : listeners) {
            try {
                listener.onTradeClosed(trade);
            } catch (RuntimeException e) {
                log.error("[REPLAY] Trade listener failed for {}: {}", trade.instrument(), e.getMessage(), e);
            }
        }
    }

    private void notifySignal(Signal signal) {
        for (TradeListener listener : listeners) {
            try {
                listener.onSignal(signal);
            } catch (RuntimeException e) {
                log.error("[REPLAY] Signal listener failed for {}: {}", signal.instrument(), e.getMessage(), e);
            }
        }
    }

    private void recordEquity(Run run, Instant at) {
        BigDecimal equity = run.account.equity(marks(run), instruments);
        run.equityCurve.add(new EquityPoint(at, run.account.getBalance(), equity));
        metrics.recordEquity(equity);
    }

    private Map<String, BigDecimal> marks(Run run) {
        Map<String, BigDecimal> marks = new HashMap<>();
        for (String symbol : run.pipelines.keySet()) {
            Candle latest = run.store.getLatest(symbol, execution);
            if (latest != null) {
                marks.put(symbol, latest.close());
            }
        }
        return marks;
    }

    private List<Candle> loadOrResample(String symbol, Resolution resolution, List<Candle> executionBars) {
        List<Candle> bars = source.load(symbol, resolution);
        if (!bars.isEmpty()) {
            return bars;
        }
        log.debug("[REPLAY] {} has no {} bars; resampling from execution bars", symbol, resolution);
        return CandleAggregator.resample(executionBars, resolution);
    }

    private static DropKind dropKind(RiskException.Kind kind) {
        return switch (kind) {
            case NON_POSITIVE_STOP -> DropKind.RISK_NON_POSITIVE_STOP;
            case UNRESOLVED_UNIT_VALUE -> DropKind.RISK_UNRESOLVED_UNIT_VALUE;
            case BELOW_MINIMUM_SIZE -> DropKind.RISK_BELOW_MINIMUM_SIZE;
            case MAX_OPEN_POSITIONS -> DropKind.MAX_OPEN_POSITIONS;
            case DAILY_TRADE_LIMIT -> DropKind.DAILY_TRADE_LIMIT;
            case COOLDOWN -> DropKind.COOLDOWN;
            case LOSS_STREAK_PAUSE -> DropKind.LOSS_STREAK_PAUSE;
        };
    }

    /**
     * Mutable state of one run.
     */
    private final class Run {
        final CandleStore store = new CandleStore();
        final AccountState account = new AccountState(config.backtest().initialBalance(), config.risk());
        final PositionSizer sizer = new PositionSizer(config.risk());
        final TradeManager tradeManager = new TradeManager(config.management(), account);
        final ConfluenceScorer scorer = new ConfluenceScorer(config.scoring(), config.zones(), account);
        final SessionFilter sessions = new SessionFilter(config.sessions());
        final Map<String, InstrumentPipeline> pipelines = new TreeMap<>();
        final List<ClosedTrade> trades = new ArrayList<>();
        final List<EquityPoint> equityCurve = new ArrayList<>();
    }

    private record Cursor(String symbol, List<Candle> bars, int index) {
        Candle bar() {
            return bars.get(index);
        }

        Instant timestamp() {
            return bar().timestamp();
        }
    }
}
