package in.zonetrader.service.backtest;

import in.zonetrader.config.BacktestConfig;
import in.zonetrader.config.EngineConfig;
import in.zonetrader.config.ManagementConfig;
import in.zonetrader.config.RiskConfig;
import in.zonetrader.config.SessionConfig;
import in.zonetrader.config.SessionWindow;
import in.zonetrader.domain.backtest.BacktestSummary;
import in.zonetrader.domain.backtest.DropKind;
import in.zonetrader.domain.backtest.InstrumentReport;
import in.zonetrader.domain.data.Candle;
import in.zonetrader.domain.data.InstrumentClass;
import in.zonetrader.domain.data.InstrumentMeta;
import in.zonetrader.domain.data.Resolution;
import in.zonetrader.domain.signal.Signal;
import in.zonetrader.domain.trade.ClosedTrade;
import in.zonetrader.infrastructure.metrics.BacktestMetrics;
import in.zonetrader.infrastructure.metrics.NoOpBacktestMetrics;
import in.zonetrader.service.candle.CandleAggregator;
import in.zonetrader.service.signal.TradingEmbargo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Random;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for BacktestEngine.
 *
 * Tests:
 * - Identical inputs give identical outputs
 * - Embargo oracle is consulted per prospective signal and blocks entries
 * - Out-of-order data and load failures halt only the affected instrument
 * - Daily loss limit drops signals before they are counted or published
 * - Unresolved and anomalous unit values
 * - Session gate
 * - Listener failures do not stop the replay
 * - Configuration and instrument validation
 */
@ExtendWith(MockitoExtension.class)
class BacktestEngineTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final int BARS = 1500;

    private static final InstrumentMeta EURUSD = new InstrumentMeta("EURUSD", InstrumentClass.CURRENCY_PAIR,
        new BigDecimal("0.0001"), new BigDecimal("10"), new BigDecimal("0.01"), BigDecimal.ZERO);
    private static final InstrumentMeta GBPUSD = new InstrumentMeta("GBPUSD", InstrumentClass.CURRENCY_PAIR,
        new BigDecimal("0.0001"), new BigDecimal("10"), new BigDecimal("0.01"), BigDecimal.ZERO);

    @Mock
    private BacktestMetrics metrics;

    @Test
    @DisplayName("Two runs over the same data produce the same trades, curve and reports")
    void testReplayIsDeterministic() {
        CandleSource source = syntheticSource();
        BacktestEngine engine = new BacktestEngine(config(), source, TradingEmbargo.ALWAYS_PERMITTED,
            NoOpBacktestMetrics.INSTANCE);

        BacktestSummary first = engine.run();
        BacktestSummary second = engine.run();

        assertFalse(first.trades().isEmpty(), "Fixture must produce trades");
        assertEquals(first.trades(), second.trades());
        assertEquals(first.equityCurve(), second.equityCurve());
        assertEquals(first.instruments(), second.instruments());
        assertEquals(0, first.finalBalance().compareTo(second.finalBalance()));

        // A fresh engine over a fresh source gives the same result again
        BacktestSummary third = new BacktestEngine(config(), syntheticSource(), TradingEmbargo.ALWAYS_PERMITTED,
            NoOpBacktestMetrics.INSTANCE).run();
        assertEquals(first.trades(), third.trades());
    }

    @Test
    void testReportsCoverEveryInstrument() {
        BacktestSummary summary = new BacktestEngine(config(), syntheticSource(), TradingEmbargo.ALWAYS_PERMITTED,
            NoOpBacktestMetrics.INSTANCE).run();

        assertEquals(2, summary.instruments().size());
        for (InstrumentReport report : summary.instruments().values()) {
            assertFalse(report.halted(), report.instrument() + " should not halt");
            assertEquals(BARS, report.barsProcessed());
            assertTrue(report.trades() <= report.signals());
        }
        // Equity curve has one point per distinct bar time
        assertEquals(BARS, summary.equityCurve().size());
        BigDecimal pnl = summary.trades().stream().map(ClosedTrade::pnl).reduce(BigDecimal.ZERO, BigDecimal::add);
        assertEquals(0, summary.netProfit().compareTo(pnl), "Net profit is the sum of realized trades");
    }

    @Test
    void testEmbargoBlocksEveryEntry() {
        AtomicInteger consulted = new AtomicInteger();
        TradingEmbargo closed = (instrument, time) -> {
            consulted.incrementAndGet();
            return false;
        };
        List<Signal> signals = new ArrayList<>();
        BacktestEngine engine = new BacktestEngine(config(), syntheticSource(), closed, NoOpBacktestMetrics.INSTANCE);
        engine.addListener(new TradeListener() {
            @Override
            public void onSignal(Signal signal) {
                signals.add(signal);
            }

            @Override
            public void onTradeClosed(ClosedTrade trade) {
                fail("No trade can open under a permanent embargo");
            }
        });

        BacktestSummary summary = engine.run();

        assertTrue(summary.trades().isEmpty());
        int embargoed = summary.instruments().values().stream().mapToInt(r -> r.dropCount(DropKind.EMBARGO)).sum();
        int signalCount = summary.instruments().values().stream().mapToInt(InstrumentReport::signals).sum();
        assertTrue(signalCount > 0, "Fixture must produce signals");
        assertEquals(signals.size(), signalCount);
        assertEquals(consulted.get(), embargoed, "Oracle consulted once per prospective signal");
        assertEquals(signalCount, embargoed);
        assertEquals(0, summary.finalBalance().compareTo(BacktestConfig.defaults().initialBalance()));
    }

    @Test
    @DisplayName("Out-of-order bar halts that instrument only")
    void testOutOfOrderHaltsOneInstrument() {
        CandleSource clean = syntheticSource();
        CandleSource corrupted = (instrument, resolution) -> {
            if (resolution != Resolution.M15) {
                // Coarser bars stay clean so the fault surfaces mid-replay
                return CandleAggregator.resample(clean.load(instrument, Resolution.M15), resolution);
            }
            List<Candle> bars = new ArrayList<>(clean.load(instrument, resolution));
            if (instrument.equals("EURUSD")) {
                Candle duplicate = bars.get(199);
                Candle bad = bars.get(200);
                bars.set(200, new Candle(bad.instrument(), bad.resolution(), duplicate.timestamp(),
                    bad.open(), bad.high(), bad.low(), bad.close(), bad.volume()));
            }
            return bars;
        };

        BacktestSummary summary = new BacktestEngine(config(), corrupted, TradingEmbargo.ALWAYS_PERMITTED, metrics).run();

        InstrumentReport eurusd = summary.instruments().get("EURUSD");
        InstrumentReport gbpusd = summary.instruments().get("GBPUSD");
        assertTrue(eurusd.halted());
        assertNotNull(eurusd.haltReason());
        assertTrue(eurusd.haltReason().startsWith("OutOfOrderDataException"), eurusd.haltReason());
        assertEquals(200, eurusd.barsProcessed());
        assertFalse(gbpusd.halted());
        assertEquals(BARS, gbpusd.barsProcessed());
        assertTrue(summary.trades().stream()
            .noneMatch(t -> t.instrument().equals("EURUSD") && t.closeTime().isAfter(START.plusSeconds(900L * 199))));

        verify(metrics).recordHalt(eq("EURUSD"), eq("OutOfOrderDataException"));
        verify(metrics, atLeastOnce()).recordEquity(any());
    }

    @Test
    @DisplayName("A source that cannot load an instrument halts that instrument only")
    void testLoadFailureHaltsOneInstrument() {
        CandleSource clean = syntheticSource();
        CandleSource failing = (instrument, resolution) -> {
            if (instrument.equals("EURUSD") && resolution == Resolution.M15) {
                throw new IllegalArgumentException("EURUSD_M15.csv:42 malformed row");
            }
            return clean.load(instrument, resolution);
        };

        BacktestSummary summary = new BacktestEngine(config(), failing, TradingEmbargo.ALWAYS_PERMITTED, metrics).run();

        InstrumentReport eurusd = summary.instruments().get("EURUSD");
        assertTrue(eurusd.halted());
        assertEquals(0, eurusd.barsProcessed());
        assertTrue(eurusd.haltReason().startsWith("IllegalArgumentException"), eurusd.haltReason());
        assertTrue(eurusd.haltReason().contains("EURUSD_M15.csv:42"), eurusd.haltReason());

        InstrumentReport gbpusd = summary.instruments().get("GBPUSD");
        assertFalse(gbpusd.halted());
        assertEquals(BARS, gbpusd.barsProcessed());
        assertTrue(summary.trades().stream().noneMatch(t -> t.instrument().equals("EURUSD")));

        verify(metrics).recordHalt("EURUSD", "IllegalArgumentException");
        verify(metrics, never()).recordHalt(eq("GBPUSD"), any());
    }

    @Test
    void testCoarserLoadFailureHaltsOneInstrument() {
        CandleSource clean = syntheticSource();
        CandleSource failing = (instrument, resolution) -> {
            if (instrument.equals("GBPUSD") && resolution == Resolution.H4) {
                throw new UncheckedIOException(new IOException("GBPUSD_H4.csv: permission denied"));
            }
            return clean.load(instrument, resolution);
        };

        BacktestSummary summary = new BacktestEngine(config(), failing, TradingEmbargo.ALWAYS_PERMITTED,
            NoOpBacktestMetrics.INSTANCE).run();

        assertTrue(summary.instruments().get("GBPUSD").halted());
        assertTrue(summary.instruments().get("GBPUSD").haltReason().startsWith("UncheckedIOException"));
        assertFalse(summary.instruments().get("EURUSD").halted());
        assertEquals(BARS, summary.instruments().get("EURUSD").barsProcessed());
    }

    @Test
    @DisplayName("Signals past the daily loss limit are dropped before they are counted or published")
    void testDailyLossLimitDropsBeforeSignalIsCounted() {
        BigDecimal fraction = new BigDecimal("0.000001");
        EngineConfig config = config(risk(fraction), EURUSD, GBPUSD);
        BigDecimal initial = config.backtest().initialBalance();

        // Mirrors the account's UTC-day accumulator from the trades as they are realized
        TreeMap<LocalDate, BigDecimal> realizedByDay = new TreeMap<>();
        List<Signal> published = new ArrayList<>();
        List<String> lateSignals = new ArrayList<>();
        BacktestEngine engine = new BacktestEngine(config, syntheticSource(), TradingEmbargo.ALWAYS_PERMITTED, metrics);
        engine.addListener(new TradeListener() {
            @Override
            public void onSignal(Signal signal) {
                LocalDate day = LocalDate.ofInstant(signal.barTime(), ZoneOffset.UTC);
                BigDecimal opening = realizedByDay.headMap(day).values().stream()
                    .reduce(initial, BigDecimal::add);
                BigDecimal realized = realizedByDay.getOrDefault(day, BigDecimal.ZERO);
                if (realized.negate().compareTo(opening.multiply(fraction)) >= 0) {
                    lateSignals.add(signal.instrument() + " @ " + signal.barTime());
                }
                published.add(signal);
            }

            @Override
            public void onTradeClosed(ClosedTrade trade) {
                realizedByDay.merge(LocalDate.ofInstant(trade.closeTime(), ZoneOffset.UTC), trade.pnl(),
                    BigDecimal::add);
            }
        });

        BacktestSummary summary = engine.run();

        int signalCount = summary.instruments().values().stream().mapToInt(InstrumentReport::signals).sum();
        int suppressed = summary.instruments().values().stream()
            .mapToInt(r -> r.dropCount(DropKind.DAILY_LOSS_LIMIT)).sum();
        assertTrue(lateSignals.isEmpty(), "Published after the limit was hit: " + lateSignals);
        assertTrue(signalCount > 0);
        assertTrue(suppressed > 0, "A losing day must suppress at least one later signal");
        assertEquals(published.size(), signalCount);
        verify(metrics, times(signalCount)).recordSignal(any(), any());
        verify(metrics, times(suppressed)).recordDrop(any(), eq(DropKind.DAILY_LOSS_LIMIT));
    }

    @Test
    @DisplayName("Unresolved unit value drops every signal and opens nothing")
    void testUnresolvedUnitValueOpensNothing() {
        BacktestSummary summary = new BacktestEngine(
            config(EngineConfig.defaults().risk(), unitValue(EURUSD, null), unitValue(GBPUSD, null)),
            syntheticSource(), TradingEmbargo.ALWAYS_PERMITTED, NoOpBacktestMetrics.INSTANCE).run();

        int signalCount = summary.instruments().values().stream().mapToInt(InstrumentReport::signals).sum();
        int unresolved = summary.instruments().values().stream()
            .mapToInt(r -> r.dropCount(DropKind.RISK_UNRESOLVED_UNIT_VALUE)).sum();
        assertTrue(signalCount > 0);
        assertEquals(signalCount, unresolved);
        assertTrue(summary.trades().isEmpty());
        assertEquals(0, summary.finalBalance().compareTo(summary.initialBalance()));
    }

    @Test
    @DisplayName("Anomalous size opens at the minimum increment and is counted")
    void testAnomalousSizeOpensAtMinimumIncrement() {
        BigDecimal tiny = new BigDecimal("0.0001");
        BacktestSummary summary = new BacktestEngine(
            config(EngineConfig.defaults().risk(), unitValue(EURUSD, tiny), unitValue(GBPUSD, tiny)),
            syntheticSource(), TradingEmbargo.ALWAYS_PERMITTED, NoOpBacktestMetrics.INSTANCE).run();

        assertFalse(summary.trades().isEmpty());
        for (ClosedTrade trade : summary.trades()) {
            assertEquals(0, EURUSD.minIncrement().compareTo(trade.size()), trade.toString());
        }
        int anomalies = summary.instruments().values().stream()
            .mapToInt(r -> r.dropCount(DropKind.ANOMALY_SIZE)).sum();
        int positions = summary.instruments().values().stream().mapToInt(InstrumentReport::trades).sum();
        assertEquals(positions, anomalies, "Every position opened was an anomaly");
    }

    @Test
    void testSessionGateScoresOnlyInsideWindows() {
        SessionConfig london = new SessionConfig(true,
            List.of(new SessionWindow("London", LocalTime.of(7, 0), LocalTime.of(16, 0))),
            EnumSet.of(InstrumentClass.DIGITAL_ASSET));
        EngineConfig defaults = config();
        EngineConfig gated = new EngineConfig(defaults.structure(), defaults.zones(), defaults.scoring(),
            defaults.risk(), defaults.management(), defaults.backtest(), defaults.embargo(), london,
            defaults.instruments(), defaults.events());
        List<Signal> signals = new ArrayList<>();
        BacktestEngine engine = new BacktestEngine(gated, syntheticSource(), TradingEmbargo.ALWAYS_PERMITTED,
            NoOpBacktestMetrics.INSTANCE);
        engine.addListener(new TradeListener() {
            @Override
            public void onSignal(Signal signal) {
                signals.add(signal);
            }

            @Override
            public void onTradeClosed(ClosedTrade trade) {}
        });

        engine.run();

        assertFalse(signals.isEmpty());
        for (Signal signal : signals) {
            LocalTime time = LocalTime.ofInstant(signal.barTime(), ZoneOffset.UTC);
            assertFalse(time.isBefore(LocalTime.of(7, 0)), signal.toString());
            assertTrue(time.isBefore(LocalTime.of(16, 0)), signal.toString());
        }
    }

    @Test
    void testFailingListenerDoesNotStopReplay() {
        BacktestEngine engine = new BacktestEngine(config(), syntheticSource(), TradingEmbargo.ALWAYS_PERMITTED,
            NoOpBacktestMetrics.INSTANCE);
        AtomicInteger calls = new AtomicInteger();
        engine.addListener(new TradeListener() {
            @Override
            public void onSignal(Signal signal) {
                calls.incrementAndGet();
                throw new IllegalStateException("listener down");
            }

            @Override
            public void onTradeClosed(ClosedTrade trade) {
                throw new IllegalStateException("listener down");
            }
        });

        BacktestSummary summary = assertDoesNotThrow(() -> engine.run());

        int signalCount = summary.instruments().values().stream().mapToInt(InstrumentReport::signals).sum();
        assertEquals(signalCount, calls.get());
        summary.instruments().values().forEach(r -> assertEquals(BARS, r.barsProcessed()));
    }

    @Test
    void testUnknownInstrumentRejected() {
        BacktestEngine engine = new BacktestEngine(config(), syntheticSource(), TradingEmbargo.ALWAYS_PERMITTED,
            NoOpBacktestMetrics.INSTANCE);

        assertThrows(IllegalArgumentException.class, () -> engine.run(List.of("EURUSD", "USDCHF")));
    }

    @Test
    void testInvalidConfigurationRejected() {
        EngineConfig defaults = config();
        ManagementConfig broken = new ManagementConfig(
            true, BigDecimal.ZERO, BigDecimal.ONE,
            false, BigDecimal.ZERO, BigDecimal.ZERO,
            false, BigDecimal.ZERO, BigDecimal.ZERO);
        EngineConfig invalid = new EngineConfig(defaults.structure(), defaults.zones(), defaults.scoring(),
            defaults.risk(), broken, defaults.backtest(), defaults.embargo(), defaults.sessions(),
            defaults.instruments(), defaults.events());

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> new BacktestEngine(invalid, syntheticSource(), TradingEmbargo.ALWAYS_PERMITTED,
                NoOpBacktestMetrics.INSTANCE));
        assertTrue(e.getMessage().contains("management"));
    }

    @Test
    void testEmptySourceProducesEmptyRun() {
        BacktestSummary summary = new BacktestEngine(config(), (instrument, resolution) -> List.of(),
            TradingEmbargo.ALWAYS_PERMITTED, NoOpBacktestMetrics.INSTANCE).run();

        assertEquals(0, summary.totalTrades());
        assertTrue(summary.equityCurve().isEmpty());
        assertEquals(0, summary.netProfit().signum());
        assertEquals(0, summary.instruments().get("EURUSD").barsProcessed());
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Fixtures
    // ═══════════════════════════════════════════════════════════════════════

    private static EngineConfig config() {
        return config(EngineConfig.defaults().risk(), EURUSD, GBPUSD);
    }

    private static EngineConfig config(RiskConfig risk, InstrumentMeta... instruments) {
        EngineConfig defaults = EngineConfig.defaults();
        return new EngineConfig(defaults.structure(), defaults.zones(), defaults.scoring(), risk,
            defaults.management(), defaults.backtest(), defaults.embargo(), defaults.sessions(),
            List.of(instruments), List.of());
    }

    /**
     * Default sizing with the given daily loss limit and no trade-count or cooldown limits.
     */
    private static RiskConfig risk(BigDecimal dailyLossLimitFraction) {
        RiskConfig d = RiskConfig.defaults();
        return new RiskConfig(d.riskFraction(), d.globalMaxSize(), d.classMaxSize(), d.sanityMultiple(),
            dailyLossLimitFraction, 0, 0, 0, 0, 0, 0);
    }

    private static InstrumentMeta unitValue(InstrumentMeta meta, BigDecimal unitValue) {
        return new InstrumentMeta(meta.symbol(), meta.instrumentClass(), meta.priceUnit(), unitValue,
            meta.minIncrement(), meta.spread());
    }

    /**
     * Seeded random walk with alternating drift legs, M15 bars; coarser resolutions are
     * left to the engine to resample.
     */
    private static CandleSource syntheticSource() {
        List<Candle> eurusd = walk("EURUSD", 11L, "1.10000");
        List<Candle> gbpusd = walk("GBPUSD", 29L, "1.27000");
        return (instrument, resolution) -> {
            if (resolution != Resolution.M15) {
                return List.of();
            }
            return switch (instrument) {
                case "EURUSD" -> eurusd;
                case "GBPUSD" -> gbpusd;
                default -> List.of();
            };
        };
    }

    private static List<Candle> walk(String instrument, long seed, String startPrice) {
        Random random = new Random(seed);
        List<Candle> bars = new ArrayList<>(BARS);
        BigDecimal close = new BigDecimal(startPrice);
        for (int i = 0; i < BARS; i++) {
            // 120-bar legs alternate up and down
            double drift = ((i / 120) % 2 == 0) ? 0.00012 : -0.00012;
            BigDecimal open = close;
            BigDecimal move = BigDecimal.valueOf(drift + (random.nextDouble() - 0.5) * 0.0008);
            close = open.add(move).setScale(5, RoundingMode.HALF_UP);
            BigDecimal high = open.max(close).add(BigDecimal.valueOf(random.nextDouble() * 0.0004))
                .setScale(5, RoundingMode.HALF_UP);
            BigDecimal low = open.min(close).subtract(BigDecimal.valueOf(random.nextDouble() * 0.0004))
                .setScale(5, RoundingMode.HALF_UP);
            bars.add(new Candle(instrument, Resolution.M15, START.plusSeconds(900L * i), open, high, low, close,
                100 + random.nextInt(50)));
        }
        return List.copyOf(bars);
    }
}
