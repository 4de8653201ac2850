package in.zonetrader.bootstrap;

import in.zonetrader.config.BacktestConfig;
import in.zonetrader.config.ConfigLoader;
import in.zonetrader.config.EngineConfig;
import in.zonetrader.domain.backtest.BacktestSummary;
import in.zonetrader.domain.backtest.InstrumentReport;
import in.zonetrader.infrastructure.data.CsvCandleSource;
import in.zonetrader.infrastructure.metrics.PrometheusBacktestMetrics;
import in.zonetrader.infrastructure.report.BacktestReportWriter;
import in.zonetrader.service.backtest.BacktestEngine;
import in.zonetrader.service.signal.CalendarTradingEmbargo;
import in.zonetrader.service.signal.EmbargoPolicy;
import in.zonetrader.util.Env;
import io.prometheus.client.exporter.common.TextFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line entry point for a backtest run.
 *
 * Environment:
 * - CONFIG_PATH: engine configuration JSON (default ./config/zonetrader.json)
 * - DATA_DIR: directory of {INSTRUMENT}_{RESOLUTION}.csv files (default ./data)
 * - REPORT_PATH: summary JSON output (default ./reports/backtest.json); the effective
 *   configuration is written next to it as {report}-config.json
 * - METRICS_PATH: optional Prometheus text dump of run metrics
 * - INSTRUMENTS: optional comma-separated subset of configured instruments
 * - INITIAL_BALANCE: optional override of backtest.initialBalance
 *
 * Exit status is non-zero when configuration or report IO fails.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== ZoneTrader Backtest Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        Path configPath = Path.of(Env.get("CONFIG_PATH", "./config/zonetrader.json"));
        Path dataDir = Path.of(Env.get("DATA_DIR", "./data"));
        Path reportPath = Path.of(Env.get("REPORT_PATH", "./reports/backtest.json"));
        String metricsPath = Env.get("METRICS_PATH", null);
        String instrumentFilter = Env.get("INSTRUMENTS", null);

        try {
            // ═══════════════════════════════════════════════════════════════
            // Configuration
            // ═══════════════════════════════════════════════════════════════
            EngineConfig config = ConfigLoader.load(configPath);
            if (config.instruments().isEmpty()) {
                log.error("No instruments configured in {}", configPath);
                System.exit(2);
                return;
            }
            config = withInitialBalance(config, Env.getDecimal("INITIAL_BALANCE", config.backtest().initialBalance()));

            // ═══════════════════════════════════════════════════════════════
            // Prometheus Metrics
            // ═══════════════════════════════════════════════════════════════
            PrometheusBacktestMetrics metrics = new PrometheusBacktestMetrics();
            log.info("✓ Prometheus metrics initialized");

            // ═══════════════════════════════════════════════════════════════
            // Event Calendar
            // ═══════════════════════════════════════════════════════════════
            CalendarTradingEmbargo embargo = new CalendarTradingEmbargo(
                config.events(), new EmbargoPolicy(config.embargo()));
            log.info("✓ Event calendar loaded: {} events", embargo.size());

            // ═══════════════════════════════════════════════════════════════
            // Replay
            // ═══════════════════════════════════════════════════════════════
            BacktestEngine engine = new BacktestEngine(config, new CsvCandleSource(dataDir), embargo, metrics);
            BacktestSummary summary = instrumentFilter == null
                ? engine.run()
                : engine.run(parseInstruments(instrumentFilter));

            logSummary(summary);

            // ═══════════════════════════════════════════════════════════════
            // Output
            // ═══════════════════════════════════════════════════════════════
            new BacktestReportWriter().write(summary, reportPath);
            ConfigLoader.save(config, configSnapshotPath(reportPath));
            if (metricsPath != null) {
                writeMetrics(metrics, Path.of(metricsPath));
            }
        } catch (IOException e) {
            log.error("Backtest failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    static EngineConfig withInitialBalance(EngineConfig config, BigDecimal initialBalance) {
        BacktestConfig backtest = config.backtest();
        if (backtest.initialBalance().compareTo(initialBalance) == 0) {
            return config;
        }
        log.info("Initial balance override: {}", initialBalance);
        return new EngineConfig(config.structure(), config.zones(), config.scoring(), config.risk(),
            config.management(),
            new BacktestConfig(initialBalance, backtest.executionResolution(), backtest.intermediateResolution(),
                backtest.macroResolution(), backtest.periodsPerYear()),
            config.embargo(), config.sessions(), config.instruments(), config.events());
    }

    /**
     * backtest.json -> backtest-config.json, in the report's directory.
     */
    static Path configSnapshotPath(Path reportPath) {
        String name = reportPath.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return reportPath.resolveSibling(stem + "-config.json");
    }

    static List<String> parseInstruments(String value) {
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    private static void logSummary(BacktestSummary summary) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("[RESULT] {}", summary.getSummary());
        log.info("[RESULT] Balance {} -> {}", summary.initialBalance(), summary.finalBalance());
        for (InstrumentReport report : summary.instruments().values()) {
            if (report.halted()) {
                log.warn("[RESULT] {} HALTED: {}", report.instrument(), report.haltReason());
            } else {
                log.info("[RESULT] {} bars={} signals={} trades={} pnl={} drops={}",
                    report.instrument(), report.barsProcessed(), report.signals(), report.trades(),
                    report.netPnl(), report.drops());
            }
        }
        log.info("═══════════════════════════════════════════════════════════════");
    }

    private static void writeMetrics(PrometheusBacktestMetrics metrics, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            TextFormat.write004(writer, metrics.getRegistry().metricFamilySamples());
        }
        log.info("Metrics written to: {}", path);
    }

    private App() {}
}
