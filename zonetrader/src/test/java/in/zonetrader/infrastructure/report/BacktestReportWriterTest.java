package in.zonetrader.infrastructure.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.zonetrader.domain.backtest.BacktestSummary;
import in.zonetrader.domain.backtest.DropKind;
import in.zonetrader.domain.backtest.EquityPoint;
import in.zonetrader.domain.backtest.InstrumentReport;
import in.zonetrader.domain.data.Direction;
import in.zonetrader.domain.trade.ClosedTrade;
import in.zonetrader.domain.trade.ExitReason;
import in.zonetrader.service.backtest.PerformanceCalculator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BacktestReportWriterTest {

    private static final Instant OPENED = Instant.parse("2024-03-04T10:00:00Z");
    private static final Instant CLOSED = Instant.parse("2024-03-04T14:15:00Z");

    @TempDir
    Path tempDir;

    @Test
    void testWritesJsonReport() throws Exception {
        Path file = tempDir.resolve("reports/run.json");

        new BacktestReportWriter().write(summary(), file);

        assertTrue(Files.exists(file), "Parent directories are created");
        JsonNode root = new ObjectMapper().readTree(Files.readString(file));
        assertEquals(1, root.get("totalTrades").asInt());
        assertEquals(0, new BigDecimal("200").compareTo(root.get("netProfit").decimalValue()));
        assertEquals(1, root.get("positions").asInt());
        assertEquals(0, new BigDecimal("100").compareTo(root.get("positionWinRate").decimalValue()));

        JsonNode trade = root.get("trades").get(0);
        assertEquals("EURUSD", trade.get("instrument").asText());
        assertEquals("TARGET", trade.get("exitReason").asText());
        assertEquals("2024-03-04T14:15:00Z", trade.get("closeTime").asText(), "Timestamps are ISO-8601");

        JsonNode eurusd = root.get("instruments").get("EURUSD");
        assertFalse(eurusd.get("halted").asBoolean());
        assertEquals(1, eurusd.get("drops").get("EMBARGO").asInt());
    }

    @Test
    void testUndefinedRatiosSerializeAsNull() throws Exception {
        String json = new BacktestReportWriter().toJson(summary());

        JsonNode root = new ObjectMapper().readTree(json);
        assertTrue(root.get("profitFactor").isNull(), "No losing trades: profit factor is null");
    }

    private static BacktestSummary summary() {
        ClosedTrade trade = new ClosedTrade("EURUSD", Direction.LONG, new BigDecimal("1.2500"),
            new BigDecimal("1.2600"), new BigDecimal("0.20"), new BigDecimal("200"), OPENED, CLOSED, ExitReason.TARGET);
        InstrumentReport report = new InstrumentReport("EURUSD", false, null, 420, 2, 1, new BigDecimal("200"),
            Map.of(DropKind.EMBARGO, 1));
        return PerformanceCalculator.summarize(new BigDecimal("10000"), new BigDecimal("10200"), List.of(trade),
            List.of(new EquityPoint(CLOSED, new BigDecimal("10200"), new BigDecimal("10200"))), 252,
            Map.of("EURUSD", report));
    }
}
