package in.zonetrader.infrastructure.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.zonetrader.domain.backtest.BacktestSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes run summaries as pretty-printed JSON (ISO-8601 timestamps).
 */
public final class BacktestReportWriter {
    private static final Logger log = LoggerFactory.getLogger(BacktestReportWriter.class);

    private final ObjectMapper mapper;

    public BacktestReportWriter() {
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public String toJson(BacktestSummary summary) throws IOException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(summary);
    }

    public void write(BacktestSummary summary, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, toJson(summary));
        log.info("Report written to: {} ({} trades)", path, summary.totalTrades());
    }
}
