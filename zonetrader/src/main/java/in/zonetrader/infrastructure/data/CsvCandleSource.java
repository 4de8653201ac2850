package in.zonetrader.infrastructure.data;

import in.zonetrader.domain.data.Candle;
import in.zonetrader.domain.data.Resolution;
import in.zonetrader.service.backtest.CandleSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Candle source reading one CSV file per (instrument, resolution).
 *
 * File layout: {dataDir}/{INSTRUMENT}_{RESOLUTION}.csv, e.g. data/EURUSD_M15.csv
 * Columns: timestamp,open,high,low,close,volume (ISO-8601 UTC or epoch millis).
 * A header line is skipped when its first field is not a timestamp.
 *
 * Rows are returned in file order; ordering is validated downstream.
 */
public final class CsvCandleSource implements CandleSource {
    private static final Logger log = LoggerFactory.getLogger(CsvCandleSource.class);

    private final Path dataDir;

    public CsvCandleSource(Path dataDir) {
        this.dataDir = dataDir;
    }

    @Override
    public List<Candle> load(String instrument, Resolution resolution) {
        Path file = fileFor(instrument, resolution);
        if (!Files.exists(file)) {
            log.debug("No candle file {}", file);
            return List.of();
        }

        List<Candle> candles = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) {
                    continue;
                }
                String[] fields = line.split(",");
                if (lineNo == 1 && !looksLikeTimestamp(fields[0].trim())) {
                    continue;
                }
                candles.add(parse(instrument, resolution, fields, file, lineNo));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }

        log.info("Loaded {} {} bars for {} from {}", candles.size(), resolution, instrument, file);
        return candles;
    }

    public Path fileFor(String instrument, Resolution resolution) {
        return dataDir.resolve(instrument + "_" + resolution.name() + ".csv");
    }

    private static Candle parse(String instrument, Resolution resolution, String[] fields, Path file, int lineNo) {
        if (fields.length < 5) {
            throw new IllegalArgumentException(
                String.format("%s:%d expected at least 5 columns, got %d", file, lineNo, fields.length));
        }
        try {
            Instant ts = parseTimestamp(fields[0].trim());
            long volume = fields.length > 5 && !fields[5].isBlank()
                ? new BigDecimal(fields[5].trim()).longValue()
                : 0L;
            return new Candle(
                instrument,
                resolution,
                ts,
                new BigDecimal(fields[1].trim()),
                new BigDecimal(fields[2].trim()),
                new BigDecimal(fields[3].trim()),
                new BigDecimal(fields[4].trim()),
                volume
            );
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new IllegalArgumentException(
                String.format("%s:%d malformed row: %s", file, lineNo, e.getMessage()), e);
        }
    }

    private static Instant parseTimestamp(String value) {
        if (!value.isEmpty() && value.chars().allMatch(Character::isDigit)) {
            return Instant.ofEpochMilli(Long.parseLong(value));
        }
        return Instant.parse(value);
    }

    private static boolean looksLikeTimestamp(String value) {
        return !value.isEmpty() && Character.isDigit(value.charAt(0));
    }
}
