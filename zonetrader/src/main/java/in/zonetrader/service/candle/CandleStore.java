package in.zonetrader.service.candle;

import in.zonetrader.domain.data.Candle;
import in.zonetrader.domain.data.Resolution;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Candle Store - Append-only in-memory bar windows.
 *
 * One series per (instrument, resolution), oldest first. Each series keeps at most
 * {@link Resolution#getLookback()} bars; older bars drop off the front.
 * Bars must arrive with strictly increasing timestamps. The replay reads the latest
 * execution bar of each instrument back as its mark.
 */
public final class CandleStore {

    // instrument -> resolution -> candles (oldest first)
    private final Map<String, Map<Resolution, List<Candle>>> series = new ConcurrentHashMap<>();

    private final int lookbackOverride;

    public CandleStore() {
        this(0);
    }

    /**
     * @param lookbackOverride Max bars per series; 0 uses each resolution's default lookback
     */
    public CandleStore(int lookbackOverride) {
        if (lookbackOverride < 0) {
            throw new IllegalArgumentException("Lookback must not be negative: " + lookbackOverride);
        }
        this.lookbackOverride = lookbackOverride;
    }

    /**
     * Append a closed bar to its series.
     *
     * @throws OutOfOrderDataException if the bar does not strictly follow the latest bar
     */
    public void append(Candle candle) {
        List<Candle> list = series
            .computeIfAbsent(candle.instrument(), k -> new ConcurrentHashMap<>())
            .computeIfAbsent(candle.resolution(), k -> new ArrayList<>());

        if (!list.isEmpty()) {
            Instant previous = list.get(list.size() - 1).timestamp();
            if (!candle.timestamp().isAfter(previous)) {
                throw new OutOfOrderDataException(
                    candle.instrument(), candle.resolution(), previous, candle.timestamp());
            }
        }

        list.add(candle);

        int max = lookbackOverride > 0 ? lookbackOverride : candle.resolution().getLookback();
        if (list.size() > max) {
            list.remove(0);
        }
    }

    /**
     * Get latest bar, or null if the series is empty.
     */
    public Candle getLatest(String instrument, Resolution resolution) {
        List<Candle> list = find(instrument, resolution);
        if (list == null || list.isEmpty()) {
            return null;
        }
        return list.get(list.size() - 1);
    }

    int size(String instrument, Resolution resolution) {
        List<Candle> list = find(instrument, resolution);
        return list == null ? 0 : list.size();
    }

    private List<Candle> find(String instrument, Resolution resolution) {
        Map<Resolution, List<Candle>> byResolution = series.get(instrument);
        return byResolution == null ? null : byResolution.get(resolution);
    }
}
