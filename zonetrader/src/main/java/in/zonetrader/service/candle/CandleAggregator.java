package in.zonetrader.service.candle;

import in.zonetrader.domain.data.Candle;
import in.zonetrader.domain.data.Resolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Candle Aggregator - Build coarser bars from finer bars.
 *
 * Buckets are calendar aligned in UTC (see {@link Resolution#bucketStart(Instant)}).
 * Each bucket aggregates whatever finer bars fall inside it: first open, max high,
 * min low, last close, summed volume.
 */
public final class CandleAggregator {
    private static final Logger log = LoggerFactory.getLogger(CandleAggregator.class);

    private CandleAggregator() {}

    /**
     * Resample a chronological series into the target resolution.
     *
     * @param finer  Bars of one instrument, oldest first, all of the same resolution
     * @param target Coarser resolution
     * @return Aggregated bars, oldest first
     * @throws OutOfOrderDataException if the input is not strictly increasing
     */
    public static List<Candle> resample(List<Candle> finer, Resolution target) {
        List<Candle> result = new ArrayList<>();
        if (finer == null || finer.isEmpty()) {
            return result;
        }

        Resolution source = finer.get(0).resolution();
        if (!target.isCoarserThan(source)) {
            throw new IllegalArgumentException(
                String.format("Cannot resample %s into %s", source, target));
        }

        List<Candle> bucket = new ArrayList<>();
        Instant bucketStart = null;
        Instant previous = null;

        for (Candle c : finer) {
            if (previous != null && !c.timestamp().isAfter(previous)) {
                throw new OutOfOrderDataException(c.instrument(), c.resolution(), previous, c.timestamp());
            }
            previous = c.timestamp();

            Instant start = target.bucketStart(c.timestamp());
            if (bucketStart != null && !start.equals(bucketStart)) {
                result.add(aggregate(bucket, target, bucketStart));
                bucket.clear();
            }
            bucketStart = start;
            bucket.add(c);
        }
        result.add(aggregate(bucket, target, bucketStart));

        log.debug("Resampled {} {} bars of {} into {} {} bars",
            finer.size(), source, finer.get(0).instrument(), result.size(), target);
        return result;
    }

    /**
     * Aggregate the bars of one bucket.
     */
    static Candle aggregate(List<Candle> bars, Resolution target, Instant bucketStart) {
        BigDecimal open = bars.get(0).open();                    // First bar's open
        BigDecimal close = bars.get(bars.size() - 1).close();    // Last bar's close
        BigDecimal high = bars.stream()
            .map(Candle::high)
            .max(BigDecimal::compareTo)
            .orElseThrow();
        BigDecimal low = bars.stream()
            .map(Candle::low)
            .min(BigDecimal::compareTo)
            .orElseThrow();
        long volume = bars.stream()
            .mapToLong(Candle::volume)
            .sum();

        return new Candle(bars.get(0).instrument(), target, bucketStart, open, high, low, close, volume);
    }
}
