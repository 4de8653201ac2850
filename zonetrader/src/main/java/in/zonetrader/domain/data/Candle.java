package in.zonetrader.domain.data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * OHLCV bar. Immutable; unique per (instrument, resolution, timestamp).
 * Timestamp is the bar open time.
 */
public record Candle(
    String instrument,
    Resolution resolution,
    Instant timestamp,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    long volume
) {
    public Candle {
        Objects.requireNonNull(instrument, "instrument");
        Objects.requireNonNull(resolution, "resolution");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(open, "open");
        Objects.requireNonNull(high, "high");
        Objects.requireNonNull(low, "low");
        Objects.requireNonNull(close, "close");
        if (high.compareTo(low) < 0) {
            throw new IllegalArgumentException(
                String.format("Candle high %s below low %s for %s @ %s", high, low, instrument, timestamp));
        }
    }

    /**
     * Check if candle is bullish (close > open).
     */
    public boolean isBullish() {
        return close.compareTo(open) > 0;
    }

    /**
     * Check if candle is bearish (close < open).
     */
    public boolean isBearish() {
        return close.compareTo(open) < 0;
    }

    /**
     * Get body size (absolute difference between open and close).
     */
    public BigDecimal bodySize() {
        return close.subtract(open).abs();
    }

    /**
     * Full bar range (high - low).
     */
    public BigDecimal range() {
        return high.subtract(low);
    }

    /**
     * Close time of the bar (exclusive).
     */
    public Instant closeTime() {
        return timestamp.plus(resolution.duration());
    }

    /**
     * Create candle from raw values.
     */
    public static Candle of(String instrument, Resolution resolution, Instant ts,
                            double o, double h, double l, double c, long v) {
        return new Candle(
            instrument, resolution, ts,
            BigDecimal.valueOf(o),
            BigDecimal.valueOf(h),
            BigDecimal.valueOf(l),
            BigDecimal.valueOf(c),
            v
        );
    }
}
