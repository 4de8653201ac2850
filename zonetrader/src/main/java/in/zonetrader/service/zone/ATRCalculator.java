package in.zonetrader.service.zone;

import in.zonetrader.domain.data.Candle;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * ATR Calculator - Average True Range from candle data.
 *
 * Used to scale volatility-dependent distances:
 * 1. Liquidity tolerance: equal-level and sweep tolerance = N x ATR
 * 2. Stop buffer: stop = zone edge -/+ N x ATR
 *
 * Calculation Method:
 * - Wilder's smoothing: ATR_t = ((ATR_{t-1} x (n-1)) + TR_t) / n
 * - True Range: TR = max(H-L, |H-PC|, |L-PC|)
 */
public final class ATRCalculator {

    private static final BigDecimal ZERO = BigDecimal.ZERO;
    private static final int SCALE = 10;

    private ATRCalculator() {}

    /**
     * Calculate ATR using Wilder's smoothing method.
     *
     * Requires at least (period + 1) candles.
     *
     * @param candles Candles in chronological order (oldest first)
     * @param period  ATR period (typically 14)
     * @return ATR value, or null if insufficient data
     */
    static BigDecimal calculate(List<Candle> candles, int period) {
        if (candles == null || candles.isEmpty()) {
            return null;
        }

        if (period <= 0) {
            throw new IllegalArgumentException("ATR period must be positive: " + period);
        }

        // Need period TRs for the seed, +1 for the first previous close
        if (candles.size() < period + 1) {
            return null;
        }

        Running running = new Running(period);
        BigDecimal atr = null;
        for (Candle candle : candles) {
            atr = running.update(candle);
        }
        return atr;
    }

    /**
     * Calculate True Range for a candle.
     *
     * TR = max(H - L, |H - PC|, |L - PC|)
     *
     * @param current  Current candle
     * @param previous Previous candle
     * @return True Range value
     */
    public static BigDecimal calculateTrueRange(Candle current, Candle previous) {
        if (current == null || previous == null) {
            throw new IllegalArgumentException("Candles cannot be null");
        }

        BigDecimal prevClose = previous.close();

        // TR component 1: H - L
        BigDecimal highLow = current.high().subtract(current.low());

        // TR component 2: |H - PC|
        BigDecimal highPrevClose = current.high().subtract(prevClose).abs();

        // TR component 3: |L - PC|
        BigDecimal lowPrevClose = current.low().subtract(prevClose).abs();

        return highLow.max(highPrevClose).max(lowPrevClose);
    }

    /**
     * Incremental Wilder ATR, one bar at a time.
     *
     * Seeds with the simple average of the first {@code period} true ranges, then smooths.
     */
    public static final class Running {
        private final int period;
        private final BigDecimal periodBd;
        private final BigDecimal periodMinusOne;

        private Candle previous;
        private int trCount;
        private BigDecimal seedSum = ZERO;
        private BigDecimal atr;

        public Running(int period) {
            if (period <= 0) {
                throw new IllegalArgumentException("ATR period must be positive: " + period);
            }
            this.period = period;
            this.periodBd = new BigDecimal(period);
            this.periodMinusOne = new BigDecimal(period - 1);
        }

        /**
         * Feed the next bar.
         *
         * @return Current ATR, or null until period + 1 bars have been seen
         */
        public BigDecimal update(Candle candle) {
            if (previous != null) {
                BigDecimal tr = calculateTrueRange(candle, previous);
                trCount++;
                if (trCount < period) {
                    seedSum = seedSum.add(tr);
                } else if (trCount == period) {
                    atr = seedSum.add(tr).divide(periodBd, SCALE, RoundingMode.HALF_UP);
                } else {
                    atr = atr.multiply(periodMinusOne).add(tr).divide(periodBd, SCALE, RoundingMode.HALF_UP);
                }
            }
            previous = candle;
            return atr;
        }

        public BigDecimal current() {
            return atr;
        }

        public int getPeriod() {
            return period;
        }
    }
}
