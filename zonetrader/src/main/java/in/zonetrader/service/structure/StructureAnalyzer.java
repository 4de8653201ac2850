package in.zonetrader.service.structure;

import in.zonetrader.config.StructureConfig;
import in.zonetrader.domain.data.Candle;
import in.zonetrader.domain.data.Resolution;
import in.zonetrader.domain.structure.Bias;
import in.zonetrader.domain.structure.BreakType;
import in.zonetrader.domain.structure.StructureBreak;
import in.zonetrader.domain.structure.StructureState;
import in.zonetrader.domain.structure.SwingKind;
import in.zonetrader.domain.structure.SwingPoint;
import in.zonetrader.service.candle.OutOfOrderDataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Structure Analyzer - Confirmed swings, bias and structural breaks for one series.
 *
 * Swing rule (fractal):
 * - Bar i is a swing high when the confirmWindow bars on each side have strictly lower highs
 * - Confirmation happens on bar i + confirmWindow, never earlier
 * - A swing can be broken only by bars after the one that confirmed it
 *
 * Break rule:
 * - Close above the last unbroken swing high = bullish break
 * - Close below the last unbroken swing low = bearish break
 * - CONTINUATION if it extends (or from RANGING establishes) bias, CHARACTER_CHANGE if it flips it
 * - Each swing can be broken once
 *
 * One instance per (instrument, resolution). Not thread-safe.
 */
public final class StructureAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(StructureAnalyzer.class);

    private final String instrument;
    private final Resolution resolution;
    private final StructureConfig config;

    private final Deque<Candle> buffer = new ArrayDeque<>();
    private final int bufferSize;

    private final List<SwingPoint> swingHistory = new ArrayList<>();
    private final int maxSwingHistory;

    private StructureState state = StructureState.initial();
    private boolean swingHighBroken;
    private boolean swingLowBroken;
    private List<SwingPoint> confirmedOnLastBar = List.of();

    public StructureAnalyzer(String instrument, Resolution resolution, StructureConfig config) {
        this(instrument, resolution, config, 50);
    }

    public StructureAnalyzer(String instrument, Resolution resolution, StructureConfig config, int maxSwingHistory) {
        if (!config.isValid()) {
            throw new IllegalArgumentException("Invalid structure config: " + config);
        }
        this.instrument = instrument;
        this.resolution = resolution;
        this.config = config;
        this.maxSwingHistory = maxSwingHistory;
        // Swing window plus one bar, or the displacement lookback plus the breaking bar
        this.bufferSize = Math.max(2 * config.confirmWindow() + 1, config.displacementLookback() + 1);
    }

    /**
     * Feed the next closed bar.
     *
     * @return State after this bar
     * @throws OutOfOrderDataException if the bar does not strictly follow the previous one
     */
    public StructureState update(Candle candle) {
        Candle last = buffer.peekLast();
        if (last != null && !candle.timestamp().isAfter(last.timestamp())) {
            throw new OutOfOrderDataException(instrument, resolution, last.timestamp(), candle.timestamp());
        }

        buffer.addLast(candle);
        if (buffer.size() > bufferSize) {
            buffer.removeFirst();
        }

        // Step 1: structural break on this bar's close, against swings confirmed on earlier bars
        SwingPoint swingHigh = state.lastSwingHigh();
        SwingPoint swingLow = state.lastSwingLow();
        Bias bias = state.bias();
        StructureBreak lastBreak = state.lastBreak();

        if (swingHigh != null && !swingHighBroken
                && candle.close().compareTo(swingHigh.price()) > 0
                && hasDisplacement(candle)) {
            BreakType type = bias == Bias.BEARISH ? BreakType.CHARACTER_CHANGE : BreakType.CONTINUATION;
            lastBreak = new StructureBreak(candle.timestamp(), Bias.BULLISH, type, swingHigh, candle.close());
            bias = Bias.BULLISH;
            swingHighBroken = true;
        } else if (swingLow != null && !swingLowBroken
                && candle.close().compareTo(swingLow.price()) < 0
                && hasDisplacement(candle)) {
            BreakType type = bias == Bias.BULLISH ? BreakType.CHARACTER_CHANGE : BreakType.CONTINUATION;
            lastBreak = new StructureBreak(candle.timestamp(), Bias.BEARISH, type, swingLow, candle.close());
            bias = Bias.BEARISH;
            swingLowBroken = true;
        }

        // Step 2: confirm the swing candidate confirmWindow bars back; usable from the next bar on
        List<SwingPoint> confirmed = new ArrayList<>(2);
        int n = config.confirmWindow();
        if (buffer.size() >= 2 * n + 1) {
            List<Candle> bars = new ArrayList<>(buffer);
            int candidate = bars.size() - 1 - n;
            Candle pivot = bars.get(candidate);

            if (isSwingHigh(bars, candidate, n)) {
                swingHigh = new SwingPoint(pivot.timestamp(), pivot.high(), SwingKind.HIGH, candle.timestamp());
                swingHighBroken = false;
                confirmed.add(swingHigh);
            }
            if (isSwingLow(bars, candidate, n)) {
                swingLow = new SwingPoint(pivot.timestamp(), pivot.low(), SwingKind.LOW, candle.timestamp());
                swingLowBroken = false;
                confirmed.add(swingLow);
            }
        }

        if (lastBreak != null && lastBreak != state.lastBreak()) {
            log.debug("[STRUCTURE] {} {} {} {} break of {} @ {}",
                instrument, resolution, lastBreak.direction(), lastBreak.type(),
                lastBreak.brokenSwing().price(), candle.timestamp());
        }

        for (SwingPoint swing : confirmed) {
            swingHistory.add(swing);
            if (swingHistory.size() > maxSwingHistory) {
                swingHistory.remove(0);
            }
        }
        confirmedOnLastBar = List.copyOf(confirmed);

        state = new StructureState(bias, lastBreak, swingHigh, swingLow, state.barsSeen() + 1);
        return state;
    }

    public StructureState state() {
        return state;
    }

    /**
     * Swings confirmed by the most recent bar.
     */
    public List<SwingPoint> confirmedOnLastBar() {
        return confirmedOnLastBar;
    }

    /**
     * Recent confirmed swings, oldest first.
     */
    public List<SwingPoint> swingHistory() {
        return List.copyOf(swingHistory);
    }

    /**
     * True when the most recent bar produced a structural break.
     */
    public boolean brokeOnLastBar() {
        Candle last = buffer.peekLast();
        return last != null && state.lastBreak() != null
            && state.lastBreak().timestamp().equals(last.timestamp());
    }

    public String getInstrument() {
        return instrument;
    }

    public Resolution getResolution() {
        return resolution;
    }

    private static boolean isSwingHigh(List<Candle> bars, int index, int n) {
        BigDecimal pivot = bars.get(index).high();
        for (int k = 1; k <= n; k++) {
            if (bars.get(index - k).high().compareTo(pivot) >= 0
                    || bars.get(index + k).high().compareTo(pivot) >= 0) {
                return false;
            }
        }
        return true;
    }

    private static boolean isSwingLow(List<Candle> bars, int index, int n) {
        BigDecimal pivot = bars.get(index).low();
        for (int k = 1; k <= n; k++) {
            if (bars.get(index - k).low().compareTo(pivot) <= 0
                    || bars.get(index + k).low().compareTo(pivot) <= 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Displacement filter: breaking body > multiplier x mean range of the preceding bars.
     * Always passes when the filter is off or history is too short.
     */
    private boolean hasDisplacement(Candle candle) {
        if (!config.displacementEnabled()) {
            return true;
        }
        List<Candle> bars = new ArrayList<>(buffer);
        int lookback = config.displacementLookback();
        if (bars.size() < lookback + 1) {
            return true;
        }

        BigDecimal sum = BigDecimal.ZERO;
        for (int i = bars.size() - 1 - lookback; i < bars.size() - 1; i++) {
            sum = sum.add(bars.get(i).range());
        }
        BigDecimal meanRange = sum.divide(BigDecimal.valueOf(lookback), 10, RoundingMode.HALF_UP);
        return candle.bodySize().compareTo(meanRange.multiply(config.displacementMultiplier())) > 0;
    }
}
