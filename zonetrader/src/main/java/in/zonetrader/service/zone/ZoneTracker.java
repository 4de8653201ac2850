package in.zonetrader.service.zone;

import in.zonetrader.config.ZoneConfig;
import in.zonetrader.domain.data.Candle;
import in.zonetrader.domain.data.Resolution;
import in.zonetrader.domain.structure.SwingKind;
import in.zonetrader.domain.structure.SwingPoint;
import in.zonetrader.domain.zone.LiquidityBook;
import in.zonetrader.domain.zone.LiquidityLevel;
import in.zonetrader.domain.zone.LiquiditySource;
import in.zonetrader.domain.zone.Polarity;
import in.zonetrader.domain.zone.Zone;
import in.zonetrader.domain.zone.ZoneBook;
import in.zonetrader.domain.zone.ZoneKind;
import in.zonetrader.domain.zone.ZoneStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Zone Tracker - Owns the zone and liquidity books of one (instrument, resolution).
 *
 * Per bar, in order:
 * 1. Update ATR
 * 2. Apply lifecycle transitions to zones formed before this bar
 * 3. Roll previous-day high/low levels on a UTC day change
 * 4. Detect sweeps of existing levels (consume them, record SWEEP_LEVEL zones)
 * 5. Detect new order blocks and gaps
 * 6. Add levels for swings confirmed on this bar (equal highs/lows when clustered)
 *
 * The structure analyzer of the same series must already have processed the bar.
 * Not thread-safe.
 */
public final class ZoneTracker {
    private static final Logger log = LoggerFactory.getLogger(ZoneTracker.class);

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final String instrument;
    private final Resolution resolution;
    private final ZoneConfig config;
    private final BigDecimal minGap;
    private final BigDecimal impulseRatio;

    private final ZoneBook zoneBook;
    private final LiquidityBook liquidityBook;
    private final ATRCalculator.Running atr;
    private final Deque<Candle> recent = new ArrayDeque<>(3);

    private final List<SwingPoint> swingHighs = new ArrayList<>();
    private final List<SwingPoint> swingLows = new ArrayList<>();

    private LocalDate currentDay;
    private BigDecimal dayHigh;
    private BigDecimal dayLow;

    public ZoneTracker(String instrument, Resolution resolution, ZoneConfig config, BigDecimal priceUnit) {
        if (!config.isValid()) {
            throw new IllegalArgumentException("Invalid zone config: " + config);
        }
        this.instrument = instrument;
        this.resolution = resolution;
        this.config = config;
        this.minGap = config.minGapUnitsFor(resolution).multiply(priceUnit);
        this.impulseRatio = config.impulseRatioFor(resolution);
        this.zoneBook = new ZoneBook(config.maxZonesPerSide());
        this.liquidityBook = new LiquidityBook(config.maxLiquidityLevels());
        this.atr = new ATRCalculator.Running(config.atrPeriod());
    }

    /**
     * Process the next closed bar.
     *
     * @param bar       Bar just closed
     * @param newSwings Swings the structure analyzer confirmed on this bar
     * @return Zones formed and sweeps detected on this bar
     */
    public ZoneUpdate onBar(Candle bar, List<SwingPoint> newSwings) {
        BigDecimal currentAtr = atr.update(bar);
        BigDecimal tolerance = currentAtr == null
            ? BigDecimal.ZERO
            : currentAtr.multiply(config.sweepToleranceAtrMultiple());

        for (Zone zone : zoneBook.all()) {
            if (zone.getFormedAt().isBefore(bar.timestamp())) {
                applyTransition(zone, bar);
            }
        }

        rollDay(bar, tolerance);

        List<Zone> formed = new ArrayList<>();
        List<Sweep> sweeps = List.of();

        // Sweeps need a volatility estimate for the tolerance
        if (currentAtr != null) {
            sweeps = SweepDetector.detect(bar, liquidityBook.unconsumed(), tolerance);
            for (Sweep sweep : sweeps) {
                sweep.levels().forEach(level -> level.consume(bar.timestamp()));
                BigDecimal top = sweep.referenceLevel().max(sweep.wickExtreme());
                BigDecimal bottom = sweep.referenceLevel().min(sweep.wickExtreme());
                formed.add(new Zone(instrument, resolution, ZoneKind.SWEEP_LEVEL, sweep.reactionPolarity(),
                    top, bottom, bar.timestamp()));
                log.debug("[SWEEP] {} {} {} sweep of {} level(s) @ {}",
                    instrument, resolution, sweep.side(), sweep.levels().size(), bar.timestamp());
            }
        }

        recent.addLast(bar);
        if (recent.size() > 3) {
            recent.removeFirst();
        }
        List<Candle> window = new ArrayList<>(recent);

        OrderBlockDetector.detect(window, impulseRatio, config.wickAllowance()).ifPresent(formed::add);
        GapDetector.detect(window, minGap).ifPresent(formed::add);

        List<Zone> evicted = new ArrayList<>();
        for (Zone zone : formed) {
            zoneBook.add(zone).ifPresent(evicted::add);
            log.debug("[ZONE] {} formed {}", instrument, zone);
        }

        for (SwingPoint swing : newSwings) {
            addSwingLevel(swing, tolerance);
        }

        return new ZoneUpdate(List.copyOf(formed), sweeps, List.copyOf(evicted));
    }

    /**
     * Lifecycle step for one zone against one bar.
     */
    static void applyTransition(Zone zone, Candle bar) {
        if (zone.getKind() == ZoneKind.GAP && zone.getStatus() == ZoneStatus.INVALIDATED) {
            applyFlip(zone, bar);
            return;
        }
        if (zone.getStatus() == ZoneStatus.FLIPPED) {
            if (closesThrough(zone, bar)) {
                zone.retire();
            }
            return;
        }
        if (zone.getStatus() == ZoneStatus.INVALIDATED) {
            return;
        }

        boolean bullish = zone.getPolarity() == Polarity.BULLISH;
        boolean entered = bullish
            ? bar.low().compareTo(zone.getTop()) <= 0
            : bar.high().compareTo(zone.getBottom()) >= 0;

        if (entered) {
            zone.recordFill(fillPercent(zone, bar));
        }

        if (closesThrough(zone, bar)) {
            zone.transitionTo(ZoneStatus.INVALIDATED, bar.timestamp());
        } else if (entered && zone.getStatus() == ZoneStatus.FRESH) {
            zone.transitionTo(ZoneStatus.TESTED, bar.timestamp());
        }
    }

    /**
     * An invalidated gap retested from the far side and closed back beyond it flips polarity.
     */
    private static void applyFlip(Zone zone, Candle bar) {
        if (!bar.timestamp().isAfter(zone.getLastTransitionAt())) {
            return;
        }
        boolean wasBullish = zone.getPolarity() == Polarity.BULLISH;
        boolean retest = wasBullish
            ? bar.high().compareTo(zone.getBottom()) >= 0
            : bar.low().compareTo(zone.getTop()) <= 0;
        if (retest) {
            zone.markRetestedAfterInvalidation();
        }
        if (zone.isRetestedAfterInvalidation() && closesThrough(zone, bar)) {
            zone.transitionTo(ZoneStatus.FLIPPED, bar.timestamp());
            log.debug("[ZONE] {} flipped to {}", zone.key(), zone.getPolarity());
        }
    }

    private static boolean closesThrough(Zone zone, Candle bar) {
        return zone.getPolarity() == Polarity.BULLISH
            ? bar.close().compareTo(zone.getBottom()) < 0
            : bar.close().compareTo(zone.getTop()) > 0;
    }

    /**
     * Traded-through share of the band. Bullish zones fill from the top down, bearish from the bottom up.
     */
    static BigDecimal fillPercent(Zone zone, Candle bar) {
        BigDecimal height = zone.height();
        if (height.signum() == 0) {
            return HUNDRED;
        }
        BigDecimal traded = zone.getPolarity() == Polarity.BULLISH
            ? zone.getTop().subtract(bar.low().max(zone.getBottom()))
            : bar.high().min(zone.getTop()).subtract(zone.getBottom());
        return traded.multiply(HUNDRED).divide(height, 4, RoundingMode.HALF_UP);
    }

    private void rollDay(Candle bar, BigDecimal tolerance) {
        LocalDate day = LocalDate.ofInstant(bar.timestamp(), ZoneOffset.UTC);
        if (currentDay != null && !day.equals(currentDay)) {
            liquidityBook.removeUnconsumed(LiquiditySource.PREVIOUS_DAY_HIGH);
            liquidityBook.removeUnconsumed(LiquiditySource.PREVIOUS_DAY_LOW);
            liquidityBook.add(new LiquidityLevel(dayHigh, LiquiditySource.PREVIOUS_DAY_HIGH, bar.timestamp()), tolerance);
            liquidityBook.add(new LiquidityLevel(dayLow, LiquiditySource.PREVIOUS_DAY_LOW, bar.timestamp()), tolerance);
            dayHigh = null;
            dayLow = null;
        }
        currentDay = day;
        dayHigh = dayHigh == null ? bar.high() : dayHigh.max(bar.high());
        dayLow = dayLow == null ? bar.low() : dayLow.min(bar.low());
    }

    private void addSwingLevel(SwingPoint swing, BigDecimal tolerance) {
        boolean high = swing.kind() == SwingKind.HIGH;
        List<SwingPoint> history = high ? swingHighs : swingLows;

        int from = Math.max(0, history.size() - config.equalLevelLookback());
        int touches = 1;
        BigDecimal extreme = swing.price();
        for (int i = from; i < history.size(); i++) {
            BigDecimal prior = history.get(i).price();
            if (prior.subtract(swing.price()).abs().compareTo(tolerance) <= 0) {
                touches++;
                extreme = high ? extreme.max(prior) : extreme.min(prior);
            }
        }

        history.add(swing);
        if (history.size() > config.equalLevelLookback()) {
            history.remove(0);
        }

        LiquiditySource source;
        BigDecimal price;
        if (touches >= config.equalLevelMinTouches()) {
            source = high ? LiquiditySource.EQUAL_HIGHS : LiquiditySource.EQUAL_LOWS;
            price = extreme;
        } else {
            source = high ? LiquiditySource.SWING_HIGH : LiquiditySource.SWING_LOW;
            price = swing.price();
        }
        liquidityBook.add(new LiquidityLevel(price, source, swing.confirmedAt()), tolerance);
    }

    /**
     * Current ATR, or null during warm-up.
     */
    public BigDecimal currentAtr() {
        return atr.current();
    }

    public ZoneBook zoneBook() {
        return zoneBook;
    }

    public LiquidityBook liquidityBook() {
        return liquidityBook;
    }

    public String getInstrument() {
        return instrument;
    }

    public Resolution getResolution() {
        return resolution;
    }

    /**
     * Result of one bar.
     */
    public record ZoneUpdate(
        List<Zone> formed,
        List<Sweep> sweeps,
        List<Zone> evicted
    ) {
        public Optional<Zone> formedOfKind(ZoneKind kind) {
            return formed.stream().filter(z -> z.getKind() == kind).findFirst();
        }
    }
}
