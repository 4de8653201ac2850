package in.zonetrader.service.signal;

import in.zonetrader.config.ScoringConfig;
import in.zonetrader.config.ZoneConfig;
import in.zonetrader.domain.data.Direction;
import in.zonetrader.domain.signal.ConfluenceFactor;
import in.zonetrader.domain.signal.Signal;
import in.zonetrader.domain.signal.SignalStrength;
import in.zonetrader.domain.structure.StructureState;
import in.zonetrader.domain.zone.LiquidityLevel;
import in.zonetrader.domain.zone.Polarity;
import in.zonetrader.domain.zone.RangePosition;
import in.zonetrader.domain.zone.RangeZone;
import in.zonetrader.domain.zone.Zone;
import in.zonetrader.domain.zone.ZoneKind;
import in.zonetrader.domain.zone.ZoneStatus;
import in.zonetrader.service.zone.RangePositionCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Confluence Scorer - Fuses multi-resolution evidence into one directional signal.
 *
 * Score = 100 x sum(credit x weight) / sum(weight), each credit in [0, 1].
 * Normalization happens before the threshold check, so all-true inputs score exactly 100
 * and nothing is clipped.
 *
 * Credits:
 * - MACRO_TREND:            aligned 1.0, RANGING 0.5, opposed 0
 * - INTERMEDIATE_STRUCTURE: aligned 1.0, RANGING 0.5, opposed 0
 * - EXECUTION_ZONE:         first reaction from the zone 1.0, repeat reaction 0.7
 * - SWEEP_CONFIRMATION:     recent sweep zone of the same polarity 1.0, else 0
 * - RANGE_POSITION:         optimal band 1.0, rest of favourable half 0.6, equilibrium 0.3, else 0
 *
 * A signal needs price inside active execution zones of exactly one polarity.
 */
public final class ConfluenceScorer {
    private static final Logger log = LoggerFactory.getLogger(ConfluenceScorer.class);

    private static final BigDecimal HUNDRED = new BigDecimal("100");
    private static final BigDecimal HALF = new BigDecimal("0.5");
    private static final BigDecimal REPEAT_REACTION = new BigDecimal("0.7");
    private static final BigDecimal NEAR_OPTIMAL = new BigDecimal("0.6");
    private static final BigDecimal EQUILIBRIUM = new BigDecimal("0.3");

    private final ScoringConfig config;
    private final ZoneConfig zoneConfig;
    private final OpenPositionView positions;

    // instrument -> last bar a signal was emitted for
    private final Map<String, Instant> lastEmitted = new ConcurrentHashMap<>();

    public ConfluenceScorer(ScoringConfig config, ZoneConfig zoneConfig, OpenPositionView positions) {
        if (!config.isValid()) {
            throw new IllegalArgumentException("Invalid scoring config: " + config);
        }
        this.config = config;
        this.zoneConfig = zoneConfig;
        this.positions = positions;
    }

    /**
     * Evaluate one execution bar.
     *
     * @return A signal, or empty when a position is open, the bar already produced one,
     *         direction is ambiguous, or the score is below the minimum
     */
    public Optional<Signal> evaluate(String instrument, MultiResolutionSnapshot snapshot) {
        if (positions.hasOpenPosition(instrument)) {
            return Optional.empty();
        }

        Instant barTime = snapshot.barTime();
        Instant previous = lastEmitted.get(instrument);
        if (previous != null && !barTime.isAfter(previous)) {
            return Optional.empty();
        }

        BigDecimal price = snapshot.price();
        List<Zone> qualifying = snapshot.executionZones().stream()
            .filter(Zone::isActive)
            .filter(z -> z.contains(price))
            .toList();
        if (qualifying.isEmpty()) {
            return Optional.empty();
        }

        boolean anyBullish = qualifying.stream().anyMatch(z -> z.getPolarity() == Polarity.BULLISH);
        boolean anyBearish = qualifying.stream().anyMatch(z -> z.getPolarity() == Polarity.BEARISH);
        if (anyBullish && anyBearish) {
            log.debug("[SCORE] {} ambiguous zones @ {}", instrument, barTime);
            return Optional.empty();
        }

        Direction direction = qualifying.get(0).getPolarity().toDirection();
        if (snapshot.atr() == null) {
            log.debug("[SCORE] {} no ATR yet @ {}", instrument, barTime);
            return Optional.empty();
        }

        // Most recently formed zone triggers; ties by kind order
        Zone trigger = qualifying.stream()
            .max(Comparator.comparing(Zone::getFormedAt)
                .thenComparing(Zone::getKind, Comparator.reverseOrder()))
            .orElseThrow();

        Map<ConfluenceFactor, BigDecimal> credits = credits(direction, snapshot, qualifying);
        BigDecimal confidence = normalize(credits);

        if (confidence.compareTo(config.minConfidence()) < 0) {
            log.debug("[SCORE] {} {} confidence {} below {} @ {}",
                instrument, direction, confidence, config.minConfidence(), barTime);
            return Optional.empty();
        }

        BigDecimal buffer = snapshot.atr().multiply(config.stopBufferAtrMultiple());
        BigDecimal stop = direction == Direction.LONG
            ? trigger.invalidationEdge().subtract(buffer)
            : trigger.invalidationEdge().add(buffer);
        BigDecimal target = target(direction, price, stop, snapshot.liquidity());

        SignalStrength strength = SignalStrength.fromConfidence(confidence);
        Signal signal = new Signal(
            instrument, direction, price, stop, target, confidence, strength,
            strength.getMultiplier(), reasons(direction, credits, trigger), barTime);

        lastEmitted.put(instrument, barTime);
        log.info("[SIGNAL] {} {} entry={} stop={} target={} confidence={} ({})",
            instrument, direction, price, stop, target, confidence, strength);
        return Optional.of(signal);
    }

    /**
     * Normalized score in [0, 100], scale 2. Missing factors count as zero credit.
     */
    public BigDecimal normalize(Map<ConfluenceFactor, BigDecimal> credits) {
        BigDecimal weighted = BigDecimal.ZERO;
        for (ConfluenceFactor factor : ConfluenceFactor.values()) {
            BigDecimal credit = credits.getOrDefault(factor, BigDecimal.ZERO);
            if (credit.signum() < 0 || credit.compareTo(BigDecimal.ONE) > 0) {
                throw new IllegalArgumentException(
                    String.format("Credit for %s out of [0, 1]: %s", factor, credit));
            }
            weighted = weighted.add(credit.multiply(factor.weight(config)));
        }
        return weighted.multiply(HUNDRED).divide(config.totalWeight(), 2, RoundingMode.HALF_UP);
    }

    /**
     * Credits of every factor for one direction.
     */
    Map<ConfluenceFactor, BigDecimal> credits(Direction direction, MultiResolutionSnapshot snapshot, List<Zone> qualifying) {
        Map<ConfluenceFactor, BigDecimal> credits = new EnumMap<>(ConfluenceFactor.class);
        credits.put(ConfluenceFactor.MACRO_TREND, biasCredit(snapshot.macro(), direction));
        credits.put(ConfluenceFactor.INTERMEDIATE_STRUCTURE, biasCredit(snapshot.intermediate(), direction));
        credits.put(ConfluenceFactor.EXECUTION_ZONE, zoneCredit(qualifying, snapshot.barTime()));
        credits.put(ConfluenceFactor.SWEEP_CONFIRMATION, sweepCredit(direction, snapshot));
        credits.put(ConfluenceFactor.RANGE_POSITION, rangeCredit(direction, snapshot));
        return credits;
    }

    private static BigDecimal biasCredit(StructureState state, Direction direction) {
        if (state == null) {
            return BigDecimal.ZERO;
        }
        if (state.bias().alignsWith(direction)) {
            return BigDecimal.ONE;
        }
        return state.bias().opposes(direction) ? BigDecimal.ZERO : HALF;
    }

    private static BigDecimal zoneCredit(List<Zone> qualifying, Instant barTime) {
        for (Zone zone : qualifying) {
            boolean firstReaction = zone.getStatus() == ZoneStatus.FRESH
                || zone.getStatus() == ZoneStatus.FLIPPED
                || (zone.getStatus() == ZoneStatus.TESTED && zone.getLastTransitionAt().equals(barTime));
            if (firstReaction) {
                return BigDecimal.ONE;
            }
        }
        return REPEAT_REACTION;
    }

    private BigDecimal sweepCredit(Direction direction, MultiResolutionSnapshot snapshot) {
        Polarity wanted = Polarity.of(direction);
        Instant since = snapshot.barTime().minus(
            snapshot.executionBar().resolution().duration().multipliedBy(config.sweepRecencyBars()));
        boolean swept = snapshot.executionZones().stream()
            .filter(z -> z.getKind() == ZoneKind.SWEEP_LEVEL)
            .filter(z -> z.getPolarity() == wanted)
            .filter(z -> z.getStatus() != ZoneStatus.INVALIDATED)
            .anyMatch(z -> !z.getFormedAt().isBefore(since) && !z.getFormedAt().isAfter(snapshot.barTime()));
        return swept ? BigDecimal.ONE : BigDecimal.ZERO;
    }

    /**
     * Dealing range from the intermediate swings, falling back to the execution swings.
     */
    private BigDecimal rangeCredit(Direction direction, MultiResolutionSnapshot snapshot) {
        StructureState rangeSource = snapshot.intermediate() != null && snapshot.intermediate().hasRange()
            ? snapshot.intermediate()
            : snapshot.execution();
        Optional<RangePosition> position = RangePositionCalculator.calculate(snapshot.price(), rangeSource, zoneConfig);
        if (position.isEmpty()) {
            return BigDecimal.ZERO;
        }

        RangeZone favourable = direction == Direction.LONG ? RangeZone.DISCOUNT : RangeZone.PREMIUM;
        RangePosition p = position.get();
        if (p.zone() == favourable) {
            return p.optimal() ? BigDecimal.ONE : NEAR_OPTIMAL;
        }
        return p.zone() == RangeZone.EQUILIBRIUM ? EQUILIBRIUM : BigDecimal.ZERO;
    }

    /**
     * Nearest unconsumed level beyond entry that clears the minimum reward, else the minimum reward itself.
     */
    BigDecimal target(Direction direction, BigDecimal entry, BigDecimal stop, List<LiquidityLevel> liquidity) {
        BigDecimal minReward = entry.subtract(stop).abs().multiply(config.minRewardMultiple());
        BigDecimal best = null;
        for (LiquidityLevel level : liquidity) {
            if (level.isConsumed()) {
                continue;
            }
            BigDecimal distance = level.getPrice().subtract(entry).multiply(direction.sign());
            if (distance.signum() <= 0 || distance.compareTo(minReward) < 0) {
                continue;
            }
            if (best == null || distance.compareTo(best.subtract(entry).abs()) < 0) {
                best = level.getPrice();
            }
        }
        if (best != null) {
            return best;
        }
        return entry.add(minReward.multiply(direction.sign()));
    }

    private List<String> reasons(Direction direction, Map<ConfluenceFactor, BigDecimal> credits, Zone trigger) {
        List<String> reasons = new ArrayList<>();
        reasons.add(String.format("%s from %s %s [%s, %s] (%s)", direction, trigger.getKind(),
            trigger.getPolarity(), trigger.getBottom(), trigger.getTop(), trigger.getStatus()));
        for (Map.Entry<ConfluenceFactor, BigDecimal> entry : credits.entrySet()) {
            reasons.add(String.format("%s %s x %s", entry.getKey(),
                entry.getValue().stripTrailingZeros().toPlainString(),
                entry.getKey().weight(config).stripTrailingZeros().toPlainString()));
        }
        return reasons;
    }

    /**
     * Forget emission history (new run).
     */
    public void reset() {
        lastEmitted.clear();
    }
}
