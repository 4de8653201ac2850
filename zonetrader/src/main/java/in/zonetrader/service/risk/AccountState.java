package in.zonetrader.service.risk;

import in.zonetrader.config.RiskConfig;
import in.zonetrader.domain.data.InstrumentMeta;
import in.zonetrader.domain.signal.Signal;
import in.zonetrader.domain.trade.ClosedTrade;
import in.zonetrader.domain.trade.ExitReason;
import in.zonetrader.domain.trade.OrderSize;
import in.zonetrader.domain.trade.Position;
import in.zonetrader.service.signal.OpenPositionView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Account State - Balance, open positions and the daily loss accumulator of one run.
 *
 * The only shared-mutable resource. "Read balance, size, commit" is one locked step and
 * risk already committed to open positions is withheld from the balance offered to the sizer,
 * so two signals sized concurrently never spend the same budget.
 *
 * The daily accumulator holds the UTC day's realized P&L. Once the loss reaches
 * dailyLossLimitFraction x the day's opening balance, new signals are suppressed until the next day.
 *
 * Opening is also refused (as a {@link RiskException}) when:
 * - maxOpenPositions positions are already open
 * - maxDailyTrades positions were already opened this UTC day
 * - the instrument is cooling down after its last position (loss or win cooldown)
 * - the instrument lost maxConsecutiveLosses positions in a row; it is paused for
 *   lossStreakPauseMinutes and the streak starts over
 *
 * A position's outcome is its total realized P&L, partial closes included.
 */
public final class AccountState implements OpenPositionView {
    private static final Logger log = LoggerFactory.getLogger(AccountState.class);

    private final ReentrantLock lock = new ReentrantLock();

    private final BigDecimal dailyLossLimitFraction;
    private final int maxOpenPositions;
    private final int maxDailyTrades;
    private final int maxConsecutiveLosses;
    private final Duration lossCooldown;
    private final Duration winCooldown;
    private final Duration lossStreakPause;

    private final Map<String, Position> openPositions = new TreeMap<>();
    private final Map<String, BigDecimal> partialRealized = new HashMap<>();
    private final Map<String, Instant> cooldownUntil = new HashMap<>();
    private final Map<String, Instant> pausedUntil = new HashMap<>();
    private final Map<String, Integer> lossStreak = new HashMap<>();

    private BigDecimal balance;
    private LocalDate day;
    private BigDecimal dayOpeningBalance;
    private BigDecimal dayRealized = BigDecimal.ZERO;
    private int dayTrades;

    public AccountState(BigDecimal initialBalance, RiskConfig risk) {
        if (initialBalance == null || initialBalance.signum() <= 0) {
            throw new IllegalArgumentException("Initial balance must be positive: " + initialBalance);
        }
        this.balance = initialBalance;
        this.dayOpeningBalance = initialBalance;
        this.dailyLossLimitFraction = risk.dailyLossLimitFraction() == null
            ? BigDecimal.ZERO : risk.dailyLossLimitFraction();
        this.maxOpenPositions = risk.maxOpenPositions();
        this.maxDailyTrades = risk.maxDailyTrades();
        this.maxConsecutiveLosses = risk.maxConsecutiveLosses();
        this.lossCooldown = Duration.ofMinutes(risk.lossCooldownMinutes());
        this.winCooldown = Duration.ofMinutes(risk.winCooldownMinutes());
        this.lossStreakPause = Duration.ofMinutes(risk.lossStreakPauseMinutes());
    }

    /**
     * Check the account limits, size a signal against the uncommitted balance and open the
     * position, atomically. The entry is filled across the instrument's spread before sizing.
     *
     * @throws RiskException         when a limit or sizing refuses the signal (nothing is committed)
     * @throws IllegalStateException when the instrument already has an open position
     */
    public Position open(Signal signal, InstrumentMeta meta, PositionSizer sizer, Instant openedAt) {
        lock.lock();
        try {
            if (openPositions.containsKey(signal.instrument())) {
                throw new IllegalStateException("Position already open for " + signal.instrument());
            }
            checkLimitsLocked(signal.instrument(), openedAt);

            Signal filled = signal.withSpread(meta.spread());
            BigDecimal available = balance.subtract(committedRiskLocked());
            OrderSize orderSize = sizer.size(available, filled.entry(), filled.stop(), meta, filled.sizeMultiplier());

            BigDecimal reserved = orderSize.stopUnits()
                .multiply(orderSize.quantity())
                .multiply(meta.unitValue())
                .setScale(8, RoundingMode.HALF_UP);
            Position position = new Position(filled, orderSize, reserved, openedAt);
            openPositions.put(signal.instrument(), position);
            dayTrades++;

            log.info("[ACCOUNT] Opened {} (available {}, reserved {})", position, available, reserved);
            return position;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Close the whole remaining size.
     */
    public ClosedTrade close(String instrument, BigDecimal exitPrice, Instant at,
                             ExitReason reason, InstrumentMeta meta) {
        lock.lock();
        try {
            Position position = openPositions.remove(instrument);
            if (position == null) {
                throw new IllegalStateException("No open position for " + instrument);
            }
            BigDecimal pnl = position.pnl(exitPrice, position.getSize(), meta);
            realizeLocked(pnl, at);
            BigDecimal outcome = pnl.add(partialRealized.getOrDefault(instrument, BigDecimal.ZERO));
            partialRealized.remove(instrument);
            recordOutcomeLocked(instrument, outcome, at);

            ClosedTrade trade = new ClosedTrade(instrument, position.getDirection(), position.getEntry(),
                exitPrice, position.getSize(), pnl, position.getOpenedAt(), at, reason);
            log.info("[ACCOUNT] Closed {} {} @ {} pnl={} balance={}", instrument, reason, exitPrice, pnl, balance);
            return trade;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Close part of an open position. The rest stays open.
     */
    public ClosedTrade closePartial(String instrument, BigDecimal quantity, BigDecimal exitPrice,
                                    Instant at, InstrumentMeta meta) {
        lock.lock();
        try {
            Position position = openPositions.get(instrument);
            if (position == null) {
                throw new IllegalStateException("No open position for " + instrument);
            }
            BigDecimal pnl = position.pnl(exitPrice, quantity, meta);
            position.reduce(quantity);
            realizeLocked(pnl, at);
            partialRealized.merge(instrument, pnl, BigDecimal::add);

            log.info("[ACCOUNT] Partial close {} {} @ {} pnl={} remaining={}",
                instrument, quantity, exitPrice, pnl, position.getSize());
            return new ClosedTrade(instrument, position.getDirection(), position.getEntry(),
                exitPrice, quantity, pnl, position.getOpenedAt(), at, ExitReason.PARTIAL);
        } finally {
            lock.unlock();
        }
    }

    /**
     * True once the day's realized loss has reached the limit. Rolls the day first.
     */
    public boolean isSuppressed(Instant at) {
        lock.lock();
        try {
            rollDayLocked(at);
            if (dailyLossLimitFraction.signum() <= 0) {
                return false;
            }
            BigDecimal limit = dayOpeningBalance.multiply(dailyLossLimitFraction);
            return dayRealized.negate().compareTo(limit) >= 0;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean hasOpenPosition(String instrument) {
        lock.lock();
        try {
            return openPositions.containsKey(instrument);
        } finally {
            lock.unlock();
        }
    }

    public Position getPosition(String instrument) {
        lock.lock();
        try {
            return openPositions.get(instrument);
        } finally {
            lock.unlock();
        }
    }

    public List<Position> getOpenPositions() {
        lock.lock();
        try {
            return new ArrayList<>(openPositions.values());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Balance plus unrealized P&L of open positions at the given marks.
     * Positions without a mark are valued at entry.
     */
    public BigDecimal equity(Map<String, BigDecimal> marks, Map<String, InstrumentMeta> instruments) {
        lock.lock();
        try {
            BigDecimal equity = balance;
            for (Position position : openPositions.values()) {
                BigDecimal mark = marks.getOrDefault(position.getInstrument(), position.getEntry());
                equity = equity.add(position.unrealizedPnl(mark, instruments.get(position.getInstrument())));
            }
            return equity;
        } finally {
            lock.unlock();
        }
    }

    public BigDecimal getBalance() {
        lock.lock();
        try {
            return balance;
        } finally {
            lock.unlock();
        }
    }

    public BigDecimal getCommittedRisk() {
        lock.lock();
        try {
            return committedRiskLocked();
        } finally {
            lock.unlock();
        }
    }

    public BigDecimal getDailyRealized() {
        lock.lock();
        try {
            return dayRealized;
        } finally {
            lock.unlock();
        }
    }

    private BigDecimal committedRiskLocked() {
        BigDecimal total = BigDecimal.ZERO;
        for (Position position : openPositions.values()) {
            total = total.add(position.getReservedRisk());
        }
        return total;
    }

    private void checkLimitsLocked(String instrument, Instant at) {
        rollDayLocked(at);
        if (maxOpenPositions > 0 && openPositions.size() >= maxOpenPositions) {
            throw new RiskException(RiskException.Kind.MAX_OPEN_POSITIONS, instrument,
                openPositions.size() + " positions open (max " + maxOpenPositions + ")");
        }
        if (maxDailyTrades > 0 && dayTrades >= maxDailyTrades) {
            throw new RiskException(RiskException.Kind.DAILY_TRADE_LIMIT, instrument,
                dayTrades + " positions opened on " + day + " (max " + maxDailyTrades + ")");
        }
        Instant paused = pausedUntil.get(instrument);
        if (paused != null && at.isBefore(paused)) {
            throw new RiskException(RiskException.Kind.LOSS_STREAK_PAUSE, instrument, "paused until " + paused);
        }
        Instant cooldown = cooldownUntil.get(instrument);
        if (cooldown != null && at.isBefore(cooldown)) {
            throw new RiskException(RiskException.Kind.COOLDOWN, instrument, "cooling down until " + cooldown);
        }
    }

    private void recordOutcomeLocked(String instrument, BigDecimal outcome, Instant at) {
        if (outcome.signum() < 0) {
            int streak = lossStreak.merge(instrument, 1, Integer::sum);
            cooldownUntil.put(instrument, at.plus(lossCooldown));
            if (maxConsecutiveLosses > 0 && streak >= maxConsecutiveLosses) {
                pausedUntil.put(instrument, at.plus(lossStreakPause));
                lossStreak.remove(instrument);
                log.warn("[ACCOUNT] {} lost {} positions in a row, paused until {}",
                    instrument, streak, at.plus(lossStreakPause));
            }
        } else if (outcome.signum() > 0) {
            lossStreak.remove(instrument);
            cooldownUntil.put(instrument, at.plus(winCooldown));
        }
    }

    private void realizeLocked(BigDecimal pnl, Instant at) {
        rollDayLocked(at);
        balance = balance.add(pnl);
        dayRealized = dayRealized.add(pnl);
    }

    private void rollDayLocked(Instant at) {
        LocalDate today = LocalDate.ofInstant(at, ZoneOffset.UTC);
        if (day == null || !today.equals(day)) {
            if (day != null) {
                log.debug("[ACCOUNT] Day {} closed with realized {}", day, dayRealized);
            }
            day = today;
            dayOpeningBalance = balance;
            dayRealized = BigDecimal.ZERO;
            dayTrades = 0;
        }
    }
}
