package in.zonetrader.service.backtest;

import in.zonetrader.config.ManagementConfig;
import in.zonetrader.domain.data.Candle;
import in.zonetrader.domain.data.Direction;
import in.zonetrader.domain.data.InstrumentMeta;
import in.zonetrader.domain.trade.ClosedTrade;
import in.zonetrader.domain.trade.ExitReason;
import in.zonetrader.domain.trade.ManagementState;
import in.zonetrader.domain.trade.Position;
import in.zonetrader.service.risk.AccountState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Trade Manager - Applies exit checks and management rules to an open position, one bar at a time.
 *
 * Fixed order per bar:
 * 1. Stop hit (fills at the stop, or at the open when the bar gaps through it)
 * 2. Target hit (same fill rule)
 * 3. Trailing stop update
 * 4. Break-even move
 * 5. Partial close
 *
 * Exit checks run before any management update of the same bar, and a stop wins over a target
 * when one bar touches both.
 */
public final class TradeManager {
    private static final Logger log = LoggerFactory.getLogger(TradeManager.class);

    private final ManagementConfig config;
    private final AccountState account;

    public TradeManager(ManagementConfig config, AccountState account) {
        if (!config.isValid()) {
            throw new IllegalArgumentException("Invalid management config: " + config);
        }
        this.config = config;
        this.account = account;
    }

    /**
     * Process one bar for an open position.
     *
     * @return Trades realized on this bar (a partial close, a full close, or nothing)
     */
    public List<ClosedTrade> onBar(Position position, Candle bar, InstrumentMeta meta) {
        List<ClosedTrade> closed = new ArrayList<>(1);
        String instrument = position.getInstrument();
        boolean isLong = position.getDirection() == Direction.LONG;

        // 1. Stop
        BigDecimal stop = position.getStop();
        boolean stopHit = isLong ? bar.low().compareTo(stop) <= 0 : bar.high().compareTo(stop) >= 0;
        if (stopHit) {
            BigDecimal fill = gapFill(isLong ? bar.open().compareTo(stop) <= 0 : bar.open().compareTo(stop) >= 0,
                bar.open(), stop);
            closed.add(account.close(instrument, fill, bar.timestamp(), stopReason(position), meta));
            return closed;
        }

        // 2. Target
        BigDecimal target = position.getTarget();
        boolean targetHit = isLong ? bar.high().compareTo(target) >= 0 : bar.low().compareTo(target) <= 0;
        if (targetHit) {
            BigDecimal fill = gapFill(isLong ? bar.open().compareTo(target) >= 0 : bar.open().compareTo(target) <= 0,
                bar.open(), target);
            closed.add(account.close(instrument, fill, bar.timestamp(), ExitReason.TARGET, meta));
            return closed;
        }

        position.observeExtreme(bar.high(), bar.low());
        BigDecimal r = position.initialRisk();
        if (r.signum() <= 0) {
            return closed;
        }
        BigDecimal excursion = position.favourableExcursion();
        BigDecimal sign = position.getDirection().sign();

        // 3. Trailing stop
        if (config.trailingEnabled()
                && excursion.compareTo(r.multiply(config.trailingActivationR())) >= 0) {
            BigDecimal trail = position.getBestPrice().subtract(r.multiply(config.trailingDistanceR()).multiply(sign));
            if (position.tightenStop(trail, ManagementState.TRAILING)) {
                log.debug("[MANAGE] {} trailing stop -> {}", instrument, trail);
            }
        }

        // 4. Break-even
        if (config.breakEvenEnabled() && !position.isBreakEvenApplied()
                && excursion.compareTo(r.multiply(config.breakEvenTriggerR())) >= 0) {
            BigDecimal breakEven = position.getEntry().add(r.multiply(config.breakEvenOffsetR()).multiply(sign));
            if (position.tightenStop(breakEven, ManagementState.BREAK_EVEN)) {
                log.debug("[MANAGE] {} break-even stop -> {}", instrument, breakEven);
            } else {
                position.markBreakEvenApplied();
            }
        }

        // 5. Partial close
        if (config.partialEnabled() && !position.isPartialTaken()
                && excursion.compareTo(r.multiply(config.partialTriggerR())) >= 0) {
            BigDecimal quantity = position.getSize()
                .multiply(config.partialFraction())
                .divide(meta.minIncrement(), 0, RoundingMode.DOWN)
                .multiply(meta.minIncrement());
            BigDecimal remaining = position.getSize().subtract(quantity);
            if (quantity.signum() > 0 && remaining.compareTo(meta.minIncrement()) >= 0) {
                BigDecimal level = position.getEntry().add(r.multiply(config.partialTriggerR()).multiply(sign));
                boolean openedBeyond = isLong ? bar.open().compareTo(level) >= 0 : bar.open().compareTo(level) <= 0;
                BigDecimal fill = gapFill(openedBeyond, bar.open(), level);
                closed.add(account.closePartial(instrument, quantity, fill, bar.timestamp(), meta));
            } else {
                position.markPartialTaken();
            }
        }

        return closed;
    }

    private static BigDecimal gapFill(boolean gapped, BigDecimal open, BigDecimal level) {
        return gapped ? open : level;
    }

    private static ExitReason stopReason(Position position) {
        return switch (position.getManagementState()) {
            case TRAILING -> ExitReason.TRAILING_STOP;
            case BREAK_EVEN -> ExitReason.BREAK_EVEN_STOP;
            case INITIAL -> ExitReason.STOP_LOSS;
        };
    }
}
