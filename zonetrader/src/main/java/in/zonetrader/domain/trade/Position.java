package in.zonetrader.domain.trade;

import in.zonetrader.domain.data.Direction;
import in.zonetrader.domain.data.InstrumentMeta;
import in.zonetrader.domain.signal.Signal;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Open simulated position. Mutated in place by management rules.
 *
 * The stop only ever moves in the position's favour.
 */
public final class Position {

    private static final int PNL_SCALE = 8;

    private final String instrument;
    private final Direction direction;
    private final BigDecimal entry;
    private final BigDecimal initialStop;
    private final BigDecimal target;
    private final BigDecimal initialSize;
    private final Instant openedAt;
    private final OrderSize orderSize;
    private final BigDecimal confidence;

    private BigDecimal stop;
    private BigDecimal size;
    private BigDecimal bestPrice;
    private BigDecimal reservedRisk;
    private ManagementState managementState = ManagementState.INITIAL;
    private boolean breakEvenApplied;
    private boolean partialTaken;

    public Position(Signal signal, OrderSize orderSize, BigDecimal reservedRisk, Instant openedAt) {
        this.instrument = signal.instrument();
        this.direction = signal.direction();
        this.entry = signal.entry();
        this.initialStop = signal.stop();
        this.stop = signal.stop();
        this.target = signal.target();
        this.initialSize = orderSize.quantity();
        this.size = orderSize.quantity();
        this.orderSize = orderSize;
        this.confidence = signal.confidence();
        this.openedAt = openedAt;
        this.bestPrice = signal.entry();
        this.reservedRisk = reservedRisk;
    }

    /**
     * Realized P&L for closing a quantity at a price.
     *
     * pnl = (exit - entry) / priceUnit x quantity x sign x unitValue
     */
    public BigDecimal pnl(BigDecimal exitPrice, BigDecimal quantity, InstrumentMeta meta) {
        return exitPrice.subtract(entry)
            .divide(meta.priceUnit(), PNL_SCALE + 4, RoundingMode.HALF_UP)
            .multiply(quantity)
            .multiply(direction.sign())
            .multiply(meta.unitValue())
            .setScale(PNL_SCALE, RoundingMode.HALF_UP);
    }

    public BigDecimal unrealizedPnl(BigDecimal markPrice, InstrumentMeta meta) {
        return pnl(markPrice, size, meta);
    }

    /**
     * Initial stop distance (R) as a price difference.
     */
    public BigDecimal initialRisk() {
        return entry.subtract(initialStop).abs();
    }

    /**
     * Favourable excursion of the best price so far (price difference, never negative).
     */
    public BigDecimal favourableExcursion() {
        return bestPrice.subtract(entry).multiply(direction.sign()).max(BigDecimal.ZERO);
    }

    /**
     * Track the best price reached. LONG uses highs, SHORT uses lows.
     */
    public void observeExtreme(BigDecimal high, BigDecimal low) {
        if (direction == Direction.LONG) {
            bestPrice = bestPrice.max(high);
        } else {
            bestPrice = bestPrice.min(low);
        }
    }

    /**
     * Move the stop if the new level is better for the position.
     *
     * @return true if the stop moved
     */
    public boolean tightenStop(BigDecimal newStop, ManagementState state) {
        boolean better = direction == Direction.LONG
            ? newStop.compareTo(stop) > 0
            : newStop.compareTo(stop) < 0;
        if (!better) {
            return false;
        }
        stop = newStop;
        managementState = state;
        if (state == ManagementState.BREAK_EVEN) {
            breakEvenApplied = true;
        }
        return true;
    }

    /**
     * Reduce the open size after a partial close; reserved risk shrinks proportionally.
     */
    public void reduce(BigDecimal quantity) {
        if (quantity.signum() <= 0 || quantity.compareTo(size) >= 0) {
            throw new IllegalArgumentException(
                String.format("Cannot reduce %s position of %s by %s", instrument, size, quantity));
        }
        BigDecimal remaining = size.subtract(quantity);
        reservedRisk = reservedRisk.multiply(remaining).divide(size, PNL_SCALE, RoundingMode.HALF_UP);
        size = remaining;
        partialTaken = true;
    }

    public void markPartialTaken() {
        partialTaken = true;
    }

    public void markBreakEvenApplied() {
        breakEvenApplied = true;
    }

    public String getInstrument() {
        return instrument;
    }

    public Direction getDirection() {
        return direction;
    }

    public BigDecimal getEntry() {
        return entry;
    }

    public BigDecimal getInitialStop() {
        return initialStop;
    }

    public BigDecimal getStop() {
        return stop;
    }

    public BigDecimal getTarget() {
        return target;
    }

    public BigDecimal getInitialSize() {
        return initialSize;
    }

    public BigDecimal getSize() {
        return size;
    }

    public Instant getOpenedAt() {
        return openedAt;
    }

    public OrderSize getOrderSize() {
        return orderSize;
    }

    public BigDecimal getConfidence() {
        return confidence;
    }

    public BigDecimal getBestPrice() {
        return bestPrice;
    }

    public BigDecimal getReservedRisk() {
        return reservedRisk;
    }

    public ManagementState getManagementState() {
        return managementState;
    }

    public boolean isBreakEvenApplied() {
        return breakEvenApplied;
    }

    public boolean isPartialTaken() {
        return partialTaken;
    }

    @Override
    public String toString() {
        return String.format("Position[%s %s size=%s entry=%s stop=%s target=%s %s]",
            instrument, direction, size, entry, stop, target, managementState);
    }
}
