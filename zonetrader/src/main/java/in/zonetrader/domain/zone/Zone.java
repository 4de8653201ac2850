package in.zonetrader.domain.zone;

import in.zonetrader.domain.data.Resolution;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Objects;

/**
 * A tracked reaction zone: price band [bottom, top] with a polarity and a lifecycle.
 *
 * Status only moves forward (see {@link ZoneStatus}). Polarity changes only when a gap flips.
 * A flipped zone that is later closed through is retired: it stays FLIPPED but no longer reacts.
 */
public final class Zone {
    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final String instrument;
    private final Resolution resolution;
    private final ZoneKind kind;
    private final BigDecimal top;
    private final BigDecimal bottom;
    private final Instant formedAt;

    private Polarity polarity;
    private ZoneStatus status = ZoneStatus.FRESH;
    private Instant lastTransitionAt;
    private BigDecimal fillPercent = BigDecimal.ZERO;
    private boolean retestedAfterInvalidation;
    private boolean retired;

    public Zone(String instrument, Resolution resolution, ZoneKind kind, Polarity polarity,
                BigDecimal top, BigDecimal bottom, Instant formedAt) {
        this.instrument = Objects.requireNonNull(instrument, "instrument");
        this.resolution = Objects.requireNonNull(resolution, "resolution");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.polarity = Objects.requireNonNull(polarity, "polarity");
        this.formedAt = Objects.requireNonNull(formedAt, "formedAt");
        if (top.compareTo(bottom) < 0) {
            throw new IllegalArgumentException(
                String.format("Zone top %s below bottom %s (%s %s @ %s)", top, bottom, kind, instrument, formedAt));
        }
        this.top = top;
        this.bottom = bottom;
        this.lastTransitionAt = formedAt;
    }

    /**
     * Move to a later status.
     *
     * @throws IllegalStateException on a backward move or a flip that is not allowed
     */
    public void transitionTo(ZoneStatus next, Instant at) {
        if (next.ordinal() <= status.ordinal()) {
            throw new IllegalStateException(
                String.format("Zone %s cannot move from %s to %s", key(), status, next));
        }
        if (next == ZoneStatus.FLIPPED) {
            if (kind != ZoneKind.GAP || status != ZoneStatus.INVALIDATED) {
                throw new IllegalStateException(
                    String.format("Zone %s cannot flip from %s", key(), status));
            }
            polarity = polarity.opposite();
        }
        status = next;
        lastTransitionAt = at;
    }

    /**
     * Record how much of the band has been traded through (percent, never above 100, never decreasing).
     */
    public void recordFill(BigDecimal percent) {
        BigDecimal capped = percent.min(HUNDRED).max(BigDecimal.ZERO);
        if (capped.compareTo(fillPercent) > 0) {
            fillPercent = capped.setScale(2, RoundingMode.HALF_UP);
        }
    }

    public void markRetestedAfterInvalidation() {
        retestedAfterInvalidation = true;
    }

    public void retire() {
        retired = true;
    }

    /**
     * Zone can still produce a reaction.
     */
    public boolean isActive() {
        return status.isReactive() && !retired;
    }

    /**
     * Inclusive band containment.
     */
    public boolean contains(BigDecimal price) {
        return price.compareTo(bottom) >= 0 && price.compareTo(top) <= 0;
    }

    /**
     * Price level whose close-through invalidates the zone: bottom for bullish, top for bearish.
     */
    public BigDecimal invalidationEdge() {
        return polarity == Polarity.BULLISH ? bottom : top;
    }

    public BigDecimal height() {
        return top.subtract(bottom);
    }

    /**
     * Unique within one instrument's zone book.
     */
    public String key() {
        return instrument + ":" + resolution + ":" + kind + ":" + formedAt;
    }

    public String getInstrument() {
        return instrument;
    }

    public Resolution getResolution() {
        return resolution;
    }

    public ZoneKind getKind() {
        return kind;
    }

    public Polarity getPolarity() {
        return polarity;
    }

    public ZoneStatus getStatus() {
        return status;
    }

    public BigDecimal getTop() {
        return top;
    }

    public BigDecimal getBottom() {
        return bottom;
    }

    public Instant getFormedAt() {
        return formedAt;
    }

    public Instant getLastTransitionAt() {
        return lastTransitionAt;
    }

    public BigDecimal getFillPercent() {
        return fillPercent;
    }

    public boolean isRetestedAfterInvalidation() {
        return retestedAfterInvalidation;
    }

    public boolean isRetired() {
        return retired;
    }

    @Override
    public String toString() {
        return String.format("Zone[%s %s %s [%s, %s] %s fill=%s%%]",
            kind, polarity, resolution, bottom, top, status, fillPercent);
    }
}
