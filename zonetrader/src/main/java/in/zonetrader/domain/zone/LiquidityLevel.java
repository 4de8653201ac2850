package in.zonetrader.domain.zone;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A watched prior extreme. Consumed once swept; never revived.
 */
public final class LiquidityLevel {

    private final BigDecimal price;
    private final LiquiditySource source;
    private final Instant createdAt;
    private Instant consumedAt;

    public LiquidityLevel(BigDecimal price, LiquiditySource source, Instant createdAt) {
        this.price = price;
        this.source = source;
        this.createdAt = createdAt;
    }

    public void consume(Instant at) {
        if (consumedAt != null) {
            throw new IllegalStateException("Liquidity level " + this + " already consumed at " + consumedAt);
        }
        consumedAt = at;
    }

    public boolean isConsumed() {
        return consumedAt != null;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public LiquiditySource getSource() {
        return source;
    }

    public LiquiditySide getSide() {
        return source.getSide();
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getConsumedAt() {
        return consumedAt;
    }

    @Override
    public String toString() {
        return source + "@" + price;
    }
}
