package in.zonetrader.domain.trade;

import in.zonetrader.domain.data.Direction;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Realized (full or partial) close of a position.
 */
public record ClosedTrade(
    String instrument,
    Direction direction,
    BigDecimal entry,
    BigDecimal exit,
    BigDecimal size,
    BigDecimal pnl,
    Instant openTime,
    Instant closeTime,
    ExitReason exitReason
) {
    public boolean isWin() {
        return pnl.signum() > 0;
    }
}
