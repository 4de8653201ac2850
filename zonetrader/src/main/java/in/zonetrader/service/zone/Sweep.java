package in.zonetrader.service.zone;

import in.zonetrader.domain.zone.LiquidityLevel;
import in.zonetrader.domain.zone.LiquiditySide;
import in.zonetrader.domain.zone.Polarity;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * One bar's rejection of liquidity on one side.
 *
 * referenceLevel: the swept level closest to the wick extreme
 * reactionPolarity: BEARISH after a buy-side sweep, BULLISH after a sell-side sweep
 */
public record Sweep(
    Instant timestamp,
    LiquiditySide side,
    List<LiquidityLevel> levels,
    BigDecimal referenceLevel,
    BigDecimal wickExtreme
) {
    public Polarity reactionPolarity() {
        return side == LiquiditySide.BUY_SIDE ? Polarity.BEARISH : Polarity.BULLISH;
    }
}
