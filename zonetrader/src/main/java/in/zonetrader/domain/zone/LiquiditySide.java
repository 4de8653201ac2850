package in.zonetrader.domain.zone;

/**
 * BUY_SIDE liquidity rests above highs, SELL_SIDE below lows.
 */
public enum LiquiditySide {
    BUY_SIDE,
    SELL_SIDE
}
