package in.zonetrader.domain.zone;

public enum LiquiditySource {
    PREVIOUS_DAY_HIGH(LiquiditySide.BUY_SIDE, 2),
    PREVIOUS_DAY_LOW(LiquiditySide.SELL_SIDE, 2),
    EQUAL_HIGHS(LiquiditySide.BUY_SIDE, 3),
    EQUAL_LOWS(LiquiditySide.SELL_SIDE, 3),
    SWING_HIGH(LiquiditySide.BUY_SIDE, 1),
    SWING_LOW(LiquiditySide.SELL_SIDE, 1);

    private final LiquiditySide side;
    private final int rank;

    LiquiditySource(LiquiditySide side, int rank) {
        this.side = side;
        this.rank = rank;
    }

    public LiquiditySide getSide() {
        return side;
    }

    /**
     * Higher rank replaces a lower-ranked level at the same price.
     */
    public int getRank() {
        return rank;
    }
}
