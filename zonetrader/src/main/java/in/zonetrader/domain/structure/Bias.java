package in.zonetrader.domain.structure;

import in.zonetrader.domain.data.Direction;

/**
 * Directional bias derived from structural breaks.
 */
public enum Bias {
    BULLISH,
    BEARISH,
    RANGING;

    /**
     * Check if this bias agrees with a trade direction.
     */
    public boolean alignsWith(Direction direction) {
        return (this == BULLISH && direction == Direction.LONG)
            || (this == BEARISH && direction == Direction.SHORT);
    }

    /**
     * Check if this bias opposes a trade direction. RANGING opposes nothing.
     */
    public boolean opposes(Direction direction) {
        return (this == BULLISH && direction == Direction.SHORT)
            || (this == BEARISH && direction == Direction.LONG);
    }
}
