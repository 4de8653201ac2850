package in.zonetrader.domain.zone;

import in.zonetrader.domain.data.Direction;

/**
 * Side a zone supports: BULLISH zones are demand (long reactions), BEARISH zones supply.
 */
public enum Polarity {
    BULLISH,
    BEARISH;

    public Polarity opposite() {
        return this == BULLISH ? BEARISH : BULLISH;
    }

    public Direction toDirection() {
        return this == BULLISH ? Direction.LONG : Direction.SHORT;
    }

    public static Polarity of(Direction direction) {
        return direction == Direction.LONG ? BULLISH : BEARISH;
    }
}
