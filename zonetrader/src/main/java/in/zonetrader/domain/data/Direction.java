package in.zonetrader.domain.data;

import java.math.BigDecimal;

/**
 * Trade direction.
 */
public enum Direction {
    LONG(BigDecimal.ONE),
    SHORT(BigDecimal.ONE.negate());

    private final BigDecimal sign;

    Direction(BigDecimal sign) {
        this.sign = sign;
    }

    /**
     * +1 for LONG, -1 for SHORT.
     */
    public BigDecimal sign() {
        return sign;
    }

    public Direction opposite() {
        return this == LONG ? SHORT : LONG;
    }
}
