package in.zonetrader.domain.zone;

import java.math.BigDecimal;

/**
 * Price location inside the active swing range.
 *
 * position: 0 at the swing low, 1 at the swing high; may fall outside [0, 1]
 * optimal: inside the narrower sub-band of its DISCOUNT or PREMIUM zone
 */
public record RangePosition(
    BigDecimal position,
    RangeZone zone,
    boolean optimal
) {
}
