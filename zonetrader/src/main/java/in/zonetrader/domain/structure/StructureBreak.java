package in.zonetrader.domain.structure;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A close beyond the most recent confirmed opposite swing.
 */
public record StructureBreak(
    Instant timestamp,
    Bias direction,        // BULLISH or BEARISH
    BreakType type,
    SwingPoint brokenSwing,
    BigDecimal closePrice
) {
    public boolean isCharacterChange() {
        return type == BreakType.CHARACTER_CHANGE;
    }
}
