package in.zonetrader.domain.structure;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Confirmed swing extreme.
 *
 * timestamp is the bar that made the extreme, confirmedAt the bar that confirmed it.
 * A swing is never visible to bars before confirmedAt.
 */
public record SwingPoint(
    Instant timestamp,
    BigDecimal price,
    SwingKind kind,
    Instant confirmedAt
) {
    public SwingPoint {
        if (!timestamp.isBefore(confirmedAt)) {
            throw new IllegalArgumentException(
                String.format("Swing at %s cannot be confirmed at %s", timestamp, confirmedAt));
        }
    }
}
