package in.zonetrader.domain.trade;

/**
 * Stop regime of an open position.
 */
public enum ManagementState {
    INITIAL,        // Original protective stop
    BREAK_EVEN,     // Stop moved to entry (+ offset)
    TRAILING        // Stop follows the best price
}
