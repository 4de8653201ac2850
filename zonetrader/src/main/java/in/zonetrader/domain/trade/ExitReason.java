package in.zonetrader.domain.trade;

/**
 * Exit reasons for closed trades.
 */
public enum ExitReason {
    STOP_LOSS,          // Original stop hit
    BREAK_EVEN_STOP,    // Stop hit after a break-even move
    TRAILING_STOP,      // Trailing stop hit
    TARGET,             // Price reached target
    PARTIAL,            // Part of the size closed at the partial trigger
    DATA_HALT,          // Instrument halted on a data error
    END_OF_DATA         // Closed at the final bar of the run
}
