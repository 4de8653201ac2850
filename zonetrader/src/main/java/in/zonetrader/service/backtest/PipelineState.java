package in.zonetrader.service.backtest;

/**
 * Per-instrument replay state.
 *
 * IDLE -> SIGNAL_PENDING -> POSITION_OPEN -> IDLE; HALTED is terminal.
 */
public enum PipelineState {
    IDLE,
    SIGNAL_PENDING,
    POSITION_OPEN,
    HALTED
}
