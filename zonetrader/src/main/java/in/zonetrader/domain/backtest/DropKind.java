package in.zonetrader.domain.backtest;

/**
 * Why a signal did not become a position (or was flagged when it did).
 */
public enum DropKind {
    RISK_NON_POSITIVE_STOP,
    RISK_UNRESOLVED_UNIT_VALUE,
    RISK_BELOW_MINIMUM_SIZE,
    ANOMALY_SIZE,           // Position opened at the minimum increment
    EMBARGO,
    DAILY_LOSS_LIMIT,
    MAX_OPEN_POSITIONS,
    DAILY_TRADE_LIMIT,
    COOLDOWN,
    LOSS_STREAK_PAUSE
}
