package in.zonetrader.domain.zone;

public enum ZoneKind {
    ORDER_BLOCK,    // Last counter-direction bar before an impulse
    GAP,            // 3-bar imbalance
    SWEEP_LEVEL     // Rejected liquidity grab
}
