package in.zonetrader.domain.zone;

public enum RangeZone {
    DISCOUNT,
    EQUILIBRIUM,
    PREMIUM
}
