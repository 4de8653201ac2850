package in.zonetrader.domain.structure;

public enum SwingKind {
    HIGH,
    LOW
}
