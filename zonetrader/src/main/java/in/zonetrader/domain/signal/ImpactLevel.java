package in.zonetrader.domain.signal;

/**
 * Impact tag of a scheduled external event.
 */
public enum ImpactLevel {
    NONE,
    LOW,
    MEDIUM,
    HIGH
}
