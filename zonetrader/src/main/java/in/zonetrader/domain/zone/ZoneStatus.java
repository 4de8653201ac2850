package in.zonetrader.domain.zone;

/**
 * Zone lifecycle. Transitions only move forward in declaration order.
 *
 * FRESH -> TESTED -> INVALIDATED -> FLIPPED
 * FLIPPED is reachable only for gaps and only from INVALIDATED.
 */
public enum ZoneStatus {
    FRESH,
    TESTED,
    INVALIDATED,
    FLIPPED;

    /**
     * Zones a signal may react from.
     */
    public boolean isReactive() {
        return this != INVALIDATED;
    }
}
