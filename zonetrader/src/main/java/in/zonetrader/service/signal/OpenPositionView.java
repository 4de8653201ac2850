package in.zonetrader.service.signal;

/**
 * Read-only view of which instruments currently hold a position.
 */
public interface OpenPositionView {

    boolean hasOpenPosition(String instrument);
}
