package in.zonetrader.service.signal;

import java.time.Instant;

/**
 * Oracle deciding whether a new position may be opened at a given time.
 * Consulted once per prospective signal.
 */
public interface TradingEmbargo {

    TradingEmbargo ALWAYS_PERMITTED = (instrument, time) -> true;

    boolean isTradingPermitted(String instrument, Instant time);
}
