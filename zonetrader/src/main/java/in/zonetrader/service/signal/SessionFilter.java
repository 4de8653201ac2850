package in.zonetrader.service.signal;

import in.zonetrader.config.SessionConfig;
import in.zonetrader.domain.data.InstrumentClass;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;

/**
 * Session Filter - Decides whether a bar falls inside a trading session.
 */
public final class SessionFilter {

    private final SessionConfig config;

    public SessionFilter(SessionConfig config) {
        if (!config.isValid()) {
            throw new IllegalArgumentException("Invalid session config: " + config);
        }
        this.config = config;
    }

    /**
     * True when the gate is off, the class is exempt, or the time is inside a window.
     */
    public boolean isOpen(InstrumentClass instrumentClass, Instant at) {
        if (!config.enabled() || config.exemptClasses().contains(instrumentClass)) {
            return true;
        }
        LocalTime time = LocalTime.ofInstant(at, ZoneOffset.UTC);
        return config.windows().stream().anyMatch(window -> window.contains(time));
    }
}
