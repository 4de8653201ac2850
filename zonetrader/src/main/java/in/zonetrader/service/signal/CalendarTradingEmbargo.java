package in.zonetrader.service.signal;

import in.zonetrader.domain.signal.ScheduledEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Embargo oracle backed by a fixed calendar of scheduled events.
 */
public final class CalendarTradingEmbargo implements TradingEmbargo {
    private static final Logger log = LoggerFactory.getLogger(CalendarTradingEmbargo.class);

    private final List<ScheduledEvent> events;
    private final EmbargoPolicy policy;

    public CalendarTradingEmbargo(List<ScheduledEvent> events, EmbargoPolicy policy) {
        this.events = List.copyOf(events);
        this.policy = policy;
    }

    @Override
    public boolean isTradingPermitted(String instrument, Instant time) {
        for (ScheduledEvent event : events) {
            if (!event.affects(instrument)) {
                continue;
            }
            Duration lead = Duration.between(time, event.time());
            if (policy.isEmbargoed(event.impact(), lead)) {
                log.debug("[EMBARGO] {} blocked @ {} by {} ({})", instrument, time, event.title(), event.impact());
                return false;
            }
        }
        return true;
    }

    public int size() {
        return events.size();
    }
}
