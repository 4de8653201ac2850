package in.zonetrader.domain.signal;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Set;

/**
 * Scheduled external event that can embargo trading.
 *
 * An empty instrument set affects every instrument.
 */
public record ScheduledEvent(
    @JsonProperty("time")
    Instant time,

    @JsonProperty("impact")
    ImpactLevel impact,

    @JsonProperty("instruments")
    Set<String> instruments,

    @JsonProperty("title")
    String title
) {
    public boolean affects(String instrument) {
        return instruments == null || instruments.isEmpty() || instruments.contains(instrument);
    }
}
