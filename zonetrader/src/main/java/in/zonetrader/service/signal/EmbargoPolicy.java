package in.zonetrader.service.signal;

import in.zonetrader.config.EmbargoConfig;
import in.zonetrader.domain.signal.ImpactLevel;

import java.time.Duration;

/**
 * Embargo decision as a pure function of (impact, lead time).
 *
 * Lead time is signed: positive before the event, negative after it.
 * An event embargoes trading while |lead time| <= its impact's window.
 * NONE never embargoes; a zero window never embargoes.
 */
public final class EmbargoPolicy {

    private final EmbargoConfig config;

    public EmbargoPolicy(EmbargoConfig config) {
        if (!config.isValid()) {
            throw new IllegalArgumentException("Invalid embargo config: " + config);
        }
        this.config = config;
    }

    public boolean isEmbargoed(ImpactLevel impact, Duration leadTime) {
        Duration window = window(impact);
        if (window.isZero()) {
            return false;
        }
        return leadTime.abs().compareTo(window) <= 0;
    }

    public Duration window(ImpactLevel impact) {
        return switch (impact) {
            case HIGH -> Duration.ofMinutes(config.highImpactLeadMinutes());
            case MEDIUM -> Duration.ofMinutes(config.mediumImpactLeadMinutes());
            case LOW -> Duration.ofMinutes(config.lowImpactLeadMinutes());
            case NONE -> Duration.ZERO;
        };
    }
}
