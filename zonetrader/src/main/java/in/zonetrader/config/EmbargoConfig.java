package in.zonetrader.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lead windows around scheduled events, in minutes, by impact level.
 * Trading is embargoed from lead minutes before an event until lead minutes after it.
 */
public record EmbargoConfig(
    @JsonProperty("highImpactLeadMinutes")
    int highImpactLeadMinutes,

    @JsonProperty("mediumImpactLeadMinutes")
    int mediumImpactLeadMinutes,

    @JsonProperty("lowImpactLeadMinutes")
    int lowImpactLeadMinutes
) {
    public static EmbargoConfig defaults() {
        return new EmbargoConfig(30, 15, 0);
    }

    public boolean isValid() {
        return highImpactLeadMinutes >= 0 && mediumImpactLeadMinutes >= 0 && lowImpactLeadMinutes >= 0;
    }
}
