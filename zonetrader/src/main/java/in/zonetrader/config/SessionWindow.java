package in.zonetrader.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalTime;

/**
 * A daily trading window in UTC, start inclusive and end exclusive.
 * A window whose end is before its start wraps past midnight.
 */
public record SessionWindow(
    @JsonProperty("name")
    String name,

    @JsonProperty("start")
    LocalTime start,

    @JsonProperty("end")
    LocalTime end
) {
    public boolean contains(LocalTime time) {
        if (start.isBefore(end)) {
            return !time.isBefore(start) && time.isBefore(end);
        }
        return !time.isBefore(start) || time.isBefore(end);
    }

    public boolean isValid() {
        return name != null && start != null && end != null && !start.equals(end);
    }
}
