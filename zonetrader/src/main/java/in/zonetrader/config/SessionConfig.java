package in.zonetrader.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.zonetrader.domain.data.InstrumentClass;

import java.time.LocalTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Trading session gate. When enabled, bars outside every window are not scored,
 * except for instrument classes that trade around the clock.
 */
public record SessionConfig(
    @JsonProperty("enabled")
    boolean enabled,

    @JsonProperty("windows")
    List<SessionWindow> windows,

    @JsonProperty("exemptClasses")
    Set<InstrumentClass> exemptClasses
) {
    public static SessionConfig defaults() {
        return new SessionConfig(
            false,
            List.of(
                new SessionWindow("London", LocalTime.of(7, 0), LocalTime.of(16, 0)),
                new SessionWindow("New York", LocalTime.of(12, 0), LocalTime.of(21, 0))
            ),
            EnumSet.of(InstrumentClass.DIGITAL_ASSET)
        );
    }

    public boolean isValid() {
        if (windows == null || exemptClasses == null) {
            return false;
        }
        if (enabled && windows.isEmpty()) {
            return false;
        }
        return windows.stream().allMatch(SessionWindow::isValid);
    }
}
