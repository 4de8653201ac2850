package in.zonetrader.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.zonetrader.domain.data.InstrumentMeta;
import in.zonetrader.domain.signal.ScheduledEvent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Complete configuration of a run. Every component receives its own section explicitly.
 */
public record EngineConfig(
    @JsonProperty("structure")
    StructureConfig structure,

    @JsonProperty("zones")
    ZoneConfig zones,

    @JsonProperty("scoring")
    ScoringConfig scoring,

    @JsonProperty("risk")
    RiskConfig risk,

    @JsonProperty("management")
    ManagementConfig management,

    @JsonProperty("backtest")
    BacktestConfig backtest,

    @JsonProperty("embargo")
    EmbargoConfig embargo,

    @JsonProperty("sessions")
    SessionConfig sessions,

    @JsonProperty("instruments")
    List<InstrumentMeta> instruments,

    @JsonProperty("events")
    List<ScheduledEvent> events
) {
    public static EngineConfig defaults() {
        return new EngineConfig(
            StructureConfig.defaults(),
            ZoneConfig.defaults(),
            ScoringConfig.defaults(),
            RiskConfig.defaults(),
            ManagementConfig.defaults(),
            BacktestConfig.defaults(),
            EmbargoConfig.defaults(),
            SessionConfig.defaults(),
            List.of(),
            List.of()
        );
    }

    /**
     * Fill missing sections with defaults.
     */
    public EngineConfig withDefaults() {
        return new EngineConfig(
            structure != null ? structure : StructureConfig.defaults(),
            zones != null ? zones : ZoneConfig.defaults(),
            scoring != null ? scoring : ScoringConfig.defaults(),
            risk != null ? risk : RiskConfig.defaults(),
            management != null ? management : ManagementConfig.defaults(),
            backtest != null ? backtest : BacktestConfig.defaults(),
            embargo != null ? embargo : EmbargoConfig.defaults(),
            sessions != null ? sessions : SessionConfig.defaults(),
            instruments != null ? instruments : List.of(),
            events != null ? events : List.of()
        );
    }

    /**
     * Instrument metadata keyed by symbol, in declaration order.
     */
    public Map<String, InstrumentMeta> instrumentsBySymbol() {
        Map<String, InstrumentMeta> bySymbol = new LinkedHashMap<>();
        for (InstrumentMeta meta : instruments) {
            bySymbol.put(meta.symbol(), meta);
        }
        return bySymbol;
    }

    /**
     * Names of invalid sections; empty when the configuration is usable.
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (!structure.isValid()) errors.add("structure");
        if (!zones.isValid()) errors.add("zones");
        if (!scoring.isValid()) errors.add("scoring");
        if (!risk.isValid()) errors.add("risk");
        if (!management.isValid()) errors.add("management");
        if (!backtest.isValid()) errors.add("backtest");
        if (!embargo.isValid()) errors.add("embargo");
        if (!sessions.isValid()) errors.add("sessions");
        for (InstrumentMeta meta : instruments) {
            if (meta.symbol() == null || meta.symbol().isBlank() || meta.instrumentClass() == null) {
                errors.add("instruments[" + meta.symbol() + "]");
            }
        }
        return errors;
    }
}
