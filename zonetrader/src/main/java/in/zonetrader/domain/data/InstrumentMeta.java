package in.zonetrader.domain.data;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Static instrument metadata supplied by configuration.
 *
 * priceUnit: size of one price unit (e.g. 0.0001 for EURUSD, 0.01 for USDJPY)
 * unitValue: money value of a one-unit move for one unit of order size
 * minIncrement: smallest tradable size step
 * spread: bid/ask spread as a price difference, paid on entry (null = none)
 */
public record InstrumentMeta(
    @JsonProperty("symbol")
    String symbol,

    @JsonProperty("instrumentClass")
    InstrumentClass instrumentClass,

    @JsonProperty("priceUnit")
    BigDecimal priceUnit,

    @JsonProperty("unitValue")
    BigDecimal unitValue,           // null = unresolved, sizing fails closed

    @JsonProperty("minIncrement")
    BigDecimal minIncrement,

    @JsonProperty("spread")
    BigDecimal spread
) {
    public InstrumentMeta {
        if (spread == null) {
            spread = BigDecimal.ZERO;
        } else if (spread.signum() < 0) {
            throw new IllegalArgumentException("Spread must not be negative: " + spread);
        }
    }

    /**
     * Check whether the unit value is usable for sizing and P&L.
     */
    public boolean hasResolvedUnitValue() {
        return unitValue != null && unitValue.signum() > 0;
    }
}
