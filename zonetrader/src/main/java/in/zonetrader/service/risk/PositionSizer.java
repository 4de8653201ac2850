package in.zonetrader.service.risk;

import in.zonetrader.config.RiskConfig;
import in.zonetrader.domain.data.InstrumentMeta;
import in.zonetrader.domain.trade.OrderSize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Position Sizer - Risk-budget size with hard safety caps.
 *
 * stopUnits = |entry - stop| / priceUnit
 * raw       = balance x riskFraction / (stopUnits x unitValue) x multiplier
 *
 * Applied in order:
 * 1. Instrument-class absolute max
 * 2. Global absolute max
 * 3. Round down to the minimum increment
 *
 * A raw size above sanityMultiple x globalMax is an anomaly: it is logged and the size is
 * forced to the minimum increment, never clamped to the max.
 *
 * Fails closed with {@link RiskException}; never returns a size for bad inputs.
 */
public final class PositionSizer {
    private static final Logger log = LoggerFactory.getLogger(PositionSizer.class);

    private static final int SCALE = 10;

    private final RiskConfig config;

    public PositionSizer(RiskConfig config) {
        if (!config.isValid()) {
            throw new IllegalArgumentException("Invalid risk config: " + config);
        }
        this.config = config;
    }

    public OrderSize size(BigDecimal balance, BigDecimal entry, BigDecimal stop, InstrumentMeta meta) {
        return size(balance, entry, stop, meta, BigDecimal.ONE);
    }

    /**
     * Size an order.
     *
     * @param balance    Balance available to risk against
     * @param entry      Entry price
     * @param stop       Protective stop price
     * @param meta       Instrument metadata (unit value must be explicit)
     * @param multiplier Confidence multiplier (0..1]
     * @throws RiskException when the size cannot be computed safely
     */
    public OrderSize size(BigDecimal balance, BigDecimal entry, BigDecimal stop,
                          InstrumentMeta meta, BigDecimal multiplier) {
        String symbol = meta.symbol();

        if (!meta.hasResolvedUnitValue()) {
            throw new RiskException(RiskException.Kind.UNRESOLVED_UNIT_VALUE, symbol,
                "unit value " + meta.unitValue() + " is not usable");
        }
        if (meta.priceUnit() == null || meta.priceUnit().signum() <= 0) {
            throw new RiskException(RiskException.Kind.UNRESOLVED_UNIT_VALUE, symbol,
                "price unit " + meta.priceUnit() + " is not usable");
        }
        if (meta.minIncrement() == null || meta.minIncrement().signum() <= 0) {
            throw new RiskException(RiskException.Kind.BELOW_MINIMUM_SIZE, symbol,
                "minimum increment " + meta.minIncrement() + " is not usable");
        }

        BigDecimal stopUnits = entry.subtract(stop).abs().divide(meta.priceUnit(), SCALE, RoundingMode.HALF_UP);
        if (stopUnits.signum() <= 0) {
            throw new RiskException(RiskException.Kind.NON_POSITIVE_STOP, symbol,
                String.format("entry %s, stop %s", entry, stop));
        }

        BigDecimal riskAmount = balance.multiply(config.riskFraction());
        if (riskAmount.signum() <= 0) {
            throw new RiskException(RiskException.Kind.BELOW_MINIMUM_SIZE, symbol,
                "no risk budget on balance " + balance);
        }

        BigDecimal m = multiplier == null ? BigDecimal.ONE : multiplier;
        BigDecimal raw = riskAmount
            .divide(stopUnits.multiply(meta.unitValue()), SCALE, RoundingMode.DOWN)
            .multiply(m);

        BigDecimal classMax = config.maxSizeFor(meta.instrumentClass());
        BigDecimal globalMax = config.globalMaxSize();
        Map<String, BigDecimal> constraints = new LinkedHashMap<>();
        constraints.put("RISK", raw);
        constraints.put("CLASS_MAX", classMax);
        constraints.put("GLOBAL_MAX", globalMax);

        BigDecimal sanityBound = globalMax.multiply(config.sanityMultiple());
        if (raw.compareTo(sanityBound) > 0) {
            AnomalySizeException anomaly = new AnomalySizeException(symbol, raw, sanityBound);
            log.error("[RISK] {}", anomaly.getMessage(), anomaly);
            return new OrderSize(meta.minIncrement(), raw, stopUnits, riskAmount, "ANOMALY", constraints, true);
        }

        BigDecimal quantity = raw;
        String limiting = "RISK";

        // 1. Instrument-class max
        if (quantity.compareTo(classMax) > 0) {
            quantity = classMax;
            limiting = "CLASS_MAX";
        }

        // 2. Global max
        if (quantity.compareTo(globalMax) > 0) {
            quantity = globalMax;
            limiting = "GLOBAL_MAX";
        }

        // 3. Round down to the minimum increment
        BigDecimal steps = quantity.divide(meta.minIncrement(), 0, RoundingMode.DOWN);
        quantity = steps.multiply(meta.minIncrement());
        if (quantity.signum() <= 0) {
            throw new RiskException(RiskException.Kind.BELOW_MINIMUM_SIZE, symbol,
                String.format("raw size %s below minimum increment %s", raw.toPlainString(), meta.minIncrement()));
        }

        OrderSize result = new OrderSize(quantity, raw, stopUnits, riskAmount, limiting, constraints, false);
        log.debug("[RISK] {} {}", symbol, result.getSummary());
        return result;
    }
}
