package in.zonetrader.domain.trade;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of position sizing.
 *
 * quantity: final size after caps and rounding (or the minimum increment for an anomaly)
 * rawQuantity: size implied by the risk budget, before any cap
 * limitingConstraint: RISK, CLASS_MAX, GLOBAL_MAX or ANOMALY
 */
public record OrderSize(
    BigDecimal quantity,
    BigDecimal rawQuantity,
    BigDecimal stopUnits,
    BigDecimal riskAmount,                  // Balance x risk fraction
    String limitingConstraint,
    Map<String, BigDecimal> allConstraints, // Constraint name -> cap it imposed
    boolean anomaly
) {
    public OrderSize {
        allConstraints = Collections.unmodifiableMap(new LinkedHashMap<>(allConstraints));
    }

    public String getSummary() {
        return String.format("Qty=%s (limited by %s), raw=%s, stopUnits=%s%s",
            quantity.toPlainString(), limitingConstraint, rawQuantity.toPlainString(),
            stopUnits.toPlainString(), anomaly ? " ANOMALY" : "");
    }
}
