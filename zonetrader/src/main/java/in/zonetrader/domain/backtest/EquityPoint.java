package in.zonetrader.domain.backtest;

import java.math.BigDecimal;
import java.time.Instant;

public record EquityPoint(
    Instant timestamp,
    BigDecimal balance,
    BigDecimal equity
) {
}
