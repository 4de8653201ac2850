package in.zonetrader.domain.backtest;

import in.zonetrader.domain.trade.ClosedTrade;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Run-level statistics.
 *
 * totalTrades, wins, losses and winRate count trade records, so a partial close is a record
 * of its own. positions, positionWins and positionWinRate count each position once, on its
 * total realized P&L.
 *
 * Ratios that are undefined for the run (profit factor without losses, recovery factor
 * without drawdown) are null.
 */
public record BacktestSummary(
    BigDecimal initialBalance,
    BigDecimal finalBalance,
    BigDecimal netProfit,
    int totalTrades,
    int wins,
    int losses,
    BigDecimal winRate,             // Percent
    int positions,
    int positionWins,
    BigDecimal positionWinRate,     // Percent
    BigDecimal profitFactor,
    BigDecimal maxDrawdown,         // Money
    BigDecimal maxDrawdownPercent,
    BigDecimal sharpeRatio,         // Annualized from daily equity returns
    BigDecimal recoveryFactor,
    BigDecimal averageWin,
    BigDecimal averageLoss,
    BigDecimal largestWin,
    BigDecimal largestLoss,
    List<ClosedTrade> trades,
    List<EquityPoint> equityCurve,
    Map<String, InstrumentReport> instruments
) {
    public BacktestSummary {
        trades = List.copyOf(trades);
        equityCurve = List.copyOf(equityCurve);
        instruments = Collections.unmodifiableMap(new TreeMap<>(instruments));
    }

    public String getSummary() {
        return String.format(
            "Trades=%d WinRate=%s%% Positions=%d PositionWinRate=%s%% PF=%s MaxDD=%s (%s%%) Sharpe=%s Net=%s",
            totalTrades, winRate, positions, positionWinRate, profitFactor, maxDrawdown, maxDrawdownPercent, sharpeRatio, netProfit);
    }
}
