package in.zonetrader.service.backtest;

import in.zonetrader.domain.backtest.BacktestSummary;
import in.zonetrader.domain.backtest.EquityPoint;
import in.zonetrader.domain.backtest.InstrumentReport;
import in.zonetrader.domain.trade.ClosedTrade;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Performance Calculator - Run statistics from closed trades and the equity curve.
 *
 * - Win rate: winning trade records / all trade records (partial closes count as records)
 * - Position win rate: winning positions / all positions, a position's outcome being the sum
 *   of its partial and final closes
 * - Profit factor: gross profit / gross loss
 * - Max drawdown: largest peak-to-trough fall of equity
 * - Sharpe: mean / stdev of daily equity returns x sqrt(periodsPerYear)
 * - Recovery factor: net profit / max drawdown
 */
public final class PerformanceCalculator {

    private static final BigDecimal HUNDRED = new BigDecimal("100");
    private static final int SCALE = 4;

    private PerformanceCalculator() {}

    public static BacktestSummary summarize(BigDecimal initialBalance, BigDecimal finalBalance,
                                            List<ClosedTrade> trades, List<EquityPoint> equityCurve,
                                            int periodsPerYear, Map<String, InstrumentReport> instruments) {
        int wins = 0;
        int losses = 0;
        BigDecimal grossProfit = BigDecimal.ZERO;
        BigDecimal grossLoss = BigDecimal.ZERO;
        BigDecimal largestWin = BigDecimal.ZERO;
        BigDecimal largestLoss = BigDecimal.ZERO;

        for (ClosedTrade trade : trades) {
            BigDecimal pnl = trade.pnl();
            if (pnl.signum() > 0) {
                wins++;
                grossProfit = grossProfit.add(pnl);
                largestWin = largestWin.max(pnl);
            } else if (pnl.signum() < 0) {
                losses++;
                grossLoss = grossLoss.add(pnl.negate());
                largestLoss = largestLoss.min(pnl);
            }
        }

        // One position per instrument at a time, so instrument and open time identify it
        Map<PositionKey, BigDecimal> positionPnl = new LinkedHashMap<>();
        for (ClosedTrade trade : trades) {
            positionPnl.merge(new PositionKey(trade.instrument(), trade.openTime()), trade.pnl(), BigDecimal::add);
        }
        int positions = positionPnl.size();
        int positionWins = (int) positionPnl.values().stream().filter(pnl -> pnl.signum() > 0).count();

        int total = trades.size();
        BigDecimal winRate = percent(wins, total);
        BigDecimal positionWinRate = percent(positionWins, positions);
        BigDecimal profitFactor = grossLoss.signum() == 0
            ? null
            : grossProfit.divide(grossLoss, SCALE, RoundingMode.HALF_UP);
        BigDecimal averageWin = wins == 0
            ? BigDecimal.ZERO
            : grossProfit.divide(BigDecimal.valueOf(wins), SCALE, RoundingMode.HALF_UP);
        BigDecimal averageLoss = losses == 0
            ? BigDecimal.ZERO
            : grossLoss.negate().divide(BigDecimal.valueOf(losses), SCALE, RoundingMode.HALF_UP);

        Drawdown drawdown = maxDrawdown(initialBalance, equityCurve);
        BigDecimal netProfit = finalBalance.subtract(initialBalance);
        BigDecimal recoveryFactor = drawdown.amount().signum() == 0
            ? null
            : netProfit.divide(drawdown.amount(), SCALE, RoundingMode.HALF_UP);

        return new BacktestSummary(
            initialBalance,
            finalBalance,
            netProfit,
            total,
            wins,
            losses,
            winRate,
            positions,
            positionWins,
            positionWinRate,
            profitFactor,
            drawdown.amount().setScale(2, RoundingMode.HALF_UP),
            drawdown.percent(),
            sharpeRatio(initialBalance, equityCurve, periodsPerYear),
            recoveryFactor,
            averageWin,
            averageLoss,
            largestWin,
            largestLoss,
            trades,
            equityCurve,
            instruments
        );
    }

    private static BigDecimal percent(int part, int whole) {
        return whole == 0
            ? BigDecimal.ZERO
            : BigDecimal.valueOf(part).multiply(HUNDRED).divide(BigDecimal.valueOf(whole), 2, RoundingMode.HALF_UP);
    }

    /**
     * Largest peak-to-trough fall of equity, starting from the initial balance.
     */
    static Drawdown maxDrawdown(BigDecimal initialBalance, List<EquityPoint> equityCurve) {
        BigDecimal peak = initialBalance;
        BigDecimal maxAmount = BigDecimal.ZERO;
        BigDecimal maxPercent = BigDecimal.ZERO;

        for (EquityPoint point : equityCurve) {
            BigDecimal equity = point.equity();
            if (equity.compareTo(peak) > 0) {
                peak = equity;
                continue;
            }
            BigDecimal amount = peak.subtract(equity);
            if (amount.compareTo(maxAmount) > 0) {
                maxAmount = amount;
                maxPercent = amount.multiply(HUNDRED).divide(peak, 2, RoundingMode.HALF_UP);
            }
        }
        return new Drawdown(maxAmount, maxPercent);
    }

    /**
     * Annualized Sharpe ratio of daily (UTC) equity returns, zero risk-free rate.
     * Zero when fewer than two returns exist or returns do not vary.
     */
    static BigDecimal sharpeRatio(BigDecimal initialBalance, List<EquityPoint> equityCurve, int periodsPerYear) {
        // Last equity of each day
        Map<LocalDate, BigDecimal> daily = new TreeMap<>();
        for (EquityPoint point : equityCurve) {
            daily.put(LocalDate.ofInstant(point.timestamp(), ZoneOffset.UTC), point.equity());
        }

        List<BigDecimal> returns = new ArrayList<>();
        BigDecimal previous = initialBalance;
        for (BigDecimal equity : daily.values()) {
            if (previous.signum() != 0) {
                returns.add(equity.subtract(previous).divide(previous, MathContext.DECIMAL64));
            }
            previous = equity;
        }

        if (returns.size() < 2) {
            return BigDecimal.ZERO;
        }

        BigDecimal n = BigDecimal.valueOf(returns.size());
        BigDecimal mean = returns.stream().reduce(BigDecimal.ZERO, BigDecimal::add).divide(n, MathContext.DECIMAL64);
        BigDecimal sumSquares = BigDecimal.ZERO;
        for (BigDecimal r : returns) {
            BigDecimal d = r.subtract(mean);
            sumSquares = sumSquares.add(d.multiply(d));
        }
        BigDecimal variance = sumSquares.divide(BigDecimal.valueOf(returns.size() - 1), MathContext.DECIMAL64);
        if (variance.signum() == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal stdev = variance.sqrt(MathContext.DECIMAL64);
        BigDecimal annualization = BigDecimal.valueOf(periodsPerYear).sqrt(MathContext.DECIMAL64);
        return mean.divide(stdev, MathContext.DECIMAL64).multiply(annualization).setScale(SCALE, RoundingMode.HALF_UP);
    }

    record Drawdown(BigDecimal amount, BigDecimal percent) {
    }

    private record PositionKey(String instrument, Instant openTime) {
    }
}
