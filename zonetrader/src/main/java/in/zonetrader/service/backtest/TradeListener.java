package in.zonetrader.service.backtest;

import in.zonetrader.domain.signal.Signal;
import in.zonetrader.domain.trade.ClosedTrade;

/**
 * Reporting / notification hook for replay events.
 */
public interface TradeListener {

    default void onSignal(Signal signal) {}

    void onTradeClosed(ClosedTrade trade);
}
