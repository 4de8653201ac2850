package in.zonetrader.service.backtest;

import in.zonetrader.domain.data.Candle;
import in.zonetrader.domain.data.Resolution;

import java.util.List;

/**
 * Historical candle provider.
 */
public interface CandleSource {

    /**
     * Bars of one instrument and resolution, in the order the source holds them.
     * Ordering is not corrected here; the replay rejects out-of-order data.
     *
     * @return Bars, or an empty list when the source has none at this resolution
     */
    List<Candle> load(String instrument, Resolution resolution);
}
