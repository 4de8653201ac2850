package in.zonetrader.service.backtest;

import in.zonetrader.config.EngineConfig;
import in.zonetrader.domain.backtest.DropKind;
import in.zonetrader.domain.backtest.InstrumentReport;
import in.zonetrader.domain.data.Candle;
import in.zonetrader.domain.data.InstrumentMeta;
import in.zonetrader.domain.data.Resolution;
import in.zonetrader.service.candle.CandleStore;
import in.zonetrader.service.signal.MultiResolutionSnapshot;
import in.zonetrader.service.structure.StructureAnalyzer;
import in.zonetrader.service.zone.ZoneTracker;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Detection state of one instrument across its three resolutions.
 *
 * Coarser bars become visible only once they have closed at or before the close of the
 * execution bar being processed, so nothing from the future leaks into a snapshot.
 */
final class InstrumentPipeline {

    private final String instrument;
    private final InstrumentMeta meta;
    private final CandleStore store;
    private final Resolution execution;

    private final StructureAnalyzer macroStructure;
    private final StructureAnalyzer intermediateStructure;
    private final StructureAnalyzer executionStructure;
    private final ZoneTracker zones;

    private final List<Candle> intermediateBars;
    private final List<Candle> macroBars;
    private int intermediateCursor;
    private int macroCursor;

    private PipelineState state = PipelineState.IDLE;
    private String haltReason;
    private int barsProcessed;
    private int signals;
    private int trades;
    private BigDecimal netPnl = BigDecimal.ZERO;
    private final Map<DropKind, Integer> drops = new EnumMap<>(DropKind.class);

    InstrumentPipeline(String instrument, InstrumentMeta meta, EngineConfig config, CandleStore store,
                       List<Candle> intermediateBars, List<Candle> macroBars) {
        this.instrument = instrument;
        this.meta = meta;
        this.store = store;
        this.execution = config.backtest().executionResolution();

        this.macroStructure = new StructureAnalyzer(instrument, config.backtest().macroResolution(), config.structure());
        this.intermediateStructure = new StructureAnalyzer(
            instrument, config.backtest().intermediateResolution(), config.structure());
        this.executionStructure = new StructureAnalyzer(instrument, execution, config.structure());
        this.zones = new ZoneTracker(instrument, execution, config.zones(), meta.priceUnit());

        this.intermediateBars = intermediateBars;
        this.macroBars = macroBars;
    }

    /**
     * Feed the next execution bar and return what the scorer may see at its close.
     *
     * @throws in.zonetrader.service.candle.OutOfOrderDataException on non-monotonic data
     */
    MultiResolutionSnapshot advance(Candle bar) {
        store.append(bar);

        intermediateCursor = feedClosed(intermediateBars, intermediateCursor, intermediateStructure, bar);
        macroCursor = feedClosed(macroBars, macroCursor, macroStructure, bar);

        executionStructure.update(bar);
        zones.onBar(bar, executionStructure.confirmedOnLastBar());
        barsProcessed++;

        return new MultiResolutionSnapshot(
            bar,
            macroStructure.state(),
            intermediateStructure.state(),
            executionStructure.state(),
            zones.zoneBook().all(),
            zones.liquidityBook().unconsumed(),
            zones.currentAtr()
        );
    }

    private int feedClosed(List<Candle> bars, int cursor, StructureAnalyzer analyzer, Candle executionBar) {
        int i = cursor;
        while (i < bars.size()) {
            Candle coarse = bars.get(i);
            if (!coarse.resolution().isClosedBy(coarse.timestamp(), execution, executionBar.timestamp())) {
                break;
            }
            store.append(coarse);
            analyzer.update(coarse);
            i++;
        }
        return i;
    }

    void recordDrop(DropKind kind) {
        drops.merge(kind, 1, Integer::sum);
    }

    void recordSignal() {
        signals++;
    }

    void recordTrade(BigDecimal pnl, boolean positionClosed) {
        netPnl = netPnl.add(pnl);
        if (positionClosed) {
            trades++;
        }
    }

    void halt(String reason) {
        state = PipelineState.HALTED;
        haltReason = reason;
    }

    InstrumentReport report() {
        return new InstrumentReport(instrument, state == PipelineState.HALTED, haltReason,
            barsProcessed, signals, trades, netPnl, drops);
    }

    String instrument() {
        return instrument;
    }

    InstrumentMeta meta() {
        return meta;
    }

    PipelineState state() {
        return state;
    }

    void setState(PipelineState state) {
        this.state = state;
    }

    ZoneTracker zones() {
        return zones;
    }

    StructureAnalyzer executionStructure() {
        return executionStructure;
    }
}
