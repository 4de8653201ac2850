package in.zonetrader.service.signal;

import in.zonetrader.domain.data.Candle;
import in.zonetrader.domain.structure.StructureState;
import in.zonetrader.domain.zone.LiquidityLevel;
import in.zonetrader.domain.zone.Zone;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Everything the scorer may see at one execution bar.
 *
 * Macro and intermediate states only include bars that closed at or before the execution bar's close.
 * atr is the execution-resolution ATR, null during warm-up.
 */
public record MultiResolutionSnapshot(
    Candle executionBar,
    StructureState macro,
    StructureState intermediate,
    StructureState execution,
    List<Zone> executionZones,
    List<LiquidityLevel> liquidity,
    BigDecimal atr
) {
    public MultiResolutionSnapshot {
        executionZones = List.copyOf(executionZones);
        liquidity = List.copyOf(liquidity);
    }

    public Instant barTime() {
        return executionBar.timestamp();
    }

    public BigDecimal price() {
        return executionBar.close();
    }
}
