package in.zonetrader.service.backtest;

import in.zonetrader.config.ManagementConfig;
import in.zonetrader.config.RiskConfig;
import in.zonetrader.domain.data.Candle;
import in.zonetrader.domain.data.Direction;
import in.zonetrader.domain.data.InstrumentClass;
import in.zonetrader.domain.data.InstrumentMeta;
import in.zonetrader.domain.data.Resolution;
import in.zonetrader.domain.signal.Signal;
import in.zonetrader.domain.signal.SignalStrength;
import in.zonetrader.domain.trade.ClosedTrade;
import in.zonetrader.domain.trade.ExitReason;
import in.zonetrader.domain.trade.ManagementState;
import in.zonetrader.domain.trade.Position;
import in.zonetrader.service.risk.AccountState;
import in.zonetrader.service.risk.PositionSizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TradeManager.
 *
 * Position: EURUSD LONG 0.20 @ 1.2500, stop 1.2450 (R = 50 units), target 1.2600.
 */
class TradeManagerTest {

    private static final Instant T0 = Instant.parse("2024-03-04T10:00:00Z");
    private static final InstrumentMeta EURUSD = new InstrumentMeta("EURUSD", InstrumentClass.CURRENCY_PAIR,
        new BigDecimal("0.0001"), new BigDecimal("10"), new BigDecimal("0.01"), BigDecimal.ZERO);

    private AccountState account;
    private Position position;

    @BeforeEach
    void setUp() {
        account = new AccountState(new BigDecimal("10000"), RiskConfig.defaults());
        Signal signal = new Signal("EURUSD", Direction.LONG, new BigDecimal("1.2500"), new BigDecimal("1.2450"),
            new BigDecimal("1.2600"), new BigDecimal("92"), SignalStrength.VERY_STRONG, BigDecimal.ONE,
            List.of(), T0);
        position = account.open(signal, EURUSD, new PositionSizer(RiskConfig.defaults()), T0);
    }

    @Test
    @DisplayName("Stop wins when one bar touches both stop and target")
    void testStopBeforeTarget() {
        TradeManager manager = new TradeManager(ManagementConfig.defaults(), account);

        List<ClosedTrade> closed = manager.onBar(position, bar(1, 1.2500, 1.2610, 1.2440, 1.2520), EURUSD);

        assertEquals(1, closed.size());
        assertEquals(ExitReason.STOP_LOSS, closed.get(0).exitReason());
        assertEquals(0, new BigDecimal("1.2450").compareTo(closed.get(0).exit()));
        assertEquals(0, new BigDecimal("-100").compareTo(closed.get(0).pnl()));
        assertFalse(account.hasOpenPosition("EURUSD"));
    }

    @Test
    void testGapThroughStopFillsAtOpen() {
        TradeManager manager = new TradeManager(ManagementConfig.defaults(), account);

        ClosedTrade trade = manager.onBar(position, bar(1, 1.2400, 1.2420, 1.2390, 1.2410), EURUSD).get(0);

        assertEquals(0, new BigDecimal("1.2400").compareTo(trade.exit()));
        assertEquals(0, new BigDecimal("-200").compareTo(trade.pnl()));
    }

    @Test
    void testTargetFillsAtTargetOrGapOpen() {
        TradeManager manager = new TradeManager(ManagementConfig.disabled(), account);

        ClosedTrade trade = manager.onBar(position, bar(1, 1.2650, 1.2660, 1.2640, 1.2655), EURUSD).get(0);

        assertEquals(ExitReason.TARGET, trade.exitReason());
        assertEquals(0, new BigDecimal("1.2650").compareTo(trade.exit()), "Gap above target fills at the open");
        assertEquals(0, new BigDecimal("300").compareTo(trade.pnl()));
    }

    @Test
    void testTargetHitIntrabar() {
        TradeManager manager = new TradeManager(ManagementConfig.defaults(), account);

        ClosedTrade trade = manager.onBar(position, bar(1, 1.2520, 1.2605, 1.2510, 1.2590), EURUSD).get(0);

        assertEquals(ExitReason.TARGET, trade.exitReason());
        assertEquals(0, new BigDecimal("200").compareTo(trade.pnl()));
    }

    @Test
    @DisplayName("At 1R: break-even stop and half closed, then the rest stops out at break-even")
    void testBreakEvenAndPartial() {
        TradeManager manager = new TradeManager(ManagementConfig.defaults(), account);

        List<ClosedTrade> closed = manager.onBar(position, bar(1, 1.2510, 1.2555, 1.2505, 1.2540), EURUSD);

        assertEquals(1, closed.size());
        assertEquals(ExitReason.PARTIAL, closed.get(0).exitReason());
        assertEquals(0, new BigDecimal("1.2550").compareTo(closed.get(0).exit()));
        assertEquals(0, new BigDecimal("50").compareTo(closed.get(0).pnl()));
        assertEquals(0, new BigDecimal("0.10").compareTo(position.getSize()));
        assertEquals(0, new BigDecimal("1.2505").compareTo(position.getStop()));
        assertEquals(ManagementState.BREAK_EVEN, position.getManagementState());

        closed = manager.onBar(position, bar(2, 1.2530, 1.2535, 1.2500, 1.2510), EURUSD);

        assertEquals(ExitReason.BREAK_EVEN_STOP, closed.get(0).exitReason());
        assertEquals(0, new BigDecimal("5").compareTo(closed.get(0).pnl()));
        assertFalse(account.hasOpenPosition("EURUSD"));
    }

    @Test
    void testTrailingStop() {
        ManagementConfig trailingOnly = new ManagementConfig(
            true, new BigDecimal("1.5"), new BigDecimal("1.0"),
            false, BigDecimal.ZERO, BigDecimal.ZERO,
            false, BigDecimal.ZERO, BigDecimal.ZERO);
        TradeManager manager = new TradeManager(trailingOnly, account);

        assertTrue(manager.onBar(position, bar(1, 1.2510, 1.2580, 1.2505, 1.2570), EURUSD).isEmpty());
        assertEquals(0, new BigDecimal("1.2530").compareTo(position.getStop()), "Best 1.2580 - 1R");
        assertEquals(ManagementState.TRAILING, position.getManagementState());

        ClosedTrade trade = manager.onBar(position, bar(2, 1.2560, 1.2565, 1.2525, 1.2540), EURUSD).get(0);
        assertEquals(ExitReason.TRAILING_STOP, trade.exitReason());
        assertEquals(0, new BigDecimal("60").compareTo(trade.pnl()));
    }

    @Test
    void testManagementRunsAfterExitChecks() {
        TradeManager manager = new TradeManager(ManagementConfig.defaults(), account);

        // Bar reaches 1R but also trades back to the initial stop: exit first, no management
        ClosedTrade trade = manager.onBar(position, bar(1, 1.2500, 1.2555, 1.2450, 1.2460), EURUSD).get(0);

        assertEquals(ExitReason.STOP_LOSS, trade.exitReason());
        assertEquals(0, new BigDecimal("0.20").compareTo(trade.size()));
    }

    private static Candle bar(int index, double o, double h, double l, double c) {
        return Candle.of("EURUSD", Resolution.M15, T0.plusSeconds(900L * index), o, h, l, c, 100);
    }
}
