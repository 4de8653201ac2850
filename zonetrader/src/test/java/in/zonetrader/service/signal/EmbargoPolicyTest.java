package in.zonetrader.service.signal;

import in.zonetrader.config.EmbargoConfig;
import in.zonetrader.domain.signal.ImpactLevel;
import in.zonetrader.domain.signal.ScheduledEvent;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EmbargoPolicyTest {

    private final EmbargoPolicy policy = new EmbargoPolicy(EmbargoConfig.defaults());

    @Test
    void testHighImpactWindowIsSymmetric() {
        assertTrue(policy.isEmbargoed(ImpactLevel.HIGH, Duration.ofMinutes(30)), "Boundary is inclusive");
        assertTrue(policy.isEmbargoed(ImpactLevel.HIGH, Duration.ofMinutes(-30)));
        assertTrue(policy.isEmbargoed(ImpactLevel.HIGH, Duration.ZERO));
        assertFalse(policy.isEmbargoed(ImpactLevel.HIGH, Duration.ofMinutes(31)));
        assertFalse(policy.isEmbargoed(ImpactLevel.HIGH, Duration.ofMinutes(-31)));
    }

    @Test
    void testWindowsByImpact() {
        assertTrue(policy.isEmbargoed(ImpactLevel.MEDIUM, Duration.ofMinutes(15)));
        assertFalse(policy.isEmbargoed(ImpactLevel.MEDIUM, Duration.ofMinutes(16)));
        assertFalse(policy.isEmbargoed(ImpactLevel.LOW, Duration.ZERO), "Zero window never embargoes");
        assertFalse(policy.isEmbargoed(ImpactLevel.NONE, Duration.ZERO));
    }

    @Test
    void testInvalidConfigIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new EmbargoPolicy(new EmbargoConfig(-1, 15, 0)));
    }

    @Test
    void testCalendarEmbargoAppliesOnlyToAffectedInstruments() {
        Instant event = Instant.parse("2024-03-08T13:30:00Z");
        CalendarTradingEmbargo embargo = new CalendarTradingEmbargo(List.of(
            new ScheduledEvent(event, ImpactLevel.HIGH, Set.of("EURUSD"), "Payrolls")), policy);

        assertFalse(embargo.isTradingPermitted("EURUSD", event.minusSeconds(900)));
        assertFalse(embargo.isTradingPermitted("EURUSD", event.plusSeconds(1800)));
        assertTrue(embargo.isTradingPermitted("EURUSD", event.plusSeconds(2700)));
        assertTrue(embargo.isTradingPermitted("XAUUSD", event), "Event does not list XAUUSD");
        assertEquals(1, embargo.size());
    }

    @Test
    void testEventWithoutInstrumentsAffectsAll() {
        Instant event = Instant.parse("2024-03-08T13:30:00Z");
        CalendarTradingEmbargo embargo = new CalendarTradingEmbargo(List.of(
            new ScheduledEvent(event, ImpactLevel.MEDIUM, Set.of(), "Rate decision")), policy);

        assertFalse(embargo.isTradingPermitted("XAUUSD", event.minusSeconds(600)));
        assertTrue(TradingEmbargo.ALWAYS_PERMITTED.isTradingPermitted("XAUUSD", event));
    }
}
