package in.zonetrader.service.risk;

/**
 * Opening refused by sizing or by an account limit. The signal is dropped; no position is opened.
 */
public class RiskException extends RuntimeException {

    public enum Kind {
        NON_POSITIVE_STOP,      // Stop distance <= 0
        UNRESOLVED_UNIT_VALUE,  // Missing or non-positive unit value / price unit
        BELOW_MINIMUM_SIZE,     // Size rounds down to zero
        MAX_OPEN_POSITIONS,     // Concurrent position cap reached
        DAILY_TRADE_LIMIT,      // Positions opened today reached the cap
        COOLDOWN,               // Instrument closed a position too recently
        LOSS_STREAK_PAUSE       // Instrument paused after consecutive losses
    }

    private final Kind kind;
    private final String instrument;

    public RiskException(Kind kind, String instrument, String message) {
        super(String.format("[%s] %s: %s", instrument, kind, message));
        this.kind = kind;
        this.instrument = instrument;
    }

    public Kind getKind() {
        return kind;
    }

    public String getInstrument() {
        return instrument;
    }
}
