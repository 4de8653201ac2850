package in.zonetrader.service.candle;

import in.zonetrader.domain.data.Resolution;

import java.time.Instant;

/**
 * Thrown when a bar does not strictly follow the previous bar of its series.
 * Fatal for that instrument's run; the bar is never skipped.
 */
public class OutOfOrderDataException extends RuntimeException {

    private final String instrument;
    private final Resolution resolution;
    private final Instant previous;
    private final Instant offending;

    public OutOfOrderDataException(String instrument, Resolution resolution,
                                   Instant previous, Instant offending) {
        super(String.format("[%s:%s] Bar %s does not follow %s (%s)",
            instrument, resolution, offending, previous,
            offending.equals(previous) ? "duplicate" : "out of order"));
        this.instrument = instrument;
        this.resolution = resolution;
        this.previous = previous;
        this.offending = offending;
    }

    public String getInstrument() {
        return instrument;
    }

    public Resolution getResolution() {
        return resolution;
    }

    public Instant getPrevious() {
        return previous;
    }

    public Instant getOffending() {
        return offending;
    }
}
