package in.zonetrader.service.risk;

import java.math.BigDecimal;

/**
 * Raw size beyond the sanity bound. Indicates a unit-value defect rather than a large position.
 * Logged, never thrown out of the sizer: the size is forced to the minimum increment.
 */
public class AnomalySizeException extends RuntimeException {

    private final String instrument;
    private final BigDecimal rawQuantity;
    private final BigDecimal sanityBound;

    public AnomalySizeException(String instrument, BigDecimal rawQuantity, BigDecimal sanityBound) {
        super(String.format("[%s] Raw size %s exceeds sanity bound %s; forcing minimum increment",
            instrument, rawQuantity.toPlainString(), sanityBound.toPlainString()));
        this.instrument = instrument;
        this.rawQuantity = rawQuantity;
        this.sanityBound = sanityBound;
    }

    public String getInstrument() {
        return instrument;
    }

    public BigDecimal getRawQuantity() {
        return rawQuantity;
    }

    public BigDecimal getSanityBound() {
        return sanityBound;
    }
}
