package in.zonetrader.domain.data;

/**
 * Instrument classes. Unit values differ by orders of magnitude between classes,
 * so each class carries its own absolute size cap in the risk configuration.
 */
public enum InstrumentClass {
    CURRENCY_PAIR,
    METAL,
    INDEX,
    DIGITAL_ASSET
}
