package in.zonetrader.domain.structure;

/**
 * Structural break classification.
 */
public enum BreakType {
    CONTINUATION,      // Extends (or from RANGING establishes) the current bias
    CHARACTER_CHANGE   // Flips the current bias
}
