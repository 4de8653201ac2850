package in.zonetrader.domain.structure;

/**
 * Snapshot of swing structure after a bar.
 *
 * lastBreak, lastSwingHigh and lastSwingLow are null until the first one occurs.
 */
public record StructureState(
    Bias bias,
    StructureBreak lastBreak,
    SwingPoint lastSwingHigh,
    SwingPoint lastSwingLow,
    int barsSeen
) {
    public static StructureState initial() {
        return new StructureState(Bias.RANGING, null, null, null, 0);
    }

    /**
     * Both swing extremes are known and form a non-empty range.
     */
    public boolean hasRange() {
        return lastSwingHigh != null && lastSwingLow != null
            && lastSwingHigh.price().compareTo(lastSwingLow.price()) > 0;
    }
}
