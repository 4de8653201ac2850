package in.zonetrader.domain.data;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Bar resolutions used for multi-resolution analysis.
 *
 * Buckets are calendar aligned in UTC: intraday buckets floor from midnight,
 * D1 buckets are whole UTC days.
 */
public enum Resolution {
    /**
     * 1-minute bars.
     */
    M1(1, 500),

    /**
     * 5-minute bars.
     */
    M5(5, 500),

    /**
     * 15-minute bars. Default execution resolution.
     */
    M15(15, 400),

    /**
     * 30-minute bars.
     */
    M30(30, 300),

    /**
     * 1-hour bars.
     */
    H1(60, 300),

    /**
     * 4-hour bars. Default intermediate resolution.
     */
    H4(240, 200),

    /**
     * Daily bars. Default macro resolution.
     */
    D1(1440, 200);

    private static final int MINUTES_PER_DAY = 1440;

    private final int minutes;
    private final int lookback;

    Resolution(int minutes, int lookback) {
        this.minutes = minutes;
        this.lookback = lookback;
    }

    public int getMinutes() {
        return minutes;
    }

    /**
     * Number of bars kept in the rolling analysis window.
     */
    public int getLookback() {
        return lookback;
    }

    public Duration duration() {
        return Duration.ofMinutes(minutes);
    }

    /**
     * Floor a timestamp to the start of the bucket that contains it.
     * Example (H4): 2024-03-01T09:37Z -> 2024-03-01T08:00Z
     */
    public Instant bucketStart(Instant timestamp) {
        Instant day = timestamp.truncatedTo(ChronoUnit.DAYS);
        if (minutes >= MINUTES_PER_DAY) {
            return day;
        }
        long minutesIntoDay = Duration.between(day, timestamp).toMinutes();
        long floored = (minutesIntoDay / minutes) * minutes;
        return day.plus(floored, ChronoUnit.MINUTES);
    }

    /**
     * True when this resolution is strictly coarser than the other one.
     */
    public boolean isCoarserThan(Resolution other) {
        return minutes > other.minutes;
    }

    /**
     * A bar of this resolution opened at {@code barStart} is closed once an execution
     * bar of {@code finer} resolution opened at {@code finerBarStart} has closed.
     */
    public boolean isClosedBy(Instant barStart, Resolution finer, Instant finerBarStart) {
        Instant barEnd = barStart.plus(duration());
        Instant finerEnd = finerBarStart.plus(finer.duration());
        return !barEnd.isAfter(finerEnd);
    }
}
