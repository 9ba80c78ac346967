package fpt.com.ehraccess.common.util;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

public final class TimeUtils {

    private TimeUtils() {}

    /**
     * Current instant at the precision the database keeps, so values survive a round trip unchanged.
     */
    public static Instant now(Clock clock) {
        return truncate(clock.instant());
    }

    public static Instant truncate(Instant instant) {
        return instant == null ? null : instant.truncatedTo(ChronoUnit.MICROS);
    }

    public static Instant latest(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }
}
