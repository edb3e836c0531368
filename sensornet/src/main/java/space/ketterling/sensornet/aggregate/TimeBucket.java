package space.ketterling.sensornet.aggregate;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Calendar granularities observations are grouped by before aggregating.
 */
public enum TimeBucket {
    MINUTE,
    HOUR,
    DAY,
    WEEK,
    MONTH,
    YEAR;

    /** Unit name accepted by {@code date_trunc}. */
    public String unit() {
        return name().toLowerCase();
    }

    public static Optional<TimeBucket> lookup(String name) {
        if (name == null)
            return Optional.empty();
        String n = name.trim().toLowerCase();
        for (TimeBucket b : values()) {
            if (b.unit().equals(n))
                return Optional.of(b);
        }
        return Optional.empty();
    }

    public static List<String> names() {
        return Arrays.stream(values()).map(TimeBucket::unit).toList();
    }
}
