package space.ketterling.sensornet.aggregate;

import java.time.LocalDateTime;

/**
 * Aggregate of one feature property within one time bucket. {@code count} is
 * the number of non-null observations that went into {@code value}.
 */
public record AggregateValue(
        LocalDateTime bucket,
        String feature,
        String property,
        Double value,
        long count) {
}
