package space.ketterling.sensornet.aggregate;

import java.time.LocalDateTime;
import java.util.List;

/**
 * One aggregate query for a single node. {@code features} holds
 * {@code feature} or {@code feature.property} references; {@code sensors} may
 * be null.
 */
public record AggregateRequest(
        AggregateFunction function,
        String node,
        List<String> features,
        List<String> sensors,
        TimeBucket bucket,
        LocalDateTime start,
        LocalDateTime end) {
}
