package space.ketterling.sensornet.meta;

import java.util.List;

/**
 * Raised when valid filters cascade to zero records at some metadata level.
 * This is a client error, distinct from request validation.
 */
public class EmptyResolutionException extends RuntimeException {
    private final MetaLevel level;
    private final List<String> values;
    private final MetaLevel upstreamLevel;
    private final List<String> upstreamValues;

    public EmptyResolutionException(MetaLevel level, List<String> values, MetaLevel upstreamLevel,
            List<String> upstreamValues) {
        super(message(level, values, upstreamLevel, upstreamValues));
        this.level = level;
        this.values = values == null ? List.of() : List.copyOf(values);
        this.upstreamLevel = upstreamLevel;
        this.upstreamValues = upstreamValues == null ? List.of() : List.copyOf(upstreamValues);
    }

    /** Level that came up empty. */
    public MetaLevel level() {
        return level;
    }

    /** Values that were looked up at {@link #level()}. */
    public List<String> values() {
        return values;
    }

    /** Level above the empty one; null when the network level itself is empty. */
    public MetaLevel upstreamLevel() {
        return upstreamLevel;
    }

    public List<String> upstreamValues() {
        return upstreamValues;
    }

    private static String message(MetaLevel level, List<String> values, MetaLevel upstreamLevel,
            List<String> upstreamValues) {
        if (upstreamLevel == null) {
            return String.format("No valid %s could be found for %s", level.label(), values);
        }
        return String.format("Given your selection, %s: %s are available and from these no valid %s could be found for %s",
                upstreamLevel.label(), upstreamValues, level.label(), values);
    }
}
