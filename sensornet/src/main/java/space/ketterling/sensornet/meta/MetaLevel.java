package space.ketterling.sensornet.meta;

/**
 * Metadata levels, in the order they are resolved.
 */
public enum MetaLevel {
    NETWORK("network"),
    NODES("nodes"),
    SENSORS("sensors"),
    FEATURES("features");

    private final String label;

    MetaLevel(String label) {
        this.label = label;
    }

    /**
     * Name used in request fields and error messages.
     */
    public String label() {
        return label;
    }

    /**
     * The level resolved just before this one, or null for NETWORK.
     */
    public MetaLevel upstream() {
        return ordinal() == 0 ? null : values()[ordinal() - 1];
    }
}
