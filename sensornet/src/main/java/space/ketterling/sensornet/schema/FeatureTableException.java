package space.ketterling.sensornet.schema;

/**
 * A resolved feature does not map to a usable observation table. This is a
 * data-integrity fault on the server side, not a client error.
 */
public class FeatureTableException extends RuntimeException {
    private final String feature;

    public FeatureTableException(String feature, String message) {
        super(message);
        this.feature = feature;
    }

    public FeatureTableException(String feature, String message, Throwable cause) {
        super(message, cause);
        this.feature = feature;
    }

    public String feature() {
        return feature;
    }
}
