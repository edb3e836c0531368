package space.ketterling.sensornet.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request arguments failed validation. Carries one message per offending
 * field.
 */
public class ValidationException extends RuntimeException {
    private final Map<String, String> errors;

    public ValidationException(Map<String, String> errors) {
        super("Invalid request arguments: " + errors.keySet());
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public Map<String, String> errors() {
        return errors;
    }
}
