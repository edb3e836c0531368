package space.ketterling.sensornet.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A measured phenomenon. Its name is also the name of its observation table.
 */
public record FeatureOfInterest(
        String name,
        Map<String, String> observedProperties) implements MetaRecord {

    public FeatureOfInterest {
        observedProperties = observedProperties == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(observedProperties));
    }

    @Override
    public String key() {
        return name.toLowerCase();
    }

    /**
     * Returns the lower-case feature part of a {@code feature.property}
     * reference.
     */
    public static String featurePart(String ref) {
        String s = ref.trim();
        int dot = s.indexOf('.');
        return (dot < 0 ? s : s.substring(0, dot)).toLowerCase();
    }

    /**
     * Returns the lower-case property part of a {@code feature.property}
     * reference, or null when the reference names only a feature.
     */
    public static String propertyPart(String ref) {
        String s = ref.trim();
        int dot = s.indexOf('.');
        if (dot < 0 || dot == s.length() - 1)
            return null;
        return s.substring(dot + 1).toLowerCase();
    }
}
