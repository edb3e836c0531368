package space.ketterling.sensornet.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A device reporting observed properties. Each property maps to a
 * {@code feature.property} reference.
 */
public record Sensor(
        String name,
        Map<String, String> observedProperties,
        JsonNode info) implements MetaRecord {

    public Sensor {
        observedProperties = observedProperties == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(observedProperties));
    }

    @Override
    public String key() {
        return name.toLowerCase();
    }

    /**
     * Feature names referenced by this sensor's observed properties, in
     * declaration order.
     */
    public List<String> featureNames() {
        Set<String> out = new LinkedHashSet<>();
        for (String ref : observedProperties.values()) {
            if (ref == null || ref.isBlank())
                continue;
            out.add(FeatureOfInterest.featurePart(ref));
        }
        return List.copyOf(out);
    }
}
