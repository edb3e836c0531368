package space.ketterling.sensornet.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * A deployment location hosting one or more sensors. Coordinates are WGS84.
 */
public record Node(
        String id,
        String network,
        double lon,
        double lat,
        JsonNode info,
        List<String> sensorNames) implements MetaRecord {

    public Node {
        sensorNames = sensorNames == null ? List.of() : List.copyOf(sensorNames);
    }

    @Override
    public String key() {
        return id.toLowerCase();
    }
}
