package space.ketterling.sensornet.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * A named collection of sensor nodes.
 */
public record Network(
        String name,
        JsonNode info,
        List<String> nodeIds,
        List<String> sensorNames,
        List<String> featureNames) implements MetaRecord {

    public Network {
        nodeIds = nodeIds == null ? List.of() : List.copyOf(nodeIds);
        sensorNames = sensorNames == null ? List.of() : List.copyOf(sensorNames);
        featureNames = featureNames == null ? List.of() : List.copyOf(featureNames);
    }

    @Override
    public String key() {
        return name.toLowerCase();
    }
}
