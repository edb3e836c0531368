package space.ketterling.sensornet.meta;

import java.util.List;

/**
 * Identity and spatial filters for a metadata lookup. Null means "no filter"
 * for that level. {@code geom} is a single GeoJSON geometry.
 */
public record MetadataFilter(
        String network,
        List<String> nodes,
        List<String> sensors,
        List<String> features,
        String geom) {

    public static MetadataFilter none() {
        return new MetadataFilter(null, null, null, null, null);
    }

    public static MetadataFilter network(String network) {
        return new MetadataFilter(network, null, null, null, null);
    }

    public MetadataFilter withNodes(List<String> nodes) {
        return new MetadataFilter(network, nodes, sensors, features, geom);
    }

    public MetadataFilter withSensors(List<String> sensors) {
        return new MetadataFilter(network, nodes, sensors, features, geom);
    }

    public MetadataFilter withFeatures(List<String> features) {
        return new MetadataFilter(network, nodes, sensors, features, geom);
    }

    public MetadataFilter withGeom(String geom) {
        return new MetadataFilter(network, nodes, sensors, features, geom);
    }

    /**
     * Explicit filter values for a level; the network filter is a single name.
     */
    List<String> valuesFor(MetaLevel level) {
        return switch (level) {
            case NETWORK -> network == null ? null : List.of(network);
            case NODES -> nodes;
            case SENSORS -> sensors;
            case FEATURES -> features;
        };
    }
}
