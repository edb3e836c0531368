package space.ketterling.sensornet.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Set;

/**
 * Extracts a single geometry from a GeoJSON document.
 */
final class GeoJsonFragments {
    private static final Set<String> GEOMETRY_TYPES = Set.of(
            "Point", "MultiPoint", "LineString", "MultiLineString", "Polygon", "MultiPolygon",
            "GeometryCollection");

    private GeoJsonFragments() {
    }

    /**
     * Returns the first geometry of {@code geojson} (a bare geometry, a Feature
     * or a FeatureCollection) serialized as compact JSON.
     *
     * @throws IllegalArgumentException if no geometry can be found
     */
    static String firstGeometry(ObjectMapper om, String geojson) {
        JsonNode root;
        try {
            root = om.readTree(geojson);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("not valid JSON: " + e.getOriginalMessage(), e);
        }
        JsonNode geometry = geometryOf(root);
        try {
            return om.writeValueAsString(geometry);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("could not serialize geometry", e);
        }
    }

    private static JsonNode geometryOf(JsonNode node) {
        if (node == null || !node.isObject())
            throw new IllegalArgumentException("expected a GeoJSON object");
        String type = node.path("type").asText("");
        if (GEOMETRY_TYPES.contains(type)) {
            String member = "GeometryCollection".equals(type) ? "geometries" : "coordinates";
            if (!node.hasNonNull(member))
                throw new IllegalArgumentException(type + " has no " + member);
            return node;
        }
        if ("Feature".equals(type))
            return geometryOf(node.get("geometry"));
        if ("FeatureCollection".equals(type)) {
            JsonNode features = node.path("features");
            if (!features.isArray() || features.isEmpty())
                throw new IllegalArgumentException("FeatureCollection has no features");
            return geometryOf(features.get(0));
        }
        throw new IllegalArgumentException("unsupported GeoJSON type: " + (type.isEmpty() ? "(none)" : type));
    }
}
