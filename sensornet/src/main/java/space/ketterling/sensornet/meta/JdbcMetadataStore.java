package space.ketterling.sensornet.meta;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import space.ketterling.sensornet.model.FeatureOfInterest;
import space.ketterling.sensornet.model.Network;
import space.ketterling.sensornet.model.Node;
import space.ketterling.sensornet.model.Sensor;

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Database access for sensor network metadata (PostgreSQL + PostGIS).
 *
 * <p>
 * Tables are owned by the admin tooling; this class only reads them:
 * {@code sensor__network_metadata}, {@code sensor__node_metadata},
 * {@code sensor__sensor_metadata}, {@code sensor__sensor_to_node} and
 * {@code sensor__feature_metadata}.
 * </p>
 */
public class JdbcMetadataStore implements MetadataStore {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(JdbcMetadataStore.class);

    private final HikariDataSource ds;
    private final ObjectMapper om;

    public JdbcMetadataStore(HikariDataSource ds, ObjectMapper om) {
        this.ds = ds;
        this.om = om;
    }

    @Override
    public List<Network> findNetworks(Collection<String> names) throws SQLException {
        String sql = """
                SELECT n.name, n.info::text AS info,
                       COALESCE((SELECT array_agg(lower(nd.id) ORDER BY lower(nd.id))
                                 FROM sensor__node_metadata nd
                                 WHERE lower(nd.sensor_network) = lower(n.name)), '{}') AS node_ids,
                       COALESCE((SELECT array_agg(DISTINCT lower(sn.sensor))
                                 FROM sensor__sensor_to_node sn
                                 WHERE lower(sn.network) = lower(n.name)), '{}') AS sensor_names
                FROM sensor__network_metadata n
                """
                + (names != null ? "WHERE lower(n.name) = ANY(?) " : "")
                + "ORDER BY lower(n.name)";

        record Row(String name, JsonNode info, List<String> nodeIds, List<String> sensorNames) {
        }
        List<Row> rows = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            if (names != null)
                ps.setArray(1, textArray(c, names));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(new Row(
                            rs.getString("name"),
                            readJson(rs.getString("info")),
                            strings(rs.getArray("node_ids")),
                            strings(rs.getArray("sensor_names"))));
                }
            }
        }

        // Feature names come from the observed properties of each network's sensors
        Set<String> allSensors = new LinkedHashSet<>();
        for (Row r : rows)
            allSensors.addAll(r.sensorNames());
        Map<String, Sensor> sensorsByName = new HashMap<>();
        if (!allSensors.isEmpty()) {
            for (Sensor s : findSensors(allSensors))
                sensorsByName.put(s.key(), s);
        }

        List<Network> out = new ArrayList<>(rows.size());
        for (Row r : rows) {
            Set<String> features = new LinkedHashSet<>();
            for (String sensor : r.sensorNames()) {
                Sensor s = sensorsByName.get(sensor);
                if (s != null)
                    features.addAll(s.featureNames());
            }
            out.add(new Network(r.name(), r.info(), r.nodeIds(), r.sensorNames(), new ArrayList<>(features)));
        }
        log.debug("findNetworks: names={} -> {}", names, out.size());
        return out;
    }

    @Override
    public List<Node> findNodes(Collection<String> ids, String geojson) throws SQLException {
        StringBuilder sql = new StringBuilder("""
                SELECT nd.id, nd.sensor_network, ST_X(nd.location) AS lon, ST_Y(nd.location) AS lat,
                       nd.info::text AS info,
                       COALESCE((SELECT array_agg(lower(sn.sensor) ORDER BY lower(sn.sensor))
                                 FROM sensor__sensor_to_node sn
                                 WHERE lower(sn.node) = lower(nd.id)), '{}') AS sensors
                FROM sensor__node_metadata nd
                WHERE 1 = 1
                """);
        if (ids != null)
            sql.append(" AND lower(nd.id) = ANY(?)");
        if (geojson != null)
            sql.append(" AND ST_Within(nd.location, ST_SetSRID(ST_GeomFromGeoJSON(?), 4326))");
        sql.append(" ORDER BY lower(nd.id)");

        List<Node> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            int idx = 1;
            if (ids != null)
                ps.setArray(idx++, textArray(c, ids));
            if (geojson != null)
                ps.setString(idx, geojson);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new Node(
                            rs.getString("id"),
                            rs.getString("sensor_network"),
                            rs.getDouble("lon"),
                            rs.getDouble("lat"),
                            readJson(rs.getString("info")),
                            strings(rs.getArray("sensors"))));
                }
            }
        }
        log.debug("findNodes: ids={} geom={} -> {}", ids, geojson != null, out.size());
        return out;
    }

    @Override
    public List<Sensor> findSensors(Collection<String> names) throws SQLException {
        String sql = "SELECT name, observed_properties::text AS props, info::text AS info "
                + "FROM sensor__sensor_metadata "
                + (names != null ? "WHERE lower(name) = ANY(?) " : "")
                + "ORDER BY lower(name)";
        List<Sensor> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            if (names != null)
                ps.setArray(1, textArray(c, names));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new Sensor(
                            rs.getString("name"),
                            propertyMap(readJson(rs.getString("props"))),
                            readJson(rs.getString("info"))));
                }
            }
        }
        return out;
    }

    @Override
    public List<FeatureOfInterest> findFeatures(Collection<String> names) throws SQLException {
        String sql = "SELECT name, observed_properties::text AS props "
                + "FROM sensor__feature_metadata "
                + (names != null ? "WHERE lower(name) = ANY(?) " : "")
                + "ORDER BY lower(name)";
        List<FeatureOfInterest> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            if (names != null)
                ps.setArray(1, textArray(c, names));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new FeatureOfInterest(
                            rs.getString("name"),
                            propertyMap(readJson(rs.getString("props")))));
                }
            }
        }
        return out;
    }

    @Override
    public Set<String> networkNames() throws SQLException {
        return index("SELECT lower(name) FROM sensor__network_metadata");
    }

    @Override
    public Set<String> nodeIds() throws SQLException {
        return index("SELECT lower(id) FROM sensor__node_metadata");
    }

    @Override
    public Set<String> sensorNames() throws SQLException {
        return index("SELECT lower(name) FROM sensor__sensor_metadata");
    }

    @Override
    public Set<String> featureNames() throws SQLException {
        return index("SELECT lower(name) FROM sensor__feature_metadata");
    }

    private Set<String> index(String sql) throws SQLException {
        Set<String> out = new LinkedHashSet<>();
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next())
                out.add(rs.getString(1));
        }
        return out;
    }

    private static Array textArray(Connection c, Collection<String> values) throws SQLException {
        return c.createArrayOf("text", values.stream().map(String::toLowerCase).toArray());
    }

    private static List<String> strings(Array arr) throws SQLException {
        if (arr == null)
            return List.of();
        Object[] raw = (Object[]) arr.getArray();
        List<String> out = new ArrayList<>(raw.length);
        for (Object o : raw) {
            if (o != null)
                out.add(o.toString());
        }
        return out;
    }

    private JsonNode readJson(String json) throws SQLException {
        if (json == null)
            return om.createObjectNode();
        try {
            return om.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SQLException("Invalid JSON in metadata column: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Reads observed properties stored either as an object ({@code name ->
     * reference}) or as a list of {@code {"name": ...}} entries.
     */
    static Map<String, String> propertyMap(JsonNode node) {
        Map<String, String> out = new LinkedHashMap<>();
        if (node == null || node.isNull())
            return out;
        if (node.isObject()) {
            node.fields().forEachRemaining(e -> out.put(e.getKey(), e.getValue().asText()));
        } else if (node.isArray()) {
            for (JsonNode item : node) {
                String name = item.path("name").asText(null);
                if (name != null)
                    out.put(name, name);
            }
        }
        return out;
    }
}
