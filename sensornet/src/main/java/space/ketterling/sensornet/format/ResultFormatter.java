package space.ketterling.sensornet.format;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import space.ketterling.sensornet.aggregate.AggregateValue;
import space.ketterling.sensornet.model.FeatureOfInterest;
import space.ketterling.sensornet.model.MetaRecord;
import space.ketterling.sensornet.model.Network;
import space.ketterling.sensornet.model.Node;
import space.ketterling.sensornet.model.Sensor;
import space.ketterling.sensornet.schema.ColumnDef;
import space.ketterling.sensornet.schema.TableSchema;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Turns metadata records, observation rows and aggregates into the JSON
 * shapes the API returns.
 */
public class ResultFormatter {
    private final ObjectMapper om;

    public ResultFormatter(ObjectMapper om) {
        this.om = om;
    }

    /**
     * Formats any metadata record with the formatter for its kind.
     */
    public ObjectNode format(MetaRecord record) {
        if (record instanceof Network n)
            return formatNetwork(n);
        if (record instanceof Node n)
            return formatNode(n);
        if (record instanceof Sensor s)
            return formatSensor(s);
        if (record instanceof FeatureOfInterest f)
            return formatFeature(f);
        throw new IllegalArgumentException("Unknown metadata record: " + record.getClass().getName());
    }

    public ObjectNode formatNetwork(Network network) {
        ObjectNode out = om.createObjectNode();
        out.put("name", network.name());
        out.set("features_of_interest", strings(network.featureNames()));
        out.set("nodes", strings(network.nodeIds()));
        out.set("sensors", strings(network.sensorNames()));
        out.set("info", infoOrEmpty(network.info()));
        return out;
    }

    /**
     * Nodes are GeoJSON Features with a Point geometry ([lon, lat]).
     */
    public ObjectNode formatNode(Node node) {
        ObjectNode feat = om.createObjectNode();
        feat.put("type", "Feature");

        ObjectNode geometry = om.createObjectNode();
        geometry.put("type", "Point");
        ArrayNode coords = geometry.putArray("coordinates");
        coords.add(node.lon());
        coords.add(node.lat());
        feat.set("geometry", geometry);

        ObjectNode props = om.createObjectNode();
        props.put("id", node.id());
        props.put("network", node.network());
        props.set("sensors", strings(node.sensorNames()));
        props.set("info", infoOrEmpty(node.info()));
        feat.set("properties", props);
        return feat;
    }

    public ObjectNode formatSensor(Sensor sensor) {
        ObjectNode out = om.createObjectNode();
        out.put("name", sensor.name());
        out.set("observed_properties", strings(List.copyOf(sensor.observedProperties().values())));
        out.set("info", infoOrEmpty(sensor.info()));
        return out;
    }

    public ObjectNode formatFeature(FeatureOfInterest feature) {
        ObjectNode out = om.createObjectNode();
        out.put("name", feature.name());
        ObjectNode props = out.putObject("observed_properties");
        feature.observedProperties().forEach(props::put);
        return out;
    }

    /**
     * Formats one observation row: the fixed envelope plus a {@code results}
     * object holding every other column of the table.
     */
    public ObjectNode formatObservation(Map<String, Object> row, TableSchema schema) {
        ObjectNode out = om.createObjectNode();
        putValue(out, "node_id", row.get(TableSchema.NODE_ID));
        putValue(out, "meta_id", row.get(TableSchema.META_ID));
        String dt = isoDateTime(row.get(TableSchema.DATETIME));
        if (dt == null)
            out.putNull("datetime");
        else
            out.put("datetime", dt);
        putValue(out, "sensor", row.get(TableSchema.SENSOR));
        out.put("feature_of_interest", schema.table());

        ObjectNode results = out.putObject("results");
        for (ColumnDef c : schema.measuredColumns()) {
            putValue(results, c.name(), row.get(c.name()));
        }
        return out;
    }

    public ObjectNode formatAggregate(AggregateValue value) {
        ObjectNode out = om.createObjectNode();
        out.put("time_bucket", isoDateTime(value.bucket()));
        out.put("feature", value.feature());
        out.put("property", value.property());
        putValue(out, "value", value.value());
        out.put("count", value.count());
        return out;
    }

    /**
     * Response envelope: echoed query arguments plus the data list.
     */
    public ObjectNode envelope(Map<String, Object> query, List<? extends JsonNode> data) {
        ObjectNode out = om.createObjectNode();
        ObjectNode meta = out.putObject("meta");
        meta.set("query", om.valueToTree(query));
        meta.putArray("message");
        meta.put("total", data.size());
        ArrayNode arr = out.putArray("data");
        arr.addAll(data);
        return out;
    }

    /**
     * Sorts formatted observations ascending by their {@code datetime}; rows
     * without one go last. The sort is stable.
     */
    public static void sortByDatetime(List<ObjectNode> observations) {
        observations.sort(Comparator.comparing(ResultFormatter::datetimeOf,
                Comparator.nullsLast(Comparator.naturalOrder())));
    }

    private static LocalDateTime datetimeOf(ObjectNode obs) {
        JsonNode dt = obs.get("datetime");
        if (dt == null || dt.isNull())
            return null;
        try {
            return LocalDateTime.parse(dt.asText());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * ISO-8601 local date-time (seconds always present) with any offset
     * stripped.
     */
    public static String isoDateTime(Object value) {
        LocalDateTime ldt = toLocalDateTime(value);
        if (ldt != null)
            return ldt.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        return value == null ? null : value.toString();
    }

    private static LocalDateTime toLocalDateTime(Object value) {
        if (value == null)
            return null;
        if (value instanceof LocalDateTime ldt)
            return ldt;
        if (value instanceof Timestamp ts)
            return ts.toLocalDateTime();
        if (value instanceof OffsetDateTime odt)
            return odt.toLocalDateTime();
        if (value instanceof ZonedDateTime zdt)
            return zdt.toLocalDateTime();
        if (value instanceof Instant i)
            return LocalDateTime.ofInstant(i, ZoneOffset.UTC);
        if (value instanceof java.sql.Date d)
            return d.toLocalDate().atStartOfDay();
        if (value instanceof LocalDate d)
            return d.atStartOfDay();
        if (value instanceof String s) {
            try {
                return OffsetDateTime.parse(s).toLocalDateTime();
            } catch (DateTimeParseException e) {
                try {
                    return LocalDateTime.parse(s);
                } catch (DateTimeParseException e2) {
                    return null;
                }
            }
        }
        return null;
    }

    /**
     * Writes a JDBC value as the closest JSON type.
     */
    void putValue(ObjectNode obj, String key, Object value) {
        if (value == null)
            obj.putNull(key);
        else if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte)
            obj.put(key, ((Number) value).longValue());
        else if (value instanceof BigDecimal bd)
            obj.put(key, bd);
        else if (value instanceof BigInteger bi)
            obj.put(key, bi);
        else if (value instanceof Number n)
            obj.put(key, n.doubleValue());
        else if (value instanceof Boolean b)
            obj.put(key, b);
        else if (value instanceof JsonNode node)
            obj.set(key, node);
        else if (toLocalDateTime(value) != null && !(value instanceof String))
            obj.put(key, isoDateTime(value));
        else
            obj.put(key, value.toString());
    }

    private ArrayNode strings(List<String> values) {
        ArrayNode arr = om.createArrayNode();
        values.forEach(arr::add);
        return arr;
    }

    private JsonNode infoOrEmpty(JsonNode info) {
        return info == null || info.isNull() ? om.createObjectNode() : info;
    }
}
