package space.ketterling.sensornet.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import space.ketterling.sensornet.aggregate.AggregateFunction;
import space.ketterling.sensornet.aggregate.TimeBucket;
import space.ketterling.sensornet.meta.MetadataStore;
import space.ketterling.sensornet.model.FeatureOfInterest;
import space.ketterling.sensornet.query.QueryArgs;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns raw request parameters into {@link QueryArgs}, one method per
 * endpoint family. Every problem is collected before failing, so a single
 * {@link ValidationException} reports all offending fields.
 */
public class RequestValidator {
    static final Duration QUERY_WINDOW = Duration.ofDays(90);
    static final Duration AGGREGATE_WINDOW = Duration.ofDays(1);
    static final Duration DOWNLOAD_WINDOW = Duration.ofDays(7);

    // A '+' offset arrives as a space once the query string is decoded
    private static final Pattern SPACE_OFFSET = Pattern.compile("(T[0-9:.]+) (\\d{2}(:?\\d{2})?)$");

    private final MetadataStore store;
    private final ObjectMapper om;
    private final Clock clock;

    public RequestValidator(MetadataStore store, ObjectMapper om, Clock clock) {
        this.store = store;
        this.om = om;
        this.clock = clock;
    }

    /**
     * Arguments for the metadata listings (networks, nodes, sensors,
     * features).
     */
    public QueryArgs metadata(Map<String, String> params) throws SQLException {
        Fields f = new Fields(params);
        QueryArgs args = QueryArgs.builder()
                .network(f.network())
                .nodes(f.nodes("nodes"))
                .sensors(f.sensors())
                .features(f.features("features"))
                .geom(f.geom())
                .build();
        f.throwIfInvalid();
        return args;
    }

    public QueryArgs query(Map<String, String> params) throws SQLException {
        Fields f = new Fields(params);
        QueryArgs.Builder b = QueryArgs.builder()
                .network(f.network())
                .nodes(f.nodes("nodes"))
                .sensors(f.sensors())
                .feature(f.requiredFeature())
                .geom(f.geom())
                .limit(f.nonNegative("limit"))
                .offset(f.nonNegative("offset"));
        f.window(b, QUERY_WINDOW);
        f.throwIfInvalid();
        return b.build();
    }

    /**
     * Arguments for a single-node aggregate. {@code feature} is accepted as an
     * alias of {@code features}.
     */
    public QueryArgs aggregate(Map<String, String> params) throws SQLException {
        Fields f = new Fields(params);
        String node = f.requiredNode();
        List<String> features = f.features(params.get("features") != null ? "features" : "feature");
        if (features == null)
            f.error("features", "Missing data for required field.");
        QueryArgs.Builder b = QueryArgs.builder()
                .network(f.network())
                .node(node)
                .features(features)
                .sensors(f.sensors())
                .function(f.function())
                .agg(f.bucket());
        f.window(b, AGGREGATE_WINDOW);
        f.throwIfInvalid();
        return b.build();
    }

    /**
     * Arguments for a datadump. {@code features_of_interest} is accepted as an
     * alias of {@code features}.
     */
    public QueryArgs download(Map<String, String> params) throws SQLException {
        Fields f = new Fields(params);
        String featuresField = params.get("features") == null && params.get("features_of_interest") != null
                ? "features_of_interest"
                : "features";
        QueryArgs.Builder b = QueryArgs.builder()
                .network(f.network())
                .nodes(f.nodes("nodes"))
                .sensors(f.sensors())
                .features(f.features(featuresField))
                .geom(f.geom())
                .limit(f.nonNegative("limit"))
                .offset(f.nonNegative("offset"));
        f.window(b, DOWNLOAD_WINDOW);
        f.throwIfInvalid();
        return b.build();
    }

    static LocalDateTime parseDateTime(String raw) {
        String value = SPACE_OFFSET.matcher(raw.trim()).replaceFirst("$1+$2");
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(value,
                    OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime)
                return ((OffsetDateTime) parsed).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
            return (LocalDateTime) parsed;
        } catch (DateTimeParseException e) {
            try {
                return LocalDate.parse(value).atStartOfDay();
            } catch (DateTimeParseException dateOnly) {
                throw new IllegalArgumentException("Not a valid ISO-8601 datetime: " + raw, e);
            }
        }
    }

    static List<String> splitList(String raw) {
        if (raw == null || raw.isBlank())
            return null;
        List<String> out = new ArrayList<>();
        for (String part : raw.split(",")) {
            String v = part.trim().toLowerCase();
            if (!v.isEmpty() && !out.contains(v))
                out.add(v);
        }
        return out.isEmpty() ? null : out;
    }

    private final class Fields {
        private final Map<String, String> params;
        private final Map<String, String> errors = new LinkedHashMap<>();

        Fields(Map<String, String> params) {
            this.params = params;
        }

        void error(String field, String message) {
            errors.putIfAbsent(field, message);
        }

        void throwIfInvalid() {
            if (!errors.isEmpty())
                throw new ValidationException(errors);
        }

        private String raw(String field) {
            String v = params.get(field);
            return v == null || v.isBlank() ? null : v.trim();
        }

        String network() throws SQLException {
            String network = raw("network");
            if (network == null)
                return null;
            network = network.toLowerCase();
            if (!store.networkNames().contains(network))
                error("network", "Invalid network name: " + network);
            return network;
        }

        List<String> nodes(String field) throws SQLException {
            List<String> nodes = splitList(raw(field));
            if (nodes != null)
                checkAll(field, nodes, store.nodeIds(), "Invalid node ID: ");
            return nodes;
        }

        String requiredNode() throws SQLException {
            String node = raw("node");
            if (node == null) {
                error("node", "Missing data for required field.");
                return null;
            }
            node = node.toLowerCase();
            if (!store.nodeIds().contains(node))
                error("node", "Invalid node ID: " + node);
            return node;
        }

        List<String> sensors() throws SQLException {
            List<String> sensors = splitList(raw("sensors"));
            if (sensors != null)
                checkAll("sensors", sensors, store.sensorNames(), "Invalid sensor name: ");
            return sensors;
        }

        /**
         * Feature references, kept whole ({@code feature} or
         * {@code feature.property}); only the feature part is checked.
         */
        List<String> features(String field) throws SQLException {
            List<String> refs = splitList(raw(field));
            if (refs == null)
                return null;
            Set<String> valid = store.featureNames();
            for (String ref : refs) {
                String feature = FeatureOfInterest.featurePart(ref);
                if (!valid.contains(feature)) {
                    error(field, "Invalid feature of interest name: " + feature);
                    break;
                }
            }
            return refs;
        }

        String requiredFeature() throws SQLException {
            String ref = raw("feature");
            if (ref == null) {
                error("feature", "Missing data for required field.");
                return null;
            }
            String feature = FeatureOfInterest.featurePart(ref);
            if (!store.featureNames().contains(feature))
                error("feature", "Invalid feature of interest name: " + feature);
            return feature;
        }

        String geom() {
            String geom = raw("geom");
            if (geom == null)
                return null;
            try {
                return GeoJsonFragments.firstGeometry(om, geom);
            } catch (IllegalArgumentException e) {
                error("geom", "Could not parse geojson: " + e.getMessage());
                return null;
            }
        }

        Integer nonNegative(String field) {
            String v = raw(field);
            if (v == null)
                return null;
            try {
                int n = Integer.parseInt(v);
                if (n < 0)
                    error(field, "Must be greater than or equal to 0.");
                return n;
            } catch (NumberFormatException e) {
                error(field, "Not a valid integer.");
                return null;
            }
        }

        AggregateFunction function() {
            String v = raw("function");
            if (v == null)
                return AggregateFunction.AVG;
            return AggregateFunction.lookup(v).orElseGet(() -> {
                error("function", "Unsupported aggregate function: " + v.toLowerCase()
                        + ". Expected one of " + String.join(", ", AggregateFunction.names()));
                return null;
            });
        }

        TimeBucket bucket() {
            String v = raw("agg");
            if (v == null)
                return TimeBucket.HOUR;
            return TimeBucket.lookup(v).orElseGet(() -> {
                error("agg", "Unsupported aggregation interval: " + v.toLowerCase()
                        + ". Expected one of " + String.join(", ", TimeBucket.names()));
                return null;
            });
        }

        void window(QueryArgs.Builder b, Duration defaultWindow) {
            LocalDateTime now = LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
            LocalDateTime end = datetime("end_datetime", now);
            LocalDateTime start = datetime("start_datetime", (end != null ? end : now).minus(defaultWindow));
            if (start != null && end != null && !start.isBefore(end))
                error("start_datetime", "start_datetime must be before end_datetime.");
            b.startDatetime(start).endDatetime(end);
        }

        private LocalDateTime datetime(String field, LocalDateTime fallback) {
            String v = raw(field);
            if (v == null)
                return fallback;
            try {
                return parseDateTime(v);
            } catch (IllegalArgumentException e) {
                error(field, e.getMessage());
                return null;
            }
        }

        private void checkAll(String field, List<String> values, Set<String> valid, String message) {
            for (String v : values) {
                if (!valid.contains(v)) {
                    error(field, message + v);
                    return;
                }
            }
        }
    }
}
