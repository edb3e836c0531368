package space.ketterling.sensornet.query;

import space.ketterling.sensornet.aggregate.AggregateFunction;
import space.ketterling.sensornet.aggregate.TimeBucket;
import space.ketterling.sensornet.meta.MetadataFilter;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validated, typed request arguments shared by every endpoint. Fields an
 * endpoint does not accept stay null. Identifiers are lower-case and
 * datetimes are UTC without an offset.
 */
public record QueryArgs(
        String network,
        List<String> nodes,
        List<String> sensors,
        List<String> features,
        String feature,
        String geom,
        LocalDateTime startDatetime,
        LocalDateTime endDatetime,
        Integer limit,
        Integer offset,
        String node,
        AggregateFunction function,
        TimeBucket agg) {

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Metadata filters implied by these arguments. A single {@code feature} or
     * {@code node} counts as a one-element filter.
     */
    public MetadataFilter metadataFilter() {
        List<String> nodeFilter = nodes;
        if (nodeFilter == null && node != null)
            nodeFilter = List.of(node);
        List<String> featureFilter = features;
        if (featureFilter == null && feature != null)
            featureFilter = List.of(feature);
        return new MetadataFilter(network, nodeFilter, sensors, featureFilter, geom);
    }

    /**
     * Non-null arguments keyed by their request field names, for echoing back
     * in response metadata.
     */
    public Map<String, Object> echo() {
        Map<String, Object> out = new LinkedHashMap<>();
        putIfSet(out, "network", network);
        putIfSet(out, "nodes", nodes);
        putIfSet(out, "node", node);
        putIfSet(out, "sensors", sensors);
        putIfSet(out, "features", features);
        putIfSet(out, "feature", feature);
        putIfSet(out, "geom", geom);
        putIfSet(out, "start_datetime",
                startDatetime == null ? null : startDatetime.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        putIfSet(out, "end_datetime",
                endDatetime == null ? null : endDatetime.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        putIfSet(out, "limit", limit);
        putIfSet(out, "offset", offset);
        putIfSet(out, "function", function == null ? null : function.sqlName());
        putIfSet(out, "agg", agg == null ? null : agg.unit());
        return out;
    }

    private static void putIfSet(Map<String, Object> out, String key, Object value) {
        if (value != null)
            out.put(key, value);
    }

    public static final class Builder {
        private String network;
        private List<String> nodes;
        private List<String> sensors;
        private List<String> features;
        private String feature;
        private String geom;
        private LocalDateTime startDatetime;
        private LocalDateTime endDatetime;
        private Integer limit;
        private Integer offset;
        private String node;
        private AggregateFunction function;
        private TimeBucket agg;

        private Builder() {
        }

        public Builder network(String v) {
            this.network = v;
            return this;
        }

        public Builder nodes(List<String> v) {
            this.nodes = v;
            return this;
        }

        public Builder sensors(List<String> v) {
            this.sensors = v;
            return this;
        }

        public Builder features(List<String> v) {
            this.features = v;
            return this;
        }

        public Builder feature(String v) {
            this.feature = v;
            return this;
        }

        public Builder geom(String v) {
            this.geom = v;
            return this;
        }

        public Builder startDatetime(LocalDateTime v) {
            this.startDatetime = v;
            return this;
        }

        public Builder endDatetime(LocalDateTime v) {
            this.endDatetime = v;
            return this;
        }

        public Builder limit(Integer v) {
            this.limit = v;
            return this;
        }

        public Builder offset(Integer v) {
            this.offset = v;
            return this;
        }

        public Builder node(String v) {
            this.node = v;
            return this;
        }

        public Builder function(AggregateFunction v) {
            this.function = v;
            return this;
        }

        public Builder agg(TimeBucket v) {
            this.agg = v;
            return this;
        }

        public QueryArgs build() {
            return new QueryArgs(network, nodes, sensors, features, feature, geom, startDatetime, endDatetime,
                    limit, offset, node, function, agg);
        }
    }
}
