package space.ketterling.sensornet.aggregate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.sensornet.model.FeatureOfInterest;
import space.ketterling.sensornet.query.ObservationStore;
import space.ketterling.sensornet.query.SqlStatement;
import space.ketterling.sensornet.schema.ColumnDef;
import space.ketterling.sensornet.schema.SchemaRegistry;
import space.ketterling.sensornet.schema.SemanticType;
import space.ketterling.sensornet.schema.TableSchema;

import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes bucketed aggregates of one node's observations.
 *
 * <p>
 * Each feature table gets a single grouped query:
 * {@code date_trunc(bucket, datetime)} with one aggregate and one count per
 * selected column, over the half-open window {@code [start, end)}.
 * </p>
 */
public class AggregationEngine {
    private static final Logger log = LoggerFactory.getLogger(AggregationEngine.class);

    private final SchemaRegistry schemas;
    private final ObservationStore store;

    public AggregationEngine(SchemaRegistry schemas, ObservationStore store) {
        this.schemas = schemas;
        this.store = store;
    }

    /**
     * Aggregates the resolved {@code features}, restricted to the properties
     * named in {@code request.features()}.
     *
     * @throws UnprocessableQueryException when a property cannot be aggregated
     *                                     or the window holds no observations
     */
    public List<AggregateValue> aggregate(AggregateRequest request, List<FeatureOfInterest> features)
            throws SQLException {
        List<AggregateValue> out = new ArrayList<>();
        for (FeatureOfInterest feature : features) {
            TableSchema schema = schemas.schemaFor(feature.name());
            List<ColumnDef> columns = columnsFor(feature, schema, request);
            SqlStatement statement = statement(schema, columns, request);

            List<Map<String, Object>> rows = store.fetch(statement);
            for (Map<String, Object> row : rows) {
                LocalDateTime bucket = toLocalDateTime(row.get("time_bucket"));
                for (int i = 0; i < columns.size(); i++) {
                    long count = toLong(row.get("count_" + i));
                    if (count == 0)
                        continue;
                    out.add(new AggregateValue(bucket, schema.table(), columns.get(i).name(),
                            toDouble(row.get("value_" + i)), count));
                }
            }
            log.debug("aggregate {} {} node={} -> {} buckets", request.function().sqlName(), schema.table(),
                    request.node(), rows.size());
        }

        if (out.isEmpty()) {
            throw new UnprocessableQueryException(String.format(
                    "No observations for node %s between %s and %s could be aggregated",
                    request.node(), request.start(), request.end()));
        }
        out.sort(Comparator.comparing(AggregateValue::bucket, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(AggregateValue::feature)
                .thenComparing(AggregateValue::property));
        return out;
    }

    /**
     * Columns to aggregate for one feature: the properties referenced as
     * {@code feature.property}, or every eligible measured column when the
     * feature is referenced on its own.
     */
    List<ColumnDef> columnsFor(FeatureOfInterest feature, TableSchema schema, AggregateRequest request) {
        AggregateFunction fn = request.function();
        Set<String> properties = new LinkedHashSet<>();
        boolean wholeFeature = false;
        for (String ref : request.features()) {
            if (!FeatureOfInterest.featurePart(ref).equals(feature.key()))
                continue;
            String property = FeatureOfInterest.propertyPart(ref);
            if (property == null)
                wholeFeature = true;
            else
                properties.add(property);
        }
        if (properties.isEmpty())
            wholeFeature = true;

        List<ColumnDef> out = new ArrayList<>();
        if (wholeFeature) {
            for (ColumnDef c : schema.measuredColumns()) {
                if (!fn.numericOnly() || c.type() == SemanticType.NUMERIC)
                    out.add(c);
            }
            if (out.isEmpty()) {
                throw new UnprocessableQueryException(String.format(
                        "Feature %s has no properties that %s can be applied to", feature.name(), fn.sqlName()));
            }
            return out;
        }

        for (String property : properties) {
            ColumnDef c = schema.column(property);
            if (c == null) {
                String mapped = feature.observedProperties().get(property);
                c = mapped == null ? null : schema.column(mapped);
            }
            if (c == null || TableSchema.ENVELOPE.contains(c.name().toLowerCase())) {
                throw new UnprocessableQueryException(String.format(
                        "Feature %s has no property %s", feature.name(), property));
            }
            if (fn.numericOnly() && c.type() != SemanticType.NUMERIC) {
                throw new UnprocessableQueryException(String.format(
                        "Cannot apply %s to non-numeric property %s.%s", fn.sqlName(), feature.name(), c.name()));
            }
            out.add(c);
        }
        return out;
    }

    SqlStatement statement(TableSchema schema, List<ColumnDef> columns, AggregateRequest request) {
        String dt = SqlStatement.quote(TableSchema.DATETIME);
        StringBuilder sql = new StringBuilder("SELECT date_trunc('")
                .append(request.bucket().unit()).append("', ").append(dt).append(") AS time_bucket");
        for (int i = 0; i < columns.size(); i++) {
            String col = SqlStatement.quote(columns.get(i).name());
            sql.append(", ").append(request.function().apply(col)).append(" AS value_").append(i);
            sql.append(", COUNT(").append(col).append(") AS count_").append(i);
        }
        sql.append(" FROM ").append(SqlStatement.quote(schema.table()));
        sql.append(" WHERE lower(").append(SqlStatement.quote(TableSchema.NODE_ID)).append(") = ?");
        sql.append(" AND ").append(dt).append(" >= ? AND ").append(dt).append(" < ?");

        List<Object> params = new ArrayList<>();
        params.add(request.node().toLowerCase());
        params.add(request.start());
        params.add(request.end());

        List<String> sensors = request.sensors();
        if (sensors != null && !sensors.isEmpty()) {
            sql.append(" AND lower(").append(SqlStatement.quote(TableSchema.SENSOR)).append(") IN (")
                    .append(String.join(", ", Collections.nCopies(sensors.size(), "?"))).append(")");
            sensors.forEach(s -> params.add(s.toLowerCase()));
        }
        sql.append(" GROUP BY 1 ORDER BY 1");
        return new SqlStatement(schema.table(), sql.toString(), params);
    }

    private static LocalDateTime toLocalDateTime(Object value) {
        if (value instanceof LocalDateTime ldt)
            return ldt;
        if (value instanceof Timestamp ts)
            return ts.toLocalDateTime();
        if (value instanceof OffsetDateTime odt)
            return odt.toLocalDateTime();
        return null;
    }

    private static Double toDouble(Object value) {
        return value instanceof Number n ? n.doubleValue() : null;
    }

    private static long toLong(Object value) {
        return value instanceof Number n ? n.longValue() : 0L;
    }
}
