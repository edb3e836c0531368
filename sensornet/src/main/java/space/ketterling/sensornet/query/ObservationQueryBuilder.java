package space.ketterling.sensornet.query;

import space.ketterling.sensornet.model.FeatureOfInterest;
import space.ketterling.sensornet.schema.SchemaRegistry;
import space.ketterling.sensornet.schema.TableSchema;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Builds one observation query per resolved feature table.
 */
public class ObservationQueryBuilder {
    private final SchemaRegistry schemas;

    public ObservationQueryBuilder(SchemaRegistry schemas) {
        this.schemas = schemas;
    }

    /**
     * Builds the per-table queries for the {@code [start, end)} window of
     * {@code args}, filtered by its nodes and sensors. Limit and offset are
     * applied only when the arguments carry them.
     */
    public List<ObservationQuery> build(List<FeatureOfInterest> features, QueryArgs args) throws SQLException {
        if (args.startDatetime() == null || args.endDatetime() == null)
            throw new IllegalArgumentException("start_datetime and end_datetime are required");

        List<ObservationQuery> out = new ArrayList<>(features.size());
        for (FeatureOfInterest f : features) {
            TableSchema schema = schemas.schemaFor(f.name());
            out.add(build(schema, args));
        }
        return out;
    }

    ObservationQuery build(TableSchema schema, QueryArgs args) {
        List<String> predicates = new ArrayList<>();
        List<Object> params = new ArrayList<>();

        String dt = SqlStatement.quote(TableSchema.DATETIME);
        predicates.add(dt + " >= ?");
        params.add(args.startDatetime());
        predicates.add(dt + " < ?");
        params.add(args.endDatetime());

        List<String> nodes = args.nodes();
        if (nodes == null && args.node() != null)
            nodes = List.of(args.node());
        if (nodes != null && !nodes.isEmpty()) {
            predicates.add(inLower(TableSchema.NODE_ID, nodes.size()));
            nodes.forEach(n -> params.add(n.toLowerCase()));
        }
        List<String> sensors = args.sensors();
        if (sensors != null && !sensors.isEmpty()) {
            predicates.add(inLower(TableSchema.SENSOR, sensors.size()));
            sensors.forEach(s -> params.add(s.toLowerCase()));
        }

        return new ObservationQuery(schema, predicates, params, args.limit(), args.offset());
    }

    static String inLower(String column, int n) {
        return "lower(" + SqlStatement.quote(column) + ") IN ("
                + String.join(", ", Collections.nCopies(n, "?")) + ")";
    }
}
