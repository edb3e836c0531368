package space.ketterling.sensornet.query;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.sensornet.aggregate.AggregateRequest;
import space.ketterling.sensornet.aggregate.AggregateValue;
import space.ketterling.sensornet.aggregate.AggregationEngine;
import space.ketterling.sensornet.format.ResultFormatter;
import space.ketterling.sensornet.meta.MetadataResolver;
import space.ketterling.sensornet.model.FeatureOfInterest;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Serves raw and aggregated observations. Features are always resolved
 * through the metadata filter chain first, so an empty selection fails before
 * any observation table is touched.
 */
public class ObservationService {
    private static final Logger log = LoggerFactory.getLogger(ObservationService.class);

    private final MetadataResolver resolver;
    private final ObservationQueryBuilder builder;
    private final ObservationStore store;
    private final AggregationEngine engine;
    private final ResultFormatter formatter;

    public ObservationService(MetadataResolver resolver, ObservationQueryBuilder builder, ObservationStore store,
            AggregationEngine engine, ResultFormatter formatter) {
        this.resolver = resolver;
        this.builder = builder;
        this.store = store;
        this.engine = engine;
        this.formatter = formatter;
    }

    /**
     * Resolves the features selected by {@code args} and builds one query per
     * feature table.
     */
    public List<ObservationQuery> queries(QueryArgs args) throws SQLException {
        List<FeatureOfInterest> features = resolver.features(args.metadataFilter());
        return builder.build(features, args);
    }

    /**
     * Fetches and formats observations from every selected table, merged in
     * ascending datetime order.
     */
    public List<ObjectNode> observations(QueryArgs args) throws SQLException {
        List<ObjectNode> out = new ArrayList<>();
        for (ObservationQuery q : queries(args)) {
            for (Map<String, Object> row : store.fetch(q.select()))
                out.add(formatter.formatObservation(row, q.schema()));
        }
        ResultFormatter.sortByDatetime(out);
        log.debug("observations network={} -> {} rows", args.network(), out.size());
        return out;
    }

    /**
     * Aggregates one node's observations for the requested features.
     */
    public List<AggregateValue> aggregate(QueryArgs args) throws SQLException {
        List<FeatureOfInterest> features = resolver.features(args.metadataFilter());
        AggregateRequest request = new AggregateRequest(
                args.function(),
                args.node(),
                args.features(),
                args.sensors(),
                args.agg(),
                args.startDatetime(),
                args.endDatetime());
        return engine.aggregate(request, features);
    }
}
