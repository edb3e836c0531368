package space.ketterling.sensornet.meta;

import space.ketterling.sensornet.model.FeatureOfInterest;
import space.ketterling.sensornet.model.MetaRecord;
import space.ketterling.sensornet.model.Network;
import space.ketterling.sensornet.model.Node;
import space.ketterling.sensornet.model.Sensor;

import java.sql.SQLException;
import java.util.List;

/**
 * Resolves metadata records by cascading network -> nodes -> sensors ->
 * features. Resolution stops at the requested level.
 *
 * <p>
 * Empty levels always surface as {@link EmptyResolutionException}, for both
 * the HTTP endpoints and the export workers.
 * </p>
 */
public class MetadataResolver {
    private final ResolutionSteps.NetworkStep networkStep;
    private final ResolutionSteps.NodeStep nodeStep;
    private final ResolutionSteps.SensorStep sensorStep;
    private final ResolutionSteps.FeatureStep featureStep;

    public MetadataResolver(MetadataStore store) {
        this.networkStep = new ResolutionSteps.NetworkStep(store);
        this.nodeStep = new ResolutionSteps.NodeStep(store);
        this.sensorStep = new ResolutionSteps.SensorStep(store);
        this.featureStep = new ResolutionSteps.FeatureStep(store);
    }

    /**
     * Resolves records at {@code target}, running only the levels up to it.
     */
    public List<? extends MetaRecord> resolve(MetaLevel target, MetadataFilter filter) throws SQLException {
        return switch (target) {
            case NETWORK -> networks(filter);
            case NODES -> nodes(filter);
            case SENSORS -> sensors(filter);
            case FEATURES -> features(filter);
        };
    }

    public List<Network> networks(MetadataFilter filter) throws SQLException {
        return networkStep.resolve(List.of(), filter).orElseThrow();
    }

    public List<Node> nodes(MetadataFilter filter) throws SQLException {
        return nodeStep.resolve(networks(filter), filter).orElseThrow();
    }

    public List<Sensor> sensors(MetadataFilter filter) throws SQLException {
        return sensorStep.resolve(nodes(filter), filter).orElseThrow();
    }

    public List<FeatureOfInterest> features(MetadataFilter filter) throws SQLException {
        return featureStep.resolve(sensors(filter), filter).orElseThrow();
    }
}
