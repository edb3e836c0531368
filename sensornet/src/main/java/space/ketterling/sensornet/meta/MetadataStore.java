package space.ketterling.sensornet.meta;

import space.ketterling.sensornet.model.FeatureOfInterest;
import space.ketterling.sensornet.model.Network;
import space.ketterling.sensornet.model.Node;
import space.ketterling.sensornet.model.Sensor;

import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Read access to sensor network metadata. Lookups compare lower-case keys and
 * return records ordered by key.
 */
public interface MetadataStore {

    /**
     * Networks with the given names, or every network when {@code names} is null.
     */
    List<Network> findNetworks(Collection<String> names) throws SQLException;

    /**
     * Nodes with the given ids, additionally restricted to those located within
     * {@code geojson} when it is not null.
     */
    List<Node> findNodes(Collection<String> ids, String geojson) throws SQLException;

    List<Sensor> findSensors(Collection<String> names) throws SQLException;

    List<FeatureOfInterest> findFeatures(Collection<String> names) throws SQLException;

    Set<String> networkNames() throws SQLException;

    Set<String> nodeIds() throws SQLException;

    Set<String> sensorNames() throws SQLException;

    Set<String> featureNames() throws SQLException;
}
