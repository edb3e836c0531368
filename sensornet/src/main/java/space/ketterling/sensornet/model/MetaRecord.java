package space.ketterling.sensornet.model;

/**
 * A metadata record that can be selected by one of the filter levels.
 */
public interface MetaRecord {
    /**
     * Lower-case identity used when filtering: network name, node id, sensor
     * name or feature name.
     */
    String key();
}
