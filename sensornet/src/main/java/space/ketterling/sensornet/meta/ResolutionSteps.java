package space.ketterling.sensornet.meta;

import space.ketterling.sensornet.model.FeatureOfInterest;
import space.ketterling.sensornet.model.MetaRecord;
import space.ketterling.sensornet.model.Network;
import space.ketterling.sensornet.model.Node;
import space.ketterling.sensornet.model.Sensor;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The four steps of the metadata filter chain.
 *
 * <p>
 * Every level below NETWORK inherits a set of valid keys from the records
 * resolved above it. Explicit filter values are lower-cased and intersected
 * with that set; without explicit values the whole set is used. A level that
 * selects nothing yields an empty resolution naming itself and its upstream
 * level.
 * </p>
 */
final class ResolutionSteps {
    private ResolutionSteps() {
    }

    /**
     * Root level. Without a network filter every network is returned.
     */
    static final class NetworkStep implements ResolutionStep<MetaRecord, Network> {
        private final MetadataStore store;

        NetworkStep(MetadataStore store) {
            this.store = store;
        }

        @Override
        public MetaLevel level() {
            return MetaLevel.NETWORK;
        }

        @Override
        public Resolution<Network> resolve(List<MetaRecord> upstream, MetadataFilter filter) throws SQLException {
            List<String> requested = normalize(filter.valuesFor(MetaLevel.NETWORK));
            List<Network> networks = requested.isEmpty()
                    ? store.findNetworks(null)
                    : store.findNetworks(requested);
            if (networks.isEmpty()) {
                return Resolution.empty(new EmptyResolutionException(MetaLevel.NETWORK, requested, null, null));
            }
            return Resolution.resolved(networks);
        }
    }

    /**
     * Nodes of the resolved networks, optionally within a GeoJSON geometry.
     */
    static final class NodeStep extends InheritedStep<Network, Node> {
        NodeStep(MetadataStore store) {
            super(store, MetaLevel.NODES);
        }

        @Override
        List<String> validValues(List<Network> upstream) {
            List<String> out = new ArrayList<>();
            for (Network n : upstream)
                out.addAll(n.nodeIds());
            return out;
        }

        @Override
        List<Node> fetch(List<String> keys, MetadataFilter filter) throws SQLException {
            return store.findNodes(keys, filter.geom());
        }
    }

    /**
     * Sensors deployed on the resolved nodes.
     */
    static final class SensorStep extends InheritedStep<Node, Sensor> {
        SensorStep(MetadataStore store) {
            super(store, MetaLevel.SENSORS);
        }

        @Override
        List<String> validValues(List<Node> upstream) {
            List<String> out = new ArrayList<>();
            for (Node n : upstream)
                out.addAll(n.sensorNames());
            return out;
        }

        @Override
        List<Sensor> fetch(List<String> keys, MetadataFilter filter) throws SQLException {
            return store.findSensors(keys);
        }
    }

    /**
     * Features referenced by the observed properties of the resolved sensors.
     */
    static final class FeatureStep extends InheritedStep<Sensor, FeatureOfInterest> {
        FeatureStep(MetadataStore store) {
            super(store, MetaLevel.FEATURES);
        }

        @Override
        List<String> validValues(List<Sensor> upstream) {
            List<String> out = new ArrayList<>();
            for (Sensor s : upstream)
                out.addAll(s.featureNames());
            return out;
        }

        @Override
        List<String> requestedValues(MetadataFilter filter) {
            List<String> raw = filter.features();
            if (raw == null)
                return List.of();
            List<String> out = new ArrayList<>();
            for (String ref : raw) {
                if (ref != null && !ref.isBlank())
                    out.add(FeatureOfInterest.featurePart(ref));
            }
            return normalize(out);
        }

        @Override
        List<FeatureOfInterest> fetch(List<String> keys, MetadataFilter filter) throws SQLException {
            return store.findFeatures(keys);
        }
    }

    /**
     * Shared logic for levels that inherit their valid keys from the level
     * above.
     */
    abstract static class InheritedStep<U extends MetaRecord, T extends MetaRecord>
            implements ResolutionStep<U, T> {
        final MetadataStore store;
        private final MetaLevel level;

        InheritedStep(MetadataStore store, MetaLevel level) {
            this.store = store;
            this.level = level;
        }

        @Override
        public MetaLevel level() {
            return level;
        }

        abstract List<String> validValues(List<U> upstream);

        abstract List<T> fetch(List<String> keys, MetadataFilter filter) throws SQLException;

        List<String> requestedValues(MetadataFilter filter) {
            return normalize(filter.valuesFor(level));
        }

        @Override
        public Resolution<T> resolve(List<U> upstream, MetadataFilter filter) throws SQLException {
            List<String> valid = normalize(validValues(upstream));
            List<String> requested = requestedValues(filter);

            List<String> lookup;
            List<String> reported;
            if (requested.isEmpty()) {
                lookup = valid;
                reported = valid;
            } else {
                Set<String> validSet = new LinkedHashSet<>(valid);
                lookup = requested.stream().filter(validSet::contains).toList();
                reported = requested;
            }

            List<T> records = lookup.isEmpty() ? List.of() : fetch(lookup, filter);
            if (records.isEmpty()) {
                return Resolution.empty(new EmptyResolutionException(level, reported, level.upstream(),
                        keys(upstream)));
            }
            return Resolution.resolved(records);
        }
    }

    /**
     * Lower-cases, trims and de-duplicates filter values, keeping their order.
     */
    static List<String> normalize(List<String> values) {
        if (values == null)
            return List.of();
        Set<String> out = new LinkedHashSet<>();
        for (String v : values) {
            if (v == null || v.isBlank())
                continue;
            out.add(v.trim().toLowerCase());
        }
        return List.copyOf(out);
    }

    static List<String> keys(List<? extends MetaRecord> records) {
        List<String> out = new ArrayList<>(records.size());
        for (MetaRecord r : records)
            out.add(r.key());
        return out;
    }
}
