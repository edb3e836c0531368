package space.ketterling.sensornet.meta;

import space.ketterling.sensornet.model.MetaRecord;

import java.sql.SQLException;
import java.util.List;

/**
 * One level of the metadata filter chain. Takes the records resolved by the
 * level above and returns the records of this level.
 *
 * @param <U> record type of the upstream level
 * @param <T> record type of this level
 */
public interface ResolutionStep<U extends MetaRecord, T extends MetaRecord> {

    MetaLevel level();

    Resolution<T> resolve(List<U> upstream, MetadataFilter filter) throws SQLException;
}
