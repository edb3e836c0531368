package space.ketterling.sensornet.export;

import java.sql.SQLException;

/**
 * Side channel for export job status and cooperative flags.
 */
public interface JobStatusStore {

    /**
     * Current status of a ticket, or null if the ticket is unknown.
     */
    JobStatus getStatus(String ticket) throws SQLException;

    void setStatus(String ticket, JobStatus status) throws SQLException;

    /**
     * Sets a flag that expires after {@code ttlSeconds}.
     */
    void setFlag(String key, boolean value, long ttlSeconds) throws SQLException;

    /**
     * True while a flag is set to true and not yet expired.
     */
    boolean hasFlag(String key) throws SQLException;
}
