package space.ketterling.sensornet.export;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

/**
 * Storage for export parts. Writes go through a {@link UnitOfWork} so a part
 * and the progress update that announces it commit together.
 */
public interface DataDumpStore {

    UnitOfWork begin() throws SQLException;

    /**
     * Tickets created before {@code cutoff}.
     */
    List<String> ticketsCreatedBefore(Instant cutoff) throws SQLException;

    /**
     * Deletes every part, the status and the flags of a ticket.
     */
    void purge(String ticket) throws SQLException;

    /**
     * A single transaction. Callers must call {@link #rollback()} when
     * anything before {@link #commit()} fails.
     */
    interface UnitOfWork extends AutoCloseable {
        void addPart(DataDumpPart part) throws SQLException;

        void putStatus(String ticket, JobStatus status) throws SQLException;

        void commit() throws SQLException;

        void rollback() throws SQLException;

        @Override
        void close() throws SQLException;
    }
}
