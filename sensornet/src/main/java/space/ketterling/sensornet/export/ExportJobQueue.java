package space.ketterling.sensornet.export;

import space.ketterling.sensornet.query.QueryArgs;

import java.sql.SQLException;

/**
 * Accepts datadump requests and runs them away from the request thread.
 */
public interface ExportJobQueue {

    /**
     * Creates a ticket, records it as queued and returns it without waiting
     * for the export to run.
     */
    String submit(QueryArgs args, String urlRoot) throws SQLException;
}
