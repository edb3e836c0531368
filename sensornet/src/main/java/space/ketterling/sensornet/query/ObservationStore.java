package space.ketterling.sensornet.query;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Executes statements against the observation store. Rows are maps from
 * column label to JDBC value, in select order.
 */
public interface ObservationStore {

    List<Map<String, Object>> fetch(SqlStatement statement) throws SQLException;

    long count(ObservationQuery query) throws SQLException;

    /**
     * Streams the rows of {@code query} in datetime order, holding at most
     * about {@code fetchSize} rows in memory at a time.
     */
    void stream(ObservationQuery query, int fetchSize, RowHandler handler) throws Exception;

    @FunctionalInterface
    interface RowHandler {
        void handle(Map<String, Object> row) throws Exception;
    }
}
