package space.ketterling.sensornet.testsupport;

import space.ketterling.sensornet.query.ObservationQuery;
import space.ketterling.sensornet.query.ObservationStore;
import space.ketterling.sensornet.query.SqlStatement;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serves canned rows per feature table. Statements are recorded, not parsed:
 * grouped aggregate statements get the aggregate rows, anything else the raw
 * observation rows.
 */
public class InMemoryObservationStore implements ObservationStore {
    private final Map<String, List<Map<String, Object>>> rows = new HashMap<>();
    private final Map<String, List<Map<String, Object>>> aggregateRows = new HashMap<>();
    private final List<SqlStatement> executed = new ArrayList<>();
    private final List<Integer> fetchSizes = new ArrayList<>();
    private final Map<String, Long> countOverrides = new HashMap<>();

    public void rows(String feature, List<Map<String, Object>> observations) {
        rows.put(feature, observations);
    }

    public void aggregateRows(String feature, List<Map<String, Object>> buckets) {
        aggregateRows.put(feature, buckets);
    }

    /**
     * Makes the count pass report {@code count} for a table regardless of its
     * rows.
     */
    public void countOverride(String feature, long count) {
        countOverrides.put(feature, count);
    }

    public List<SqlStatement> executed() {
        return executed;
    }

    public List<Integer> fetchSizes() {
        return fetchSizes;
    }

    /**
     * {@code n} temperature rows for node 005a, one minute apart.
     */
    public static List<Map<String, Object>> temperatureRows(int n, LocalDateTime from) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (int i = 0; i < n; i++)
            out.add(row("005a", from.plusMinutes(i), "tmp112", i, "temperature", 20.0 + i));
        return out;
    }

    public static Map<String, Object> row(String node, LocalDateTime datetime, String sensor, long metaId,
            String column, Object value) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("node_id", node);
        row.put("datetime", datetime);
        row.put("meta_id", metaId);
        row.put("sensor", sensor);
        row.put(column, value);
        return row;
    }

    @Override
    public List<Map<String, Object>> fetch(SqlStatement statement) {
        executed.add(statement);
        Map<String, List<Map<String, Object>>> source = statement.sql().startsWith("SELECT date_trunc")
                ? aggregateRows
                : rows;
        return source.getOrDefault(statement.feature(), List.of());
    }

    @Override
    public long count(ObservationQuery query) {
        executed.add(query.count());
        Long override = countOverrides.get(query.feature());
        return override != null ? override : rows.getOrDefault(query.feature(), List.of()).size();
    }

    @Override
    public void stream(ObservationQuery query, int fetchSize, RowHandler handler) throws Exception {
        executed.add(query.select());
        fetchSizes.add(fetchSize);
        for (Map<String, Object> row : rows.getOrDefault(query.feature(), List.of()))
            handler.handle(row);
    }
}
