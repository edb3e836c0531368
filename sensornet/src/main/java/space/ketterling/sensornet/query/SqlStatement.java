package space.ketterling.sensornet.query;

import java.util.List;

/**
 * A parameterized SQL statement against one feature's observation table.
 * {@code columns} lists the result columns the cached schema expects, or is
 * null when the result shape is not tied to the table (counts, aggregates).
 */
public record SqlStatement(String feature, String sql, List<Object> params, List<String> columns) {

    public SqlStatement {
        params = List.copyOf(params);
        columns = columns == null ? null : List.copyOf(columns);
    }

    public SqlStatement(String feature, String sql, List<Object> params) {
        this(feature, sql, params, null);
    }

    /**
     * Double-quotes an identifier for PostgreSQL/Redshift.
     */
    public static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
