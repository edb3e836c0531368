package space.ketterling.sensornet.schema;

import java.sql.SQLException;

/**
 * Maps feature names to the schemas of their observation tables.
 */
public interface SchemaRegistry {

    /**
     * Returns the schema of the feature's table.
     *
     * @throws FeatureTableException if no such table exists or it lacks the
     *                               observation envelope columns
     */
    TableSchema schemaFor(String feature) throws SQLException;

    /**
     * Drops a cached schema so the next lookup introspects again.
     */
    void invalidate(String feature);

    void invalidateAll();

    /**
     * True when a SQL error means a table or column no longer exists
     * (undefined_table, undefined_column).
     */
    static boolean isSchemaError(SQLException e) {
        String state = e.getSQLState();
        return "42P01".equals(state) || "42703".equals(state);
    }
}
