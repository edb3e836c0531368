package space.ketterling.sensornet.schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Introspects observation tables through JDBC metadata and caches the result
 * for the life of the process.
 *
 * <p>
 * Cached entries are dropped with {@link #invalidate(String)}; the observation
 * store does so whenever a query hits a missing table or column.
 * </p>
 */
public class JdbcSchemaRegistry implements SchemaRegistry {
    private static final Logger log = LoggerFactory.getLogger(JdbcSchemaRegistry.class);
    private static final Pattern TABLE_NAME = Pattern.compile("[a-z_][a-z0-9_]*");

    private final DataSource ds;
    private final Map<String, TableSchema> cache = new ConcurrentHashMap<>();

    public JdbcSchemaRegistry(DataSource ds) {
        this.ds = ds;
    }

    @Override
    public TableSchema schemaFor(String feature) throws SQLException {
        String table = feature == null ? "" : feature.trim().toLowerCase();
        if (!TABLE_NAME.matcher(table).matches()) {
            throw new FeatureTableException(feature, "Feature name is not a valid table name: " + feature);
        }
        TableSchema cached = cache.get(table);
        if (cached != null)
            return cached;

        TableSchema schema = introspect(table);
        cache.put(table, schema);
        log.debug("Cached schema for {}: {}", table, schema.columnNames());
        return schema;
    }

    @Override
    public void invalidate(String feature) {
        if (feature != null && cache.remove(feature.toLowerCase()) != null)
            log.info("Invalidated cached schema for {}", feature);
    }

    @Override
    public void invalidateAll() {
        cache.clear();
    }

    private TableSchema introspect(String table) throws SQLException {
        List<ColumnDef> columns = new ArrayList<>();
        try (Connection c = ds.getConnection()) {
            DatabaseMetaData md = c.getMetaData();
            try (ResultSet rs = md.getColumns(null, null, table, null)) {
                String owner = null;
                while (rs.next()) {
                    // Same table name in several schemas: keep the first one reported
                    String schemaName = String.valueOf(rs.getString("TABLE_SCHEM"));
                    if (owner == null)
                        owner = schemaName;
                    else if (!owner.equals(schemaName))
                        continue;
                    columns.add(new ColumnDef(
                            rs.getString("COLUMN_NAME"),
                            SemanticType.fromJdbc(rs.getInt("DATA_TYPE"))));
                }
            }
        }
        if (columns.isEmpty()) {
            log.error("No observation table found for feature {}", table);
            throw new FeatureTableException(table, "No observation table found for feature: " + table);
        }

        TableSchema schema = new TableSchema(table, columns);
        for (String required : TableSchema.REQUIRED) {
            if (!schema.hasColumn(required)) {
                log.error("Observation table {} is missing column {}", table, required);
                throw new FeatureTableException(table,
                        "Observation table " + table + " is missing required column " + required);
            }
        }
        return schema;
    }
}
