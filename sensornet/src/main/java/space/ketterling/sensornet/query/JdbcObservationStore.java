package space.ketterling.sensornet.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.sensornet.schema.FeatureTableException;
import space.ketterling.sensornet.schema.SchemaRegistry;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * JDBC access to the per-feature observation tables.
 *
 * <p>
 * A missing table or column, or a result whose columns differ from the
 * cached schema, invalidates that schema and surfaces as a
 * {@link FeatureTableException}.
 * </p>
 */
public class JdbcObservationStore implements ObservationStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcObservationStore.class);

    private final DataSource ds;
    private final SchemaRegistry schemas;

    public JdbcObservationStore(DataSource ds, SchemaRegistry schemas) {
        this.ds = ds;
        this.schemas = schemas;
    }

    @Override
    public List<Map<String, Object>> fetch(SqlStatement statement) throws SQLException {
        List<Map<String, Object>> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(statement.sql())) {
            bind(ps, statement.params());
            try (ResultSet rs = ps.executeQuery()) {
                ResultSetMetaData md = rs.getMetaData();
                checkColumns(statement, md);
                while (rs.next())
                    out.add(row(rs, md));
            }
        } catch (SQLException e) {
            throw translate(statement.feature(), e);
        }
        log.debug("fetch {} -> {} rows", statement.feature(), out.size());
        return out;
    }

    @Override
    public long count(ObservationQuery query) throws SQLException {
        SqlStatement statement = query.count();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(statement.sql())) {
            bind(ps, statement.params());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw translate(statement.feature(), e);
        }
    }

    @Override
    public void stream(ObservationQuery query, int fetchSize, RowHandler handler) throws Exception {
        SqlStatement statement = query.select();
        long rows = 0;
        try (Connection c = ds.getConnection()) {
            // PostgreSQL only uses a server-side cursor outside autocommit
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(statement.sql())) {
                ps.setFetchSize(fetchSize);
                bind(ps, statement.params());
                try (ResultSet rs = executeQuery(ps, statement.feature())) {
                    ResultSetMetaData md = rs.getMetaData();
                    checkColumns(statement, md);
                    while (rs.next()) {
                        handler.handle(row(rs, md));
                        rows++;
                    }
                }
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        }
        log.debug("stream {} -> {} rows", statement.feature(), rows);
    }

    private ResultSet executeQuery(PreparedStatement ps, String feature) throws SQLException {
        try {
            return ps.executeQuery();
        } catch (SQLException e) {
            throw translate(feature, e);
        }
    }

    /**
     * Fails closed when the table no longer has the columns its cached schema
     * lists, so an added or dropped column is never served silently.
     */
    private void checkColumns(SqlStatement statement, ResultSetMetaData md) throws SQLException {
        if (statement.columns() == null)
            return;
        Set<String> expected = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        expected.addAll(statement.columns());
        Set<String> actual = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        for (int i = 1; i <= md.getColumnCount(); i++)
            actual.add(md.getColumnLabel(i));
        if (actual.equals(expected))
            return;

        schemas.invalidate(statement.feature());
        log.error("Observation table for {} has columns {} but its cached schema has {}",
                statement.feature(), actual, expected);
        throw new FeatureTableException(statement.feature(),
                "Observation table for feature " + statement.feature() + " changed since its schema was cached");
    }

    private SQLException translate(String feature, SQLException e) {
        if (SchemaRegistry.isSchemaError(e)) {
            schemas.invalidate(feature);
            log.error("Observation table for {} no longer matches its cached schema", feature, e);
            throw new FeatureTableException(feature,
                    "Observation table for feature " + feature + " is missing or changed", e);
        }
        return e;
    }

    private static Map<String, Object> row(ResultSet rs, ResultSetMetaData md) throws SQLException {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 1; i <= md.getColumnCount(); i++)
            row.put(md.getColumnLabel(i), rs.getObject(i));
        return row;
    }

    private static void bind(PreparedStatement ps, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            Object v = params.get(i);
            if (v instanceof LocalDateTime ldt)
                ps.setTimestamp(i + 1, Timestamp.valueOf(ldt));
            else
                ps.setObject(i + 1, v);
        }
    }
}
