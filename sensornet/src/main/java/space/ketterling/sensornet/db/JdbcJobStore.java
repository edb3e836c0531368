package space.ketterling.sensornet.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import space.ketterling.sensornet.export.DataDumpPart;
import space.ketterling.sensornet.export.DataDumpStore;
import space.ketterling.sensornet.export.JobStatus;
import space.ketterling.sensornet.export.JobStatusStore;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Job status, flags and datadump parts on the metadata database.
 */
public class JdbcJobStore implements JobStatusStore, DataDumpStore {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(JdbcJobStore.class);

    private final HikariDataSource ds;
    private final ObjectMapper om;

    public JdbcJobStore(HikariDataSource ds, ObjectMapper om) {
        this.ds = ds;
        this.om = om;
        ensureTables();
    }

    private void ensureTables() {
        String sql = """
                CREATE TABLE IF NOT EXISTS sensor_job_status (
                    ticket TEXT PRIMARY KEY,
                    status JSONB NOT NULL,
                    created_at TIMESTAMPTZ NOT NULL DEFAULT now(),
                    updated_at TIMESTAMPTZ NOT NULL DEFAULT now()
                );
                CREATE TABLE IF NOT EXISTS sensor_job_flag (
                    key TEXT PRIMARY KEY,
                    value BOOLEAN NOT NULL,
                    expires_at TIMESTAMPTZ NOT NULL
                );
                CREATE TABLE IF NOT EXISTS sensor_datadump (
                    id TEXT PRIMARY KEY,
                    request TEXT NOT NULL,
                    part INTEGER NOT NULL,
                    total INTEGER NOT NULL,
                    data JSONB NOT NULL,
                    created_at TIMESTAMPTZ NOT NULL DEFAULT now()
                );
                CREATE INDEX IF NOT EXISTS sensor_datadump_request_idx ON sensor_datadump (request, part)
                """;
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.execute();
        } catch (SQLException e) {
            log.warn("Could not create job tables, assuming they exist: {}", e.getMessage());
        }
    }

    @Override
    public JobStatus getStatus(String ticket) throws SQLException {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement("SELECT status::text FROM sensor_job_status WHERE ticket = ?")) {
            ps.setString(1, ticket);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next())
                    return null;
                return readStatus(rs.getString(1));
            }
        }
    }

    @Override
    public void setStatus(String ticket, JobStatus status) throws SQLException {
        try (Connection c = ds.getConnection()) {
            upsertStatus(c, ticket, status);
        }
    }

    @Override
    public void setFlag(String key, boolean value, long ttlSeconds) throws SQLException {
        String sql = """
                INSERT INTO sensor_job_flag (key, value, expires_at)
                VALUES (?, ?, now() + (? * INTERVAL '1 second'))
                ON CONFLICT (key) DO UPDATE SET value = EXCLUDED.value, expires_at = EXCLUDED.expires_at
                """;
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key);
            ps.setBoolean(2, value);
            ps.setLong(3, ttlSeconds);
            ps.executeUpdate();
        }
    }

    @Override
    public boolean hasFlag(String key) throws SQLException {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(
                        "SELECT 1 FROM sensor_job_flag WHERE key = ? AND value AND expires_at > now()")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    @Override
    public UnitOfWork begin() throws SQLException {
        Connection c = ds.getConnection();
        try {
            c.setAutoCommit(false);
        } catch (SQLException e) {
            c.close();
            throw e;
        }
        return new JdbcUnitOfWork(c);
    }

    @Override
    public List<String> ticketsCreatedBefore(Instant cutoff) throws SQLException {
        List<String> out = new ArrayList<>();
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(
                        "SELECT ticket FROM sensor_job_status WHERE created_at < ? ORDER BY created_at")) {
            ps.setTimestamp(1, Timestamp.from(cutoff));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    out.add(rs.getString(1));
            }
        }
        return out;
    }

    @Override
    public void purge(String ticket) throws SQLException {
        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement parts = c.prepareStatement("DELETE FROM sensor_datadump WHERE request = ?");
                    PreparedStatement status = c.prepareStatement("DELETE FROM sensor_job_status WHERE ticket = ?");
                    PreparedStatement flags = c.prepareStatement("DELETE FROM sensor_job_flag WHERE key = ?")) {
                parts.setString(1, ticket);
                int deleted = parts.executeUpdate();
                status.setString(1, ticket);
                status.executeUpdate();
                flags.setString(1, ticket + "_suppresscleanup");
                flags.executeUpdate();
                c.commit();
                log.debug("purge: {} ({} parts)", ticket, deleted);
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        }
    }

    private void upsertStatus(Connection c, String ticket, JobStatus status) throws SQLException {
        String sql = """
                INSERT INTO sensor_job_status (ticket, status) VALUES (?, ?::jsonb)
                ON CONFLICT (ticket) DO UPDATE SET status = EXCLUDED.status, updated_at = now()
                """;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, ticket);
            ps.setString(2, writeJson(status));
            ps.executeUpdate();
        }
    }

    private JobStatus readStatus(String json) throws SQLException {
        try {
            return om.readValue(json, JobStatus.class);
        } catch (JsonProcessingException e) {
            throw new SQLException("Invalid job status JSON: " + e.getOriginalMessage(), e);
        }
    }

    private String writeJson(Object value) throws SQLException {
        try {
            return om.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SQLException("Could not serialize job status: " + e.getOriginalMessage(), e);
        }
    }

    private final class JdbcUnitOfWork implements UnitOfWork {
        private final Connection c;
        private boolean finished;

        JdbcUnitOfWork(Connection c) {
            this.c = c;
        }

        @Override
        public void addPart(DataDumpPart part) throws SQLException {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO sensor_datadump (id, request, part, total, data) VALUES (?, ?, ?, ?, ?::jsonb)")) {
                ps.setString(1, part.id());
                ps.setString(2, part.request());
                ps.setInt(3, part.part());
                ps.setInt(4, part.total());
                ps.setString(5, part.data());
                ps.executeUpdate();
            }
        }

        @Override
        public void putStatus(String ticket, JobStatus status) throws SQLException {
            upsertStatus(c, ticket, status);
        }

        @Override
        public void commit() throws SQLException {
            c.commit();
            finished = true;
        }

        @Override
        public void rollback() throws SQLException {
            finished = true;
            c.rollback();
        }

        @Override
        public void close() throws SQLException {
            try {
                if (!finished)
                    c.rollback();
                c.setAutoCommit(true);
            } finally {
                c.close();
            }
        }
    }
}
