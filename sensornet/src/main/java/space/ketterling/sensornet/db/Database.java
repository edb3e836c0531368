package space.ketterling.sensornet.db;

import space.ketterling.sensornet.config.AppConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Creates pooled database connections using HikariCP.
 */
public final class Database {
    private Database() {
    }

    /**
     * Builds a connection pool for the metadata store (networks, nodes, jobs).
     */
    public static HikariDataSource createMetadataDataSource(AppConfig cfg) {
        return createDataSource(cfg.metaJdbcUrl(), cfg.metaUsername(), cfg.metaPassword(), "meta",
                cfg.metaPoolMax());
    }

    /**
     * Builds a connection pool for the observation store (per-feature tables).
     */
    public static HikariDataSource createObservationDataSource(AppConfig cfg) {
        return createDataSource(cfg.obsJdbcUrl(), cfg.obsUsername(), cfg.obsPassword(), "obs",
                cfg.obsPoolMax());
    }

    /**
     * Shared helper to build a configured pool with a named role.
     */
    private static HikariDataSource createDataSource(String url, String user, String pass, String role,
            int maxPool) {
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(url);
        hc.setUsername(user);
        hc.setPassword(pass);
        hc.setPoolName("sensornet-" + role);
        hc.setMaximumPoolSize(Math.max(2, maxPool));
        hc.setMinimumIdle(1);
        hc.setConnectionTimeout(10_000);
        return new HikariDataSource(hc);
    }
}
