package space.ketterling.sensornet.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;

/**
 * Application configuration loaded from environment variables or properties.
 *
 * <p>
 * This record groups the runtime settings for the API, the metadata database,
 * the observation store, response caching and the datadump export workers.
 * </p>
 */
public record AppConfig(
        // API
        int apiPort,
        String datadumpUrlRoot,

        // Metadata DB (networks, nodes, sensors, features, jobs)
        String metaJdbcUrl,
        String metaUsername,
        String metaPassword,
        int metaPoolMax,

        // Observation store (one table per feature of interest)
        String obsJdbcUrl,
        String obsUsername,
        String obsPassword,
        int obsPoolMax,

        // Caching
        int cacheTtlSeconds,
        long cacheMaxEntries,

        // Datadump exports
        int exportChunkSize,
        long cleanupSuppressTtlSeconds,
        Duration jobRetention,
        Duration reaperInterval,
        int exportWorkers,
        String workerId) {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    /**
     * Loads configuration using environment variables, system properties, and
     * application.properties (in that order).
     */
    public static AppConfig load() {
        Properties p = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (in != null)
                p.load(in);
        } catch (IOException e) {
            log.warn("Could not read application.properties, using env and defaults: {}", e.getMessage());
        }
        return fromProperties(p);
    }

    /**
     * Builds a config from the given properties, still letting env vars and
     * -Dprop values win.
     */
    public static AppConfig fromProperties(Properties p) {
        int port = Integer.parseInt(envOr(p, "API_PORT", "api.port", "8080"));
        String urlRoot = envOr(p, "DATADUMP_URL_ROOT", "datadump.urlRoot", "");

        String metaUrl = requireNonBlank(envOr(p, "META_JDBC_URL", "meta.jdbcUrl", ""), "meta.jdbcUrl");
        String metaUser = requireNonBlank(envOr(p, "META_USERNAME", "meta.username", ""), "meta.username");
        String metaPass = envOr(p, "META_PASSWORD", "meta.password", ""); // ok empty if local trust auth
        int metaPool = Integer.parseInt(envOr(p, "META_POOL_MAX", "meta.poolMax", "8"));

        // The observation store defaults to the metadata DB for single-database setups
        String obsUrl = envOr(p, "OBS_JDBC_URL", "obs.jdbcUrl", metaUrl);
        String obsUser = envOr(p, "OBS_USERNAME", "obs.username", metaUser);
        String obsPass = envOr(p, "OBS_PASSWORD", "obs.password", metaPass);
        int obsPool = Integer.parseInt(envOr(p, "OBS_POOL_MAX", "obs.poolMax", "8"));

        int cacheTtl = Integer.parseInt(envOr(p, "CACHE_TTL_SECONDS", "cache.ttlSeconds", "600"));
        long cacheMax = Long.parseLong(envOr(p, "CACHE_MAX_ENTRIES", "cache.maxEntries", "10000"));

        int chunkSize = Integer.parseInt(envOr(p, "EXPORT_CHUNK_SIZE", "export.chunkSize", "1000"));
        if (chunkSize < 1)
            throw new IllegalStateException("export.chunkSize must be at least 1");
        long suppressTtl = Long.parseLong(envOr(p, "EXPORT_SUPPRESS_TTL_SECONDS", "export.suppressTtlSeconds", "10800"));
        Duration retention = Duration.parse(envOr(p, "EXPORT_JOB_RETENTION", "export.jobRetention", "PT3H"));
        Duration reaper = Duration.parse(envOr(p, "SCHED_REAPER", "schedule.reaper", "PT10M"));
        int workers = Integer.parseInt(envOr(p, "EXPORT_WORKERS", "export.workers", "2"));
        String workerId = envOr(p, "WORKER_ID", "export.workerId", "sensornet");

        return new AppConfig(
                port,
                urlRoot,

                metaUrl,
                metaUser,
                metaPass,
                metaPool,

                obsUrl,
                obsUser,
                obsPass,
                obsPool,

                cacheTtl,
                cacheMax,

                chunkSize,
                suppressTtl,
                retention,
                reaper,
                Math.max(1, workers),
                workerId);
    }

    // ----------------------------
    // helpers
    // ----------------------------
    /**
     * Reads a value from env, then JVM property, then properties file fallback.
     */
    private static String envOr(Properties p, String envKey, String propKey, String def) {
        String v = System.getenv(envKey);
        if (v != null && !v.isBlank())
            return v;
        String sys = System.getProperty(propKey);
        if (sys != null && !sys.isBlank())
            return sys;
        return p.getProperty(propKey, def);
    }

    /**
     * Ensures a required config value is present and not blank.
     */
    private static String requireNonBlank(String v, String propKey) {
        if (v == null || v.isBlank()) {
            throw new IllegalStateException(
                    "Missing required config value " + propKey + " (env var, -Dprop, or application.properties).");
        }
        return v;
    }
}
