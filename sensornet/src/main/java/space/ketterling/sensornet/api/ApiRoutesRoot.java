package space.ketterling.sensornet.api;

import com.zaxxer.hikari.HikariDataSource;
import io.javalin.Javalin;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root and health endpoints for the API.
 */
final class ApiRoutesRoot {
    /**
     * Utility class; do not instantiate.
     */
    private ApiRoutesRoot() {
    }

    /**
     * Registers root and health endpoints.
     */
    static void register(ApiServer api) {
        Javalin app = api.app();
        HikariDataSource ds = api.ds();

        app.get("/", ctx -> ctx.json(Map.of(
                "service", "sensornet",
                "status", "ok",
                "endpoints", new String[] {
                        "GET /health",
                        "GET /v1/api/sensor-networks",
                        "GET /v1/api/sensor-networks/{network}",
                        "GET /v1/api/sensor-networks/{network}/nodes[/{node}]?geom=<geojson>",
                        "GET /v1/api/sensor-networks/{network}/sensors[/{sensor}]",
                        "GET /v1/api/sensor-networks/{network}/features_of_interest[/{feature}]",
                        "GET /v1/api/sensor-networks/{network}/query?feature=temperature&nodes=004e",
                        "GET /v1/api/sensor-networks/{network}/aggregate?node=004e&features=temperature&agg=hour",
                        "GET /v1/api/sensor-networks/{network}/download?features=temperature",
                        "GET /v1/api/jobs/{ticket}"
                })));

        app.get("/health", ctx -> {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("status", "ok");
            out.put("time", OffsetDateTime.now().toString());

            try (Connection c = ds.getConnection();
                    PreparedStatement ps = c.prepareStatement("SELECT 1");
                    ResultSet rs = ps.executeQuery()) {
                out.put("db", rs.next() ? "ok" : "unknown");
            } catch (Exception e) {
                out.put("db", "fail");
                out.put("db_error", e.getMessage());
                ctx.status(503);
            }

            ctx.json(out);
        });
    }
}
