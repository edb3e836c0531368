package space.ketterling.sensornet.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import io.javalin.testtools.JavalinTest;
import okhttp3.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import space.ketterling.sensornet.aggregate.AggregationEngine;
import space.ketterling.sensornet.config.AppConfig;
import space.ketterling.sensornet.export.ExportJobQueue;
import space.ketterling.sensornet.export.JobStatus;
import space.ketterling.sensornet.format.ResultFormatter;
import space.ketterling.sensornet.meta.MetadataResolver;
import space.ketterling.sensornet.query.ObservationQueryBuilder;
import space.ketterling.sensornet.query.ObservationService;
import space.ketterling.sensornet.query.QueryArgs;
import space.ketterling.sensornet.testsupport.InMemoryJobStore;
import space.ketterling.sensornet.testsupport.InMemoryMetadataStore;
import space.ketterling.sensornet.testsupport.InMemoryObservationStore;
import space.ketterling.sensornet.testsupport.InMemorySchemaRegistry;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("ApiServer routes")
class ApiServerTest {
    private static final String BASE = "/v1/api/sensor-networks";
    private static final Instant NOW = Instant.parse("2016-10-08T12:00:00Z");

    private final ObjectMapper om = new ObjectMapper();
    private InMemoryObservationStore observations;
    private InMemoryJobStore jobs;
    private ExportJobQueue exports;
    private HikariDataSource ds;
    private ApiServer api;

    @BeforeEach
    void setUp() {
        InMemoryMetadataStore meta = InMemoryMetadataStore.sample();
        InMemorySchemaRegistry schemas = InMemorySchemaRegistry.sample();
        observations = new InMemoryObservationStore();
        jobs = new InMemoryJobStore();
        exports = mock(ExportJobQueue.class);
        ds = mock(HikariDataSource.class);

        MetadataResolver resolver = new MetadataResolver(meta);
        ResultFormatter formatter = new ResultFormatter(om);
        ObservationService service = new ObservationService(resolver, new ObservationQueryBuilder(schemas),
                observations, new AggregationEngine(schemas, observations), formatter);
        RequestValidator validator = new RequestValidator(meta, om, Clock.fixed(NOW, ZoneOffset.UTC));

        api = new ApiServer(config(), om, ds, resolver, service, formatter, validator, exports, jobs,
                new InMemoryResponseCache(Clock.systemUTC(), 600, 1000));
    }

    private static AppConfig config() {
        return new AppConfig(0, "http://localhost:8080/",
                "jdbc:postgresql://localhost/meta", "plenario", "", 1,
                "jdbc:postgresql://localhost/obs", "plenario", "", 1,
                600, 1000,
                3, 10800L, Duration.ofHours(3), Duration.ofMinutes(10), 1, "test");
    }

    private JsonNode json(Response r) throws Exception {
        return om.readTree(r.body().string());
    }

    @Test
    @DisplayName("network listing is wrapped in the response envelope")
    void listsNetworks() {
        JavalinTest.test(api.createApp(), (server, client) -> {
            Response r = client.get(BASE);

            assertThat(r.code()).isEqualTo(200);
            JsonNode body = json(r);
            assertThat(body.at("/meta/total").asInt()).isEqualTo(2);
            assertThat(body.at("/meta/message").isArray()).isTrue();
            assertThat(body.at("/data/0/name").asText()).isEqualTo("array_of_things");
            assertThat(body.at("/data/0/nodes")).extracting(JsonNode::asText).containsExactly("004e", "005a");
        });
    }

    @Test
    @DisplayName("a single node is served as a GeoJSON feature")
    void singleNode() {
        JavalinTest.test(api.createApp(), (server, client) -> {
            Response r = client.get(BASE + "/array_of_things/nodes/005A");

            assertThat(r.code()).isEqualTo(200);
            JsonNode node = json(r).at("/data/0");
            assertThat(node.get("type").asText()).isEqualTo("Feature");
            assertThat(node.at("/properties/id").asText()).isEqualTo("005a");
            assertThat(node.at("/geometry/coordinates/0").asDouble()).isEqualTo(-87.63);
        });
    }

    @Test
    @DisplayName("a node from another network is an empty resolution, not a validation error")
    void emptyResolution() {
        JavalinTest.test(api.createApp(), (server, client) -> {
            Response r = client.get(BASE + "/array_of_things/nodes?nodes=dev01");

            assertThat(r.code()).isEqualTo(400);
            JsonNode body = json(r);
            assertThat(body.get("error").asText()).isEqualTo("empty_resolution");
            assertThat(body.get("level").asText()).isEqualTo("nodes");
            assertThat(body.get("values")).extracting(JsonNode::asText).containsExactly("dev01");
            assertThat(body.get("upstream_level").asText()).isEqualTo("network");
        });
    }

    @Test
    @DisplayName("an unsupported aggregate function is rejected before any query runs")
    void medianIsValidationError() {
        JavalinTest.test(api.createApp(), (server, client) -> {
            Response r = client.get(BASE + "/array_of_things/aggregate?node=005a&features=temperature&function=median");

            assertThat(r.code()).isEqualTo(400);
            JsonNode body = json(r);
            assertThat(body.get("error").asText()).isEqualTo("validation_error");
            assertThat(body.at("/errors/function").asText()).contains("median");
            assertThat(observations.executed()).isEmpty();
        });
    }

    @Test
    @DisplayName("aggregating a text column is unprocessable")
    void textColumnIsUnprocessable() {
        JavalinTest.test(api.createApp(), (server, client) -> {
            Response r = client.get(BASE + "/array_of_things/aggregate?node=004e&features=humidity.status&function=sum");

            assertThat(r.code()).isEqualTo(422);
            assertThat(json(r).get("error").asText()).isEqualTo("unprocessable_query");
        });
    }

    @Test
    @DisplayName("query returns formatted observations")
    void queryObservations() {
        observations.rows("temperature",
                InMemoryObservationStore.temperatureRows(2, LocalDateTime.of(2016, 10, 8, 0, 0)));

        JavalinTest.test(api.createApp(), (server, client) -> {
            Response r = client.get(BASE + "/array_of_things/query?feature=temperature&nodes=005a");

            assertThat(r.code()).isEqualTo(200);
            JsonNode body = json(r);
            assertThat(body.at("/meta/total").asInt()).isEqualTo(2);
            assertThat(body.at("/meta/query/feature").asText()).isEqualTo("temperature");
            assertThat(body.at("/data/0/datetime").asText()).isEqualTo("2016-10-08T00:00:00");
            assertThat(body.at("/data/0/results/temperature").isNumber()).isTrue();
        });
    }

    @Test
    @DisplayName("download queues an export and points at its status")
    void downloadQueuesExport() throws Exception {
        when(exports.submit(any(QueryArgs.class), eq("http://localhost:8080/"))).thenReturn("abc123");

        JavalinTest.test(api.createApp(), (server, client) -> {
            Response r = client.get(BASE + "/array_of_things/download?features=temperature");

            assertThat(r.code()).isEqualTo(202);
            JsonNode body = json(r);
            assertThat(body.get("ticket").asText()).isEqualTo("abc123");
            assertThat(body.get("status").asText()).isEqualTo("queued");
            assertThat(body.get("url").asText()).isEqualTo("http://localhost:8080/v1/api/jobs/abc123");
            assertThat(body.at("/request/start_datetime").asText()).isEqualTo("2016-10-01T12:00:00");
        });
        verify(exports).submit(any(QueryArgs.class), eq("http://localhost:8080/"));
    }

    @Test
    @DisplayName("job status is served for known tickets only")
    void jobStatus() throws Exception {
        jobs.setStatus("abc123", JobStatus.queued("2016-10-08T12:00:00Z"));

        JavalinTest.test(api.createApp(), (server, client) -> {
            Response known = client.get("/v1/api/jobs/abc123");
            assertThat(known.code()).isEqualTo(200);
            assertThat(json(known).get("status").asText()).isEqualTo("queued");

            Response unknown = client.get("/v1/api/jobs/nope");
            assertThat(unknown.code()).isEqualTo(404);
            assertThat(json(unknown).get("error").asText()).isEqualTo("not_found");
        });
    }

    @Test
    @DisplayName("cached listings answer a matching If-None-Match with 304")
    void conditionalGet() {
        JavalinTest.test(api.createApp(), (server, client) -> {
            Response first = client.get(BASE + "/array_of_things/sensors");
            String etag = first.header("ETag");
            assertThat(first.header("Cache-Control")).isEqualTo("public, max-age=600");
            assertThat(etag).isNotBlank();

            Response second = client.get(BASE + "/array_of_things/sensors", req -> req.header("If-None-Match", etag));
            assertThat(second.code()).isEqualTo(304);
        });
    }

    @Test
    @DisplayName("health reports 503 when the database is unreachable")
    void healthWithoutDatabase() throws Exception {
        when(ds.getConnection()).thenThrow(new SQLException("connection refused"));

        JavalinTest.test(api.createApp(), (server, client) -> {
            Response r = client.get("/health");

            assertThat(r.code()).isEqualTo(503);
            assertThat(json(r).get("db").asText()).isEqualTo("fail");
        });
    }
}
