package space.ketterling.sensornet.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import space.ketterling.sensornet.aggregate.AggregateFunction;
import space.ketterling.sensornet.aggregate.TimeBucket;
import space.ketterling.sensornet.query.QueryArgs;
import space.ketterling.sensornet.testsupport.InMemoryMetadataStore;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

@DisplayName("RequestValidator")
class RequestValidatorTest {
    private static final Instant NOW = Instant.parse("2016-10-08T12:00:00Z");
    private static final LocalDateTime NOW_UTC = LocalDateTime.of(2016, 10, 8, 12, 0);

    private RequestValidator validator;

    @BeforeEach
    void setUp() {
        validator = new RequestValidator(InMemoryMetadataStore.sample(), new ObjectMapper(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Map<String, String> params(String... kv) {
        Map<String, String> out = new HashMap<>();
        out.put("network", "array_of_things");
        for (int i = 0; i < kv.length; i += 2)
            out.put(kv[i], kv[i + 1]);
        return out;
    }

    private ValidationException rejected(Runnable call) {
        return catchThrowableOfType(call::run, ValidationException.class);
    }

    @Test
    @DisplayName("an unsupported aggregate function is a validation error")
    void medianRejected() {
        ValidationException e = catchThrowableOfType(() -> validator.aggregate(
                params("node", "005a", "features", "temperature", "function", "median")),
                ValidationException.class);

        assertThat(e).isNotNull();
        assertThat(e.errors()).containsOnlyKeys("function");
        assertThat(e.errors().get("function")).contains("median");
    }

    @Test
    @DisplayName("aggregate defaults to avg per hour over the last day")
    void aggregateDefaults() throws Exception {
        QueryArgs args = validator.aggregate(params("node", "005A", "features", "Temperature.temperature"));

        assertThat(args.function()).isEqualTo(AggregateFunction.AVG);
        assertThat(args.agg()).isEqualTo(TimeBucket.HOUR);
        assertThat(args.node()).isEqualTo("005a");
        assertThat(args.features()).containsExactly("temperature.temperature");
        assertThat(args.endDatetime()).isEqualTo(NOW_UTC);
        assertThat(args.startDatetime()).isEqualTo(NOW_UTC.minusDays(1));
    }

    @Test
    @DisplayName("aggregate requires a node and features")
    void aggregateRequiredFields() {
        ValidationException e = catchThrowableOfType(() -> validator.aggregate(params()),
                ValidationException.class);

        assertThat(e.errors()).containsKeys("node", "features");
    }

    @Test
    @DisplayName("query requires a feature and defaults to the last 90 days without a limit")
    void queryDefaults() throws Exception {
        QueryArgs args = validator.query(params("feature", "temperature.temperature", "nodes", "005A,004e"));

        assertThat(args.feature()).isEqualTo("temperature");
        assertThat(args.nodes()).containsExactly("005a", "004e");
        assertThat(args.startDatetime()).isEqualTo(NOW_UTC.minusDays(90));
        assertThat(args.limit()).isNull();
        assertThat(args.offset()).isNull();

        ValidationException e = catchThrowableOfType(() -> validator.query(params()), ValidationException.class);
        assertThat(e.errors()).containsOnlyKeys("feature");
    }

    @Test
    @DisplayName("download defaults to the last seven days")
    void downloadDefaults() throws Exception {
        QueryArgs args = validator.download(params("features_of_interest", "temperature"));

        assertThat(args.startDatetime()).isEqualTo(NOW_UTC.minusDays(7));
        assertThat(args.features()).containsExactly("temperature");
    }

    @Test
    @DisplayName("unknown names are reported per field")
    void unknownNames() {
        ValidationException e = catchThrowableOfType(() -> validator.metadata(Map.of(
                "network", "nope", "nodes", "zzz", "sensors", "nope_sensor", "features", "nope.x")),
                ValidationException.class);

        assertThat(e.errors()).containsOnlyKeys("network", "nodes", "sensors", "features");
        assertThat(e.errors().get("nodes")).isEqualTo("Invalid node ID: zzz");
        assertThat(e.errors().get("features")).isEqualTo("Invalid feature of interest name: nope");
    }

    @Test
    @DisplayName("limit and offset must be non-negative integers")
    void limitAndOffset() {
        ValidationException e = catchThrowableOfType(() -> validator.query(
                params("feature", "temperature", "limit", "-1", "offset", "ten")), ValidationException.class);

        assertThat(e.errors()).containsOnlyKeys("limit", "offset");
    }

    @Test
    @DisplayName("datetimes with an offset are converted to UTC")
    void offsetsNormalizedToUtc() throws Exception {
        QueryArgs args = validator.query(params("feature", "temperature",
                "start_datetime", "2016-10-01T06:00:00-05:00",
                "end_datetime", "2016-10-02T00:00:00 02:00"));

        assertThat(args.startDatetime()).isEqualTo(LocalDateTime.of(2016, 10, 1, 11, 0));
        assertThat(args.endDatetime()).isEqualTo(LocalDateTime.of(2016, 10, 1, 22, 0));
    }

    @Test
    @DisplayName("start must precede end")
    void startBeforeEnd() {
        ValidationException e = catchThrowableOfType(() -> validator.query(params("feature", "temperature",
                "start_datetime", "2016-10-02", "end_datetime", "2016-10-01")), ValidationException.class);

        assertThat(e.errors()).containsOnlyKeys("start_datetime");
    }

    @Test
    @DisplayName("geom keeps only the first geometry and rejects garbage")
    void geom() throws Exception {
        String fc = "{\"type\":\"FeatureCollection\",\"features\":[{\"type\":\"Feature\",\"properties\":{},"
                + "\"geometry\":{\"type\":\"Point\",\"coordinates\":[-87.6,41.8]}}]}";

        QueryArgs args = validator.metadata(params("geom", fc));

        assertThat(args.geom()).isEqualTo("{\"type\":\"Point\",\"coordinates\":[-87.6,41.8]}");
        ValidationException e = catchThrowableOfType(() -> validator.metadata(params("geom", "{nope")),
                ValidationException.class);
        assertThat(e.errors()).containsOnlyKeys("geom");
    }

    @Test
    @DisplayName("list parameters are split, trimmed and lower-cased")
    void splitList() {
        assertThat(RequestValidator.splitList(" A, b ,,a ")).isEqualTo(List.of("a", "b"));
        assertThat(RequestValidator.splitList(" ")).isNull();
    }
}
