package space.ketterling.sensornet.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import space.ketterling.sensornet.aggregate.AggregationEngine;
import space.ketterling.sensornet.format.ResultFormatter;
import space.ketterling.sensornet.meta.EmptyResolutionException;
import space.ketterling.sensornet.meta.MetadataResolver;
import space.ketterling.sensornet.testsupport.InMemoryMetadataStore;
import space.ketterling.sensornet.testsupport.InMemoryObservationStore;
import space.ketterling.sensornet.testsupport.InMemorySchemaRegistry;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static space.ketterling.sensornet.testsupport.InMemoryObservationStore.row;

@DisplayName("ObservationService")
class ObservationServiceTest {
    private static final LocalDateTime START = LocalDateTime.of(2016, 10, 1, 0, 0);

    private InMemoryObservationStore store;
    private ObservationService service;

    @BeforeEach
    void setUp() {
        InMemorySchemaRegistry schemas = InMemorySchemaRegistry.sample();
        store = new InMemoryObservationStore();
        ResultFormatter formatter = new ResultFormatter(new ObjectMapper());
        service = new ObservationService(new MetadataResolver(InMemoryMetadataStore.sample()),
                new ObservationQueryBuilder(schemas), store, new AggregationEngine(schemas, store), formatter);
    }

    private static QueryArgs.Builder args() {
        return QueryArgs.builder()
                .network("array_of_things")
                .startDatetime(START)
                .endDatetime(START.plusDays(1));
    }

    @Test
    @DisplayName("observations from several tables are merged in datetime order")
    void mergesTablesByDatetime() throws Exception {
        store.rows("humidity", List.of(
                row("004e", START.plusMinutes(1), "hih6130", 1, "humidity", 40.0),
                row("004e", START.plusMinutes(3), "hih6130", 2, "humidity", 41.0)));
        store.rows("temperature", List.of(
                row("005a", START.plusMinutes(2), "tmp112", 3, "temperature", 20.5)));

        List<ObjectNode> data = service.observations(args().build());

        assertThat(data).extracting(n -> n.get("datetime").asText())
                .containsExactly("2016-10-01T00:01:00", "2016-10-01T00:02:00", "2016-10-01T00:03:00");
        assertThat(data).extracting(n -> n.get("feature_of_interest").asText())
                .containsExactly("humidity", "temperature", "humidity");
    }

    @Test
    @DisplayName("a single feature selects only its own table")
    void singleFeature() throws Exception {
        store.rows("temperature", InMemoryObservationStore.temperatureRows(2, START));

        List<ObjectNode> data = service.observations(args().feature("temperature").build());

        assertThat(data).hasSize(2);
        assertThat(store.executed()).extracting(SqlStatement::feature).containsOnly("temperature");
    }

    @Test
    @DisplayName("an empty selection fails before any observation table is queried")
    void emptyResolutionBeforeQuerying() {
        assertThatThrownBy(() -> service.observations(args().nodes(List.of("zzz")).build()))
                .isInstanceOf(EmptyResolutionException.class);
        assertThat(store.executed()).isEmpty();
    }
}
