package space.ketterling.sensornet.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JobStatus")
class JobStatusTest {
    private final ObjectMapper om = new ObjectMapper();

    @Test
    @DisplayName("unset fields are left out of the polled JSON")
    void omitsNulls() {
        JsonNode json = om.valueToTree(JobStatus.queued("2016-10-08T00:00:00Z"));

        assertThat(json.get("status").asText()).isEqualTo("queued");
        assertThat(json.at("/meta/queueTime").asText()).isEqualTo("2016-10-08T00:00:00Z");
        assertThat(json.has("progress")).isFalse();
        assertThat(json.has("error")).isFalse();
        assertThat(json.get("meta").has("endTime")).isFalse();
    }

    @Test
    @DisplayName("stored statuses read back unchanged")
    void readsBack() throws Exception {
        JobStatus status = new JobStatus(JobStatus.PROCESSING, new JobStatus.Progress(3, 7),
                new JobStatus.Meta("q", "s", null, List.of("w1")), null, null);

        JobStatus back = om.readValue(om.writeValueAsString(status), JobStatus.class);

        assertThat(back).isEqualTo(status);
    }
}
