package space.ketterling.sensornet.export;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import space.ketterling.sensornet.testsupport.InMemoryJobStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DataDumpReaper")
class DataDumpReaperTest {
    private static final Instant NOW = Instant.parse("2016-10-08T12:00:00Z");

    private InMemoryJobStore jobs;
    private DataDumpReaper reaper;

    @BeforeEach
    void setUp() {
        jobs = new InMemoryJobStore();
        reaper = new DataDumpReaper(jobs, jobs, Duration.ofHours(3), Duration.ofMinutes(10),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("purges tickets older than the retention window")
    void purgesExpired() throws Exception {
        jobs.created("old", NOW.minus(Duration.ofHours(4)));
        jobs.created("fresh", NOW.minus(Duration.ofHours(1)));
        jobs.setStatus("old", JobStatus.queued("x"));

        int purged = reaper.reap();

        assertThat(purged).isEqualTo(1);
        assertThat(jobs.purged()).containsExactly("old");
        assertThat(jobs.getStatus("old")).isNull();
    }

    @Test
    @DisplayName("keeps expired tickets while their cleanup is suppressed")
    void honorsSuppressionFlag() throws Exception {
        jobs.created("busy", NOW.minus(Duration.ofHours(5)));
        jobs.setFlag("busy" + ChunkedExportPipeline.SUPPRESS_CLEANUP_SUFFIX, true, 10800);

        assertThat(reaper.reap()).isZero();
        assertThat(jobs.purged()).isEmpty();
    }
}
