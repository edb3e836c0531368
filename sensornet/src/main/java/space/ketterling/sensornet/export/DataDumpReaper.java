package space.ketterling.sensornet.export;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically deletes expired datadumps. A ticket whose cleanup-suppression
 * flag is still live is kept, so an export that is still writing parts is
 * never removed underneath its worker.
 */
public final class DataDumpReaper {
    private static final Logger log = LoggerFactory.getLogger(DataDumpReaper.class);

    private final ScheduledExecutorService exec = Executors
            .newSingleThreadScheduledExecutor(r -> new Thread(r, "datadump-reaper"));

    private final DataDumpStore dumps;
    private final JobStatusStore jobs;
    private final Duration retention;
    private final Duration interval;
    private final Clock clock;

    private ScheduledFuture<?> task;

    public DataDumpReaper(DataDumpStore dumps, JobStatusStore jobs, Duration retention, Duration interval,
            Clock clock) {
        this.dumps = dumps;
        this.jobs = jobs;
        this.retention = retention;
        this.interval = interval;
        this.clock = clock;
    }

    public void start() {
        task = exec.scheduleWithFixedDelay(safe("datadumpReaper", this::reap),
                60, interval.toSeconds(), TimeUnit.SECONDS);
        log.info("Datadump reaper started (retention {}, every {}).", retention, interval);
    }

    public void stop() {
        if (task != null)
            task.cancel(true);
        exec.shutdownNow();
        try {
            if (!exec.awaitTermination(3, TimeUnit.SECONDS)) {
                log.warn("datadump reaper did not terminate cleanly");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * One cleanup pass. Returns the number of tickets purged.
     */
    public int reap() throws Exception {
        Instant cutoff = clock.instant().minus(retention);
        int purged = 0;
        for (String ticket : dumps.ticketsCreatedBefore(cutoff)) {
            if (jobs.hasFlag(ticket + ChunkedExportPipeline.SUPPRESS_CLEANUP_SUFFIX)) {
                log.debug("Keeping datadump {}: cleanup suppressed", ticket);
                continue;
            }
            dumps.purge(ticket);
            purged++;
        }
        if (purged > 0)
            log.info("Purged {} expired datadumps", purged);
        return purged;
    }

    private Runnable safe(String name, ThrowingRunnable r) {
        return () -> {
            MDC.put("job", name);
            try {
                r.run();
            } catch (Exception e) {
                log.error("Scheduled job failed: {}", name, e);
            } finally {
                MDC.remove("job");
            }
        };
    }

    @FunctionalInterface
    interface ThrowingRunnable {
        void run() throws Exception;
    }
}
