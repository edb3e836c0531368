package space.ketterling.sensornet.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import space.ketterling.sensornet.query.QueryArgs;

import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs exports on a fixed pool of worker threads inside this process.
 */
public final class LocalExportJobQueue implements ExportJobQueue {
    private static final Logger log = LoggerFactory.getLogger(LocalExportJobQueue.class);

    private final ChunkedExportPipeline pipeline;
    private final JobStatusStore jobs;
    private final ObjectMapper om;
    private final String workerId;
    private final long suppressTtlSeconds;
    private final Clock clock;
    private final AtomicInteger threadCount = new AtomicInteger();
    private final ExecutorService exec;

    public LocalExportJobQueue(ChunkedExportPipeline pipeline, JobStatusStore jobs, ObjectMapper om, int workers,
            String workerId, long suppressTtlSeconds, Clock clock) {
        this.pipeline = pipeline;
        this.jobs = jobs;
        this.om = om;
        this.workerId = workerId;
        this.suppressTtlSeconds = suppressTtlSeconds;
        this.clock = clock;
        this.exec = Executors.newFixedThreadPool(Math.max(1, workers),
                r -> new Thread(r, "export-worker-" + threadCount.incrementAndGet()));
    }

    @Override
    public String submit(QueryArgs args, String urlRoot) throws SQLException {
        String ticket = UUID.randomUUID().toString().replace("-", "");
        jobs.setStatus(ticket, JobStatus.queued(clock.instant().toString()));
        holdCleanup(ticket);
        exec.submit(() -> runJob(ticket, args, urlRoot));
        log.info("Datadump {} queued for network {}", ticket, args.network());
        return ticket;
    }

    void runJob(String ticket, QueryArgs args, String urlRoot) {
        MDC.put("job", "datadump:" + ticket);
        String worker = workerId + "/" + Thread.currentThread().getName();
        try {
            JobStatus queued = jobs.getStatus(ticket);
            String queueTime = queued == null ? null : queued.metaOrEmpty().queueTime();
            JobStatus.Meta meta = new JobStatus.Meta(queueTime, clock.instant().toString(), null, List.of(worker));
            jobs.setStatus(ticket, new JobStatus(JobStatus.PROCESSING, null, meta, null, null));
            holdCleanup(ticket);

            ExportResult result = pipeline.run(ticket, worker, args, urlRoot);

            JobStatus current = jobs.getStatus(ticket);
            ObjectNode body = om.createObjectNode().put("url", result.url());
            jobs.setStatus(ticket, current.withStatus(JobStatus.SUCCESS).withResult(body));
        } catch (Exception e) {
            log.error("Datadump {} failed", ticket, e);
            markFailed(ticket, e);
        } finally {
            MDC.remove("job");
        }
    }

    /**
     * Keeps the reaper away from a ticket until its first part is stored;
     * the pipeline refreshes the flag after every part.
     */
    private void holdCleanup(String ticket) throws SQLException {
        jobs.setFlag(ticket + ChunkedExportPipeline.SUPPRESS_CLEANUP_SUFFIX, true, suppressTtlSeconds);
    }

    private void markFailed(String ticket, Exception cause) {
        try {
            JobStatus current = jobs.getStatus(ticket);
            JobStatus base = current != null ? current : JobStatus.queued(null);
            String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            JobStatus.Meta meta = base.metaOrEmpty().withEndTime(clock.instant().toString());
            jobs.setStatus(ticket, base.withStatus(JobStatus.ERROR).withMeta(meta).withError(message));
        } catch (SQLException e) {
            log.error("Could not record failure of datadump {}", ticket, e);
        }
    }

    public void stop() {
        exec.shutdownNow();
        try {
            if (!exec.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Export workers did not terminate cleanly");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
