package space.ketterling.sensornet.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.sensornet.format.ResultFormatter;
import space.ketterling.sensornet.query.ObservationQuery;
import space.ketterling.sensornet.query.ObservationService;
import space.ketterling.sensornet.query.ObservationStore;
import space.ketterling.sensornet.query.QueryArgs;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Streams every observation selected by a request into numbered JSON parts.
 *
 * <p>
 * A count pass fixes the declared number of parts up front so clients can
 * follow progress. Each table is then streamed in datetime order and rows are
 * buffered; a full buffer becomes the next part. Each part is stored together
 * with the progress update that announces it. A summary record (part 0) closes
 * the export.
 * </p>
 */
public class ChunkedExportPipeline {
    private static final Logger log = LoggerFactory.getLogger(ChunkedExportPipeline.class);

    public static final String SUPPRESS_CLEANUP_SUFFIX = "_suppresscleanup";

    private final ObservationService service;
    private final ObservationStore store;
    private final ResultFormatter formatter;
    private final DataDumpStore dumps;
    private final JobStatusStore jobs;
    private final ObjectMapper om;
    private final int chunkSize;
    private final long suppressTtlSeconds;
    private final Clock clock;

    public ChunkedExportPipeline(ObservationService service, ObservationStore store, ResultFormatter formatter,
            DataDumpStore dumps, JobStatusStore jobs, ObjectMapper om, int chunkSize, long suppressTtlSeconds,
            Clock clock) {
        if (chunkSize < 1)
            throw new IllegalArgumentException("chunkSize must be positive");
        this.service = service;
        this.store = store;
        this.formatter = formatter;
        this.dumps = dumps;
        this.jobs = jobs;
        this.om = om;
        this.chunkSize = chunkSize;
        this.suppressTtlSeconds = suppressTtlSeconds;
        this.clock = clock;
    }

    public static String datadumpUrl(String urlRoot, String ticket) {
        String root = urlRoot == null ? "" : urlRoot;
        if (!root.isEmpty() && !root.endsWith("/"))
            root = root + "/";
        return root + "v1/api/datadump/" + ticket;
    }

    /**
     * Runs the export for {@code ticket}. Metadata resolution failures and
     * storage failures propagate; nothing is retried here.
     */
    public ExportResult run(String ticket, String workerId, QueryArgs args, String urlRoot) throws Exception {
        List<ObservationQuery> queries = service.queries(args);

        long rows = 0;
        for (ObservationQuery q : queries)
            rows += store.count(q);
        int declared = (int) ((rows + chunkSize - 1) / chunkSize);
        log.info("Datadump {}: {} rows in {} tables, {} parts of {}", ticket, rows, queries.size(), declared,
                chunkSize);

        ChunkWriter writer = new ChunkWriter(ticket, workerId, declared);
        Set<String> features = new LinkedHashSet<>();
        for (ObservationQuery q : queries) {
            long before = writer.rows;
            store.stream(q, chunkSize, row -> writer.append(formatter.formatObservation(row, q.schema())));
            if (writer.rows > before)
                features.add(q.feature().toLowerCase());
        }
        writer.finish();

        storeSummary(ticket, workerId, writer.parts, features);

        String url = datadumpUrl(urlRoot, ticket);
        log.info("Datadump {} complete: {} rows in {} parts", ticket, writer.rows, writer.parts);
        return new ExportResult(ticket, url, writer.parts, writer.rows, List.copyOf(features));
    }

    private void storeSummary(String ticket, String workerId, int parts, Set<String> features) throws Exception {
        JobStatus status = currentStatus(ticket, workerId);
        JobStatus.Meta meta = status.metaOrEmpty();
        String endTime = clock.instant().toString();

        ObjectNode summary = om.createObjectNode();
        summary.put("startTime", meta.startTime() != null ? meta.startTime() : endTime);
        summary.put("endTime", endTime);
        ArrayNode workers = summary.putArray("workers");
        List<String> workerIds = meta.workers() != null ? meta.workers() : List.of(workerId);
        workerIds.forEach(workers::add);
        ArrayNode featureNames = summary.putArray("features");
        features.forEach(featureNames::add);

        // Fewer rows than counted: the final total is what was actually written
        JobStatus done = status.withProgress(parts, parts).withMeta(meta.withEndTime(endTime));
        commit(ticket, new DataDumpPart(ticket, ticket, 0, parts, om.writeValueAsString(summary)), done);
    }

    private JobStatus currentStatus(String ticket, String workerId) throws Exception {
        JobStatus status = jobs.getStatus(ticket);
        if (status != null)
            return status;
        return new JobStatus(JobStatus.PROCESSING, null,
                new JobStatus.Meta(null, clock.instant().toString(), null, List.of(workerId)), null, null);
    }

    private void commit(String ticket, DataDumpPart part, JobStatus status) throws Exception {
        try (DataDumpStore.UnitOfWork uow = dumps.begin()) {
            try {
                uow.addPart(part);
                uow.putStatus(ticket, status);
                uow.commit();
            } catch (Exception e) {
                try {
                    uow.rollback();
                } catch (Exception rollbackFailure) {
                    e.addSuppressed(rollbackFailure);
                }
                log.error("Failed to store part {} of datadump {}", part.part(), ticket, e);
                throw e;
            }
        }
    }

    private final class ChunkWriter {
        private final String ticket;
        private final String workerId;
        private int total;
        private int parts;
        private long rows;
        private List<ObjectNode> buffer = new ArrayList<>();

        ChunkWriter(String ticket, String workerId, int total) {
            this.ticket = ticket;
            this.workerId = workerId;
            this.total = total;
        }

        void append(ObjectNode observation) throws Exception {
            buffer.add(observation);
            rows++;
            if (buffer.size() >= chunkSize)
                flush();
        }

        void finish() throws Exception {
            if (!buffer.isEmpty())
                flush();
        }

        private void flush() throws Exception {
            parts++;
            if (parts > total) {
                log.warn("Datadump {} produced more rows than counted, part {} exceeds declared total {}",
                        ticket, parts, total);
                total = parts;
            }
            JobStatus status = currentStatus(ticket, workerId).withProgress(parts, total);
            String data = om.writeValueAsString(buffer);
            commit(ticket, new DataDumpPart(UUID.randomUUID().toString(), ticket, parts, total, data), status);
            jobs.setFlag(ticket + SUPPRESS_CLEANUP_SUFFIX, true, suppressTtlSeconds);
            log.debug("Datadump {} stored part {}/{}", ticket, parts, total);
            buffer = new ArrayList<>();
        }
    }
}
