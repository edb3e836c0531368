package space.ketterling.sensornet.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Status record of one export ticket, as polled by clients.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatus(
        String status,
        Progress progress,
        Meta meta,
        JsonNode result,
        String error) {

    public static final String QUEUED = "queued";
    public static final String PROCESSING = "processing";
    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    public record Progress(int done, int total) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Meta(String queueTime, String startTime, String endTime, List<String> workers) {
        public Meta withStartTime(String startTime) {
            return new Meta(queueTime, startTime, endTime, workers);
        }

        public Meta withEndTime(String endTime) {
            return new Meta(queueTime, startTime, endTime, workers);
        }

        public Meta withWorkers(List<String> workers) {
            return new Meta(queueTime, startTime, endTime, workers);
        }
    }

    public static JobStatus queued(String queueTime) {
        return new JobStatus(QUEUED, null, new Meta(queueTime, null, null, null), null, null);
    }

    public JobStatus withStatus(String status) {
        return new JobStatus(status, progress, meta, result, error);
    }

    public JobStatus withProgress(int done, int total) {
        return new JobStatus(status, new Progress(done, total), meta, result, error);
    }

    public JobStatus withMeta(Meta meta) {
        return new JobStatus(status, progress, meta, result, error);
    }

    public JobStatus withResult(JsonNode result) {
        return new JobStatus(status, progress, meta, result, error);
    }

    public JobStatus withError(String error) {
        return new JobStatus(status, progress, meta, result, error);
    }

    /**
     * Meta block, never null.
     */
    public Meta metaOrEmpty() {
        return meta == null ? new Meta(null, null, null, null) : meta;
    }
}
