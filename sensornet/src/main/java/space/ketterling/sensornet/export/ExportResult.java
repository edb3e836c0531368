package space.ketterling.sensornet.export;

import java.util.List;

/**
 * Outcome of a finished export.
 */
public record ExportResult(String ticket, String url, int parts, long rows, List<String> features) {
}
