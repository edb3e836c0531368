package space.ketterling.sensornet.export;

/**
 * One persisted chunk of an export. Part 0 is the summary record; data parts
 * are numbered from 1.
 */
public record DataDumpPart(String id, String request, int part, int total, String data) {
}
