package space.ketterling.sensornet.schema;

/**
 * One column of an observation table.
 */
public record ColumnDef(String name, SemanticType type) {
}
