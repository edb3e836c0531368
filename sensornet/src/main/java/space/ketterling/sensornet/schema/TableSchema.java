package space.ketterling.sensornet.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Introspected column layout of one feature's observation table.
 */
public record TableSchema(String table, List<ColumnDef> columns) {

    public static final String NODE_ID = "node_id";
    public static final String DATETIME = "datetime";
    public static final String SENSOR = "sensor";
    public static final String META_ID = "meta_id";

    /** Columns every observation carries; everything else is a measured property. */
    public static final Set<String> ENVELOPE = Set.of(NODE_ID, DATETIME, SENSOR, META_ID);

    /** Columns a table must have to be queried at all. */
    public static final Set<String> REQUIRED = Set.of(NODE_ID, DATETIME, SENSOR);

    public TableSchema {
        columns = List.copyOf(columns);
    }

    public ColumnDef column(String name) {
        for (ColumnDef c : columns) {
            if (c.name().equalsIgnoreCase(name))
                return c;
        }
        return null;
    }

    public boolean hasColumn(String name) {
        return column(name) != null;
    }

    /**
     * Feature-specific columns, in table order.
     */
    public List<ColumnDef> measuredColumns() {
        List<ColumnDef> out = new ArrayList<>();
        for (ColumnDef c : columns) {
            if (!ENVELOPE.contains(c.name().toLowerCase()))
                out.add(c);
        }
        return out;
    }

    public List<String> columnNames() {
        return columns.stream().map(ColumnDef::name).toList();
    }
}
