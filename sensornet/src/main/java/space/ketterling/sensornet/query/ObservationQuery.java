package space.ketterling.sensornet.query;

import space.ketterling.sensornet.schema.TableSchema;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounded, filtered select over one feature table, ordered by datetime.
 */
public final class ObservationQuery {
    private final TableSchema schema;
    private final List<String> predicates;
    private final List<Object> params;
    private final Integer limit;
    private final Integer offset;

    ObservationQuery(TableSchema schema, List<String> predicates, List<Object> params, Integer limit,
            Integer offset) {
        this.schema = schema;
        this.predicates = List.copyOf(predicates);
        this.params = new ArrayList<>(params);
        this.limit = limit;
        this.offset = offset;
    }

    public String feature() {
        return schema.table();
    }

    public TableSchema schema() {
        return schema;
    }

    public Integer limit() {
        return limit;
    }

    public Integer offset() {
        return offset;
    }

    /**
     * Row select with every column of the table. The cached column names
     * travel with the statement so the store can spot a changed table.
     */
    public SqlStatement select() {
        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(SqlStatement.quote(schema.table()));
        if (!predicates.isEmpty())
            sql.append(" WHERE ").append(String.join(" AND ", predicates));
        sql.append(" ORDER BY ").append(SqlStatement.quote(TableSchema.DATETIME));

        List<Object> all = new ArrayList<>(params);
        if (limit != null) {
            sql.append(" LIMIT ?");
            all.add(limit);
        }
        if (offset != null) {
            sql.append(" OFFSET ?");
            all.add(offset);
        }
        return new SqlStatement(schema.table(), sql.toString(), all, schema.columnNames());
    }

    /**
     * Row count of {@link #select()}, honoring limit and offset.
     */
    public SqlStatement count() {
        SqlStatement inner = select();
        return new SqlStatement(schema.table(), "SELECT COUNT(*) FROM (" + inner.sql() + ") AS q", inner.params());
    }

    @Override
    public String toString() {
        return select().sql();
    }
}
