package space.ketterling.sensornet.aggregate;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Supported aggregate functions. Anything not listed here is rejected during
 * request validation.
 */
public enum AggregateFunction {
    AVG("avg", true),
    MIN("min", true),
    MAX("max", true),
    SUM("sum", true),
    COUNT("count", false);

    private final String sqlName;
    private final boolean numericOnly;

    AggregateFunction(String sqlName, boolean numericOnly) {
        this.sqlName = sqlName;
        this.numericOnly = numericOnly;
    }

    /** Name used in requests and SQL. */
    public String sqlName() {
        return sqlName;
    }

    /** Whether the function needs a numeric column. */
    public boolean numericOnly() {
        return numericOnly;
    }

    /**
     * SQL expression applying this function to an already-quoted column.
     */
    public String apply(String quotedColumn) {
        return sqlName + "(" + quotedColumn + ")";
    }

    public static Optional<AggregateFunction> lookup(String name) {
        if (name == null)
            return Optional.empty();
        String n = name.trim().toLowerCase();
        for (AggregateFunction f : values()) {
            if (f.sqlName.equals(n))
                return Optional.of(f);
        }
        return Optional.empty();
    }

    public static List<String> names() {
        return Arrays.stream(values()).map(AggregateFunction::sqlName).toList();
    }
}
