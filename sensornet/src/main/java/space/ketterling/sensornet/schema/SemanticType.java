package space.ketterling.sensornet.schema;

import java.sql.Types;

/**
 * Coarse column types, enough to tell which columns can be aggregated.
 */
public enum SemanticType {
    NUMERIC,
    TEXT,
    TIMESTAMP,
    BOOLEAN,
    OTHER;

    /**
     * Maps a {@link java.sql.Types} code.
     */
    public static SemanticType fromJdbc(int sqlType) {
        return switch (sqlType) {
            case Types.SMALLINT, Types.INTEGER, Types.BIGINT, Types.TINYINT,
                    Types.REAL, Types.FLOAT, Types.DOUBLE, Types.NUMERIC, Types.DECIMAL -> NUMERIC;
            case Types.CHAR, Types.VARCHAR, Types.LONGVARCHAR, Types.NCHAR, Types.NVARCHAR -> TEXT;
            case Types.DATE, Types.TIMESTAMP, Types.TIMESTAMP_WITH_TIMEZONE -> TIMESTAMP;
            case Types.BOOLEAN, Types.BIT -> BOOLEAN;
            default -> OTHER;
        };
    }
}
