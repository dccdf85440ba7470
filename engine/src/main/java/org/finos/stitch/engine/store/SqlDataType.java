package org.finos.stitch.engine.store;

import java.math.BigInteger;
import java.util.Locale;

/**
 * Represents SQL data types for entity columns.
 */
public enum SqlDataType {
    VARCHAR,
    INTEGER,
    BIGINT,
    BOOLEAN,
    DATE,
    TIMESTAMP,
    DOUBLE,
    DECIMAL,
    UUID,
    JSON;

    /**
     * JSON documents have no total order; every other type can appear in ORDER BY.
     */
    public boolean isOrderable() {
        return this != JSON;
    }

    /**
     * Whether a decoded request value can be bound against a column of this type.
     * Dates, timestamps and UUIDs travel as strings.
     * 
     * @param value A non-null String, Number or Boolean
     */
    public boolean accepts(Object value) {
        return switch (this) {
            case VARCHAR, DATE, TIMESTAMP, UUID, JSON -> value instanceof String;
            case INTEGER, BIGINT -> value instanceof Long || value instanceof Integer;
            case DOUBLE, DECIMAL -> value instanceof Number && !(value instanceof BigInteger);
            case BOOLEAN -> value instanceof Boolean;
        };
    }

    /**
     * Resolves a declared SQL type name, ignoring length/precision suffixes.
     * 
     * @param typeName e.g. "varchar(100)", "INT", "text"
     * @return The matching data type
     * @throws IllegalArgumentException if the type is not recognized
     */
    public static SqlDataType fromTypeName(String typeName) {
        String base = typeName.trim().toUpperCase(Locale.ROOT);
        int paren = base.indexOf('(');
        if (paren > 0) {
            base = base.substring(0, paren).trim();
        }
        return switch (base) {
            case "VARCHAR", "TEXT", "CHAR", "STRING" -> VARCHAR;
            case "INTEGER", "INT", "INT4", "SMALLINT", "SERIAL" -> INTEGER;
            case "BIGINT", "INT8", "BIGSERIAL" -> BIGINT;
            case "BOOLEAN", "BOOL" -> BOOLEAN;
            case "DATE" -> DATE;
            case "TIMESTAMP", "TIMESTAMPTZ", "DATETIME" -> TIMESTAMP;
            case "DOUBLE", "FLOAT", "REAL", "FLOAT8" -> DOUBLE;
            case "DECIMAL", "NUMERIC" -> DECIMAL;
            case "UUID" -> UUID;
            case "JSON", "JSONB" -> JSON;
            default -> throw new IllegalArgumentException("Unsupported column type: " + typeName);
        };
    }
}
