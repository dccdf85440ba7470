package org.finos.stitch.engine.store;

import java.util.Objects;

/**
 * A column of an entity as declared in the schema.
 * 
 * The declared type decides which request values may be compared against the
 * column and whether it can be ordered on.
 * 
 * @param name The column name
 * @param dataType The declared SQL type
 * @param nullable Whether the column admits NULL
 */
public record Column(String name, SqlDataType dataType, boolean nullable) {

    public Column {
        Objects.requireNonNull(name, "Column name cannot be null");
        Objects.requireNonNull(dataType, "Column dataType cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Column name cannot be blank");
        }
    }

    public static Column required(String name, SqlDataType dataType) {
        return new Column(name, dataType, false);
    }

    public static Column nullable(String name, SqlDataType dataType) {
        return new Column(name, dataType, true);
    }

    public boolean orderable() {
        return dataType.isOrderable();
    }

    /**
     * @param value A decoded request value; null is accepted only by nullable columns
     */
    public boolean accepts(Object value) {
        return value == null ? nullable : dataType.accepts(value);
    }
}
