package org.finos.stitch.engine.execution;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The values of a (possibly composite) key read from one row.
 * 
 * Integral numbers are normalized to {@link Long} so that, say, an INTEGER
 * foreign key equals the BIGINT primary key it references.
 */
record KeyTuple(List<Object> values) {

    KeyTuple {
        values = List.copyOf(values);
    }

    /**
     * Reads the key columns from a row.
     * 
     * @return The tuple, or empty if any key column is null or missing
     */
    static Optional<KeyTuple> read(Map<String, Object> row, List<String> columns) {
        List<Object> values = new ArrayList<>(columns.size());
        for (String column : columns) {
            Object value = row.get(column);
            if (value == null) {
                return Optional.empty();
            }
            values.add(normalize(value));
        }
        return Optional.of(new KeyTuple(values));
    }

    static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big && big.bitLength() < 64) {
            return big.longValue();
        }
        return value;
    }
}
