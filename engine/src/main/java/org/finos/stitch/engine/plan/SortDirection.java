package org.finos.stitch.engine.plan;

import java.util.Optional;

/**
 * Ordering direction for a relation's {@code orderBy} column.
 */
public enum SortDirection {
    ASC,
    DESC;

    public String toSql() {
        return name();
    }

    /**
     * Parses the wire form ({@code "asc"} or {@code "desc"}).
     */
    public static Optional<SortDirection> fromWire(String value) {
        return switch (value) {
            case "asc" -> Optional.of(ASC);
            case "desc" -> Optional.of(DESC);
            default -> Optional.empty();
        };
    }
}
