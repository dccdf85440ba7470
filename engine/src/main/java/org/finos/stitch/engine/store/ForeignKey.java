package org.finos.stitch.engine.store;

import java.util.List;
import java.util.Objects;

/**
 * A foreign key declared on an entity.
 * 
 * @param columns The referencing columns on the declaring entity
 * @param referencedEntity The entity being referenced
 * @param referencedColumns The referenced columns, positionally matched with {@code columns}
 */
public record ForeignKey(
        List<String> columns,
        String referencedEntity,
        List<String> referencedColumns
) {
    public ForeignKey {
        Objects.requireNonNull(columns, "Foreign key columns cannot be null");
        Objects.requireNonNull(referencedEntity, "Referenced entity cannot be null");
        Objects.requireNonNull(referencedColumns, "Referenced columns cannot be null");
        columns = List.copyOf(columns);
        referencedColumns = List.copyOf(referencedColumns);

        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Foreign key must have at least one column");
        }
        if (columns.size() != referencedColumns.size()) {
            throw new IllegalArgumentException("Foreign key " + columns + " -> " + referencedEntity
                    + referencedColumns + " has mismatched column counts");
        }
    }

    /**
     * Single-column foreign key.
     */
    public static ForeignKey of(String column, String referencedEntity, String referencedColumn) {
        return new ForeignKey(List.of(column), referencedEntity, List.of(referencedColumn));
    }
}
