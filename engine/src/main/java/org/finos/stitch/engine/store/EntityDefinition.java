package org.finos.stitch.engine.store;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A named row collection (a table) with its columns, primary key and foreign keys.
 * 
 * @param name The entity (table) name
 * @param columns Immutable list of columns
 * @param primaryKey Primary key column names, in key order (single or composite)
 * @param foreignKeys Foreign keys declared on this entity
 */
public record EntityDefinition(
        String name,
        List<Column> columns,
        List<String> primaryKey,
        List<ForeignKey> foreignKeys
) {
    public EntityDefinition {
        Objects.requireNonNull(name, "Entity name cannot be null");
        Objects.requireNonNull(columns, "Columns cannot be null");
        Objects.requireNonNull(primaryKey, "Primary key cannot be null");
        Objects.requireNonNull(foreignKeys, "Foreign keys cannot be null");

        if (name.isBlank()) {
            throw new IllegalArgumentException("Entity name cannot be blank");
        }

        // Ensure immutability
        columns = List.copyOf(columns);
        primaryKey = List.copyOf(primaryKey);
        foreignKeys = List.copyOf(foreignKeys);

        for (String pk : primaryKey) {
            if (columns.stream().noneMatch(c -> c.name().equals(pk))) {
                throw new IllegalArgumentException(
                        "Primary key column '" + pk + "' not found in entity " + name);
            }
        }
        for (ForeignKey fk : foreignKeys) {
            for (String col : fk.columns()) {
                if (columns.stream().noneMatch(c -> c.name().equals(col))) {
                    throw new IllegalArgumentException(
                            "Foreign key column '" + col + "' not found in entity " + name);
                }
            }
        }
    }

    /**
     * Creates an entity without foreign keys.
     */
    public EntityDefinition(String name, List<Column> columns, List<String> primaryKey) {
        this(name, columns, primaryKey, List.of());
    }

    /**
     * Finds a column by name.
     * 
     * @param columnName The column name to search for
     * @return Optional containing the column if found
     */
    public Optional<Column> findColumn(String columnName) {
        return columns.stream()
                .filter(c -> c.name().equals(columnName))
                .findFirst();
    }

    public boolean hasColumn(String columnName) {
        return findColumn(columnName).isPresent();
    }

    /**
     * @return Column names in declaration order
     */
    public List<String> columnNames() {
        return columns.stream().map(Column::name).toList();
    }
}
