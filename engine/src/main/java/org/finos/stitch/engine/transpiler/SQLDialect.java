package org.finos.stitch.engine.transpiler;

import org.finos.stitch.engine.plan.SortDirection;

/**
 * Interface defining SQL dialect-specific behavior.
 * Implementations handle differences between database engines.
 */
public interface SQLDialect {

    /**
     * @return The dialect name (e.g., "DuckDB", "SQLite")
     */
    String name();

    /**
     * Quote an identifier (table name, column name).
     * 
     * @param identifier The identifier to quote
     * @return The quoted identifier
     */
    String quoteIdentifier(String identifier);

    /**
     * Positional parameter marker.
     * 
     * @param index 1-based parameter position
     * @return The marker, "?" for JDBC drivers
     */
    default String parameter(int index) {
        return "?";
    }

    /**
     * Render one ORDER BY term. NULLs sort last in either direction.
     * 
     * @param quotedColumn The already quoted column
     * @param direction    Sort direction
     */
    default String orderTerm(String quotedColumn, SortDirection direction) {
        return quotedColumn + " " + direction.toSql() + " NULLS LAST";
    }

    /**
     * Whether composite key membership can be written as
     * {@code ("a", "b") IN (VALUES (?, ?), ...)} instead of an OR of AND-groups.
     */
    default boolean supportsRowValueIn() {
        return false;
    }

    /**
     * Case-insensitive LIKE.
     * 
     * @param quotedColumn The already quoted column
     * @param parameter    The pattern's parameter marker
     */
    default String caseInsensitiveLike(String quotedColumn, String parameter) {
        return quotedColumn + " ILIKE " + parameter;
    }

    /**
     * Render LIMIT/OFFSET for a root list query.
     * 
     * @param limit  Row limit, or null for none
     * @param offset Rows to skip (0 for none)
     * @return The clause with a leading space, or an empty string
     */
    default String limitOffset(Integer limit, int offset) {
        StringBuilder sb = new StringBuilder();
        if (limit != null) {
            sb.append(" LIMIT ").append(limit);
        }
        if (offset > 0) {
            sb.append(" OFFSET ").append(offset);
        }
        return sb.toString();
    }
}
