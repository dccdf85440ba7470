package org.finos.stitch.engine.transpiler;

/**
 * SQL dialect implementation for SQLite.
 * SQLite uses double quotes for identifiers and needs a LIMIT whenever an OFFSET is given.
 * Long OR chains exceed its expression depth limit, so composite keys use row values.
 */
public final class SQLiteDialect implements SQLDialect {
    
    public static final SQLiteDialect INSTANCE = new SQLiteDialect();
    
    private SQLiteDialect() {
        // Singleton
    }
    
    @Override
    public String name() {
        return "SQLite";
    }
    
    @Override
    public String quoteIdentifier(String identifier) {
        // SQLite uses double quotes for identifiers (or backticks, but double quotes are more standard)
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    @Override
    public boolean supportsRowValueIn() {
        return true;
    }

    @Override
    public String caseInsensitiveLike(String quotedColumn, String parameter) {
        return "LOWER(" + quotedColumn + ") LIKE LOWER(" + parameter + ")";
    }

    @Override
    public String limitOffset(Integer limit, int offset) {
        if (limit == null && offset > 0) {
            return " LIMIT -1 OFFSET " + offset;
        }
        return SQLDialect.super.limitOffset(limit, offset);
    }
}
