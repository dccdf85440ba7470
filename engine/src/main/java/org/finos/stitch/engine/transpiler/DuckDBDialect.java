package org.finos.stitch.engine.transpiler;

/**
 * SQL dialect implementation for DuckDB.
 * DuckDB uses double quotes for identifiers.
 */
public final class DuckDBDialect implements SQLDialect {
    
    public static final DuckDBDialect INSTANCE = new DuckDBDialect();
    
    private DuckDBDialect() {
        // Singleton
    }
    
    @Override
    public String name() {
        return "DuckDB";
    }
    
    @Override
    public String quoteIdentifier(String identifier) {
        // Escape any existing double quotes by doubling them
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
