package org.finos.stitch.engine.execution;

/**
 * A batch query failed while resolving a relation.
 * 
 * Carries where in the plan the failure happened. Aborts the stitch invocation it
 * was raised in; never retried by the engine.
 */
public class QueryExecutionException extends Exception {

    private final String entity;
    private final String relationKey;
    private final int depth;

    public QueryExecutionException(String entity, String relationKey, int depth, Throwable cause) {
        super("Failed to load include '" + relationKey + "' of '" + entity + "' at depth " + depth
                + ": " + (cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName()),
                cause);
        this.entity = entity;
        this.relationKey = relationKey;
        this.depth = depth;
    }

    /**
     * @return The entity whose relation was being loaded
     */
    public String getEntity() {
        return entity;
    }

    public String getRelationKey() {
        return relationKey;
    }

    public int getDepth() {
        return depth;
    }
}
