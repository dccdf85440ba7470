package org.finos.stitch.engine.execution;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Describes a failed stitch to the caller.
 * 
 * @param message Human readable failure message
 * @param entity Entity whose relation failed to load
 * @param relationKey The relation that failed
 * @param depth Plan depth of the failed relation
 * @param cause The underlying exception
 */
public record IncludeFailure(
        String message,
        String entity,
        String relationKey,
        int depth,
        Throwable cause) {

    public static IncludeFailure of(QueryExecutionException e) {
        return new IncludeFailure(e.getMessage(), e.getEntity(), e.getRelationKey(), e.getDepth(), e);
    }

    /**
     * The {@code includeError} / error body fields.
     * 
     * @param debug Whether to add entity, relation, depth, cause chain and stack trace
     */
    public Map<String, Object> toMap(boolean debug) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("message", message);
        if (debug) {
            map.put("entity", entity);
            map.put("relation", relationKey);
            map.put("depth", depth);
            map.put("causes", causeChain());
            map.put("stack", stackTrace());
        }
        return map;
    }

    private List<String> causeChain() {
        List<String> chain = new ArrayList<>();
        for (Throwable t = cause == null ? null : cause.getCause(); t != null; t = t.getCause()) {
            chain.add(t.getClass().getName() + ": " + t.getMessage());
        }
        return chain;
    }

    private String stackTrace() {
        if (cause == null) {
            return null;
        }
        StringWriter out = new StringWriter();
        cause.printStackTrace(new PrintWriter(out));
        return out.toString();
    }
}
