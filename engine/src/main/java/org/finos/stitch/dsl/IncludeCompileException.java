package org.finos.stitch.dsl;

/**
 * Exception thrown when an include request cannot be compiled into a plan.
 * 
 * Always a caller-input problem: the whole request is rejected and no partial
 * plan exists.
 */
public class IncludeCompileException extends RuntimeException {

    private final String entity;

    public IncludeCompileException(String entity, String message) {
        super(message);
        this.entity = entity;
    }

    /**
     * @return The entity being compiled when the error was found
     */
    public String getEntity() {
        return entity;
    }
}
