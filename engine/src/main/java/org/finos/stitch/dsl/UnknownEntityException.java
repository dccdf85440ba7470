package org.finos.stitch.dsl;

/**
 * The root entity of an include request is not registered in the relation graph.
 */
public class UnknownEntityException extends IncludeCompileException {

    public UnknownEntityException(String entity) {
        super(entity, "Unknown entity '" + entity + "'");
    }
}
