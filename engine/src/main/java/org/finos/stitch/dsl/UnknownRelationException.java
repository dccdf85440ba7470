package org.finos.stitch.dsl;

/**
 * The request referenced a relation key that is not declared on the entity at
 * that level.
 */
public class UnknownRelationException extends IncludeCompileException {

    private final String key;

    public UnknownRelationException(String entity, String key) {
        super(entity, "Unknown include key '" + key + "' on entity '" + entity + "'");
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
