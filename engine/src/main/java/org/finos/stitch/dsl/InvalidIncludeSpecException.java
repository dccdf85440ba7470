package org.finos.stitch.dsl;

/**
 * The request is not a well-formed include spec: wrong value types, unknown
 * option names, out-of-range pagination or columns the target entity lacks.
 */
public class InvalidIncludeSpecException extends IncludeCompileException {

    private final String key;

    public InvalidIncludeSpecException(String entity, String key, String reason) {
        super(entity, key == null
                ? "Invalid include spec on entity '" + entity + "': " + reason
                : "Invalid include '" + key + "' on entity '" + entity + "': " + reason);
        this.key = key;
    }

    /**
     * @return The offending include key, or null when the whole spec is malformed
     */
    public String getKey() {
        return key;
    }
}
