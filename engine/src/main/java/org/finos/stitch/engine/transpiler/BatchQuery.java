package org.finos.stitch.engine.transpiler;

import java.util.List;
import java.util.Objects;

/**
 * A parameterized query ready for a {@code QueryBackend}.
 * 
 * @param sql The query text with positional parameter markers
 * @param parameters The values bound to the markers, in order
 */
public record BatchQuery(String sql, List<Object> parameters) {

    public BatchQuery {
        Objects.requireNonNull(sql, "SQL cannot be null");
        parameters = List.copyOf(parameters);
    }

    @Override
    public String toString() {
        return sql + " " + parameters;
    }
}
