package org.finos.stitch.engine.execution;

import org.finos.stitch.dsl.IncludeCompileException;
import org.finos.stitch.dsl.InvalidIncludeSpecException;
import org.finos.stitch.dsl.UnknownRelationException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Terminal state of resolving includes for one request.
 * 
 * <pre>
 * Received -> Compiled  -> Stitched
 *                       -> PartiallyStitched (non-strict, stitch failed)
 *                       -> Aborted           (strict, stitch failed)
 *          -> Rejected  (request did not compile)
 * </pre>
 * 
 * Each outcome knows its HTTP status and response body shape.
 */
public sealed interface IncludeOutcome {

    int httpStatus();

    /**
     * @return The response body: a row list or a JSON-compatible map
     */
    Object responseBody();

    /**
     * The include request was invalid; nothing was fetched.
     */
    record Rejected(IncludeCompileException error) implements IncludeOutcome {
        @Override
        public int httpStatus() {
            return 400;
        }

        @Override
        public Object responseBody() {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", "invalid-include");
            body.put("message", error.getMessage());
            body.put("entity", error.getEntity());
            if (error instanceof UnknownRelationException unknown) {
                body.put("key", unknown.getKey());
            } else if (error instanceof InvalidIncludeSpecException invalid && invalid.getKey() != null) {
                body.put("key", invalid.getKey());
            }
            return body;
        }
    }

    /**
     * Every requested relation was resolved. The body is the bare row array.
     */
    record Stitched(List<Map<String, Object>> rows) implements IncludeOutcome {
        public Stitched {
            rows = List.copyOf(rows);
        }

        @Override
        public int httpStatus() {
            return 200;
        }

        @Override
        public Object responseBody() {
            return rows;
        }
    }

    /**
     * Stitching failed in non-strict mode: root rows are returned as fetched, together
     * with a notice that nested relations are missing.
     */
    record PartiallyStitched(List<Map<String, Object>> rows, IncludeFailure failure, boolean debug)
            implements IncludeOutcome {
        public PartiallyStitched {
            rows = List.copyOf(rows);
        }

        @Override
        public int httpStatus() {
            return 200;
        }

        @Override
        public Object responseBody() {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("data", rows);
            body.put("includeError", failure.toMap(debug));
            return body;
        }
    }

    /**
     * Stitching failed in strict mode: no data is returned.
     */
    record Aborted(IncludeFailure failure, boolean debug) implements IncludeOutcome {
        @Override
        public int httpStatus() {
            return 500;
        }

        @Override
        public Object responseBody() {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", "include-stitch-failed");
            body.putAll(failure.toMap(debug));
            return body;
        }
    }
}
