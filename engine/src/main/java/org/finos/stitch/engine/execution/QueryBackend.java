package org.finos.stitch.engine.execution;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Executes parameterized queries on behalf of the stitcher.
 * 
 * Implementations own connection acquisition, pooling, back-pressure and any retry
 * policy; the stitcher never retries a failed query. Implementations must be safe
 * to call from several threads when the stitcher is given an executor.
 */
@FunctionalInterface
public interface QueryBackend {

    /**
     * Runs a query.
     * 
     * @param sql        Query text with positional parameter markers
     * @param parameters Values for the markers, in order
     * @return Rows as column label to value maps, in result order
     * @throws SQLException If the data store fails
     */
    List<Map<String, Object>> execute(String sql, List<Object> parameters) throws SQLException;
}
