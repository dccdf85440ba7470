package org.finos.stitch.engine.server;

import org.finos.stitch.engine.execution.IncludeController;
import org.finos.stitch.engine.execution.IncludeOutcome;
import org.finos.stitch.engine.execution.QueryBackend;
import org.finos.stitch.engine.plan.SortDirection;
import org.finos.stitch.engine.store.Column;
import org.finos.stitch.engine.store.EntityDefinition;
import org.finos.stitch.engine.store.RelationGraph;
import org.finos.stitch.engine.transpiler.BatchQuery;
import org.finos.stitch.engine.transpiler.BatchQueryGenerator;
import org.finos.stitch.engine.transpiler.OrderTerm;
import org.finos.stitch.engine.transpiler.RowFilter;
import org.finos.stitch.engine.transpiler.SQLDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Serves list requests: fetches a page of root rows and resolves the requested
 * includes on them.
 * 
 * Request body fields: {@code where} (see {@link RowFilterParser}), {@code limit}
 * (1..1000, default 50), {@code offset} (default 0), {@code orderBy} (a column or
 * an array of columns), {@code order} ("asc"/"desc", or an array matching
 * {@code orderBy}; missing entries are "asc") and {@code include}.
 */
public class ListService {

    private static final Logger LOG = LoggerFactory.getLogger(ListService.class);

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 1000;

    private static final Set<String> FIELDS = Set.of("where", "limit", "offset", "orderBy", "order", "include");

    private final RelationGraph graph;
    private final QueryBackend backend;
    private final BatchQueryGenerator generator;
    private final IncludeController controller;

    public ListService(RelationGraph graph, QueryBackend backend, SQLDialect dialect, IncludeController controller) {
        this.graph = graph;
        this.backend = backend;
        this.generator = new BatchQueryGenerator(dialect);
        this.controller = controller;
    }

    /**
     * Lists rows of an entity.
     * 
     * @param entity  The entity to list
     * @param request The parsed request body
     * @return The include outcome, carrying HTTP status and body
     * @throws ListRequestException if the entity is unknown or the request malformed
     * @throws SQLException         if the root query fails
     */
    public IncludeOutcome list(String entity, Map<String, Object> request) throws SQLException {
        EntityDefinition definition = graph.entity(entity)
                .orElseThrow(() -> new ListRequestException(404, "Unknown entity: " + entity));

        for (String field : request.keySet()) {
            if (!FIELDS.contains(field)) {
                throw new ListRequestException(400, "Unknown field '" + field + "'");
            }
        }

        int limit = intField(request, "limit", DEFAULT_LIMIT);
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new ListRequestException(400, "limit must be between 1 and " + MAX_LIMIT);
        }
        int offset = intField(request, "offset", 0);
        if (offset < 0) {
            throw new ListRequestException(400, "offset must be nonnegative");
        }

        RowFilter filter = RowFilterParser.parse(definition, request.get("where"));
        List<OrderTerm> orderBy = orderTerms(definition, request.get("orderBy"), request.get("order"));

        BatchQuery query = generator.list(definition, filter, limit, offset, orderBy);
        List<Map<String, Object>> rows = backend.execute(query.sql(), query.parameters());
        LOG.debug("LIST {} ({} params) -> {} rows", entity, query.parameters().size(), rows.size());

        return controller.resolve(entity, rows, request.get("include"));
    }

    private static List<OrderTerm> orderTerms(EntityDefinition entity, Object rawOrderBy, Object rawOrder) {
        if (rawOrderBy == null) {
            return List.of();
        }
        List<?> columns = rawOrderBy instanceof List<?> list ? list : List.of(rawOrderBy);
        List<?> directions = rawOrder == null ? List.of()
                : rawOrder instanceof List<?> array ? array : Collections.nCopies(columns.size(), rawOrder);
        if (columns.isEmpty()) {
            throw new ListRequestException(400, "orderBy must name at least one column");
        }
        if (directions.size() > columns.size()) {
            throw new ListRequestException(400, "order has more directions than orderBy has columns");
        }

        List<OrderTerm> terms = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            Object column = columns.get(i);
            Optional<Column> definition = column instanceof String name ? entity.findColumn(name) : Optional.empty();
            if (definition.isEmpty() || !definition.get().orderable()) {
                throw new ListRequestException(400, "orderBy must name orderable columns of " + entity.name());
            }
            SortDirection direction = SortDirection.ASC;
            if (i < directions.size()) {
                Object rawDirection = directions.get(i);
                direction = (rawDirection instanceof String s ? SortDirection.fromWire(s)
                        : Optional.<SortDirection>empty())
                        .orElseThrow(() -> new ListRequestException(400, "order must be \"asc\" or \"desc\""));
            }
            terms.add(new OrderTerm(definition.get().name(), direction));
        }
        return terms;
    }

    private static int intField(Map<String, Object> request, String field, int defaultValue) {
        Object value = request.get(field);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Long || value instanceof Integer) {
            long l = ((Number) value).longValue();
            if (l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
                return (int) l;
            }
        }
        throw new ListRequestException(400, field + " must be an integer");
    }
}
