package org.finos.stitch.engine.execution;

import org.eclipse.collections.impl.factory.Multimaps;
import org.eclipse.collections.api.multimap.list.MutableListMultimap;
import org.finos.stitch.engine.plan.IncludeNode;
import org.finos.stitch.engine.plan.IncludeOptions;
import org.finos.stitch.engine.plan.IncludePlan;
import org.finos.stitch.engine.plan.SortDirection;
import org.finos.stitch.engine.store.EntityDefinition;
import org.finos.stitch.engine.store.JoinDescriptor;
import org.finos.stitch.engine.store.RelationDescriptor;
import org.finos.stitch.engine.store.RelationGraph;
import org.finos.stitch.engine.transpiler.BatchQuery;
import org.finos.stitch.engine.transpiler.BatchQueryGenerator;
import org.finos.stitch.engine.transpiler.OrderTerm;
import org.finos.stitch.engine.transpiler.SQLDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Executes an {@link IncludePlan} as batched queries and stitches the results onto
 * parent rows.
 *
 * Work proceeds level by level. For each level:
 * <ol>
 * <li>every sibling relation is fetched with one query (two for many_via_join),
 * concurrently when an executor is configured</li>
 * <li>the fetched rows are attached to their parents on the calling thread, in plan order</li>
 * <li>each relation with nested includes recurses on the rows just attached</li>
 * </ol>
 *
 * Stitched values: {@code one} relations attach a row or {@code null}; {@code many}
 * and {@code many_via_join} attach a list (possibly empty). Pagination is applied
 * per parent.
 *
 * Input rows are copied, never mutated. If a sibling query fails, the remaining
 * in-flight siblings of that level are awaited before the first failure (in plan
 * order) is thrown.
 */
public class BatchStitcher {

    private final RelationGraph graph;
    private final QueryBackend backend;
    private final BatchQueryGenerator generator;
    private final ExecutorService executor;
    private final int fanOut;
    private final Logger log;

    /**
     * Creates a stitcher that resolves sibling relations sequentially.
     */
    public BatchStitcher(RelationGraph graph, QueryBackend backend, SQLDialect dialect) {
        this(graph, backend, dialect, null, 1, LoggerFactory.getLogger(BatchStitcher.class));
    }

    /**
     * @param graph    The relation graph plans were compiled against
     * @param backend  Runs the batch queries
     * @param dialect  SQL dialect of the backend
     * @param executor Runs sibling fetches; null to fetch on the calling thread
     * @param fanOut   Maximum sibling fetches in flight per level
     * @param log      Receives one debug line per batch query
     */
    public BatchStitcher(RelationGraph graph, QueryBackend backend, SQLDialect dialect,
            ExecutorService executor, int fanOut, Logger log) {
        if (fanOut < 1) {
            throw new IllegalArgumentException("fanOut must be at least 1: " + fanOut);
        }
        this.graph = graph;
        this.backend = backend;
        this.generator = new BatchQueryGenerator(dialect);
        this.executor = executor;
        this.fanOut = fanOut;
        this.log = log;
    }

    /**
     * Stitches a compiled plan onto root rows.
     *
     * @param plan The compiled plan
     * @param rows Root rows of {@code plan.rootEntity()}
     * @return Copies of the rows with one extra key per resolved relation
     * @throws QueryExecutionException If any batch query fails
     */
    public List<Map<String, Object>> stitch(IncludePlan plan, List<Map<String, Object>> rows)
            throws QueryExecutionException {
        if (log.isTraceEnabled()) {
            log.trace("Stitching {} rows with plan:\n{}", rows.size(), plan.explain());
        }
        return stitch(plan.rootEntity(), rows, plan.nodes());
    }

    /**
     * Stitches one plan level (and everything nested below it) onto rows of an entity.
     *
     * @param entity The entity of {@code rows}
     * @param rows   Parent rows
     * @param level  Plan nodes for relations of {@code entity}
     * @return Copies of the rows with the relations attached
     * @throws QueryExecutionException If any batch query fails
     */
    public List<Map<String, Object>> stitch(String entity, List<Map<String, Object>> rows, List<IncludeNode> level)
            throws QueryExecutionException {
        List<Map<String, Object>> copies = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            copies.add(new LinkedHashMap<>(row));
        }
        stitchLevel(entity, copies, level);
        return copies;
    }

    private void stitchLevel(String entity, List<Map<String, Object>> rows, List<IncludeNode> level)
            throws QueryExecutionException {
        if (rows.isEmpty() || level.isEmpty()) {
            return;
        }

        List<Fetched> fetched = fetchLevel(entity, rows, level);
        for (int i = 0; i < level.size(); i++) {
            attach(rows, level.get(i), fetched.get(i));
        }

        for (int i = 0; i < level.size(); i++) {
            IncludeNode node = level.get(i);
            List<Map<String, Object>> attached = attachedRows(rows, node);
            if (node.hasChildren()) {
                stitchLevel(node.relation().targetEntity(), attached, node.children());
            }
            Set<String> hidden = fetched.get(i).hiddenColumns();
            if (!hidden.isEmpty()) {
                for (Map<String, Object> child : attached) {
                    child.keySet().removeAll(hidden);
                }
            }
        }
    }

    // ==================== Fetching ====================

    /**
     * Rows fetched for one relation.
     *
     * @param targets       Target rows (fresh, mutable maps)
     * @param joinRows      Join rows, many_via_join only
     * @param hiddenColumns Columns fetched only for stitching, removed once the subtree is done
     */
    private record Fetched(List<Map<String, Object>> targets, List<Map<String, Object>> joinRows,
            Set<String> hiddenColumns) {
    }

    private List<Fetched> fetchLevel(String entity, List<Map<String, Object>> rows, List<IncludeNode> level)
            throws QueryExecutionException {
        List<Fetched> results = new ArrayList<>(level.size());
        if (executor == null || fanOut == 1 || level.size() == 1) {
            for (IncludeNode node : level) {
                results.add(fetch(entity, rows, node));
            }
            return results;
        }

        Semaphore permits = new Semaphore(fanOut);
        List<CompletableFuture<Fetched>> futures = new ArrayList<>(level.size());
        for (IncludeNode node : level) {
            permits.acquireUninterruptibly();
            try {
                futures.add(CompletableFuture.supplyAsync(() -> {
                    try {
                        return fetch(entity, rows, node);
                    } catch (QueryExecutionException e) {
                        throw new CompletionException(e);
                    } finally {
                        permits.release();
                    }
                }, executor));
            } catch (RejectedExecutionException e) {
                permits.release();
                futures.add(CompletableFuture.failedFuture(e));
            }
        }

        // Wait for every sibling, then surface the first failure in plan order
        Throwable first = null;
        for (CompletableFuture<Fetched> future : futures) {
            try {
                results.add(future.join());
            } catch (CompletionException e) {
                if (first == null) {
                    first = e.getCause() != null ? e.getCause() : e;
                }
            }
        }
        if (first instanceof QueryExecutionException qee) {
            throw qee;
        }
        if (first instanceof RuntimeException re) {
            throw re;
        }
        if (first != null) {
            throw new IllegalStateException("Sibling fetch failed", first);
        }
        return results;
    }

    private Fetched fetch(String entity, List<Map<String, Object>> rows, IncludeNode node)
            throws QueryExecutionException {
        RelationDescriptor relation = node.relation();
        List<List<Object>> parentKeys = distinctKeys(rows, relation.sourceKey());
        Projection projection = projection(node);
        if (parentKeys.isEmpty()) {
            return new Fetched(List.of(), List.of(), projection.hidden());
        }

        EntityDefinition target = graph.getEntity(relation.targetEntity());
        return switch (relation.kind()) {
            case ONE -> {
                BatchQuery query = generator.selectByKeys(target, projection.fetch(), relation.targetKey(),
                        parentKeys, primaryKeyOrder(target));
                yield new Fetched(run(query, entity, node), List.of(), projection.hidden());
            }
            case MANY -> {
                List<OrderTerm> order = new ArrayList<>();
                relation.targetKey().forEach(c -> order.add(OrderTerm.asc(c)));
                node.options().orderBy().ifPresent(c -> order.add(new OrderTerm(c, node.options().order())));
                BatchQuery query = generator.selectByKeys(target, projection.fetch(), relation.targetKey(),
                        parentKeys, BatchQueryGenerator.withTieBreaker(order, target.primaryKey()));
                yield new Fetched(run(query, entity, node), List.of(), projection.hidden());
            }
            case MANY_VIA_JOIN -> fetchViaJoin(entity, node, parentKeys, target, projection);
        };
    }

    private Fetched fetchViaJoin(String entity, IncludeNode node, List<List<Object>> parentKeys,
            EntityDefinition target, Projection projection) throws QueryExecutionException {
        JoinDescriptor join = node.relation().via().orElseThrow();
        EntityDefinition joinEntity = graph.getEntity(join.joinEntity());

        // 1) join rows for the parents, projected to (source key, target key)
        List<String> joinColumns = new ArrayList<>(join.sourceColumns());
        joinColumns.addAll(join.targetColumns());
        List<OrderTerm> joinOrder = new ArrayList<>();
        join.sourceColumns().forEach(c -> joinOrder.add(OrderTerm.asc(c)));
        BatchQuery joinQuery = generator.selectByKeys(joinEntity, joinColumns, join.sourceColumns(), parentKeys,
                BatchQueryGenerator.withTieBreaker(joinOrder, joinEntity.primaryKey()));
        List<Map<String, Object>> joinRows = run(joinQuery, entity, node);

        List<List<Object>> targetKeys = distinctKeys(joinRows, join.targetColumns());
        if (targetKeys.isEmpty()) {
            return new Fetched(List.of(), joinRows, projection.hidden());
        }

        // 2) targets referenced by those join rows
        BatchQuery targetQuery = generator.selectByKeys(target, projection.fetch(), node.relation().targetKey(),
                targetKeys, primaryKeyOrder(target));
        return new Fetched(run(targetQuery, entity, node), joinRows, projection.hidden());
    }

    private List<Map<String, Object>> run(BatchQuery query, String entity, IncludeNode node)
            throws QueryExecutionException {
        List<Map<String, Object>> result;
        try {
            result = backend.execute(query.sql(), query.parameters());
        } catch (SQLException | RuntimeException e) {
            log.debug("Batch query for {}.{} at depth {} failed: {}", entity, node.key(), node.depth(), query.sql());
            throw new QueryExecutionException(entity, node.key(), node.depth(), e);
        }
        log.debug("{}.{} [{}] depth {}: {} ({} params) -> {} rows", entity, node.key(),
                node.relation().kind().wireName(), node.depth(), query.sql(), query.parameters().size(),
                result.size());

        List<Map<String, Object>> rows = new ArrayList<>(result.size());
        for (Map<String, Object> row : result) {
            rows.add(new LinkedHashMap<>(row));
        }
        return rows;
    }

    // ==================== Stitching ====================

    private void attach(List<Map<String, Object>> rows, IncludeNode node, Fetched fetched) {
        RelationDescriptor relation = node.relation();
        switch (relation.kind()) {
            case ONE -> {
                Map<KeyTuple, Map<String, Object>> index = index(fetched.targets(), relation.targetKey());
                for (Map<String, Object> row : rows) {
                    row.put(node.key(), KeyTuple.read(row, relation.sourceKey()).map(index::get).orElse(null));
                }
            }
            case MANY -> {
                MutableListMultimap<KeyTuple, Map<String, Object>> groups = group(fetched.targets(),
                        relation.targetKey());
                for (Map<String, Object> row : rows) {
                    List<Map<String, Object>> children = KeyTuple.read(row, relation.sourceKey())
                            .<List<Map<String, Object>>>map(groups::get)
                            .orElse(List.of());
                    row.put(node.key(), new ArrayList<>(node.options().window(children)));
                }
            }
            case MANY_VIA_JOIN -> attachViaJoin(rows, node, fetched);
        }
    }

    private void attachViaJoin(List<Map<String, Object>> rows, IncludeNode node, Fetched fetched) {
        RelationDescriptor relation = node.relation();
        JoinDescriptor join = relation.via().orElseThrow();
        IncludeOptions options = node.options();
        Map<KeyTuple, Map<String, Object>> targets = index(fetched.targets(), relation.targetKey());
        MutableListMultimap<KeyTuple, Map<String, Object>> joinsByParent = group(fetched.joinRows(),
                join.sourceColumns());

        for (Map<String, Object> row : rows) {
            List<Map<String, Object>> resolved = new ArrayList<>();
            KeyTuple.read(row, relation.sourceKey()).ifPresent(parentKey -> {
                Set<KeyTuple> seen = join.unique() ? new HashSet<>() : null;
                for (Map<String, Object> joinRow : joinsByParent.get(parentKey)) {
                    KeyTuple targetKey = KeyTuple.read(joinRow, join.targetColumns()).orElse(null);
                    Map<String, Object> target = targetKey == null ? null : targets.get(targetKey);
                    if (target == null || (seen != null && !seen.add(targetKey))) {
                        continue;
                    }
                    resolved.add(target);
                }
            });
            options.orderBy().ifPresent(column -> resolved.sort(byColumn(column, options.order())));
            row.put(node.key(), new ArrayList<>(options.window(resolved)));
        }
    }

    /**
     * Rows attached under the node's key, each distinct instance once.
     */
    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> attachedRows(List<Map<String, Object>> rows, IncludeNode node) {
        Set<Map<String, Object>> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Map<String, Object>> result = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            Object value = row.get(node.key());
            if (value instanceof Map<?, ?> single) {
                if (distinct.add((Map<String, Object>) single)) {
                    result.add((Map<String, Object>) single);
                }
            } else if (value instanceof List<?> many) {
                for (Object item : many) {
                    if (distinct.add((Map<String, Object>) item)) {
                        result.add((Map<String, Object>) item);
                    }
                }
            }
        }
        return result;
    }

    // ==================== Helpers ====================

    /**
     * Columns to fetch for a node's target rows and those to hide afterwards.
     */
    private record Projection(List<String> fetch, Set<String> hidden) {
    }

    private Projection projection(IncludeNode node) {
        IncludeOptions options = node.options();
        if (!options.hasProjection()) {
            return new Projection(List.of(), Set.of());
        }
        RelationDescriptor relation = node.relation();
        EntityDefinition target = graph.getEntity(relation.targetEntity());

        Set<String> visible = new LinkedHashSet<>(options.select().isEmpty() ? target.columnNames() : options.select());
        options.exclude().forEach(visible::remove);

        Set<String> fetch = new LinkedHashSet<>(visible);
        fetch.addAll(relation.targetKey());
        options.orderBy().ifPresent(fetch::add);
        for (IncludeNode child : node.children()) {
            fetch.addAll(child.relation().sourceKey());
        }

        Set<String> hidden = new LinkedHashSet<>(fetch);
        hidden.removeAll(visible);
        return new Projection(List.copyOf(fetch), Collections.unmodifiableSet(hidden));
    }

    private static List<OrderTerm> primaryKeyOrder(EntityDefinition entity) {
        return entity.primaryKey().stream().map(OrderTerm::asc).toList();
    }

    private static List<List<Object>> distinctKeys(List<Map<String, Object>> rows, List<String> columns) {
        Set<KeyTuple> seen = new LinkedHashSet<>();
        for (Map<String, Object> row : rows) {
            KeyTuple.read(row, columns).ifPresent(seen::add);
        }
        return seen.stream().map(KeyTuple::values).toList();
    }

    private static Map<KeyTuple, Map<String, Object>> index(List<Map<String, Object>> rows, List<String> columns) {
        Map<KeyTuple, Map<String, Object>> index = new HashMap<>();
        for (Map<String, Object> row : rows) {
            KeyTuple.read(row, columns).ifPresent(key -> index.putIfAbsent(key, row));
        }
        return index;
    }

    private static MutableListMultimap<KeyTuple, Map<String, Object>> group(List<Map<String, Object>> rows,
            List<String> columns) {
        MutableListMultimap<KeyTuple, Map<String, Object>> groups = Multimaps.mutable.list.empty();
        for (Map<String, Object> row : rows) {
            KeyTuple.read(row, columns).ifPresent(key -> groups.put(key, row));
        }
        return groups;
    }

    /**
     * Orders rows by a column; nulls sort last in either direction, as the dialects' ORDER BY does.
     */
    static Comparator<Map<String, Object>> byColumn(String column, SortDirection direction) {
        Comparator<Object> values = BatchStitcher::compareValues;
        if (direction == SortDirection.DESC) {
            values = values.reversed();
        }
        return Comparator.comparing(row -> row.get(column), Comparator.nullsLast(values));
    }

    @SuppressWarnings("unchecked")
    private static int compareValues(Object a, Object b) {
        if (a instanceof Number na && b instanceof Number nb) {
            if (isExact(na) && isExact(nb)) {
                return new BigDecimal(na.toString()).compareTo(new BigDecimal(nb.toString()));
            }
            return Double.compare(na.doubleValue(), nb.doubleValue());
        }
        if (a instanceof Comparable<?> && a.getClass().isInstance(b)) {
            return ((Comparable<Object>) a).compareTo(b);
        }
        return a.toString().compareTo(b.toString());
    }

    private static boolean isExact(Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte
                || n instanceof BigDecimal || n instanceof BigInteger;
    }
}
