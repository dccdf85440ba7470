package org.finos.stitch.dsl;

import org.finos.stitch.engine.plan.IncludeNode;
import org.finos.stitch.engine.plan.IncludeOptions;
import org.finos.stitch.engine.plan.IncludePlan;
import org.finos.stitch.engine.plan.SortDirection;
import org.finos.stitch.engine.store.EntityDefinition;
import org.finos.stitch.engine.store.RelationDescriptor;
import org.finos.stitch.engine.store.RelationGraph;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Compiles a raw include request into an {@link IncludePlan}.
 * 
 * The raw request is the generic JSON shape of the {@code include} field:
 * 
 * <pre>
 * {
 *   "books": {
 *     "limit": 5,
 *     "orderBy": "published",
 *     "order": "desc",
 *     "include": { "tags": true }
 *   },
 *   "profile": true
 * }
 * </pre>
 * 
 * Compilation is depth-first and all-or-nothing: a key that is not a relation of
 * the entity at its level rejects the whole request. Nesting at or beyond
 * {@code maxDepth} is dropped without being inspected, so requests written for a
 * deeper server configuration still compile.
 * 
 * Compilation performs no I/O and never mutates the graph.
 */
public final class IncludeCompiler {

    static final String INCLUDE = "include";
    static final String LIMIT = "limit";
    static final String OFFSET = "offset";
    static final String ORDER_BY = "orderBy";
    static final String ORDER = "order";
    static final String SELECT = "select";
    static final String EXCLUDE = "exclude";

    private static final Set<String> OPTION_KEYS = Set.of(INCLUDE, LIMIT, OFFSET, ORDER_BY, ORDER, SELECT, EXCLUDE);

    private final RelationGraph graph;

    public IncludeCompiler(RelationGraph graph) {
        this.graph = graph;
    }

    /**
     * Compiles a raw include request.
     * 
     * @param rootEntity The entity the request is applied to
     * @param rawSpec    The raw request: null, or a map from relation name to
     *                   {@code true}/{@code false} or an options map
     * @param maxDepth   Maximum number of nested levels to resolve
     * @return The compiled plan (empty when nothing is requested)
     * @throws UnknownEntityException      if the root entity is not registered
     * @throws UnknownRelationException    if any level names an undeclared relation
     * @throws InvalidIncludeSpecException if the request is malformed
     */
    public IncludePlan compile(String rootEntity, Object rawSpec, int maxDepth) {
        if (graph.entity(rootEntity).isEmpty()) {
            throw new UnknownEntityException(rootEntity);
        }
        if (rawSpec == null || maxDepth <= 0) {
            return IncludePlan.empty(rootEntity, maxDepth);
        }
        Map<String, Object> spec = asSpecMap(rootEntity, null, rawSpec);
        return new IncludePlan(rootEntity, maxDepth, walk(rootEntity, spec, 0, maxDepth));
    }

    private List<IncludeNode> walk(String entity, Map<String, Object> spec, int depth, int maxDepth) {
        List<IncludeNode> nodes = new ArrayList<>(spec.size());
        for (Map.Entry<String, Object> entry : spec.entrySet()) {
            String key = entry.getKey();
            RelationDescriptor relation = graph.lookup(entity, key)
                    .orElseThrow(() -> new UnknownRelationException(entity, key));

            Object value = entry.getValue();
            if (Boolean.TRUE.equals(value)) {
                nodes.add(new IncludeNode.Leaf(relation, depth));
            } else if (Boolean.FALSE.equals(value)) {
                // explicitly not requested
                continue;
            } else if (value instanceof Map<?, ?> optionsMap) {
                nodes.add(compileOptions(entity, key, relation, optionsMap, depth, maxDepth));
            } else {
                throw new InvalidIncludeSpecException(entity, key,
                        "expected true, false or an options object but got " + describe(value));
            }
        }
        return nodes;
    }

    private IncludeNode compileOptions(String entity, String key, RelationDescriptor relation,
            Map<?, ?> raw, int depth, int maxDepth) {
        for (Object optionKey : raw.keySet()) {
            if (!OPTION_KEYS.contains(String.valueOf(optionKey))) {
                throw new InvalidIncludeSpecException(entity, key, "unknown option '" + optionKey + "'");
            }
        }
        EntityDefinition target = graph.getEntity(relation.targetEntity());

        OptionalInt limit = OptionalInt.empty();
        Object rawLimit = raw.get(LIMIT);
        if (rawLimit != null) {
            int value = toInt(entity, key, LIMIT, rawLimit);
            if (value <= 0) {
                throw new InvalidIncludeSpecException(entity, key, "limit must be a positive integer");
            }
            limit = OptionalInt.of(value);
        }

        int offset = 0;
        Object rawOffset = raw.get(OFFSET);
        if (rawOffset != null) {
            offset = toInt(entity, key, OFFSET, rawOffset);
            if (offset < 0) {
                throw new InvalidIncludeSpecException(entity, key, "offset must be a nonnegative integer");
            }
        }

        Optional<String> orderBy = Optional.empty();
        Object rawOrderBy = raw.get(ORDER_BY);
        if (rawOrderBy != null) {
            String column = requireColumn(entity, key, target, ORDER_BY, rawOrderBy);
            if (!target.findColumn(column).orElseThrow().orderable()) {
                throw new InvalidIncludeSpecException(entity, key,
                        "orderBy column '" + column + "' of " + target.name() + " cannot be ordered on");
            }
            orderBy = Optional.of(column);
        }

        SortDirection order = SortDirection.ASC;
        Object rawOrder = raw.get(ORDER);
        if (rawOrder != null) {
            order = (rawOrder instanceof String s ? SortDirection.fromWire(s) : Optional.<SortDirection>empty())
                    .orElseThrow(() -> new InvalidIncludeSpecException(entity, key,
                            "order must be \"asc\" or \"desc\""));
        }

        List<String> select = columnList(entity, key, target, SELECT, raw.get(SELECT));
        List<String> exclude = columnList(entity, key, target, EXCLUDE, raw.get(EXCLUDE));

        IncludeOptions options = new IncludeOptions(limit, offset, orderBy, order, select, exclude);

        List<IncludeNode> children = List.of();
        Object nested = raw.get(INCLUDE);
        if (nested != null && depth + 1 < maxDepth) {
            Map<String, Object> nestedSpec = asSpecMap(entity, key, nested);
            children = walk(relation.targetEntity(), nestedSpec, depth + 1, maxDepth);
        }
        return new IncludeNode.Nested(relation, depth, options, children);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asSpecMap(String entity, String key, Object raw) {
        if (!(raw instanceof Map<?, ?> map)) {
            throw new InvalidIncludeSpecException(entity, key, "include must be an object but got " + describe(raw));
        }
        for (Object k : map.keySet()) {
            if (!(k instanceof String)) {
                throw new InvalidIncludeSpecException(entity, key, "include keys must be strings");
            }
        }
        return (Map<String, Object>) map;
    }

    private static int toInt(String entity, String key, String option, Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            long l = ((Number) value).longValue();
            if (l > Integer.MAX_VALUE || l < Integer.MIN_VALUE) {
                throw new InvalidIncludeSpecException(entity, key, option + " is out of range");
            }
            return (int) l;
        }
        if (value instanceof BigInteger big && big.bitLength() < 32) {
            return big.intValue();
        }
        if (value instanceof Number n && !(value instanceof BigInteger)
                && !(n instanceof Double d && (d.isNaN() || d.isInfinite()))
                && !(n instanceof Float f && (f.isNaN() || f.isInfinite()))) {
            BigDecimal decimal = new BigDecimal(n.toString());
            if (decimal.signum() == 0 || decimal.stripTrailingZeros().scale() <= 0) {
                try {
                    return decimal.intValueExact();
                } catch (ArithmeticException e) {
                    throw new InvalidIncludeSpecException(entity, key, option + " is out of range");
                }
            }
        }
        throw new InvalidIncludeSpecException(entity, key, option + " must be an integer but got " + describe(value));
    }

    private static String requireColumn(String entity, String key, EntityDefinition target, String option,
            Object value) {
        if (!(value instanceof String column)) {
            throw new InvalidIncludeSpecException(entity, key, option + " must be a column name");
        }
        if (!target.hasColumn(column)) {
            throw new InvalidIncludeSpecException(entity, key,
                    option + " references unknown column '" + column + "' of " + target.name());
        }
        return column;
    }

    private static List<String> columnList(String entity, String key, EntityDefinition target, String option,
            Object value) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new InvalidIncludeSpecException(entity, key, option + " must be an array of column names");
        }
        List<String> columns = new ArrayList<>(list.size());
        for (Object item : list) {
            String column = requireColumn(entity, key, target, option, item);
            if (!columns.contains(column)) {
                columns.add(column);
            }
        }
        return columns;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + " " + value;
    }
}
