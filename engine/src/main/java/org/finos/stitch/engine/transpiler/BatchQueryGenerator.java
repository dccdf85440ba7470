package org.finos.stitch.engine.transpiler;

import org.finos.stitch.engine.plan.SortDirection;
import org.finos.stitch.engine.store.EntityDefinition;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;
import java.util.stream.Collectors;

/**
 * Generates the parameterized queries the stitcher issues.
 * 
 * A batch query fetches every row of an entity whose key tuple is one of a set of
 * tuples collected from parent rows:
 * 
 * <pre>
 * SELECT "id", "author_id", "title" FROM "books" WHERE "author_id" IN (?, ?)
 *     ORDER BY "author_id" ASC NULLS LAST, "id" ASC NULLS LAST
 * </pre>
 * 
 * Composite keys use an OR of AND-groups, or row values where the dialect has them:
 * 
 * <pre>
 * ... WHERE (("region" = ? AND "code" = ?) OR ("region" = ? AND "code" = ?))
 * ... WHERE ("region", "code") IN (VALUES (?, ?), (?, ?))
 * </pre>
 */
public final class BatchQueryGenerator {

    private final SQLDialect dialect;

    public BatchQueryGenerator(SQLDialect dialect) {
        this.dialect = dialect;
    }

    /**
     * Generates a batch membership query.
     * 
     * @param entity     The entity to read
     * @param projection Columns to select; empty selects every column
     * @param keyColumns Columns matched against the key tuples
     * @param keyTuples  Distinct, non-empty key tuples, each sized like {@code keyColumns}
     * @param orderBy    Ordering terms, possibly empty
     * @return The query and its parameters
     */
    public BatchQuery selectByKeys(
            EntityDefinition entity,
            List<String> projection,
            List<String> keyColumns,
            List<List<Object>> keyTuples,
            List<OrderTerm> orderBy) {
        if (keyTuples.isEmpty()) {
            throw new IllegalArgumentException("Batch query on " + entity.name() + " needs at least one key");
        }
        List<Object> params = new ArrayList<>(keyTuples.size() * keyColumns.size());
        StringBuilder sql = new StringBuilder();
        appendSelect(sql, entity, projection);
        sql.append(" WHERE ");

        if (keyColumns.size() == 1) {
            sql.append(dialect.quoteIdentifier(keyColumns.get(0))).append(" IN (");
            for (int i = 0; i < keyTuples.size(); i++) {
                if (i > 0) {
                    sql.append(", ");
                }
                params.add(keyTuples.get(i).get(0));
                sql.append(dialect.parameter(params.size()));
            }
            sql.append(')');
        } else if (dialect.supportsRowValueIn()) {
            sql.append(keyColumns.stream().map(dialect::quoteIdentifier).collect(Collectors.joining(", ", "(", ")")))
                    .append(" IN (VALUES ");
            for (int i = 0; i < keyTuples.size(); i++) {
                List<Object> tuple = checkedTuple(keyTuples.get(i), keyColumns);
                if (i > 0) {
                    sql.append(", ");
                }
                StringJoiner markers = new StringJoiner(", ", "(", ")");
                for (Object value : tuple) {
                    params.add(value);
                    markers.add(dialect.parameter(params.size()));
                }
                sql.append(markers);
            }
            sql.append(')');
        } else {
            sql.append('(');
            for (int i = 0; i < keyTuples.size(); i++) {
                List<Object> tuple = checkedTuple(keyTuples.get(i), keyColumns);
                if (i > 0) {
                    sql.append(" OR ");
                }
                sql.append('(');
                for (int c = 0; c < keyColumns.size(); c++) {
                    if (c > 0) {
                        sql.append(" AND ");
                    }
                    params.add(tuple.get(c));
                    sql.append(dialect.quoteIdentifier(keyColumns.get(c)))
                            .append(" = ")
                            .append(dialect.parameter(params.size()));
                }
                sql.append(')');
            }
            sql.append(')');
        }

        appendOrderBy(sql, orderBy);
        return new BatchQuery(sql.toString(), params);
    }

    private static List<Object> checkedTuple(List<Object> tuple, List<String> keyColumns) {
        if (tuple.size() != keyColumns.size()) {
            throw new IllegalArgumentException("Key tuple " + tuple + " does not match columns " + keyColumns);
        }
        return tuple;
    }

    /**
     * Generates a root list query.
     * 
     * @param entity  The entity to list
     * @param filter  Row filter, {@link RowFilter#NONE} for all rows
     * @param limit   Row limit, or null for none
     * @param offset  Rows to skip
     * @param orderBy Ordering terms; the primary key is appended as a tie-breaker
     */
    public BatchQuery list(EntityDefinition entity, RowFilter filter, Integer limit, int offset,
            List<OrderTerm> orderBy) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder();
        appendSelect(sql, entity, List.of());
        if (!(filter instanceof RowFilter.All all && all.filters().isEmpty())) {
            sql.append(" WHERE ").append(renderFilter(filter, params));
        }
        appendOrderBy(sql, withTieBreaker(orderBy, entity.primaryKey()));
        sql.append(dialect.limitOffset(limit, offset));
        return new BatchQuery(sql.toString(), params);
    }

    private String renderFilter(RowFilter filter, List<Object> params) {
        if (filter instanceof RowFilter.Compare compare) {
            String column = dialect.quoteIdentifier(compare.column());
            params.add(compare.value());
            String marker = dialect.parameter(params.size());
            if (compare.comparison() == RowFilter.Comparison.ILIKE) {
                return dialect.caseInsensitiveLike(column, marker);
            }
            return column + " " + compare.comparison().toSql() + " " + marker;
        }
        if (filter instanceof RowFilter.In in) {
            if (in.values().isEmpty()) {
                return in.negated() ? "1 = 1" : "1 = 0";
            }
            StringJoiner markers = new StringJoiner(", ", "(", ")");
            for (Object value : in.values()) {
                params.add(value);
                markers.add(dialect.parameter(params.size()));
            }
            return dialect.quoteIdentifier(in.column()) + (in.negated() ? " NOT IN " : " IN ") + markers;
        }
        if (filter instanceof RowFilter.IsNull isNull) {
            return dialect.quoteIdentifier(isNull.column()) + (isNull.negated() ? " IS NOT NULL" : " IS NULL");
        }
        if (filter instanceof RowFilter.All all) {
            return renderGroup(all.filters(), " AND ", "1 = 1", params);
        }
        if (filter instanceof RowFilter.Any any) {
            return renderGroup(any.filters(), " OR ", "1 = 0", params);
        }
        throw new IllegalArgumentException("Unsupported filter: " + filter);
    }

    private String renderGroup(List<RowFilter> filters, String operator, String whenEmpty, List<Object> params) {
        if (filters.isEmpty()) {
            return whenEmpty;
        }
        if (filters.size() == 1) {
            return renderFilter(filters.get(0), params);
        }
        StringJoiner group = new StringJoiner(operator);
        for (RowFilter filter : filters) {
            group.add("(" + renderFilter(filter, params) + ")");
        }
        return group.toString();
    }

    /**
     * Appends ascending terms for the given columns unless already ordered on.
     */
    public static List<OrderTerm> withTieBreaker(List<OrderTerm> terms, List<String> columns) {
        List<OrderTerm> result = new ArrayList<>(terms);
        Set<String> seen = terms.stream().map(OrderTerm::column).collect(Collectors.toSet());
        for (String column : columns) {
            if (seen.add(column)) {
                result.add(new OrderTerm(column, SortDirection.ASC));
            }
        }
        return result;
    }

    private void appendSelect(StringBuilder sql, EntityDefinition entity, List<String> projection) {
        sql.append("SELECT ");
        if (projection.isEmpty()) {
            sql.append('*');
        } else {
            sql.append(new LinkedHashSet<>(projection).stream()
                    .map(dialect::quoteIdentifier)
                    .collect(Collectors.joining(", ")));
        }
        sql.append(" FROM ").append(dialect.quoteIdentifier(entity.name()));
    }

    private void appendOrderBy(StringBuilder sql, List<OrderTerm> orderBy) {
        if (orderBy.isEmpty()) {
            return;
        }
        sql.append(" ORDER BY ");
        sql.append(orderBy.stream()
                .map(term -> dialect.orderTerm(dialect.quoteIdentifier(term.column()), term.direction()))
                .collect(Collectors.joining(", ")));
    }
}
