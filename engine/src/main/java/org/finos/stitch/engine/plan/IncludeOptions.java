package org.finos.stitch.engine.plan;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Per-relation options of an include node.
 * 
 * Pagination ({@code limit}/{@code offset}) is applied per parent row, never
 * across the whole batch: {@code limit 2} means "the first two children of each
 * parent".
 * 
 * @param limit Maximum children per parent (positive), if any
 * @param offset Children skipped per parent (nonnegative)
 * @param orderBy Target column ordering the children, if any
 * @param order Direction for {@code orderBy}
 * @param select Target columns to keep; empty means all
 * @param exclude Target columns to drop
 */
public record IncludeOptions(
        OptionalInt limit,
        int offset,
        Optional<String> orderBy,
        SortDirection order,
        List<String> select,
        List<String> exclude
) {
    public static final IncludeOptions DEFAULTS = new IncludeOptions(
            OptionalInt.empty(), 0, Optional.empty(), SortDirection.ASC, List.of(), List.of());

    public IncludeOptions {
        Objects.requireNonNull(limit, "limit cannot be null (use OptionalInt.empty())");
        Objects.requireNonNull(orderBy, "orderBy cannot be null (use Optional.empty())");
        Objects.requireNonNull(order, "order cannot be null");
        select = List.copyOf(select);
        exclude = List.copyOf(exclude);

        if (limit.isPresent() && limit.getAsInt() <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit.getAsInt());
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be nonnegative: " + offset);
        }
    }

    public boolean isPaged() {
        return limit.isPresent() || offset > 0;
    }

    public boolean hasProjection() {
        return !select.isEmpty() || !exclude.isEmpty();
    }

    /**
     * Applies offset then limit to a list that is already ordered.
     */
    public <T> List<T> window(List<T> ordered) {
        if (!isPaged()) {
            return ordered;
        }
        int from = Math.min(offset, ordered.size());
        int to = limit.isPresent()
                ? (int) Math.min((long) from + limit.getAsInt(), ordered.size())
                : ordered.size();
        return ordered.subList(from, to);
    }
}
