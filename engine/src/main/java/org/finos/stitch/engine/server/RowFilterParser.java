package org.finos.stitch.engine.server;

import org.finos.stitch.engine.store.Column;
import org.finos.stitch.engine.store.EntityDefinition;
import org.finos.stitch.engine.transpiler.RowFilter;
import org.finos.stitch.engine.transpiler.RowFilter.Comparison;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parses the {@code where} field of a list request into a {@link RowFilter}.
 * 
 * <pre>
 * {"name": "Ann"}                         equality
 * {"author_id": null}                     IS NULL
 * {"published": {"$gte": 2000, "$lt": 2010}}
 * {"id": {"$in": [10, 11]}}
 * {"$or": [{"title": {"$like": "Cy%"}}, {"published": 1999}]}
 * </pre>
 * 
 * Field operators: $eq, $ne, $gt, $gte, $lt, $lte, $in, $nin, $like, $ilike,
 * $is and $isNot (both take null). Sibling conditions are ANDed; {@code $and}
 * and {@code $or} take arrays of nested conditions. An empty {@code $or}
 * matches nothing.
 */
final class RowFilterParser {

    private RowFilterParser() {
    }

    static RowFilter parse(EntityDefinition entity, Object raw) {
        if (raw == null) {
            return RowFilter.NONE;
        }
        return parseCondition(entity, raw);
    }

    private static RowFilter parseCondition(EntityDefinition entity, Object raw) {
        if (!(raw instanceof Map<?, ?> condition)) {
            throw invalid("where conditions must be objects");
        }
        List<RowFilter> parts = new ArrayList<>();
        for (Map.Entry<?, ?> entry : condition.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            switch (key) {
                case "$and" -> parts.add(new RowFilter.All(nested(entity, key, value)));
                case "$or" -> parts.add(new RowFilter.Any(nested(entity, key, value)));
                default -> parseField(column(entity, key), value, parts);
            }
        }
        return parts.size() == 1 ? parts.get(0) : new RowFilter.All(parts);
    }

    private static List<RowFilter> nested(EntityDefinition entity, String operator, Object value) {
        if (!(value instanceof List<?> items)) {
            throw invalid(operator + " takes an array of conditions");
        }
        List<RowFilter> filters = new ArrayList<>(items.size());
        for (Object item : items) {
            filters.add(parseCondition(entity, item));
        }
        return filters;
    }

    private static void parseField(Column column, Object value, List<RowFilter> parts) {
        if (value instanceof Map<?, ?> operators) {
            if (operators.isEmpty()) {
                throw invalid("no operator given for column '" + column.name() + "'");
            }
            for (Map.Entry<?, ?> entry : operators.entrySet()) {
                parts.add(parseOperator(column, String.valueOf(entry.getKey()), entry.getValue()));
            }
        } else {
            parts.add(equality(column, value, false));
        }
    }

    private static RowFilter parseOperator(Column column, String operator, Object operand) {
        return switch (operator) {
            case "$eq" -> equality(column, operand, false);
            case "$ne" -> equality(column, operand, true);
            case "$gt" -> compare(column, Comparison.GT, operand);
            case "$gte" -> compare(column, Comparison.GTE, operand);
            case "$lt" -> compare(column, Comparison.LT, operand);
            case "$lte" -> compare(column, Comparison.LTE, operand);
            case "$like" -> pattern(column, Comparison.LIKE, operand);
            case "$ilike" -> pattern(column, Comparison.ILIKE, operand);
            case "$in" -> membership(column, operand, false);
            case "$nin" -> membership(column, operand, true);
            case "$is" -> nullCheck(column, operator, operand, false);
            case "$isNot" -> nullCheck(column, operator, operand, true);
            default -> throw invalid("unknown operator '" + operator + "' on column '" + column.name() + "'");
        };
    }

    private static RowFilter equality(Column column, Object value, boolean negated) {
        if (value == null) {
            return new RowFilter.IsNull(column.name(), negated);
        }
        return new RowFilter.Compare(column.name(), negated ? Comparison.NE : Comparison.EQ, operand(column, value));
    }

    private static RowFilter compare(Column column, Comparison comparison, Object value) {
        if (value == null) {
            throw invalid("column '" + column.name() + "' cannot be compared with null");
        }
        if (!column.orderable()) {
            throw invalid("column '" + column.name() + "' has no ordering");
        }
        return new RowFilter.Compare(column.name(), comparison, operand(column, value));
    }

    private static RowFilter pattern(Column column, Comparison comparison, Object value) {
        if (!(value instanceof String)) {
            throw invalid("LIKE patterns on column '" + column.name() + "' must be strings");
        }
        return new RowFilter.Compare(column.name(), comparison, value);
    }

    private static RowFilter membership(Column column, Object value, boolean negated) {
        if (!(value instanceof List<?> items)) {
            throw invalid("$in and $nin on column '" + column.name() + "' take an array");
        }
        List<Object> values = new ArrayList<>(items.size());
        for (Object item : items) {
            if (item == null) {
                throw invalid("$in and $nin on column '" + column.name() + "' cannot contain null");
            }
            values.add(operand(column, item));
        }
        return new RowFilter.In(column.name(), values, negated);
    }

    private static RowFilter nullCheck(Column column, String operator, Object value, boolean negated) {
        if (value != null) {
            throw invalid(operator + " on column '" + column.name() + "' only takes null");
        }
        return new RowFilter.IsNull(column.name(), negated);
    }

    private static Object operand(Column column, Object value) {
        if (value instanceof Map || value instanceof List || !column.accepts(value)) {
            throw invalid("value " + StitchJson.toJson(value) + " does not fit column '" + column.name()
                    + "' of type " + column.dataType());
        }
        return value;
    }

    private static Column column(EntityDefinition entity, String name) {
        return entity.findColumn(name)
                .orElseThrow(() -> invalid("unknown column '" + name + "' of " + entity.name()));
    }

    private static ListRequestException invalid(String reason) {
        return new ListRequestException(400, "Invalid where: " + reason);
    }
}
