package org.finos.stitch.engine.transpiler;

import java.util.List;
import java.util.Objects;

/**
 * A row predicate over one entity's columns, rendered to a parameterized WHERE
 * clause by {@link BatchQueryGenerator}.
 */
public sealed interface RowFilter {

    /** Matches every row; renders no WHERE clause at the top level. */
    RowFilter NONE = new All(List.of());

    enum Comparison {
        EQ("="),
        NE("<>"),
        GT(">"),
        GTE(">="),
        LT("<"),
        LTE("<="),
        LIKE("LIKE"),
        ILIKE("ILIKE");

        private final String sql;

        Comparison(String sql) {
            this.sql = sql;
        }

        public String toSql() {
            return sql;
        }
    }

    /**
     * {@code column <op> value}; the value is bound as a parameter.
     */
    record Compare(String column, Comparison comparison, Object value) implements RowFilter {
        public Compare {
            Objects.requireNonNull(column, "Column cannot be null");
            Objects.requireNonNull(comparison, "Comparison cannot be null");
            Objects.requireNonNull(value, "Use IsNull to compare against null");
        }
    }

    /**
     * {@code column [NOT] IN (...)}. An empty IN matches nothing, an empty NOT IN everything.
     */
    record In(String column, List<Object> values, boolean negated) implements RowFilter {
        public In {
            Objects.requireNonNull(column, "Column cannot be null");
            values = List.copyOf(values);
        }
    }

    record IsNull(String column, boolean negated) implements RowFilter {
        public IsNull {
            Objects.requireNonNull(column, "Column cannot be null");
        }
    }

    /**
     * Conjunction; empty matches every row.
     */
    record All(List<RowFilter> filters) implements RowFilter {
        public All {
            filters = List.copyOf(filters);
        }
    }

    /**
     * Disjunction; empty matches no row.
     */
    record Any(List<RowFilter> filters) implements RowFilter {
        public Any {
            filters = List.copyOf(filters);
        }
    }
}
