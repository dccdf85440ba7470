package org.finos.stitch.engine.transpiler;

import org.finos.stitch.engine.plan.SortDirection;

/**
 * One ORDER BY term.
 */
public record OrderTerm(String column, SortDirection direction) {

    public static OrderTerm asc(String column) {
        return new OrderTerm(column, SortDirection.ASC);
    }
}
