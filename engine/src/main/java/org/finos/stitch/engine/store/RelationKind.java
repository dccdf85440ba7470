package org.finos.stitch.engine.store;

import java.util.Optional;

/**
 * Cardinality of a relation. Fixes the shape of the stitched value:
 * {@link #ONE} attaches a row or null, the others attach a list.
 */
public enum RelationKind {
    /** Source row references exactly one target row. */
    ONE("one"),
    /** Inverse of a {@code one} relation declared elsewhere. */
    MANY("many"),
    /** Source and target connected through a join entity holding a key to each side. */
    MANY_VIA_JOIN("many_via_join");

    private final String wireName;

    RelationKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<RelationKind> fromWireName(String name) {
        for (RelationKind kind : values()) {
            if (kind.wireName.equals(name)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
