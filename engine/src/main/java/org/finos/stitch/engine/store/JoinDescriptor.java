package org.finos.stitch.engine.store;

import java.util.List;
import java.util.Objects;

/**
 * The intermediate entity realizing a {@link RelationKind#MANY_VIA_JOIN} relation.
 * 
 * Schema example:
 * <pre>
 * book_tags(book_id -> books.id, tag_id -> tags.id)
 * </pre>
 * 
 * @param joinEntity The join entity name
 * @param sourceColumns Join columns referencing the relation's source key
 * @param targetColumns Join columns referencing the relation's target key
 * @param unique Whether a (source, target) pair can occur at most once; duplicates
 *               are collapsed during stitching only when set
 */
public record JoinDescriptor(
        String joinEntity,
        List<String> sourceColumns,
        List<String> targetColumns,
        boolean unique
) {
    public JoinDescriptor {
        Objects.requireNonNull(joinEntity, "Join entity cannot be null");
        Objects.requireNonNull(sourceColumns, "Join source columns cannot be null");
        Objects.requireNonNull(targetColumns, "Join target columns cannot be null");
        sourceColumns = List.copyOf(sourceColumns);
        targetColumns = List.copyOf(targetColumns);

        if (sourceColumns.isEmpty() || targetColumns.isEmpty()) {
            throw new IllegalArgumentException("Join " + joinEntity + " must reference both sides");
        }
    }

    public static JoinDescriptor of(String joinEntity, String sourceColumn, String targetColumn) {
        return new JoinDescriptor(joinEntity, List.of(sourceColumn), List.of(targetColumn), false);
    }

    @Override
    public String toString() {
        return joinEntity + sourceColumns + "->" + targetColumns + (unique ? " unique" : "");
    }
}
