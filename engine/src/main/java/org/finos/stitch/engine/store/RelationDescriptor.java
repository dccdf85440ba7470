package org.finos.stitch.engine.store;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A directed, named edge from a source entity to a target entity.
 * 
 * Key semantics per kind:
 * <ul>
 * <li>{@code one}: sourceKey on the source row matches targetKey on exactly one target row
 * (belongs-to: FK columns to PK; has-one: PK to unique FK columns)</li>
 * <li>{@code many}: sourceKey (usually the PK) matches targetKey (the child's FK columns)</li>
 * <li>{@code many_via_join}: sourceKey is matched by {@link JoinDescriptor#sourceColumns()},
 * targetKey by {@link JoinDescriptor#targetColumns()}</li>
 * </ul>
 * 
 * @param sourceEntity The entity the relation is declared on
 * @param name The relation name, used as the include key and the stitched property
 * @param kind The cardinality
 * @param targetEntity The related entity
 * @param sourceKey Columns read from source rows
 * @param targetKey Columns matched on target rows
 * @param via The join entity, present only for {@code many_via_join}
 */
public record RelationDescriptor(
        String sourceEntity,
        String name,
        RelationKind kind,
        String targetEntity,
        List<String> sourceKey,
        List<String> targetKey,
        Optional<JoinDescriptor> via
) {
    public RelationDescriptor {
        Objects.requireNonNull(sourceEntity, "Source entity cannot be null");
        Objects.requireNonNull(name, "Relation name cannot be null");
        Objects.requireNonNull(kind, "Relation kind cannot be null");
        Objects.requireNonNull(targetEntity, "Target entity cannot be null");
        Objects.requireNonNull(via, "Join descriptor cannot be null (use Optional.empty())");
        sourceKey = List.copyOf(sourceKey);
        targetKey = List.copyOf(targetKey);

        if (sourceKey.isEmpty() || sourceKey.size() != targetKey.size()) {
            throw new IllegalArgumentException("Relation " + sourceEntity + "." + name
                    + " has mismatched keys " + sourceKey + " -> " + targetKey);
        }
        if ((kind == RelationKind.MANY_VIA_JOIN) != via.isPresent()) {
            throw new IllegalArgumentException("Relation " + sourceEntity + "." + name
                    + ": a join entity is required for many_via_join and only for it");
        }
        if (via.isPresent()) {
            JoinDescriptor join = via.get();
            if (join.sourceColumns().size() != sourceKey.size()
                    || join.targetColumns().size() != targetKey.size()) {
                throw new IllegalArgumentException("Relation " + sourceEntity + "." + name
                        + " has join columns that do not line up with its keys");
            }
        }
    }

    /**
     * Source row holds {@code sourceColumns} referencing the target's {@code targetColumns}.
     */
    public static RelationDescriptor one(String sourceEntity, String name, String targetEntity,
            List<String> sourceColumns, List<String> targetColumns) {
        return new RelationDescriptor(sourceEntity, name, RelationKind.ONE, targetEntity,
                sourceColumns, targetColumns, Optional.empty());
    }

    /**
     * Target rows hold {@code targetColumns} referencing the source's {@code sourceColumns}.
     */
    public static RelationDescriptor many(String sourceEntity, String name, String targetEntity,
            List<String> sourceColumns, List<String> targetColumns) {
        return new RelationDescriptor(sourceEntity, name, RelationKind.MANY, targetEntity,
                sourceColumns, targetColumns, Optional.empty());
    }

    public static RelationDescriptor manyViaJoin(String sourceEntity, String name, String targetEntity,
            List<String> sourceColumns, List<String> targetColumns, JoinDescriptor join) {
        return new RelationDescriptor(sourceEntity, name, RelationKind.MANY_VIA_JOIN, targetEntity,
                sourceColumns, targetColumns, Optional.of(join));
    }

    public String qualifiedName() {
        return sourceEntity + "." + name;
    }

    @Override
    public String toString() {
        return qualifiedName() + " (" + kind.wireName() + " -> " + targetEntity
                + via.map(j -> " via " + j).orElse("") + ")";
    }
}
