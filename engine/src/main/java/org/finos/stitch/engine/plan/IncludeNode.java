package org.finos.stitch.engine.plan;

import org.finos.stitch.engine.store.RelationDescriptor;

import java.util.List;
import java.util.Objects;

/**
 * One resolved relation in a compiled {@link IncludePlan}.
 * 
 * Two variants:
 * <ul>
 * <li>{@link Leaf} - the relation was requested with {@code true}: default options, no nesting</li>
 * <li>{@link Nested} - the relation was requested with an options object; may carry children
 * (an empty child list means the nested include was absent or pruned by depth)</li>
 * </ul>
 */
public sealed interface IncludeNode permits IncludeNode.Leaf, IncludeNode.Nested {

    RelationDescriptor relation();

    /**
     * @return Nesting depth of this node, 0 for relations of the root entity
     */
    int depth();

    IncludeOptions options();

    List<IncludeNode> children();

    /**
     * The include key, i.e. the property the stitched value is attached under.
     */
    default String key() {
        return relation().name();
    }

    default boolean hasChildren() {
        return !children().isEmpty();
    }

    record Leaf(RelationDescriptor relation, int depth) implements IncludeNode {
        public Leaf {
            Objects.requireNonNull(relation, "relation cannot be null");
        }

        @Override
        public IncludeOptions options() {
            return IncludeOptions.DEFAULTS;
        }

        @Override
        public List<IncludeNode> children() {
            return List.of();
        }
    }

    record Nested(RelationDescriptor relation, int depth, IncludeOptions options,
            List<IncludeNode> children) implements IncludeNode {
        public Nested {
            Objects.requireNonNull(relation, "relation cannot be null");
            Objects.requireNonNull(options, "options cannot be null");
            children = List.copyOf(children);
            for (IncludeNode child : children) {
                if (child.depth() != depth + 1) {
                    throw new IllegalArgumentException("Child " + child.key() + " of " + relation.qualifiedName()
                            + " must be at depth " + (depth + 1) + " but was " + child.depth());
                }
            }
        }
    }
}
