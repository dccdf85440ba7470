package org.finos.stitch.engine.plan;

import java.util.List;
import java.util.Objects;

/**
 * Compiled, relation-checked and depth-bounded form of an include request.
 * 
 * The plan is a tree isomorphic to the accepted part of the request: every key is
 * resolved to a concrete relation and every node knows its depth. Plans are
 * immutable values; compiling the same request twice yields equal plans.
 * 
 * @param rootEntity The entity whose rows the plan is applied to
 * @param maxDepth The depth bound the plan was compiled with
 * @param nodes Relations of the root entity (depth 0)
 */
public record IncludePlan(
        String rootEntity,
        int maxDepth,
        List<IncludeNode> nodes
) {
    public IncludePlan {
        Objects.requireNonNull(rootEntity, "Root entity cannot be null");
        nodes = List.copyOf(nodes);
    }

    public static IncludePlan empty(String rootEntity, int maxDepth) {
        return new IncludePlan(rootEntity, maxDepth, List.of());
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * @return Number of levels actually present (0 for an empty plan)
     */
    public int depth() {
        return levels(nodes);
    }

    private static int levels(List<IncludeNode> nodes) {
        int max = 0;
        for (IncludeNode node : nodes) {
            max = Math.max(max, 1 + levels(node.children()));
        }
        return max;
    }

    /**
     * Renders the plan as an indented tree, e.g. for debug logging.
     */
    public String explain() {
        StringBuilder sb = new StringBuilder(rootEntity).append('\n');
        appendNodes(sb, nodes, 1);
        return sb.toString();
    }

    private static void appendNodes(StringBuilder sb, List<IncludeNode> nodes, int indent) {
        for (IncludeNode node : nodes) {
            sb.append("  ".repeat(indent))
                    .append(node.key())
                    .append(" [")
                    .append(node.relation().kind().wireName())
                    .append(" -> ")
                    .append(node.relation().targetEntity())
                    .append(", depth ")
                    .append(node.depth())
                    .append(']');
            if (node.options().isPaged()) {
                sb.append(" offset=").append(node.options().offset());
                node.options().limit().ifPresent(l -> sb.append(" limit=").append(l));
            }
            node.options().orderBy().ifPresent(o -> sb.append(" orderBy=").append(o)
                    .append(' ').append(node.options().order()));
            sb.append('\n');
            appendNodes(sb, node.children(), indent + 1);
        }
    }
}
