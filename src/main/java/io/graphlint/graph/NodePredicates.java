package io.graphlint.graph;

import io.graphlint.config.LintRuleConfig;
import io.graphlint.model.GraphNode;
import io.graphlint.model.NodeKind;

import java.util.function.Predicate;

/**
 * Context predicates for {@link GraphTraversal#isNodeInContext}.
 */
public final class NodePredicates {

    private NodePredicates() {
    }

    /**
     * Matches per-frame update events (ReceiveTick, Tick).
     */
    public static Predicate<GraphNode> tickEvent(LintRuleConfig rules) {
        return node -> node.kind() == NodeKind.EVENT && rules.isTickEventName(node.memberName());
    }

    /**
     * Matches loop constructs, by kind or by class and title patterns.
     */
    public static Predicate<GraphNode> loopConstruct(LintRuleConfig rules) {
        return node -> node.kind() == NodeKind.LOOP || rules.isLoopNode(node);
    }
}
