package io.graphlint.graph;

import io.graphlint.model.GraphNode;
import io.graphlint.model.NodeGraph;
import io.graphlint.model.Pin;
import io.graphlint.model.PinDirection;
import io.graphlint.model.PinKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Walks a graph along exec connections.
 * <p>
 * Both walks record node ids in a visited set and never expand a node twice, so they
 * terminate on cyclic graphs (loops, recursive macro expansion). They are iterative,
 * so long exec chains do not grow the call stack.
 */
public final class GraphTraversal {

    private static final Logger log = LoggerFactory.getLogger(GraphTraversal.class);

    private GraphTraversal() {
    }

    /**
     * Counts the nodes reachable from {@code start} by following output exec pins,
     * including {@code start} itself.
     *
     * @param graph   Graph owning the node
     * @param start   Node to start from
     * @param visited Ids of nodes already counted; updated in place
     * @return Number of newly visited nodes
     */
    public static int countConnectedNodes(NodeGraph graph, GraphNode start, Set<String> visited) {
        if (start == null || visited.contains(start.id())) {
            return 0;
        }
        Deque<GraphNode> stack = new ArrayDeque<>();
        stack.push(resolve(graph, start));
        visited.add(start.id());
        int count = 0;

        while (!stack.isEmpty()) {
            GraphNode current = stack.pop();
            count++;
            for (Pin pin : current.pins(PinDirection.OUTPUT, PinKind.EXEC)) {
                for (GraphNode next : graph.linkedNodes(pin)) {
                    if (visited.add(next.id())) {
                        stack.push(next);
                    }
                }
            }
        }
        log.trace("{} nodes reachable from {} in {}", count, start.id(), graph.name());
        return count;
    }

    /**
     * Counts the nodes reachable from {@code start} with a fresh visited set.
     */
    public static int countConnectedNodes(NodeGraph graph, GraphNode start) {
        return countConnectedNodes(graph, start, new HashSet<>());
    }

    /**
     * Walks backward from {@code node} along input exec pins and tests {@code predicate}
     * on every node visited, the start node included.
     *
     * @param graph     Graph owning the node
     * @param node      Node to start from
     * @param predicate Context test (e.g. "is a tick event")
     * @param visited   Ids of nodes already tested; must be fresh for each top-level query
     * @return true on the first node matching the predicate
     */
    public static boolean isNodeInContext(NodeGraph graph, GraphNode node,
                                          Predicate<GraphNode> predicate, Set<String> visited) {
        if (node == null || visited.contains(node.id())) {
            return false;
        }
        Deque<GraphNode> stack = new ArrayDeque<>();
        stack.push(resolve(graph, node));
        visited.add(node.id());

        while (!stack.isEmpty()) {
            GraphNode current = stack.pop();
            if (predicate.test(current)) {
                log.trace("{} matched context at {}", node.id(), current.id());
                return true;
            }
            for (Pin pin : current.pins(PinDirection.INPUT, PinKind.EXEC)) {
                for (GraphNode previous : graph.linkedNodes(pin)) {
                    if (visited.add(previous.id())) {
                        stack.push(previous);
                    }
                }
            }
        }
        return false;
    }

    /**
     * Tests the backward context of {@code node} with a fresh visited set.
     */
    public static boolean isNodeInContext(NodeGraph graph, GraphNode node, Predicate<GraphNode> predicate) {
        return isNodeInContext(graph, node, predicate, new HashSet<>());
    }

    // links live on the graph's own instance of a node, not on one built before it
    private static GraphNode resolve(NodeGraph graph, GraphNode node) {
        return graph.node(node.id()).orElse(node);
    }
}
