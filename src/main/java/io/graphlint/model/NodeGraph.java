package io.graphlint.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A named, directed collection of nodes within a program.
 * Nodes keep their insertion order; lookups by id go through an index.
 */
public class NodeGraph {

    private final String name;
    private final GraphKind kind;
    private final Map<String, GraphNode> nodesById;

    private NodeGraph(String name, GraphKind kind, Map<String, GraphNode> nodesById) {
        this.name = name;
        this.kind = kind;
        this.nodesById = Collections.unmodifiableMap(new LinkedHashMap<>(nodesById));
    }

    public String name() {
        return name;
    }

    public GraphKind kind() {
        return kind;
    }

    /**
     * Returns all nodes in declaration order.
     */
    public Collection<GraphNode> nodes() {
        return nodesById.values();
    }

    /**
     * Returns the node for the given id, or empty if not found.
     */
    public Optional<GraphNode> node(String id) {
        return Optional.ofNullable(nodesById.get(id));
    }

    public int nodeCount() {
        return nodesById.size();
    }

    /**
     * Returns the nodes owning the pins the given pin is linked to.
     * Links to nodes outside this graph are ignored.
     */
    public List<GraphNode> linkedNodes(Pin pin) {
        List<GraphNode> result = new ArrayList<>(pin.linkedTo().size());
        for (PinRef ref : pin.linkedTo()) {
            GraphNode target = nodesById.get(ref.nodeId());
            if (target != null) {
                result.add(target);
            }
        }
        return result;
    }

    /**
     * Returns the nodes of the given kind, in declaration order.
     */
    public List<GraphNode> nodesOfKind(NodeKind nodeKind) {
        return nodesById.values().stream()
                .filter(n -> n.kind() == nodeKind)
                .toList();
    }

    @Override
    public String toString() {
        return "NodeGraph[" + name + ", " + kind + ", " + nodesById.size() + " nodes]";
    }

    public static Builder builder(String name, GraphKind kind) {
        return new Builder(name, kind);
    }

    public static class Builder {
        private final String name;
        private final GraphKind kind;
        private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
        private final List<Connection> connections = new ArrayList<>();

        private record Connection(String fromNode, String fromPin, String toNode, String toPin) {}

        private Builder(String name, GraphKind kind) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Graph name cannot be null or blank");
            }
            if (kind == null) {
                throw new IllegalArgumentException("Graph kind cannot be null");
            }
            this.name = name;
            this.kind = kind;
        }

        public Builder addNode(GraphNode node) {
            if (nodes.putIfAbsent(node.id(), node) != null) {
                throw new IllegalArgumentException("Duplicate node id '" + node.id() + "' in graph " + name);
            }
            return this;
        }

        public Builder addNodes(GraphNode... toAdd) {
            for (GraphNode node : toAdd) {
                addNode(node);
            }
            return this;
        }

        /**
         * Connects two pins. Both ends record the link when the graph is built.
         */
        public Builder connect(String fromNodeId, String fromPin, String toNodeId, String toPin) {
            connections.add(new Connection(fromNodeId, fromPin, toNodeId, toPin));
            return this;
        }

        public NodeGraph build() {
            Map<String, Map<String, Set<PinRef>>> links = new LinkedHashMap<>();
            for (Connection c : connections) {
                requirePin(c.fromNode(), c.fromPin());
                requirePin(c.toNode(), c.toPin());
                links.computeIfAbsent(c.fromNode(), k -> new LinkedHashMap<>())
                        .computeIfAbsent(c.fromPin(), k -> new LinkedHashSet<>())
                        .add(new PinRef(c.toNode(), c.toPin()));
                links.computeIfAbsent(c.toNode(), k -> new LinkedHashMap<>())
                        .computeIfAbsent(c.toPin(), k -> new LinkedHashSet<>())
                        .add(new PinRef(c.fromNode(), c.fromPin()));
            }

            Map<String, GraphNode> wired = new LinkedHashMap<>();
            for (GraphNode node : nodes.values()) {
                Map<String, Set<PinRef>> nodeLinks = links.get(node.id());
                wired.put(node.id(), nodeLinks == null ? node : withLinks(node, nodeLinks));
            }
            return new NodeGraph(name, kind, wired);
        }

        private void requirePin(String nodeId, String pinName) {
            GraphNode node = nodes.get(nodeId);
            if (node == null) {
                throw new IllegalArgumentException("Unknown node '" + nodeId + "' in graph " + name);
            }
            if (node.pin(pinName).isEmpty()) {
                throw new IllegalArgumentException("Unknown pin '" + pinName + "' on node " + nodeId);
            }
        }

        private static GraphNode withLinks(GraphNode node, Map<String, Set<PinRef>> nodeLinks) {
            List<Pin> pins = new ArrayList<>(node.pins().size());
            for (Pin pin : node.pins()) {
                Set<PinRef> added = nodeLinks.get(pin.name());
                if (added == null) {
                    pins.add(pin);
                } else {
                    Set<PinRef> merged = new LinkedHashSet<>(pin.linkedTo());
                    merged.addAll(added);
                    pins.add(pin.withLinks(List.copyOf(merged)));
                }
            }
            return new GraphNode(node.id(), node.kind(), node.title(), node.memberName(),
                    node.memberParent(), node.nodeClass(), node.castTarget(), node.interfaceEvent(), pins);
        }
    }
}
