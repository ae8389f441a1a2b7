package io.graphlint.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A node in a graph.
 *
 * @param id             Stable unique identifier (used for navigation)
 * @param kind           Node category
 * @param title          Display title (e.g., "Cast To BP_Enemy")
 * @param memberName     Function, variable, delegate or macro the node refers to (may be null)
 * @param memberParent   Class owning the referenced function, for call nodes (may be null)
 * @param nodeClass      Host type name of the node (e.g., "K2Node_ForEachLoop", may be null)
 * @param castTarget     Target type, for dynamic cast nodes (may be null)
 * @param interfaceEvent True if this event implements an interface-mandated event
 * @param pins           Ordered pins of the node
 */
public record GraphNode(
        String id,
        NodeKind kind,
        String title,
        String memberName,
        String memberParent,
        String nodeClass,
        CastTarget castTarget,
        boolean interfaceEvent,
        List<Pin> pins
) {
    /**
     * Compact constructor with validation.
     */
    public GraphNode {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Node id cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Node kind cannot be null");
        }
        if (pins == null) {
            pins = List.of();
        } else {
            pins = List.copyOf(pins);
        }
        Set<String> pinNames = new HashSet<>();
        for (Pin pin : pins) {
            if (!pinNames.add(pin.name())) {
                throw new IllegalArgumentException("Duplicate pin '" + pin.name() + "' on node " + id);
            }
        }
        if (title == null || title.isBlank()) {
            title = memberName != null && !memberName.isBlank() ? memberName : id;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the pin with the given name, if present.
     */
    public Optional<Pin> pin(String name) {
        return pins.stream()
                .filter(p -> p.name().equals(name))
                .findFirst();
    }

    /**
     * Returns true if the node has at least one exec pin.
     */
    public boolean hasExecPins() {
        return pins.stream().anyMatch(Pin::isExec);
    }

    /**
     * A pure node has no exec pins: it is evaluated on demand by the nodes reading its outputs.
     */
    public boolean isPure() {
        return !hasExecPins();
    }

    /**
     * Returns true if any pin of this node is connected.
     */
    public boolean hasAnyConnection() {
        return pins.stream().anyMatch(Pin::isConnected);
    }

    /**
     * Returns true if any output pin is connected.
     */
    public boolean hasConnectedOutput() {
        return pins.stream().anyMatch(p -> p.isOutput() && p.isConnected());
    }

    /**
     * Returns true if any output pin of the given kind is connected.
     */
    public boolean hasConnectedOutput(PinKind kind) {
        return pins.stream().anyMatch(p -> p.isOutput() && p.kind() == kind && p.isConnected());
    }

    /**
     * Returns the pins matching a direction and kind, in declaration order.
     */
    public List<Pin> pins(PinDirection direction, PinKind kind) {
        return pins.stream()
                .filter(p -> p.direction() == direction && p.kind() == kind)
                .toList();
    }

    /**
     * Returns true if the node's host class name contains the given fragment.
     */
    public boolean nodeClassContains(String fragment) {
        return nodeClass != null && nodeClass.contains(fragment);
    }

    public Optional<String> member() {
        return memberName == null || memberName.isBlank() ? Optional.empty() : Optional.of(memberName);
    }

    /**
     * Name other nodes use to refer to this one: the member name, or the title if there is none.
     */
    public String referenceName() {
        return member().orElse(title);
    }

    public static class Builder {
        private String id;
        private NodeKind kind = NodeKind.GENERIC;
        private String title;
        private String memberName;
        private String memberParent;
        private String nodeClass;
        private CastTarget castTarget;
        private boolean interfaceEvent;
        private final List<Pin> pins = new ArrayList<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder kind(NodeKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder memberName(String memberName) {
            this.memberName = memberName;
            return this;
        }

        public Builder memberParent(String memberParent) {
            this.memberParent = memberParent;
            return this;
        }

        public Builder nodeClass(String nodeClass) {
            this.nodeClass = nodeClass;
            return this;
        }

        public Builder castTarget(String typeName, TypeCategory category) {
            this.castTarget = new CastTarget(typeName, category);
            return this;
        }

        public Builder interfaceEvent(boolean interfaceEvent) {
            this.interfaceEvent = interfaceEvent;
            return this;
        }

        public Builder pin(Pin pin) {
            this.pins.add(pin);
            return this;
        }

        public Builder execIn(String name) {
            return pin(Pin.of(name, PinDirection.INPUT, PinKind.EXEC));
        }

        public Builder execOut(String name) {
            return pin(Pin.of(name, PinDirection.OUTPUT, PinKind.EXEC));
        }

        public Builder dataIn(String name) {
            return pin(Pin.of(name, PinDirection.INPUT, PinKind.DATA));
        }

        public Builder dataIn(String name, String defaultValue) {
            return pin(Pin.of(name, PinDirection.INPUT, PinKind.DATA).withDefaultValue(defaultValue));
        }

        public Builder dataOut(String name) {
            return pin(Pin.of(name, PinDirection.OUTPUT, PinKind.DATA));
        }

        public Builder delegateIn(String name) {
            return pin(Pin.of(name, PinDirection.INPUT, PinKind.DELEGATE));
        }

        public Builder delegateOut(String name) {
            return pin(Pin.of(name, PinDirection.OUTPUT, PinKind.DELEGATE));
        }

        public GraphNode build() {
            return new GraphNode(id, kind, title, memberName, memberParent, nodeClass,
                    castTarget, interfaceEvent, pins);
        }
    }
}
