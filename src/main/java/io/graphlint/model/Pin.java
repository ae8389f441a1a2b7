package io.graphlint.model;

import java.util.List;

/**
 * A connection point on a node.
 *
 * @param name         Pin name, unique within its node
 * @param direction    Input or output
 * @param kind         Exec, data or delegate
 * @param linkedTo     Pins on other nodes this pin is connected to
 * @param defaultValue Literal value typed into an unconnected input pin (may be null)
 */
public record Pin(
        String name,
        PinDirection direction,
        PinKind kind,
        List<PinRef> linkedTo,
        String defaultValue
) {
    public Pin {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Pin name cannot be null or blank");
        }
        if (direction == null) {
            throw new IllegalArgumentException("Pin direction cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Pin kind cannot be null");
        }
        linkedTo = linkedTo == null ? List.of() : List.copyOf(linkedTo);
    }

    public static Pin of(String name, PinDirection direction, PinKind kind) {
        return new Pin(name, direction, kind, List.of(), null);
    }

    /**
     * Returns a copy of this pin with the given links.
     */
    public Pin withLinks(List<PinRef> links) {
        return new Pin(name, direction, kind, links, defaultValue);
    }

    /**
     * Returns a copy of this pin with the given literal default value.
     */
    public Pin withDefaultValue(String value) {
        return new Pin(name, direction, kind, linkedTo, value);
    }

    public boolean isConnected() {
        return !linkedTo.isEmpty();
    }

    public boolean isExec() {
        return kind == PinKind.EXEC;
    }

    public boolean isInput() {
        return direction == PinDirection.INPUT;
    }

    public boolean isOutput() {
        return direction == PinDirection.OUTPUT;
    }
}
