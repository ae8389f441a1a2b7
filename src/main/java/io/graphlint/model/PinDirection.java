package io.graphlint.model;

/**
 * Direction of a pin relative to its owning node.
 */
public enum PinDirection {
    INPUT,
    OUTPUT
}
