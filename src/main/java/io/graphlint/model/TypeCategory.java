package io.graphlint.model;

/**
 * Coarse classification of a cast target type.
 */
public enum TypeCategory {
    INTERFACE,
    /** Placeable world object; casting to it loads the whole class. */
    ACTOR,
    /** Component attached to an actor. */
    COMPONENT,
    OBJECT
}
