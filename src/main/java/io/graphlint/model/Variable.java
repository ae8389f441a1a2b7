package io.graphlint.model;

/**
 * A variable declared by a program.
 *
 * @param name              Variable name
 * @param typeTag           Declared type (e.g., "float", "BP_Enemy"), may be null
 * @param multicastDelegate True if the variable is a bindable multicast event slot
 */
public record Variable(String name, String typeTag, boolean multicastDelegate) {

    public Variable {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Variable name cannot be null or blank");
        }
    }

    public static Variable of(String name, String typeTag) {
        return new Variable(name, typeTag, false);
    }

    public static Variable delegate(String name) {
        return new Variable(name, "MulticastDelegate", true);
    }
}
