package io.graphlint.model;

/**
 * Target type of a dynamic cast node.
 *
 * @param typeName Name of the class or interface being cast to
 * @param category Classification of that type
 */
public record CastTarget(String typeName, TypeCategory category) {

    public CastTarget {
        if (typeName == null || typeName.isBlank()) {
            throw new IllegalArgumentException("typeName cannot be null or blank");
        }
        if (category == null) {
            category = TypeCategory.OBJECT;
        }
    }

    /**
     * A hard-reference cast targets a concrete actor or component class, which forces
     * the target class to be loaded together with the caster.
     */
    public boolean isHardReference() {
        return category == TypeCategory.ACTOR || category == TypeCategory.COMPONENT;
    }
}
