package io.graphlint.model;

/**
 * Severity of a lint issue.
 * Ordered from least to most severe so that {@link #compareTo} reads naturally.
 */
public enum Severity {
    /**
     * Cosmetic or clean-up issue.
     * Examples: variables that are declared but never read, disconnected pure nodes.
     */
    LOW("Low"),

    /**
     * Likely performance or maintenance issue.
     * Examples: casts inside loops, functions nobody calls.
     */
    MEDIUM("Medium"),

    /**
     * Definite performance issue or broken control flow.
     * Examples: hard-reference casts on the per-frame path, isolated execution nodes.
     */
    HIGH("High"),

    /**
     * Severe per-frame cost.
     * Examples: tick events driving more than fifty nodes.
     */
    CRITICAL("Critical");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
