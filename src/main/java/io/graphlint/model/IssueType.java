package io.graphlint.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Categories of lint issues, one per detector.
 */
public enum IssueType {
    DEAD_NODE("dead-node", "Dead Node"),
    ORPHAN_NODE("orphan-node", "Orphan Node"),
    CAST_ABUSE("cast-abuse", "Cast Abuse"),
    TICK_ABUSE("tick-abuse", "Tick Abuse"),
    UNUSED_FUNCTION("unused-function", "Unused Function");

    private final String id;
    private final String displayName;

    IssueType(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    /**
     * Stable identifier used in configuration files.
     */
    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Resolves a type from its id ({@code dead-node}) or enum name ({@code DEAD_NODE}).
     */
    public static Optional<IssueType> fromId(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(t -> t.id.equalsIgnoreCase(trimmed) || t.name().equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
