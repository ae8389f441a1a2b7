package io.graphlint.model;

import java.util.List;

/**
 * Identifies a program without loading it.
 *
 * @param path      Object path (e.g., "/Game/Enemies/BP_Enemy.BP_Enemy")
 * @param name      Asset name
 * @param ancestors Parent class names from the asset metadata, nearest first
 */
public record ProgramId(String path, String name, List<String> ancestors) {

    public ProgramId {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            int slash = path.lastIndexOf('/');
            String tail = slash >= 0 ? path.substring(slash + 1) : path;
            int dot = tail.indexOf('.');
            name = dot >= 0 ? tail.substring(0, dot) : tail;
        }
        ancestors = ancestors == null ? List.of() : List.copyOf(ancestors);
    }

    public static ProgramId of(String path) {
        return new ProgramId(path, null, List.of());
    }

    public static ProgramId of(String path, String... ancestors) {
        return new ProgramId(path, null, List.of(ancestors));
    }

    /**
     * Returns true if the asset metadata names the type as an ancestor.
     */
    public boolean isChildOf(String typeName) {
        return ancestors.contains(typeName);
    }
}
