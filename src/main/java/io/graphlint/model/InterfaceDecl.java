package io.graphlint.model;

import java.util.Set;

/**
 * An interface a program implements, with the functions it mandates.
 */
public record InterfaceDecl(String name, Set<String> functionNames) {

    public InterfaceDecl {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Interface name cannot be null or blank");
        }
        functionNames = functionNames == null ? Set.of() : Set.copyOf(functionNames);
    }

    public static InterfaceDecl of(String name, String... functionNames) {
        return new InterfaceDecl(name, Set.of(functionNames));
    }

    public boolean declares(String functionName) {
        return functionNames.contains(functionName);
    }
}
