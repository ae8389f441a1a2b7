package io.graphlint.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * A parent type in a program's inheritance chain.
 *
 * @param name          Type name
 * @param functionNames Functions declared (overridable) by this type
 * @param interfaces    Interfaces implemented by this type
 * @param superType     Next type up the chain, or null at the root
 */
public record TypeInfo(
        String name,
        Set<String> functionNames,
        List<InterfaceDecl> interfaces,
        TypeInfo superType
) {
    public TypeInfo {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Type name cannot be null or blank");
        }
        functionNames = functionNames == null ? Set.of() : Set.copyOf(functionNames);
        interfaces = interfaces == null ? List.of() : List.copyOf(interfaces);
    }

    public static TypeInfo root(String name, String... functionNames) {
        return new TypeInfo(name, Set.of(functionNames), List.of(), null);
    }

    /**
     * Returns this type followed by its ancestors, nearest first.
     */
    public List<TypeInfo> chain() {
        List<TypeInfo> chain = new ArrayList<>();
        for (TypeInfo t = this; t != null; t = t.superType()) {
            chain.add(t);
        }
        return chain;
    }

    /**
     * Returns true if this type or any ancestor declares the function.
     */
    public boolean declaresFunction(String functionName) {
        return chain().stream().anyMatch(t -> t.functionNames().contains(functionName));
    }

    /**
     * Returns true if any interface implemented along the chain mandates the function.
     */
    public boolean requiresViaInterface(String functionName) {
        return chain().stream()
                .flatMap(t -> t.interfaces().stream())
                .anyMatch(i -> i.declares(functionName));
    }

    /**
     * Returns true if this type is, or inherits from, the named type.
     */
    public boolean isSubtypeOf(String typeName) {
        return chain().stream().anyMatch(t -> t.name().equals(typeName));
    }
}
