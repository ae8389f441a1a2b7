package io.graphlint.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One analyzable unit: graphs, variables, an optional parent type and implemented interfaces.
 * Programs are immutable; detectors only read them.
 *
 * @param path       Object path, reported in issues
 * @param name       Program name
 * @param kind       Standard program or interface definition
 * @param graphs     Event, function and macro graphs
 * @param variables  Declared variables
 * @param parent     Parent type chain (may be null)
 * @param interfaces Interfaces implemented directly by this program
 */
public record Program(
        String path,
        String name,
        ProgramKind kind,
        List<NodeGraph> graphs,
        List<Variable> variables,
        TypeInfo parent,
        List<InterfaceDecl> interfaces
) {
    /**
     * Compact constructor with validation.
     */
    public Program {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (kind == null) {
            kind = ProgramKind.STANDARD;
        }
        graphs = graphs == null ? List.of() : List.copyOf(graphs);
        variables = variables == null ? List.of() : List.copyOf(variables);
        interfaces = interfaces == null ? List.of() : List.copyOf(interfaces);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<NodeGraph> eventGraphs() {
        return graphsOfKind(GraphKind.EVENT_GRAPH);
    }

    public List<NodeGraph> functionGraphs() {
        return graphsOfKind(GraphKind.FUNCTION_GRAPH);
    }

    public List<NodeGraph> macroGraphs() {
        return graphsOfKind(GraphKind.MACRO_GRAPH);
    }

    private List<NodeGraph> graphsOfKind(GraphKind graphKind) {
        return graphs.stream().filter(g -> g.kind() == graphKind).toList();
    }

    public boolean hasGraphs() {
        return !graphs.isEmpty();
    }

    public Optional<TypeInfo> parentType() {
        return Optional.ofNullable(parent);
    }

    public boolean isInterface() {
        return kind == ProgramKind.INTERFACE;
    }

    /**
     * Returns true if a parent type declares a function with this name.
     */
    public boolean overridesParentFunction(String functionName) {
        return parent != null && parent.declaresFunction(functionName);
    }

    /**
     * Returns true if an interface implemented by this program or any ancestor mandates the function.
     */
    public boolean requiresViaInterface(String functionName) {
        if (interfaces.stream().anyMatch(i -> i.declares(functionName))) {
            return true;
        }
        return parent != null && parent.requiresViaInterface(functionName);
    }

    /**
     * Returns true if the parent chain contains the named type.
     */
    public boolean isSubtypeOf(String typeName) {
        return parent != null && parent.isSubtypeOf(typeName);
    }

    public static class Builder {
        private String path;
        private String name;
        private ProgramKind kind = ProgramKind.STANDARD;
        private final List<NodeGraph> graphs = new ArrayList<>();
        private final List<Variable> variables = new ArrayList<>();
        private TypeInfo parent;
        private final List<InterfaceDecl> interfaces = new ArrayList<>();

        /**
         * Sets the path; the name defaults to the last path segment without its extension.
         */
        public Builder path(String path) {
            this.path = path;
            if (name == null && path != null) {
                name = ProgramId.of(path).name();
            }
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder kind(ProgramKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder addGraph(NodeGraph graph) {
            this.graphs.add(graph);
            return this;
        }

        public Builder addVariable(Variable variable) {
            this.variables.add(variable);
            return this;
        }

        public Builder parent(TypeInfo parent) {
            this.parent = parent;
            return this;
        }

        public Builder addInterface(InterfaceDecl decl) {
            this.interfaces.add(decl);
            return this;
        }

        public Program build() {
            return new Program(path, name, kind, graphs, variables, parent, interfaces);
        }
    }
}
