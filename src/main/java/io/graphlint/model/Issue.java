package io.graphlint.model;

import java.util.Optional;

/**
 * A single lint issue found by a detector.
 *
 * @param type        Category of the issue
 * @param programPath Object path of the program the issue was found in
 * @param nodeName    Display name of the offending node, variable or graph
 * @param description Human-readable description
 * @param severity    Severity of the issue
 * @param nodeId      Identifier of the offending node, for navigation (may be null)
 */
public record Issue(
        IssueType type,
        String programPath,
        String nodeName,
        String description,
        Severity severity,
        String nodeId
) {
    /**
     * Compact constructor with validation.
     */
    public Issue {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (programPath == null || programPath.isBlank()) {
            throw new IllegalArgumentException("programPath cannot be null or blank");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        if (nodeName == null) {
            nodeName = "";
        }
        if (description == null) {
            description = "";
        }
    }

    /**
     * Builder for creating Issue instances.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private IssueType type;
        private String programPath;
        private String nodeName;
        private String description;
        private Severity severity = Severity.LOW;
        private String nodeId;

        public Builder type(IssueType type) {
            this.type = type;
            return this;
        }

        public Builder programPath(String programPath) {
            this.programPath = programPath;
            return this;
        }

        public Builder nodeName(String nodeName) {
            this.nodeName = nodeName;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder nodeId(String nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        /**
         * Sets the node name and id from a graph node.
         */
        public Builder node(GraphNode node) {
            this.nodeName = node.title();
            this.nodeId = node.id();
            return this;
        }

        public Issue build() {
            return new Issue(type, programPath, nodeName, description, severity, nodeId);
        }
    }

    public Optional<String> node() {
        return Optional.ofNullable(nodeId);
    }

    /**
     * Returns the program name (last path segment without its object suffix).
     */
    public String programName() {
        int slash = programPath.lastIndexOf('/');
        String tail = slash >= 0 ? programPath.substring(slash + 1) : programPath;
        int dot = tail.indexOf('.');
        return dot >= 0 ? tail.substring(0, dot) : tail;
    }
}
