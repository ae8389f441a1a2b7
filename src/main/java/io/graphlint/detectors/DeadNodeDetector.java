package io.graphlint.detectors;

import io.graphlint.config.LintRuleConfig;
import io.graphlint.model.*;
import io.graphlint.registry.ReferenceRegistry;
import io.graphlint.registry.ReferenceResolver;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Detects declarations that nothing uses.
 *
 * Reports:
 * - variable reads whose value goes nowhere
 * - custom events that are neither called, bound to a delegate, nor referenced by another program
 * - declared variables that are never read or written
 * - event dispatchers (multicast delegates) that are never bound or called
 *
 * All dead-node issues are low severity.
 */
public class DeadNodeDetector implements Detector {

    @Override
    public IssueType type() {
        return IssueType.DEAD_NODE;
    }

    @Override
    public String description() {
        return "Detects unused variables, custom events and event dispatchers";
    }

    @Override
    public List<Issue> detect(Program program, ScanContext context) {
        References refs = collectReferences(program);
        List<Issue> issues = new ArrayList<>();

        for (NodeGraph graph : program.graphs()) {
            for (GraphNode node : graph.nodes()) {
                if (node.kind() == NodeKind.VARIABLE_GET && !node.hasAnyConnection()) {
                    issues.add(issue(program, node.referenceName(), node.id(),
                            "Variable '" + node.referenceName() + "' is retrieved but never used"));
                } else if (isCheckedEvent(node, context.rules()) && !isEventReferenced(node, refs, context.registry())) {
                    issues.add(issue(program, node.referenceName(), node.id(),
                            "Custom event '" + node.referenceName() + "' is defined but never called"));
                }
            }
        }

        for (Variable variable : program.variables()) {
            if (variable.multicastDelegate()) {
                continue;
            }
            if (!refs.variables.contains(variable.name())) {
                issues.add(issue(program, variable.name(), null,
                        "Variable '" + variable.name() + "' is declared but never used"));
            }
        }

        for (Variable variable : program.variables()) {
            if (!variable.multicastDelegate()) {
                continue;
            }
            String name = variable.name();
            if (!refs.names.contains(name) && !context.registry().isReferenced(name)) {
                issues.add(issue(program, name, null,
                        "Event dispatcher '" + name + "' is declared but never used"));
            }
        }

        return issues;
    }

    /**
     * Names and node ids referenced from within the program.
     */
    private static final class References {
        final Set<String> variables = new HashSet<>();
        final Set<String> names = new HashSet<>();
        final Set<String> boundEventIds = new HashSet<>();
    }

    private References collectReferences(Program program) {
        References refs = new References();
        for (NodeGraph graph : program.graphs()) {
            for (GraphNode node : graph.nodes()) {
                switch (node.kind()) {
                    case VARIABLE_GET -> {
                        if (node.hasConnectedOutput()) {
                            node.member().ifPresent(refs.variables::add);
                        }
                    }
                    case VARIABLE_SET -> node.member().ifPresent(refs.variables::add);
                    case CALL_FUNCTION -> node.member().ifPresent(refs.names::add);
                    case DELEGATE_ADD, DELEGATE_ASSIGN, DELEGATE_REMOVE, DELEGATE_CLEAR, DELEGATE_CALL -> {
                        node.member().ifPresent(refs.names::add);
                        if (node.kind().isDelegateBinding()) {
                            for (GraphNode handler : ReferenceResolver.boundCustomEvents(graph, node)) {
                                refs.names.add(handler.referenceName());
                                refs.boundEventIds.add(handler.id());
                            }
                        }
                    }
                    default -> {
                    }
                }
            }
        }
        return refs;
    }

    /**
     * Component-bound events are fired by their component and never checked.
     * Lifecycle hooks, tick events and interface-mandated events are called by the engine.
     */
    private boolean isCheckedEvent(GraphNode node, LintRuleConfig rules) {
        if (node.kind() != NodeKind.CUSTOM_EVENT && node.kind() != NodeKind.EVENT) {
            return false;
        }
        String name = node.referenceName();
        return !rules.isLifecycleName(name)
                && !rules.isTickEventName(name)
                && !node.interfaceEvent();
    }

    private boolean isEventReferenced(GraphNode node, References refs, ReferenceRegistry registry) {
        String name = node.referenceName();
        return refs.names.contains(name)
                || registry.isReferenced(name)
                || refs.boundEventIds.contains(node.id());
    }

    private Issue issue(Program program, String name, String nodeId, String description) {
        return Issue.builder()
                .type(IssueType.DEAD_NODE)
                .programPath(program.path())
                .nodeName(name)
                .nodeId(nodeId)
                .description(description)
                .severity(Severity.LOW)
                .build();
    }
}
