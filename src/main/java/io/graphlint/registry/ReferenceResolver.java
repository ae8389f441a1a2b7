package io.graphlint.registry;

import io.graphlint.config.LintRuleConfig;
import io.graphlint.model.GraphNode;
import io.graphlint.model.NodeGraph;
import io.graphlint.model.NodeKind;
import io.graphlint.model.Pin;
import io.graphlint.model.PinKind;
import io.graphlint.model.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Records every reference a program makes into a {@link ReferenceRegistry}.
 * <ul>
 *   <li>Call nodes: the function name, {@code Parent.Function} when the owner is known,
 *       and the callback name typed into timer calls</li>
 *   <li>Delegate nodes: the delegate property name, plus the custom events bound
 *       through the delegate pin of bind/assign nodes</li>
 *   <li>Macro instances: the macro name</li>
 * </ul>
 * Indexing is linear in the number of nodes.
 */
public class ReferenceResolver {

    private static final Logger log = LoggerFactory.getLogger(ReferenceResolver.class);

    private final LintRuleConfig rules;

    public ReferenceResolver(LintRuleConfig rules) {
        this.rules = rules;
    }

    /**
     * Indexes all graphs of a program.
     */
    public void index(Program program, ReferenceRegistry registry) {
        for (NodeGraph graph : program.graphs()) {
            for (GraphNode node : graph.nodes()) {
                indexNode(program, graph, node, registry);
            }
        }
    }

    private void indexNode(Program program, NodeGraph graph, GraphNode node, ReferenceRegistry registry) {
        switch (node.kind()) {
            case CALL_FUNCTION -> indexCall(program, node, registry);
            case DELEGATE_ADD, DELEGATE_ASSIGN, DELEGATE_REMOVE, DELEGATE_CLEAR, DELEGATE_CALL -> {
                node.member().ifPresent(registry::recordReference);
                if (node.kind().isDelegateBinding()) {
                    for (GraphNode handler : boundCustomEvents(graph, node)) {
                        registry.recordReference(handler.referenceName());
                    }
                }
            }
            case MACRO_INSTANCE -> node.member().ifPresent(registry::recordMacro);
            default -> {
                // not a reference
            }
        }
    }

    private void indexCall(Program program, GraphNode node, ReferenceRegistry registry) {
        String functionName = node.memberName();
        if (functionName == null || functionName.isBlank()) {
            return;
        }
        registry.recordCall(program.path(), functionName);
        if (node.memberParent() != null && !node.memberParent().isBlank()) {
            registry.recordReference(node.memberParent() + "." + functionName);
        }
        if (rules.isTimerFunction(functionName)) {
            node.pin(rules.getTimerFunctionPinName())
                    .filter(pin -> !pin.isConnected())
                    .map(Pin::defaultValue)
                    .filter(value -> value != null && !value.isBlank())
                    .ifPresent(callback -> {
                        log.trace("Timer {} in {} references {}", functionName, program.name(), callback);
                        registry.recordReference(callback);
                        registry.recordCallTarget(program.path(), callback);
                    });
        }
    }

    /**
     * Returns the custom events bound to a delegate bind/assign node through its delegate pins.
     */
    public static List<GraphNode> boundCustomEvents(NodeGraph graph, GraphNode delegateNode) {
        List<GraphNode> handlers = new ArrayList<>();
        for (Pin pin : delegateNode.pins()) {
            if (pin.kind() != PinKind.DELEGATE) {
                continue;
            }
            for (GraphNode linked : graph.linkedNodes(pin)) {
                if (linked.kind() == NodeKind.CUSTOM_EVENT) {
                    handlers.add(linked);
                }
            }
        }
        return handlers;
    }
}
