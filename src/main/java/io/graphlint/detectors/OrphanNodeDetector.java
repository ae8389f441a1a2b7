package io.graphlint.detectors;

import io.graphlint.config.LintRuleConfig;
import io.graphlint.model.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Detects nodes cut off from the rest of their graph.
 *
 * A pure node (no exec pins) is orphaned when none of its data outputs is read.
 * An execution node is orphaned when none of its exec pins is connected, which makes it
 * an island that can never run.
 *
 * Entry points (events, function entries, macro tunnels), macro instances, literals and
 * utility nodes whose outputs may stay unread are skipped. Interface programs only declare
 * signatures and are skipped entirely.
 */
public class OrphanNodeDetector implements Detector {

    @Override
    public IssueType type() {
        return IssueType.ORPHAN_NODE;
    }

    @Override
    public String description() {
        return "Detects pure and execution nodes that are not connected";
    }

    @Override
    public List<Issue> detect(Program program, ScanContext context) {
        List<Issue> issues = new ArrayList<>();
        if (program.isInterface()) {
            return issues;
        }
        LintRuleConfig rules = context.rules();

        for (NodeGraph graph : program.graphs()) {
            for (GraphNode node : graph.nodes()) {
                if (isEntryOrReference(node) || node.pins().isEmpty()) {
                    continue;
                }
                if (node.isPure()) {
                    checkPureNode(program, node, rules, issues);
                } else {
                    checkExecutionNode(program, node, rules, issues);
                }
            }
        }
        return issues;
    }

    private boolean isEntryOrReference(GraphNode node) {
        return node.kind().isEvent()
                || node.kind() == NodeKind.FUNCTION_ENTRY
                || node.kind() == NodeKind.TUNNEL
                || node.kind() == NodeKind.MACRO_INSTANCE;
    }

    private void checkPureNode(Program program, GraphNode node, LintRuleConfig rules, List<Issue> issues) {
        if (node.kind() == NodeKind.LITERAL
                || rules.isPureUtilityTitle(node.title())
                || rules.isLiteralClass(node.nodeClass())) {
            return;
        }
        if (!node.hasConnectedOutput(PinKind.DATA)) {
            issues.add(Issue.builder()
                    .type(IssueType.ORPHAN_NODE)
                    .programPath(program.path())
                    .node(node)
                    .description("Pure node '" + node.title() + "' has no output connections")
                    .severity(Severity.LOW)
                    .build());
        }
    }

    private void checkExecutionNode(Program program, GraphNode node, LintRuleConfig rules, List<Issue> issues) {
        if (rules.isConstructionScriptTitle(node.title()) || rules.isInputNode(node)) {
            return;
        }
        List<Pin> execInputs = node.pins(PinDirection.INPUT, PinKind.EXEC);
        List<Pin> execOutputs = node.pins(PinDirection.OUTPUT, PinKind.EXEC);

        // exec outputs without exec inputs: an entry point of some other kind
        if (execInputs.isEmpty() && !execOutputs.isEmpty()) {
            return;
        }

        boolean anyConnected = execInputs.stream().anyMatch(Pin::isConnected)
                || execOutputs.stream().anyMatch(Pin::isConnected);
        if (!anyConnected) {
            issues.add(Issue.builder()
                    .type(IssueType.ORPHAN_NODE)
                    .programPath(program.path())
                    .node(node)
                    .description("Execution node '" + node.title()
                            + "' is not connected to any execution flow (orphan node)")
                    .severity(Severity.HIGH)
                    .build());
        }
    }
}
