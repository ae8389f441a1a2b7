package io.graphlint.detectors;

import io.graphlint.config.LintRuleConfig;
import io.graphlint.graph.GraphTraversal;
import io.graphlint.model.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Detects tick events that drive too much logic.
 *
 * Counts the nodes reachable from each tick event along exec connections. Events over the
 * configured threshold are reported with a severity banded by the count
 * (over 50 Critical, over 25 High, over 10 Medium by default).
 */
public class TickAbuseDetector implements Detector {

    @Override
    public IssueType type() {
        return IssueType.TICK_ABUSE;
    }

    @Override
    public String description() {
        return "Detects tick events with high complexity";
    }

    @Override
    public List<Issue> detect(Program program, ScanContext context) {
        List<Issue> issues = new ArrayList<>();
        LintRuleConfig rules = context.rules();

        for (NodeGraph graph : program.eventGraphs()) {
            for (GraphNode node : graph.nodesOfKind(NodeKind.EVENT)) {
                if (!rules.isTickEventName(node.memberName())) {
                    continue;
                }
                int count = GraphTraversal.countConnectedNodes(graph, node);
                if (rules.exceedsTickThreshold(count)) {
                    issues.add(Issue.builder()
                            .type(IssueType.TICK_ABUSE)
                            .programPath(program.path())
                            .node(node)
                            .description("Tick event has high complexity (" + count + " connected nodes)")
                            .severity(rules.tickSeverity(count))
                            .build());
                }
            }
        }
        return issues;
    }
}
