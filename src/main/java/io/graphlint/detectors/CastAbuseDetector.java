package io.graphlint.detectors;

import io.graphlint.config.LintRuleConfig;
import io.graphlint.graph.GraphTraversal;
import io.graphlint.graph.NodePredicates;
import io.graphlint.model.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Detects dynamic casts on hot paths.
 *
 * A cast is reported when it runs:
 * 1. downstream of a tick event (High)
 * 2. downstream of a loop (Medium)
 * 3. inside a graph whose name suggests it is called often, such as "UpdateHealth" (Medium)
 *
 * The first matching context wins. Casts to a concrete actor or component class keep the
 * target class loaded with the caster and are always High once a context matches.
 * Casts outside these contexts are not reported.
 */
public class CastAbuseDetector implements Detector {

    /**
     * Execution context of a cast, in precedence order.
     */
    public enum CastContext {
        TICK("in Tick event context", Severity.HIGH),
        LOOP("in loop context", Severity.MEDIUM),
        FREQUENT_FUNCTION("in frequently called function", Severity.MEDIUM);

        private final String phrase;
        private final Severity severity;

        CastContext(String phrase, Severity severity) {
            this.phrase = phrase;
            this.severity = severity;
        }

        public String phrase() {
            return phrase;
        }

        public Severity severity() {
            return severity;
        }
    }

    @Override
    public IssueType type() {
        return IssueType.CAST_ABUSE;
    }

    @Override
    public String description() {
        return "Detects dynamic casts in tick, loop and frequently called contexts";
    }

    @Override
    public List<Issue> detect(Program program, ScanContext context) {
        List<Issue> issues = new ArrayList<>();
        LintRuleConfig rules = context.rules();

        for (NodeGraph graph : program.graphs()) {
            for (GraphNode node : graph.nodesOfKind(NodeKind.DYNAMIC_CAST)) {
                classify(graph, node, rules).ifPresent(castContext ->
                        issues.add(createIssue(program, node, castContext)));
            }
        }
        return issues;
    }

    /**
     * Returns the first context the cast runs in, if any.
     * Each backward walk starts with its own visited set.
     */
    public Optional<CastContext> classify(NodeGraph graph, GraphNode castNode, LintRuleConfig rules) {
        if (GraphTraversal.isNodeInContext(graph, castNode, NodePredicates.tickEvent(rules))) {
            return Optional.of(CastContext.TICK);
        }
        if (GraphTraversal.isNodeInContext(graph, castNode, NodePredicates.loopConstruct(rules))) {
            return Optional.of(CastContext.LOOP);
        }
        if (rules.isFrequentFunctionName(graph.name())) {
            return Optional.of(CastContext.FREQUENT_FUNCTION);
        }
        return Optional.empty();
    }

    private Issue createIssue(Program program, GraphNode node, CastContext castContext) {
        boolean hardReference = node.castTarget() != null && node.castTarget().isHardReference();
        Severity severity = hardReference ? Severity.HIGH : castContext.severity();

        StringBuilder sb = new StringBuilder();
        sb.append("Cast node '").append(node.title()).append("' ");
        if (hardReference) {
            sb.append("(hard reference) ");
        }
        sb.append("may cause performance issues ").append(castContext.phrase());

        return Issue.builder()
                .type(IssueType.CAST_ABUSE)
                .programPath(program.path())
                .node(node)
                .description(sb.toString())
                .severity(severity)
                .build();
    }
}
