package io.graphlint.detectors;

import io.graphlint.config.LintRuleConfig;
import io.graphlint.model.*;
import io.graphlint.registry.ReferenceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Detects functions and macros nothing calls.
 *
 * Functions can be called from any program, so the first run in a scan indexes the
 * references of the whole corpus. A function is used if its name is referenced anywhere
 * in the corpus, if the program calls it itself, or if another program's call target
 * contains its name.
 *
 * Skipped: interface programs, programs deriving from an entry-point type, programs outside
 * the analyzed root, lifecycle hooks, engine-style names, overrides of parent functions and
 * functions mandated by an implemented interface.
 *
 * Disabled by default because it loads every program of the corpus.
 */
public class UnusedFunctionDetector implements Detector {

    private static final Logger log = LoggerFactory.getLogger(UnusedFunctionDetector.class);

    @Override
    public IssueType type() {
        return IssueType.UNUSED_FUNCTION;
    }

    @Override
    public String description() {
        return "Detects functions and macros that are never called";
    }

    @Override
    public boolean enabledByDefault() {
        return false;
    }

    @Override
    public List<Issue> detect(Program program, ScanContext context) {
        List<Issue> issues = new ArrayList<>();
        LintRuleConfig rules = context.rules();

        if (program.isInterface() || rules.isInterfaceProgramName(program.name())) {
            return issues;
        }
        if (rules.getEntryPointBaseTypes().stream().anyMatch(program::isSubtypeOf)) {
            return issues;
        }

        context.ensureCorpusIndexed();
        ReferenceRegistry registry = context.registry();
        Set<String> localCalls = new HashSet<>();
        Set<String> localMacros = new HashSet<>();
        collectLocalReferences(program, localCalls, localMacros);

        if (rules.isUnderAnalyzedRoot(program.path())) {
            for (NodeGraph function : program.functionGraphs()) {
                String name = function.name();
                if (isExempt(program, name, rules)) {
                    continue;
                }
                boolean used = localCalls.contains(name)
                        || registry.isReferenced(name)
                        || registry.isCalledFromOtherProgram(name, program.path());
                if (!used) {
                    log.debug("Unreferenced function {} in {}", name, program.name());
                    issues.add(Issue.builder()
                            .type(IssueType.UNUSED_FUNCTION)
                            .programPath(program.path())
                            .nodeName(name)
                            .description("Function '" + name + "' is defined but never called")
                            .severity(Severity.MEDIUM)
                            .build());
                }
            }
        }

        for (NodeGraph macro : program.macroGraphs()) {
            String name = macro.name();
            if (rules.isSkippedMacro(name)) {
                continue;
            }
            if (!registry.isMacroReferenced(name) && !localMacros.contains(name)) {
                issues.add(Issue.builder()
                        .type(IssueType.UNUSED_FUNCTION)
                        .programPath(program.path())
                        .nodeName(name)
                        .description("Macro '" + name + "' is defined but never used")
                        .severity(Severity.LOW)
                        .build());
            }
        }
        return issues;
    }

    private boolean isExempt(Program program, String functionName, LintRuleConfig rules) {
        return rules.isLifecycleName(functionName)
                || rules.isEngineFunctionName(functionName)
                || program.overridesParentFunction(functionName)
                || program.requiresViaInterface(functionName);
    }

    private void collectLocalReferences(Program program, Set<String> calls, Set<String> macros) {
        for (NodeGraph graph : program.graphs()) {
            for (GraphNode node : graph.nodes()) {
                if (node.kind() == NodeKind.CALL_FUNCTION) {
                    node.member().ifPresent(calls::add);
                } else if (node.kind() == NodeKind.MACRO_INSTANCE) {
                    node.member().ifPresent(macros::add);
                }
            }
        }
    }
}
