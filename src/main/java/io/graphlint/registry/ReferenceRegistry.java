package io.graphlint.registry;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Names referenced anywhere in the scanned corpus: called functions, bound delegates and
 * their handlers, instantiated macros, and the raw call targets of each program.
 * <p>
 * One registry belongs to one scan. It only grows while the scan runs; indexing the same
 * program twice counts its calls twice. All methods are thread-safe.
 */
public class ReferenceRegistry {

    private final Set<String> referencedNames = ConcurrentHashMap.newKeySet();
    private final Map<String, Integer> callCounts = new ConcurrentHashMap<>();
    private final Set<String> referencedMacros = ConcurrentHashMap.newKeySet();
    private final Map<String, Set<String>> callTargetsByProgram = new ConcurrentHashMap<>();
    private volatile boolean corpusIndexed;

    /**
     * Records a call to a function and bumps its call count.
     */
    public void recordCall(String programPath, String functionName) {
        if (functionName == null || functionName.isBlank()) {
            return;
        }
        referencedNames.add(functionName);
        callCounts.merge(functionName, 1, Integer::sum);
        recordCallTarget(programPath, functionName);
    }

    /**
     * Records a name referenced without a direct call (delegates, handlers, timer callbacks).
     */
    public void recordReference(String name) {
        if (name != null && !name.isBlank()) {
            referencedNames.add(name);
        }
    }

    /**
     * Records a string a program uses to target a function, for substring lookups.
     */
    public void recordCallTarget(String programPath, String target) {
        if (programPath == null || target == null || target.isBlank()) {
            return;
        }
        callTargetsByProgram.computeIfAbsent(programPath, k -> ConcurrentHashMap.newKeySet()).add(target);
    }

    public void recordMacro(String macroName) {
        if (macroName != null && !macroName.isBlank()) {
            referencedMacros.add(macroName);
        }
    }

    public boolean isReferenced(String name) {
        return referencedNames.contains(name);
    }

    public int callCount(String functionName) {
        return callCounts.getOrDefault(functionName, 0);
    }

    public boolean isMacroReferenced(String macroName) {
        return referencedMacros.contains(macroName);
    }

    /**
     * Returns true if any program other than {@code excludedProgramPath} has a call target
     * equal to or containing {@code functionName}.
     */
    public boolean isCalledFromOtherProgram(String functionName, String excludedProgramPath) {
        for (Map.Entry<String, Set<String>> entry : callTargetsByProgram.entrySet()) {
            if (entry.getKey().equals(excludedProgramPath)) {
                continue;
            }
            for (String target : entry.getValue()) {
                if (target.equals(functionName) || target.contains(functionName)) {
                    return true;
                }
            }
        }
        return false;
    }

    public boolean isCorpusIndexed() {
        return corpusIndexed;
    }

    public void markCorpusIndexed() {
        this.corpusIndexed = true;
    }

    public int referencedNameCount() {
        return referencedNames.size();
    }

    /**
     * Returns a copy of the referenced names.
     */
    public Set<String> snapshot() {
        return Set.copyOf(referencedNames);
    }
}
