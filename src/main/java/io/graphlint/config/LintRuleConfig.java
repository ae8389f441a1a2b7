package io.graphlint.config;

import io.graphlint.model.GraphNode;
import io.graphlint.model.Severity;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Naming heuristics used by the detectors: event names, loop and input node patterns,
 * engine function names, thresholds.
 * Loaded from YAML configuration files.
 */
public class LintRuleConfig {

    private static final String DEFAULT_CONFIG = "/lint-rules.yaml";

    private static final List<String> SET_KEYS = List.of(
            "tickEventNames", "loopNodePatterns", "frequentFunctionPatterns", "pureSkipTitlePatterns",
            "literalClassPatterns", "constructionScriptPatterns", "inputNodePatterns", "inputClassPatterns",
            "engineFunctionPatterns", "interfaceProgramPrefixes", "entryPointBaseTypes",
            "timerFunctionPrefixes", "macroSkipPrefixes");

    private static final List<String> SCALAR_KEYS = List.of(
            "lifecycleEventPrefix", "analyzedRootPath", "timerFunctionPinName",
            "tickComplexityThreshold", "tickSeverityBands");

    private final Map<String, Object> source;

    private final Set<String> tickEventNames;
    private final String lifecycleEventPrefix;
    private final Set<String> loopNodePatterns;
    private final Set<String> frequentFunctionPatterns;
    private final Set<String> pureSkipTitlePatterns;
    private final Set<String> literalClassPatterns;
    private final Set<String> constructionScriptPatterns;
    private final Set<String> inputNodePatterns;
    private final Set<String> inputClassPatterns;
    private final Set<String> engineFunctionPatterns;
    private final Set<String> interfaceProgramPrefixes;
    private final Set<String> entryPointBaseTypes;
    private final String analyzedRootPath;
    private final Set<String> timerFunctionPrefixes;
    private final String timerFunctionPinName;
    private final Set<String> macroSkipPrefixes;
    private final int tickComplexityThreshold;
    private final int tickMediumBand;
    private final int tickHighBand;
    private final int tickCriticalBand;

    private LintRuleConfig(Map<String, Object> config) {
        this.source = Collections.unmodifiableMap(new HashMap<>(config));
        this.tickEventNames = getStringSet(config, "tickEventNames");
        this.lifecycleEventPrefix = getString(config, "lifecycleEventPrefix", "Receive");
        this.loopNodePatterns = getStringSet(config, "loopNodePatterns");
        this.frequentFunctionPatterns = getStringSet(config, "frequentFunctionPatterns");
        this.pureSkipTitlePatterns = getStringSet(config, "pureSkipTitlePatterns");
        this.literalClassPatterns = getStringSet(config, "literalClassPatterns");
        this.constructionScriptPatterns = getStringSet(config, "constructionScriptPatterns");
        this.inputNodePatterns = getStringSet(config, "inputNodePatterns");
        this.inputClassPatterns = getStringSet(config, "inputClassPatterns");
        this.engineFunctionPatterns = getStringSet(config, "engineFunctionPatterns");
        this.interfaceProgramPrefixes = getStringSet(config, "interfaceProgramPrefixes");
        this.entryPointBaseTypes = getStringSet(config, "entryPointBaseTypes");
        this.analyzedRootPath = getString(config, "analyzedRootPath", "/Game/");
        this.timerFunctionPrefixes = getStringSet(config, "timerFunctionPrefixes");
        this.timerFunctionPinName = getString(config, "timerFunctionPinName", "FunctionName");
        this.macroSkipPrefixes = getStringSet(config, "macroSkipPrefixes");
        this.tickComplexityThreshold = getInt(config, "tickComplexityThreshold", 10);

        Map<String, Object> bands = getMap(config, "tickSeverityBands");
        this.tickMediumBand = getInt(bands, "medium", 10);
        this.tickHighBand = getInt(bands, "high", 25);
        this.tickCriticalBand = getInt(bands, "critical", 50);

        if (tickComplexityThreshold < 0) {
            throw new IllegalArgumentException("tickComplexityThreshold must be >= 0");
        }
        if (tickMediumBand > tickHighBand || tickHighBand > tickCriticalBand) {
            throw new IllegalArgumentException("tickSeverityBands must be ordered medium <= high <= critical");
        }
    }

    private static Set<String> getStringSet(Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (value instanceof List<?> list) {
            Set<String> result = new HashSet<>();
            for (Object item : list) {
                if (item instanceof String s && !s.isBlank()) {
                    result.add(s);
                }
            }
            return Set.copyOf(result);
        }
        return Set.of();
    }

    private static String getString(Map<String, Object> config, String key, String defaultValue) {
        Object value = config.get(key);
        return value instanceof String s && !s.isBlank() ? s : defaultValue;
    }

    private static int getInt(Map<String, Object> config, String key, int defaultValue) {
        Object value = config.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number n) {
            return n.intValue();
        }
        throw new IllegalArgumentException("'" + key + "' must be an integer, got: " + value);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<String, Object> config, String key) {
        Object value = config.get(key);
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    /**
     * Loads the default configuration from the classpath.
     */
    public static LintRuleConfig loadDefault() {
        try (InputStream is = LintRuleConfig.class.getResourceAsStream(DEFAULT_CONFIG)) {
            if (is == null) {
                throw new IllegalStateException("Default configuration not found: " + DEFAULT_CONFIG);
            }
            return load(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load default configuration", e);
        }
    }

    /**
     * Loads configuration from a file path.
     */
    public static LintRuleConfig loadFromFile(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return load(is);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public static LintRuleConfig load(InputStream is) {
        Yaml yaml = new Yaml();
        Map<String, Object> config = yaml.load(is);
        return new LintRuleConfig(config != null ? config : Map.of());
    }

    /**
     * Merges this configuration with another.
     * Pattern lists are combined; scalar values set in the other configuration take precedence.
     */
    public LintRuleConfig merge(LintRuleConfig other) {
        Map<String, Object> merged = new HashMap<>();
        for (String key : SET_KEYS) {
            Set<String> combined = new HashSet<>(getStringSet(this.source, key));
            combined.addAll(getStringSet(other.source, key));
            merged.put(key, new ArrayList<>(combined));
        }
        for (String key : SCALAR_KEYS) {
            Object value = other.source.containsKey(key) ? other.source.get(key) : this.source.get(key);
            if (value != null) {
                merged.put(key, value);
            }
        }
        return new LintRuleConfig(merged);
    }

    // ---- Query methods ----

    public boolean isTickEventName(String eventName) {
        return eventName != null && tickEventNames.contains(eventName);
    }

    /**
     * Returns true for built-in lifecycle hooks (ReceiveBeginPlay, ReceiveTick, ...).
     */
    public boolean isLifecycleName(String name) {
        return name != null && name.startsWith(lifecycleEventPrefix);
    }

    /**
     * Returns true if the node's class or title names a loop construct.
     */
    public boolean isLoopNode(GraphNode node) {
        return containsAny(node.nodeClass(), loopNodePatterns) || containsAny(node.title(), loopNodePatterns);
    }

    public boolean isFrequentFunctionName(String graphName) {
        return containsAny(graphName, frequentFunctionPatterns);
    }

    public boolean isPureUtilityTitle(String title) {
        return containsAny(title, pureSkipTitlePatterns);
    }

    public boolean isLiteralClass(String nodeClass) {
        return containsAny(nodeClass, literalClassPatterns);
    }

    public boolean isConstructionScriptTitle(String title) {
        return containsAny(title, constructionScriptPatterns);
    }

    /**
     * Returns true if the node is driven by the input system, judged by title or class.
     */
    public boolean isInputNode(GraphNode node) {
        return containsAny(node.title(), inputNodePatterns) || containsAny(node.nodeClass(), inputClassPatterns);
    }

    public boolean isEngineFunctionName(String functionName) {
        return containsAny(functionName, engineFunctionPatterns);
    }

    public boolean isInterfaceProgramName(String programName) {
        return startsWithAny(programName, interfaceProgramPrefixes);
    }

    public boolean isEntryPointBaseType(String typeName) {
        return typeName != null && entryPointBaseTypes.contains(typeName);
    }

    public boolean isUnderAnalyzedRoot(String programPath) {
        return programPath != null && programPath.startsWith(analyzedRootPath);
    }

    public boolean isTimerFunction(String functionName) {
        return startsWithAny(functionName, timerFunctionPrefixes);
    }

    public boolean isSkippedMacro(String macroName) {
        return startsWithAny(macroName, macroSkipPrefixes);
    }

    /**
     * Returns true if a tick event reaching this many nodes should be reported.
     */
    public boolean exceedsTickThreshold(int nodeCount) {
        return nodeCount > tickComplexityThreshold;
    }

    /**
     * Maps a tick node count onto a severity band.
     */
    public Severity tickSeverity(int nodeCount) {
        if (nodeCount > tickCriticalBand) {
            return Severity.CRITICAL;
        } else if (nodeCount > tickHighBand) {
            return Severity.HIGH;
        } else if (nodeCount > tickMediumBand) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    private static boolean containsAny(String value, Set<String> fragments) {
        if (value == null) return false;
        for (String fragment : fragments) {
            if (value.contains(fragment)) return true;
        }
        return false;
    }

    private static boolean startsWithAny(String value, Set<String> prefixes) {
        if (value == null) return false;
        for (String prefix : prefixes) {
            if (value.startsWith(prefix)) return true;
        }
        return false;
    }

    // ---- Getters for direct access ----

    public Set<String> getTickEventNames() {
        return tickEventNames;
    }

    public String getLifecycleEventPrefix() {
        return lifecycleEventPrefix;
    }

    public Set<String> getLoopNodePatterns() {
        return loopNodePatterns;
    }

    public Set<String> getFrequentFunctionPatterns() {
        return frequentFunctionPatterns;
    }

    public Set<String> getEngineFunctionPatterns() {
        return engineFunctionPatterns;
    }

    public Set<String> getEntryPointBaseTypes() {
        return entryPointBaseTypes;
    }

    public String getAnalyzedRootPath() {
        return analyzedRootPath;
    }

    public String getTimerFunctionPinName() {
        return timerFunctionPinName;
    }

    public int getTickComplexityThreshold() {
        return tickComplexityThreshold;
    }
}
