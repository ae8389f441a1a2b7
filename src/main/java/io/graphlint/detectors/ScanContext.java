package io.graphlint.detectors;

import io.graphlint.config.LintRuleConfig;
import io.graphlint.model.Program;
import io.graphlint.model.ProgramId;
import io.graphlint.registry.ReferenceRegistry;
import io.graphlint.registry.ReferenceResolver;
import io.graphlint.source.ProgramLoadException;
import io.graphlint.source.ProgramSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * State shared by the detectors of one scan: the rule set, the reference registry and
 * access to the rest of the corpus.
 * <p>
 * A context is created when a scan starts and dropped when it ends, so references found
 * in one scan never leak into the next. Indexing runs on the thread that runs the detectors.
 */
public class ScanContext {

    private static final Logger log = LoggerFactory.getLogger(ScanContext.class);

    private final LintRuleConfig rules;
    private final ReferenceRegistry registry;
    private final ReferenceResolver resolver;
    private final ProgramSource source;
    private final String corpusRoot;
    private final Set<String> indexedPaths = new HashSet<>();

    /**
     * @param rules      Naming heuristics
     * @param source     Source of the corpus, or null to analyze programs in isolation
     * @param corpusRoot Path prefix of the corpus indexed for cross-program references
     */
    public ScanContext(LintRuleConfig rules, ProgramSource source, String corpusRoot) {
        if (rules == null) {
            throw new IllegalArgumentException("rules cannot be null");
        }
        this.rules = rules;
        this.registry = new ReferenceRegistry();
        this.resolver = new ReferenceResolver(rules);
        this.source = source;
        this.corpusRoot = corpusRoot;
    }

    /**
     * Creates a context that sees no program besides the ones handed to the detectors.
     */
    public static ScanContext standalone(LintRuleConfig rules) {
        return new ScanContext(rules, null, null);
    }

    public LintRuleConfig rules() {
        return rules;
    }

    public ReferenceRegistry registry() {
        return registry;
    }

    /**
     * Records the references of a program once; later calls for the same path are ignored.
     */
    public synchronized void indexProgram(Program program) {
        if (indexedPaths.add(program.path())) {
            resolver.index(program, registry);
        }
    }

    /**
     * Indexes every program under the corpus root, once per scan.
     * Programs that fail to load are logged and skipped.
     */
    public synchronized void ensureCorpusIndexed() {
        if (registry.isCorpusIndexed()) {
            return;
        }
        if (source != null) {
            List<String> filters = corpusRoot == null || corpusRoot.isBlank() ? List.of() : List.of(corpusRoot);
            List<ProgramId> corpus = source.listCandidatePrograms(filters);
            log.debug("Indexing references of {} programs under {}", corpus.size(), corpusRoot);
            for (ProgramId id : corpus) {
                try {
                    indexProgram(source.loadProgram(id));
                } catch (ProgramLoadException e) {
                    log.warn("Skipping {} while indexing references: {}", id.path(), e.getMessage());
                } catch (RuntimeException e) {
                    log.error("Exception while indexing references of {}", id.path(), e);
                }
            }
        }
        registry.markCorpusIndexed();
        log.debug("Reference registry holds {} names", registry.referencedNameCount());
    }
}
