package io.graphlint.detectors;

import io.graphlint.model.Issue;
import io.graphlint.model.IssueType;
import io.graphlint.model.Program;

import java.util.*;

/**
 * Registry of all available detectors.
 * Manages detector selection and result aggregation.
 */
public class DetectorRegistry {

    private final List<Detector> detectors;

    private DetectorRegistry(List<Detector> detectors) {
        this.detectors = List.copyOf(detectors);
    }

    /**
     * Creates a registry with all default detectors.
     */
    public static DetectorRegistry createDefault() {
        return new DetectorRegistry(List.of(
                new DeadNodeDetector(),
                new OrphanNodeDetector(),
                new CastAbuseDetector(),
                new TickAbuseDetector(),
                new UnusedFunctionDetector()
        ));
    }

    /**
     * Creates a registry with specific detectors.
     */
    public static DetectorRegistry of(Detector... detectors) {
        return new DetectorRegistry(Arrays.asList(detectors));
    }

    /**
     * Returns the detectors enabled by default.
     */
    public Set<IssueType> defaultEnabledTypes() {
        Set<IssueType> types = EnumSet.noneOf(IssueType.class);
        for (Detector detector : detectors) {
            if (detector.enabledByDefault()) {
                types.add(detector.type());
            }
        }
        return types;
    }

    /**
     * Returns the detectors for the given issue types, in registration order.
     */
    public List<Detector> select(Set<IssueType> types) {
        return detectors.stream()
                .filter(d -> types.contains(d.type()))
                .toList();
    }

    /**
     * Runs the detectors for the given issue types and returns aggregated issues.
     *
     * @param program The program to analyze
     * @param context Scan context
     * @param types   Issue types to detect
     * @return All issues from the selected detectors
     */
    public List<Issue> run(Program program, ScanContext context, Set<IssueType> types) {
        List<Issue> allIssues = new ArrayList<>();
        for (Detector detector : select(types)) {
            allIssues.addAll(detector.detect(program, context));
        }
        return allIssues;
    }

    /**
     * Returns all registered detectors.
     */
    public List<Detector> allDetectors() {
        return detectors;
    }

    /**
     * Returns a detector by ID, if present.
     */
    public Optional<Detector> getById(String id) {
        return detectors.stream()
                .filter(d -> d.id().equals(id))
                .findFirst();
    }
}
