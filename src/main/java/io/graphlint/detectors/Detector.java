package io.graphlint.detectors;

import io.graphlint.model.Issue;
import io.graphlint.model.IssueType;
import io.graphlint.model.Program;

import java.util.List;

/**
 * Base interface for all lint detectors.
 * Each detector analyzes one program's graphs for a specific kind of defect.
 * Detectors never modify the program.
 */
public interface Detector {

    /**
     * Returns the category of issues this detector reports.
     */
    IssueType type();

    /**
     * Returns a unique identifier for this detector.
     */
    default String id() {
        return type().id();
    }

    /**
     * Returns a human-readable description of what this detector finds.
     */
    String description();

    /**
     * Detects issues in the given program.
     *
     * @param program The program to analyze
     * @param context Rules and cross-program references of the running scan
     * @return Issues in discovery order
     */
    List<Issue> detect(Program program, ScanContext context);

    /**
     * Returns true if this detector is enabled by default.
     */
    default boolean enabledByDefault() {
        return true;
    }
}
