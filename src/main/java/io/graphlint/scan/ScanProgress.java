package io.graphlint.scan;

import java.time.Duration;
import java.time.Instant;

/**
 * Snapshot of a scan's progress.
 *
 * @param totalAssets            Programs selected for the scan
 * @param processedAssets        Programs analyzed so far
 * @param issuesFound            Issues found so far
 * @param currentAsset           Name of the program being analyzed (may be null)
 * @param progressPercentage     processedAssets / totalAssets, as a fraction in [0, 1]
 * @param estimatedTimeRemaining Average time per program times programs remaining
 * @param startTime              When the scan started (null before the first scan)
 * @param completed              True once the scan ran to completion
 * @param cancelled              True if the scan was cancelled
 */
public record ScanProgress(
        int totalAssets,
        int processedAssets,
        int issuesFound,
        String currentAsset,
        double progressPercentage,
        Duration estimatedTimeRemaining,
        Instant startTime,
        boolean completed,
        boolean cancelled
) {
    public ScanProgress {
        if (estimatedTimeRemaining == null) {
            estimatedTimeRemaining = Duration.ZERO;
        }
    }

    /**
     * Progress of a linter that has not scanned yet.
     */
    public static ScanProgress idle() {
        return new ScanProgress(0, 0, 0, null, 0.0, Duration.ZERO, null, false, false);
    }

    public int remainingAssets() {
        return totalAssets - processedAssets;
    }
}
