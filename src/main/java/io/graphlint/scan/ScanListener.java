package io.graphlint.scan;

import io.graphlint.model.Issue;

import java.util.List;

/**
 * Receives scan events. Both callbacks run on the coordinator thread.
 */
public interface ScanListener {

    /**
     * Called after each program has been analyzed.
     */
    default void onScanProgress(int processedAssets, int totalAssets) {
    }

    /**
     * Called once per scan, when it completes or is cancelled.
     * A cancelled scan reports the issues found before cancellation.
     */
    default void onScanComplete(List<Issue> issues) {
    }
}
