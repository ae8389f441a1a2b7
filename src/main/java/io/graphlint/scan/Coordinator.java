package io.graphlint.scan;

import java.util.concurrent.Executor;

/**
 * The single thread that owns program data.
 * Loading programs, running detectors and delivering scan events all happen on it.
 */
public interface Coordinator extends Executor {

    /**
     * Returns true if the calling thread is the coordinator thread.
     */
    boolean isCoordinatorThread();
}
