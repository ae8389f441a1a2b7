package io.graphlint.scan;

import io.graphlint.ScanConfiguration;
import io.graphlint.detectors.ScanContext;
import io.graphlint.model.ProgramId;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One scan invocation: its assets, configuration, detector context and cancellation token.
 * <p>
 * A session finishes exactly once, either by completing or by being cancelled; whichever
 * path wins {@link #tryFinish()} delivers the final result. Tasks of a finished session
 * still queued on the coordinator do nothing.
 */
final class ScanSession {

    private final long generation;
    private final List<ProgramId> assets;
    private final ScanConfiguration config;
    private final ScanContext context;
    private final boolean async;

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicBoolean finished = new AtomicBoolean();
    private final CountDownLatch batchDone = new CountDownLatch(1);
    private final CountDownLatch terminated = new CountDownLatch(1);

    ScanSession(long generation, List<ProgramId> assets, ScanConfiguration config,
                ScanContext context, boolean async) {
        this.generation = generation;
        this.assets = List.copyOf(assets);
        this.config = config;
        this.context = context;
        this.async = async;
    }

    List<ProgramId> assets() {
        return assets;
    }

    ScanConfiguration config() {
        return config;
    }

    ScanContext context() {
        return context;
    }

    boolean isAsync() {
        return async;
    }

    void cancel() {
        cancelled.set(true);
    }

    boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Claims the right to deliver the final result. Returns false if another path already did.
     */
    boolean tryFinish() {
        return finished.compareAndSet(false, true);
    }

    boolean isFinished() {
        return finished.get();
    }

    /**
     * Marks the batch loop (worker or synchronous) as stopped.
     */
    void markBatchDone() {
        batchDone.countDown();
    }

    boolean awaitBatchDone(Duration timeout) throws InterruptedException {
        return batchDone.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Marks the final result as delivered.
     */
    void markTerminated() {
        terminated.countDown();
    }

    boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public String toString() {
        return "ScanSession[" + generation + ", " + assets.size() + " assets]";
    }
}
