package io.graphlint.scan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * A {@link Coordinator} backed by one dedicated daemon thread.
 * Tasks run in submission order. A task that throws is logged and does not stop the thread.
 */
public class CoordinatorThread implements Coordinator, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorThread.class);

    private static final long CLOSE_TIMEOUT_SECONDS = 5;

    private final ExecutorService executor;
    private volatile Thread thread;

    public CoordinatorThread() {
        this("graph-lint-coordinator");
    }

    public CoordinatorThread(String threadName) {
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread t = new Thread(runnable, threadName);
            t.setDaemon(true);
            thread = t;
            return t;
        });
    }

    @Override
    public void execute(Runnable task) {
        executor.execute(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Coordinator task failed", e);
            }
        });
    }

    @Override
    public boolean isCoordinatorThread() {
        return Thread.currentThread() == thread;
    }

    /**
     * Stops accepting tasks and waits for queued ones to finish.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Coordinator did not drain within {}s, interrupting", CLOSE_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
