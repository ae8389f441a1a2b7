package io.graphlint.scan;

import io.graphlint.model.ProgramId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Background batch loop of an asynchronous scan.
 * <p>
 * The worker never touches program data. For each asset it posts a hand-off task to the
 * coordinator and waits for it in short timed slices, checking the cancellation token on
 * every wake-up. A hand-off still queued when cancellation is seen is abandoned; one that
 * already started is waited for, so analysis of an asset is never cut short.
 */
final class ScanWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ScanWorker.class);

    private final ScanSession session;
    private final Coordinator coordinator;
    private final BiConsumer<ScanSession, ProgramId> processor;
    private final Consumer<ScanSession> completion;
    private final Consumer<ScanSession> abort;

    ScanWorker(ScanSession session, Coordinator coordinator, BiConsumer<ScanSession, ProgramId> processor,
               Consumer<ScanSession> completion, Consumer<ScanSession> abort) {
        this.session = session;
        this.coordinator = coordinator;
        this.processor = processor;
        this.completion = completion;
        this.abort = abort;
    }

    @Override
    public void run() {
        try {
            for (ProgramId asset : session.assets()) {
                if (session.isCancelled()) {
                    log.debug("{} cancelled before {}", session, asset.path());
                    return;
                }
                Handoff handoff = new Handoff(() -> processor.accept(session, asset));
                try {
                    coordinator.execute(handoff);
                } catch (RejectedExecutionException e) {
                    log.warn("Coordinator rejected {}, stopping {}", asset.path(), session);
                    abort.accept(session);
                    return;
                }
                if (!awaitHandoff(handoff, asset)) {
                    return;
                }
            }
            if (!session.isCancelled()) {
                try {
                    coordinator.execute(() -> completion.accept(session));
                } catch (RejectedExecutionException e) {
                    log.warn("Coordinator rejected completion of {}", session);
                    abort.accept(session);
                }
            }
        } finally {
            session.markBatchDone();
        }
    }

    /**
     * Waits for a hand-off to finish. Returns false if the batch must stop.
     */
    private boolean awaitHandoff(Handoff handoff, ProgramId asset) {
        long sliceMillis = session.config().getHandoffTimeout().toMillis();
        while (true) {
            try {
                handoff.done().get(sliceMillis, TimeUnit.MILLISECONDS);
                return true;
            } catch (TimeoutException e) {
                if (session.isCancelled() && handoff.abandon()) {
                    log.debug("Abandoned queued analysis of {}", asset.path());
                    return false;
                }
            } catch (ExecutionException e) {
                log.error("Analysis of {} failed", asset.path(), e.getCause());
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                handoff.abandon();
                session.cancel();
                return false;
            }
        }
    }

    /**
     * A coordinator task that runs at most once and can be abandoned before it starts.
     */
    static final class Handoff implements Runnable {
        private static final int PENDING = 0;
        private static final int RUNNING = 1;
        private static final int ABANDONED = 2;

        private final Runnable work;
        private final AtomicInteger state = new AtomicInteger(PENDING);
        private final CompletableFuture<Void> done = new CompletableFuture<>();

        Handoff(Runnable work) {
            this.work = work;
        }

        @Override
        public void run() {
            if (!state.compareAndSet(PENDING, RUNNING)) {
                return;
            }
            try {
                work.run();
                done.complete(null);
            } catch (RuntimeException e) {
                done.completeExceptionally(e);
            } catch (Error e) {
                done.completeExceptionally(e);
                throw e;
            }
        }

        /**
         * Prevents the task from starting. Returns false if it already started.
         */
        boolean abandon() {
            return state.compareAndSet(PENDING, ABANDONED);
        }

        CompletableFuture<Void> done() {
            return done;
        }
    }
}
