package io.graphlint.scan;

import io.graphlint.ScanConfiguration;
import io.graphlint.config.LintRuleConfig;
import io.graphlint.detectors.Detector;
import io.graphlint.detectors.DetectorRegistry;
import io.graphlint.detectors.ScanContext;
import io.graphlint.model.Issue;
import io.graphlint.model.IssueType;
import io.graphlint.model.Program;
import io.graphlint.model.ProgramId;
import io.graphlint.source.ProgramLoadException;
import io.graphlint.source.ProgramSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs the enabled detectors over a set of programs and collects their issues.
 * <p>
 * States: idle, scanning, then completed or cancelled, then idle again. Only one scan
 * runs at a time; starting another while scanning is ignored.
 * <p>
 * Program data belongs to the {@link Coordinator}: every program is loaded and analyzed
 * there, and listeners are notified there. An asynchronous scan drives the batch from a
 * background worker that hands each program to the coordinator; a synchronous scan runs
 * the batch as one coordinator task. Issues and progress are guarded by one lock and can
 * be queried from any thread.
 * <p>
 * Cancelling keeps the issues found so far and reports them as the scan result.
 * Closing the linter cancels a running scan and waits, up to the configured shutdown
 * timeout, for the final result to be delivered.
 */
public class StaticLinter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StaticLinter.class);

    private static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final ProgramSource source;
    private final Coordinator coordinator;
    private final DetectorRegistry detectors;
    private final LintRuleConfig rules;
    private final ExecutorService worker;
    private final List<ScanListener> listeners = new CopyOnWriteArrayList<>();

    private final Object lock = new Object();
    private final List<Issue> issues = new ArrayList<>();
    private final ProgressState progress = new ProgressState();
    private ScanSession currentSession;
    private boolean scanning;
    private long generation;
    private volatile boolean closed;

    public StaticLinter(ProgramSource source, Coordinator coordinator) {
        this(source, coordinator, DetectorRegistry.createDefault(), LintRuleConfig.loadDefault());
    }

    public StaticLinter(ProgramSource source, Coordinator coordinator,
                        DetectorRegistry detectors, LintRuleConfig rules) {
        if (source == null || coordinator == null || detectors == null || rules == null) {
            throw new IllegalArgumentException("source, coordinator, detectors and rules are required");
        }
        this.source = source;
        this.coordinator = coordinator;
        this.detectors = detectors;
        this.rules = rules;
        this.worker = Executors.newSingleThreadExecutor(runnable -> {
            Thread t = new Thread(runnable, "graph-lint-worker");
            t.setDaemon(true);
            return t;
        });
    }

    public void addListener(ScanListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ScanListener listener) {
        listeners.remove(listener);
    }

    // ---- Scan entry points ----

    /**
     * Scans every program under the configured project root.
     */
    public void scanProject(ScanConfiguration config) {
        ensureOpen();
        scanBlueprints(source.listCandidatePrograms(List.of(config.getProjectRoot())), config);
    }

    /**
     * Scans every program under a folder.
     */
    public void scanFolder(String folderPath, ScanConfiguration config) {
        ensureOpen();
        scanBlueprints(source.listCandidatePrograms(List.of(folderPath)), config);
    }

    /**
     * Scans the programs under several folders. Programs listed by more than one folder
     * are scanned once.
     */
    public void scanSelectedFolders(List<String> folderPaths, ScanConfiguration config) {
        ensureOpen();
        Map<String, ProgramId> unique = new LinkedHashMap<>();
        for (String folder : folderPaths) {
            for (ProgramId id : source.listCandidatePrograms(List.of(folder))) {
                unique.putIfAbsent(id.path(), id);
            }
        }
        log.info("Scanning {} folders, found {} unique programs", folderPaths.size(), unique.size());
        scanBlueprints(new ArrayList<>(unique.values()), config);
    }

    /**
     * Scans the given programs.
     * <p>
     * Ignored, with a warning, if a scan is already running. Programs rejected by
     * {@link #shouldProcessAsset} are dropped; if none remain, listeners receive an empty
     * result before this method returns. Otherwise the scan runs in the background when
     * multi-threading is enabled and there is more than one program, and on the
     * coordinator before this method returns when not.
     */
    public void scanBlueprints(List<ProgramId> assets, ScanConfiguration config) {
        ensureOpen();
        List<ProgramId> filtered = assets.stream()
                .filter(id -> shouldProcessAsset(id, config))
                .toList();
        boolean async = config.isUseMultiThreading() && filtered.size() > 1;

        ScanSession session = null;
        synchronized (lock) {
            if (scanning) {
                log.warn("Scan already in progress, ignoring request for {} programs", assets.size());
                return;
            }
            issues.clear();
            progress.reset(filtered.size());
            if (filtered.isEmpty()) {
                progress.completed = true;
            } else {
                scanning = true;
                session = new ScanSession(++generation, filtered, config,
                        new ScanContext(rules, source, config.getProjectRoot()), async);
                currentSession = session;
            }
        }

        if (session == null) {
            log.warn("No programs found to scan");
            runOnCoordinatorAndWait(() -> fireComplete(List.of()));
            return;
        }

        log.info("Starting scan of {} programs with {} threading", filtered.size(), session.isAsync() ? "multi" : "single");
        if (session.isAsync()) {
            startWorker(session);
        } else {
            ScanSession syncSession = session;
            try {
                runOnCoordinatorAndWait(() -> runBatch(syncSession));
            } catch (RejectedExecutionException e) {
                log.error("Coordinator rejected the scan", e);
                session.markBatchDone();
                abort(session);
            }
        }
    }

    /**
     * Returns true if the program passes the path filters and does not derive from an
     * entry-point type.
     */
    public boolean shouldProcessAsset(ProgramId id, ScanConfiguration config) {
        if (!config.matchesPathFilters(id.path())) {
            return false;
        }
        for (String entryPoint : rules.getEntryPointBaseTypes()) {
            if (id.isChildOf(entryPoint)) {
                log.debug("Excluding {} program {}", entryPoint, id.name());
                return false;
            }
        }
        return true;
    }

    /**
     * Cancels the running scan, if any.
     * Waits for the batch loop to stop, then reports the issues found so far.
     */
    public void cancelScan() {
        ScanSession session;
        synchronized (lock) {
            session = currentSession;
            if (!scanning || session == null) {
                return;
            }
            progress.cancelled = true;
            session.cancel();
            log.info("Scan cancellation requested - processed {}/{} programs",
                    progress.processed, progress.total);
        }

        // on the coordinator no analysis can run concurrently; queued tasks of a finished session do nothing
        if (!coordinator.isCoordinatorThread()) {
            awaitBatch(session);
        }
        if (!session.tryFinish()) {
            return;
        }

        List<Issue> partial;
        synchronized (lock) {
            scanning = false;
            currentSession = null;
            progress.currentAsset = null;
            partial = List.copyOf(issues);
            log.info("Scan cancelled - {} issues found in {} processed programs", partial.size(), progress.processed);
        }
        deliverFinalResult(session, partial);
    }

    // ---- Queries ----

    public boolean isScanInProgress() {
        synchronized (lock) {
            return scanning;
        }
    }

    /**
     * Returns the issues found by the current or last scan, in discovery order.
     */
    public List<Issue> getIssues() {
        synchronized (lock) {
            return List.copyOf(issues);
        }
    }

    public List<Issue> getIssuesByType(IssueType type) {
        synchronized (lock) {
            return issues.stream()
                    .filter(issue -> issue.type() == type)
                    .toList();
        }
    }

    public ScanProgress getScanProgress() {
        synchronized (lock) {
            return progress.snapshot();
        }
    }

    // ---- Scan execution ----

    private void startWorker(ScanSession session) {
        try {
            worker.execute(new ScanWorker(session, coordinator, this::processAsset, this::completeScan, this::abort));
        } catch (RejectedExecutionException e) {
            log.error("Could not start background scan", e);
            session.markBatchDone();
            abort(session);
        }
    }

    /**
     * Synchronous batch loop; runs on the coordinator.
     */
    private void runBatch(ScanSession session) {
        try {
            for (ProgramId asset : session.assets()) {
                if (session.isCancelled()) {
                    break;
                }
                processAsset(session, asset);
            }
        } finally {
            session.markBatchDone();
        }
        if (!session.isCancelled()) {
            completeScan(session);
        }
    }

    /**
     * Analyzes one program and publishes progress; runs on the coordinator.
     */
    private void processAsset(ScanSession session, ProgramId asset) {
        if (session.isFinished()) {
            return;
        }
        synchronized (lock) {
            if (session == currentSession) {
                progress.currentAsset = asset.name();
            }
        }

        List<Issue> found = processProgram(session, asset);

        int processed;
        int total;
        synchronized (lock) {
            // a cancel that timed out may already have finished this session and started another
            if (session != currentSession || session.isFinished()) {
                log.debug("Dropping {} issues of {}, {} already finished", found.size(), asset.path(), session);
                return;
            }
            issues.addAll(found);
            progress.advance(issues.size());
            processed = progress.processed;
            total = progress.total;
            log.debug("Scan progress: {}/{} ({}%) - ETA: {}s - Current: {}", processed, total,
                    Math.round(progress.percentage() * 100), progress.estimatedRemaining().toSeconds(), asset.name());
        }
        fireProgress(processed, total);
    }

    /**
     * Loads a program and runs every enabled detector over it.
     * Load failures and detector faults are logged; issues found before a fault are kept.
     */
    private List<Issue> processProgram(ScanSession session, ProgramId asset) {
        Program program;
        try {
            program = source.loadProgram(asset);
        } catch (ProgramLoadException e) {
            log.warn("Failed to load program {}: {}", asset.path(), e.getMessage());
            return List.of();
        } catch (RuntimeException e) {
            log.error("Exception while loading program {}", asset.path(), e);
            return List.of();
        }

        if (!program.hasGraphs()) {
            log.debug("Program has no graphs to analyze: {}", program.name());
            return List.of();
        }

        List<Issue> found = new ArrayList<>();
        ScanContext context = session.context();
        try {
            context.indexProgram(program);
            for (Detector detector : detectors.select(session.config().getEnabledChecks())) {
                found.addAll(detector.detect(program, context));
            }
        } catch (RuntimeException e) {
            log.error("Analysis of {} failed, keeping {} issues found before the failure",
                    asset.path(), found.size(), e);
        }
        return found;
    }

    /**
     * Finishes a scan that ran through all of its programs; runs on the coordinator.
     */
    private void completeScan(ScanSession session) {
        if (!session.tryFinish()) {
            return;
        }
        List<Issue> result;
        synchronized (lock) {
            scanning = false;
            currentSession = null;
            progress.completed = true;
            progress.currentAsset = null;
            result = List.copyOf(issues);
            Duration elapsed = progress.elapsed();
            log.info("Scan completed: {} issues found in {} programs ({} ms total)",
                    result.size(), progress.total, elapsed.toMillis());
        }
        deliverFinalResult(session, result);
    }

    /**
     * Ends a scan that could not run to completion because the coordinator refused work.
     * The issues found before that point are reported as the result.
     */
    private void abort(ScanSession session) {
        session.cancel();
        if (!session.tryFinish()) {
            return;
        }
        List<Issue> partial;
        synchronized (lock) {
            scanning = false;
            currentSession = null;
            progress.cancelled = true;
            progress.currentAsset = null;
            partial = List.copyOf(issues);
            log.warn("Scan aborted - {} issues found in {} processed programs", partial.size(), progress.processed);
        }
        deliverFinalResult(session, partial);
    }

    private void deliverFinalResult(ScanSession session, List<Issue> result) {
        Runnable delivery = () -> {
            try {
                fireComplete(result);
            } finally {
                session.markTerminated();
            }
        };
        if (coordinator.isCoordinatorThread()) {
            delivery.run();
            return;
        }
        try {
            coordinator.execute(delivery);
        } catch (RejectedExecutionException e) {
            log.warn("Coordinator unavailable, scan result of {} not delivered", session);
            session.markTerminated();
        }
    }

    private void awaitBatch(ScanSession session) {
        Duration timeout = session.config().getShutdownTimeout();
        try {
            if (!session.awaitBatchDone(timeout)) {
                log.warn("{} did not stop within {} ms", session, timeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void runOnCoordinatorAndWait(Runnable task) {
        if (coordinator.isCoordinatorThread()) {
            task.run();
        } else {
            CompletableFuture.runAsync(task, coordinator).join();
        }
    }

    private void fireProgress(int processed, int total) {
        for (ScanListener listener : listeners) {
            try {
                listener.onScanProgress(processed, total);
            } catch (RuntimeException e) {
                log.error("Scan listener failed on progress", e);
            }
        }
    }

    private void fireComplete(List<Issue> result) {
        for (ScanListener listener : listeners) {
            try {
                listener.onScanComplete(result);
            } catch (RuntimeException e) {
                log.error("Scan listener failed on completion", e);
            }
        }
    }

    // ---- Lifecycle ----

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("StaticLinter is closed");
        }
    }

    /**
     * Cancels a running scan, waits for its final result to be delivered and stops the
     * worker thread. Waits are bounded by the scan's shutdown timeout; on timeout a warning
     * is logged and state is released anyway.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        ScanSession session;
        synchronized (lock) {
            session = currentSession;
        }
        Duration timeout = session != null ? session.config().getShutdownTimeout() : DEFAULT_SHUTDOWN_TIMEOUT;
        if (session != null) {
            cancelScan();
            try {
                if (!session.awaitTermination(timeout)) {
                    log.warn("Closing linter before {} delivered its result ({} ms timeout)", session, timeout.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        worker.shutdown();
        try {
            if (!worker.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Scan worker did not stop within {} ms", timeout.toMillis());
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.shutdownNow();
        }
        listeners.clear();
    }

    /**
     * Mutable progress, guarded by the linter lock.
     */
    private static final class ProgressState {
        int total;
        int processed;
        int issuesFound;
        String currentAsset;
        Instant startTime;
        Duration eta = Duration.ZERO;
        boolean completed;
        boolean cancelled;

        void reset(int totalAssets) {
            total = totalAssets;
            processed = 0;
            issuesFound = 0;
            currentAsset = null;
            startTime = Instant.now();
            eta = Duration.ZERO;
            completed = false;
            cancelled = false;
        }

        void advance(int totalIssues) {
            processed++;
            issuesFound = totalIssues;
            Duration elapsed = elapsed();
            eta = processed > 0
                    ? elapsed.dividedBy(processed).multipliedBy(total - processed)
                    : Duration.ZERO;
        }

        double percentage() {
            return total > 0 ? (double) processed / total : 0.0;
        }

        Duration estimatedRemaining() {
            return eta;
        }

        Duration elapsed() {
            return startTime == null ? Duration.ZERO : Duration.between(startTime, Instant.now());
        }

        ScanProgress snapshot() {
            return new ScanProgress(total, processed, issuesFound, currentAsset, percentage(),
                    eta, startTime, completed, cancelled);
        }
    }
}
