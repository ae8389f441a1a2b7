package io.graphlint.scan;

import io.graphlint.ScanConfiguration;
import io.graphlint.config.LintRuleConfig;
import io.graphlint.detectors.Detector;
import io.graphlint.detectors.DetectorRegistry;
import io.graphlint.detectors.OrphanNodeDetector;
import io.graphlint.detectors.ScanContext;
import io.graphlint.model.GraphKind;
import io.graphlint.model.GraphNode;
import io.graphlint.model.Issue;
import io.graphlint.model.IssueType;
import io.graphlint.model.NodeGraph;
import io.graphlint.model.Program;
import io.graphlint.model.ProgramId;
import io.graphlint.model.TypeInfo;
import io.graphlint.source.InMemoryProgramSource;
import io.graphlint.source.ProgramLoadException;
import io.graphlint.source.ProgramSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StaticLinterTest {

    private static final long TIMEOUT_SECONDS = 10;

    private CoordinatorThread coordinator;
    private StaticLinter linter;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        coordinator = new CoordinatorThread("test-coordinator");
        listener = new RecordingListener();
    }

    @AfterEach
    void tearDown() {
        if (linter != null) {
            linter.close();
        }
        coordinator.close();
    }

    /**
     * A program with one isolated execution node: exactly one orphan issue under default checks.
     */
    private static Program orphanProgram(String path) {
        NodeGraph graph = NodeGraph.builder("EventGraph", GraphKind.EVENT_GRAPH)
                .addNode(GraphNode.builder().id("print").title("Print String").execIn("exec").execOut("then").build())
                .build();
        return Program.builder().path(path).addGraph(graph).build();
    }

    private static List<Program> orphanPrograms(int count) {
        List<Program> programs = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            programs.add(orphanProgram("/Game/Level/BP_Prop" + i + ".BP_Prop" + i));
        }
        return programs;
    }

    private StaticLinter linterOver(ProgramSource source) {
        linter = new StaticLinter(source, coordinator);
        linter.addListener(listener);
        return linter;
    }

    private static ScanConfiguration sync() {
        return ScanConfiguration.builder().useMultiThreading(false).build();
    }

    private static ScanConfiguration async() {
        return ScanConfiguration.builder().useMultiThreading(true).build();
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(TIMEOUT_SECONDS);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within " + TIMEOUT_SECONDS + "s");
            }
            Thread.sleep(5);
        }
    }

    @Test
    void scanBlueprints_emptyInputCompletesBeforeReturning() {
        StaticLinter linter = linterOver(new InMemoryProgramSource());

        linter.scanBlueprints(List.of(), async());

        assertThat(listener.completed.getCount()).isZero();
        assertThat(listener.result.get()).isEmpty();
        assertThat(linter.isScanInProgress()).isFalse();
        assertThat(linter.getScanProgress().completed()).isTrue();
        assertThat(linter.getScanProgress().totalAssets()).isZero();
    }

    @Test
    void scanProject_syncScanCompletesBeforeReturning() {
        InMemoryProgramSource source = new InMemoryProgramSource();
        orphanPrograms(3).forEach(source::add);
        StaticLinter linter = linterOver(source);

        linter.scanProject(sync());

        assertThat(listener.completed.getCount()).isZero();
        assertThat(listener.result.get()).hasSize(3);
        assertThat(listener.onCoordinator).isTrue();
        assertThat(linter.getIssues()).hasSize(3);

        ScanProgress progress = linter.getScanProgress();
        assertThat(progress.completed()).isTrue();
        assertThat(progress.cancelled()).isFalse();
        assertThat(progress.processedAssets()).isEqualTo(3);
        assertThat(progress.progressPercentage()).isEqualTo(1.0);
        assertThat(progress.currentAsset()).isNull();
    }

    @Test
    void scanProject_asyncScanReportsProgressOnCoordinator() throws InterruptedException {
        InMemoryProgramSource source = new InMemoryProgramSource();
        orphanPrograms(5).forEach(source::add);
        StaticLinter linter = linterOver(source);

        linter.scanProject(async());

        assertThat(listener.completed.await(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isTrue();
        assertThat(listener.onCoordinator).isTrue();
        assertThat(listener.progress).containsExactly(
                new ProgressEvent(1, 5), new ProgressEvent(2, 5), new ProgressEvent(3, 5),
                new ProgressEvent(4, 5), new ProgressEvent(5, 5));
        assertThat(listener.result.get()).hasSize(5);
        assertThat(linter.getIssuesByType(IssueType.ORPHAN_NODE)).hasSize(5);
        assertThat(linter.getIssuesByType(IssueType.DEAD_NODE)).isEmpty();
        assertThat(linter.getScanProgress().remainingAssets()).isZero();
        assertThat(linter.isScanInProgress()).isFalse();
    }

    @Test
    void scanBlueprints_issuesFollowProgramOrder() {
        InMemoryProgramSource source = new InMemoryProgramSource();
        orphanPrograms(3).forEach(source::add);
        StaticLinter linter = linterOver(source);

        linter.scanProject(sync());

        assertThat(linter.getIssues()).extracting(Issue::programPath).containsExactly(
                "/Game/Level/BP_Prop0.BP_Prop0", "/Game/Level/BP_Prop1.BP_Prop1", "/Game/Level/BP_Prop2.BP_Prop2");
    }

    @Test
    void scanBlueprints_rejectsConcurrentScan() throws InterruptedException {
        GatedProgramSource source = new GatedProgramSource("/Game/Level/BP_Prop1.BP_Prop1");
        orphanPrograms(3).forEach(source.programs::add);
        Program other = orphanProgram("/Game/Other/BP_Other.BP_Other");
        source.programs.add(other);
        StaticLinter linter = linterOver(source);

        linter.scanFolder("/Game/Level", async());
        assertThat(source.entered.await(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isTrue();

        linter.scanBlueprints(List.of(ProgramId.of(other.path())), sync());
        assertThat(linter.isScanInProgress()).isTrue();

        source.release.countDown();
        assertThat(listener.completed.await(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isTrue();
        assertThat(listener.completions).hasValue(1);
        assertThat(linter.getIssues()).extracting(Issue::programPath).doesNotContain(other.path()).hasSize(3);
    }

    @Test
    void cancelScan_fromListenerKeepsPartialResults() throws InterruptedException {
        InMemoryProgramSource source = new InMemoryProgramSource();
        orphanPrograms(5).forEach(source::add);
        StaticLinter linter = linterOver(source);
        linter.addListener(new ScanListener() {
            @Override
            public void onScanProgress(int processedAssets, int totalAssets) {
                if (processedAssets == 2) {
                    linter.cancelScan();
                }
            }
        });

        linter.scanProject(async());

        assertThat(listener.completed.await(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isTrue();
        assertThat(listener.result.get()).hasSize(2);
        assertThat(linter.getIssues()).hasSize(2);
        ScanProgress progress = linter.getScanProgress();
        assertThat(progress.cancelled()).isTrue();
        assertThat(progress.completed()).isFalse();
        assertThat(progress.processedAssets()).isEqualTo(2);
        assertThat(linter.isScanInProgress()).isFalse();
    }

    @Test
    void cancelScan_fromOtherThreadWaitsForCurrentProgram() throws Exception {
        GatedProgramSource source = new GatedProgramSource("/Game/Level/BP_Prop1.BP_Prop1");
        orphanPrograms(4).forEach(source.programs::add);
        StaticLinter linter = linterOver(source);

        linter.scanProject(async());
        assertThat(source.entered.await(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isTrue();

        CompletableFuture<Void> cancel = CompletableFuture.runAsync(linter::cancelScan);
        awaitCondition(() -> linter.getScanProgress().cancelled());
        source.release.countDown();
        cancel.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        assertThat(listener.completed.await(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isTrue();
        assertThat(listener.result.get()).extracting(Issue::programPath).containsExactly(
                "/Game/Level/BP_Prop0.BP_Prop0", "/Game/Level/BP_Prop1.BP_Prop1");
        assertThat(linter.isScanInProgress()).isFalse();
        assertThat(listener.completions).hasValue(1);
    }

    @Test
    void cancelScan_withoutScanDoesNothing() {
        StaticLinter linter = linterOver(new InMemoryProgramSource());

        linter.cancelScan();

        assertThat(listener.completions).hasValue(0);
        assertThat(linter.getScanProgress()).isEqualTo(ScanProgress.idle());
    }

    @Test
    void scanProject_continuesAfterLoadFailure() {
        InMemoryProgramSource source = new InMemoryProgramSource();
        orphanPrograms(2).forEach(source::add);
        StaticLinter linter = linterOver(source);
        List<ProgramId> ids = new ArrayList<>(source.listCandidatePrograms(List.of()));
        ids.add(1, ProgramId.of("/Game/Level/BP_Missing.BP_Missing"));

        linter.scanBlueprints(ids, sync());

        assertThat(linter.getIssues()).hasSize(2);
        assertThat(linter.getScanProgress().processedAssets()).isEqualTo(3);
        assertThat(linter.getScanProgress().completed()).isTrue();
    }

    @Test
    void scanProject_continuesAfterDetectorFault() throws InterruptedException {
        Program faulty = orphanProgram("/Game/Level/BP_Faulty.BP_Faulty");
        Program healthy = orphanProgram("/Game/Level/BP_Healthy.BP_Healthy");
        Detector exploding = new Detector() {
            @Override
            public IssueType type() {
                return IssueType.TICK_ABUSE;
            }

            @Override
            public String description() {
                return "Fails on one program";
            }

            @Override
            public List<Issue> detect(Program program, ScanContext context) {
                if (program.path().equals(faulty.path())) {
                    throw new IllegalStateException("boom");
                }
                return List.of();
            }
        };
        linter = new StaticLinter(InMemoryProgramSource.of(faulty, healthy), coordinator,
                DetectorRegistry.of(new OrphanNodeDetector(), exploding), LintRuleConfig.loadDefault());
        linter.addListener(listener);

        linter.scanProject(async());

        assertThat(listener.awaitCompletion()).isTrue();
        assertThat(linter.getIssues()).extracting(Issue::programPath)
                .containsExactly(faulty.path(), healthy.path());
        assertThat(linter.getScanProgress().processedAssets()).isEqualTo(2);
    }

    @Test
    void scanProject_skipsProgramsWithoutGraphs() {
        InMemoryProgramSource source = InMemoryProgramSource.of(
                Program.builder().path("/Game/Data/DA_Empty.DA_Empty").build(),
                orphanProgram("/Game/Level/BP_Prop.BP_Prop"));
        StaticLinter linter = linterOver(source);

        linter.scanProject(sync());

        assertThat(linter.getIssues()).hasSize(1);
        assertThat(linter.getScanProgress().processedAssets()).isEqualTo(2);
    }

    @Test
    void scanSelectedFolders_scansOverlappingProgramsOnce() {
        InMemoryProgramSource source = new InMemoryProgramSource();
        orphanPrograms(2).forEach(source::add);
        source.add(orphanProgram("/Game/Enemies/BP_Grunt.BP_Grunt"));
        StaticLinter linter = linterOver(source);

        linter.scanSelectedFolders(List.of("/Game/Level", "/Game", "/Game/Enemies"), sync());

        assertThat(linter.getScanProgress().totalAssets()).isEqualTo(3);
        assertThat(linter.getIssues()).hasSize(3);
    }

    @Test
    void scanProject_excludesEntryPointPrograms() {
        Program gameInstance = Program.builder().path("/Game/Core/BP_GI.BP_GI")
                .parent(TypeInfo.root("GameInstance"))
                .addGraph(orphanProgram("/Game/Core/BP_GI.BP_GI").graphs().get(0))
                .build();
        InMemoryProgramSource source = InMemoryProgramSource.of(gameInstance, orphanProgram("/Game/Level/BP_Prop.BP_Prop"));
        StaticLinter linter = linterOver(source);

        linter.scanProject(sync());

        assertThat(linter.getScanProgress().totalAssets()).isEqualTo(1);
        assertThat(linter.getIssues()).extracting(Issue::programPath).containsExactly("/Game/Level/BP_Prop.BP_Prop");
        assertThat(linter.shouldProcessAsset(ProgramId.of(gameInstance.path(), "GameInstance"), sync())).isFalse();
    }

    @Test
    void scanProject_appliesPathFilters() {
        InMemoryProgramSource source = new InMemoryProgramSource();
        orphanPrograms(2).forEach(source::add);
        source.add(orphanProgram("/Game/Level/Deprecated/BP_Old.BP_Old"));
        StaticLinter linter = linterOver(source);
        ScanConfiguration config = ScanConfiguration.builder()
                .useMultiThreading(false)
                .excludePaths(List.of("Deprecated"))
                .build();

        linter.scanProject(config);

        assertThat(linter.getIssues()).hasSize(2);
    }

    @Test
    void scanProject_startsFreshEachTime() {
        InMemoryProgramSource source = new InMemoryProgramSource();
        orphanPrograms(2).forEach(source::add);
        StaticLinter linter = linterOver(source);

        linter.scanProject(sync());
        linter.scanProject(sync());

        assertThat(linter.getIssues()).hasSize(2);
        assertThat(listener.completions).hasValue(2);
    }

    @Test
    void close_rejectsLaterScans() {
        StaticLinter linter = linterOver(new InMemoryProgramSource());

        linter.close();

        assertThatThrownBy(() -> linter.scanProject(sync())).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void close_cancelsRunningScan() throws InterruptedException {
        GatedProgramSource source = new GatedProgramSource("/Game/Level/BP_Prop0.BP_Prop0");
        orphanPrograms(3).forEach(source.programs::add);
        StaticLinter linter = linterOver(source);

        linter.scanProject(async());
        assertThat(source.entered.await(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isTrue();

        CompletableFuture<Void> close = CompletableFuture.runAsync(linter::close);
        awaitCondition(() -> linter.getScanProgress().cancelled());
        source.release.countDown();
        close.join();

        assertThat(listener.completions).hasValue(1);
        assertThat(linter.isScanInProgress()).isFalse();
        assertThat(linter.getIssues()).hasSize(1);
    }

    @Test
    void cancelScan_lateAnalysisOfCancelledScanIsDropped() throws Exception {
        GatedProgramSource source = new GatedProgramSource("/Game/A/BP_P0.BP_P0");
        source.programs.add(orphanProgram("/Game/A/BP_P0.BP_P0"))
                .add(orphanProgram("/Game/A/BP_P1.BP_P1"))
                .add(orphanProgram("/Game/B/BP_Q0.BP_Q0"))
                .add(orphanProgram("/Game/B/BP_Q1.BP_Q1"));
        StaticLinter linter = linterOver(source);
        ScanConfiguration shortShutdown = ScanConfiguration.builder()
                .useMultiThreading(true)
                .shutdownTimeoutMillis(50)
                .build();

        linter.scanFolder("/Game/A", shortShutdown);
        assertThat(source.entered.await(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isTrue();
        linter.cancelScan();
        assertThat(linter.isScanInProgress()).isFalse();

        linter.scanFolder("/Game/B", async());
        source.release.countDown();
        awaitCondition(() -> listener.completions.get() == 2);

        assertThat(listener.result.get()).extracting(Issue::programPath)
                .containsExactly("/Game/B/BP_Q0.BP_Q0", "/Game/B/BP_Q1.BP_Q1");
        assertThat(linter.getIssues()).hasSize(2);
        assertThat(listener.progress).containsExactly(new ProgressEvent(1, 2), new ProgressEvent(2, 2));
        ScanProgress progress = linter.getScanProgress();
        assertThat(progress.processedAssets()).isEqualTo(2);
        assertThat(progress.totalAssets()).isEqualTo(2);
        assertThat(progress.completed()).isTrue();
    }

    @Test
    void scanProject_rejectedHandoffEndsScanWithPartialResults() throws InterruptedException {
        InMemoryProgramSource source = new InMemoryProgramSource();
        orphanPrograms(3).forEach(source::add);
        linter = new StaticLinter(source, new RejectingCoordinator(coordinator, 2));
        linter.addListener(listener);

        linter.scanProject(async());

        assertThat(listener.awaitCompletion()).isTrue();
        assertThat(listener.result.get()).extracting(Issue::programPath)
                .containsExactly("/Game/Level/BP_Prop0.BP_Prop0");
        assertThat(linter.isScanInProgress()).isFalse();
        assertThat(linter.getScanProgress().cancelled()).isTrue();

        linter.scanProject(sync());

        assertThat(listener.completions).hasValue(2);
        assertThat(listener.result.get()).hasSize(3);
    }

    @Test
    void scanProject_rejectedCompletionStillDeliversResult() throws InterruptedException {
        InMemoryProgramSource source = new InMemoryProgramSource();
        orphanPrograms(2).forEach(source::add);
        linter = new StaticLinter(source, new RejectingCoordinator(coordinator, 3));
        linter.addListener(listener);

        linter.scanProject(async());

        assertThat(listener.awaitCompletion()).isTrue();
        assertThat(listener.result.get()).hasSize(2);
        assertThat(listener.completions).hasValue(1);
        assertThat(linter.isScanInProgress()).isFalse();
        assertThat(linter.getScanProgress().processedAssets()).isEqualTo(2);
    }

    private record ProgressEvent(int processed, int total) {
    }

    /**
     * Records listener callbacks and checks they arrive on the coordinator.
     */
    private final class RecordingListener implements ScanListener {
        final List<ProgressEvent> progress = Collections.synchronizedList(new ArrayList<>());
        final AtomicReference<List<Issue>> result = new AtomicReference<>();
        final AtomicInteger completions = new AtomicInteger();
        final CountDownLatch completed = new CountDownLatch(1);
        final AtomicBoolean onCoordinator = new AtomicBoolean(true);

        @Override
        public void onScanProgress(int processedAssets, int totalAssets) {
            checkThread();
            progress.add(new ProgressEvent(processedAssets, totalAssets));
        }

        @Override
        public void onScanComplete(List<Issue> issues) {
            checkThread();
            result.set(issues);
            completions.incrementAndGet();
            completed.countDown();
        }

        boolean awaitCompletion() throws InterruptedException {
            return completed.await(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        }

        private void checkThread() {
            if (!coordinator.isCoordinatorThread()) {
                onCoordinator.set(false);
            }
        }
    }

    /**
     * Blocks the load of one program until released.
     */
    private static final class GatedProgramSource implements ProgramSource {
        final InMemoryProgramSource programs = new InMemoryProgramSource();
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        private final String gatedPath;

        GatedProgramSource(String gatedPath) {
            this.gatedPath = gatedPath;
        }

        @Override
        public List<ProgramId> listCandidatePrograms(List<String> pathFilters) {
            return programs.listCandidatePrograms(pathFilters);
        }

        @Override
        public Program loadProgram(ProgramId id) throws ProgramLoadException {
            if (id.path().equals(gatedPath)) {
                entered.countDown();
                try {
                    if (!release.await(TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                        throw new ProgramLoadException(id, "Gate never released");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ProgramLoadException(id, "Interrupted at gate", e);
                }
            }
            return programs.loadProgram(id);
        }
    }

    /**
     * Refuses the n-th task posted to it and forwards every other one.
     */
    private static final class RejectingCoordinator implements Coordinator {
        private final Coordinator delegate;
        private final int rejectedCall;
        private final AtomicInteger calls = new AtomicInteger();

        RejectingCoordinator(Coordinator delegate, int rejectedCall) {
            this.delegate = delegate;
            this.rejectedCall = rejectedCall;
        }

        @Override
        public void execute(Runnable command) {
            if (calls.incrementAndGet() == rejectedCall) {
                throw new RejectedExecutionException("Coordinator is shutting down");
            }
            delegate.execute(command);
        }

        @Override
        public boolean isCoordinatorThread() {
            return delegate.isCoordinatorThread();
        }
    }
}
