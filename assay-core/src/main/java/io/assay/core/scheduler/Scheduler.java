package io.assay.core.scheduler;

import io.assay.core.AssayConfig;
import io.assay.core.ClassCleanupBehavior;
import io.assay.core.descriptor.TestUnitDescriptor;
import io.assay.core.execution.ExecutionSession;
import io.assay.core.execution.InvocationPipeline;
import io.assay.core.execution.ScopeCleanup;
import io.assay.core.execution.Verdict;
import io.assay.core.expansion.DataExpansion;
import io.assay.core.lifecycle.ClassCleanupTracker;
import io.assay.core.lifecycle.ClassLifecycleState;
import io.assay.core.lifecycle.ModuleLifecycleState;
import io.assay.core.result.CaseResult;
import io.assay.core.result.FailureDetail;
import io.assay.core.result.FailureKind;
import io.assay.core.result.Outcome;
import io.assay.core.result.ResultSink;
import io.assay.core.result.RunSummary;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Partitions a run into dispatch units, drives them through a fixed worker pool and
/// aggregates their results.
///
/// ### Lifecycle
/// `UNSCHEDULED → PARTITIONED → DISPATCHED → AGGREGATED`. A scheduler runs once.
///
/// ### Contracts
/// - Exactly `workers` threads drain the parallel partition; the serial partition runs
///   afterwards on a single worker
/// - Results keep unit order: parallel units in partition order, then serial units
/// - Every initialized class and module scope is cleaned up exactly once
/// - Results reach the sink only after aggregation, followed by the run summary
///
/// @implNote Cross-worker state is limited to the session's registry and multiplexer,
/// the class cleanup tracker and the result slots, each of which is thread-safe.
public final class Scheduler {

    private static final Logger logger = Logger.getLogger(Scheduler.class.getName());

    private final ExecutionSession session;
    private final DataExpansion expansion;
    private final ScopeCleanup scopeCleanup;
    private final Partitioner partitioner;
    private final ClassCleanupTracker tracker = new ClassCleanupTracker();
    private final List<String> cleanupWarnings = Collections.synchronizedList(new ArrayList<>());
    private volatile SchedulerState state = SchedulerState.UNSCHEDULED;

    public Scheduler(ExecutionSession session) {
        this.session = session;
        this.expansion = new DataExpansion(session, new InvocationPipeline(session));
        this.scopeCleanup = new ScopeCleanup(session);
        this.partitioner = new Partitioner(session.getResolver());
    }

    /// Runs `descriptors` and delivers their results to `sink`.
    ///
    /// @param descriptors descriptors in submission order, not null
    /// @param sink receiver of results and the run summary, not null
    /// @return summary of the run, never null
    /// @throws IllegalStateException if this scheduler already ran
    public synchronized RunSummary run(List<TestUnitDescriptor> descriptors, ResultSink sink) {
        if (state != SchedulerState.UNSCHEDULED) {
            throw new IllegalStateException("Scheduler already ran: " + state);
        }
        Instant start = Instant.now();
        AssayConfig config = session.getConfig();

        PartitionPlan plan = partitioner.partition(descriptors, config);
        descriptors.forEach(d -> tracker.expect(d.className()));
        state = SchedulerState.PARTITIONED;
        logger.info(
                "Running "
                        + descriptors.size()
                        + " test(s): "
                        + plan.parallel().size()
                        + " parallel unit(s), "
                        + plan.serial().size()
                        + " serial unit(s), "
                        + plan.workers()
                        + " worker(s), scope "
                        + config.getParallelScope());

        AtomicReferenceArray<List<CaseResult>> slots =
                new AtomicReferenceArray<>(plan.unitCount());
        dispatch(plan, slots);
        state = SchedulerState.DISPATCHED;

        List<CaseResult> results = new ArrayList<>();
        List<DispatchUnit> units = new ArrayList<>(plan.parallel());
        units.addAll(plan.serial());
        for (DispatchUnit unit : units) {
            List<CaseResult> unitResults = slots.get(unit.index());
            results.addAll(unitResults != null ? unitResults : lost(unit));
        }
        cleanupRemainingScopes(results);
        state = SchedulerState.AGGREGATED;

        RunSummary summary =
                new RunSummary(
                        results,
                        session.getRunCancellation().isCancellationRequested(),
                        cleanupWarnings,
                        start,
                        Instant.now());
        deliver(sink, summary);
        logger.info(
                "Run completed in "
                        + summary.duration().toMillis()
                        + " ms: "
                        + summary.counts()
                        + (summary.cancelled() ? " (cancelled)" : ""));
        return summary;
    }

    public SchedulerState getState() {
        return state;
    }

    private void dispatch(PartitionPlan plan, AtomicReferenceArray<List<CaseResult>> slots) {
        ExecutorService workers =
                Executors.newFixedThreadPool(
                        plan.workers(), new NamedThreadFactory("assay-worker"));
        try {
            Queue<DispatchUnit> queue = new ConcurrentLinkedQueue<>(plan.parallel());
            List<Future<?>> drains = new ArrayList<>();
            for (int i = 0; i < plan.workers(); i++) {
                drains.add(
                        workers.submit(
                                () -> {
                                    DispatchUnit unit;
                                    while ((unit = queue.poll()) != null) {
                                        slots.set(unit.index(), runUnit(unit));
                                    }
                                }));
            }
            awaitAll(drains);

            if (!plan.serial().isEmpty()) {
                awaitAll(
                        List.of(
                                workers.submit(
                                        () -> {
                                            for (DispatchUnit unit : plan.serial()) {
                                                slots.set(unit.index(), runUnit(unit));
                                            }
                                        })));
            }
        } finally {
            workers.shutdown();
        }
    }

    private List<CaseResult> runUnit(DispatchUnit unit) {
        List<CaseResult> results = new ArrayList<>();
        List<TestUnitDescriptor> descriptors = unit.descriptors();
        int next = 0;
        try {
            while (next < descriptors.size()) {
                TestUnitDescriptor descriptor = descriptors.get(next);
                List<CaseResult> caseResults =
                        new ArrayList<>(
                                session.getRunCancellation().isCancellationRequested()
                                        ? List.of(cancelled(descriptor))
                                        : expansion.execute(descriptor));
                next++;
                completeCase(descriptor, caseResults);
                results.addAll(caseResults);
            }
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Dispatch unit " + unit.key() + " failed", e);
            for (int i = next; i < descriptors.size(); i++) {
                TestUnitDescriptor descriptor = descriptors.get(i);
                Verdict verdict = InvocationPipeline.engineFault(descriptor, e);
                results.add(CaseResult.of(descriptor, verdict.outcome(), verdict.failure()));
                tracker.complete(descriptor.className());
            }
        }
        return results;
    }

    /// Marks `descriptor` finished and, at end-of-class cleanup, cleans its class up
    /// once its last case is done.
    private void completeCase(TestUnitDescriptor descriptor, List<CaseResult> caseResults) {
        if (!tracker.complete(descriptor.className())
                || session.getConfig().getClassCleanupBehavior()
                        != ClassCleanupBehavior.END_OF_CLASS) {
            return;
        }
        session.getResolver()
                .resolveType(descriptor)
                .map(type -> session.getRegistry().findClassState(type))
                .ifPresent(
                        classState ->
                                attach(
                                        caseResults,
                                        caseResults.size() - 1,
                                        scopeCleanup.cleanup(classState, descriptor)));
    }

    /// Cleans up every class not yet cleaned, then every module, attaching warnings and
    /// output to the last result of each scope.
    private void cleanupRemainingScopes(List<CaseResult> results) {
        for (ClassLifecycleState classState : session.getRegistry().classStates()) {
            String className = classState.getType().getName();
            int last = lastIndexOf(results, r -> r.getDescriptor().className().equals(className));
            TestUnitDescriptor lastCase =
                    last >= 0
                            ? results.get(last).getDescriptor()
                            : TestUnitDescriptor.of(
                                    className, "classCleanup", classState.getModuleName());
            attach(results, last, scopeCleanup.cleanup(classState, lastCase));
        }
        for (ModuleLifecycleState module : session.getRegistry().moduleStates()) {
            String moduleName = module.getModuleName();
            int last =
                    lastIndexOf(results, r -> r.getDescriptor().moduleName().equals(moduleName));
            if (last < 0) {
                continue;
            }
            attach(results, last, scopeCleanup.cleanup(module, results.get(last).getDescriptor()));
        }
    }

    private void attach(List<CaseResult> results, int index, ScopeCleanup.Report report) {
        if (report.isEmpty()) {
            return;
        }
        cleanupWarnings.addAll(report.warnings());
        if (index < 0) {
            return;
        }
        CaseResult result = results.get(index);
        CaseResult.Builder builder =
                result.toBuilder()
                        .addWarnings(report.warnings())
                        .standardOutput(
                                result.getStandardOutput() + report.output().standardOutput())
                        .diagnosticTrace(
                                result.getDiagnosticTrace() + report.output().diagnosticTrace());
        if (!report.warnings().isEmpty()
                && session.getConfig().isTreatCleanupWarningsAsErrors()
                && result.getOutcome() == Outcome.PASSED) {
            builder.outcome(Outcome.FAILED)
                    .failure(
                            FailureDetail.of(
                                    FailureKind.CLEANUP_FAILURE, report.warnings().get(0)));
        }
        results.set(index, builder.build());
    }

    private void deliver(ResultSink sink, RunSummary summary) {
        for (CaseResult result : summary.results()) {
            try {
                sink.record(result);
            } catch (RuntimeException e) {
                logger.log(
                        Level.WARNING,
                        "Result sink failed to record "
                                + result.getDescriptor().fullyQualifiedName(),
                        e);
            }
        }
        try {
            sink.onRunCompleted(summary);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Result sink failed to complete the run", e);
        }
    }

    private void awaitAll(List<Future<?>> futures) {
        boolean interrupted = false;
        for (Future<?> future : futures) {
            while (true) {
                try {
                    future.get();
                    break;
                } catch (ExecutionException e) {
                    logger.log(Level.WARNING, "Worker failed", e.getCause());
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                    session.getRunCancellation().cancel();
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private static CaseResult cancelled(TestUnitDescriptor descriptor) {
        return CaseResult.builder(descriptor)
                .outcome(Outcome.IGNORED)
                .failure(
                        FailureDetail.of(
                                FailureKind.RUN_CANCELLED,
                                "Run was cancelled before the case started."))
                .duration(Duration.ZERO)
                .build();
    }

    private static List<CaseResult> lost(DispatchUnit unit) {
        logger.warning("Dispatch unit " + unit.key() + " reported no results");
        List<CaseResult> results = new ArrayList<>();
        for (TestUnitDescriptor descriptor : unit.descriptors()) {
            results.add(
                    CaseResult.of(
                            descriptor,
                            Outcome.FAILED,
                            FailureDetail.of(
                                    FailureKind.UNRECOGNIZED_EXCEPTION,
                                    "Worker stopped before running "
                                            + descriptor.fullyQualifiedName()
                                            + ".")));
        }
        return results;
    }

    private static int lastIndexOf(List<CaseResult> results, Predicate<CaseResult> matches) {
        for (int i = results.size() - 1; i >= 0; i--) {
            if (matches.test(results.get(i))) {
                return i;
            }
        }
        return -1;
    }
}
