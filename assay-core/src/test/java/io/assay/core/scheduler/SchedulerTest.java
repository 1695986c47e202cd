package io.assay.core.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import io.assay.core.AssayConfig;
import io.assay.core.ClassCleanupBehavior;
import io.assay.core.descriptor.BindingTable;
import io.assay.core.descriptor.ClassBindings;
import io.assay.core.descriptor.ModuleBindings;
import io.assay.core.descriptor.TestMethodDefinition;
import io.assay.core.descriptor.TestUnitDescriptor;
import io.assay.core.execution.AssertionFailedException;
import io.assay.core.execution.CaseExecutionContext;
import io.assay.core.execution.ExecutionSession;
import io.assay.core.result.CaseResult;
import io.assay.core.result.CollectingResultSink;
import io.assay.core.result.FailureKind;
import io.assay.core.result.Outcome;
import io.assay.core.result.ResultSink;
import io.assay.core.result.RunSummary;
import io.assay.core.testing.Journal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("Scheduler")
@ExtendWith(MockitoExtension.class)
class SchedulerTest {

    private ExecutorService boundaryExecutor;

    @Mock private ResultSink failingSink;

    @BeforeEach
    void setUp() {
        Journal.clear();
        Mixed.active.set(0);
        Mixed.overlapped.set(false);
        Canceller.cancellation = null;
        boundaryExecutor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        boundaryExecutor.shutdownNow();
    }

    @Nested
    @DisplayName("parallel dispatch")
    class ParallelDispatch {

        @Test
        @DisplayName("initializes a shared class exactly once under method-level parallelism")
        void shouldInitializeSharedClassOnce() {
            var builder =
                    BindingTable.builder()
                            .type(
                                    Shared.class,
                                    ClassBindings.builder(Shared.class)
                                            .classInitialize("setUpClass")
                                            .build());
            List<TestUnitDescriptor> descriptors = new ArrayList<>();
            for (String method : List.of("one", "two", "three", "four", "five", "six")) {
                descriptors.add(
                        builder.register(
                                "m", TestMethodDefinition.builder(Shared.class, method).build()));
            }
            var config =
                    AssayConfig.builder().workers(4).parallelScope(ParallelScope.METHOD).build();

            var summary = run(builder.build(), config, descriptors, new CollectingResultSink());

            assertThat(Journal.count("class-init")).isEqualTo(1);
            assertThat(Journal.count("body")).isEqualTo(6);
            assertThat(summary.count(Outcome.PASSED)).isEqualTo(6);
            assertThat(summary.results())
                    .extracting(CaseResult::getDescriptor)
                    .containsExactlyElementsOf(descriptors);
        }

        @Test
        @DisplayName("keeps the cases of a class together at class scope")
        void shouldGroupByClassAtClassScope() {
            var builder = BindingTable.builder();
            var firstA =
                    builder.register(
                            "m", TestMethodDefinition.builder(OrderA.class, "one").build());
            var firstB =
                    builder.register(
                            "m", TestMethodDefinition.builder(OrderB.class, "one").build());
            var secondA =
                    builder.register(
                            "m", TestMethodDefinition.builder(OrderA.class, "two").build());
            var config =
                    AssayConfig.builder().workers(2).parallelScope(ParallelScope.CLASS).build();

            var summary =
                    run(
                            builder.build(),
                            config,
                            List.of(firstA, firstB, secondA),
                            new CollectingResultSink());

            assertThat(summary.results())
                    .extracting(CaseResult::getDescriptor)
                    .containsExactly(firstA, secondA, firstB);
        }

        @Test
        @DisplayName("runs non-parallelizable cases after the parallel ones, one at a time")
        void shouldRunSerialCasesAlone() {
            var builder = BindingTable.builder();
            var descriptors =
                    List.of(
                            builder.register(
                                    "m",
                                    TestMethodDefinition.builder(Mixed.class, "serialA")
                                            .doNotParallelize()
                                            .build()),
                            builder.register(
                                    "m",
                                    TestMethodDefinition.builder(Mixed.class, "parallelA").build()),
                            builder.register(
                                    "m",
                                    TestMethodDefinition.builder(Mixed.class, "serialB")
                                            .doNotParallelize()
                                            .build()),
                            builder.register(
                                    "m",
                                    TestMethodDefinition.builder(Mixed.class, "parallelB")
                                            .build()));
            var config =
                    AssayConfig.builder().workers(4).parallelScope(ParallelScope.METHOD).build();

            var summary = run(builder.build(), config, descriptors, new CollectingResultSink());

            assertThat(Journal.events())
                    .containsExactlyInAnyOrder("parallel", "parallel", "serial-a", "serial-b");
            assertThat(Journal.events().subList(0, 2)).containsOnly("parallel");
            assertThat(Journal.events().subList(2, 4)).containsExactly("serial-a", "serial-b");
            assertThat(Mixed.overlapped).isFalse();
            assertThat(summary.results())
                    .extracting(r -> r.getDescriptor().methodName())
                    .containsExactly("parallelA", "parallelB", "serialA", "serialB");
        }
    }

    @Nested
    @DisplayName("scope cleanup")
    class ScopeCleanupTiming {

        @Test
        @DisplayName("cleans each class right after its last case at end-of-class")
        void shouldCleanUpClassesEarly() {
            var builder = cleanupTable();
            var descriptors = cleanupDescriptors(builder);
            var config =
                    AssayConfig.builder()
                            .parallelizationDisabled(true)
                            .classCleanupBehavior(ClassCleanupBehavior.END_OF_CLASS)
                            .build();

            run(builder.build(), config, descriptors, new CollectingResultSink());

            assertThat(Journal.events())
                    .containsExactly(
                            "a-body",
                            "a-body",
                            "a-class-cleanup",
                            "b-body",
                            "b-class-cleanup",
                            "module-cleanup");
        }

        @Test
        @DisplayName("defers class cleanup to the end of the run at end-of-module")
        void shouldDeferClassCleanup() {
            var builder = cleanupTable();
            var descriptors = cleanupDescriptors(builder);
            var config =
                    AssayConfig.builder()
                            .parallelizationDisabled(true)
                            .classCleanupBehavior(ClassCleanupBehavior.END_OF_MODULE)
                            .build();

            run(builder.build(), config, descriptors, new CollectingResultSink());

            assertThat(Journal.events())
                    .containsExactly(
                            "a-body",
                            "a-body",
                            "b-body",
                            "a-class-cleanup",
                            "b-class-cleanup",
                            "module-cleanup");
        }

        @Test
        @DisplayName("attaches class cleanup output and warnings to the last case of the class")
        void shouldAttachCleanupReportToLastCase() {
            var builder =
                    BindingTable.builder()
                            .type(
                                    NoisyCleanup.class,
                                    ClassBindings.builder(NoisyCleanup.class)
                                            .classCleanup("tearDownClass")
                                            .build());
            var first =
                    builder.register(
                            "m", TestMethodDefinition.builder(NoisyCleanup.class, "one").build());
            var second =
                    builder.register(
                            "m", TestMethodDefinition.builder(NoisyCleanup.class, "two").build());
            var config = AssayConfig.builder().parallelizationDisabled(true).build();

            var summary =
                    run(
                            builder.build(),
                            config,
                            List.of(first, second),
                            new CollectingResultSink());

            CaseResult last = summary.results().get(1);
            assertThat(summary.results().get(0).getWarnings()).isEmpty();
            assertThat(last.getOutcome()).isEqualTo(Outcome.PASSED);
            assertThat(last.getWarnings()).hasSize(1);
            assertThat(last.getStandardOutput()).contains("closing class");
            assertThat(summary.cleanupWarnings()).hasSize(1);
        }

        @Test
        @DisplayName("fails the last case on class cleanup warnings when configured")
        void shouldFailLastCaseOnCleanupWarnings() {
            var builder =
                    BindingTable.builder()
                            .type(
                                    NoisyCleanup.class,
                                    ClassBindings.builder(NoisyCleanup.class)
                                            .classCleanup("tearDownClass")
                                            .build());
            var only =
                    builder.register(
                            "m", TestMethodDefinition.builder(NoisyCleanup.class, "one").build());
            var config =
                    AssayConfig.builder()
                            .parallelizationDisabled(true)
                            .treatCleanupWarningsAsErrors(true)
                            .build();

            var summary = run(builder.build(), config, List.of(only), new CollectingResultSink());

            assertThat(summary.results().get(0).getOutcome()).isEqualTo(Outcome.FAILED);
            assertThat(summary.results().get(0).getFailure().kind())
                    .isEqualTo(FailureKind.CLEANUP_FAILURE);
        }

        @Test
        @DisplayName("keeps the failure of a failed last case when class cleanup also fails")
        void shouldKeepOriginalFailureOnCleanupWarnings() {
            var builder =
                    BindingTable.builder()
                            .type(
                                    NoisyCleanup.class,
                                    ClassBindings.builder(NoisyCleanup.class)
                                            .classCleanup("tearDownClass")
                                            .build());
            var only =
                    builder.register(
                            "m", TestMethodDefinition.builder(NoisyCleanup.class, "fails").build());
            var config =
                    AssayConfig.builder()
                            .parallelizationDisabled(true)
                            .treatCleanupWarningsAsErrors(true)
                            .build();

            var summary = run(builder.build(), config, List.of(only), new CollectingResultSink());

            CaseResult result = summary.results().get(0);
            assertThat(result.getOutcome()).isEqualTo(Outcome.FAILED);
            assertThat(result.getFailure().kind()).isEqualTo(FailureKind.ASSERTION_FAILURE);
            assertThat(result.getWarnings()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        @DisplayName("reports undispatched cases as ignored once the run is cancelled")
        void shouldIgnoreCasesAfterCancellation() {
            var builder = BindingTable.builder();
            var first =
                    builder.register(
                            "m", TestMethodDefinition.builder(Canceller.class, "cancels").build());
            var second =
                    builder.register(
                            "m",
                            TestMethodDefinition.builder(Canceller.class, "neverRuns").build());
            var cancellation = new RunCancellation();
            Canceller.cancellation = cancellation;
            var session =
                    session(
                            builder.build(),
                            AssayConfig.builder().parallelizationDisabled(true).build(),
                            cancellation);

            var summary =
                    new Scheduler(session).run(List.of(first, second), new CollectingResultSink());

            assertThat(summary.cancelled()).isTrue();
            assertThat(summary.results().get(0).getOutcome()).isEqualTo(Outcome.PASSED);
            assertThat(summary.results().get(1).getOutcome()).isEqualTo(Outcome.IGNORED);
            assertThat(summary.results().get(1).getFailure().kind())
                    .isEqualTo(FailureKind.RUN_CANCELLED);
            assertThat(Journal.events()).containsExactly("cancel");
        }
    }

    @Nested
    @DisplayName("delivery")
    class Delivery {

        @Test
        @DisplayName("delivers every result before the summary")
        void shouldDeliverResultsThenSummary() {
            var builder = BindingTable.builder();
            var descriptor =
                    builder.register(
                            "m", TestMethodDefinition.builder(OrderA.class, "one").build());
            var sink = new CollectingResultSink();

            var summary = run(builder.build(), AssayConfig.defaults(), List.of(descriptor), sink);

            assertThat(sink.getResults()).hasSize(1);
            assertThat(sink.getSummary()).isSameAs(summary);
        }

        @Test
        @DisplayName("keeps going when the sink throws")
        void shouldSurviveFailingSink() {
            var builder = BindingTable.builder();
            var first =
                    builder.register(
                            "m", TestMethodDefinition.builder(OrderA.class, "one").build());
            var second =
                    builder.register(
                            "m", TestMethodDefinition.builder(OrderA.class, "two").build());
            doThrow(new IllegalStateException("disk full")).when(failingSink).record(any());

            var summary =
                    run(
                            builder.build(),
                            AssayConfig.defaults(),
                            List.of(first, second),
                            failingSink);

            assertThat(summary.results()).hasSize(2);
            verify(failingSink, times(2)).record(any());
            verify(failingSink).onRunCompleted(summary);
        }

        @Test
        @DisplayName("refuses to run twice")
        void shouldRunOnlyOnce() {
            var builder = BindingTable.builder();
            var descriptor =
                    builder.register(
                            "m", TestMethodDefinition.builder(OrderA.class, "one").build());
            var scheduler =
                    new Scheduler(session(builder.build(), AssayConfig.defaults(), null));
            scheduler.run(List.of(descriptor), new CollectingResultSink());

            assertThat(scheduler.getState()).isEqualTo(SchedulerState.AGGREGATED);
            assertThatThrownBy(() -> scheduler.run(List.of(descriptor), new CollectingResultSink()))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    // --- Helpers ---

    private RunSummary run(
            BindingTable table,
            AssayConfig config,
            List<TestUnitDescriptor> descriptors,
            ResultSink sink) {
        return new Scheduler(session(table, config, null)).run(descriptors, sink);
    }

    private ExecutionSession session(
            BindingTable table, AssayConfig config, RunCancellation cancellation) {
        var builder =
                ExecutionSession.builder()
                        .config(config)
                        .resolver(table)
                        .boundaryExecutor(boundaryExecutor);
        if (cancellation != null) {
            builder.runCancellation(cancellation.getHandle());
        }
        return builder.build();
    }

    private static BindingTable.Builder cleanupTable() {
        return BindingTable.builder()
                .type(
                        CleanA.class,
                        ClassBindings.builder(CleanA.class).classCleanup("tearDownClass").build())
                .type(
                        CleanB.class,
                        ClassBindings.builder(CleanB.class).classCleanup("tearDownClass").build())
                .module(
                        "m",
                        ModuleBindings.builder().cleanup(CleanA.class, "tearDownModule").build());
    }

    private static List<TestUnitDescriptor> cleanupDescriptors(BindingTable.Builder builder) {
        return List.of(
                builder.register("m", TestMethodDefinition.builder(CleanA.class, "one").build()),
                builder.register("m", TestMethodDefinition.builder(CleanA.class, "two").build()),
                builder.register("m", TestMethodDefinition.builder(CleanB.class, "one").build()));
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // --- Fixtures ---

    static class Shared {
        static void setUpClass() {
            Journal.record("class-init");
            pause(50);
        }

        void one() {
            body();
        }

        void two() {
            body();
        }

        void three() {
            body();
        }

        void four() {
            body();
        }

        void five() {
            body();
        }

        void six() {
            body();
        }

        private void body() {
            Journal.record("body");
            pause(10);
        }
    }

    static class OrderA {
        void one() {}

        void two() {}

        void fails() {
            throw new AssertionFailedException("expected open but was closed");
        }
    }

    static class OrderB {
        void one() {}
    }

    static class Mixed {
        static final AtomicInteger active = new AtomicInteger();
        static final AtomicBoolean overlapped = new AtomicBoolean();

        void parallelA() {
            parallel();
        }

        void parallelB() {
            parallel();
        }

        void serialA() {
            serial("serial-a");
        }

        void serialB() {
            serial("serial-b");
        }

        private void parallel() {
            active.incrementAndGet();
            Journal.record("parallel");
            pause(30);
            active.decrementAndGet();
        }

        private void serial(String event) {
            if (active.incrementAndGet() > 1) {
                overlapped.set(true);
            }
            Journal.record(event);
            pause(30);
            active.decrementAndGet();
        }
    }

    static class CleanA {
        static void tearDownClass() {
            Journal.record("a-class-cleanup");
        }

        static void tearDownModule() {
            Journal.record("module-cleanup");
        }

        void one() {
            Journal.record("a-body");
        }

        void two() {
            Journal.record("a-body");
        }
    }

    static class CleanB {
        static void tearDownClass() {
            Journal.record("b-class-cleanup");
        }

        void one() {
            Journal.record("b-body");
        }
    }

    static class NoisyCleanup {
        static void tearDownClass(CaseExecutionContext context) {
            context.writeLine("closing class");
            throw new IllegalStateException("socket already closed");
        }

        void one() {}

        void two() {}
    }

    static class Canceller {
        static volatile RunCancellation cancellation;

        void cancels() {
            Journal.record("cancel");
            cancellation.cancel();
        }

        void neverRuns() {
            Journal.record("ran");
        }
    }
}
