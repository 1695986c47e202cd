package io.assay.core.execution;

import static org.assertj.core.api.Assertions.assertThat;

import io.assay.core.output.OutputMultiplexer;
import io.assay.core.output.OutputScope;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TimeoutBoundary")
class TimeoutBoundaryTest {

    private final OutputMultiplexer multiplexer = new OutputMultiplexer();
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("runs inline on the calling thread without a deadline")
    void shouldRunInlineWithoutTimeout() {
        var boundary = boundary(ForcedAbort.INTERRUPT, Duration.ofSeconds(1));
        AtomicReference<Thread> ranOn = new AtomicReference<>();

        var completion =
                boundary.run(
                        () -> ranOn.set(Thread.currentThread()),
                        Duration.ZERO,
                        CancellationHandle.create(),
                        null);

        assertThat(completion.isCompleted()).isTrue();
        assertThat(ranOn.get()).isSameAs(Thread.currentThread());
    }

    @Test
    @DisplayName("reports what the work threw")
    void shouldReportThrowable() {
        var boundary = boundary(ForcedAbort.INTERRUPT, Duration.ofSeconds(1));

        var completion =
                boundary.run(
                        () -> {
                            throw new IllegalStateException("broken");
                        },
                        Duration.ofSeconds(5),
                        CancellationHandle.create(),
                        null);

        assertThat(completion.error()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("cancels cooperative work on expiry and sees it exit")
    void shouldCancelCooperativeWork() {
        var boundary = boundary(ForcedAbort.UNSUPPORTED, Duration.ofSeconds(2));
        CancellationHandle cancellation = CancellationHandle.create();

        var completion =
                boundary.run(
                        () -> {
                            while (!cancellation.isCancellationRequested()) {
                                Thread.onSpinWait();
                            }
                        },
                        Duration.ofMillis(50),
                        cancellation,
                        null);

        assertThat(completion.isTimedOut()).isTrue();
        assertThat(completion.abandoned()).isFalse();
        assertThat(cancellation.isCancellationRequested()).isTrue();
    }

    @Test
    @DisplayName("abandons work that ignores cancellation after the grace period")
    void shouldAbandonStubbornWork() {
        var boundary = boundary(ForcedAbort.UNSUPPORTED, Duration.ofMillis(100));
        CountDownLatch release = new CountDownLatch(1);
        long started = System.nanoTime();

        try {
            var completion =
                    boundary.run(
                            () -> release.await(10, TimeUnit.SECONDS),
                            Duration.ofMillis(50),
                            CancellationHandle.create(),
                            null);

            assertThat(completion.isTimedOut()).isTrue();
            assertThat(completion.abandoned()).isTrue();
            assertThat(Duration.ofNanos(System.nanoTime() - started))
                    .isLessThan(Duration.ofSeconds(5));
        } finally {
            release.countDown();
        }
    }

    @Test
    @DisplayName("binds the output scope on the boundary thread")
    void shouldBindScopeOnBoundaryThread() {
        var boundary = boundary(ForcedAbort.INTERRUPT, Duration.ofSeconds(1));
        OutputScope scope = multiplexer.openScope();

        boundary.run(
                () -> multiplexer.write(multiplexer.currentScope(), "inside\n"),
                Duration.ofSeconds(5),
                CancellationHandle.create(),
                scope);

        assertThat(multiplexer.closeScope(scope).standardOutput()).isEqualTo("inside\n");
    }

    private TimeoutBoundary boundary(ForcedAbort forcedAbort, Duration grace) {
        return new TimeoutBoundary(executor, forcedAbort, grace, multiplexer);
    }
}
