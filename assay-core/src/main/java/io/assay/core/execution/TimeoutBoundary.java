package io.assay.core.execution;

import io.assay.core.output.OutputMultiplexer;
import io.assay.core.output.OutputScope;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/// Races a unit of work against a deadline on a separate thread.
///
/// ### Contracts
/// - Without a deadline the work runs inline on the calling thread
/// - On expiry the case's cancellation handle is cancelled, {@link ForcedAbort} is asked
///   to stop the work, and the caller waits at most the grace period for it to exit
/// - The caller never waits longer than deadline plus grace period
///
/// @implNote The boundary thread binds the case's output scope, so text routed
/// through the multiplexer's thread-bound streams reaches the right case.
public final class TimeoutBoundary {

    private static final Logger logger = Logger.getLogger(TimeoutBoundary.class.getName());

    private final ExecutorService executor;
    private final ForcedAbort forcedAbort;
    private final Duration gracePeriod;
    private final OutputMultiplexer multiplexer;

    /// Creates a boundary.
    ///
    /// @param executor pool supplying boundary threads, not null
    /// @param forcedAbort fallback for cases ignoring cancellation, not null
    /// @param gracePeriod how long to wait for an aborted case to exit, not null
    /// @param multiplexer output multiplexer of the run, not null
    public TimeoutBoundary(
            ExecutorService executor,
            ForcedAbort forcedAbort,
            Duration gracePeriod,
            OutputMultiplexer multiplexer) {
        this.executor = executor;
        this.forcedAbort = forcedAbort;
        this.gracePeriod = gracePeriod;
        this.multiplexer = multiplexer;
    }

    /// Runs `work` within `timeout`.
    ///
    /// @param work work to run, not null
    /// @param timeout deadline, null or zero for none
    /// @param cancellation the case's cancellation handle, not null
    /// @param scope output scope to bind on the boundary thread, may be null
    /// @return how the work ended, never null
    public Completion run(
            Work work, Duration timeout, CancellationHandle cancellation, OutputScope scope) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return runInline(work);
        }

        CountDownLatch exited = new CountDownLatch(1);
        Future<?> future;
        try {
            future =
                    executor.submit(
                            () -> {
                                try (OutputMultiplexer.Binding ignored = multiplexer.bind(scope)) {
                                    work.run();
                                    return null;
                                } catch (Exception | Error e) {
                                    throw e;
                                } catch (Throwable t) {
                                    throw new ExecutionException(t);
                                } finally {
                                    exited.countDown();
                                }
                            });
        } catch (RejectedExecutionException e) {
            logger.warning("Timeout boundary unavailable, running inline: " + e.getMessage());
            return runInline(work);
        }

        try {
            future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return Completion.COMPLETED;
        } catch (ExecutionException e) {
            return Completion.threw(e.getCause() != null ? e.getCause() : e);
        } catch (TimeoutException e) {
            cancellation.cancel();
            forcedAbort.abort(future);
            boolean exitedInTime = awaitExit(exited);
            if (!exitedInTime) {
                logger.warning(
                        "Timed-out work did not exit within "
                                + gracePeriod.toMillis()
                                + " ms and was abandoned");
            }
            return Completion.timedOut(timeout, !exitedInTime);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellation.cancel();
            forcedAbort.abort(future);
            return Completion.threw(
                    new CaseCancelledException("Interrupted while waiting for the case"));
        }
    }

    private Completion runInline(Work work) {
        try {
            work.run();
            return Completion.COMPLETED;
        } catch (Throwable t) {
            return Completion.threw(t);
        }
    }

    private boolean awaitExit(CountDownLatch exited) {
        try {
            return exited.await(gracePeriod.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /// Work run inside the boundary.
    @FunctionalInterface
    public interface Work {
        void run() throws Throwable;
    }

    /// How work run inside a boundary ended.
    ///
    /// @param error throwable raised by the work, null unless it threw
    /// @param timeout deadline that expired, null unless it timed out
    /// @param abandoned whether timed-out work was still running when the boundary gave up
    public record Completion(Throwable error, Duration timeout, boolean abandoned) {

        static final Completion COMPLETED = new Completion(null, null, false);

        static Completion threw(Throwable error) {
            return new Completion(error, null, false);
        }

        static Completion timedOut(Duration timeout, boolean abandoned) {
            return new Completion(null, timeout, abandoned);
        }

        public boolean isTimedOut() {
            return timeout != null;
        }

        public boolean isCompleted() {
            return error == null && timeout == null;
        }
    }
}
