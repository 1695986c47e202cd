package io.assay.core.scheduler;

import io.assay.core.execution.CancellationHandle;

/// Caller-side handle for cancelling a run in progress.
///
/// Cancelling stops the dispatch of cases that have not started, which are reported as
/// ignored, and requests cooperative cancellation of the cases in flight. Cleanup still
/// runs for every scope that was initialized.
///
/// {@snippet :
/// RunCancellation cancellation = new RunCancellation();
/// executor.submit(() -> engine.execute(descriptors, config, sink, cancellation));
/// cancellation.cancel();
/// }
public final class RunCancellation {

    private final CancellationHandle handle = CancellationHandle.create();

    public void cancel() {
        handle.cancel();
    }

    public boolean isCancelled() {
        return handle.isCancellationRequested();
    }

    /// Returns the run-wide handle case handles are derived from.
    ///
    /// @return cancellation handle, never null
    public CancellationHandle getHandle() {
        return handle;
    }
}
