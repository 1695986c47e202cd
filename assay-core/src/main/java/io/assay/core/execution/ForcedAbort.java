package io.assay.core.execution;

import java.util.concurrent.Future;

/// Best-effort stop of a case that ignored its cancellation request.
///
/// Cooperative cancellation through {@link CancellationHandle} always comes first;
/// a forced abort is only attempted after a timeout expired.
@FunctionalInterface
public interface ForcedAbort {

    /// Interrupts the thread running the case.
    ForcedAbort INTERRUPT = inFlight -> inFlight.cancel(true);

    /// Leaves the case running; the boundary abandons it after the grace period.
    ForcedAbort UNSUPPORTED = inFlight -> {};

    /// Attempts to stop `inFlight`.
    ///
    /// @param inFlight the running case, not null
    void abort(Future<?> inFlight);
}
