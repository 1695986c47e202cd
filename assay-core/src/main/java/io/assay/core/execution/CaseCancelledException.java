package io.assay.core.execution;

import java.io.Serial;

/// Thrown by test code that observes a cancellation request.
///
/// @see CancellationHandle#throwIfCancellationRequested()
public class CaseCancelledException extends RuntimeException {

    @Serial private static final long serialVersionUID = -2297513306150671840L;

    public CaseCancelledException(String message) {
        super(message);
    }
}
