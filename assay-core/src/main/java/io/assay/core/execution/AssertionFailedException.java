package io.assay.core.execution;

import java.io.Serial;

/// Framework assertion failure signal.
///
/// A plain {@link AssertionError} is treated the same way.
public class AssertionFailedException extends RuntimeException {

    @Serial private static final long serialVersionUID = 8120437519863705642L;

    public AssertionFailedException(String message) {
        super(message);
    }

    public AssertionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
