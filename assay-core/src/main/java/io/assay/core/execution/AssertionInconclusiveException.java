package io.assay.core.execution;

import java.io.Serial;

/// Signals that a case could not reach a verdict.
///
/// Always reported as {@link io.assay.core.result.Outcome#INCONCLUSIVE}, including when
/// thrown from an initialize method or when the case declares an expected failure.
public class AssertionInconclusiveException extends RuntimeException {

    @Serial private static final long serialVersionUID = 5403722136420996617L;

    public AssertionInconclusiveException(String message) {
        super(message);
    }
}
