package io.assay.core.expansion;

import io.assay.core.result.FailureKind;
import io.assay.core.result.Outcome;
import java.io.Serial;

/// Thrown when a descriptor cannot be expanded into argument sets.
///
/// Carries the outcome and failure kind reported for the descriptor in place of its
/// cases: a failing or empty data source, or a parameterized body without data.
public class DataExpansionException extends Exception {

    @Serial private static final long serialVersionUID = 8830127415396412276L;

    private final Outcome outcome;
    private final FailureKind kind;

    public DataExpansionException(Outcome outcome, FailureKind kind, String message) {
        super(message);
        this.outcome = outcome;
        this.kind = kind;
    }

    public DataExpansionException(
            Outcome outcome, FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.outcome = outcome;
        this.kind = kind;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public FailureKind getKind() {
        return kind;
    }
}
