package io.assay.core.execution;

import io.assay.core.lifecycle.ScopeFailure;
import io.assay.core.result.FailureDetail;
import io.assay.core.result.FailureKind;
import io.assay.core.result.Outcome;
import java.util.Objects;

/// Outcome of one pipeline step together with its failure, if any.
///
/// @param outcome outcome, not null
/// @param failure failure detail, null for a clean pass
public record Verdict(Outcome outcome, FailureDetail failure) {

    public static final Verdict PASSED = new Verdict(Outcome.PASSED, null);

    public Verdict {
        Objects.requireNonNull(outcome, "outcome");
    }

    public static Verdict failed(FailureKind kind, String message) {
        return new Verdict(Outcome.FAILED, FailureDetail.of(kind, message));
    }

    public static Verdict of(ScopeFailure failure) {
        return new Verdict(failure.outcome(), failure.detail());
    }
}
