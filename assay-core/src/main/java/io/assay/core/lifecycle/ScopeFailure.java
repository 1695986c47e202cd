package io.assay.core.lifecycle;

import io.assay.core.result.FailureDetail;
import io.assay.core.result.Outcome;
import java.util.Objects;

/// Terminal failure of a module or class initialize chain, reapplied to every
/// case of the scope.
///
/// @param outcome {@link Outcome#FAILED} or {@link Outcome#INCONCLUSIVE}, not null
/// @param detail failure detail, not null
public record ScopeFailure(Outcome outcome, FailureDetail detail) {

    public ScopeFailure {
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(detail, "detail");
    }
}
