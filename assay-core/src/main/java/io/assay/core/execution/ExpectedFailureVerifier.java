package io.assay.core.execution;

import io.assay.core.descriptor.ExpectedFailure;
import java.util.Optional;

/// Decides whether an exception satisfies a declared expected failure.
///
/// @see DefaultExpectedFailureVerifier
@FunctionalInterface
public interface ExpectedFailureVerifier {

    /// Checks `actual` against `expected`.
    ///
    /// @param expected the declared expectation, not null
    /// @param actual the exception the body threw, already unwrapped, not null
    /// @return empty when it matches, otherwise a message naming expected and actual
    Optional<String> verify(ExpectedFailure expected, Throwable actual);
}
