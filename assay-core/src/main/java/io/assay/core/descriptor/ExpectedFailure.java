package io.assay.core.descriptor;

import java.util.Objects;

/// Declares that a test body is expected to throw.
///
/// @param type expected throwable type, not null
/// @param allowDerivedTypes whether subclasses of `type` also match
/// @param messageContains text the exception message must contain, null to skip the check
public record ExpectedFailure(
        Class<? extends Throwable> type, boolean allowDerivedTypes, String messageContains) {

    public ExpectedFailure {
        Objects.requireNonNull(type, "type");
    }

    /// Expects exactly `type`.
    ///
    /// @param type expected type, not null
    /// @return new policy, never null
    public static ExpectedFailure of(Class<? extends Throwable> type) {
        return new ExpectedFailure(type, false, null);
    }

    /// Expects `type` or any subclass of it.
    ///
    /// @param type expected base type, not null
    /// @return new policy, never null
    public static ExpectedFailure derivedFrom(Class<? extends Throwable> type) {
        return new ExpectedFailure(type, true, null);
    }

    /// Returns a copy that also requires the message to contain `text`.
    ///
    /// @param text required message fragment, not null
    /// @return new policy, never null
    public ExpectedFailure withMessageContaining(String text) {
        return new ExpectedFailure(type, allowDerivedTypes, text);
    }
}
