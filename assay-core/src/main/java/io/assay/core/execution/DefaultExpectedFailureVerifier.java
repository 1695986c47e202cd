package io.assay.core.execution;

import io.assay.core.descriptor.ExpectedFailure;
import java.util.Optional;

/// Matches by exact type, or by assignability when derived types are allowed, then
/// checks the optional message fragment.
public final class DefaultExpectedFailureVerifier implements ExpectedFailureVerifier {

    @Override
    public Optional<String> verify(ExpectedFailure expected, Throwable actual) {
        boolean typeMatches =
                expected.allowDerivedTypes()
                        ? expected.type().isInstance(actual)
                        : expected.type() == actual.getClass();
        if (!typeMatches) {
            return Optional.of(
                    "Exception "
                            + actual.getClass().getName()
                            + " was thrown, but "
                            + (expected.allowDerivedTypes() ? "a subtype of " : "")
                            + expected.type().getName()
                            + " was expected. Exception message: "
                            + actual.getMessage());
        }
        String fragment = expected.messageContains();
        if (fragment != null) {
            String message = actual.getMessage();
            if (message == null || !message.contains(fragment)) {
                return Optional.of(
                        "Exception "
                                + actual.getClass().getName()
                                + " was thrown with message '"
                                + message
                                + "', but a message containing '"
                                + fragment
                                + "' was expected");
            }
        }
        return Optional.empty();
    }
}
