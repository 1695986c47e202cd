package io.assay.core.execution;

import io.assay.core.descriptor.ExpectedFailure;
import io.assay.core.descriptor.TestUnitDescriptor;
import io.assay.core.result.FailureDetail;
import io.assay.core.result.FailureKind;
import io.assay.core.result.Outcome;
import io.assay.core.result.StackTraces;
import java.util.Optional;

/// Maps how a case body ended to an outcome and failure detail.
///
/// ### Rules, in order
/// 1. The inconclusive signal is always {@link Outcome#INCONCLUSIVE}
/// 2. A cancellation is {@link Outcome#TIMED_OUT} with {@link FailureKind#CANCELLED}
/// 3. With an expected failure declared, a matching exception passes and anything else
///    fails naming expected and actual
/// 4. A framework assertion failure or an {@link AssertionError} is an assertion failure
/// 5. Anything else is an unrecognized exception
public final class ExceptionClassifier {

    private final ExpectedFailureVerifier verifier;

    public ExceptionClassifier(ExpectedFailureVerifier verifier) {
        this.verifier = verifier;
    }

    /// Classifies an exception thrown by a body.
    ///
    /// @param descriptor the case's descriptor, not null
    /// @param thrown the exception as caught, not null
    /// @param expected declared expected failure, may be null
    /// @return verdict, never null
    public Verdict classifyBodyFailure(
            TestUnitDescriptor descriptor, Throwable thrown, ExpectedFailure expected) {
        Throwable error = StackTraces.unwrap(thrown);
        String testClass = descriptor.className();

        if (error instanceof AssertionInconclusiveException) {
            return new Verdict(
                    Outcome.INCONCLUSIVE,
                    FailureDetail.of(
                            FailureKind.ASSERTION_INCONCLUSIVE,
                            "Case is inconclusive. " + nullToEmpty(error.getMessage()),
                            error,
                            testClass));
        }
        if (error instanceof CaseCancelledException) {
            return new Verdict(
                    Outcome.TIMED_OUT,
                    FailureDetail.of(
                            FailureKind.CANCELLED,
                            "Test '" + descriptor.fullyQualifiedName() + "' was canceled",
                            error,
                            testClass));
        }
        if (expected != null) {
            Optional<String> mismatch = verifier.verify(expected, error);
            if (mismatch.isEmpty()) {
                return Verdict.PASSED;
            }
            if (!isAssertionFailure(error)) {
                return new Verdict(
                        Outcome.FAILED,
                        FailureDetail.of(
                                FailureKind.EXPECTED_FAILURE_MISMATCH,
                                "Test method "
                                        + descriptor.fullyQualifiedName()
                                        + " threw an unexpected exception. "
                                        + mismatch.get(),
                                error,
                                testClass));
            }
        }
        if (isAssertionFailure(error)) {
            return new Verdict(
                    Outcome.FAILED,
                    FailureDetail.of(
                            FailureKind.ASSERTION_FAILURE,
                            error.getMessage() != null
                                    ? error.getMessage()
                                    : error.getClass().getName(),
                            error,
                            testClass));
        }
        return new Verdict(
                Outcome.FAILED,
                FailureDetail.of(
                        FailureKind.UNRECOGNIZED_EXCEPTION,
                        "Test method "
                                + descriptor.fullyQualifiedName()
                                + " threw exception: "
                                + StackTraces.formatMessage(error),
                        error,
                        testClass));
    }

    /// Classifies a body that completed without throwing.
    ///
    /// @param descriptor the case's descriptor, not null
    /// @param expected declared expected failure, may be null
    /// @param reported outcome set through the context, may be null
    /// @return verdict, never null
    public Verdict classifyCompletion(
            TestUnitDescriptor descriptor, ExpectedFailure expected, Outcome reported) {
        if (expected != null) {
            return Verdict.failed(
                    FailureKind.EXPECTED_FAILURE_MISSING,
                    "Test method "
                            + descriptor.fullyQualifiedName()
                            + " did not throw expected exception "
                            + expected.type().getName()
                            + ".");
        }
        if (reported != null && reported != Outcome.PASSED) {
            return new Verdict(reported, null);
        }
        return Verdict.PASSED;
    }

    /// Classifies an exception thrown by a case initialize method.
    ///
    /// @param descriptor the case's descriptor, not null
    /// @param message failure message naming the method, not null
    /// @param thrown the exception as caught, not null
    /// @return verdict, never null
    public Verdict classifyCaseInitializeFailure(
            TestUnitDescriptor descriptor, String message, Throwable thrown) {
        Throwable error = StackTraces.unwrap(thrown);
        if (error instanceof CaseCancelledException) {
            return classifyBodyFailure(descriptor, error, null);
        }
        Outcome outcome =
                error instanceof AssertionInconclusiveException
                        ? Outcome.INCONCLUSIVE
                        : Outcome.FAILED;
        return new Verdict(
                outcome,
                FailureDetail.of(
                        FailureKind.CASE_INITIALIZE_FAILURE,
                        message,
                        error,
                        descriptor.className()));
    }

    private static boolean isAssertionFailure(Throwable error) {
        return error instanceof AssertionFailedException || error instanceof AssertionError;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
