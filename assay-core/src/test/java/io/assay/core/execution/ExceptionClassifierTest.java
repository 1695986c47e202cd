package io.assay.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.assay.core.descriptor.ExpectedFailure;
import io.assay.core.descriptor.TestUnitDescriptor;
import io.assay.core.result.FailureKind;
import io.assay.core.result.Outcome;
import java.lang.reflect.InvocationTargetException;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("ExceptionClassifier")
@ExtendWith(MockitoExtension.class)
class ExceptionClassifierTest {

    private static final TestUnitDescriptor DESCRIPTOR =
            TestUnitDescriptor.of("com.example.OrderTest", "placesOrder", "orders");

    @Mock private ExpectedFailureVerifier verifier;

    private ExceptionClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new ExceptionClassifier(verifier);
    }

    @Nested
    @DisplayName("classifyBodyFailure")
    class ClassifyBodyFailure {

        @Test
        @DisplayName("reports the inconclusive signal even when a failure is expected")
        void shouldPreferInconclusive() {
            var expected = ExpectedFailure.of(IllegalStateException.class);

            var verdict =
                    classifier.classifyBodyFailure(
                            DESCRIPTOR, new AssertionInconclusiveException("later"), expected);

            assertThat(verdict.outcome()).isEqualTo(Outcome.INCONCLUSIVE);
            assertThat(verdict.failure().kind()).isEqualTo(FailureKind.ASSERTION_INCONCLUSIVE);
            verifyNoInteractions(verifier);
        }

        @Test
        @DisplayName("reports cancellation as timed out")
        void shouldReportCancellation() {
            var verdict =
                    classifier.classifyBodyFailure(
                            DESCRIPTOR, new CaseCancelledException("stop"), null);

            assertThat(verdict.outcome()).isEqualTo(Outcome.TIMED_OUT);
            assertThat(verdict.failure().kind()).isEqualTo(FailureKind.CANCELLED);
        }

        @Test
        @DisplayName("unwraps reflection wrappers before classifying")
        void shouldUnwrapReflectionWrappers() {
            var wrapped = new InvocationTargetException(new AssertionFailedException("1 != 2"));

            var verdict = classifier.classifyBodyFailure(DESCRIPTOR, wrapped, null);

            assertThat(verdict.failure().kind()).isEqualTo(FailureKind.ASSERTION_FAILURE);
            assertThat(verdict.failure().message()).isEqualTo("1 != 2");
            assertThat(verdict.failure().exceptionType())
                    .isEqualTo(AssertionFailedException.class.getName());
        }

        @Test
        @DisplayName("treats AssertionError as an assertion failure")
        void shouldTreatAssertionErrorAsAssertionFailure() {
            var verdict =
                    classifier.classifyBodyFailure(DESCRIPTOR, new AssertionError("nope"), null);

            assertThat(verdict.outcome()).isEqualTo(Outcome.FAILED);
            assertThat(verdict.failure().kind()).isEqualTo(FailureKind.ASSERTION_FAILURE);
        }

        @Test
        @DisplayName("passes when the verifier accepts the exception")
        void shouldPassOnVerifiedException() {
            var expected = ExpectedFailure.of(IllegalStateException.class);
            var thrown = new IllegalStateException("closed");
            when(verifier.verify(expected, thrown)).thenReturn(Optional.empty());

            var verdict = classifier.classifyBodyFailure(DESCRIPTOR, thrown, expected);

            assertThat(verdict).isEqualTo(Verdict.PASSED);
        }

        @Test
        @DisplayName("reports a mismatch with the verifier's explanation")
        void shouldReportMismatch() {
            var expected = ExpectedFailure.of(IllegalStateException.class);
            when(verifier.verify(eq(expected), any())).thenReturn(Optional.of("wrong type"));

            var verdict =
                    classifier.classifyBodyFailure(
                            DESCRIPTOR, new IllegalArgumentException("bad"), expected);

            assertThat(verdict.outcome()).isEqualTo(Outcome.FAILED);
            assertThat(verdict.failure().kind()).isEqualTo(FailureKind.EXPECTED_FAILURE_MISMATCH);
            assertThat(verdict.failure().message())
                    .isEqualTo(
                            "Test method com.example.OrderTest.placesOrder threw an unexpected "
                                    + "exception. wrong type");
        }

        @Test
        @DisplayName("keeps an assertion failure as such when it does not match the expectation")
        void shouldKeepAssertionFailureOnMismatch() {
            var expected = ExpectedFailure.of(IllegalStateException.class);
            when(verifier.verify(eq(expected), any())).thenReturn(Optional.of("wrong type"));

            var verdict =
                    classifier.classifyBodyFailure(
                            DESCRIPTOR, new AssertionFailedException("1 != 2"), expected);

            assertThat(verdict.failure().kind()).isEqualTo(FailureKind.ASSERTION_FAILURE);
        }

        @Test
        @DisplayName("quotes type and message of an unrecognized exception")
        void shouldDescribeUnrecognizedException() {
            var verdict =
                    classifier.classifyBodyFailure(
                            DESCRIPTOR, new IllegalStateException("pool closed"), null);

            assertThat(verdict.failure().kind()).isEqualTo(FailureKind.UNRECOGNIZED_EXCEPTION);
            assertThat(verdict.failure().message())
                    .isEqualTo(
                            "Test method com.example.OrderTest.placesOrder threw exception: "
                                    + "java.lang.IllegalStateException: pool closed");
        }
    }

    @Nested
    @DisplayName("classifyCompletion")
    class ClassifyCompletion {

        @Test
        @DisplayName("fails a normal completion when an exception was expected")
        void shouldFailMissingExpectedException() {
            var verdict =
                    classifier.classifyCompletion(
                            DESCRIPTOR, ExpectedFailure.of(IllegalStateException.class), null);

            assertThat(verdict.failure().kind()).isEqualTo(FailureKind.EXPECTED_FAILURE_MISSING);
        }

        @Test
        @DisplayName("uses an outcome reported through the context")
        void shouldUseReportedOutcome() {
            var verdict = classifier.classifyCompletion(DESCRIPTOR, null, Outcome.INCONCLUSIVE);

            assertThat(verdict.outcome()).isEqualTo(Outcome.INCONCLUSIVE);
            assertThat(verdict.failure()).isNull();
        }

        @Test
        @DisplayName("passes otherwise")
        void shouldPass() {
            assertThat(classifier.classifyCompletion(DESCRIPTOR, null, null))
                    .isEqualTo(Verdict.PASSED);
        }
    }

    @Nested
    @DisplayName("classifyCaseInitializeFailure")
    class ClassifyCaseInitializeFailure {

        @Test
        @DisplayName("keeps inconclusive initialization inconclusive")
        void shouldKeepInconclusive() {
            var verdict =
                    classifier.classifyCaseInitializeFailure(
                            DESCRIPTOR, "setUp failed", new AssertionInconclusiveException("skip"));

            assertThat(verdict.outcome()).isEqualTo(Outcome.INCONCLUSIVE);
            assertThat(verdict.failure().kind()).isEqualTo(FailureKind.CASE_INITIALIZE_FAILURE);
            assertThat(verdict.failure().message()).isEqualTo("setUp failed");
        }
    }
}
