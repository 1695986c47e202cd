package io.assay.core.result;

import static org.assertj.core.api.Assertions.assertThat;

import io.assay.core.descriptor.TestUnitDescriptor;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("OutcomeRecord")
class OutcomeRecordTest {

    private static final TestUnitDescriptor DESCRIPTOR =
            TestUnitDescriptor.of("com.example.CartTest", "addsItem", "shop");

    @Test
    @DisplayName("copies identity, failure and row fields from the result")
    void shouldCopyResultFields() {
        CaseResult result =
                CaseResult.builder(DESCRIPTOR)
                        .outcome(Outcome.FAILED)
                        .failure(
                                new FailureDetail(
                                        FailureKind.ASSERTION_FAILURE,
                                        "expected 2",
                                        "trace",
                                        "java.lang.AssertionError",
                                        "CartTest.java",
                                        42))
                        .duration(Duration.ofMillis(15))
                        .rowIndex(3)
                        .displayName("addsItem (2)")
                        .addWarning("cleanup warning")
                        .addResultFile(Path.of("out", "cart.log"))
                        .build();

        OutcomeRecord record = result.toOutcomeRecord(true);

        assertThat(record.fullyQualifiedName()).isEqualTo("com.example.CartTest.addsItem");
        assertThat(record.moduleName()).isEqualTo("shop");
        assertThat(record.displayName()).isEqualTo("addsItem (2)");
        assertThat(record.rowIndex()).isEqualTo(3);
        assertThat(record.failureKind()).isEqualTo(FailureKind.ASSERTION_FAILURE);
        assertThat(record.errorFile()).isEqualTo("CartTest.java");
        assertThat(record.errorLine()).isEqualTo(42);
        assertThat(record.warnings()).containsExactly("cleanup warning");
        assertThat(record.resultFiles()).containsExactly(Path.of("out", "cart.log").toString());
        assertThat(record.endTime()).isEqualTo(record.startTime().plus(Duration.ofMillis(15)));
    }

    @Test
    @DisplayName("appends a delimited trace section when trace was captured")
    void shouldAppendTraceSection() {
        CaseResult result =
                CaseResult.builder(DESCRIPTOR)
                        .standardOutput("hello\n")
                        .diagnosticTrace("step 1\n")
                        .build();

        String nl = System.lineSeparator();
        assertThat(result.toOutcomeRecord(true).output())
                .isEqualTo("hello\n" + nl + "Diagnostic Trace:" + nl + "step 1\n");
        assertThat(result.toOutcomeRecord(false).output()).isEqualTo("hello\n");
    }

    @Test
    @DisplayName("leaves failure fields empty for a passing result")
    void shouldOmitFailureForPass() {
        OutcomeRecord record = CaseResult.builder(DESCRIPTOR).build().toOutcomeRecord(true);

        assertThat(record.outcome()).isEqualTo(Outcome.PASSED);
        assertThat(record.failureKind()).isNull();
        assertThat(record.errorMessage()).isNull();
        assertThat(record.output()).isEmpty();
        assertThat(record.displayName()).isEqualTo("addsItem");
    }
}
