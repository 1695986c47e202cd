package io.assay.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import io.assay.core.descriptor.TestUnitDescriptor;
import io.assay.core.result.CaseResult;
import io.assay.core.result.FailureDetail;
import io.assay.core.result.FailureKind;
import io.assay.core.result.Outcome;
import io.assay.core.result.OutcomeRecord;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class OutcomeRecordSerializerTest {

    private static final Instant START = Instant.parse("2026-03-02T09:15:00Z");

    @Test
    void toJson_passedCaseOmitsFailureFields() throws Exception {
        OutcomeRecord record = passedResult().toOutcomeRecord(false);

        JsonNode json = readTree(OutcomeRecordSerializer.toJson(record));

        assertThat(json.get("outcome").asText()).isEqualTo("PASSED");
        assertThat(json.get("fullyQualifiedName").asText())
                .isEqualTo("com.acme.OrderTest.placesOrder");
        assertThat(json.has("failureKind")).isFalse();
        assertThat(json.has("errorMessage")).isFalse();
        assertThat(json.has("rowIndex")).isFalse();
    }

    @Test
    void toJson_writesIsoDurationsAndTimestamps() throws Exception {
        OutcomeRecord record = passedResult().toOutcomeRecord(false);

        JsonNode json = readTree(OutcomeRecordSerializer.toJson(record));

        assertThat(json.get("duration").asText()).isEqualTo("PT1.5S");
        assertThat(json.get("startTime").asText()).isEqualTo("2026-03-02T09:15:00Z");
        assertThat(json.get("endTime").asText()).isEqualTo("2026-03-02T09:15:01.500Z");
    }

    @Test
    void toJson_keepsDeclaredPropertyOrder() {
        String json = OutcomeRecordSerializer.toJson(failedResult().toOutcomeRecord(false));

        assertThat(json.indexOf("\"displayName\""))
                .isLessThan(json.indexOf("\"outcome\""));
        assertThat(json.indexOf("\"outcome\""))
                .isLessThan(json.indexOf("\"failureKind\""));
        assertThat(json.indexOf("\"errorLine\"")).isLessThan(json.indexOf("\"output\""));
    }

    @Test
    void roundTrip_failedCase() {
        OutcomeRecord original = failedResult().toOutcomeRecord(true);

        OutcomeRecord restored =
                OutcomeRecordSerializer.fromJson(OutcomeRecordSerializer.toJson(original));

        assertThat(restored).isEqualTo(original);
        assertThat(restored.failureKind()).isEqualTo(FailureKind.ASSERTION_FAILURE);
        assertThat(restored.errorFile()).isEqualTo("OrderTest.java");
        assertThat(restored.errorLine()).isEqualTo(42);
        assertThat(restored.rowIndex()).isEqualTo(3);
        assertThat(restored.warnings()).containsExactly("cleanup was slow");
        assertThat(restored.resultFiles()).containsExactly(Path.of("out", "order.png").toString());
    }

    @Test
    void fromJson_restoresDefaultsForOmittedCollections() {
        String json =
                "{\"displayName\":\"placesOrder\","
                        + "\"fullyQualifiedName\":\"com.acme.OrderTest.placesOrder\","
                        + "\"moduleName\":\"orders\",\"outcome\":\"IGNORED\","
                        + "\"duration\":\"PT0S\",\"startTime\":\"2026-03-02T09:15:00Z\","
                        + "\"endTime\":\"2026-03-02T09:15:00Z\"}";

        OutcomeRecord restored = OutcomeRecordSerializer.fromJson(json);

        assertThat(restored.outcome()).isEqualTo(Outcome.IGNORED);
        assertThat(restored.output()).isEmpty();
        assertThat(restored.warnings()).isEmpty();
        assertThat(restored.resultFiles()).isEmpty();
    }

    @Test
    void fromJson_ignoresUnknownProperties() {
        String json =
                "{\"displayName\":\"placesOrder\",\"outcome\":\"PASSED\","
                        + "\"agent\":\"build-42\"}";

        OutcomeRecord restored = OutcomeRecordSerializer.fromJson(json);

        assertThat(restored.displayName()).isEqualTo("placesOrder");
        assertThat(restored.outcome()).isEqualTo(Outcome.PASSED);
    }

    @Test
    void fromJson_rejectsMalformedInput() {
        assertThatThrownBy(() -> OutcomeRecordSerializer.fromJson("{\"outcome\":"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Failed to deserialize outcome record");
    }

    @Test
    void toJson_embedsTraceSectionWhenCaptured() {
        CaseResult result =
                passedResult().toBuilder()
                        .standardOutput("placing order\n")
                        .diagnosticTrace("db connected\n")
                        .build();

        OutcomeRecord withTrace =
                OutcomeRecordSerializer.fromJson(
                        OutcomeRecordSerializer.toJson(result.toOutcomeRecord(true)));
        OutcomeRecord withoutTrace =
                OutcomeRecordSerializer.fromJson(
                        OutcomeRecordSerializer.toJson(result.toOutcomeRecord(false)));

        assertThat(withTrace.output())
                .startsWith("placing order")
                .contains("Diagnostic Trace:")
                .endsWith("db connected\n");
        assertThat(withoutTrace.output()).isEqualTo("placing order\n");
    }

    // --- Helpers ---

    private static JsonNode readTree(String json) throws Exception {
        return OutcomeRecordSerializer.createMapper().readTree(json);
    }

    private static TestUnitDescriptor descriptor() {
        return TestUnitDescriptor.of("com.acme.OrderTest", "placesOrder", "orders");
    }

    private static CaseResult passedResult() {
        return CaseResult.builder(descriptor())
                .outcome(Outcome.PASSED)
                .startTime(START)
                .duration(Duration.ofMillis(1500))
                .build();
    }

    private static CaseResult failedResult() {
        List<String> warnings = new ArrayList<>();
        warnings.add("cleanup was slow");
        return CaseResult.builder(descriptor())
                .outcome(Outcome.FAILED)
                .failure(
                        new FailureDetail(
                                FailureKind.ASSERTION_FAILURE,
                                "expected 3 items but was 2",
                                "at com.acme.OrderTest.placesOrder(OrderTest.java:42)",
                                "io.assay.core.execution.AssertionFailedException",
                                "OrderTest.java",
                                42))
                .addWarnings(warnings)
                .startTime(START)
                .duration(Duration.ofMillis(20))
                .standardOutput("placing order\n")
                .addResultFile(Path.of("out", "order.png"))
                .rowIndex(3)
                .displayName("placesOrder (3)")
                .build();
    }
}
