package io.assay.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/// Jackson mixin fixing the field order of serialized `OutcomeRecord`s and dropping
/// absent failure fields.
///
/// Applied to `OutcomeRecord.class` via `AssayJacksonModule.setupModule()`. Deserialization
/// goes through the record's canonical constructor, which restores empty output and
/// empty lists for omitted fields.
///
/// @see io.assay.serialization.AssayJacksonModule
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
    "displayName",
    "fullyQualifiedName",
    "moduleName",
    "outcome",
    "duration",
    "startTime",
    "endTime",
    "rowIndex",
    "failureKind",
    "errorMessage",
    "errorStackTrace",
    "errorFile",
    "errorLine",
    "output",
    "warnings",
    "resultFiles"
})
public abstract class OutcomeRecordMixin {}
