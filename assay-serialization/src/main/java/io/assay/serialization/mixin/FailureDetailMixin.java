package io.assay.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/// Jackson mixin for `FailureDetail`: `kind` and `message` first, location fields only
/// when the failure came from a throwable.
///
/// @see io.assay.serialization.AssayJacksonModule
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"kind", "message", "exceptionType", "file", "line", "stackTrace"})
public abstract class FailureDetailMixin {}
