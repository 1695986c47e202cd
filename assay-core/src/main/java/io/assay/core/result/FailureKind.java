package io.assay.core.result;

/// Classification of the condition that produced a non-passing {@link CaseResult}.
///
/// Every kind is caught where it originates and reported as a result field;
/// none of them escapes the invocation pipeline.
public enum FailureKind {
    CONSTRUCTION_FAILURE,
    CONTEXT_BINDING_FAILURE,
    MODULE_INITIALIZE_FAILURE,
    CLASS_INITIALIZE_FAILURE,
    CASE_INITIALIZE_FAILURE,
    ASSERTION_FAILURE,
    ASSERTION_INCONCLUSIVE,
    UNRECOGNIZED_EXCEPTION,
    TIMEOUT,
    CANCELLED,
    EXPECTED_FAILURE_MISMATCH,
    EXPECTED_FAILURE_MISSING,
    CLEANUP_FAILURE,
    DESCRIPTOR_NOT_FOUND,
    DESCRIPTOR_NOT_RUNNABLE,
    ARGUMENT_MISMATCH,
    DATA_SOURCE_FAILURE,
    INSPECTION_FAILURE,
    RUN_CANCELLED,
    IGNORED
}
