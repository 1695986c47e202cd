package io.assay.core.output;

/// Text channels captured per case.
public enum OutputChannel {
    STANDARD_OUTPUT,
    DIAGNOSTIC_TRACE
}
