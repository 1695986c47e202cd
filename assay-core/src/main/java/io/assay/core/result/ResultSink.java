package io.assay.core.result;

/// Receives the results of a run.
///
/// ### Contracts
/// - {@link #record(CaseResult)} is called once per expanded case, after aggregation,
///   from the thread that called the engine
/// - {@link #onRunCompleted(RunSummary)} is called exactly once, after the last record
///
/// @see CollectingResultSink
@FunctionalInterface
public interface ResultSink {

    /// Records one case result.
    ///
    /// @param result the result, not null
    void record(CaseResult result);

    /// Called when the run has finished and every result has been recorded.
    ///
    /// @param summary summary of the run, not null
    default void onRunCompleted(RunSummary summary) {}
}
