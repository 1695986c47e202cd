package io.assay.core.result;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// Result sink that keeps everything in memory.
///
/// @implNote Thread-safe. Returned lists are snapshots.
public final class CollectingResultSink implements ResultSink {

    private final List<CaseResult> results = Collections.synchronizedList(new ArrayList<>());
    private volatile RunSummary summary;

    @Override
    public void record(CaseResult result) {
        results.add(result);
    }

    @Override
    public void onRunCompleted(RunSummary summary) {
        this.summary = summary;
    }

    /// Returns the recorded results in delivery order.
    ///
    /// @return snapshot of the results, never null
    public List<CaseResult> getResults() {
        synchronized (results) {
            return List.copyOf(results);
        }
    }

    /// Returns the summary of the completed run.
    ///
    /// @return the summary, or null if the run has not completed
    public RunSummary getSummary() {
        return summary;
    }
}
