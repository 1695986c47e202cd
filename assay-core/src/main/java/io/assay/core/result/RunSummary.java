package io.assay.core.result;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/// Summary of one engine run, handed to {@link ResultSink#onRunCompleted(RunSummary)}.
///
/// @param results all results in delivery order, not null
/// @param cancelled whether the run was cancelled before all units were dispatched
/// @param cleanupWarnings warnings from run-end class and module cleanups, not null
/// @param startTime run start, not null
/// @param endTime run end, not null
public record RunSummary(
        List<CaseResult> results,
        boolean cancelled,
        List<String> cleanupWarnings,
        Instant startTime,
        Instant endTime) {

    public RunSummary {
        results = List.copyOf(results);
        cleanupWarnings = List.copyOf(cleanupWarnings);
    }

    /// Returns how many results ended with each outcome.
    ///
    /// @return counts keyed by outcome, only outcomes that occurred are present
    public Map<Outcome, Integer> counts() {
        Map<Outcome, Integer> counts = new EnumMap<>(Outcome.class);
        for (CaseResult result : results) {
            counts.merge(result.getOutcome(), 1, Integer::sum);
        }
        return counts;
    }

    /// Returns the number of results with `outcome`.
    ///
    /// @param outcome the outcome to count, not null
    /// @return count, zero when absent
    public int count(Outcome outcome) {
        return counts().getOrDefault(outcome, 0);
    }

    /// Returns the most important outcome across all results.
    ///
    /// @return aggregate outcome, {@link Outcome#PASSED} for an empty run
    public Outcome aggregateOutcome() {
        Outcome aggregate = Outcome.PASSED;
        for (CaseResult result : results) {
            aggregate = aggregate.moreImportant(result.getOutcome());
        }
        return aggregate;
    }

    public Duration duration() {
        return Duration.between(startTime, endTime);
    }
}
