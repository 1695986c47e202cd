package io.assay.core.scheduler;

/// Granularity of a dispatch unit.
public enum ParallelScope {
    /// Every case is its own dispatch unit.
    METHOD,
    /// All cases of one class form a single dispatch unit, run in order on one worker.
    CLASS
}
