package io.assay.core.scheduler;

/// Phases a {@link Scheduler} moves through during one run, strictly in declaration order.
public enum SchedulerState {
    UNSCHEDULED,
    PARTITIONED,
    DISPATCHED,
    AGGREGATED
}
