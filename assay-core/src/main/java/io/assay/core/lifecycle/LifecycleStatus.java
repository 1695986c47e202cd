package io.assay.core.lifecycle;

/// Progress of a scope's initialize chain within one run.
public enum LifecycleStatus {
    NOT_RUN,
    RUNNING,
    DONE
}
