package io.assay.core;

/// When a class's cleanup chain runs.
public enum ClassCleanupBehavior {
    /// Right after the last scheduled case of the class finished.
    END_OF_CLASS,
    /// At the end of the run, before module cleanup.
    END_OF_MODULE
}
