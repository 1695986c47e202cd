package io.assay.core.descriptor;

/// Position a lifecycle method occupies around test execution.
public enum LifecycleRole {
    MODULE_INITIALIZE(Scope.MODULE, true),
    MODULE_CLEANUP(Scope.MODULE, false),
    CLASS_INITIALIZE(Scope.CLASS, true),
    CLASS_CLEANUP(Scope.CLASS, false),
    CASE_INITIALIZE(Scope.CASE, true),
    CASE_CLEANUP(Scope.CASE, false);

    /// Granularity at which a role runs.
    public enum Scope {
        MODULE,
        CLASS,
        CASE
    }

    private final Scope scope;
    private final boolean initialize;

    LifecycleRole(Scope scope, boolean initialize) {
        this.scope = scope;
        this.initialize = initialize;
    }

    public Scope getScope() {
        return scope;
    }

    public boolean isInitialize() {
        return initialize;
    }

    /// Returns whether methods in this role must be static.
    ///
    /// @return true for module and class roles
    public boolean requiresStatic() {
        return scope != Scope.CASE;
    }

    /// Returns a readable label such as `Class Initialization`.
    ///
    /// @return label used in failure messages, never null
    public String label() {
        String prefix =
                switch (scope) {
                    case MODULE -> "Module";
                    case CLASS -> "Class";
                    case CASE -> "Case";
                };
        return prefix + (initialize ? " Initialization" : " Cleanup");
    }
}
