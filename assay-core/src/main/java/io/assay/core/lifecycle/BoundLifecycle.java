package io.assay.core.lifecycle;

/// The module and class lifecycle states a case runs under.
///
/// @param module state of the case's module, not null
/// @param type state of the case's concrete class, not null
public record BoundLifecycle(ModuleLifecycleState module, ClassLifecycleState type) {}
