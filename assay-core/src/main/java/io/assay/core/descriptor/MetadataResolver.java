package io.assay.core.descriptor;

import java.util.Optional;

/// Supplies already-resolved bindings for test descriptors.
///
/// The engine never inspects annotations or other markers itself; everything it
/// knows about a test class comes through this interface.
///
/// ### Contracts
/// - Implementations must be safe for concurrent calls from scheduler workers
/// - Repeated calls with equal arguments return equal answers for the duration of a run
///
/// @see BindingTable for the in-memory implementation
public interface MetadataResolver {

    /// Resolves the class declaring `descriptor`.
    ///
    /// @param descriptor the test descriptor, not null
    /// @return the loaded class, or empty if it cannot be found
    Optional<Class<?>> resolveType(TestUnitDescriptor descriptor);

    /// Resolves the method binding of `descriptor`.
    ///
    /// @param descriptor the test descriptor, not null
    /// @return the definition, or empty if the method cannot be found
    Optional<TestMethodDefinition> resolveMethod(TestUnitDescriptor descriptor);

    /// Returns the lifecycle bindings `type` declares itself, excluding inherited ones.
    ///
    /// @param type a test class or one of its ancestors, not null
    /// @return own bindings, {@link ClassBindings#NONE} when there are none
    ClassBindings resolveClass(Class<?> type);

    /// Returns the module-level bindings of `moduleName`.
    ///
    /// @param moduleName module name, not null
    /// @return module bindings, {@link ModuleBindings#NONE} when there are none
    ModuleBindings resolveModule(String moduleName);
}
