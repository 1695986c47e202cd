package io.assay.core.descriptor;

import java.util.Objects;

/// Identifies one declared test method.
///
/// Produced by a {@link MetadataResolver} and treated as read-only by the engine. All
/// other knowledge about the method (its body, timeout, data rows, lifecycle bindings)
/// is looked up through the resolver using this descriptor as the key.
///
/// @param className fully qualified name of the declaring test class, not null
/// @param methodName name of the test method, not null
/// @param moduleName name of the module (loaded unit) owning the class, not null
/// @param async whether the body completes through a returned `CompletionStage` or `Future`
public record TestUnitDescriptor(
        String className, String methodName, String moduleName, boolean async) {

    public TestUnitDescriptor {
        Objects.requireNonNull(className, "className");
        Objects.requireNonNull(methodName, "methodName");
        Objects.requireNonNull(moduleName, "moduleName");
    }

    /// Creates a descriptor for a synchronous test method.
    ///
    /// @param className declaring class name, not null
    /// @param methodName method name, not null
    /// @param moduleName owning module name, not null
    /// @return new descriptor, never null
    public static TestUnitDescriptor of(String className, String methodName, String moduleName) {
        return new TestUnitDescriptor(className, methodName, moduleName, false);
    }

    /// Returns `className.methodName`.
    ///
    /// @return fully qualified method name, never null
    public String fullyQualifiedName() {
        return className + "." + methodName;
    }
}
