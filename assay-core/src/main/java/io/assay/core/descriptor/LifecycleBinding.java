package io.assay.core.descriptor;

import java.lang.reflect.Method;
import java.time.Duration;
import java.util.Objects;

/// A method bound to a lifecycle role.
///
/// @param role position of the method around test execution, not null
/// @param method the bound method, not null
/// @param timeout own timeout, null when the method runs without one
public record LifecycleBinding(LifecycleRole role, Method method, Duration timeout) {

    public LifecycleBinding {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(method, "method");
    }

    public LifecycleBinding(LifecycleRole role, Method method) {
        this(role, method, null);
    }

    /// Returns `DeclaringClass.method`, as quoted in failure messages.
    ///
    /// @return qualified method name, never null
    public String qualifiedName() {
        return method.getDeclaringClass().getName() + "." + method.getName();
    }
}
