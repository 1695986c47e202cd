package io.assay.core.lifecycle;

import io.assay.core.descriptor.ContextSlot;
import io.assay.core.descriptor.LifecycleBinding;
import io.assay.core.descriptor.LifecycleRole;
import io.assay.core.descriptor.ReturnKinds;
import io.assay.core.execution.CaseExecutionContext;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/// Validates lifecycle binding signatures once, when a scope is resolved.
final class BindingInspector {

    private BindingInspector() {}

    /// Checks every binding of one declaring scope.
    ///
    /// @param owner class or module name used in messages, not null
    /// @param bindings bindings declared by that scope, not null
    /// @throws LifecycleInspectionException on the first invalid binding
    static void inspect(String owner, List<LifecycleBinding> bindings)
            throws LifecycleInspectionException {
        Map<LifecycleRole, LifecycleBinding> seen = new EnumMap<>(LifecycleRole.class);
        for (LifecycleBinding binding : bindings) {
            LifecycleBinding previous = seen.putIfAbsent(binding.role(), binding);
            if (previous != null) {
                throw new LifecycleInspectionException(
                        owner
                                + " declares more than one "
                                + binding.role().label()
                                + " method: "
                                + previous.method().getName()
                                + ", "
                                + binding.method().getName());
            }
            inspect(binding);
        }
    }

    static void inspect(LifecycleBinding binding) throws LifecycleInspectionException {
        Method method = binding.method();
        LifecycleRole role = binding.role();
        boolean isStatic = Modifier.isStatic(method.getModifiers());
        if (role.requiresStatic() && !isStatic) {
            throw invalid(binding, "must be static");
        }
        if (!role.requiresStatic() && isStatic) {
            throw invalid(binding, "must not be static");
        }
        Class<?>[] parameters = method.getParameterTypes();
        if (role.requiresStatic()) {
            boolean accepted =
                    parameters.length == 0
                            || (parameters.length == 1
                                    && parameters[0].isAssignableFrom(CaseExecutionContext.class));
            if (!accepted) {
                throw invalid(binding, "must take no parameters or a single CaseExecutionContext");
            }
        } else if (parameters.length != 0) {
            throw invalid(binding, "must take no parameters");
        }
        Class<?> returnType = method.getReturnType();
        if (returnType != void.class && !ReturnKinds.isAsync(returnType)) {
            throw invalid(binding, "must return void, a CompletionStage or a Future");
        }
        if (method.getTypeParameters().length > 0) {
            throw invalid(binding, "must not be generic");
        }
    }

    static void inspect(String owner, ContextSlot slot) throws LifecycleInspectionException {
        if (slot == null || !slot.isWritable()) {
            return;
        }
        Method setter = slot.setter();
        if (Modifier.isStatic(setter.getModifiers())
                || setter.getParameterCount() != 1
                || !setter.getParameterTypes()[0].isAssignableFrom(CaseExecutionContext.class)) {
            throw new LifecycleInspectionException(
                    owner
                            + " context slot '"
                            + slot.name()
                            + "' must be an instance method taking a CaseExecutionContext: "
                            + setter.getName());
        }
    }

    private static LifecycleInspectionException invalid(LifecycleBinding binding, String problem) {
        return new LifecycleInspectionException(
                binding.role().label() + " method " + binding.qualifiedName() + " " + problem);
    }
}
