package io.assay.core.lifecycle;

import io.assay.core.descriptor.ClassBindings;
import io.assay.core.descriptor.ContextSlot;
import io.assay.core.descriptor.LifecycleBinding;
import io.assay.core.descriptor.LifecycleRole;
import io.assay.core.descriptor.MetadataResolver;
import io.assay.core.descriptor.ModuleBindings;
import io.assay.core.descriptor.TestUnitDescriptor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Run-scoped registry of module and class lifecycle states.
///
/// States are created on first reference and live until the run ends. Resolving a
/// class walks its ancestry once, asks the {@link MetadataResolver} for each
/// ancestor's own bindings, validates their signatures and flattens them into the
/// ordered chains held by {@link ClassLifecycleState}.
///
/// ### Contracts
/// - {@link #bindLifecycle} returns the same state instances for the same module and class
/// - Concurrent first references observe a single resolution
/// - An invalid binding never escapes as an exception; it is cached on the state as
///   {@link ScopeLifecycle#getInspectionFailure()}
///
/// @implNote Lookups take a lock-free fast path; creation is double-checked under
/// the registry lock.
public final class LifecycleRegistry {

    private static final Logger logger = Logger.getLogger(LifecycleRegistry.class.getName());

    private final MetadataResolver resolver;
    private final Object lock = new Object();
    private final Map<String, ModuleLifecycleState> modules = new ConcurrentHashMap<>();
    private final Map<Class<?>, ClassLifecycleState> classes = new ConcurrentHashMap<>();
    private final List<ModuleLifecycleState> moduleOrder = new ArrayList<>();
    private final List<ClassLifecycleState> classOrder = new ArrayList<>();

    /// Creates an empty registry for one run.
    ///
    /// @param resolver source of lifecycle bindings, not null
    public LifecycleRegistry(MetadataResolver resolver) {
        this.resolver = resolver;
    }

    /// Returns the lifecycle states `descriptor` runs under, creating them on first use.
    ///
    /// @param descriptor test descriptor, not null
    /// @return module and class states, never null
    /// @throws IllegalArgumentException if the resolver cannot find the test class
    public BoundLifecycle bindLifecycle(TestUnitDescriptor descriptor) {
        Class<?> type =
                resolver.resolveType(descriptor)
                        .orElseThrow(
                                () ->
                                        new IllegalArgumentException(
                                                "Test class not found: "
                                                        + descriptor.className()));
        return bindLifecycle(descriptor.moduleName(), type);
    }

    /// Returns the lifecycle states of `type` in `moduleName`, creating them on first use.
    ///
    /// @param moduleName owning module, not null
    /// @param type concrete test class, not null
    /// @return module and class states, never null
    public BoundLifecycle bindLifecycle(String moduleName, Class<?> type) {
        ModuleLifecycleState module = modules.get(moduleName);
        ClassLifecycleState state = classes.get(type);
        if (module == null || state == null) {
            synchronized (lock) {
                module = modules.get(moduleName);
                if (module == null) {
                    module = resolveModule(moduleName);
                    modules.put(moduleName, module);
                    moduleOrder.add(module);
                }
                state = classes.get(type);
                if (state == null) {
                    state = resolveClass(moduleName, type);
                    classes.put(type, state);
                    classOrder.add(state);
                }
            }
        }
        return new BoundLifecycle(module, state);
    }

    /// Returns every module state created so far, in creation order.
    ///
    /// @return snapshot of module states, never null
    public List<ModuleLifecycleState> moduleStates() {
        synchronized (lock) {
            return List.copyOf(moduleOrder);
        }
    }

    /// Returns every class state created so far, in creation order.
    ///
    /// @return snapshot of class states, never null
    public List<ClassLifecycleState> classStates() {
        synchronized (lock) {
            return List.copyOf(classOrder);
        }
    }

    /// Returns the state of `type` if it was created.
    ///
    /// @param type test class, not null
    /// @return class state, or null when the class was never bound
    public ClassLifecycleState findClassState(Class<?> type) {
        return classes.get(type);
    }

    private ModuleLifecycleState resolveModule(String moduleName) {
        ModuleBindings bindings = resolver.resolveModule(moduleName);
        LifecycleInspectionException inspectionFailure = null;
        try {
            for (LifecycleBinding binding : bindings.getBindings()) {
                if (binding.role().getScope() != LifecycleRole.Scope.MODULE) {
                    throw new LifecycleInspectionException(
                            "Module "
                                    + moduleName
                                    + " binds "
                                    + binding.qualifiedName()
                                    + " to non-module role "
                                    + binding.role());
                }
            }
            BindingInspector.inspect("Module " + moduleName, bindings.getBindings());
        } catch (LifecycleInspectionException e) {
            logger.warning("Invalid module lifecycle: " + e.getMessage());
            inspectionFailure = e;
        }
        return new ModuleLifecycleState(
                moduleName,
                bindings.bindingsFor(LifecycleRole.MODULE_INITIALIZE),
                bindings.bindingsFor(LifecycleRole.MODULE_CLEANUP),
                inspectionFailure);
    }

    private ClassLifecycleState resolveClass(String moduleName, Class<?> type) {
        List<Class<?>> ancestry = new ArrayList<>();
        for (Class<?> current = type;
                current != null && current != Object.class;
                current = current.getSuperclass()) {
            ancestry.add(current);
        }
        Collections.reverse(ancestry);

        List<LifecycleBinding> classInitialize = new ArrayList<>();
        List<LifecycleBinding> classCleanup = new ArrayList<>();
        List<LifecycleBinding> caseInitialize = new ArrayList<>();
        List<LifecycleBinding> caseCleanup = new ArrayList<>();
        ContextSlot contextSlot = null;
        LifecycleInspectionException inspectionFailure = null;

        for (Class<?> ancestor : ancestry) {
            ClassBindings own = resolver.resolveClass(ancestor);
            try {
                for (LifecycleBinding binding : own.getBindings()) {
                    if (binding.role().getScope() == LifecycleRole.Scope.MODULE) {
                        throw new LifecycleInspectionException(
                                "Class "
                                        + ancestor.getName()
                                        + " binds "
                                        + binding.qualifiedName()
                                        + " to module role "
                                        + binding.role());
                    }
                }
                BindingInspector.inspect(ancestor.getName(), own.getBindings());
                BindingInspector.inspect(ancestor.getName(), own.getContextSlot().orElse(null));
            } catch (LifecycleInspectionException e) {
                if (inspectionFailure == null) {
                    logger.warning(
                            "Invalid lifecycle in " + type.getName() + ": " + e.getMessage());
                    inspectionFailure = e;
                }
            }
            classInitialize.addAll(own.bindingsFor(LifecycleRole.CLASS_INITIALIZE));
            classCleanup.addAll(0, own.bindingsFor(LifecycleRole.CLASS_CLEANUP));
            caseInitialize.addAll(own.bindingsFor(LifecycleRole.CASE_INITIALIZE));
            caseCleanup.addAll(0, own.bindingsFor(LifecycleRole.CASE_CLEANUP));
            if (own.getContextSlot().isPresent()) {
                contextSlot = own.getContextSlot().get();
            }
        }

        String ignoreReason = resolver.resolveClass(type).getIgnoreReason().orElse(null);
        logger.fine(
                () ->
                        "Resolved lifecycle of "
                                + type.getName()
                                + ": "
                                + classInitialize.size()
                                + " class initialize, "
                                + caseInitialize.size()
                                + " case initialize binding(s)");
        return new ClassLifecycleState(
                type,
                moduleName,
                classInitialize,
                classCleanup,
                caseInitialize,
                caseCleanup,
                contextSlot,
                ignoreReason,
                inspectionFailure);
    }
}
