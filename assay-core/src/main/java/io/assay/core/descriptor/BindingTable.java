package io.assay.core.descriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// In-memory {@link MetadataResolver} populated through a builder.
///
/// {@snippet :
/// BindingTable table = BindingTable.builder()
///     .module("orders", ModuleBindings.builder().initialize(Setup.class, "start").build())
///     .type(OrderTest.class, ClassBindings.builder(OrderTest.class)
///         .classInitialize("loadFixtures")
///         .caseCleanup("reset")
///         .build())
///     .test("orders", TestMethodDefinition.builder(OrderTest.class, "createsOrder").build())
///     .build();
/// }
///
/// @implNote Immutable after {@link Builder#build()}; safe for concurrent reads.
public final class BindingTable implements MetadataResolver {

    private final Map<String, Class<?>> types;
    private final Map<TestUnitDescriptor, TestMethodDefinition> tests;
    private final Map<Class<?>, ClassBindings> classes;
    private final Map<String, ModuleBindings> modules;

    private BindingTable(Builder builder) {
        this.types = Map.copyOf(builder.types);
        this.tests = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tests));
        this.classes = Map.copyOf(builder.classes);
        this.modules = Map.copyOf(builder.modules);
    }

    @Override
    public Optional<Class<?>> resolveType(TestUnitDescriptor descriptor) {
        return Optional.ofNullable(types.get(descriptor.className()));
    }

    @Override
    public Optional<TestMethodDefinition> resolveMethod(TestUnitDescriptor descriptor) {
        return Optional.ofNullable(tests.get(descriptor));
    }

    @Override
    public ClassBindings resolveClass(Class<?> type) {
        return classes.getOrDefault(type, ClassBindings.NONE);
    }

    @Override
    public ModuleBindings resolveModule(String moduleName) {
        return modules.getOrDefault(moduleName, ModuleBindings.NONE);
    }

    /// Returns the descriptors of all registered tests in registration order.
    ///
    /// @return descriptors, never null
    public List<TestUnitDescriptor> descriptors() {
        return new ArrayList<>(tests.keySet());
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link BindingTable}.
    public static final class Builder {
        private final Map<String, Class<?>> types = new HashMap<>();
        private final Map<TestUnitDescriptor, TestMethodDefinition> tests = new LinkedHashMap<>();
        private final Map<Class<?>, ClassBindings> classes = new HashMap<>();
        private final Map<String, ModuleBindings> modules = new HashMap<>();

        private Builder() {}

        /// Registers a test; its declaring class becomes resolvable as well.
        ///
        /// @param moduleName owning module, not null
        /// @param definition the test definition, not null
        /// @return the descriptor under which the test was registered, never null
        public TestUnitDescriptor register(String moduleName, TestMethodDefinition definition) {
            Class<?> declaring = definition.getMethod().getDeclaringClass();
            return register(declaring, moduleName, definition);
        }

        /// Registers a test run against `type`, which may inherit the method.
        ///
        /// @param type concrete test class, not null
        /// @param moduleName owning module, not null
        /// @param definition the test definition, not null
        /// @return the descriptor under which the test was registered, never null
        public TestUnitDescriptor register(
                Class<?> type, String moduleName, TestMethodDefinition definition) {
            boolean async = ReturnKinds.isAsync(definition.getMethod().getReturnType());
            TestUnitDescriptor descriptor =
                    new TestUnitDescriptor(
                            type.getName(), definition.getMethod().getName(), moduleName, async);
            types.put(type.getName(), type);
            tests.put(descriptor, definition);
            return descriptor;
        }

        public Builder test(String moduleName, TestMethodDefinition definition) {
            register(moduleName, definition);
            return this;
        }

        public Builder test(Class<?> type, String moduleName, TestMethodDefinition definition) {
            register(type, moduleName, definition);
            return this;
        }

        public Builder type(Class<?> type, ClassBindings bindings) {
            types.put(type.getName(), type);
            classes.put(type, bindings);
            return this;
        }

        public Builder module(String moduleName, ModuleBindings bindings) {
            modules.put(moduleName, bindings);
            return this;
        }

        public BindingTable build() {
            return new BindingTable(this);
        }
    }
}
