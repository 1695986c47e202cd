package io.assay.core.scheduler;

import io.assay.core.AssayConfig;
import io.assay.core.descriptor.MetadataResolver;
import io.assay.core.descriptor.TestMethodDefinition;
import io.assay.core.descriptor.TestUnitDescriptor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Splits the descriptors of a run into dispatch units.
///
/// ### Contracts
/// - Disabled parallelization puts every descriptor in the serial partition
/// - At class scope one parallel unit holds all parallelizable descriptors of a class,
///   in submission order; at method scope every descriptor is its own unit
/// - Descriptors marked not parallelizable always go to the serial partition
/// - Units keep the order in which their first descriptor was submitted
public final class Partitioner {

    private final MetadataResolver resolver;

    public Partitioner(MetadataResolver resolver) {
        this.resolver = resolver;
    }

    /// Partitions `descriptors` according to `config`.
    ///
    /// @param descriptors descriptors of the run in submission order, not null
    /// @param config run configuration, not null
    /// @return partition plan, never null
    public PartitionPlan partition(List<TestUnitDescriptor> descriptors, AssayConfig config) {
        List<TestUnitDescriptor> parallel = new ArrayList<>();
        List<TestUnitDescriptor> serial = new ArrayList<>();
        for (TestUnitDescriptor descriptor : descriptors) {
            if (config.isParallelizationDisabled() || !isParallelizable(descriptor)) {
                serial.add(descriptor);
            } else {
                parallel.add(descriptor);
            }
        }

        List<DispatchUnit> parallelUnits = new ArrayList<>();
        if (config.getParallelScope() == ParallelScope.CLASS) {
            Map<String, List<TestUnitDescriptor>> byClass = new LinkedHashMap<>();
            for (TestUnitDescriptor descriptor : parallel) {
                byClass.computeIfAbsent(descriptor.className(), k -> new ArrayList<>())
                        .add(descriptor);
            }
            byClass.forEach(
                    (className, members) ->
                            parallelUnits.add(
                                    new DispatchUnit(parallelUnits.size(), className, members)));
        } else {
            for (TestUnitDescriptor descriptor : parallel) {
                parallelUnits.add(single(parallelUnits.size(), descriptor));
            }
        }

        List<DispatchUnit> serialUnits = new ArrayList<>();
        for (TestUnitDescriptor descriptor : serial) {
            serialUnits.add(single(parallelUnits.size() + serialUnits.size(), descriptor));
        }
        return new PartitionPlan(parallelUnits, serialUnits, config.effectiveWorkers());
    }

    private boolean isParallelizable(TestUnitDescriptor descriptor) {
        return resolver.resolveMethod(descriptor)
                .map(TestMethodDefinition::isParallelizable)
                .orElse(true);
    }

    private static DispatchUnit single(int index, TestUnitDescriptor descriptor) {
        return new DispatchUnit(index, descriptor.fullyQualifiedName(), List.of(descriptor));
    }
}
