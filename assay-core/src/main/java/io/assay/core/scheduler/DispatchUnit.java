package io.assay.core.scheduler;

import io.assay.core.descriptor.TestUnitDescriptor;
import java.util.List;

/// The smallest piece of work handed to a worker: one or more descriptors run in order.
///
/// @param index position of the unit in the plan, used to slot its results
/// @param key class name at class scope, fully qualified name at method scope
/// @param descriptors descriptors to run in order, not empty
public record DispatchUnit(int index, String key, List<TestUnitDescriptor> descriptors) {

    public DispatchUnit {
        descriptors = List.copyOf(descriptors);
    }
}
