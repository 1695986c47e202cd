package io.assay.core.scheduler;

import java.util.List;

/// Dispatch units split into the parallel partition and the serial one run after it.
///
/// Unit indices run from zero across the parallel units and continue through the serial
/// units, which is also the order results are reported in.
///
/// @param parallel units any worker may pick up, not null
/// @param serial units run one after another on a single worker, not null
/// @param workers number of workers draining the parallel partition, at least 1
public record PartitionPlan(List<DispatchUnit> parallel, List<DispatchUnit> serial, int workers) {

    public PartitionPlan {
        parallel = List.copyOf(parallel);
        serial = List.copyOf(serial);
    }

    public int unitCount() {
        return parallel.size() + serial.size();
    }
}
