package io.assay.core.expansion;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/// One expansion of a descriptor: the arguments a single case runs with.
///
/// @param rowIndex zero-based row index, null for a descriptor without data
/// @param values body arguments in declaration order, not null, may contain nulls
/// @param displayName label of the case, not null
/// @param ignoreReason when non-null the case is reported as ignored
public record ArgumentSet(
        Integer rowIndex, List<Object> values, String displayName, String ignoreReason) {

    public ArgumentSet {
        values = Collections.unmodifiableList(Arrays.asList(values.toArray()));
    }

    /// Creates the single expansion of a descriptor that takes no data.
    ///
    /// @param displayName label of the case, not null
    /// @return argument set without values, never null
    public static ArgumentSet single(String displayName) {
        return new ArgumentSet(null, List.of(), displayName, null);
    }

    public boolean isIgnored() {
        return ignoreReason != null;
    }
}
