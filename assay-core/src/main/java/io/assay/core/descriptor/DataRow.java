package io.assay.core.descriptor;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/// One row of arguments for a data-driven test.
///
/// Values may contain nulls.
///
/// @param values positional arguments, not null
/// @param displayName label for this row, null to derive one from the values
/// @param ignoreReason when non-null the row is reported as ignored instead of run
public record DataRow(List<Object> values, String displayName, String ignoreReason) {

    public DataRow {
        values = Collections.unmodifiableList(Arrays.asList(values.toArray()));
    }

    public static DataRow of(Object... values) {
        return new DataRow(Arrays.asList(values), null, null);
    }

    public static DataRow named(String displayName, Object... values) {
        return new DataRow(Arrays.asList(values), displayName, null);
    }

    public DataRow ignored(String reason) {
        return new DataRow(values, displayName, reason);
    }
}
