package io.assay.core.descriptor;

import java.util.List;

/// Supplies rows for a named external data source.
@FunctionalInterface
public interface DataSourceProvider {

    /// Provider used when none is configured; every lookup fails.
    DataSourceProvider NONE =
            (sourceName, descriptor) -> {
                throw new IllegalStateException(
                        "No data source provider configured for source '" + sourceName + "'");
            };

    /// Loads the rows of `sourceName` for `descriptor`.
    ///
    /// @param sourceName declared data source name, not null
    /// @param descriptor the test being expanded, not null
    /// @return rows in source order, never null (may be empty)
    /// @throws Exception if the source cannot be read
    List<DataRow> rows(String sourceName, TestUnitDescriptor descriptor) throws Exception;
}
