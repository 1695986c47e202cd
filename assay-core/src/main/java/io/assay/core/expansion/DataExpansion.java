package io.assay.core.expansion;

import io.assay.core.descriptor.DataRow;
import io.assay.core.descriptor.TestMethodDefinition;
import io.assay.core.descriptor.TestUnitDescriptor;
import io.assay.core.execution.CaseExecutionContext;
import io.assay.core.execution.ExecutionSession;
import io.assay.core.execution.InvocationPipeline;
import io.assay.core.execution.ResolvedCase;
import io.assay.core.execution.Verdict;
import io.assay.core.result.CaseResult;
import io.assay.core.result.FailureDetail;
import io.assay.core.result.FailureKind;
import io.assay.core.result.Outcome;
import io.assay.core.result.StackTraces;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Turns a descriptor into its cases and runs each through the invocation pipeline.
///
/// ### Contracts
/// - Inline rows win over an external data source; the provider is only consulted when
///   there are no inline rows and a source name is declared
/// - Rows run in declaration order, each with a fresh instance and context
/// - A row that cannot be bound fails on its own; other rows still run
/// - Duplicate rows are kept
///
/// @implNote Thread-safe; each call works on its own contexts.
public final class DataExpansion {

    private static final Logger logger = Logger.getLogger(DataExpansion.class.getName());

    private final ExecutionSession session;
    private final InvocationPipeline pipeline;

    public DataExpansion(ExecutionSession session, InvocationPipeline pipeline) {
        this.session = session;
        this.pipeline = pipeline;
    }

    /// Expands `definition` into the argument sets its cases run with.
    ///
    /// @param descriptor the descriptor being expanded, not null
    /// @param definition its method definition, not null
    /// @return argument sets in row order, never empty
    /// @throws DataExpansionException if the data source fails or is empty, or a
    ///     parameterized body has no data
    public List<ArgumentSet> expand(TestUnitDescriptor descriptor, TestMethodDefinition definition)
            throws DataExpansionException {
        String baseName = definition.getDisplayName().orElse(descriptor.methodName());
        if (!definition.isDataDriven()) {
            if (definition.isParameterized()) {
                throw new DataExpansionException(
                        Outcome.NOT_RUNNABLE,
                        FailureKind.DESCRIPTOR_NOT_RUNNABLE,
                        "Test method "
                                + descriptor.fullyQualifiedName()
                                + " takes parameters but declares no data.");
            }
            return List.of(ArgumentSet.single(baseName));
        }

        List<DataRow> rows = rows(descriptor, definition);
        if (rows.isEmpty()) {
            boolean inconclusive = session.getConfig().isConsiderEmptyDataSourceAsInconclusive();
            throw new DataExpansionException(
                    inconclusive ? Outcome.INCONCLUSIVE : Outcome.FAILED,
                    FailureKind.DATA_SOURCE_FAILURE,
                    "Data source of "
                            + descriptor.fullyQualifiedName()
                            + " returned no rows.");
        }

        List<ArgumentSet> sets = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            DataRow row = rows.get(i);
            String displayName =
                    row.displayName() != null
                            ? row.displayName()
                            : DisplayNames.forRow(baseName, row.values());
            sets.add(new ArgumentSet(i, row.values(), displayName, row.ignoreReason()));
        }
        logger.fine(
                () -> descriptor.fullyQualifiedName() + " expanded to " + sets.size() + " rows");
        return sets;
    }

    /// Runs every case of `descriptor`.
    ///
    /// @param descriptor the descriptor to run, not null
    /// @return one result per expansion in row order, never empty
    public List<CaseResult> execute(TestUnitDescriptor descriptor) {
        ResolvedCase resolved = pipeline.resolve(descriptor);
        if (!resolved.isRunnable()) {
            return List.of(
                    pipeline.report(
                            descriptor, context(descriptor, resolved, null), resolved.terminal()));
        }

        List<ArgumentSet> sets;
        try {
            sets = expand(descriptor, resolved.definition());
        } catch (DataExpansionException e) {
            logger.warning(e.getMessage());
            FailureDetail failure =
                    e.getCause() != null
                            ? FailureDetail.of(
                                    e.getKind(),
                                    e.getMessage(),
                                    e.getCause(),
                                    descriptor.className())
                            : FailureDetail.of(e.getKind(), e.getMessage());
            return List.of(
                    pipeline.report(
                            descriptor,
                            context(descriptor, resolved, null),
                            new Verdict(e.getOutcome(), failure)));
        }

        List<CaseResult> results = new ArrayList<>(sets.size());
        for (ArgumentSet set : sets) {
            results.add(executeRow(resolved, set));
        }
        return results;
    }

    private CaseResult executeRow(ResolvedCase resolved, ArgumentSet set) {
        TestUnitDescriptor descriptor = resolved.descriptor();
        CaseExecutionContext context = context(descriptor, resolved, set);
        if (session.getRunCancellation().isCancellationRequested()) {
            return pipeline.report(
                    descriptor,
                    context,
                    new Verdict(
                            Outcome.IGNORED,
                            FailureDetail.of(
                                    FailureKind.RUN_CANCELLED,
                                    "Run was cancelled before the case started.")));
        }
        if (set.isIgnored()) {
            return pipeline.report(
                    descriptor,
                    context,
                    new Verdict(
                            Outcome.IGNORED,
                            FailureDetail.of(FailureKind.IGNORED, set.ignoreReason())));
        }
        Object[] arguments;
        try {
            arguments = ArgumentBinder.bind(resolved.definition().getMethod(), set.values());
        } catch (ArgumentMismatchException e) {
            return pipeline.report(
                    descriptor,
                    context,
                    Verdict.failed(FailureKind.ARGUMENT_MISMATCH, e.getMessage()));
        }
        return pipeline.invoke(resolved, context, arguments);
    }

    private List<DataRow> rows(TestUnitDescriptor descriptor, TestMethodDefinition definition)
            throws DataExpansionException {
        if (!definition.getDataRows().isEmpty()) {
            return definition.getDataRows();
        }
        String source = definition.getDataSourceName().orElseThrow();
        try {
            List<DataRow> rows = session.getDataSourceProvider().rows(source, descriptor);
            return rows != null ? rows : List.of();
        } catch (Exception e) {
            throw new DataExpansionException(
                    Outcome.FAILED,
                    FailureKind.DATA_SOURCE_FAILURE,
                    "Data source '"
                            + source
                            + "' of "
                            + descriptor.fullyQualifiedName()
                            + " failed. "
                            + StackTraces.formatMessage(e)
                            + ".",
                    e);
        }
    }

    private CaseExecutionContext context(
            TestUnitDescriptor descriptor, ResolvedCase resolved, ArgumentSet set) {
        Map<String, Object> properties =
                resolved.getDefinition().map(TestMethodDefinition::getProperties).orElse(Map.of());
        String displayName =
                set != null
                        ? set.displayName()
                        : resolved.getDefinition()
                                .flatMap(TestMethodDefinition::getDisplayName)
                                .orElse(descriptor.methodName());
        return CaseExecutionContext.builder(descriptor, session.getMultiplexer())
                .cancellation(session.getRunCancellation().child())
                .runParameters(session.getConfig().getRunParameters())
                .properties(properties)
                .displayName(displayName)
                .rowIndex(set != null ? set.rowIndex() : null)
                .data(set != null ? set.values() : List.of())
                .build();
    }
}
