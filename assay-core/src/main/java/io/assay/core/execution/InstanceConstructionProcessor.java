package io.assay.core.execution;

import io.assay.core.result.FailureDetail;
import io.assay.core.result.FailureKind;
import io.assay.core.result.Outcome;
import io.assay.core.result.StackTraces;
import java.lang.reflect.Constructor;
import java.util.Optional;

/// Creates a fresh test instance for every case.
///
/// A constructor taking the {@link CaseExecutionContext} is preferred over the
/// no-argument one.
final class InstanceConstructionProcessor implements CaseProcessor {

    @Override
    public Optional<Verdict> process(CaseInvocation invocation) {
        Class<?> type = invocation.getType();
        try {
            invocation.setInstance(construct(type, invocation.getContext()));
            return Optional.empty();
        } catch (ReflectiveOperationException | RuntimeException | LinkageError e) {
            Throwable error = StackTraces.unwrap(e);
            return Optional.of(
                    new Verdict(
                            Outcome.FAILED,
                            FailureDetail.of(
                                    FailureKind.CONSTRUCTION_FAILURE,
                                    "Unable to create instance of class "
                                            + type.getName()
                                            + ". Error: "
                                            + StackTraces.formatMessage(error)
                                            + ".",
                                    error,
                                    type.getName())));
        }
    }

    private static Object construct(Class<?> type, CaseExecutionContext context)
            throws ReflectiveOperationException {
        Constructor<?> withContext = null;
        Constructor<?> noArgs = null;
        for (Constructor<?> constructor : type.getDeclaredConstructors()) {
            Class<?>[] parameters = constructor.getParameterTypes();
            if (parameters.length == 1
                    && parameters[0].isAssignableFrom(CaseExecutionContext.class)) {
                withContext = constructor;
            } else if (parameters.length == 0) {
                noArgs = constructor;
            }
        }
        if (withContext != null) {
            withContext.setAccessible(true);
            return withContext.newInstance(context);
        }
        if (noArgs != null) {
            noArgs.setAccessible(true);
            return noArgs.newInstance();
        }
        throw new NoSuchMethodException(
                type.getName() + " declares neither a no-argument constructor nor one taking "
                        + CaseExecutionContext.class.getSimpleName());
    }
}
