package io.assay.core.execution;

import io.assay.core.descriptor.LifecycleBinding;
import io.assay.core.descriptor.LifecycleRole;
import io.assay.core.lifecycle.ScopeFailure;
import io.assay.core.result.FailureDetail;
import io.assay.core.result.FailureKind;
import io.assay.core.result.Outcome;
import io.assay.core.result.StackTraces;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/// Invokes reflected test and lifecycle methods.
///
/// Results of asynchronous methods (`CompletionStage`, `Future`) are awaited, so a
/// returned invocation has fully completed.
public final class LifecycleInvoker {

    private final TimeoutBoundary boundary;

    public LifecycleInvoker(TimeoutBoundary boundary) {
        this.boundary = boundary;
    }

    /// Runs an initialize chain in order, stopping at the first failure.
    ///
    /// @param chain bindings, outermost first, not null
    /// @param context context of the case that triggered initialization, not null
    /// @return the failure, or null when every binding completed
    public ScopeFailure initialize(List<LifecycleBinding> chain, CaseExecutionContext context) {
        for (LifecycleBinding binding : chain) {
            TimeoutBoundary.Completion completion =
                    boundary.run(
                            () -> invoke(binding, null, context),
                            binding.timeout(),
                            context.getCancellation(),
                            context.getOutputScope());
            if (completion.isCompleted()) {
                continue;
            }
            FailureKind kind =
                    binding.role() == LifecycleRole.MODULE_INITIALIZE
                            ? FailureKind.MODULE_INITIALIZE_FAILURE
                            : FailureKind.CLASS_INITIALIZE_FAILURE;
            if (completion.isTimedOut()) {
                return new ScopeFailure(
                        Outcome.TIMED_OUT,
                        FailureDetail.of(
                                FailureKind.TIMEOUT,
                                binding.role().label()
                                        + " method "
                                        + binding.qualifiedName()
                                        + " exceeded its timeout of "
                                        + completion.timeout().toMillis()
                                        + " ms"));
            }
            Throwable error = StackTraces.unwrap(completion.error());
            Outcome outcome =
                    error instanceof AssertionInconclusiveException
                            ? Outcome.INCONCLUSIVE
                            : Outcome.FAILED;
            return new ScopeFailure(
                    outcome,
                    FailureDetail.of(
                            kind,
                            threwMessage(binding, error),
                            error,
                            binding.method().getDeclaringClass().getName()));
        }
        return null;
    }

    /// Runs a cleanup chain, attempting every binding whatever the others do.
    ///
    /// @param chain bindings, innermost first, not null
    /// @param instance test instance for case-scoped bindings, null for static ones
    /// @param context context passed to bindings that accept one, not null
    /// @return one warning per failing binding, never null
    public List<String> cleanup(
            List<LifecycleBinding> chain, Object instance, CaseExecutionContext context) {
        List<String> warnings = new ArrayList<>();
        for (LifecycleBinding binding : chain) {
            TimeoutBoundary.Completion completion =
                    boundary.run(
                            () -> invoke(binding, instance, context),
                            binding.timeout(),
                            context.getCancellation(),
                            context.getOutputScope());
            if (completion.isTimedOut()) {
                warnings.add(
                        binding.role().label()
                                + " method "
                                + binding.qualifiedName()
                                + " exceeded its timeout of "
                                + completion.timeout().toMillis()
                                + " ms");
            } else if (!completion.isCompleted()) {
                Throwable error = StackTraces.unwrap(completion.error());
                warnings.add(
                        threwMessage(binding, error)
                                + System.lineSeparator()
                                + StackTraces.describe(error));
            }
        }
        return warnings;
    }

    /// Invokes one lifecycle binding.
    ///
    /// @param binding the binding, not null
    /// @param instance receiver for instance methods, null for static ones
    /// @param context passed when the method declares a parameter, not null
    /// @throws Throwable whatever the method throws, unwrapped
    public void invoke(LifecycleBinding binding, Object instance, CaseExecutionContext context)
            throws Throwable {
        Method method = binding.method();
        Object receiver = Modifier.isStatic(method.getModifiers()) ? null : instance;
        Object[] args = method.getParameterCount() == 1 ? new Object[] {context} : new Object[0];
        invokeMethod(method, receiver, args);
    }

    /// Invokes `method` and awaits an asynchronous result.
    ///
    /// @param method method to call, not null
    /// @param receiver receiver, null for static methods
    /// @param args arguments, not null
    /// @throws Throwable whatever the method throws, unwrapped
    public void invokeMethod(Method method, Object receiver, Object[] args) throws Throwable {
        Object returned;
        try {
            method.setAccessible(true);
            returned = method.invoke(receiver, args);
        } catch (InvocationTargetException e) {
            throw e.getCause() != null ? e.getCause() : e;
        }
        await(returned);
    }

    private static void await(Object returned) throws Throwable {
        try {
            if (returned instanceof CompletionStage<?> stage) {
                stage.toCompletableFuture().get();
            } else if (returned instanceof Future<?> future) {
                future.get();
            }
        } catch (ExecutionException e) {
            throw StackTraces.unwrap(e);
        }
    }

    static String threwMessage(LifecycleBinding binding, Throwable error) {
        return binding.role().label()
                + " method "
                + binding.qualifiedName()
                + " threw exception. "
                + StackTraces.formatMessage(error)
                + ".";
    }
}
