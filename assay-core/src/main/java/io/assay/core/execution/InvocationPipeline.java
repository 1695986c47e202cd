package io.assay.core.execution;

import io.assay.core.descriptor.ExpectedFailure;
import io.assay.core.descriptor.LifecycleBinding;
import io.assay.core.descriptor.MetadataResolver;
import io.assay.core.descriptor.ReturnKinds;
import io.assay.core.descriptor.TestMethodDefinition;
import io.assay.core.descriptor.TestUnitDescriptor;
import io.assay.core.lifecycle.BoundLifecycle;
import io.assay.core.lifecycle.ClassLifecycleState;
import io.assay.core.output.CapturedOutput;
import io.assay.core.output.OutputMultiplexer;
import io.assay.core.result.CaseResult;
import io.assay.core.result.FailureDetail;
import io.assay.core.result.FailureKind;
import io.assay.core.result.Outcome;
import io.assay.core.result.StackTraces;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Runs one case of a descriptor from lifecycle setup to result.
///
/// Steps, in order:
/// 1. Module and class initialize, exactly once per scope, failures cached
/// 2. Fresh instance construction and context injection
/// 3. Case initialize chain and body inside the timeout boundary
/// 4. Case cleanup chain and disposal, whenever an instance exists
/// 5. Result assembly from the verdict, the warnings and the captured output
///
/// ### Contracts
/// - **Postcondition**: every call yields a result; test code failures never propagate
/// - **Invariant**: cleanup runs whenever construction succeeded, disposal runs last
///
/// @implNote Thread-safe. All per-case state lives in a {@link CaseInvocation} confined to
/// the calling worker; cross-case state is held by the session's registry.
///
/// @see CaseProcessorPipeline for the setup steps
/// @see ExceptionClassifier for body outcome rules
public final class InvocationPipeline {

    private static final Logger logger = Logger.getLogger(InvocationPipeline.class.getName());

    private final ExecutionSession session;
    private final CaseProcessorPipeline setup;

    public InvocationPipeline(ExecutionSession session) {
        this(session, CaseProcessorPipeline.setup());
    }

    public InvocationPipeline(ExecutionSession session, CaseProcessorPipeline setup) {
        this.session = session;
        this.setup = setup;
    }

    /// Resolves and runs a single case of `descriptor`.
    ///
    /// @param descriptor the case's descriptor, not null
    /// @param context the case's context, not null; its output scope is closed and its
    ///     cancellation handle released on return
    /// @param arguments body arguments, empty for a parameterless body
    /// @return single-element result array, never null
    public CaseResult[] invoke(
            TestUnitDescriptor descriptor, CaseExecutionContext context, Object[] arguments) {
        return new CaseResult[] {invoke(resolve(descriptor), context, arguments)};
    }

    /// Runs one case of an already resolved descriptor.
    ///
    /// A terminal resolution is reported without running anything.
    ///
    /// @param resolved resolution of the descriptor, not null
    /// @param context the case's context, not null; its output scope is closed and its
    ///     cancellation handle released on return
    /// @param arguments body arguments, empty for a parameterless body
    /// @return the case's result, never null
    public CaseResult invoke(
            ResolvedCase resolved, CaseExecutionContext context, Object[] arguments) {
        if (!resolved.isRunnable()) {
            return report(resolved.descriptor(), context, resolved.terminal());
        }
        Method method = resolved.definition().getMethod();
        Object[] args = arguments != null ? arguments : new Object[0];
        if (args.length != method.getParameterCount()) {
            return report(
                    resolved.descriptor(),
                    context,
                    Verdict.failed(
                            FailureKind.ARGUMENT_MISMATCH,
                            "Test method "
                                    + resolved.descriptor().fullyQualifiedName()
                                    + " expects "
                                    + method.getParameterCount()
                                    + " argument(s) but received "
                                    + args.length
                                    + "."));
        }
        return run(
                new CaseInvocation(
                        session,
                        resolved.descriptor(),
                        resolved.definition(),
                        resolved.type(),
                        resolved.lifecycle(),
                        context,
                        args));
    }

    /// Resolves `descriptor` to a runnable case or to the verdict it reports instead.
    ///
    /// Checks, in order: the class and method exist, the method belongs to the class,
    /// the class is concrete and the body has a runnable signature, nothing is ignored.
    /// Only runnable descriptors bind a lifecycle, so ignored cases never trigger
    /// initialization.
    ///
    /// @param descriptor descriptor to resolve, not null
    /// @return resolution, never null
    public ResolvedCase resolve(TestUnitDescriptor descriptor) {
        MetadataResolver resolver = session.getResolver();
        Optional<Class<?>> type = resolver.resolveType(descriptor);
        if (type.isEmpty()) {
            return ResolvedCase.terminal(
                    descriptor,
                    null,
                    null,
                    notFound("Test class " + descriptor.className() + " was not found."));
        }
        Optional<TestMethodDefinition> definition = resolver.resolveMethod(descriptor);
        if (definition.isEmpty()
                || !definition
                        .get()
                        .getMethod()
                        .getDeclaringClass()
                        .isAssignableFrom(type.get())) {
            return ResolvedCase.terminal(
                    descriptor,
                    type.get(),
                    null,
                    notFound("Test method " + descriptor.fullyQualifiedName() + " was not found."));
        }

        Optional<String> unrunnable = checkRunnable(descriptor, type.get(), definition.get());
        if (unrunnable.isPresent()) {
            return ResolvedCase.terminal(
                    descriptor,
                    type.get(),
                    definition.get(),
                    new Verdict(
                            Outcome.NOT_RUNNABLE,
                            FailureDetail.of(
                                    FailureKind.DESCRIPTOR_NOT_RUNNABLE, unrunnable.get())));
        }

        BoundLifecycle lifecycle =
                session.getRegistry().bindLifecycle(descriptor.moduleName(), type.get());
        Optional<String> ignoreReason =
                definition.get().getIgnoreReason().or(() -> lifecycle.type().getIgnoreReason());
        if (ignoreReason.isPresent()) {
            return ResolvedCase.terminal(
                    descriptor,
                    type.get(),
                    definition.get(),
                    new Verdict(
                            Outcome.IGNORED,
                            FailureDetail.of(FailureKind.IGNORED, ignoreReason.get())));
        }
        return ResolvedCase.runnable(descriptor, type.get(), definition.get(), lifecycle);
    }

    /// Produces the result of a case that ends without running, closing its output scope
    /// and releasing its cancellation handle.
    ///
    /// @param descriptor the case's descriptor, not null
    /// @param context the case's context, not null
    /// @param verdict verdict to report, not null
    /// @return result, never null
    public CaseResult report(
            TestUnitDescriptor descriptor, CaseExecutionContext context, Verdict verdict) {
        Instant now = Instant.now();
        CapturedOutput output = session.closeOutput(context);
        context.getCancellation().release();
        logger.fine(() -> descriptor.fullyQualifiedName() + " reported " + verdict.outcome());
        return CaseResult.builder(descriptor)
                .outcome(verdict.outcome())
                .failure(verdict.failure())
                .startTime(now)
                .endTime(now)
                .duration(Duration.ZERO)
                .standardOutput(output.standardOutput())
                .diagnosticTrace(output.diagnosticTrace())
                .rowIndex(context.getRowIndex())
                .displayName(context.getDisplayName())
                .build();
    }

    private CaseResult run(CaseInvocation invocation) {
        TestUnitDescriptor descriptor = invocation.getDescriptor();
        CaseExecutionContext context = invocation.getContext();
        OutputMultiplexer multiplexer = session.getMultiplexer();
        Instant start = Instant.now();
        long startNanos = System.nanoTime();
        logger.fine(() -> "Running " + descriptor.fullyQualifiedName());

        Verdict verdict;
        List<String> warnings = new ArrayList<>();
        try (OutputMultiplexer.Binding ignored = multiplexer.bind(context.getOutputScope())) {
            try {
                verdict = setup.execute(invocation).orElseGet(() -> runBody(invocation));
            } finally {
                if (invocation.getInstance() != null) {
                    warnings.addAll(cleanupInstance(invocation));
                }
            }
        }

        if (!warnings.isEmpty()) {
            warnings.forEach(
                    w -> logger.warning(descriptor.fullyQualifiedName() + " cleanup: " + w));
            if (session.getConfig().isTreatCleanupWarningsAsErrors()
                    && verdict.outcome() == Outcome.PASSED) {
                verdict =
                        new Verdict(
                                Outcome.FAILED,
                                FailureDetail.of(FailureKind.CLEANUP_FAILURE, warnings.get(0)));
            }
        }

        Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
        CapturedOutput output = session.closeOutput(context);
        context.getCancellation().release();
        CaseResult.Builder result =
                CaseResult.builder(descriptor)
                        .outcome(verdict.outcome())
                        .failure(verdict.failure())
                        .addWarnings(warnings)
                        .startTime(start)
                        .endTime(start.plus(duration))
                        .duration(duration)
                        .standardOutput(output.standardOutput())
                        .diagnosticTrace(output.diagnosticTrace())
                        .rowIndex(context.getRowIndex())
                        .displayName(context.getDisplayName());
        context.getResultFiles().forEach(result::addResultFile);

        Outcome outcome = verdict.outcome();
        logger.fine(
                () ->
                        descriptor.fullyQualifiedName()
                                + " finished "
                                + outcome
                                + " in "
                                + duration.toMillis()
                                + " ms");
        return result.build();
    }

    private Verdict runBody(CaseInvocation invocation) {
        TestUnitDescriptor descriptor = invocation.getDescriptor();
        TestMethodDefinition definition = invocation.getDefinition();
        CaseExecutionContext context = invocation.getContext();
        ExceptionClassifier classifier = session.getClassifier();
        ExpectedFailure expected = definition.getExpectedFailure().orElse(null);
        Duration timeout = definition.getTimeout().orElse(session.getConfig().getDefaultTimeout());

        AtomicReference<Verdict> initializeFailure = new AtomicReference<>();
        TimeoutBoundary.Completion completion =
                session.getBoundary()
                        .run(
                                () -> initializeAndInvoke(invocation, initializeFailure),
                                timeout,
                                context.getCancellation(),
                                context.getOutputScope());

        if (completion.isTimedOut()) {
            return new Verdict(
                    Outcome.TIMED_OUT,
                    FailureDetail.of(
                            FailureKind.TIMEOUT,
                            "Test '"
                                    + descriptor.fullyQualifiedName()
                                    + "' exceeded execution timeout period of "
                                    + completion.timeout().toMillis()
                                    + " ms."));
        }
        if (initializeFailure.get() != null) {
            return initializeFailure.get();
        }
        if (completion.error() != null) {
            return classifier.classifyBodyFailure(descriptor, completion.error(), expected);
        }
        return classifier.classifyCompletion(
                descriptor, expected, context.getOutcome().orElse(null));
    }

    /// Runs the case initialize chain and then the body; a failing initialize binding
    /// records its verdict and skips the body.
    private void initializeAndInvoke(CaseInvocation invocation, AtomicReference<Verdict> failure)
            throws Throwable {
        LifecycleInvoker invoker = session.getInvoker();
        ClassLifecycleState state = invocation.getLifecycle().type();
        for (LifecycleBinding binding : state.getCaseInitializeChain()) {
            try {
                invoker.invoke(binding, invocation.getInstance(), invocation.getContext());
            } catch (Throwable t) {
                Throwable error = StackTraces.unwrap(t);
                failure.set(
                        session.getClassifier()
                                .classifyCaseInitializeFailure(
                                        invocation.getDescriptor(),
                                        LifecycleInvoker.threwMessage(binding, error),
                                        error));
                return;
            }
        }
        invoker.invokeMethod(
                invocation.getDefinition().getMethod(),
                invocation.getInstance(),
                invocation.getArguments());
    }

    private List<String> cleanupInstance(CaseInvocation invocation) {
        Object instance = invocation.getInstance();
        List<String> warnings =
                new ArrayList<>(
                        session.getInvoker()
                                .cleanup(
                                        invocation.getLifecycle().type().getCaseCleanupChain(),
                                        instance,
                                        invocation.getContext()));
        if (instance instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                warnings.add(
                        "Dispose of "
                                + instance.getClass().getName()
                                + " threw exception. "
                                + StackTraces.formatMessage(e)
                                + "."
                                + System.lineSeparator()
                                + StackTraces.describe(e));
            }
        }
        return warnings;
    }

    private static Optional<String> checkRunnable(
            TestUnitDescriptor descriptor, Class<?> type, TestMethodDefinition definition) {
        Method method = definition.getMethod();
        String name = descriptor.fullyQualifiedName();
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            return Optional.of(
                    "Test class " + type.getName() + " is abstract and cannot be instantiated.");
        }
        if (Modifier.isStatic(method.getModifiers())) {
            return Optional.of("Test method " + name + " must not be static.");
        }
        if (method.getTypeParameters().length > 0) {
            return Optional.of("Test method " + name + " must not be generic.");
        }
        Class<?> returnType = method.getReturnType();
        boolean async = ReturnKinds.isAsync(returnType);
        if (returnType != void.class && !async) {
            return Optional.of(
                    "Test method "
                            + name
                            + " must return void, a CompletionStage or a Future, not "
                            + returnType.getName()
                            + ".");
        }
        if (descriptor.async() && !async) {
            return Optional.of(
                    "Test method " + name + " is declared asynchronous but returns void.");
        }
        return Optional.empty();
    }

    private static Verdict notFound(String message) {
        return new Verdict(
                Outcome.NOT_FOUND, FailureDetail.of(FailureKind.DESCRIPTOR_NOT_FOUND, message));
    }

    /// Logs and converts an engine fault raised while running `descriptor`.
    ///
    /// @param descriptor the descriptor being run, not null
    /// @param fault the fault, not null
    /// @return failed verdict describing the fault, never null
    public static Verdict engineFault(TestUnitDescriptor descriptor, RuntimeException fault) {
        logger.log(
                Level.WARNING,
                "Engine fault while running " + descriptor.fullyQualifiedName(),
                fault);
        return new Verdict(
                Outcome.FAILED,
                FailureDetail.of(
                        FailureKind.UNRECOGNIZED_EXCEPTION,
                        "Engine fault while running "
                                + descriptor.fullyQualifiedName()
                                + ": "
                                + StackTraces.formatMessage(fault),
                        fault,
                        null));
    }
}
