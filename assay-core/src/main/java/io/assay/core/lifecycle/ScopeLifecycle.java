package io.assay.core.lifecycle;

import io.assay.core.descriptor.LifecycleBinding;
import io.assay.core.result.FailureDetail;
import io.assay.core.result.FailureKind;
import io.assay.core.result.Outcome;
import io.assay.core.result.StackTraces;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/// Execution state shared by module and class scopes.
///
/// ### Contracts
/// - The initialize chain runs at most once per run, whichever worker gets there first
/// - Callers arriving while it runs block until it finished and then see its result
/// - A failure is cached and returned unchanged to every later caller
/// - Cleanup can be claimed once, and only after initialization was attempted
///
/// @implNote Double-checked: the `DONE` fast path reads a volatile field without locking.
public abstract class ScopeLifecycle {

    private static final Logger logger = Logger.getLogger(ScopeLifecycle.class.getName());

    private final Object guard = new Object();
    private final List<LifecycleBinding> initializeChain;
    private final List<LifecycleBinding> cleanupChain;
    private final LifecycleInspectionException inspectionFailure;
    private final AtomicBoolean cleanupClaimed = new AtomicBoolean();
    private volatile LifecycleStatus status = LifecycleStatus.NOT_RUN;
    private volatile ScopeFailure failure;

    protected ScopeLifecycle(
            List<LifecycleBinding> initializeChain,
            List<LifecycleBinding> cleanupChain,
            LifecycleInspectionException inspectionFailure) {
        this.initializeChain = List.copyOf(initializeChain);
        this.cleanupChain = List.copyOf(cleanupChain);
        this.inspectionFailure = inspectionFailure;
    }

    /// Runs the initialize chain through `initializer` unless it already ran.
    ///
    /// @param initializer runs the chain and reports its failure, not null
    /// @return the cached failure, or empty when initialization succeeded
    public Optional<ScopeFailure> initializeOnce(Initializer initializer) {
        if (status == LifecycleStatus.DONE) {
            return Optional.ofNullable(failure);
        }
        synchronized (guard) {
            if (status == LifecycleStatus.NOT_RUN) {
                status = LifecycleStatus.RUNNING;
                try {
                    failure = initializer.initialize(initializeChain);
                } catch (RuntimeException e) {
                    logger.warning("Initializer of " + describe() + " failed: " + e);
                    failure =
                            new ScopeFailure(
                                    Outcome.FAILED,
                                    FailureDetail.of(
                                            initializeFailureKind(),
                                            StackTraces.formatMessage(e),
                                            e,
                                            null));
                } finally {
                    status = LifecycleStatus.DONE;
                }
                if (failure != null) {
                    logger.warning(
                            describe() + " initialization failed: " + failure.detail().message());
                }
            }
            return Optional.ofNullable(failure);
        }
    }

    /// Claims the right to run the cleanup chain.
    ///
    /// @return true exactly once, and only if initialization was attempted
    public boolean claimCleanup() {
        return status == LifecycleStatus.DONE && cleanupClaimed.compareAndSet(false, true);
    }

    public LifecycleStatus getStatus() {
        return status;
    }

    /// Returns the cached initialize failure.
    ///
    /// @return failure, or empty when initialization has not failed
    public Optional<ScopeFailure> getFailure() {
        return Optional.ofNullable(failure);
    }

    /// Returns the inspection failure found while resolving this scope.
    ///
    /// @return inspection failure, or empty when every binding is valid
    public Optional<LifecycleInspectionException> getInspectionFailure() {
        return Optional.ofNullable(inspectionFailure);
    }

    /// Returns the initialize bindings, outermost first.
    ///
    /// @return initialize chain, never null
    public List<LifecycleBinding> getInitializeChain() {
        return initializeChain;
    }

    /// Returns the cleanup bindings, innermost first.
    ///
    /// @return cleanup chain, never null
    public List<LifecycleBinding> getCleanupChain() {
        return cleanupChain;
    }

    /// Returns the failure kind reported when this scope fails to initialize.
    ///
    /// @return failure kind, never null
    protected abstract FailureKind initializeFailureKind();

    /// Returns a short label for log messages.
    ///
    /// @return label, never null
    protected abstract String describe();

    /// Runs an initialize chain.
    @FunctionalInterface
    public interface Initializer {

        /// Runs `chain` in order, stopping at the first failing binding.
        ///
        /// @param chain bindings to run, outermost first, not null
        /// @return the failure, or null on success
        ScopeFailure initialize(List<LifecycleBinding> chain);
    }
}
