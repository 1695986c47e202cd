package io.assay.core.execution;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/// Cooperative cancellation signal.
///
/// A run owns a root handle; every case gets a child of it, so cancelling the run
/// reaches every in-flight case while a case timeout only cancels that case. A child
/// is released once its case finishes, which unlinks it from its parent.
///
/// {@snippet :
/// while (!context.getCancellation().isCancellationRequested()) {
///     pollOnce();
/// }
/// }
///
/// @implNote Thread-safe. Callbacks run on the cancelling thread.
public final class CancellationHandle {

    private static final Logger logger = Logger.getLogger(CancellationHandle.class.getName());

    private final CancellationHandle parent;
    private final Runnable link;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    private CancellationHandle(CancellationHandle parent) {
        this.parent = parent;
        this.link = parent != null ? this::cancel : null;
    }

    /// Creates a root handle.
    ///
    /// @return new handle, never null
    public static CancellationHandle create() {
        return new CancellationHandle(null);
    }

    /// Creates a handle that is also cancelled when this one is.
    ///
    /// @return new child handle, never null
    public CancellationHandle child() {
        CancellationHandle child = new CancellationHandle(this);
        onCancel(child.link);
        return child;
    }

    /// Unlinks this handle from its parent so the parent no longer holds a callback for it.
    ///
    /// No-op for a root handle and on repeated calls.
    public void release() {
        if (parent != null) {
            parent.callbacks.remove(link);
        }
    }

    /// Requests cancellation and runs the registered callbacks once.
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        for (Runnable callback : callbacks) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                logger.warning("Cancellation callback failed: " + e);
            }
        }
    }

    int registeredCallbacks() {
        return callbacks.size();
    }

    public boolean isCancellationRequested() {
        return cancelled.get() || (parent != null && parent.isCancellationRequested());
    }

    /// Registers `callback` to run on cancellation; runs it now if already cancelled.
    ///
    /// @param callback action to run, not null
    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback)) {
            callback.run();
        }
    }

    /// Throws if cancellation was requested.
    ///
    /// @throws CaseCancelledException if this handle or an ancestor was cancelled
    public void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new CaseCancelledException("Cancellation was requested");
        }
    }
}
