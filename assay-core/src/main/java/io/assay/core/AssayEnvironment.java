package io.assay.core;

import io.assay.core.descriptor.MetadataResolver;
import java.util.concurrent.ExecutorService;

/// Container holding the engine and the resources it runs on.
///
/// Implements {@link AutoCloseable} to release the timeout boundary pool.
///
/// ### Contracts
/// - **Precondition**: All constructor parameters must be non-null
/// - **Invariant**: Component references are immutable after construction
///
/// @apiNote Create instances via {@link AssayFactory#createEnvironment(MetadataResolver)}
/// or {@link AssayFactory.Builder} rather than direct construction.
public final class AssayEnvironment implements AutoCloseable {

    private final AssayEngine engine;
    private final ExecutorService boundaryExecutor;

    /// Creates an environment.
    ///
    /// @param engine the configured engine, not null
    /// @param boundaryExecutor pool backing the engine's timeout boundary, not null
    public AssayEnvironment(AssayEngine engine, ExecutorService boundaryExecutor) {
        this.engine = engine;
        this.boundaryExecutor = boundaryExecutor;
    }

    public AssayEngine getEngine() {
        return engine;
    }

    public ExecutorService getBoundaryExecutor() {
        return boundaryExecutor;
    }

    /// Shuts down the boundary pool.
    ///
    /// @implNote Does not block. Work abandoned after a timeout keeps running on its
    /// daemon thread until it exits on its own.
    @Override
    public void close() {
        boundaryExecutor.shutdownNow();
    }
}
