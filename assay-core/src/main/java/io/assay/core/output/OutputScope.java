package io.assay.core.output;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/// A capture surface, typically one per case.
///
/// Complete lines are appended under the scope's monitor; partial lines are kept per
/// writing thread until their terminator arrives. Scopes are created and closed
/// through {@link OutputMultiplexer}.
public final class OutputScope {

    private final long id;
    private final OutputScope parent;
    private final Map<OutputChannel, StringBuilder> lines = new EnumMap<>(OutputChannel.class);
    private final Map<PendingKey, StringBuilder> pending = new ConcurrentHashMap<>();
    private boolean open = true;

    OutputScope(long id, OutputScope parent) {
        this.id = id;
        this.parent = parent;
        for (OutputChannel channel : OutputChannel.values()) {
            lines.put(channel, new StringBuilder());
        }
    }

    public long getId() {
        return id;
    }

    /// Returns the enclosing scope.
    ///
    /// @return parent scope, or null for a top-level scope
    public OutputScope getParent() {
        return parent;
    }

    public synchronized boolean isOpen() {
        return open;
    }

    StringBuilder pendingFor(OutputChannel channel) {
        return pending.computeIfAbsent(
                new PendingKey(Thread.currentThread().getId(), channel), k -> new StringBuilder());
    }

    Map<PendingKey, StringBuilder> pending() {
        return pending;
    }

    /// Appends a complete line if the scope is still open.
    ///
    /// @return true if the line was recorded
    synchronized boolean appendLine(OutputChannel channel, String line) {
        if (!open) {
            return false;
        }
        lines.get(channel).append(line);
        return true;
    }

    synchronized CapturedOutput close() {
        open = false;
        return snapshot();
    }

    synchronized CapturedOutput snapshot() {
        return new CapturedOutput(
                lines.get(OutputChannel.STANDARD_OUTPUT).toString(),
                lines.get(OutputChannel.DIAGNOSTIC_TRACE).toString());
    }

    @Override
    public String toString() {
        return "OutputScope{" + id + (parent != null ? ", parent=" + parent.id : "") + '}';
    }

    record PendingKey(long threadId, OutputChannel channel) {}
}
