package io.assay.core.output;

import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/// Routes text from concurrently running cases into per-case scopes.
///
/// ### Contracts
/// - A captured line never mixes characters from two writer threads
/// - A line written to a scope is also recorded by every enclosing scope that is still open
/// - Closing a scope flushes unterminated text and leaves lines already recorded by
///   enclosing scopes untouched
///
/// ### Thread routing
/// {@link #bind(OutputScope)} makes a scope current for the calling thread. Streams from
/// {@link #printStream(OutputChannel)} write to whichever scope is current on the thread
/// that writes, so code running on a timeout-boundary thread reaches the right case once
/// the boundary has bound the case's scope.
///
/// @implNote Thread-safe. Text written with no current scope goes to the fallback stream.
public final class OutputMultiplexer {

    private static final Logger logger = Logger.getLogger(OutputMultiplexer.class.getName());

    private final AtomicLong ids = new AtomicLong();
    private final ThreadLocal<OutputScope> current = new ThreadLocal<>();
    private final PrintStream fallback;

    /// Creates a multiplexer whose unscoped text goes to the process standard output.
    public OutputMultiplexer() {
        this(System.out);
    }

    /// Creates a multiplexer with an explicit fallback for unscoped text.
    ///
    /// @param fallback receives text written outside any scope, not null
    public OutputMultiplexer(PrintStream fallback) {
        this.fallback = fallback;
    }

    /// Opens a top-level scope.
    ///
    /// @return new open scope, never null
    public OutputScope openScope() {
        return openScope(null);
    }

    /// Opens a scope nested in `parent`.
    ///
    /// @param parent enclosing scope, may be null
    /// @return new open scope, never null
    public OutputScope openScope(OutputScope parent) {
        OutputScope scope = new OutputScope(ids.incrementAndGet(), parent);
        logger.finest(() -> "Opened " + scope);
        return scope;
    }

    /// Writes standard output text to `scope`.
    ///
    /// @param scope target scope, not null
    /// @param text text to write, not null
    public void write(OutputScope scope, String text) {
        write(scope, OutputChannel.STANDARD_OUTPUT, text);
    }

    /// Writes text on `channel` to `scope`.
    ///
    /// Text is held per writer thread until a line terminator arrives; each complete
    /// line is then appended in one step.
    ///
    /// @param scope target scope, not null
    /// @param channel output channel, not null
    /// @param text text to write, not null
    public void write(OutputScope scope, OutputChannel channel, String text) {
        if (text.isEmpty()) {
            return;
        }
        StringBuilder pending = scope.pendingFor(channel);
        List<String> complete = new ArrayList<>();
        synchronized (pending) {
            pending.append(text);
            int newline;
            while ((newline = pending.indexOf("\n")) >= 0) {
                complete.add(pending.substring(0, newline + 1));
                pending.delete(0, newline + 1);
            }
        }
        for (String line : complete) {
            appendLine(scope, channel, line);
        }
    }

    /// Closes `scope`, flushing any unterminated text it holds.
    ///
    /// @param scope scope to close, not null
    /// @return text the scope recorded, never null
    public CapturedOutput closeScope(OutputScope scope) {
        for (Map.Entry<OutputScope.PendingKey, StringBuilder> entry : scope.pending().entrySet()) {
            String remainder;
            StringBuilder pending = entry.getValue();
            synchronized (pending) {
                remainder = pending.toString();
                pending.setLength(0);
            }
            if (!remainder.isEmpty()) {
                appendLine(scope, entry.getKey().channel(), remainder + System.lineSeparator());
            }
        }
        scope.pending().clear();
        CapturedOutput captured = scope.close();
        logger.finest(() -> "Closed " + scope);
        return captured;
    }

    /// Makes `scope` current for the calling thread until the binding is closed.
    ///
    /// @param scope scope to bind, may be null to unbind
    /// @return binding restoring the previous scope on close, never null
    public Binding bind(OutputScope scope) {
        OutputScope previous = current.get();
        current.set(scope);
        return () -> {
            if (previous == null) {
                current.remove();
            } else {
                current.set(previous);
            }
        };
    }

    /// Returns the scope bound to the calling thread.
    ///
    /// @return current scope, or null when none is bound
    public OutputScope currentScope() {
        return current.get();
    }

    /// Returns a stream that writes to the scope current on the writing thread.
    ///
    /// @param channel channel to write to, not null
    /// @return auto-flushing UTF-8 print stream, never null
    public PrintStream printStream(OutputChannel channel) {
        return new PrintStream(new RoutingStream(channel), true, StandardCharsets.UTF_8);
    }

    /// Returns a stream that always writes to `scope`, whatever thread writes.
    ///
    /// @param scope target scope, not null
    /// @param channel channel to write to, not null
    /// @return auto-flushing UTF-8 print stream, never null
    public PrintStream printStream(OutputScope scope, OutputChannel channel) {
        return new PrintStream(new ScopedStream(scope, channel), true, StandardCharsets.UTF_8);
    }

    private void appendLine(OutputScope scope, OutputChannel channel, String line) {
        for (OutputScope target = scope; target != null; target = target.getParent()) {
            target.appendLine(channel, line);
        }
    }

    /// Restores the previous thread binding when closed.
    @FunctionalInterface
    public interface Binding extends AutoCloseable {
        @Override
        void close();
    }

    /// Stateful UTF-8 decoder for one writer thread; holds back the bytes of a character
    /// split across writes until the rest arrives.
    private static final class Utf8Decoder {
        private final CharsetDecoder decoder =
                StandardCharsets.UTF_8
                        .newDecoder()
                        .onMalformedInput(CodingErrorAction.REPLACE)
                        .onUnmappableCharacter(CodingErrorAction.REPLACE);
        private byte[] carry = new byte[0];

        String decode(byte[] b, int off, int len) {
            ByteBuffer in = ByteBuffer.allocate(carry.length + len);
            in.put(carry).put(b, off, len).flip();
            CharBuffer out = CharBuffer.allocate(in.remaining());
            decoder.decode(in, out, false);
            carry = new byte[in.remaining()];
            in.get(carry);
            return out.flip().toString();
        }
    }

    private final class ScopedStream extends OutputStream {
        private final OutputScope scope;
        private final OutputChannel channel;
        private final ThreadLocal<Utf8Decoder> decoders =
                ThreadLocal.withInitial(Utf8Decoder::new);

        private ScopedStream(OutputScope scope, OutputChannel channel) {
            this.scope = scope;
            this.channel = channel;
        }

        @Override
        public void write(int b) {
            write(new byte[] {(byte) b}, 0, 1);
        }

        @Override
        public void write(byte[] b, int off, int len) {
            OutputMultiplexer.this.write(scope, channel, decoders.get().decode(b, off, len));
        }
    }

    private final class RoutingStream extends OutputStream {
        private final OutputChannel channel;
        private final ThreadLocal<Utf8Decoder> decoders =
                ThreadLocal.withInitial(Utf8Decoder::new);

        private RoutingStream(OutputChannel channel) {
            this.channel = channel;
        }

        @Override
        public void write(int b) {
            write(new byte[] {(byte) b}, 0, 1);
        }

        @Override
        public void write(byte[] b, int off, int len) {
            String text = decoders.get().decode(b, off, len);
            OutputScope scope = current.get();
            if (scope == null) {
                fallback.print(text);
            } else {
                OutputMultiplexer.this.write(scope, channel, text);
            }
        }
    }
}
