package io.assay.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.assay.core.AssayConfig;
import io.assay.core.result.CaseResult;
import io.assay.core.result.ResultSink;
import io.assay.core.result.RunSummary;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/// Result sink writing one compact JSON outcome record per line.
///
/// ### Contracts
/// - Each recorded result becomes exactly one line, written whole
/// - The writer is flushed when the run completes
///
/// @implNote Thread-safe; writes are serialized on the sink.
public final class JsonLinesResultSink implements ResultSink, Closeable {

    private static final Logger logger = Logger.getLogger(JsonLinesResultSink.class.getName());

    private final Writer writer;
    private final boolean traceCaptured;
    private final ObjectMapper mapper = OutcomeRecordSerializer.createMapper();

    /// Creates a sink writing to `writer`.
    ///
    /// @param writer destination, not null; closed by {@link #close()}
    /// @param traceCaptured whether trace capture was enabled for the run
    public JsonLinesResultSink(Writer writer, boolean traceCaptured) {
        this.writer = writer;
        this.traceCaptured = traceCaptured;
    }

    /// Creates a sink writing to `writer` that renders the trace as `config` captures it.
    ///
    /// @param writer destination, not null; closed by {@link #close()}
    /// @param config configuration of the run whose results are written, not null
    public JsonLinesResultSink(Writer writer, AssayConfig config) {
        this(writer, config.isCaptureTrace());
    }

    /// Creates a sink writing UTF-8 lines to `file` for a run configured by `config`.
    ///
    /// @param file destination file, not null
    /// @param config configuration of the run whose results are written, not null
    /// @return new sink, never null
    /// @throws IOException if the file cannot be opened
    public static JsonLinesResultSink toFile(Path file, AssayConfig config) throws IOException {
        return toFile(file, config.isCaptureTrace());
    }

    /// Creates a sink writing UTF-8 lines to `file`, replacing its content.
    ///
    /// @param file destination file, not null
    /// @param traceCaptured whether trace capture was enabled for the run
    /// @return new sink, never null
    /// @throws IOException if the file cannot be opened
    public static JsonLinesResultSink toFile(Path file, boolean traceCaptured)
            throws IOException {
        BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
        return new JsonLinesResultSink(writer, traceCaptured);
    }

    /// Writes `result` as one JSON line.
    ///
    /// @param result the result, not null
    /// @throws UncheckedIOException if the line cannot be written
    @Override
    public synchronized void record(CaseResult result) {
        try {
            writer.write(mapper.writeValueAsString(result.toOutcomeRecord(traceCaptured)));
            writer.write('\n');
        } catch (IOException e) {
            logger.warning(
                    "Failed to write result of "
                            + result.getDescriptor().fullyQualifiedName()
                            + ": "
                            + e.getMessage());
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public synchronized void onRunCompleted(RunSummary summary) {
        try {
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public synchronized void close() throws IOException {
        writer.close();
    }
}
