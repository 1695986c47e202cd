package io.assay.core.output;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("OutputMultiplexer")
class OutputMultiplexerTest {

    private final OutputMultiplexer multiplexer = new OutputMultiplexer();

    @Nested
    @DisplayName("line capture")
    class LineCapture {

        @Test
        @DisplayName("keeps each scope's text separate")
        void shouldIsolateScopes() {
            OutputScope first = multiplexer.openScope();
            OutputScope second = multiplexer.openScope();

            multiplexer.write(first, "one\n");
            multiplexer.write(second, "two\n");

            assertThat(multiplexer.closeScope(first).standardOutput()).isEqualTo("one\n");
            assertThat(multiplexer.closeScope(second).standardOutput()).isEqualTo("two\n");
        }

        @Test
        @DisplayName("flushes an unterminated line when the scope closes")
        void shouldFlushPartialLineOnClose() {
            OutputScope scope = multiplexer.openScope();

            multiplexer.write(scope, "partial");

            assertThat(multiplexer.closeScope(scope).standardOutput())
                    .isEqualTo("partial" + System.lineSeparator());
        }

        @Test
        @DisplayName("separates the trace channel from standard output")
        void shouldSeparateChannels() {
            OutputScope scope = multiplexer.openScope();

            multiplexer.write(scope, OutputChannel.DIAGNOSTIC_TRACE, "trace\n");
            multiplexer.write(scope, "out\n");

            CapturedOutput captured = multiplexer.closeScope(scope);
            assertThat(captured.standardOutput()).isEqualTo("out\n");
            assertThat(captured.diagnosticTrace()).isEqualTo("trace\n");
        }

        @Test
        @DisplayName("ignores text written after the scope closed")
        void shouldDropTextAfterClose() {
            OutputScope scope = multiplexer.openScope();
            multiplexer.closeScope(scope);

            multiplexer.write(scope, "late\n");

            assertThat(scope.isOpen()).isFalse();
            assertThat(scope.snapshot().standardOutput()).isEmpty();
        }
    }

    @Nested
    @DisplayName("nesting")
    class Nesting {

        @Test
        @DisplayName("records a child's lines in its open parent")
        void shouldPropagateToParent() {
            OutputScope parent = multiplexer.openScope();
            OutputScope child = multiplexer.openScope(parent);

            multiplexer.write(child, "from child\n");
            multiplexer.closeScope(child);
            multiplexer.write(parent, "from parent\n");

            assertThat(multiplexer.closeScope(parent).standardOutput())
                    .isEqualTo("from child\nfrom parent\n");
        }
    }

    @Nested
    @DisplayName("concurrency")
    class Concurrency {

        @Test
        @DisplayName("never mixes characters of lines written by different threads")
        void shouldNotInterleaveLines() throws Exception {
            OutputScope scope = multiplexer.openScope();
            ExecutorService pool = Executors.newFixedThreadPool(4);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> writers = new ArrayList<>();
            try {
                for (int t = 0; t < 4; t++) {
                    String marker = String.valueOf((char) ('a' + t));
                    writers.add(
                            pool.submit(
                                    () -> {
                                        start.await();
                                        for (int i = 0; i < 200; i++) {
                                            multiplexer.write(scope, marker.repeat(5));
                                            multiplexer.write(scope, marker.repeat(5) + "\n");
                                        }
                                        return null;
                                    }));
                }
                start.countDown();
                for (Future<?> writer : writers) {
                    writer.get(10, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            String[] lines = multiplexer.closeScope(scope).standardOutput().split("\n");
            assertThat(lines).hasSize(800);
            assertThat(lines).allMatch(line -> line.matches("([a-d])\\1{9}"));
        }
    }

    @Nested
    @DisplayName("byte streams")
    class ByteStreams {

        @Test
        @DisplayName("decodes characters whose bytes arrive one write at a time")
        void shouldDecodeCharactersWrittenByteByByte() {
            OutputScope scope = multiplexer.openScope();
            PrintStream stream = multiplexer.printStream(scope, OutputChannel.STANDARD_OUTPUT);

            for (byte b : "café € 𝄞\n".getBytes(StandardCharsets.UTF_8)) {
                stream.write(b);
            }

            assertThat(multiplexer.closeScope(scope).standardOutput())
                    .isEqualTo("café € 𝄞\n")
                    .doesNotContain("\uFFFD");
        }

        @Test
        @DisplayName("joins a character split across two writes on the routing stream")
        void shouldJoinSplitCharacterOnRoutingStream() {
            OutputScope scope = multiplexer.openScope();
            PrintStream stream = multiplexer.printStream(OutputChannel.STANDARD_OUTPUT);
            byte[] bytes = "prix: 5€\n".getBytes(StandardCharsets.UTF_8);
            int split = bytes.length - 2;

            try (OutputMultiplexer.Binding ignored = multiplexer.bind(scope)) {
                stream.write(bytes, 0, split);
                stream.write(bytes, split, bytes.length - split);
            }

            assertThat(multiplexer.closeScope(scope).standardOutput()).isEqualTo("prix: 5€\n");
        }
    }

    @Nested
    @DisplayName("thread routing")
    class ThreadRouting {

        @Test
        @DisplayName("routes a routing stream to the scope bound on the writing thread")
        void shouldRouteToBoundScope() {
            OutputScope scope = multiplexer.openScope();
            PrintStream stream = multiplexer.printStream(OutputChannel.STANDARD_OUTPUT);

            try (OutputMultiplexer.Binding ignored = multiplexer.bind(scope)) {
                stream.println("bound");
            }

            assertThat(multiplexer.currentScope()).isNull();
            assertThat(multiplexer.closeScope(scope).standardOutput()).contains("bound");
        }

        @Test
        @DisplayName("sends unscoped text to the fallback stream")
        void shouldUseFallbackWhenUnbound() {
            ByteArrayOutputStream sink = new ByteArrayOutputStream();
            OutputMultiplexer withFallback =
                    new OutputMultiplexer(new PrintStream(sink, true, StandardCharsets.UTF_8));

            withFallback.printStream(OutputChannel.STANDARD_OUTPUT).print("loose");

            assertThat(sink.toString(StandardCharsets.UTF_8)).isEqualTo("loose");
        }

        @Test
        @DisplayName("restores the previous binding when a nested binding closes")
        void shouldRestorePreviousBinding() {
            OutputScope outer = multiplexer.openScope();
            OutputScope inner = multiplexer.openScope();

            try (OutputMultiplexer.Binding outerBinding = multiplexer.bind(outer)) {
                try (OutputMultiplexer.Binding innerBinding = multiplexer.bind(inner)) {
                    assertThat(multiplexer.currentScope()).isSameAs(inner);
                }
                assertThat(multiplexer.currentScope()).isSameAs(outer);
            }
        }
    }
}
