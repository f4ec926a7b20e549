package fr.lapetina.llm.verifier.domain.adapter;

import fr.lapetina.llm.verifier.domain.model.StreamingChunk;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkStreamTest {

    private static final EventDecoder CONTENT_DECODER =
            event -> EventDecoder.Decoded.of(AdapterSupport.text(event.path("c")), event.path("end").asBoolean());

    @Test
    @DisplayName("should skip comments and blank lines and stop at [DONE]")
    void shouldStopAtDone() {
        ChunkStream stream = streamOf(": keep-alive\n\nevent: message\ndata: {\"c\":\"a\"}\n\n"
                + "data: [DONE]\ndata: {\"c\":\"after\"}\n");

        assertThat(stream.stream().map(StreamingChunk::content).toList()).containsExactly("a", "");
        assertThat(stream.isClosed()).isTrue();
    }

    @Test
    @DisplayName("should yield an error chunk for malformed JSON and keep parsing")
    void shouldContinueAfterMalformedLine() {
        ChunkStream stream = streamOf("data: {not json}\ndata: {\"c\":\"b\"}\n");

        Iterator<StreamingChunk> it = stream.iterator();

        StreamingChunk first = it.next();
        assertThat(first.isError()).isTrue();
        assertThat(first.error()).startsWith("Malformed stream event");
        assertThat(it.next().content()).isEqualTo("b");
        // end of body without [DONE] still terminates
        assertThat(it.next().finish()).isTrue();
        assertThat(it.hasNext()).isFalse();
    }

    @Test
    @DisplayName("should refuse a second iteration")
    void shouldNotBeRestartable() {
        ChunkStream stream = streamOf("data: [DONE]\n");
        stream.iterator();

        assertThatThrownBy(stream::iterator).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("should read lazily, one chunk per request")
    void shouldReadLazily() throws Exception {
        PipedOutputStream producer = new PipedOutputStream();
        PipedInputStream body = new PipedInputStream(producer);
        ChunkStream stream = new ChunkStream(body, CONTENT_DECODER, AdapterSupport.newObjectMapper());
        Iterator<StreamingChunk> it = stream.iterator();

        producer.write("data: {\"c\":\"first\"}\n".getBytes(StandardCharsets.UTF_8));
        producer.flush();
        assertThat(it.next().content()).isEqualTo("first");

        producer.write("data: {\"c\":\"second\",\"end\":true}\n".getBytes(StandardCharsets.UTF_8));
        producer.flush();
        assertThat(it.next().content()).isEqualTo("second");
        assertThat(it.next().finish()).isTrue();
        assertThat(stream.isClosed()).isTrue();
        producer.close();
    }

    @Test
    @DisplayName("should end quietly when closed from another thread while blocked")
    void shouldEndWhenClosedConcurrently() throws Exception {
        CountDownLatch closed = new CountDownLatch(1);
        InputStream body = new InputStream() {
            @Override
            public int read() throws IOException {
                try {
                    closed.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                throw new IOException("stream closed");
            }

            @Override
            public void close() {
                closed.countDown();
            }
        };
        ChunkStream stream = new ChunkStream(body, CONTENT_DECODER, AdapterSupport.newObjectMapper());

        CompletableFuture<Boolean> consumer = CompletableFuture.supplyAsync(() -> stream.iterator().hasNext());
        Thread.sleep(100);
        stream.close();

        assertThat(consumer.get(5, TimeUnit.SECONDS)).isFalse();
    }

    @Test
    @DisplayName("should surface read failures as UncheckedIOException")
    void shouldSurfaceReadFailures() {
        InputStream failing = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("connection reset");
            }
        };
        ChunkStream stream = new ChunkStream(failing, CONTENT_DECODER, AdapterSupport.newObjectMapper());

        assertThatThrownBy(() -> stream.iterator().hasNext())
                .isInstanceOf(UncheckedIOException.class)
                .hasRootCauseMessage("connection reset");
        assertThat(stream.isClosed()).isTrue();
    }

    private static ChunkStream streamOf(String body) {
        return new ChunkStream(new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)),
                CONTENT_DECODER, AdapterSupport.newObjectMapper());
    }
}
