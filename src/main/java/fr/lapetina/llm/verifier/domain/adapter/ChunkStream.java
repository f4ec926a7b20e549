package fr.lapetina.llm.verifier.domain.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.llm.verifier.domain.model.StreamingChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, single-use sequence of {@link StreamingChunk}s read from a server-sent-event body.
 *
 * <p>Lines are read only when the consumer asks for the next chunk. The underlying
 * stream is closed when:
 * <ul>
 *   <li>{@code data: [DONE]} or a provider finish signal is read</li>
 *   <li>the body ends</li>
 *   <li>{@link #close()} is called, from any thread</li>
 * </ul>
 * Malformed JSON on a line yields an error chunk; parsing continues with the next line.
 * An I/O failure while reading surfaces as {@link UncheckedIOException}.
 */
public final class ChunkStream implements Iterable<StreamingChunk>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ChunkStream.class);

    private static final String DATA_PREFIX = "data:";
    private static final String DONE_MARKER = "[DONE]";

    private final InputStream source;
    private final BufferedReader reader;
    private final EventDecoder decoder;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean iteratorCreated = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Deque<StreamingChunk> pending = new ArrayDeque<>(2);
    private boolean terminated;

    public ChunkStream(InputStream source, EventDecoder decoder, ObjectMapper objectMapper) {
        this.source = source;
        this.reader = new BufferedReader(new InputStreamReader(source, StandardCharsets.UTF_8));
        this.decoder = decoder;
        this.objectMapper = objectMapper;
    }

    /**
     * Returns the one and only iterator over this stream.
     *
     * @throws IllegalStateException if called a second time
     */
    @Override
    public Iterator<StreamingChunk> iterator() {
        if (!iteratorCreated.compareAndSet(false, true)) {
            throw new IllegalStateException("ChunkStream is not restartable");
        }
        return new ChunkIterator();
    }

    /**
     * Stream view; closing the returned stream closes the body.
     */
    public Stream<StreamingChunk> stream() {
        Spliterator<StreamingChunk> spliterator = Spliterators.spliteratorUnknownSize(
                iterator(), Spliterator.ORDERED | Spliterator.NONNULL);
        return StreamSupport.stream(spliterator, false).onClose(this::close);
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            // Close the raw stream, not the reader: a blocked readLine holds the reader's lock
            try {
                source.close();
            } catch (IOException e) {
                log.debug("Error closing stream body: {}", e.getMessage());
            }
        }
    }

    private StreamingChunk advance() {
        if (!pending.isEmpty()) {
            return pending.poll();
        }
        while (!terminated) {
            if (closed.get()) {
                terminated = true;
                return null;
            }
            String line;
            try {
                line = reader.readLine();
            } catch (IOException e) {
                terminated = true;
                boolean closedByConsumer = closed.get();
                close();
                if (closedByConsumer) {
                    return null;
                }
                throw new UncheckedIOException("Stream read failed", e);
            }

            if (line == null) {
                terminated = true;
                boolean closedByConsumer = closed.get();
                close();
                return closedByConsumer ? null : StreamingChunk.terminal();
            }

            line = line.strip();
            if (line.isEmpty() || line.startsWith(":") || !line.startsWith(DATA_PREFIX)) {
                continue;
            }

            String data = line.substring(DATA_PREFIX.length()).strip();
            if (DONE_MARKER.equals(data)) {
                return finish(null);
            }

            JsonNode event;
            try {
                event = objectMapper.readTree(data);
            } catch (JsonProcessingException e) {
                return StreamingChunk.error("Malformed stream event: " + e.getOriginalMessage());
            }

            EventDecoder.Decoded decoded = decoder.decode(event);
            if (decoded.error() != null) {
                return StreamingChunk.error(decoded.error());
            }
            if (decoded.finished()) {
                return finish(decoded.content());
            }
            if (!decoded.content().isEmpty()) {
                return StreamingChunk.content(decoded.content());
            }
        }
        return null;
    }

    private StreamingChunk finish(String lastContent) {
        terminated = true;
        close();
        if (lastContent != null && !lastContent.isEmpty()) {
            pending.add(StreamingChunk.terminal());
            return StreamingChunk.content(lastContent);
        }
        return StreamingChunk.terminal();
    }

    private final class ChunkIterator implements Iterator<StreamingChunk> {
        private StreamingChunk next;

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public StreamingChunk next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            StreamingChunk current = next;
            next = null;
            return current;
        }
    }
}
