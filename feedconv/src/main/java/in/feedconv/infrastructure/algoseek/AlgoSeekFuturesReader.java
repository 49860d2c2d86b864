package in.feedconv.infrastructure.algoseek;

import in.feedconv.application.port.output.LineTokenizer;
import in.feedconv.application.port.output.StreamProvider;
import in.feedconv.application.port.output.SymbolResolver;
import in.feedconv.domain.model.FuturesTick;
import in.feedconv.infrastructure.io.CommaLineTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Forward-only reader converting an AlgoSeek futures file into ticks.
 *
 * The header row is read on construction and the first tick is fetched right away.
 * Each advance pulls lines until one produces a tick or the stream ends; rejected
 * rows are skipped. Only one line is held in memory at a time.
 *
 * Not thread-safe. There is no reset: open a new reader to read the file again.
 * The reader owns the stream and closes it in {@link #close()}.
 */
public final class AlgoSeekFuturesReader implements Iterator<FuturesTick>, Closeable {
    private static final Logger log = LoggerFactory.getLogger(AlgoSeekFuturesReader.class);

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private final BufferedReader reader;
    private final HeaderColumns columns;
    private final AlgoSeekLineParser parser;

    private FuturesTick current;
    private boolean closed;
    private long linesRead;
    private long ticksEmitted;

    public AlgoSeekFuturesReader(
        InputStream stream,
        Map<String, BigDecimal> multipliers,
        Set<String> symbolFilter,
        SymbolResolver symbolResolver
    ) throws IOException {
        this(stream, multipliers, symbolFilter, symbolResolver, new CommaLineTokenizer());
    }

    /**
     * @param stream         raw file content; owned by the reader from here on, and closed
     *                       again if construction fails
     * @param multipliers    contract multiplier per root symbol
     * @param symbolFilter   roots to keep (case-insensitive), or null for all
     * @param symbolResolver maps raw tickers to symbols
     * @param tokenizer      splits rows into fields
     * @throws IOException if the header row cannot be read
     */
    public AlgoSeekFuturesReader(
        InputStream stream,
        Map<String, BigDecimal> multipliers,
        Set<String> symbolFilter,
        SymbolResolver symbolResolver,
        LineTokenizer tokenizer
    ) throws IOException {
        Objects.requireNonNull(stream, "stream");
        this.reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8));
        try {
            this.columns = readHeader(reader, tokenizer);
            this.parser = new AlgoSeekLineParser(columns, tokenizer, symbolResolver, multipliers, symbolFilter);
            advance();
        } catch (IOException | RuntimeException e) {
            closed = true;
            try {
                reader.close();
            } catch (IOException closeError) {
                e.addSuppressed(closeError);
            }
            throw e;
        }
    }

    /**
     * Open a feed file and read it.
     */
    public static AlgoSeekFuturesReader open(
        Path file,
        StreamProvider streamProvider,
        Map<String, BigDecimal> multipliers,
        Set<String> symbolFilter,
        SymbolResolver symbolResolver
    ) throws IOException {
        InputStream stream = streamProvider.open(file);
        log.info("[AlgoSeekFuturesReader] Reading {}", file);
        return new AlgoSeekFuturesReader(stream, multipliers, symbolFilter, symbolResolver);
    }

    private static HeaderColumns readHeader(BufferedReader reader, LineTokenizer tokenizer) throws IOException {
        String headerLine = reader.readLine();
        if (headerLine != null && headerLine.startsWith(BYTE_ORDER_MARK)) {
            headerLine = headerLine.substring(BYTE_ORDER_MARK.length());
        }
        if (headerLine == null || headerLine.isEmpty()) {
            log.warn("[AlgoSeekFuturesReader] Missing header row, no columns resolved");
            return HeaderColumns.unresolved();
        }

        HeaderColumns columns = HeaderColumns.resolve(tokenizer.tokenize(headerLine));
        log.debug("[AlgoSeekFuturesReader] Header columns: {}", columns);
        return columns;
    }

    /**
     * Move to the next tick.
     *
     * @return true if a tick is now current, false if the stream is exhausted
     * @throws UncheckedIOException if the underlying stream fails
     */
    public boolean advance() {
        current = null;
        if (closed) {
            return false;
        }

        try {
            String line;
            FuturesTick tick = null;
            while (tick == null && (line = reader.readLine()) != null) {
                linesRead++;
                tick = parser.parse(line);
            }
            current = tick;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read AlgoSeek futures stream", e);
        }

        if (current != null) {
            ticksEmitted++;
        }
        return current != null;
    }

    /**
     * Tick at the current position, or null once exhausted.
     */
    public FuturesTick current() {
        return current;
    }

    public HeaderColumns columns() {
        return columns;
    }

    @Override
    public boolean hasNext() {
        return current != null;
    }

    @Override
    public FuturesTick next() {
        if (current == null) {
            throw new NoSuchElementException("AlgoSeek futures reader is exhausted");
        }
        FuturesTick tick = current;
        advance();
        return tick;
    }

    /**
     * Remaining ticks as a sequential stream. Closing the stream closes the reader.
     */
    public Stream<FuturesTick> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false)
            .onClose(this::closeUnchecked);
    }

    public long linesRead() {
        return linesRead;
    }

    public long ticksEmitted() {
        return ticksEmitted;
    }

    /**
     * Release the underlying stream. Safe to call more than once.
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        current = null;
        log.debug("[AlgoSeekFuturesReader] Closing after {} lines, {} ticks", linesRead, ticksEmitted);
        reader.close();
    }

    private void closeUnchecked() {
        try {
            close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
