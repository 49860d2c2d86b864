package in.feedconv.infrastructure.algoseek;

import in.feedconv.application.port.output.StreamProvider;
import in.feedconv.application.port.output.SymbolResolver;
import in.feedconv.domain.model.FuturesTick;
import in.feedconv.domain.model.TickType;
import in.feedconv.infrastructure.symbol.FutureTickerParser;
import in.feedconv.infrastructure.symbol.SymbolPropertiesDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("AlgoSeek futures reader")
class AlgoSeekFuturesReaderTest {

    private static final String HEADER = "Timestamp,Ticker,Type,Side,SecurityID,Quantity,Price";

    private static final Map<String, BigDecimal> MULTIPLIERS = Map.of(
        "ES", BigDecimal.ONE,
        "NQ", new BigDecimal("2.0"),
        "VX", BigDecimal.ONE);

    private SymbolResolver symbolResolver;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2023-06-15T00:00:00Z"), ZoneOffset.UTC);
        symbolResolver = new FutureTickerParser(SymbolPropertiesDatabase.fromClasspath(), clock);
    }

    private static InputStream content(String... lines) {
        return new ByteArrayInputStream((String.join("\n", lines) + "\n").getBytes(StandardCharsets.UTF_8));
    }

    private AlgoSeekFuturesReader reader(Set<String> filter, String... lines) throws IOException {
        return new AlgoSeekFuturesReader(content(lines), MULTIPLIERS, filter, symbolResolver);
    }

    private static List<FuturesTick> drain(AlgoSeekFuturesReader reader) {
        List<FuturesTick> ticks = new ArrayList<>();
        reader.forEachRemaining(ticks::add);
        return ticks;
    }

    @Test
    void convertsSingleTrade() throws IOException {
        try (AlgoSeekFuturesReader reader = reader(null, HEADER, "20230615093012123,ESU3,2,,123,5,450000000000")) {
            assertTrue(reader.hasNext());

            FuturesTick tick = reader.next();
            assertEquals(TickType.TRADE, tick.tickType());
            assertEquals("ES", tick.symbol().root());
            assertEquals("cme", tick.symbol().market());
            assertEquals(YearMonth.of(2023, 9), tick.symbol().contractMonth());
            assertEquals(LocalDateTime.of(2023, 6, 15, 9, 30, 12, 123_000_000), tick.time());
            assertEquals(0, new BigDecimal("45").compareTo(tick.value()));
            assertEquals(5L, tick.quantity());

            assertFalse(reader.hasNext());
            assertNull(reader.current());
            assertThrows(NoSuchElementException.class, reader::next);
        }
    }

    @Test
    void skipsRejectedRowsAndKeepsGoing() throws IOException {
        try (AlgoSeekFuturesReader reader = reader(null,
                HEADER,
                "20230615093012120,ES U3 C4500,2,,900,1,10000000000",
                "20230615093012121,ESU3-ESZ3,2,,901,1,10000000000",
                "20230615093012122,ESU3,2",
                "20230615093012123,ESU3,2,,123,5,450000000000",
                "20230615093012124,ESU3,7,,123,5,450000000000",
                "20230615093012125,ESU3,1,X,123,5,450000000000",
                "not a timestamp,ESU3,2,,123,5,450000000000",
                "20230615093012126,CLQ3,2,,777,5,450000000000",
                "20230615093012127,NQU3,1,B,456,10,123450000000000",
                "20230615093012128,NQU3,1,S,456,4,123500000000000",
                "20230615093012129,ESU3,11,,123,250000,0",
                "20230615093012130,VXN3,2,,200,3,13.55")) {

            List<FuturesTick> ticks = drain(reader);

            assertEquals(5, ticks.size());
            assertEquals(List.of(TickType.TRADE, TickType.QUOTE, TickType.QUOTE, TickType.OPEN_INTEREST, TickType.TRADE),
                ticks.stream().map(FuturesTick::tickType).collect(Collectors.toList()));

            FuturesTick bid = ticks.get(1);
            assertEquals(0, new BigDecimal("24690").compareTo(bid.bidPrice()));
            assertEquals(10L, bid.bidSize());
            assertNull(bid.askPrice());

            FuturesTick ask = ticks.get(2);
            assertEquals(0, new BigDecimal("24700").compareTo(ask.askPrice()));
            assertEquals(4L, ask.askSize());
            assertNull(ask.bidPrice());

            FuturesTick openInterest = ticks.get(3);
            assertEquals(0, new BigDecimal("250000").compareTo(openInterest.value()));
            assertEquals("cme", openInterest.exchange());

            FuturesTick vix = ticks.get(4);
            assertEquals("cfe", vix.symbol().market());
            assertEquals(0, new BigDecimal("13.55").compareTo(vix.value()));

            assertEquals(12, reader.linesRead());
            assertEquals(5, reader.ticksEmitted());
        }
    }

    @Test
    void honoursColumnOrderFromHeader() throws IOException {
        try (AlgoSeekFuturesReader reader = reader(null,
                "Price,Quantity,Exchange,Side,Type,Ticker,SecurityID,Timestamp",
                "450000000000,5,XCME,,2,ESU3,123,20230615093012123")) {

            FuturesTick tick = reader.next();
            assertEquals(TickType.TRADE, tick.tickType());
            assertEquals(0, new BigDecimal("45").compareTo(tick.value()));
            assertEquals(5, reader.columns().ticker());
        }
    }

    @Test
    void appliesSymbolFilter() throws IOException {
        try (AlgoSeekFuturesReader reader = reader(Set.of("nq"),
                HEADER,
                "20230615093012123,ESU3,2,,123,5,450000000000",
                "20230615093012127,NQU3,2,,456,10,123450000000000")) {

            List<FuturesTick> ticks = drain(reader);
            assertEquals(1, ticks.size());
            assertEquals("NQ", ticks.get(0).symbol().root());
        }
    }

    @Test
    void byteOrderMarkOnHeaderIsIgnored() throws IOException {
        try (AlgoSeekFuturesReader reader = reader(null,
                "\uFEFF" + HEADER,
                "20230615093012123,ESU3,2,,123,5,450000000000")) {

            assertEquals(0, reader.columns().timestamp());
            assertTrue(reader.hasNext());
            assertEquals(TickType.TRADE, reader.next().tickType());
        }
    }

    @Test
    void openInterestWithBlankPriceIsKept() throws IOException {
        try (AlgoSeekFuturesReader reader = reader(null,
                HEADER,
                "20230615093012123,ESU3,11,,123,250000,")) {

            List<FuturesTick> ticks = drain(reader);
            assertEquals(1, ticks.size());
            assertEquals(TickType.OPEN_INTEREST, ticks.get(0).tickType());
            assertEquals(0, new BigDecimal("250000").compareTo(ticks.get(0).value()));
        }
    }

    @Test
    void failedConstructionClosesStream() {
        byte[] header = (HEADER + "\n").getBytes(StandardCharsets.UTF_8);
        int[] closeCount = {0};
        InputStream failsAfterHeader = new InputStream() {
            private boolean served;

            @Override
            public int read() throws IOException {
                throw new IOException("disk gone");
            }

            @Override
            public int read(byte[] b, int off, int len) throws IOException {
                if (served) {
                    throw new IOException("disk gone");
                }
                served = true;
                System.arraycopy(header, 0, b, off, header.length);
                return header.length;
            }

            @Override
            public void close() {
                closeCount[0]++;
            }
        };

        assertThrows(UncheckedIOException.class,
            () -> new AlgoSeekFuturesReader(failsAfterHeader, MULTIPLIERS, null, symbolResolver));
        assertEquals(1, closeCount[0]);
    }

    @Test
    void emptyStreamIsExhaustedImmediately() throws IOException {
        try (AlgoSeekFuturesReader reader = new AlgoSeekFuturesReader(
                new ByteArrayInputStream(new byte[0]), MULTIPLIERS, null, symbolResolver)) {
            assertFalse(reader.hasNext());
            assertFalse(reader.columns().isResolved());
        }
    }

    @Test
    void missingHeaderRejectsEveryRow() throws IOException {
        try (AlgoSeekFuturesReader reader = reader(null,
                "",
                "20230615093012123,ESU3,2,,123,5,450000000000")) {
            assertFalse(reader.hasNext());
            assertEquals(1, reader.linesRead());
        }
    }

    @Test
    void sameInputGivesSameTicks() throws IOException {
        String[] lines = {
            HEADER,
            "20230615093012123,ESU3,2,,123,5,450000000000",
            "20230615093012127,NQU3,1,B,456,10,123450000000000",
            "20230615093012129,ESU3,11,,123,250000,0"
        };

        List<FuturesTick> first;
        List<FuturesTick> second;
        try (AlgoSeekFuturesReader reader = reader(null, lines)) {
            first = drain(reader);
        }
        try (AlgoSeekFuturesReader reader = reader(null, lines)) {
            second = drain(reader);
        }

        assertEquals(3, first.size());
        assertEquals(first, second);
    }

    @Test
    void streamClosesReader() throws IOException {
        CountingStream stream = new CountingStream(content(
            HEADER,
            "20230615093012123,ESU3,2,,123,5,450000000000",
            "20230615093012124,ESU3,2,,123,6,450000000000"));
        AlgoSeekFuturesReader reader = new AlgoSeekFuturesReader(stream, MULTIPLIERS, null, symbolResolver);

        long total;
        try (var ticks = reader.stream()) {
            total = ticks.mapToLong(FuturesTick::quantity).sum();
        }

        assertEquals(11, total);
        assertEquals(1, stream.closeCount);
    }

    @Test
    void closeIsIdempotentAndStopsIteration() throws IOException {
        CountingStream stream = new CountingStream(content(
            HEADER,
            "20230615093012123,ESU3,2,,123,5,450000000000",
            "20230615093012124,ESU3,2,,123,6,450000000000"));
        AlgoSeekFuturesReader reader = new AlgoSeekFuturesReader(stream, MULTIPLIERS, null, symbolResolver);
        assertTrue(reader.hasNext());

        reader.close();
        reader.close();

        assertEquals(1, stream.closeCount);
        assertFalse(reader.hasNext());
        assertFalse(reader.advance());
        assertNull(reader.current());
    }

    @Test
    void readFailureSurfacesToCaller() {
        byte[] good = (HEADER + "\n20230615093012123,ESU3,2,,123,5,450000000000\n").getBytes(StandardCharsets.UTF_8);
        InputStream failing = new InputStream() {
            private boolean served;

            @Override
            public int read() throws IOException {
                throw new IOException("disk gone");
            }

            @Override
            public int read(byte[] b, int off, int len) throws IOException {
                if (served) {
                    throw new IOException("disk gone");
                }
                served = true;
                System.arraycopy(good, 0, b, off, good.length);
                return good.length;
            }
        };

        assertThrows(UncheckedIOException.class, () -> {
            try (AlgoSeekFuturesReader reader = new AlgoSeekFuturesReader(failing, MULTIPLIERS, null, symbolResolver)) {
                drain(reader);
            }
        });
    }

    @Test
    void openFailurePropagates() throws IOException {
        StreamProvider provider = mock(StreamProvider.class);
        when(provider.open(any())).thenThrow(new FileNotFoundException("missing.csv.gz"));

        assertThrows(FileNotFoundException.class,
            () -> AlgoSeekFuturesReader.open(Path.of("missing.csv.gz"), provider, MULTIPLIERS, null, symbolResolver));
    }

    @Test
    void openReadsThroughProvider() throws IOException {
        StreamProvider provider = mock(StreamProvider.class);
        when(provider.open(Path.of("ES.csv"))).thenReturn(content(HEADER, "20230615093012123,ESU3,2,,123,5,450000000000"));

        try (AlgoSeekFuturesReader reader = AlgoSeekFuturesReader.open(
                Path.of("ES.csv"), provider, MULTIPLIERS, null, symbolResolver)) {
            assertEquals(1, drain(reader).size());
        }
    }

    private static final class CountingStream extends java.io.FilterInputStream {
        int closeCount;

        CountingStream(InputStream in) {
            super(in);
        }

        @Override
        public void close() throws IOException {
            closeCount++;
            super.close();
        }
    }
}
