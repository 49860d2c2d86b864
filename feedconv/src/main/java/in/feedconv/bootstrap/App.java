package in.feedconv.bootstrap;

import in.feedconv.application.port.output.StreamProvider;
import in.feedconv.application.port.output.SymbolResolver;
import in.feedconv.domain.model.FuturesTick;
import in.feedconv.domain.model.TickType;
import in.feedconv.infrastructure.algoseek.AlgoSeekFuturesReader;
import in.feedconv.infrastructure.io.FileStreamProvider;
import in.feedconv.infrastructure.symbol.FutureTickerParser;
import in.feedconv.infrastructure.symbol.SymbolPropertiesDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Command-line entry point: reads AlgoSeek futures files and logs what they contain.
 *
 * Usage: App &lt;file&gt; [&lt;file&gt; ...]
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    /**
     * Per-file counts.
     */
    public record FileSummary(
        Path file,
        long lines,
        long ticks,
        Map<TickType, Long> byType,
        Map<String, Long> byRoot
    ) {}

    private final StreamProvider streamProvider;
    private final SymbolResolver symbolResolver;
    private final Map<String, BigDecimal> multipliers;
    private final ConverterConfig config;

    public App(StreamProvider streamProvider, SymbolResolver symbolResolver,
               Map<String, BigDecimal> multipliers, ConverterConfig config) {
        this.streamProvider = streamProvider;
        this.symbolResolver = symbolResolver;
        this.multipliers = Map.copyOf(multipliers);
        this.config = config;
    }

    public static void main(String[] args) {
        if (args.length == 0) {
            System.err.println("Usage: App <file> [<file> ...]");
            System.exit(2);
        }

        ConverterConfig config = ConverterConfig.fromEnv();
        SymbolPropertiesDatabase database = config.propertiesFile() != null
            ? SymbolPropertiesDatabase.fromFile(config.propertiesFile())
            : SymbolPropertiesDatabase.fromClasspath();

        App app = new App(
            new FileStreamProvider(),
            new FutureTickerParser(database),
            database.multipliers(),
            config);

        int failures = 0;
        for (String arg : args) {
            try {
                FileSummary summary = app.summarize(Path.of(arg));
                if (summary.ticks() == 0 && config.failOnEmpty()) {
                    log.error("[App] No ticks in {}", arg);
                    failures++;
                }
            } catch (IOException | RuntimeException e) {
                log.error("[App] Failed to read {}: {}", arg, e.getMessage(), e);
                failures++;
            }
        }

        System.exit(failures == 0 ? 0 : 1);
    }

    /**
     * Read one file to the end and count its ticks.
     */
    public FileSummary summarize(Path file) throws IOException {
        long start = System.currentTimeMillis();
        Map<TickType, Long> byType = new EnumMap<>(TickType.class);
        Map<String, Long> byRoot = new TreeMap<>();

        try (AlgoSeekFuturesReader reader = AlgoSeekFuturesReader.open(
                file, streamProvider, multipliers, config.symbolFilter(), symbolResolver)) {
            while (reader.hasNext()) {
                FuturesTick tick = reader.next();
                byType.merge(tick.tickType(), 1L, Long::sum);
                byRoot.merge(tick.symbol().root(), 1L, Long::sum);
            }

            FileSummary summary = new FileSummary(file, reader.linesRead(), reader.ticksEmitted(), byType, byRoot);
            log.info("[App] {}: {} ticks from {} lines in {}ms, by type {}, by root {}",
                file, summary.ticks(), summary.lines(), System.currentTimeMillis() - start, byType, byRoot);
            return summary;
        }
    }
}
