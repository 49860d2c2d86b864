package in.feedconv.infrastructure.algoseek;

import in.feedconv.application.port.output.LineTokenizer;
import in.feedconv.application.port.output.SymbolResolver;
import in.feedconv.domain.model.FutureSymbol;
import in.feedconv.domain.model.FuturesTick;
import in.feedconv.domain.model.TickType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns one AlgoSeek futures row into a tick.
 *
 * Rows that do not produce a tick return null:
 * - too few fields for the header
 * - option or spread tickers (contain a space or a hyphen)
 * - tickers the resolver cannot parse
 * - roots without a multiplier, or outside the symbol filter
 * - message types other than trade, quote and open interest
 * - quotes with an unknown side
 * - unparseable timestamp, type, price or quantity fields
 *
 * A row never throws. Unexpected failures are logged with the raw line.
 */
public final class AlgoSeekLineParser {
    private static final Logger log = LoggerFactory.getLogger(AlgoSeekLineParser.class);

    private final HeaderColumns columns;
    private final LineTokenizer tokenizer;
    private final SymbolResolver symbolResolver;
    private final Map<String, BigDecimal> multipliers;
    private final Set<String> symbolFilter;

    /**
     * @param symbolFilter roots to keep (case-insensitive), or null to keep every root
     */
    public AlgoSeekLineParser(
        HeaderColumns columns,
        LineTokenizer tokenizer,
        SymbolResolver symbolResolver,
        Map<String, BigDecimal> multipliers,
        Set<String> symbolFilter
    ) {
        this.columns = Objects.requireNonNull(columns, "columns");
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        this.symbolResolver = Objects.requireNonNull(symbolResolver, "symbolResolver");
        this.multipliers = Map.copyOf(Objects.requireNonNull(multipliers, "multipliers"));
        this.symbolFilter = symbolFilter == null ? null : caseInsensitiveCopy(symbolFilter);
    }

    /**
     * Parse a row.
     *
     * @return the tick, or null if the row is rejected
     */
    public FuturesTick parse(String line) {
        try {
            List<String> fields = tokenizer.tokenize(line);
            if (!columns.accepts(fields.size())) {
                return null;
            }

            FutureSymbol symbol = resolveSymbol(HeaderColumns.field(fields, columns.ticker()));
            if (symbol == null) {
                return null;
            }

            LocalDateTime time = MessageTypeDecoder.parseTimestamp(HeaderColumns.field(fields, columns.timestamp()));

            MessageTypeDecoder.Message message = MessageTypeDecoder.classify(
                HeaderColumns.field(fields, columns.type()),
                HeaderColumns.field(fields, columns.side()));
            if (message == null) {
                return null;
            }

            // open interest carries its value in Quantity; Price is not read
            BigDecimal price = message.tickType() == TickType.OPEN_INTEREST
                ? null
                : TickAssembler.price(
                    HeaderColumns.field(fields, columns.price()),
                    symbol.root(),
                    multipliers.get(symbol.root()));
            long quantity = parseQuantity(HeaderColumns.field(fields, columns.quantity()));

            return TickAssembler.assemble(symbol, time, message, price, quantity);

        } catch (Exception e) {
            log.error("[AlgoSeekLineParser] Failed to parse line: {}", line, e);
            return null;
        }
    }

    /**
     * Apply the ticker filters and resolve the ticker to a symbol we have a multiplier for.
     */
    private FutureSymbol resolveSymbol(String ticker) {
        if (ticker == null) {
            return null;
        }

        // options and spreads
        if (ticker.indexOf(' ') >= 0 || ticker.indexOf('-') >= 0) {
            log.trace("[AlgoSeekLineParser] Skipping option/spread ticker {}", ticker);
            return null;
        }

        ticker = trimQuotes(ticker);
        if (ticker.isEmpty()) {
            return null;
        }

        FutureSymbol symbol = symbolResolver.resolve(ticker);
        if (symbol == null || !multipliers.containsKey(symbol.root())) {
            return null;
        }

        if (symbolFilter != null && !symbolFilter.contains(symbol.root())) {
            return null;
        }

        return symbol;
    }

    /**
     * Integer part of the Quantity field; a fractional part such as ".0" is ignored.
     *
     * @throws NumberFormatException if the integer part is not a valid int
     */
    static int parseQuantity(String value) {
        String trimmed = value.trim();
        int dot = trimmed.indexOf('.');
        return Integer.parseInt(dot < 0 ? trimmed : trimmed.substring(0, dot));
    }

    static String trimQuotes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '"') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '"') {
            end--;
        }
        return value.substring(start, end);
    }

    private static Set<String> caseInsensitiveCopy(Set<String> symbols) {
        Set<String> copy = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        copy.addAll(symbols);
        return Collections.unmodifiableSet(copy);
    }
}
