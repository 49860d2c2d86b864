package in.feedconv.infrastructure.symbol;

import in.feedconv.application.port.output.SymbolResolver;
import in.feedconv.domain.model.FutureSymbol;

import java.time.Clock;
import java.time.Year;
import java.time.YearMonth;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses exchange-style futures tickers such as ESU3, CLZ24 or 6EH5.
 *
 * Grammar: root, one month code (F G H J K M N Q U V X Z for Jan..Dec), then a one or
 * two digit year. Two-digit years are 20yy. A one-digit year becomes the first year,
 * starting one year before the clock's current year, that ends in that digit.
 */
public final class FutureTickerParser implements SymbolResolver {
    static final String DEFAULT_MARKET = "usa";

    private static final Pattern TICKER = Pattern.compile("^([A-Z0-9]+?)([FGHJKMNQUVXZ])(\\d{1,2})$");
    private static final String MONTH_CODES = "FGHJKMNQUVXZ";

    private final SymbolPropertiesDatabase properties;
    private final Clock clock;

    public FutureTickerParser(SymbolPropertiesDatabase properties) {
        this(properties, Clock.systemUTC());
    }

    public FutureTickerParser(SymbolPropertiesDatabase properties, Clock clock) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public FutureSymbol resolve(String ticker) {
        if (ticker == null) {
            return null;
        }

        Matcher m = TICKER.matcher(ticker.trim());
        if (!m.matches()) {
            return null;
        }

        String root = m.group(1);
        int month = MONTH_CODES.indexOf(m.group(2).charAt(0)) + 1;
        int year = contractYear(m.group(3));

        String market = properties.market(root);
        return new FutureSymbol(
            root,
            market != null ? market : DEFAULT_MARKET,
            YearMonth.of(year, month),
            ticker);
    }

    private int contractYear(String digits) {
        int value = Integer.parseInt(digits);
        if (digits.length() == 2) {
            return 2000 + value;
        }

        int earliest = Year.now(clock).getValue() - 1;
        int year = earliest - Math.floorMod(earliest, 10) + value;
        return year < earliest ? year + 10 : year;
    }
}
