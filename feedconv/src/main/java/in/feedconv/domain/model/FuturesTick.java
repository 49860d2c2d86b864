package in.feedconv.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Normalized futures market event.
 *
 * Field population depends on tickType:
 * - TRADE: value = price, quantity
 * - QUOTE: value = price, exactly one of (bidPrice, bidSize) or (askPrice, askSize)
 * - OPEN_INTEREST: value = open interest, exchange = market of the symbol
 *
 * Unpopulated fields are null. Use the static factories; they enforce the rules above.
 * Time is feed-local, no time zone conversion applied.
 */
public record FuturesTick(
    FutureSymbol symbol,
    LocalDateTime time,
    TickType tickType,
    BigDecimal value,
    BigDecimal bidPrice,
    Long bidSize,
    BigDecimal askPrice,
    Long askSize,
    Long quantity,
    String exchange
) {
    public static FuturesTick trade(FutureSymbol symbol, LocalDateTime time, BigDecimal price, long quantity) {
        return new FuturesTick(symbol, time, TickType.TRADE, price,
            null, null, null, null, quantity, null);
    }

    public static FuturesTick bid(FutureSymbol symbol, LocalDateTime time, BigDecimal price, long size) {
        return new FuturesTick(symbol, time, TickType.QUOTE, price,
            price, size, null, null, null, null);
    }

    public static FuturesTick ask(FutureSymbol symbol, LocalDateTime time, BigDecimal price, long size) {
        return new FuturesTick(symbol, time, TickType.QUOTE, price,
            null, null, price, size, null, null);
    }

    public static FuturesTick openInterest(FutureSymbol symbol, LocalDateTime time, long openInterest) {
        return new FuturesTick(symbol, time, TickType.OPEN_INTEREST, BigDecimal.valueOf(openInterest),
            null, null, null, null, null, symbol.market());
    }

    public boolean isAsk() {
        return askPrice != null;
    }

    public boolean isBid() {
        return bidPrice != null;
    }
}
