package in.feedconv.infrastructure.algoseek;

import in.feedconv.domain.model.FutureSymbol;
import in.feedconv.domain.model.FuturesTick;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Builds canonical ticks from decoded AlgoSeek rows.
 *
 * Prices arrive as unscaled integers with 10 implied decimal places, except for
 * the VIX future which is delivered already scaled. The descaled price is then
 * multiplied by the per-root contract multiplier.
 */
public final class TickAssembler {
    static final String VOLATILITY_ROOT = "VX";
    static final BigDecimal PRICE_SCALE = new BigDecimal("10000000000");

    private TickAssembler() {}

    /**
     * Scale factor applied to raw prices of the given root.
     */
    public static BigDecimal scaleFactor(String root) {
        return VOLATILITY_ROOT.equals(root) ? BigDecimal.ONE : PRICE_SCALE;
    }

    /**
     * Convert a raw price field into a multiplier-adjusted price.
     *
     * @throws NumberFormatException if the field is not a decimal number
     */
    public static BigDecimal price(String rawPrice, String root, BigDecimal multiplier) {
        // Dividing by a power of ten always terminates, so the exact divide is safe.
        BigDecimal descaled = new BigDecimal(rawPrice.trim()).divide(scaleFactor(root));
        return descaled.multiply(multiplier);
    }

    /**
     * Build the tick for a classified row.
     */
    public static FuturesTick assemble(
        FutureSymbol symbol,
        LocalDateTime time,
        MessageTypeDecoder.Message message,
        BigDecimal price,
        long quantity
    ) {
        return switch (message.tickType()) {
            case TRADE -> FuturesTick.trade(symbol, time, price, quantity);
            case QUOTE -> message.ask()
                ? FuturesTick.ask(symbol, time, price, quantity)
                : FuturesTick.bid(symbol, time, price, quantity);
            case OPEN_INTEREST -> FuturesTick.openInterest(symbol, time, quantity);
        };
    }
}
