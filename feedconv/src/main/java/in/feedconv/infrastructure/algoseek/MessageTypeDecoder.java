package in.feedconv.infrastructure.algoseek;

import in.feedconv.domain.model.TickType;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;

/**
 * Decodes the timestamp, message type and side fields of an AlgoSeek futures row.
 *
 * The Type field packs the message kind into its low four bits. Only three codes
 * produce ticks:
 * - 2  (0b0010) trade
 * - 11 (0b1011) open interest
 * - 1  (0b0001) quote, side taken from the Side field (B = bid, S = ask)
 *
 * Every other code is a message kind this feed does not surface.
 */
public final class MessageTypeDecoder {
    static final int MESSAGE_TYPE_MASK = 0b1111;
    static final int QUOTE_CODE = 0b0001;
    static final int TRADE_CODE = 0b0010;
    static final int OPEN_INTEREST_CODE = 0b1011;

    static final String BID_SIDE = "B";
    static final String ASK_SIDE = "S";

    // yyyyMMddHHmmssSSS, fixed width, no separators
    static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
        .appendValue(ChronoField.YEAR, 4)
        .appendValue(ChronoField.MONTH_OF_YEAR, 2)
        .appendValue(ChronoField.DAY_OF_MONTH, 2)
        .appendValue(ChronoField.HOUR_OF_DAY, 2)
        .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
        .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
        .appendValue(ChronoField.MILLI_OF_SECOND, 3)
        .toFormatter()
        .withResolverStyle(ResolverStyle.STRICT);

    /**
     * Result of classifying a row.
     *
     * @param tickType kind of tick to build
     * @param ask      true for the ask side of a quote; always false otherwise
     */
    public record Message(TickType tickType, boolean ask) {
        static final Message TRADE = new Message(TickType.TRADE, false);
        static final Message OPEN_INTEREST = new Message(TickType.OPEN_INTEREST, false);
        static final Message BID = new Message(TickType.QUOTE, false);
        static final Message ASK = new Message(TickType.QUOTE, true);
    }

    private MessageTypeDecoder() {}

    /**
     * Classify a row from its Type and Side fields.
     *
     * @return the message, or null if the row does not carry a tick
     */
    public static Message classify(int type, String side) {
        return switch (type & MESSAGE_TYPE_MASK) {
            case TRADE_CODE -> Message.TRADE;
            case OPEN_INTEREST_CODE -> Message.OPEN_INTEREST;
            case QUOTE_CODE -> quoteSide(side);
            default -> null;
        };
    }

    /**
     * Parse the Type field and classify the row.
     *
     * @throws NumberFormatException if the Type field is not an integer
     */
    public static Message classify(String type, String side) {
        return classify(Integer.parseInt(type.trim()), side);
    }

    /**
     * Parse a feed timestamp. The value is feed-local time and is not converted.
     *
     * @throws java.time.format.DateTimeParseException if the field does not match yyyyMMddHHmmssSSS
     */
    public static LocalDateTime parseTimestamp(String value) {
        return LocalDateTime.parse(value, TIMESTAMP_FORMAT);
    }

    private static Message quoteSide(String side) {
        if (BID_SIDE.equals(side)) {
            return Message.BID;
        }
        if (ASK_SIDE.equals(side)) {
            return Message.ASK;
        }
        return null;
    }
}
