package in.feedconv.infrastructure.algoseek;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Column positions of an AlgoSeek futures file, discovered from its header row.
 *
 * Column order varies between files, so every file is read through its own instance.
 * A column absent from the header has index -1.
 *
 * @param columnsRequired highest resolved index; rows with fewer fields are rejected.
 *                        -1 when the header was missing, which disables the check.
 */
public record HeaderColumns(
    int timestamp,
    int ticker,
    int type,
    int side,
    int securityId,
    int quantity,
    int price,
    int columnsRequired
) {
    public static final String TIMESTAMP = "Timestamp";
    public static final String TICKER = "Ticker";
    public static final String TYPE = "Type";
    public static final String SIDE = "Side";
    public static final String SECURITY_ID = "SecurityID";
    public static final String QUANTITY = "Quantity";
    public static final String PRICE = "Price";

    private static final HeaderColumns UNRESOLVED = new HeaderColumns(-1, -1, -1, -1, -1, -1, -1, -1);

    /**
     * Header state when the file has no header row.
     */
    public static HeaderColumns unresolved() {
        return UNRESOLVED;
    }

    /**
     * Locate the known columns in a tokenized header row. Names match case-sensitively.
     */
    public static HeaderColumns resolve(List<String> header) {
        if (header == null || header.isEmpty()) {
            return UNRESOLVED;
        }

        int timestamp = header.indexOf(TIMESTAMP);
        int ticker = header.indexOf(TICKER);
        int type = header.indexOf(TYPE);
        int side = header.indexOf(SIDE);
        int securityId = header.indexOf(SECURITY_ID);
        int quantity = header.indexOf(QUANTITY);
        int price = header.indexOf(PRICE);

        int required = IntStream.of(timestamp, ticker, type, side, securityId, quantity, price)
            .max()
            .orElse(-1);

        return new HeaderColumns(timestamp, ticker, type, side, securityId, quantity, price, required);
    }

    /**
     * True if the row has enough fields to cover every resolved column.
     */
    public boolean accepts(int fieldCount) {
        return fieldCount - 1 >= columnsRequired;
    }

    public boolean isResolved() {
        return columnsRequired >= 0;
    }

    /**
     * Field at the given column, or null if the column was not in the header.
     */
    static String field(List<String> fields, int column) {
        return column < 0 ? null : fields.get(column);
    }
}
