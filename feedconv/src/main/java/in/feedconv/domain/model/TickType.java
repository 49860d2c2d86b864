package in.feedconv.domain.model;

/**
 * Kind of market event carried by a tick.
 */
public enum TickType {
    TRADE,
    QUOTE,
    OPEN_INTEREST
}
