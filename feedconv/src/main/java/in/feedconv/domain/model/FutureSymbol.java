package in.feedconv.domain.model;

import java.time.YearMonth;

/**
 * Canonical identity of a futures contract.
 *
 * @param root          canonical symbol shared by all expiries (e.g. ES, VX)
 * @param market        market identifier the contract trades on (e.g. cme, cfe)
 * @param contractMonth delivery month of the contract
 * @param ticker        raw ticker the identity was parsed from
 */
public record FutureSymbol(
    String root,
    String market,
    YearMonth contractMonth,
    String ticker
) {
    @Override
    public String toString() {
        return root + " " + contractMonth + " (" + market + ")";
    }
}
