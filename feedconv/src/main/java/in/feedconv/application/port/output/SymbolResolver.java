package in.feedconv.application.port.output;

import in.feedconv.domain.model.FutureSymbol;

/**
 * Maps a raw feed ticker to a canonical futures identity.
 */
public interface SymbolResolver {
    /**
     * Resolve a ticker.
     *
     * @param ticker raw ticker, surrounding quotes already removed
     * @return canonical symbol, or null if the ticker cannot be parsed
     */
    FutureSymbol resolve(String ticker);
}
