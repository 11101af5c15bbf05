package io.trading.adapter.binance.instrument;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Futures {@code exchangeInfo} response.
 *
 * @param timezone   Venue timezone, always "UTC"
 * @param serverTime Venue time the response was produced (UNIX milliseconds)
 * @param symbols    Contract trading rules
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BinanceFuturesExchangeInfo(
    String timezone,
    long serverTime,
    List<BinanceFuturesSymbolInfo> symbols
) {
    public BinanceFuturesExchangeInfo {
        symbols = symbols == null ? List.of() : List.copyOf(symbols);
    }
}
