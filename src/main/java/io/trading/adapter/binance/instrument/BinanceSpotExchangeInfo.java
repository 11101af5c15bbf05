package io.trading.adapter.binance.instrument;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Spot {@code exchangeInfo} response. Rate limits and exchange filters are not read.
 *
 * @param timezone   Venue timezone, always "UTC"
 * @param serverTime Venue time the response was produced (UNIX milliseconds)
 * @param symbols    Symbol trading rules
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BinanceSpotExchangeInfo(
    String timezone,
    long serverTime,
    List<BinanceSpotSymbolInfo> symbols
) {
    public BinanceSpotExchangeInfo {
        symbols = symbols == null ? List.of() : List.copyOf(symbols);
    }
}
