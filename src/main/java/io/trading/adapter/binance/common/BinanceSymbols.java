package io.trading.adapter.binance.common;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trading.adapter.model.Symbol;

import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.List;

/**
 * A non-empty list of wire symbols, as sent in the venue's {@code symbols=[...]} parameter.
 */
public final class BinanceSymbols {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<BinanceSymbol> symbols;

    private BinanceSymbols(List<BinanceSymbol> symbols) {
        this.symbols = symbols;
    }

    /**
     * Encodes each symbol with {@link BinanceSymbol#of(String, BinanceAccountType)}.
     *
     * @throws IllegalArgumentException if the collection is empty or any symbol is invalid
     */
    public static BinanceSymbols of(Collection<String> raw, BinanceAccountType accountType) {
        if (raw == null || raw.isEmpty()) {
            throw new IllegalArgumentException("symbols cannot be null or empty");
        }
        return new BinanceSymbols(raw.stream()
            .map(symbol -> BinanceSymbol.of(symbol, accountType))
            .toList());
    }

    public List<BinanceSymbol> getSymbols() {
        return symbols;
    }

    public List<Symbol> toInternal(BinanceAccountType accountType) {
        return symbols.stream()
            .map(symbol -> symbol.toInternal(accountType))
            .toList();
    }

    /**
     * Renders the symbols as a compact JSON array, e.g. {@code ["BTCUSDT","ETHUSDT"]}.
     */
    public String toJsonArray() {
        try {
            return MAPPER.writeValueAsString(symbols.stream().map(BinanceSymbol::getValue).toList());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to encode symbols", e);
        }
    }

    public int size() {
        return symbols.size();
    }

    @Override
    public String toString() {
        return symbols.toString();
    }
}
