package io.trading.adapter.binance.instrument;

/**
 * Thrown when a symbol lacks a filter (or filter field) every instrument needs.
 */
public class MissingRequiredFilterException extends InstrumentParseException {

    private final BinanceSymbolFilterType filterType;

    public MissingRequiredFilterException(BinanceSymbolFilterType filterType, String field) {
        super(String.format("Missing required filter %s.%s", filterType, field));
        this.filterType = filterType;
    }

    public BinanceSymbolFilterType getFilterType() {
        return filterType;
    }
}
