package io.trading.adapter.binance.instrument;

import io.trading.adapter.binance.common.UnrecognizedEnumException;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Per-symbol trading rule filter kinds.
 */
public enum BinanceSymbolFilterType {
    PRICE_FILTER("PRICE_FILTER"),
    PERCENT_PRICE("PERCENT_PRICE"),
    PERCENT_PRICE_BY_SIDE("PERCENT_PRICE_BY_SIDE"),
    LOT_SIZE("LOT_SIZE"),
    MIN_NOTIONAL("MIN_NOTIONAL"),
    NOTIONAL("NOTIONAL"),
    ICEBERG_PARTS("ICEBERG_PARTS"),
    MARKET_LOT_SIZE("MARKET_LOT_SIZE"),
    MAX_NUM_ORDERS("MAX_NUM_ORDERS"),
    MAX_NUM_ALGO_ORDERS("MAX_NUM_ALGO_ORDERS"),
    MAX_NUM_ICEBERG_ORDERS("MAX_NUM_ICEBERG_ORDERS"),
    MAX_POSITION("MAX_POSITION"),
    TRAILING_DELTA("TRAILING_DELTA");

    private static final Map<String, BinanceSymbolFilterType> BY_WIRE = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(BinanceSymbolFilterType::getWireValue, Function.identity()));

    private final String wireValue;

    BinanceSymbolFilterType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }

    /**
     * @throws UnrecognizedEnumException if the spelling is unknown
     */
    public static BinanceSymbolFilterType fromWire(String value) {
        return find(value).orElseThrow(() -> new UnrecognizedEnumException("BinanceSymbolFilterType", value));
    }

    /**
     * Looks up a venue spelling. The venue adds filter kinds without notice, so callers
     * that only read known filters use this instead of {@link #fromWire(String)}.
     */
    public static Optional<BinanceSymbolFilterType> find(String value) {
        return Optional.ofNullable(value == null ? null : BY_WIRE.get(value));
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
