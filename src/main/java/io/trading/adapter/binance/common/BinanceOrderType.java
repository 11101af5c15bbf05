package io.trading.adapter.binance.common;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Binance order types across spot and futures.
 */
public enum BinanceOrderType {
    LIMIT("LIMIT"),
    MARKET("MARKET"),
    LIMIT_MAKER("LIMIT_MAKER"),
    STOP_LOSS("STOP_LOSS"),
    STOP_LOSS_LIMIT("STOP_LOSS_LIMIT"),
    TAKE_PROFIT("TAKE_PROFIT"),
    TAKE_PROFIT_LIMIT("TAKE_PROFIT_LIMIT"),
    STOP("STOP"),
    STOP_MARKET("STOP_MARKET"),
    TAKE_PROFIT_MARKET("TAKE_PROFIT_MARKET"),
    TRAILING_STOP_MARKET("TRAILING_STOP_MARKET"),
    LIQUIDATION("LIQUIDATION");

    private static final Map<String, BinanceOrderType> BY_WIRE = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(BinanceOrderType::getWireValue, Function.identity()));

    private final String wireValue;

    BinanceOrderType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }

    /**
     * Resolves a venue spelling.
     *
     * @throws UnrecognizedEnumException if the spelling is unknown
     */
    public static BinanceOrderType fromWire(String value) {
        BinanceOrderType result = value == null ? null : BY_WIRE.get(value);
        if (result == null) {
            throw new UnrecognizedEnumException("BinanceOrderType", value);
        }
        return result;
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
