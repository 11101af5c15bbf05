package io.trading.adapter.binance.common;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Binance time in force.
 *
 * GTX is the futures post-only variant of GTC. GTE_GTC is an undocumented GTC alias
 * seen on futures order updates.
 */
public enum BinanceTimeInForce {
    GTC("GTC"),
    IOC("IOC"),
    FOK("FOK"),
    GTX("GTX"),
    GTD("GTD"),
    GTE_GTC("GTE_GTC");

    private static final Map<String, BinanceTimeInForce> BY_WIRE = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(BinanceTimeInForce::getWireValue, Function.identity()));

    private final String wireValue;

    BinanceTimeInForce(String wireValue) {
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
    public static BinanceTimeInForce fromWire(String value) {
        BinanceTimeInForce result = value == null ? null : BY_WIRE.get(value);
        if (result == null) {
            throw new UnrecognizedEnumException("BinanceTimeInForce", value);
        }
        return result;
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
