package io.trading.adapter.binance.common;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Kline (candlestick) intervals.
 */
public enum BinanceKlineInterval {
    SECOND_1("1s"),
    MINUTE_1("1m"),
    MINUTE_3("3m"),
    MINUTE_5("5m"),
    MINUTE_15("15m"),
    MINUTE_30("30m"),
    HOUR_1("1h"),
    HOUR_2("2h"),
    HOUR_4("4h"),
    HOUR_6("6h"),
    HOUR_8("8h"),
    HOUR_12("12h"),
    DAY_1("1d"),
    DAY_3("3d"),
    WEEK_1("1w"),
    MONTH_1("1M");

    private static final Map<String, BinanceKlineInterval> BY_WIRE = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(BinanceKlineInterval::getWireValue, Function.identity()));

    private final String wireValue;

    BinanceKlineInterval(String wireValue) {
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
    public static BinanceKlineInterval fromWire(String value) {
        BinanceKlineInterval result = value == null ? null : BY_WIRE.get(value);
        if (result == null) {
            throw new UnrecognizedEnumException("BinanceKlineInterval", value);
        }
        return result;
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
