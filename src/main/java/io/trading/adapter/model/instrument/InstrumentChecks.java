package io.trading.adapter.model.instrument;

import io.trading.adapter.model.Currency;
import io.trading.adapter.model.InstrumentId;

import java.math.BigDecimal;

/**
 * Shared constructor checks for instrument records.
 */
final class InstrumentChecks {

    private InstrumentChecks() {
    }

    static void checkCommon(
        InstrumentId id,
        String rawSymbol,
        Currency baseCurrency,
        Currency quoteCurrency,
        int pricePrecision,
        int sizePrecision,
        BigDecimal priceIncrement,
        BigDecimal sizeIncrement,
        BigDecimal makerFee,
        BigDecimal takerFee
    ) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (rawSymbol == null || rawSymbol.isEmpty()) {
            throw new IllegalArgumentException("rawSymbol cannot be null or empty");
        }
        if (baseCurrency == null) {
            throw new IllegalArgumentException("baseCurrency cannot be null");
        }
        if (quoteCurrency == null) {
            throw new IllegalArgumentException("quoteCurrency cannot be null");
        }
        checkIncrement("priceIncrement", priceIncrement, pricePrecision);
        checkIncrement("sizeIncrement", sizeIncrement, sizePrecision);
        if (makerFee == null || takerFee == null) {
            throw new IllegalArgumentException("fees cannot be null");
        }
    }

    private static void checkIncrement(String name, BigDecimal increment, int precision) {
        if (precision < 0) {
            throw new IllegalArgumentException(name + " precision cannot be negative");
        }
        if (increment == null || increment.signum() <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        if (increment.scale() != precision) {
            throw new IllegalArgumentException(
                name + " scale " + increment.scale() + " does not match precision " + precision);
        }
    }
}
