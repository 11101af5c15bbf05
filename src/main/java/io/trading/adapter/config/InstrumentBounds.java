package io.trading.adapter.config;

import java.math.BigDecimal;

/**
 * Process-wide sanity bounds applied to venue trading rules.
 *
 * @param maxPrice     Largest representable price magnitude
 * @param maxQuantity  Largest representable quantity magnitude
 * @param maxPrecision Largest number of decimal places for a price or quantity
 */
public record InstrumentBounds(
    BigDecimal maxPrice,
    BigDecimal maxQuantity,
    int maxPrecision
) {
    public static final InstrumentBounds DEFAULT = new InstrumentBounds(
        new BigDecimal("9223372036"),
        new BigDecimal("18446744073"),
        9
    );

    public InstrumentBounds {
        if (maxPrice == null || maxPrice.signum() <= 0) {
            throw new IllegalArgumentException("maxPrice must be positive");
        }
        if (maxQuantity == null || maxQuantity.signum() <= 0) {
            throw new IllegalArgumentException("maxQuantity must be positive");
        }
        if (maxPrecision < 0) {
            throw new IllegalArgumentException("maxPrecision cannot be negative");
        }
    }
}
