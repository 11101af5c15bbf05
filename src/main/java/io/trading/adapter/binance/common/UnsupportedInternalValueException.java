package io.trading.adapter.binance.common;

/**
 * Thrown when an internal value has no venue equivalent for the active product type.
 */
public class UnsupportedInternalValueException extends RuntimeException {

    private final Enum<?> internalValue;

    public UnsupportedInternalValueException(Enum<?> internalValue, BinanceAccountType accountType) {
        super(String.format("%s.%s has no Binance equivalent for %s",
            internalValue.getDeclaringClass().getSimpleName(), internalValue.name(), accountType));
        this.internalValue = internalValue;
    }

    public UnsupportedInternalValueException(Object internalValue, BinanceAccountType accountType, String detail) {
        super(String.format("%s has no Binance equivalent for %s: %s", internalValue, accountType, detail));
        this.internalValue = internalValue instanceof Enum<?> e ? e : null;
    }

    /**
     * Returns the offending enum constant, or null when the value was not an enum.
     */
    public Enum<?> getInternalValue() {
        return internalValue;
    }
}
