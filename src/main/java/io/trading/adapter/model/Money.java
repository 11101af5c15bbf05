package io.trading.adapter.model;

import java.math.BigDecimal;

/**
 * Amount denominated in a currency.
 *
 * @param amount   Decimal amount
 * @param currency Denomination
 */
public record Money(
    BigDecimal amount,
    Currency currency
) {
    public Money {
        if (amount == null) {
            throw new IllegalArgumentException("amount cannot be null");
        }
        if (currency == null) {
            throw new IllegalArgumentException("currency cannot be null");
        }
    }

    public static Money of(String amount, Currency currency) {
        return new Money(new BigDecimal(amount), currency);
    }

    public static Money zero(Currency currency) {
        return new Money(BigDecimal.ZERO, currency);
    }

    @Override
    public String toString() {
        return amount.toPlainString() + " " + currency.code();
    }
}
