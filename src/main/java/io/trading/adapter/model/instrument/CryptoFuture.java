package io.trading.adapter.model.instrument;

import io.trading.adapter.model.Currency;
import io.trading.adapter.model.InstrumentId;
import io.trading.adapter.model.Money;

import java.math.BigDecimal;

/**
 * Dated (deliverable) futures contract.
 *
 * @param activationNs Listing time (UNIX nanoseconds)
 * @param expirationNs Delivery time (UNIX nanoseconds)
 */
public record CryptoFuture(
    InstrumentId id,
    String rawSymbol,
    Currency baseCurrency,
    Currency quoteCurrency,
    Currency settlementCurrency,
    boolean isInverse,
    long activationNs,
    long expirationNs,
    int pricePrecision,
    int sizePrecision,
    BigDecimal priceIncrement,
    BigDecimal sizeIncrement,
    BigDecimal multiplier,
    BigDecimal maxQuantity,
    BigDecimal minQuantity,
    Money maxNotional,
    Money minNotional,
    BigDecimal maxPrice,
    BigDecimal minPrice,
    BigDecimal marginInit,
    BigDecimal marginMaint,
    BigDecimal makerFee,
    BigDecimal takerFee,
    long tsEvent,
    long tsInit
) implements Instrument {
    public CryptoFuture {
        InstrumentChecks.checkCommon(id, rawSymbol, baseCurrency, quoteCurrency, pricePrecision,
            sizePrecision, priceIncrement, sizeIncrement, makerFee, takerFee);
        if (settlementCurrency == null) {
            throw new IllegalArgumentException("settlementCurrency cannot be null");
        }
        if (multiplier == null || multiplier.signum() <= 0) {
            throw new IllegalArgumentException("multiplier must be positive");
        }
        if (expirationNs < activationNs) {
            throw new IllegalArgumentException("expirationNs cannot precede activationNs");
        }
    }

    /**
     * The underlying asset of the contract.
     */
    public Currency underlying() {
        return baseCurrency;
    }

    @Override
    public CryptoFuture withTimestamps(long tsEvent, long tsInit) {
        return new CryptoFuture(id, rawSymbol, baseCurrency, quoteCurrency, settlementCurrency,
            isInverse, activationNs, expirationNs, pricePrecision, sizePrecision, priceIncrement,
            sizeIncrement, multiplier, maxQuantity, minQuantity, maxNotional, minNotional, maxPrice,
            minPrice, marginInit, marginMaint, makerFee, takerFee, tsEvent, tsInit);
    }
}
