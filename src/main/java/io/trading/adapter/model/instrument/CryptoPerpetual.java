package io.trading.adapter.model.instrument;

import io.trading.adapter.model.Currency;
import io.trading.adapter.model.InstrumentId;
import io.trading.adapter.model.Money;

import java.math.BigDecimal;

/**
 * Perpetual swap. Inverse when settled in the base currency (coin-margined).
 */
public record CryptoPerpetual(
    InstrumentId id,
    String rawSymbol,
    Currency baseCurrency,
    Currency quoteCurrency,
    Currency settlementCurrency,
    boolean isInverse,
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
    public CryptoPerpetual {
        InstrumentChecks.checkCommon(id, rawSymbol, baseCurrency, quoteCurrency, pricePrecision,
            sizePrecision, priceIncrement, sizeIncrement, makerFee, takerFee);
        if (settlementCurrency == null) {
            throw new IllegalArgumentException("settlementCurrency cannot be null");
        }
        if (multiplier == null || multiplier.signum() <= 0) {
            throw new IllegalArgumentException("multiplier must be positive");
        }
    }

    @Override
    public CryptoPerpetual withTimestamps(long tsEvent, long tsInit) {
        return new CryptoPerpetual(id, rawSymbol, baseCurrency, quoteCurrency, settlementCurrency,
            isInverse, pricePrecision, sizePrecision, priceIncrement, sizeIncrement, multiplier,
            maxQuantity, minQuantity, maxNotional, minNotional, maxPrice, minPrice, marginInit,
            marginMaint, makerFee, takerFee, tsEvent, tsInit);
    }
}
