package io.trading.adapter.model.instrument;

import io.trading.adapter.model.Currency;
import io.trading.adapter.model.InstrumentId;
import io.trading.adapter.model.Money;

import java.math.BigDecimal;

/**
 * Spot currency pair.
 */
public record CurrencyPair(
    InstrumentId id,
    String rawSymbol,
    Currency baseCurrency,
    Currency quoteCurrency,
    int pricePrecision,
    int sizePrecision,
    BigDecimal priceIncrement,
    BigDecimal sizeIncrement,
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
    public CurrencyPair {
        InstrumentChecks.checkCommon(id, rawSymbol, baseCurrency, quoteCurrency, pricePrecision,
            sizePrecision, priceIncrement, sizeIncrement, makerFee, takerFee);
    }

    @Override
    public Currency settlementCurrency() {
        return quoteCurrency;
    }

    @Override
    public boolean isInverse() {
        return false;
    }

    @Override
    public BigDecimal multiplier() {
        return BigDecimal.ONE;
    }

    @Override
    public CurrencyPair withTimestamps(long tsEvent, long tsInit) {
        return new CurrencyPair(id, rawSymbol, baseCurrency, quoteCurrency, pricePrecision,
            sizePrecision, priceIncrement, sizeIncrement, maxQuantity, minQuantity, maxNotional,
            minNotional, maxPrice, minPrice, marginInit, marginMaint, makerFee, takerFee,
            tsEvent, tsInit);
    }
}
