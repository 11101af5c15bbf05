package io.trading.adapter.model.instrument;

import io.trading.adapter.model.Currency;
import io.trading.adapter.model.InstrumentId;
import io.trading.adapter.model.Money;

import java.math.BigDecimal;

/**
 * Immutable, venue-normalized instrument definition.
 *
 * Optional limits (min/max price, quantity and notional) are null when the venue
 * imposes no constraint; null never means zero.
 */
public sealed interface Instrument permits CurrencyPair, CryptoPerpetual, CryptoFuture {

    InstrumentId id();

    /**
     * Symbol as spelled on the venue wire.
     */
    String rawSymbol();

    Currency baseCurrency();

    Currency quoteCurrency();

    Currency settlementCurrency();

    boolean isInverse();

    int pricePrecision();

    int sizePrecision();

    BigDecimal priceIncrement();

    BigDecimal sizeIncrement();

    BigDecimal multiplier();

    BigDecimal maxQuantity();

    BigDecimal minQuantity();

    Money maxNotional();

    Money minNotional();

    BigDecimal maxPrice();

    BigDecimal minPrice();

    BigDecimal marginInit();

    BigDecimal marginMaint();

    BigDecimal makerFee();

    BigDecimal takerFee();

    /**
     * Venue timestamp the definition was derived from (UNIX nanoseconds).
     */
    long tsEvent();

    /**
     * Time the definition was created (UNIX nanoseconds).
     */
    long tsInit();

    /**
     * Returns a copy carrying the given timestamps and otherwise identical fields.
     */
    Instrument withTimestamps(long tsEvent, long tsInit);
}
