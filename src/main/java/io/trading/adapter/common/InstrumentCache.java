package io.trading.adapter.common;

import io.trading.adapter.model.Currency;
import io.trading.adapter.model.InstrumentId;
import io.trading.adapter.model.instrument.Instrument;

import java.util.Collection;
import java.util.Optional;

/**
 * Store of instrument and currency definitions shared with the trading core.
 * Implementations must be safe for concurrent use.
 */
public interface InstrumentCache {

    /**
     * Adds or replaces an instrument definition.
     */
    void add(Instrument instrument);

    /**
     * Adds or replaces a currency definition, keyed by its code.
     */
    void addCurrency(Currency currency);

    Optional<Instrument> instrument(InstrumentId instrumentId);

    Optional<Currency> currency(String code);

    Collection<Instrument> instruments();
}
