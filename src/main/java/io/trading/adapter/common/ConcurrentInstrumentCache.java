package io.trading.adapter.common;

import io.trading.adapter.model.Currency;
import io.trading.adapter.model.InstrumentId;
import io.trading.adapter.model.instrument.Instrument;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory instrument cache.
 * A reloaded definition replaces the previous one in a single map write.
 */
public class ConcurrentInstrumentCache implements InstrumentCache {

    private final ConcurrentHashMap<InstrumentId, Instrument> instruments = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Currency> currencies = new ConcurrentHashMap<>();

    @Override
    public void add(Instrument instrument) {
        instruments.put(instrument.id(), instrument);
    }

    @Override
    public void addCurrency(Currency currency) {
        currencies.put(currency.code(), currency);
    }

    @Override
    public Optional<Instrument> instrument(InstrumentId instrumentId) {
        return Optional.ofNullable(instruments.get(instrumentId));
    }

    @Override
    public Optional<Currency> currency(String code) {
        return Optional.ofNullable(currencies.get(code));
    }

    @Override
    public Collection<Instrument> instruments() {
        return List.copyOf(instruments.values());
    }

    public int currencyCount() {
        return currencies.size();
    }
}
