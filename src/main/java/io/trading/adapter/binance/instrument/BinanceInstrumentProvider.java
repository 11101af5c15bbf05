package io.trading.adapter.binance.instrument;

import io.trading.adapter.binance.common.BinanceAccountType;
import io.trading.adapter.common.InstrumentCache;
import io.trading.adapter.metrics.AdapterMetrics;
import io.trading.adapter.model.InstrumentId;
import io.trading.adapter.model.Venue;
import io.trading.adapter.model.instrument.Instrument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads instrument definitions from the venue and publishes them to the instrument cache.
 *
 * A reload replaces each definition with a freshly built one; definitions are never mutated.
 */
public abstract class BinanceInstrumentProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(BinanceInstrumentProvider.class);

    protected final BinanceAccountType accountType;

    private final InstrumentCache cache;
    private final AdapterMetrics metrics;
    private final Map<InstrumentId, Instrument> instruments = new ConcurrentHashMap<>();

    protected BinanceInstrumentProvider(BinanceAccountType accountType, InstrumentCache cache, AdapterMetrics metrics) {
        this.accountType = accountType;
        this.cache = cache;
        this.metrics = metrics;
    }

    /**
     * Loads every instrument the venue lists for the account type.
     *
     * @return the instruments produced by this load
     */
    public List<Instrument> loadAll() {
        LOGGER.info("Loading all {} instruments", accountType);
        return publish(fetchAll());
    }

    /**
     * Loads the given instruments. Ids the venue does not list are ignored.
     *
     * @throws IllegalArgumentException if an id belongs to another venue
     */
    public List<Instrument> loadIds(Collection<InstrumentId> instrumentIds) {
        if (instrumentIds.isEmpty()) {
            return List.of();
        }
        for (InstrumentId instrumentId : instrumentIds) {
            checkVenue(instrumentId);
        }
        LOGGER.info("Loading {} {} instruments", instrumentIds.size(), accountType);
        return publish(fetch(instrumentIds));
    }

    /**
     * Loads a single instrument.
     *
     * @throws IllegalArgumentException if the id belongs to another venue
     */
    public Optional<Instrument> loadOne(InstrumentId instrumentId) {
        checkVenue(instrumentId);
        return loadIds(List.of(instrumentId)).stream()
            .filter(instrument -> instrument.id().equals(instrumentId))
            .findFirst();
    }

    /**
     * Instruments loaded so far by this provider.
     */
    public Collection<Instrument> instruments() {
        return List.copyOf(instruments.values());
    }

    public Optional<Instrument> find(InstrumentId instrumentId) {
        return Optional.ofNullable(instruments.get(instrumentId));
    }

    public BinanceAccountType getAccountType() {
        return accountType;
    }

    protected abstract List<Instrument> fetchAll();

    protected abstract List<Instrument> fetch(Collection<InstrumentId> instrumentIds);

    private List<Instrument> publish(List<Instrument> loaded) {
        for (Instrument instrument : loaded) {
            cache.add(instrument);
            instruments.put(instrument.id(), instrument);
        }
        metrics.setLastLoadSize(accountType, loaded.size());
        LOGGER.info("Loaded {} {} instruments ({} total)", loaded.size(), accountType, instruments.size());
        return loaded;
    }

    private static void checkVenue(InstrumentId instrumentId) {
        if (instrumentId.venue() != Venue.BINANCE) {
            throw new IllegalArgumentException("Instrument " + instrumentId + " is not a Binance instrument");
        }
    }
}
