package io.trading.adapter.binance.instrument;

import io.trading.adapter.binance.common.BinanceAccountType;
import io.trading.adapter.binance.common.BinanceSymbol;
import io.trading.adapter.common.Clock;
import io.trading.adapter.common.InstrumentCache;
import io.trading.adapter.config.AdapterConfig;
import io.trading.adapter.metrics.AdapterMetrics;
import io.trading.adapter.model.Currency;
import io.trading.adapter.model.InstrumentId;
import io.trading.adapter.model.Money;
import io.trading.adapter.model.Venue;
import io.trading.adapter.model.instrument.Instrument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Base for turning venue symbol entries into instrument definitions.
 *
 * Owns the pieces shared by spot and futures: currency registration, fee lookup,
 * timestamping and per-symbol failure handling.
 */
public abstract class BinanceInstrumentNormalizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(BinanceInstrumentNormalizer.class);

    static final long NANOS_PER_MILLI = 1_000_000L;

    protected final AdapterConfig config;
    protected final BinanceAccountType accountType;
    protected final BinanceFilterParser filterParser;
    protected final AdapterMetrics metrics;

    private final InstrumentCache cache;
    private final Clock clock;
    private final Map<String, Currency> registered = new ConcurrentHashMap<>();

    protected BinanceInstrumentNormalizer(AdapterConfig config, InstrumentCache cache, Clock clock, AdapterMetrics metrics) {
        this.config = config;
        this.accountType = config.accountType();
        this.filterParser = new BinanceFilterParser(config.instrumentBounds());
        this.cache = cache;
        this.clock = clock;
        this.metrics = metrics;
    }

    public BinanceAccountType getAccountType() {
        return accountType;
    }

    /**
     * Returns the currency for the code, registering it with the cache the first time
     * this normalizer sees it. An already-cached definition is reused.
     */
    protected Currency currency(String code, int precision) {
        return registered.computeIfAbsent(code, key -> cache.currency(key).orElseGet(() -> {
            Currency currency = Currency.of(key, precision);
            cache.addCurrency(currency);
            LOGGER.debug("Registered currency {} with precision {}", key, precision);
            return currency;
        }));
    }

    /**
     * Returns the venue field value, failing the symbol when the venue left it out.
     */
    protected static String requireField(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new InstrumentParseException("Missing " + field);
        }
        return value;
    }

    /**
     * Encodes the entry's symbol. A missing or blank symbol is recorded as a failure.
     */
    public Optional<BinanceSymbol> venueSymbol(BinanceSymbolInfo info) {
        try {
            return Optional.of(BinanceSymbol.of(requireField("symbol", info.symbol()), accountType));
        } catch (InstrumentParseException | IllegalArgumentException e) {
            failed(info.symbol(), e);
            return Optional.empty();
        }
    }

    protected InstrumentId instrumentId(String rawSymbol) {
        BinanceSymbol symbol = BinanceSymbol.of(rawSymbol, accountType);
        return new InstrumentId(symbol.toInternal(accountType), Venue.BINANCE);
    }

    protected static BigDecimal makerFee(BinanceFeeInfo fee) {
        return fee == null || fee.makerCommission() == null ? BigDecimal.ZERO : new BigDecimal(fee.makerCommission());
    }

    protected static BigDecimal takerFee(BinanceFeeInfo fee) {
        return fee == null || fee.takerCommission() == null ? BigDecimal.ZERO : new BigDecimal(fee.takerCommission());
    }

    protected static Money money(BigDecimal amount, Currency currency) {
        return amount == null ? null : new Money(amount, currency);
    }

    protected static long millisToNanos(long millis) {
        return millis * NANOS_PER_MILLI;
    }

    protected long timestampNs() {
        return clock.timestampNs();
    }

    protected void loaded(Instrument instrument) {
        metrics.recordInstrumentLoaded(accountType, instrument.getClass().getSimpleName());
        LOGGER.debug("Normalized {}", instrument.id());
    }

    /**
     * Records a recoverable failure for one symbol. The load continues.
     */
    protected void failed(String rawSymbol, RuntimeException e) {
        metrics.recordParseFailure(accountType);
        if (config.logWarnings()) {
            LOGGER.warn("Unable to parse instrument {} ({}): {}", rawSymbol, accountType, e.getMessage());
        } else {
            LOGGER.debug("Unable to parse instrument {} ({}): {}", rawSymbol, accountType, e.getMessage());
        }
    }
}
