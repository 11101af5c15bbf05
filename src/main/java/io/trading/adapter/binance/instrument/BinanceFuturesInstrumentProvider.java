package io.trading.adapter.binance.instrument;

import io.trading.adapter.binance.common.BinanceSymbol;
import io.trading.adapter.common.Clock;
import io.trading.adapter.common.InstrumentCache;
import io.trading.adapter.config.AdapterConfig;
import io.trading.adapter.metrics.AdapterMetrics;
import io.trading.adapter.model.InstrumentId;
import io.trading.adapter.model.Symbol;
import io.trading.adapter.model.instrument.Instrument;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Instrument provider for USD-M, COIN-M and portfolio margin accounts.
 *
 * The futures exchange info endpoint has no symbol filter, so loading a subset still reads
 * the full listing; commission rates are fetched only for the contracts being built.
 */
public class BinanceFuturesInstrumentProvider extends BinanceInstrumentProvider {

    private final BinanceFuturesMarketSource source;
    private final BinanceFuturesInstrumentNormalizer normalizer;

    public BinanceFuturesInstrumentProvider(
        AdapterConfig config,
        BinanceFuturesMarketSource source,
        InstrumentCache cache,
        Clock clock,
        AdapterMetrics metrics
    ) {
        super(config.accountType(), cache, metrics);
        this.source = source;
        this.normalizer = new BinanceFuturesInstrumentNormalizer(config, cache, clock, metrics);
    }

    @Override
    protected List<Instrument> fetchAll() {
        return normalize(symbol -> true);
    }

    @Override
    protected List<Instrument> fetch(Collection<InstrumentId> instrumentIds) {
        Set<Symbol> wanted = instrumentIds.stream()
            .map(InstrumentId::symbol)
            .collect(Collectors.toSet());
        return normalize(symbol -> wanted.contains(symbol.toInternal(accountType)));
    }

    /**
     * Builds the contracts whose venue symbol passes the filter. Entries without a usable
     * symbol are counted as parse failures and never reach the commission endpoint.
     */
    private List<Instrument> normalize(Predicate<BinanceSymbol> filter) {
        BinanceFuturesExchangeInfo exchangeInfo = source.exchangeInfo();
        List<Instrument> instruments = new ArrayList<>();
        for (BinanceFuturesSymbolInfo info : exchangeInfo.symbols()) {
            Optional<BinanceSymbol> symbol = normalizer.venueSymbol(info);
            if (symbol.isEmpty() || !filter.test(symbol.get())) {
                continue;
            }
            BinanceFeeInfo fee = BinanceFuturesInstrumentNormalizer.isPendingListing(info)
                ? null
                : source.commissionRate(symbol.get());
            normalizer.normalize(info, fee, exchangeInfo.serverTime()).ifPresent(instruments::add);
        }
        return instruments;
    }
}
