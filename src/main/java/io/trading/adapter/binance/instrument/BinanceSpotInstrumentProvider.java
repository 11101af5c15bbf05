package io.trading.adapter.binance.instrument;

import io.trading.adapter.binance.common.BinanceSymbols;
import io.trading.adapter.common.Clock;
import io.trading.adapter.common.InstrumentCache;
import io.trading.adapter.config.AdapterConfig;
import io.trading.adapter.metrics.AdapterMetrics;
import io.trading.adapter.model.InstrumentId;
import io.trading.adapter.model.instrument.Instrument;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Instrument provider for spot and margin accounts.
 */
public class BinanceSpotInstrumentProvider extends BinanceInstrumentProvider {

    private final BinanceSpotMarketSource source;
    private final BinanceSpotInstrumentNormalizer normalizer;

    public BinanceSpotInstrumentProvider(
        AdapterConfig config,
        BinanceSpotMarketSource source,
        InstrumentCache cache,
        Clock clock,
        AdapterMetrics metrics
    ) {
        super(config.accountType(), cache, metrics);
        this.source = source;
        this.normalizer = new BinanceSpotInstrumentNormalizer(config, cache, clock, metrics);
    }

    @Override
    protected List<Instrument> fetchAll() {
        return normalize(source.exchangeInfo());
    }

    @Override
    protected List<Instrument> fetch(Collection<InstrumentId> instrumentIds) {
        BinanceSymbols symbols = BinanceSymbols.of(
            instrumentIds.stream().map(id -> id.symbol().value()).toList(), accountType);
        return normalize(source.exchangeInfo(symbols));
    }

    private List<Instrument> normalize(BinanceSpotExchangeInfo exchangeInfo) {
        Map<String, BinanceFeeInfo> fees = new HashMap<>();
        for (BinanceFeeInfo fee : source.tradeFees()) {
            fees.put(fee.symbol(), fee);
        }
        List<Instrument> instruments = new ArrayList<>(exchangeInfo.symbols().size());
        for (BinanceSpotSymbolInfo info : exchangeInfo.symbols()) {
            normalizer.normalize(info, fees.get(info.symbol()), exchangeInfo.serverTime())
                .ifPresent(instruments::add);
        }
        return instruments;
    }
}
