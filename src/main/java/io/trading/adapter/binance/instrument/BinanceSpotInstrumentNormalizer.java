package io.trading.adapter.binance.instrument;

import io.trading.adapter.common.Clock;
import io.trading.adapter.common.InstrumentCache;
import io.trading.adapter.config.AdapterConfig;
import io.trading.adapter.metrics.AdapterMetrics;
import io.trading.adapter.model.Currency;
import io.trading.adapter.model.instrument.CurrencyPair;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Normalizes spot and margin symbols into {@link CurrencyPair} definitions.
 */
public class BinanceSpotInstrumentNormalizer extends BinanceInstrumentNormalizer {

    public BinanceSpotInstrumentNormalizer(AdapterConfig config, InstrumentCache cache, Clock clock, AdapterMetrics metrics) {
        super(config, cache, clock, metrics);
        if (!accountType.isSpotOrMargin()) {
            throw new IllegalArgumentException("Spot normalizer cannot serve " + accountType);
        }
    }

    /**
     * Normalizes one symbol.
     *
     * @param info         venue symbol entry
     * @param fee          commission for the symbol, null when unknown
     * @param serverTimeMs venue time of the exchange info response
     * @return the definition, or empty when the symbol failed to parse
     */
    public Optional<CurrencyPair> normalize(BinanceSpotSymbolInfo info, BinanceFeeInfo fee, long serverTimeMs) {
        try {
            CurrencyPair pair = parse(info, fee, serverTimeMs);
            loaded(pair);
            return Optional.of(pair);
        } catch (InstrumentParseException | IllegalArgumentException e) {
            failed(info.symbol(), e);
            return Optional.empty();
        }
    }

    private CurrencyPair parse(BinanceSpotSymbolInfo info, BinanceFeeInfo fee, long serverTimeMs) {
        requireField("symbol", info.symbol());
        String baseAsset = requireField("baseAsset", info.baseAsset());
        String quoteAsset = requireField("quoteAsset", info.quoteAsset());
        ParsedFilters filters = filterParser.parse(info.filtersByType(), accountType);
        Currency base = currency(baseAsset, info.resolvedBasePrecision());
        Currency quote = currency(quoteAsset, info.resolvedQuotePrecision());

        return new CurrencyPair(
            instrumentId(info.symbol()),
            info.symbol(),
            base,
            quote,
            filters.pricePrecision(),
            filters.sizePrecision(),
            filters.priceIncrement(),
            filters.sizeIncrement(),
            filters.maxQuantity(),
            filters.minQuantity(),
            money(filters.maxNotional(), quote),
            money(filters.minNotional(), quote),
            filters.maxPrice(),
            filters.minPrice(),
            BigDecimal.ZERO,
            BigDecimal.ZERO,
            makerFee(fee),
            takerFee(fee),
            millisToNanos(serverTimeMs),
            timestampNs()
        );
    }
}
