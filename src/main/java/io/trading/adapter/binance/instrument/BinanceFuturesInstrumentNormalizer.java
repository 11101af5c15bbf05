package io.trading.adapter.binance.instrument;

import io.trading.adapter.binance.common.BinanceFuturesContractStatus;
import io.trading.adapter.binance.common.BinanceFuturesContractType;
import io.trading.adapter.binance.common.UnrecognizedEnumException;
import io.trading.adapter.common.Clock;
import io.trading.adapter.common.InstrumentCache;
import io.trading.adapter.config.AdapterConfig;
import io.trading.adapter.metrics.AdapterMetrics;
import io.trading.adapter.model.Currency;
import io.trading.adapter.model.InstrumentId;
import io.trading.adapter.model.instrument.CryptoFuture;
import io.trading.adapter.model.instrument.CryptoPerpetual;
import io.trading.adapter.model.instrument.Instrument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Normalizes USD-M and COIN-M contracts into {@link CryptoPerpetual} and {@link CryptoFuture}
 * definitions.
 *
 * Symbols without a contract type or still pending listing are placeholders the venue
 * publishes ahead of launch; they are skipped quietly on every load.
 */
public class BinanceFuturesInstrumentNormalizer extends BinanceInstrumentNormalizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(BinanceFuturesInstrumentNormalizer.class);

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    public BinanceFuturesInstrumentNormalizer(AdapterConfig config, InstrumentCache cache, Clock clock, AdapterMetrics metrics) {
        super(config, cache, clock, metrics);
        if (!accountType.isFutures()) {
            throw new IllegalArgumentException("Futures normalizer cannot serve " + accountType);
        }
    }

    /**
     * Returns whether the venue lists the contract but it cannot trade yet.
     */
    public static boolean isPendingListing(BinanceFuturesSymbolInfo info) {
        return info.contractType() == null
            || info.contractType().isEmpty()
            || BinanceFuturesContractStatus.PENDING_TRADING.getWireValue().equals(info.tradingStatus());
    }

    /**
     * Normalizes one contract.
     *
     * @param info         venue symbol entry
     * @param fee          commission for the symbol, null when unknown
     * @param serverTimeMs venue time of the exchange info response
     * @return the definition, or empty when the contract was skipped or failed to parse
     */
    public Optional<Instrument> normalize(BinanceFuturesSymbolInfo info, BinanceFeeInfo fee, long serverTimeMs) {
        if (isPendingListing(info)) {
            LOGGER.debug("Skipping {}: contract type '{}', status {}",
                info.symbol(), info.contractType(), info.tradingStatus());
            metrics.recordSymbolSkipped(accountType);
            return Optional.empty();
        }
        try {
            Instrument instrument = parse(info, fee, serverTimeMs);
            loaded(instrument);
            return Optional.of(instrument);
        } catch (InstrumentParseException | IllegalArgumentException e) {
            failed(info.symbol(), e);
            return Optional.empty();
        }
    }

    private Instrument parse(BinanceFuturesSymbolInfo info, BinanceFeeInfo fee, long serverTimeMs) {
        requireField("symbol", info.symbol());
        String baseAsset = requireField("baseAsset", info.baseAsset());
        String quoteAsset = requireField("quoteAsset", info.quoteAsset());
        requireField("marginAsset", info.marginAsset());
        BinanceFuturesContractType contractType = contractType(info);
        ParsedFilters filters = filterParser.parse(info.filtersByType(), accountType);

        Currency base = currency(baseAsset, info.resolvedBasePrecision());
        Currency quote = currency(quoteAsset, info.resolvedQuotePrecision());
        Currency settlement = settlement(info, base, quote);
        boolean inverse = settlement.equals(base);
        BigDecimal multiplier = info.contractSize() != null ? BigDecimal.valueOf(info.contractSize()) : BigDecimal.ONE;

        InstrumentId id = instrumentId(info.symbol());
        BigDecimal marginInit = percent(info.requiredMarginPercent());
        BigDecimal marginMaint = percent(info.maintMarginPercent());
        long tsEvent = millisToNanos(serverTimeMs);
        long tsInit = timestampNs();

        return switch (contractType) {
            case PERPETUAL, PERPETUAL_DELIVERING -> new CryptoPerpetual(
                id,
                info.symbol(),
                base,
                quote,
                settlement,
                inverse,
                filters.pricePrecision(),
                filters.sizePrecision(),
                filters.priceIncrement(),
                filters.sizeIncrement(),
                multiplier,
                filters.maxQuantity(),
                filters.minQuantity(),
                money(filters.maxNotional(), quote),
                money(filters.minNotional(), quote),
                filters.maxPrice(),
                filters.minPrice(),
                marginInit,
                marginMaint,
                makerFee(fee),
                takerFee(fee),
                tsEvent,
                tsInit
            );
            case CURRENT_MONTH, NEXT_MONTH, CURRENT_QUARTER, NEXT_QUARTER, CURRENT_QUARTER_DELIVERING -> new CryptoFuture(
                id,
                info.symbol(),
                base,
                quote,
                settlement,
                inverse,
                millisToNanos(required("onboardDate", info.onboardDate())),
                millisToNanos(required("deliveryDate", info.deliveryDate())),
                filters.pricePrecision(),
                filters.sizePrecision(),
                filters.priceIncrement(),
                filters.sizeIncrement(),
                multiplier,
                filters.maxQuantity(),
                filters.minQuantity(),
                money(filters.maxNotional(), quote),
                money(filters.minNotional(), quote),
                filters.maxPrice(),
                filters.minPrice(),
                marginInit,
                marginMaint,
                makerFee(fee),
                takerFee(fee),
                tsEvent,
                tsInit
            );
        };
    }

    private BinanceFuturesContractType contractType(BinanceFuturesSymbolInfo info) {
        try {
            return BinanceFuturesContractType.fromWire(info.contractType());
        } catch (UnrecognizedEnumException e) {
            throw new InstrumentParseException("Unknown contract type '" + info.contractType() + "'", e);
        }
    }

    /**
     * The settlement currency is whichever of base or quote the venue margins the contract in.
     */
    private static Currency settlement(BinanceFuturesSymbolInfo info, Currency base, Currency quote) {
        String marginAsset = info.marginAsset();
        if (base.code().equals(marginAsset)) {
            return base;
        }
        if (quote.code().equals(marginAsset)) {
            return quote;
        }
        throw new InstrumentParseException(String.format(
            "Unrecognized margin asset %s for %s (base %s, quote %s)",
            marginAsset, info.symbol(), base.code(), quote.code()));
    }

    private static BigDecimal percent(String value) {
        if (value == null || value.isBlank()) {
            return BigDecimal.ZERO;
        }
        return new BigDecimal(value).divide(ONE_HUNDRED, 8, RoundingMode.HALF_EVEN).stripTrailingZeros();
    }

    private static long required(String field, Long value) {
        if (value == null) {
            throw new InstrumentParseException("Missing " + field);
        }
        return value;
    }
}
