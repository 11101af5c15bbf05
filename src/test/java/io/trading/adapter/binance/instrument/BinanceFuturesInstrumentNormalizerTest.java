package io.trading.adapter.binance.instrument;

import io.prometheus.client.CollectorRegistry;
import io.trading.adapter.Fixtures;
import io.trading.adapter.binance.common.BinanceAccountType;
import io.trading.adapter.common.ConcurrentInstrumentCache;
import io.trading.adapter.common.InstrumentCache;
import io.trading.adapter.config.AdapterConfig;
import io.trading.adapter.metrics.AdapterMetrics;
import io.trading.adapter.model.Currency;
import io.trading.adapter.model.InstrumentId;
import io.trading.adapter.model.Money;
import io.trading.adapter.model.Venue;
import io.trading.adapter.model.instrument.CryptoFuture;
import io.trading.adapter.model.instrument.CryptoPerpetual;
import io.trading.adapter.model.instrument.Instrument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BinanceFuturesInstrumentNormalizerTest {

    private static final long SERVER_TIME_MS = 1700000000000L;
    private static final long NOW_NS = 1700000000123000000L;

    private CollectorRegistry registry;
    private AdapterMetrics metrics;
    private InstrumentCache cache;
    private BinanceFuturesInstrumentNormalizer normalizer;
    private BinanceFuturesExchangeInfo exchangeInfo;

    @BeforeEach
    void setUp() {
        registry = new CollectorRegistry();
        metrics = new AdapterMetrics(registry);
        cache = new ConcurrentInstrumentCache();
        normalizer = normalizer(BinanceAccountType.USDT_FUTURE);
        exchangeInfo = new BinanceExchangeInfoDecoder().decodeFuturesExchangeInfo(Fixtures.load("futures_exchange_info.json"));
    }

    @Test
    void testLinearPerpetualFromFilters() {
        BinanceFuturesSymbolInfo info = new BinanceFuturesSymbolInfo(
            "ETHUSDT", "ETHUSDT", "PERPETUAL", 4133404800000L, 1569398400000L, "TRADING", null,
            "2.5000", "5.0000", "ETH", "USDT", "USDT", 2, 3, 8, 8, null, "COIN",
            List.of(
                BinanceSymbolFilter.builder(BinanceSymbolFilterType.PRICE_FILTER)
                    .price("0.01", "100000", "0.01").build(),
                BinanceSymbolFilter.builder(BinanceSymbolFilterType.LOT_SIZE)
                    .quantity("0.001", "10000", "0.001").build(),
                BinanceSymbolFilter.builder(BinanceSymbolFilterType.MIN_NOTIONAL)
                    .notional("10").build()));

        Instrument instrument = normalizer.normalize(info, null, SERVER_TIME_MS).orElseThrow();

        CryptoPerpetual perpetual = assertInstanceOf(CryptoPerpetual.class, instrument);
        assertEquals(InstrumentId.of("ETHUSDT-PERP", Venue.BINANCE), perpetual.id());
        assertEquals("ETHUSDT", perpetual.rawSymbol());
        assertEquals(2, perpetual.pricePrecision());
        assertEquals(3, perpetual.sizePrecision());
        assertEquals(new BigDecimal("0.01"), perpetual.priceIncrement());
        assertEquals(new BigDecimal("0.001"), perpetual.sizeIncrement());
        assertEquals(Money.of("10", Currency.of("USDT", 8)), perpetual.minNotional());
        assertEquals(Currency.of("USDT", 8), perpetual.settlementCurrency());
        assertFalse(perpetual.isInverse());
        assertEquals(BigDecimal.ONE, perpetual.multiplier());
    }

    @Test
    void testPerpetualFromExchangeInfo() {
        BinanceFeeInfo fee = new BinanceFeeInfo("BTCUSDT", "0.0002", "0.0004");

        Instrument instrument = normalizer.normalize(symbol("BTCUSDT"), fee, SERVER_TIME_MS).orElseThrow();

        CryptoPerpetual perpetual = assertInstanceOf(CryptoPerpetual.class, instrument);
        assertEquals("BTCUSDT-PERP.BINANCE", perpetual.id().toString());
        assertEquals(1, perpetual.pricePrecision());
        assertEquals(new BigDecimal("0.1"), perpetual.priceIncrement());
        assertEquals(0, new BigDecimal("100").compareTo(perpetual.minNotional().amount()));
        assertEquals(new BigDecimal("0.05"), perpetual.marginInit());
        assertEquals(new BigDecimal("0.025"), perpetual.marginMaint());
        assertEquals(0, new BigDecimal("0.0002").compareTo(perpetual.makerFee()));
        assertEquals(0, new BigDecimal("0.0004").compareTo(perpetual.takerFee()));
        assertEquals(SERVER_TIME_MS * 1_000_000L, perpetual.tsEvent());
        assertEquals(NOW_NS, perpetual.tsInit());
    }

    @Test
    void testDatedFuture() {
        Instrument instrument = normalizer.normalize(symbol("ETHUSDT_240628"), null, SERVER_TIME_MS).orElseThrow();

        CryptoFuture future = assertInstanceOf(CryptoFuture.class, instrument);
        assertEquals(InstrumentId.of("ETHUSDT_240628", Venue.BINANCE), future.id());
        assertEquals(1711094400000L * 1_000_000L, future.activationNs());
        assertEquals(1719561600000L * 1_000_000L, future.expirationNs());
        assertEquals(Currency.of("ETH", 8), future.underlying());
        assertEquals(0, new BigDecimal("5").compareTo(future.minNotional().amount()));
    }

    @Test
    void testPendingListingIsSkippedQuietly() {
        BinanceFuturesSymbolInfo pending = symbol("NEWUSDT");

        assertTrue(BinanceFuturesInstrumentNormalizer.isPendingListing(pending));
        assertTrue(normalizer.normalize(pending, null, SERVER_TIME_MS).isEmpty());
        assertEquals(1.0, registry.getSampleValue("binance_adapter_symbols_skipped_total",
            new String[] {"account_type"}, new String[] {"USDT_FUTURE"}));
        assertNull(registry.getSampleValue("binance_adapter_parse_failures_total",
            new String[] {"account_type"}, new String[] {"USDT_FUTURE"}));
    }

    @Test
    void testUnknownMarginAssetFailsOnlyThatSymbol() {
        List<Instrument> loaded = new ArrayList<>();
        for (BinanceFuturesSymbolInfo info : exchangeInfo.symbols()) {
            normalizer.normalize(info, null, SERVER_TIME_MS).ifPresent(loaded::add);
        }

        assertEquals(2, loaded.size());
        assertEquals(1.0, registry.getSampleValue("binance_adapter_parse_failures_total",
            new String[] {"account_type"}, new String[] {"USDT_FUTURE"}));
        assertTrue(loaded.stream().noneMatch(instrument -> instrument.rawSymbol().equals("ODDUSDT")));
    }

    @Test
    void testMissingMarginAssetFails() {
        BinanceFuturesSymbolInfo btc = symbol("BTCUSDT");
        BinanceFuturesSymbolInfo info = new BinanceFuturesSymbolInfo(
            btc.symbol(), btc.pair(), btc.contractType(), btc.deliveryDate(), btc.onboardDate(), btc.status(), null,
            btc.maintMarginPercent(), btc.requiredMarginPercent(), btc.baseAsset(), btc.quoteAsset(),
            null, btc.pricePrecision(), btc.quantityPrecision(), btc.baseAssetPrecision(),
            btc.quotePrecision(), null, btc.underlyingType(), btc.filters());

        assertTrue(normalizer.normalize(info, null, SERVER_TIME_MS).isEmpty());
        assertEquals(1.0, registry.getSampleValue("binance_adapter_parse_failures_total",
            new String[] {"account_type"}, new String[] {"USDT_FUTURE"}));
        assertTrue(cache.currency("BTC").isEmpty());
    }

    @Test
    void testUnknownContractTypeFails() {
        BinanceFuturesSymbolInfo btc = symbol("BTCUSDT");
        BinanceFuturesSymbolInfo info = new BinanceFuturesSymbolInfo(
            btc.symbol(), btc.pair(), "NEXT_YEAR", btc.deliveryDate(), btc.onboardDate(), btc.status(), null,
            btc.maintMarginPercent(), btc.requiredMarginPercent(), btc.baseAsset(), btc.quoteAsset(),
            btc.marginAsset(), btc.pricePrecision(), btc.quantityPrecision(), btc.baseAssetPrecision(),
            btc.quotePrecision(), null, btc.underlyingType(), btc.filters());

        Optional<Instrument> result = normalizer.normalize(info, null, SERVER_TIME_MS);

        assertTrue(result.isEmpty());
        assertEquals(1.0, registry.getSampleValue("binance_adapter_parse_failures_total",
            new String[] {"account_type"}, new String[] {"USDT_FUTURE"}));
    }

    @Test
    void testInverseCoinPerpetual() {
        BinanceFuturesInstrumentNormalizer coin = normalizer(BinanceAccountType.COIN_FUTURE);
        BinanceFuturesExchangeInfo coinInfo = new BinanceExchangeInfoDecoder()
            .decodeFuturesExchangeInfo(Fixtures.load("coin_futures_exchange_info.json"));

        Instrument instrument = coin.normalize(coinInfo.symbols().get(0), null, coinInfo.serverTime()).orElseThrow();

        CryptoPerpetual perpetual = assertInstanceOf(CryptoPerpetual.class, instrument);
        assertEquals(InstrumentId.of("BTCUSD-PERP", Venue.BINANCE), perpetual.id());
        assertEquals("BTCUSD_PERP", perpetual.rawSymbol());
        assertTrue(perpetual.isInverse());
        assertEquals(Currency.of("BTC", 8), perpetual.settlementCurrency());
        assertEquals(BigDecimal.valueOf(100), perpetual.multiplier());
        assertEquals(0, perpetual.sizePrecision());
        assertNull(perpetual.minNotional());
    }

    @Test
    void testRejectsSpotAccount() {
        assertThrows(IllegalArgumentException.class, () -> normalizer(BinanceAccountType.SPOT));
    }

    private BinanceFuturesInstrumentNormalizer normalizer(BinanceAccountType accountType) {
        return new BinanceFuturesInstrumentNormalizer(
            AdapterConfig.defaults(accountType), cache, () -> NOW_NS, metrics);
    }

    private BinanceFuturesSymbolInfo symbol(String name) {
        return exchangeInfo.symbols().stream()
            .filter(info -> info.symbol().equals(name))
            .findFirst()
            .orElseThrow();
    }
}
