package io.trading.adapter.binance.instrument;

import io.prometheus.client.CollectorRegistry;
import io.trading.adapter.Fixtures;
import io.trading.adapter.binance.common.BinanceAccountType;
import io.trading.adapter.binance.common.BinanceApiException;
import io.trading.adapter.binance.common.BinanceSymbols;
import io.trading.adapter.common.ConcurrentInstrumentCache;
import io.trading.adapter.common.InstrumentCache;
import io.trading.adapter.config.AdapterConfig;
import io.trading.adapter.metrics.AdapterMetrics;
import io.trading.adapter.model.InstrumentId;
import io.trading.adapter.model.Venue;
import io.trading.adapter.model.instrument.Instrument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BinanceSpotInstrumentProviderTest {

    private static final InstrumentId ETHUSDT = InstrumentId.of("ETHUSDT", Venue.BINANCE);

    @Mock
    private BinanceSpotMarketSource source;

    private CollectorRegistry registry;
    private InstrumentCache cache;
    private BinanceSpotInstrumentProvider provider;
    private BinanceSpotExchangeInfo exchangeInfo;
    private List<BinanceFeeInfo> fees;

    @BeforeEach
    void setUp() {
        registry = new CollectorRegistry();
        cache = new ConcurrentInstrumentCache();
        provider = new BinanceSpotInstrumentProvider(
            AdapterConfig.defaults(BinanceAccountType.SPOT), source, cache, () -> 1L, new AdapterMetrics(registry));

        BinanceExchangeInfoDecoder decoder = new BinanceExchangeInfoDecoder();
        exchangeInfo = decoder.decodeSpotExchangeInfo(Fixtures.load("spot_exchange_info.json"));
        fees = decoder.decodeTradeFees(Fixtures.load("spot_trade_fees.json"));
    }

    @Test
    void testLoadAll() {
        when(source.exchangeInfo()).thenReturn(exchangeInfo);
        when(source.tradeFees()).thenReturn(fees);

        List<Instrument> loaded = provider.loadAll();

        assertEquals(2, loaded.size());
        assertEquals(2, cache.instruments().size());
        assertEquals(2, provider.instruments().size());
        assertEquals(2.0, registry.getSampleValue("binance_adapter_last_load_instruments",
            new String[] {"account_type"}, new String[] {"SPOT"}));

        Instrument btc = provider.find(InstrumentId.of("BTCUSDT", Venue.BINANCE)).orElseThrow();
        assertEquals(0, new BigDecimal("0.0008").compareTo(btc.makerFee()));
        assertSame(btc, cache.instrument(btc.id()).orElseThrow());
    }

    @Test
    void testMalformedSymbolsDoNotAbortLoad() {
        BinanceSpotExchangeInfo mixed = new BinanceExchangeInfoDecoder()
            .decodeSpotExchangeInfo(Fixtures.load("spot_exchange_info_mixed.json"));
        when(source.exchangeInfo()).thenReturn(mixed);
        when(source.tradeFees()).thenReturn(fees);

        List<Instrument> loaded = provider.loadAll();

        assertEquals(2, loaded.size());
        assertTrue(cache.instrument(ETHUSDT).isPresent());
        assertTrue(cache.instrument(InstrumentId.of("SOLUSDT", Venue.BINANCE)).isPresent());
        assertTrue(provider.find(InstrumentId.of("NOBASEUSDT", Venue.BINANCE)).isEmpty());
        assertEquals(1.0, registry.getSampleValue("binance_adapter_parse_failures_total",
            new String[] {"account_type"}, new String[] {"SPOT"}));
        assertEquals(2.0, registry.getSampleValue("binance_adapter_last_load_instruments",
            new String[] {"account_type"}, new String[] {"SPOT"}));
    }

    @Test
    void testLoadIdsRequestsOnlyThoseSymbols() {
        BinanceSpotExchangeInfo subset = new BinanceSpotExchangeInfo(
            exchangeInfo.timezone(), exchangeInfo.serverTime(), List.of(exchangeInfo.symbols().get(0)));
        when(source.exchangeInfo(any(BinanceSymbols.class))).thenReturn(subset);
        when(source.tradeFees()).thenReturn(fees);

        List<Instrument> loaded = provider.loadIds(List.of(ETHUSDT));

        ArgumentCaptor<BinanceSymbols> captor = ArgumentCaptor.forClass(BinanceSymbols.class);
        verify(source).exchangeInfo(captor.capture());
        assertEquals("[\"ETHUSDT\"]", captor.getValue().toJsonArray());
        verify(source, never()).exchangeInfo();
        assertEquals(1, loaded.size());
        assertEquals(ETHUSDT, loaded.get(0).id());
    }

    @Test
    void testLoadOne() {
        BinanceSpotExchangeInfo subset = new BinanceSpotExchangeInfo(
            exchangeInfo.timezone(), exchangeInfo.serverTime(), List.of(exchangeInfo.symbols().get(0)));
        when(source.exchangeInfo(any(BinanceSymbols.class))).thenReturn(subset);
        when(source.tradeFees()).thenReturn(List.of());

        Optional<Instrument> loaded = provider.loadOne(ETHUSDT);

        assertTrue(loaded.isPresent());
        assertEquals(0, BigDecimal.ZERO.compareTo(loaded.get().takerFee()));
    }

    @Test
    void testLoadOneUnknownSymbol() {
        when(source.exchangeInfo(any(BinanceSymbols.class)))
            .thenReturn(new BinanceSpotExchangeInfo("UTC", exchangeInfo.serverTime(), List.of()));
        when(source.tradeFees()).thenReturn(fees);

        assertTrue(provider.loadOne(InstrumentId.of("XYZUSDT", Venue.BINANCE)).isEmpty());
    }

    @Test
    void testLoadIdsEmpty() {
        assertTrue(provider.loadIds(List.of()).isEmpty());
        verifyNoInteractions(source);
    }

    @Test
    void testRejectsOtherVenue() {
        InstrumentId okx = InstrumentId.of("ETHUSDT", Venue.OKX);

        assertThrows(IllegalArgumentException.class, () -> provider.loadOne(okx));
        assertThrows(IllegalArgumentException.class, () -> provider.loadIds(List.of(ETHUSDT, okx)));
        verifyNoInteractions(source);
    }

    @Test
    void testVenueErrorPropagates() {
        when(source.exchangeInfo()).thenThrow(new BinanceApiException(418, -1003, "Way too many requests"));

        BinanceApiException e = assertThrows(BinanceApiException.class, () -> provider.loadAll());
        assertEquals(-1003, e.getCode());
        assertTrue(provider.instruments().isEmpty());
    }
}
