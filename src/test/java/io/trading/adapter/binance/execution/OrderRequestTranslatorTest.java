package io.trading.adapter.binance.execution;

import io.prometheus.client.CollectorRegistry;
import io.trading.adapter.Fixtures;
import io.trading.adapter.binance.common.BinanceAccountType;
import io.trading.adapter.config.AdapterConfig;
import io.trading.adapter.metrics.AdapterMetrics;
import io.trading.adapter.model.InstrumentId;
import io.trading.adapter.model.LiquiditySide;
import io.trading.adapter.model.OrderSide;
import io.trading.adapter.model.OrderStatus;
import io.trading.adapter.model.OrderType;
import io.trading.adapter.model.PositionSide;
import io.trading.adapter.model.TimeInForce;
import io.trading.adapter.model.TrailingOffsetType;
import io.trading.adapter.model.TriggerType;
import io.trading.adapter.model.Venue;
import io.trading.adapter.model.order.ExecutionReport;
import io.trading.adapter.model.order.OrderIntent;
import io.trading.adapter.model.order.OrderStatusReport;
import io.trading.adapter.model.order.TradeReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OrderRequestTranslatorTest {

    private static final InstrumentId ETHUSDT = InstrumentId.of("ETHUSDT", Venue.BINANCE);
    private static final InstrumentId BTCUSDT_PERP = InstrumentId.of("BTCUSDT-PERP", Venue.BINANCE);
    private static final long NOW_NS = 1700000005000000000L;

    private final BinanceOrderUpdateParser parser = new BinanceOrderUpdateParser();

    private CollectorRegistry registry;
    private AdapterMetrics metrics;
    private OrderRequestTranslator spot;
    private OrderRequestTranslator futures;

    @BeforeEach
    void setUp() {
        registry = new CollectorRegistry();
        metrics = new AdapterMetrics(registry);
        spot = translator(AdapterConfig.defaults(BinanceAccountType.SPOT), false);
        futures = translator(AdapterConfig.defaults(BinanceAccountType.USDT_FUTURE), false);
    }

    // -- INTERNAL TO VENUE ------------------------------------------------------------------

    @Test
    void testSpotPostOnlyBecomesLimitMaker() {
        OrderIntent intent = limit(ETHUSDT, "O-1").postOnly(true).build();

        WireOrderFields fields = accepted(spot.toWire(intent));

        assertEquals("LIMIT_MAKER", fields.get(WireOrderFields.TYPE).orElseThrow());
        assertFalse(fields.has(WireOrderFields.TIME_IN_FORCE));
        assertEquals(List.of("symbol", "side", "type", "quantity", "price", "newClientOrderId", "recvWindow"),
            List.copyOf(fields.parameters().keySet()));
    }

    @Test
    void testFuturesPostOnlyUsesGtx() {
        OrderIntent intent = limit(BTCUSDT_PERP, "O-2").postOnly(true).build();

        WireOrderFields fields = accepted(futures.toWire(intent));

        assertEquals("BTCUSDT", fields.get(WireOrderFields.SYMBOL).orElseThrow());
        assertEquals("LIMIT", fields.get(WireOrderFields.TYPE).orElseThrow());
        assertEquals("GTX", fields.get(WireOrderFields.TIME_IN_FORCE).orElseThrow());
    }

    @Test
    void testLimitOrderFields() {
        OrderIntent intent = limit(ETHUSDT, "O-3").build();

        WireOrderFields fields = accepted(spot.toWire(intent));

        assertEquals("ETHUSDT", fields.get(WireOrderFields.SYMBOL).orElseThrow());
        assertEquals("BUY", fields.get(WireOrderFields.SIDE).orElseThrow());
        assertEquals("LIMIT", fields.get(WireOrderFields.TYPE).orElseThrow());
        assertEquals("GTC", fields.get(WireOrderFields.TIME_IN_FORCE).orElseThrow());
        assertEquals("1.5", fields.get(WireOrderFields.QUANTITY).orElseThrow());
        assertEquals("2000.00", fields.get(WireOrderFields.PRICE).orElseThrow());
        assertEquals("O-3", fields.get(WireOrderFields.NEW_CLIENT_ORDER_ID).orElseThrow());
        assertEquals("5000", fields.get(WireOrderFields.RECV_WINDOW).orElseThrow());
        assertFalse(fields.has(WireOrderFields.WORKING_TYPE));
        assertFalse(fields.has(WireOrderFields.POSITION_SIDE));
    }

    @Test
    void testMarketOrderTakesNoTimeInForce() {
        OrderIntent intent = OrderIntent.builder()
            .instrumentId(ETHUSDT)
            .clientOrderId("O-4")
            .side(OrderSide.SELL)
            .orderType(OrderType.MARKET)
            .quantity("0.25")
            .build();

        WireOrderFields fields = accepted(spot.toWire(intent));

        assertEquals("MARKET", fields.get(WireOrderFields.TYPE).orElseThrow());
        assertFalse(fields.has(WireOrderFields.TIME_IN_FORCE));
        assertFalse(fields.has(WireOrderFields.PRICE));
    }

    @Test
    void testFuturesStopLimitParameterOrder() {
        OrderIntent intent = OrderIntent.builder()
            .instrumentId(BTCUSDT_PERP)
            .clientOrderId("O-5")
            .side(OrderSide.SELL)
            .orderType(OrderType.STOP_LIMIT)
            .quantity("0.010")
            .price("36400")
            .triggerPrice("36500")
            .build();

        WireOrderFields fields = accepted(futures.toWire(intent));

        assertEquals(List.of("symbol", "side", "type", "timeInForce", "quantity", "price", "stopPrice",
                "workingType", "newClientOrderId", "recvWindow"),
            List.copyOf(fields.parameters().keySet()));
        assertEquals("STOP", fields.get(WireOrderFields.TYPE).orElseThrow());
        assertEquals("36500", fields.get(WireOrderFields.STOP_PRICE).orElseThrow());
        assertEquals("CONTRACT_PRICE", fields.get(WireOrderFields.WORKING_TYPE).orElseThrow());
    }

    @Test
    void testSpotStopLimitHasNoWorkingType() {
        OrderIntent intent = OrderIntent.builder()
            .instrumentId(ETHUSDT)
            .clientOrderId("O-6")
            .side(OrderSide.SELL)
            .orderType(OrderType.STOP_LIMIT)
            .quantity("1")
            .price("1900")
            .triggerPrice("1950")
            .triggerType(TriggerType.LAST_PRICE)
            .build();

        WireOrderFields fields = accepted(spot.toWire(intent));

        assertEquals("STOP_LOSS_LIMIT", fields.get(WireOrderFields.TYPE).orElseThrow());
        assertEquals("1950", fields.get(WireOrderFields.STOP_PRICE).orElseThrow());
        assertFalse(fields.has(WireOrderFields.WORKING_TYPE));
    }

    @Test
    void testSpotStopMarketRejectedWithAlternatives() {
        OrderIntent intent = OrderIntent.builder()
            .instrumentId(ETHUSDT)
            .clientOrderId("O-7")
            .side(OrderSide.SELL)
            .orderType(OrderType.STOP_MARKET)
            .quantity("1")
            .triggerPrice("1900")
            .build();

        OrderRejection rejection = rejected(spot.toWire(intent));

        assertEquals("O-7", rejection.clientOrderId());
        assertEquals(OrderRejection.Reason.UNSUPPORTED_ORDER_TYPE, rejection.reason());
        assertTrue(rejection.message().contains("STOP_MARKET"));
        assertEquals(List.of("MARKET", "LIMIT", "STOP_LIMIT", "LIMIT_IF_TOUCHED"), rejection.alternatives());
        assertEquals(1.0, registry.getSampleValue("binance_adapter_order_rejections_total",
            new String[] {"account_type", "reason"}, new String[] {"SPOT", "UNSUPPORTED_ORDER_TYPE"}));
    }

    @Test
    void testUnsupportedTimeInForce() {
        OrderIntent intent = limit(ETHUSDT, "O-8").timeInForce(TimeInForce.DAY).build();

        OrderRejection rejection = rejected(spot.toWire(intent));

        assertEquals(OrderRejection.Reason.UNSUPPORTED_TIME_IN_FORCE, rejection.reason());
        assertEquals(List.of("GTC", "GTD", "FOK", "IOC"), rejection.alternatives());
    }

    @Test
    void testPostOnlyRequiresLimit() {
        OrderIntent intent = OrderIntent.builder()
            .instrumentId(BTCUSDT_PERP)
            .clientOrderId("O-9")
            .side(OrderSide.BUY)
            .orderType(OrderType.MARKET)
            .quantity("0.001")
            .postOnly(true)
            .build();

        assertEquals(OrderRejection.Reason.POST_ONLY_REQUIRES_LIMIT, rejected(futures.toWire(intent)).reason());
    }

    @Test
    void testSpotGtdDowngradedToGtc() {
        OrderIntent intent = limit(ETHUSDT, "O-10").timeInForce(TimeInForce.GTD).build();

        WireOrderFields fields = accepted(spot.toWire(intent));

        assertEquals("GTC", fields.get(WireOrderFields.TIME_IN_FORCE).orElseThrow());
    }

    @Test
    void testFuturesGtdKept() {
        OrderIntent intent = limit(BTCUSDT_PERP, "O-11").timeInForce(TimeInForce.GTD).build();

        WireOrderFields fields = accepted(futures.toWire(intent));

        assertEquals("GTD", fields.get(WireOrderFields.TIME_IN_FORCE).orElseThrow());
    }

    @Test
    void testTriggerTypes() {
        OrderIntent spotMark = OrderIntent.builder()
            .instrumentId(ETHUSDT)
            .clientOrderId("O-12")
            .side(OrderSide.SELL)
            .orderType(OrderType.STOP_LIMIT)
            .quantity("1")
            .price("1900")
            .triggerPrice("1950")
            .triggerType(TriggerType.MARK_PRICE)
            .build();
        OrderRejection rejection = rejected(spot.toWire(spotMark));
        assertEquals(OrderRejection.Reason.UNSUPPORTED_TRIGGER_TYPE, rejection.reason());
        assertEquals(List.of("DEFAULT", "LAST_PRICE"), rejection.alternatives());

        OrderIntent futuresMark = OrderIntent.builder()
            .instrumentId(BTCUSDT_PERP)
            .clientOrderId("O-13")
            .side(OrderSide.SELL)
            .orderType(OrderType.STOP_MARKET)
            .quantity("0.010")
            .triggerPrice("36500")
            .triggerType(TriggerType.MARK_PRICE)
            .build();
        WireOrderFields fields = accepted(futures.toWire(futuresMark));
        assertEquals("STOP_MARKET", fields.get(WireOrderFields.TYPE).orElseThrow());
        assertEquals("MARK_PRICE", fields.get(WireOrderFields.WORKING_TYPE).orElseThrow());
        assertFalse(fields.has(WireOrderFields.TIME_IN_FORCE));

        OrderIntent futuresIndex = OrderIntent.builder()
            .instrumentId(BTCUSDT_PERP)
            .clientOrderId("O-14")
            .side(OrderSide.SELL)
            .orderType(OrderType.STOP_MARKET)
            .quantity("0.010")
            .triggerPrice("36500")
            .triggerType(TriggerType.INDEX_PRICE)
            .build();
        assertEquals(OrderRejection.Reason.UNSUPPORTED_TRIGGER_TYPE, rejected(futures.toWire(futuresIndex)).reason());
    }

    @Test
    void testTrailingStopCallbackRate() {
        OrderIntent intent = trailing("O-15", "100").triggerPrice("36000").build();

        WireOrderFields fields = accepted(futures.toWire(intent));

        assertEquals("TRAILING_STOP_MARKET", fields.get(WireOrderFields.TYPE).orElseThrow());
        assertEquals("1", fields.get(WireOrderFields.CALLBACK_RATE).orElseThrow());
        assertEquals("36000", fields.get(WireOrderFields.ACTIVATION_PRICE).orElseThrow());
        assertEquals("CONTRACT_PRICE", fields.get(WireOrderFields.WORKING_TYPE).orElseThrow());
        assertFalse(fields.has(WireOrderFields.STOP_PRICE));
        assertFalse(fields.has(WireOrderFields.TIME_IN_FORCE));
    }

    @Test
    void testTrailingStopCallbackRateBounds() {
        assertEquals("0.1", accepted(futures.toWire(trailing("O-16", "10").build()))
            .get(WireOrderFields.CALLBACK_RATE).orElseThrow());
        assertEquals("10", accepted(futures.toWire(trailing("O-17", "1000").build()))
            .get(WireOrderFields.CALLBACK_RATE).orElseThrow());

        OrderRejection tooTight = rejected(futures.toWire(trailing("O-18", "5").build()));
        assertEquals(OrderRejection.Reason.CALLBACK_RATE_OUT_OF_BOUNDS, tooTight.reason());
        assertTrue(tooTight.message().contains("0.05"));

        OrderRejection tooWide = rejected(futures.toWire(trailing("O-19", "1001").build()));
        assertEquals(OrderRejection.Reason.CALLBACK_RATE_OUT_OF_BOUNDS, tooWide.reason());
    }

    @Test
    void testTrailingStopOffsetType() {
        OrderIntent priceOffset = OrderIntent.builder()
            .instrumentId(BTCUSDT_PERP)
            .clientOrderId("O-20")
            .side(OrderSide.BUY)
            .orderType(OrderType.TRAILING_STOP_MARKET)
            .quantity("0.4")
            .trailingOffset("50", TrailingOffsetType.PRICE)
            .build();
        assertEquals(OrderRejection.Reason.UNSUPPORTED_TRAILING_OFFSET_TYPE, rejected(futures.toWire(priceOffset)).reason());

        OrderIntent noOffset = OrderIntent.builder()
            .instrumentId(BTCUSDT_PERP)
            .clientOrderId("O-21")
            .side(OrderSide.BUY)
            .orderType(OrderType.TRAILING_STOP_MARKET)
            .quantity("0.4")
            .build();
        assertEquals(OrderRejection.Reason.MISSING_TRAILING_OFFSET, rejected(futures.toWire(noOffset)).reason());
    }

    @Test
    void testReduceOnly() {
        OrderIntent intent = limit(BTCUSDT_PERP, "O-22").reduceOnly(true).build();

        assertEquals("true", accepted(futures.toWire(intent)).get(WireOrderFields.REDUCE_ONLY).orElseThrow());

        OrderRequestTranslator withoutFlag = translator(
            AdapterConfig.builder().accountType(BinanceAccountType.USDT_FUTURE).useReduceOnly(false).build(), false);
        assertFalse(accepted(withoutFlag.toWire(intent)).has(WireOrderFields.REDUCE_ONLY));

        OrderIntent spotIntent = limit(ETHUSDT, "O-23").reduceOnly(true).build();
        assertEquals(OrderRejection.Reason.REDUCE_ONLY_NOT_SUPPORTED, rejected(spot.toWire(spotIntent)).reason());
    }

    @Test
    void testIcebergQuantity() {
        OrderIntent spotIceberg = limit(ETHUSDT, "O-24").displayQty("0.5").build();
        assertEquals("0.5", accepted(spot.toWire(spotIceberg)).get(WireOrderFields.ICEBERG_QTY).orElseThrow());

        OrderIntent futuresIceberg = limit(BTCUSDT_PERP, "O-25").displayQty("0.5").build();
        assertEquals(OrderRejection.Reason.ICEBERG_NOT_SUPPORTED, rejected(futures.toWire(futuresIceberg)).reason());
    }

    @Test
    void testIcebergRequiresLimitOrder() {
        OrderIntent marketIceberg = OrderIntent.builder()
            .instrumentId(ETHUSDT)
            .clientOrderId("O-40")
            .side(OrderSide.SELL)
            .orderType(OrderType.MARKET)
            .quantity("2")
            .displayQty("0.5")
            .build();

        OrderRejection rejection = rejected(spot.toWire(marketIceberg));
        assertEquals(OrderRejection.Reason.ICEBERG_NOT_SUPPORTED, rejection.reason());
        assertEquals(List.of("LIMIT", "STOP_LIMIT", "LIMIT_IF_TOUCHED"), rejection.alternatives());
        assertEquals(1.0, registry.getSampleValue("binance_adapter_order_rejections_total",
            new String[]{"account_type", "reason"}, new String[]{"SPOT", "ICEBERG_NOT_SUPPORTED"}));

        OrderIntent stopLimitIceberg = OrderIntent.builder()
            .instrumentId(ETHUSDT)
            .clientOrderId("O-41")
            .side(OrderSide.SELL)
            .orderType(OrderType.STOP_LIMIT)
            .quantity("2")
            .price("1900")
            .triggerPrice("1950")
            .displayQty("0.5")
            .build();

        WireOrderFields fields = accepted(spot.toWire(stopLimitIceberg));
        assertEquals("STOP_LOSS_LIMIT", fields.get(WireOrderFields.TYPE).orElseThrow());
        assertEquals("0.5", fields.get(WireOrderFields.ICEBERG_QTY).orElseThrow());
    }

    @Test
    void testHedgeModeConfiguration() {
        assertThrows(AdapterConfigurationException.class,
            () -> translator(AdapterConfig.defaults(BinanceAccountType.USDT_FUTURE), true));
        assertThrows(AdapterConfigurationException.class, () -> translator(
            AdapterConfig.builder().accountType(BinanceAccountType.SPOT).useReduceOnly(false).build(), true));
    }

    @Test
    void testHedgeModePositionSide() {
        OrderRequestTranslator hedge = hedgeTranslator();
        assertTrue(hedge.isHedgeMode());

        WireOrderFields fields = accepted(hedge.toWire(limit(BTCUSDT_PERP, "O-26").positionSide(PositionSide.LONG).build()));
        assertEquals("LONG", fields.get(WireOrderFields.POSITION_SIDE).orElseThrow());

        OrderRejection missing = rejected(hedge.toWire(limit(BTCUSDT_PERP, "O-27").build()));
        assertEquals(OrderRejection.Reason.POSITION_SIDE_REQUIRED, missing.reason());
        assertEquals(List.of("LONG", "SHORT"), missing.alternatives());

        OrderRejection flat = rejected(hedge.toWire(limit(BTCUSDT_PERP, "O-28").positionSide(PositionSide.FLAT).build()));
        assertEquals(OrderRejection.Reason.POSITION_SIDE_REQUIRED, flat.reason());
    }

    @Test
    void testHedgeModeReduceOnlyThrows() {
        OrderIntent intent = limit(BTCUSDT_PERP, "O-29").positionSide(PositionSide.SHORT).reduceOnly(true).build();

        assertThrows(AdapterConfigurationException.class, () -> hedgeTranslator().toWire(intent));
    }

    @Test
    void testOneWayModeRejectsPositionSide() {
        OrderIntent intent = limit(BTCUSDT_PERP, "O-30").positionSide(PositionSide.SHORT).build();

        assertEquals(OrderRejection.Reason.POSITION_SIDE_NOT_ALLOWED, rejected(futures.toWire(intent)).reason());
        assertTrue(futures.toWire(limit(BTCUSDT_PERP, "O-31").positionSide(PositionSide.FLAT).build()).isAccepted());
    }

    @Test
    void testRejectsOtherVenue() {
        OrderIntent intent = limit(InstrumentId.of("ETHUSDT", Venue.BYBIT), "O-32").build();

        assertThrows(IllegalArgumentException.class, () -> spot.toWire(intent));
    }

    // -- VENUE TO INTERNAL ------------------------------------------------------------------

    @Test
    void testSpotTradeReport() {
        BinanceOrderUpdate update = parser.parse(Fixtures.load("execution_report_trade.json")).orElseThrow();

        ExecutionReport report = spot.fromWire(update);

        OrderStatusReport status = report.status();
        assertEquals(ETHUSDT, status.instrumentId());
        assertEquals("O-20231114-001", status.clientOrderId());
        assertEquals("4293153", status.venueOrderId());
        assertEquals(OrderSide.BUY, status.side());
        assertEquals(OrderType.LIMIT, status.orderType());
        assertEquals(TimeInForce.GTC, status.timeInForce());
        assertEquals(OrderStatus.PARTIALLY_FILLED, status.orderStatus());
        assertTrue(status.postOnly());
        assertNull(status.triggerPrice());
        assertNull(status.positionSide());
        assertEquals(TriggerType.DEFAULT, status.triggerType());
        assertEquals(0, new BigDecimal("1").compareTo(status.leavesQty()));
        assertEquals(1700000000999L * 1_000_000L, status.tsLast());
        assertEquals(NOW_NS, status.tsInit());

        TradeReport trade = report.tradeReport().orElseThrow();
        assertEquals("12345", trade.tradeId());
        assertEquals(LiquiditySide.MAKER, trade.liquiditySide());
        assertEquals(0, new BigDecimal("0.5").compareTo(trade.lastQty()));
        assertEquals(0, new BigDecimal("2000").compareTo(trade.lastPx()));
        assertEquals(0, new BigDecimal("0.0005").compareTo(trade.commission()));
        assertEquals("ETH", trade.commissionAsset());
    }

    @Test
    void testSpotCancelReport() {
        BinanceOrderUpdate update = parser.parse(Fixtures.load("execution_report_canceled.json")).orElseThrow();

        ExecutionReport report = spot.fromWire(update);

        assertEquals("O-20231114-002", report.status().clientOrderId());
        assertEquals(OrderStatus.CANCELED, report.status().orderStatus());
        assertTrue(report.status().isTerminal());
        assertTrue(report.tradeReport().isEmpty());
    }

    @Test
    void testFuturesTradeReport() {
        BinanceOrderUpdate update = parser.parse(Fixtures.load("order_trade_update.json")).orElseThrow();

        ExecutionReport report = futures.fromWire(update);

        OrderStatusReport status = report.status();
        assertEquals(BTCUSDT_PERP, status.instrumentId());
        assertEquals(OrderType.STOP_MARKET, status.orderType());
        assertEquals(OrderStatus.FILLED, status.orderStatus());
        assertEquals(TriggerType.MARK_PRICE, status.triggerType());
        assertEquals(PositionSide.FLAT, status.positionSide());
        assertNull(status.price());
        assertEquals(new BigDecimal("36500"), status.triggerPrice());
        assertEquals(new BigDecimal("36500.10"), status.avgPx());
        assertTrue(status.reduceOnly());
        assertFalse(status.postOnly());

        TradeReport trade = report.tradeReport().orElseThrow();
        assertEquals("4432", trade.tradeId());
        assertEquals(LiquiditySide.TAKER, trade.liquiditySide());
        assertEquals("USDT", trade.commissionAsset());
        assertEquals(1700000002990L * 1_000_000L, trade.tsEvent());
    }

    @Test
    void testSelfTradePreventionExpiryIsCanceled() {
        BinanceOrderUpdate update = parser.parse(Fixtures.load("order_trade_update_stp.json")).orElseThrow();

        ExecutionReport report = futures.fromWire(update);

        assertEquals(OrderStatus.CANCELED, report.status().orderStatus());
        assertEquals(PositionSide.LONG, report.status().positionSide());
        assertTrue(report.status().postOnly());
        assertEquals(TimeInForce.GTC, report.status().timeInForce());
        assertNull(report.status().avgPx());
        assertTrue(report.tradeReport().isEmpty());
    }

    @Test
    void testRestOrderReport() {
        BinanceOrderUpdate update = parser.parseOrder(Fixtures.load("futures_order.json"));

        ExecutionReport report = hedgeTranslator().fromWire(update);

        OrderStatusReport status = report.status();
        assertEquals(OrderType.TRAILING_STOP_MARKET, status.orderType());
        assertEquals(OrderStatus.ACCEPTED, status.orderStatus());
        assertEquals(PositionSide.SHORT, status.positionSide());
        assertEquals(TriggerType.LAST_PRICE, status.triggerType());
        assertNull(status.avgPx());
        assertEquals(0, new BigDecimal("0.4").compareTo(status.leavesQty()));
        assertTrue(report.tradeReport().isEmpty());
    }

    private OrderRequestTranslator translator(AdapterConfig config, boolean hedgeMode) {
        return OrderRequestTranslator.create(config, hedgeMode, () -> NOW_NS, metrics);
    }

    private OrderRequestTranslator hedgeTranslator() {
        return translator(AdapterConfig.builder()
            .accountType(BinanceAccountType.USDT_FUTURE)
            .useReduceOnly(false)
            .build(), true);
    }

    private static OrderIntent.Builder limit(InstrumentId instrumentId, String clientOrderId) {
        return OrderIntent.builder()
            .instrumentId(instrumentId)
            .clientOrderId(clientOrderId)
            .side(OrderSide.BUY)
            .orderType(OrderType.LIMIT)
            .quantity("1.5")
            .price("2000.00");
    }

    private static OrderIntent.Builder trailing(String clientOrderId, String basisPoints) {
        return OrderIntent.builder()
            .instrumentId(BTCUSDT_PERP)
            .clientOrderId(clientOrderId)
            .side(OrderSide.BUY)
            .orderType(OrderType.TRAILING_STOP_MARKET)
            .quantity("0.4")
            .trailingOffset(basisPoints, TrailingOffsetType.BASIS_POINTS);
    }

    private static WireOrderFields accepted(TranslationResult result) {
        assertTrue(result.isAccepted(), () -> "expected acceptance, got " + result);
        return assertInstanceOf(WireOrderFields.class, result);
    }

    private static OrderRejection rejected(TranslationResult result) {
        return assertInstanceOf(OrderRejection.class, result);
    }
}
