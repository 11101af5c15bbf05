package io.trading.adapter.binance.execution;

import io.trading.adapter.binance.common.BinanceAccountType;
import io.trading.adapter.binance.common.BinanceEnumParser;
import io.trading.adapter.binance.common.BinanceOrderType;
import io.trading.adapter.binance.common.BinanceSymbol;
import io.trading.adapter.binance.common.BinanceTimeInForce;
import io.trading.adapter.common.Clock;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;

/**
 * Translates internal orders to venue request parameters and venue order updates back to
 * internal execution reports.
 *
 * Orders the venue cannot accept come back as an {@link OrderRejection}; only configuration
 * contradictions throw. Instances hold no mutable state and may be shared between threads.
 */
public class OrderRequestTranslator {

    private static final Logger LOGGER = LoggerFactory.getLogger(OrderRequestTranslator.class);

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);
    private static final long NANOS_PER_MILLI = 1_000_000L;

    private final AdapterConfig config;
    private final BinanceAccountType accountType;
    private final boolean hedgeMode;
    private final BinanceEnumParser enumParser;
    private final BinanceOrderRules rules;
    private final Clock clock;
    private final AdapterMetrics metrics;

    private OrderRequestTranslator(AdapterConfig config, boolean hedgeMode, Clock clock, AdapterMetrics metrics) {
        this.config = config;
        this.accountType = config.accountType();
        this.hedgeMode = hedgeMode;
        this.enumParser = BinanceEnumParser.forAccountType(accountType);
        this.rules = BinanceOrderRules.forAccountType(accountType);
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Creates a translator for a session.
     *
     * @param config    adapter configuration, selecting the account type
     * @param hedgeMode whether the account holds separate long and short positions
     * @throws AdapterConfigurationException if hedge mode is combined with reduce-only orders,
     *                                       or requested for a spot or margin account
     */
    public static OrderRequestTranslator create(AdapterConfig config, boolean hedgeMode, Clock clock, AdapterMetrics metrics) {
        if (hedgeMode && !config.accountType().isFutures()) {
            throw new AdapterConfigurationException("Hedge mode is not available for " + config.accountType());
        }
        if (hedgeMode && config.useReduceOnly()) {
            throw new AdapterConfigurationException(
                "useReduceOnly cannot be enabled while the account is in hedge mode");
        }
        return new OrderRequestTranslator(config, hedgeMode, clock, metrics);
    }

    public BinanceAccountType getAccountType() {
        return accountType;
    }

    public boolean isHedgeMode() {
        return hedgeMode;
    }

    // -- INTERNAL TO VENUE ------------------------------------------------------------------

    /**
     * Translates an order for submission.
     *
     * @return the venue parameters, or a rejection naming the failed constraint
     * @throws AdapterConfigurationException if a reduce-only order is submitted in hedge mode
     * @throws IllegalArgumentException      if the order targets another venue
     */
    public TranslationResult toWire(OrderIntent intent) {
        if (intent.instrumentId().venue() != Venue.BINANCE) {
            throw new IllegalArgumentException("Order " + intent.clientOrderId() + " targets " + intent.instrumentId());
        }
        if (intent.reduceOnly() && hedgeMode) {
            throw new AdapterConfigurationException(
                "Reduce-only order " + intent.clientOrderId() + " submitted while the account is in hedge mode");
        }

        OrderRejection rejection = validate(intent);
        if (rejection != null) {
            LOGGER.warn("Rejected order {}: {}", intent.clientOrderId(), rejection.message());
            metrics.recordOrderRejection(accountType, rejection.reason().name());
            return rejection;
        }

        OrderType orderType = intent.orderType();
        BinanceOrderType venueType = enumParser.parseInternalOrderType(orderType, intent.postOnly());
        boolean trailing = orderType == OrderType.TRAILING_STOP_MARKET;

        return WireOrderFields.builder()
            .put(WireOrderFields.SYMBOL, BinanceSymbol.of(intent.instrumentId().symbol().value(), accountType))
            .put(WireOrderFields.SIDE, enumParser.parseInternalOrderSide(intent.side()))
            .put(WireOrderFields.TYPE, venueType)
            .put(WireOrderFields.TIME_IN_FORCE, timeInForce(intent, venueType))
            .put(WireOrderFields.QUANTITY, intent.quantity().toPlainString())
            .put(WireOrderFields.PRICE, orderType.hasPrice() ? intent.price().toPlainString() : null)
            .put(WireOrderFields.STOP_PRICE, orderType.hasTriggerPrice() ? intent.triggerPrice().toPlainString() : null)
            .put(WireOrderFields.WORKING_TYPE, workingType(intent))
            .put(WireOrderFields.ACTIVATION_PRICE,
                trailing && intent.triggerPrice() != null ? intent.triggerPrice().toPlainString() : null)
            .put(WireOrderFields.CALLBACK_RATE, trailing ? callbackRate(intent).toPlainString() : null)
            .put(WireOrderFields.ICEBERG_QTY, intent.displayQty() != null ? intent.displayQty().toPlainString() : null)
            .put(WireOrderFields.REDUCE_ONLY, intent.reduceOnly() && config.useReduceOnly() ? "true" : null)
            .put(WireOrderFields.POSITION_SIDE, hedgeMode ? enumParser.parseInternalPositionSide(intent.positionSide()) : null)
            .put(WireOrderFields.NEW_CLIENT_ORDER_ID, intent.clientOrderId())
            .put(WireOrderFields.RECV_WINDOW, config.recvWindowMs())
            .build();
    }

    private OrderRejection validate(OrderIntent intent) {
        OrderType orderType = intent.orderType();
        if (!rules.supports(orderType)) {
            return reject(intent, OrderRejection.Reason.UNSUPPORTED_ORDER_TYPE,
                orderType + " orders are not supported for " + accountType, names(rules.getOrderTypes()));
        }
        if (!rules.supports(intent.timeInForce())) {
            return reject(intent, OrderRejection.Reason.UNSUPPORTED_TIME_IN_FORCE,
                intent.timeInForce() + " time in force is not supported for " + accountType,
                names(rules.getTimeInForces()));
        }
        if (intent.postOnly() && orderType != OrderType.LIMIT) {
            return reject(intent, OrderRejection.Reason.POST_ONLY_REQUIRES_LIMIT,
                "post-only requires a LIMIT order, was " + orderType, List.of(OrderType.LIMIT.name()));
        }
        if (intent.reduceOnly() && accountType.isSpotOrMargin()) {
            return reject(intent, OrderRejection.Reason.REDUCE_ONLY_NOT_SUPPORTED,
                "reduce-only orders are not supported for " + accountType, List.of());
        }
        if (intent.displayQty() != null && !accountType.isSpotOrMargin()) {
            return reject(intent, OrderRejection.Reason.ICEBERG_NOT_SUPPORTED,
                "iceberg orders are not supported for " + accountType, List.of());
        }
        if (intent.displayQty() != null && !orderType.hasPrice()) {
            return reject(intent, OrderRejection.Reason.ICEBERG_NOT_SUPPORTED,
                "iceberg requires a limit order, was " + orderType,
                names(rules.getOrderTypes().stream().filter(OrderType::hasPrice).toList()));
        }

        OrderRejection positionRejection = validatePositionSide(intent);
        if (positionRejection != null) {
            return positionRejection;
        }

        if (orderType.hasTriggerPrice() || orderType == OrderType.TRAILING_STOP_MARKET) {
            List<TriggerType> supported = accountType.isSpotOrMargin()
                ? List.of(TriggerType.DEFAULT, TriggerType.LAST_PRICE)
                : List.of(TriggerType.DEFAULT, TriggerType.LAST_PRICE, TriggerType.MARK_PRICE);
            if (!supported.contains(intent.triggerType())) {
                return reject(intent, OrderRejection.Reason.UNSUPPORTED_TRIGGER_TYPE,
                    intent.triggerType() + " trigger is not supported for " + accountType, names(supported));
            }
        }

        if (orderType == OrderType.TRAILING_STOP_MARKET) {
            return validateTrailing(intent);
        }
        return null;
    }

    private OrderRejection validatePositionSide(OrderIntent intent) {
        PositionSide positionSide = intent.positionSide();
        boolean directional = positionSide == PositionSide.LONG || positionSide == PositionSide.SHORT;
        if (hedgeMode && !directional) {
            return reject(intent, OrderRejection.Reason.POSITION_SIDE_REQUIRED,
                "hedge mode requires a LONG or SHORT position side, was " + positionSide,
                List.of(PositionSide.LONG.name(), PositionSide.SHORT.name()));
        }
        if (!hedgeMode && directional) {
            return reject(intent, OrderRejection.Reason.POSITION_SIDE_NOT_ALLOWED,
                "position side " + positionSide + " requires hedge mode",
                List.of(PositionSide.FLAT.name()));
        }
        return null;
    }

    private OrderRejection validateTrailing(OrderIntent intent) {
        if (intent.trailingOffsetType() != TrailingOffsetType.BASIS_POINTS) {
            return reject(intent, OrderRejection.Reason.UNSUPPORTED_TRAILING_OFFSET_TYPE,
                intent.trailingOffsetType() + " trailing offsets are not supported",
                List.of(TrailingOffsetType.BASIS_POINTS.name()));
        }
        if (intent.trailingOffset() == null) {
            return reject(intent, OrderRejection.Reason.MISSING_TRAILING_OFFSET,
                "trailing stop requires a trailing offset", List.of());
        }
        BigDecimal callbackRate = callbackRate(intent);
        if (!BinanceOrderRules.isCallbackRateInBounds(callbackRate)) {
            return reject(intent, OrderRejection.Reason.CALLBACK_RATE_OUT_OF_BOUNDS,
                String.format("callback rate %s%% outside [%s, %s]", callbackRate.toPlainString(),
                    BinanceOrderRules.MIN_CALLBACK_RATE, BinanceOrderRules.MAX_CALLBACK_RATE),
                List.of());
        }
        return null;
    }

    private static OrderRejection reject(OrderIntent intent, OrderRejection.Reason reason, String message,
                                         List<String> alternatives) {
        return new OrderRejection(intent.clientOrderId(), reason, message, alternatives);
    }

    private static List<String> names(Collection<? extends Enum<?>> values) {
        return values.stream().map(Enum::name).toList();
    }

    /**
     * Time in force sent with the order, or null for types that take none. Spot post-only
     * orders are LIMIT_MAKER and take none; futures post-only orders use GTX.
     */
    private BinanceTimeInForce timeInForce(OrderIntent intent, BinanceOrderType venueType) {
        if (!intent.orderType().hasPrice() || venueType == BinanceOrderType.LIMIT_MAKER) {
            return null;
        }
        if (intent.postOnly()) {
            return BinanceTimeInForce.GTX;
        }
        BinanceTimeInForce timeInForce = enumParser.parseInternalTimeInForce(intent.timeInForce());
        if (intent.timeInForce() == TimeInForce.GTD && timeInForce == BinanceTimeInForce.GTC && config.warnGtdToGtc()) {
            LOGGER.warn("Converted GTD time in force to GTC for order {}", intent.clientOrderId());
        }
        return timeInForce;
    }

    private Object workingType(OrderIntent intent) {
        boolean triggered = intent.orderType().hasTriggerPrice() || intent.orderType() == OrderType.TRAILING_STOP_MARKET;
        if (!triggered || accountType.isSpotOrMargin()) {
            return null;
        }
        return enumParser.parseInternalTriggerType(intent.triggerType());
    }

    /**
     * Basis points to percent: 100 bps is a 1% callback rate.
     */
    private static BigDecimal callbackRate(OrderIntent intent) {
        return intent.trailingOffset().divide(ONE_HUNDRED).stripTrailingZeros();
    }

    // -- VENUE TO INTERNAL ------------------------------------------------------------------

    /**
     * Translates a venue order update into an execution report. A trade report is attached
     * when the update carries a fill.
     */
    public ExecutionReport fromWire(BinanceOrderUpdate update) {
        InstrumentId instrumentId = new InstrumentId(
            BinanceSymbol.of(update.symbol(), accountType).toInternal(accountType), Venue.BINANCE);
        OrderSide side = enumParser.parseBinanceOrderSide(update.side());
        OrderStatus status = enumParser.parseBinanceOrderStatus(update.orderStatus());
        OrderType orderType = enumParser.parseBinanceOrderType(update.orderType());
        TimeInForce timeInForce = update.timeInForce() != null
            ? enumParser.parseBinanceTimeInForce(update.timeInForce())
            : TimeInForce.GTC;
        TriggerType triggerType = update.workingType() != null && accountType.isFutures()
            ? enumParser.parseBinanceWorkingType(update.workingType())
            : TriggerType.DEFAULT;
        PositionSide positionSide = update.positionSide() != null && accountType.isFutures()
            ? enumParser.parseBinancePositionSide(update.positionSide())
            : null;
        long tsInit = clock.timestampNs();
        long tsLast = update.transactionTimeMs() * NANOS_PER_MILLI;

        OrderStatusReport report = new OrderStatusReport(
            instrumentId,
            update.clientOrderId(),
            update.venueOrderId(),
            side,
            orderType,
            timeInForce,
            status,
            update.quantity(),
            update.filledQty(),
            nonZero(update.price()),
            nonZero(update.stopPrice()),
            triggerType,
            nonZero(update.avgPrice()),
            enumParser.isPostOnly(update.orderType(), update.timeInForce()),
            update.reduceOnly(),
            positionSide,
            tsLast,
            tsInit
        );

        if (status.isTerminal()) {
            LOGGER.debug("Order {} ({}) reached terminal status {}", update.clientOrderId(), update.venueOrderId(), status);
        }

        TradeReport trade = null;
        if (update.executionType() != null && enumParser.isFill(update.executionType()) && update.hasTrade()) {
            trade = new TradeReport(
                instrumentId,
                update.clientOrderId(),
                update.venueOrderId(),
                String.valueOf(update.tradeId()),
                side,
                update.lastQty(),
                update.lastPrice(),
                update.commission() != null ? update.commission() : BigDecimal.ZERO,
                update.commissionAsset(),
                LiquiditySide.fromMakerFlag(update.maker()),
                tsLast,
                tsInit
            );
        }
        return new ExecutionReport(report, trade);
    }

    private static BigDecimal nonZero(BigDecimal value) {
        return value == null || value.signum() == 0 ? null : value;
    }
}
