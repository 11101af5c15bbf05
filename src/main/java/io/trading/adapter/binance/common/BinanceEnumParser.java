package io.trading.adapter.binance.common;

import io.trading.adapter.model.BarAggregation;
import io.trading.adapter.model.BarSpecification;
import io.trading.adapter.model.OrderSide;
import io.trading.adapter.model.OrderStatus;
import io.trading.adapter.model.OrderType;
import io.trading.adapter.model.PositionSide;
import io.trading.adapter.model.TimeInForce;
import io.trading.adapter.model.TriggerType;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Bidirectional translation between Binance enumerations and the internal model.
 *
 * The tables shared by every product type live here. Translations that differ between
 * spot and derivatives are abstract, so each product-type variant must provide them.
 * All tables are switch expressions over enums and carry no instance state, which makes
 * a parser safe to share between threads.
 *
 * Venue-to-internal translations throw {@link UnrecognizedEnumException} for venue values
 * the product type never reports; internal-to-venue translations throw
 * {@link UnsupportedInternalValueException} for internal values the venue cannot express.
 */
public abstract class BinanceEnumParser {

    private static final Map<BarSpecification, BinanceKlineInterval> INTERVALS_BY_SPEC =
        Arrays.stream(BinanceKlineInterval.values())
            .collect(Collectors.toUnmodifiableMap(BinanceEnumParser::barSpecificationOf, Function.identity()));

    private static final Map<BinanceAccountType, BinanceEnumParser> PARSERS;

    static {
        EnumMap<BinanceAccountType, BinanceEnumParser> parsers = new EnumMap<>(BinanceAccountType.class);
        for (BinanceAccountType accountType : BinanceAccountType.values()) {
            parsers.put(accountType, accountType.isSpotOrMargin()
                ? new BinanceSpotEnumParser(accountType)
                : new BinanceFuturesEnumParser(accountType));
        }
        PARSERS = Collections.unmodifiableMap(parsers);
    }

    private final BinanceAccountType accountType;

    protected BinanceEnumParser(BinanceAccountType accountType) {
        this.accountType = accountType;
    }

    /**
     * Returns the shared parser for the given account type.
     */
    public static BinanceEnumParser forAccountType(BinanceAccountType accountType) {
        return PARSERS.get(accountType);
    }

    public BinanceAccountType getAccountType() {
        return accountType;
    }

    // -- ORDER SIDE -------------------------------------------------------------------------

    public final OrderSide parseBinanceOrderSide(BinanceOrderSide side) {
        return switch (side) {
            case BUY -> OrderSide.BUY;
            case SELL -> OrderSide.SELL;
        };
    }

    public final BinanceOrderSide parseInternalOrderSide(OrderSide side) {
        return switch (side) {
            case BUY -> BinanceOrderSide.BUY;
            case SELL -> BinanceOrderSide.SELL;
            case NO_ORDER_SIDE -> throw new UnsupportedInternalValueException(side, accountType);
        };
    }

    // -- ORDER STATUS -----------------------------------------------------------------------

    /**
     * Translates a venue order status.
     *
     * Liquidation and auto-deleverage fills are FILLED. A self-trade-prevention expiry is
     * CANCELED rather than EXPIRED.
     */
    public final OrderStatus parseBinanceOrderStatus(BinanceOrderStatus status) {
        return switch (status) {
            case NEW -> OrderStatus.ACCEPTED;
            case PENDING_NEW -> OrderStatus.SUBMITTED;
            case PARTIALLY_FILLED -> OrderStatus.PARTIALLY_FILLED;
            case FILLED, NEW_INSURANCE, NEW_ADL -> OrderStatus.FILLED;
            case CANCELED, EXPIRED_IN_MATCH -> OrderStatus.CANCELED;
            case PENDING_CANCEL -> OrderStatus.PENDING_CANCEL;
            case REJECTED -> OrderStatus.REJECTED;
            case EXPIRED -> OrderStatus.EXPIRED;
        };
    }

    public final BinanceOrderStatus parseInternalOrderStatus(OrderStatus status) {
        return switch (status) {
            case SUBMITTED -> BinanceOrderStatus.PENDING_NEW;
            case ACCEPTED -> BinanceOrderStatus.NEW;
            case PARTIALLY_FILLED -> BinanceOrderStatus.PARTIALLY_FILLED;
            case FILLED -> BinanceOrderStatus.FILLED;
            case CANCELED -> BinanceOrderStatus.CANCELED;
            case PENDING_CANCEL -> BinanceOrderStatus.PENDING_CANCEL;
            case REJECTED -> BinanceOrderStatus.REJECTED;
            case EXPIRED -> BinanceOrderStatus.EXPIRED;
            case TRIGGERED -> throw new UnsupportedInternalValueException(status, accountType);
        };
    }

    // -- TIME IN FORCE ----------------------------------------------------------------------

    /**
     * Translates a venue time in force. GTX and GTE_GTC collapse to GTC; the post-only
     * meaning of GTX is recovered separately by {@link #isPostOnly(BinanceOrderType, BinanceTimeInForce)}.
     */
    public final TimeInForce parseBinanceTimeInForce(BinanceTimeInForce timeInForce) {
        return switch (timeInForce) {
            case GTC, GTX, GTE_GTC -> TimeInForce.GTC;
            case IOC -> TimeInForce.IOC;
            case FOK -> TimeInForce.FOK;
            case GTD -> TimeInForce.GTD;
        };
    }

    /**
     * Translates an internal time in force. GTC always yields the canonical GTC spelling.
     */
    public final BinanceTimeInForce parseInternalTimeInForce(TimeInForce timeInForce) {
        return switch (timeInForce) {
            case GTC -> BinanceTimeInForce.GTC;
            case IOC -> BinanceTimeInForce.IOC;
            case FOK -> BinanceTimeInForce.FOK;
            case GTD -> goodTillDateTimeInForce();
            case DAY, AT_THE_OPEN, AT_THE_CLOSE -> throw new UnsupportedInternalValueException(timeInForce, accountType);
        };
    }

    /**
     * Returns whether a venue order was placed as post-only.
     */
    public final boolean isPostOnly(BinanceOrderType orderType, BinanceTimeInForce timeInForce) {
        return orderType == BinanceOrderType.LIMIT_MAKER || timeInForce == BinanceTimeInForce.GTX;
    }

    // -- BAR AGGREGATION --------------------------------------------------------------------

    public final BarSpecification parseBinanceKlineInterval(BinanceKlineInterval interval) {
        if (!isKlineIntervalSupported(interval)) {
            throw new UnrecognizedEnumException("BinanceKlineInterval", interval.getWireValue(), accountType);
        }
        return barSpecificationOf(interval);
    }

    public final BinanceKlineInterval parseInternalBarSpecification(BarSpecification spec) {
        BinanceKlineInterval interval = INTERVALS_BY_SPEC.get(spec);
        if (interval == null || !isKlineIntervalSupported(interval)) {
            throw new UnsupportedInternalValueException(spec, accountType, "no kline interval");
        }
        return interval;
    }

    private static BarSpecification barSpecificationOf(BinanceKlineInterval interval) {
        return switch (interval) {
            case SECOND_1 -> new BarSpecification(1, BarAggregation.SECOND);
            case MINUTE_1 -> new BarSpecification(1, BarAggregation.MINUTE);
            case MINUTE_3 -> new BarSpecification(3, BarAggregation.MINUTE);
            case MINUTE_5 -> new BarSpecification(5, BarAggregation.MINUTE);
            case MINUTE_15 -> new BarSpecification(15, BarAggregation.MINUTE);
            case MINUTE_30 -> new BarSpecification(30, BarAggregation.MINUTE);
            case HOUR_1 -> new BarSpecification(1, BarAggregation.HOUR);
            case HOUR_2 -> new BarSpecification(2, BarAggregation.HOUR);
            case HOUR_4 -> new BarSpecification(4, BarAggregation.HOUR);
            case HOUR_6 -> new BarSpecification(6, BarAggregation.HOUR);
            case HOUR_8 -> new BarSpecification(8, BarAggregation.HOUR);
            case HOUR_12 -> new BarSpecification(12, BarAggregation.HOUR);
            case DAY_1 -> new BarSpecification(1, BarAggregation.DAY);
            case DAY_3 -> new BarSpecification(3, BarAggregation.DAY);
            case WEEK_1 -> new BarSpecification(1, BarAggregation.WEEK);
            case MONTH_1 -> new BarSpecification(1, BarAggregation.MONTH);
        };
    }

    // -- EXECUTION TYPE ---------------------------------------------------------------------

    /**
     * Returns whether an order update of this execution type carries a fill.
     */
    public final boolean isFill(BinanceExecutionType executionType) {
        return switch (executionType) {
            case TRADE, CALCULATED -> true;
            case NEW, CANCELED, REPLACED, REJECTED, EXPIRED, AMENDMENT, TRADE_PREVENTION -> false;
        };
    }

    // -- PRODUCT-TYPE SPECIFIC --------------------------------------------------------------

    /**
     * The venue spelling emitted for an internal GTD order.
     */
    protected abstract BinanceTimeInForce goodTillDateTimeInForce();

    protected abstract boolean isKlineIntervalSupported(BinanceKlineInterval interval);

    public abstract OrderType parseBinanceOrderType(BinanceOrderType orderType);

    /**
     * Translates an internal order type to its venue spelling.
     *
     * @param postOnly whether the order must only add liquidity
     */
    public abstract BinanceOrderType parseInternalOrderType(OrderType orderType, boolean postOnly);

    public abstract TriggerType parseBinanceWorkingType(BinanceWorkingType workingType);

    public abstract BinanceWorkingType parseInternalTriggerType(TriggerType triggerType);

    public abstract PositionSide parseBinancePositionSide(BinancePositionSide positionSide);

    public abstract BinancePositionSide parseInternalPositionSide(PositionSide positionSide);
}
