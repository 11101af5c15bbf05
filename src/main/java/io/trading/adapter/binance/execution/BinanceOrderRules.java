package io.trading.adapter.binance.execution;

import io.trading.adapter.binance.common.BinanceAccountType;
import io.trading.adapter.model.OrderType;
import io.trading.adapter.model.TimeInForce;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Order types and times in force the venue accepts per account type.
 *
 * Spot stop-market orders ({@code STOP_LOSS}) and take-profit-market orders
 * ({@code TAKE_PROFIT}) exist on the wire but are not offered for submission.
 */
public final class BinanceOrderRules {

    /** Smallest trailing stop callback rate, in percent. */
    public static final BigDecimal MIN_CALLBACK_RATE = new BigDecimal("0.1");

    /** Largest trailing stop callback rate, in percent. */
    public static final BigDecimal MAX_CALLBACK_RATE = new BigDecimal("10.0");

    private static final BinanceOrderRules SPOT = new BinanceOrderRules(
        EnumSet.of(OrderType.MARKET, OrderType.LIMIT, OrderType.STOP_LIMIT, OrderType.LIMIT_IF_TOUCHED),
        EnumSet.of(TimeInForce.GTC, TimeInForce.GTD, TimeInForce.FOK, TimeInForce.IOC));

    private static final BinanceOrderRules FUTURES = new BinanceOrderRules(
        EnumSet.of(
            OrderType.MARKET,
            OrderType.LIMIT,
            OrderType.STOP_MARKET,
            OrderType.STOP_LIMIT,
            OrderType.MARKET_IF_TOUCHED,
            OrderType.LIMIT_IF_TOUCHED,
            OrderType.TRAILING_STOP_MARKET),
        EnumSet.of(TimeInForce.GTC, TimeInForce.GTD, TimeInForce.FOK, TimeInForce.IOC));

    private final Set<OrderType> orderTypes;
    private final Set<TimeInForce> timeInForces;

    private BinanceOrderRules(EnumSet<OrderType> orderTypes, EnumSet<TimeInForce> timeInForces) {
        this.orderTypes = Collections.unmodifiableSet(orderTypes);
        this.timeInForces = Collections.unmodifiableSet(timeInForces);
    }

    public static BinanceOrderRules forAccountType(BinanceAccountType accountType) {
        return accountType.isSpotOrMargin() ? SPOT : FUTURES;
    }

    public Set<OrderType> getOrderTypes() {
        return orderTypes;
    }

    public Set<TimeInForce> getTimeInForces() {
        return timeInForces;
    }

    public boolean supports(OrderType orderType) {
        return orderTypes.contains(orderType);
    }

    public boolean supports(TimeInForce timeInForce) {
        return timeInForces.contains(timeInForce);
    }

    public static boolean isCallbackRateInBounds(BigDecimal callbackRate) {
        return callbackRate.compareTo(MIN_CALLBACK_RATE) >= 0 && callbackRate.compareTo(MAX_CALLBACK_RATE) <= 0;
    }
}
