package io.trading.adapter.binance.common;

import io.trading.adapter.model.OrderType;
import io.trading.adapter.model.PositionSide;
import io.trading.adapter.model.TriggerType;

/**
 * Enum translations for Binance USD-M, COIN-M and portfolio margin derivatives.
 */
public final class BinanceFuturesEnumParser extends BinanceEnumParser {

    BinanceFuturesEnumParser(BinanceAccountType accountType) {
        super(accountType);
    }

    @Override
    protected BinanceTimeInForce goodTillDateTimeInForce() {
        return BinanceTimeInForce.GTD;
    }

    @Override
    protected boolean isKlineIntervalSupported(BinanceKlineInterval interval) {
        return interval != BinanceKlineInterval.SECOND_1;
    }

    @Override
    public OrderType parseBinanceOrderType(BinanceOrderType orderType) {
        return switch (orderType) {
            case LIMIT -> OrderType.LIMIT;
            case MARKET, LIQUIDATION -> OrderType.MARKET;
            case STOP -> OrderType.STOP_LIMIT;
            case STOP_MARKET -> OrderType.STOP_MARKET;
            case TAKE_PROFIT -> OrderType.LIMIT_IF_TOUCHED;
            case TAKE_PROFIT_MARKET -> OrderType.MARKET_IF_TOUCHED;
            case TRAILING_STOP_MARKET -> OrderType.TRAILING_STOP_MARKET;
            case LIMIT_MAKER, STOP_LOSS, STOP_LOSS_LIMIT, TAKE_PROFIT_LIMIT ->
                throw new UnrecognizedEnumException("BinanceOrderType", orderType.getWireValue(), getAccountType());
        };
    }

    /**
     * Translates an internal order type. Futures encode post-only through the GTX time in
     * force, so the flag does not change the order type spelling.
     */
    @Override
    public BinanceOrderType parseInternalOrderType(OrderType orderType, boolean postOnly) {
        return switch (orderType) {
            case LIMIT -> BinanceOrderType.LIMIT;
            case MARKET -> BinanceOrderType.MARKET;
            case STOP_MARKET -> BinanceOrderType.STOP_MARKET;
            case STOP_LIMIT -> BinanceOrderType.STOP;
            case MARKET_IF_TOUCHED -> BinanceOrderType.TAKE_PROFIT_MARKET;
            case LIMIT_IF_TOUCHED -> BinanceOrderType.TAKE_PROFIT;
            case TRAILING_STOP_MARKET -> BinanceOrderType.TRAILING_STOP_MARKET;
            case MARKET_TO_LIMIT, TRAILING_STOP_LIMIT ->
                throw new UnsupportedInternalValueException(orderType, getAccountType());
        };
    }

    @Override
    public TriggerType parseBinanceWorkingType(BinanceWorkingType workingType) {
        return switch (workingType) {
            case CONTRACT_PRICE -> TriggerType.LAST_PRICE;
            case MARK_PRICE -> TriggerType.MARK_PRICE;
        };
    }

    @Override
    public BinanceWorkingType parseInternalTriggerType(TriggerType triggerType) {
        return switch (triggerType) {
            case DEFAULT, LAST_PRICE -> BinanceWorkingType.CONTRACT_PRICE;
            case MARK_PRICE -> BinanceWorkingType.MARK_PRICE;
            case INDEX_PRICE, BID_ASK -> throw new UnsupportedInternalValueException(triggerType, getAccountType());
        };
    }

    @Override
    public PositionSide parseBinancePositionSide(BinancePositionSide positionSide) {
        return switch (positionSide) {
            case BOTH -> PositionSide.FLAT;
            case LONG -> PositionSide.LONG;
            case SHORT -> PositionSide.SHORT;
        };
    }

    @Override
    public BinancePositionSide parseInternalPositionSide(PositionSide positionSide) {
        return switch (positionSide) {
            case FLAT -> BinancePositionSide.BOTH;
            case LONG -> BinancePositionSide.LONG;
            case SHORT -> BinancePositionSide.SHORT;
        };
    }
}
