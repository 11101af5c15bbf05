package io.trading.adapter.binance.common;

import io.trading.adapter.model.OrderType;
import io.trading.adapter.model.PositionSide;
import io.trading.adapter.model.TriggerType;

/**
 * Enum translations for Binance Spot and Margin accounts.
 *
 * Spot stop orders always trigger on the last trade price and the venue has no notion of
 * a working type or a position side.
 */
public final class BinanceSpotEnumParser extends BinanceEnumParser {

    BinanceSpotEnumParser(BinanceAccountType accountType) {
        super(accountType);
    }

    @Override
    protected BinanceTimeInForce goodTillDateTimeInForce() {
        return BinanceTimeInForce.GTC;
    }

    @Override
    protected boolean isKlineIntervalSupported(BinanceKlineInterval interval) {
        return true;
    }

    @Override
    public OrderType parseBinanceOrderType(BinanceOrderType orderType) {
        return switch (orderType) {
            case LIMIT, LIMIT_MAKER -> OrderType.LIMIT;
            case MARKET -> OrderType.MARKET;
            case STOP_LOSS -> OrderType.STOP_MARKET;
            case STOP_LOSS_LIMIT -> OrderType.STOP_LIMIT;
            case TAKE_PROFIT -> OrderType.MARKET_IF_TOUCHED;
            case TAKE_PROFIT_LIMIT -> OrderType.LIMIT_IF_TOUCHED;
            case STOP, STOP_MARKET, TAKE_PROFIT_MARKET, TRAILING_STOP_MARKET, LIQUIDATION ->
                throw new UnrecognizedEnumException("BinanceOrderType", orderType.getWireValue(), getAccountType());
        };
    }

    @Override
    public BinanceOrderType parseInternalOrderType(OrderType orderType, boolean postOnly) {
        return switch (orderType) {
            case LIMIT -> postOnly ? BinanceOrderType.LIMIT_MAKER : BinanceOrderType.LIMIT;
            case MARKET -> BinanceOrderType.MARKET;
            case STOP_MARKET -> BinanceOrderType.STOP_LOSS;
            case STOP_LIMIT -> BinanceOrderType.STOP_LOSS_LIMIT;
            case MARKET_IF_TOUCHED -> BinanceOrderType.TAKE_PROFIT;
            case LIMIT_IF_TOUCHED -> BinanceOrderType.TAKE_PROFIT_LIMIT;
            case MARKET_TO_LIMIT, TRAILING_STOP_MARKET, TRAILING_STOP_LIMIT ->
                throw new UnsupportedInternalValueException(orderType, getAccountType());
        };
    }

    @Override
    public TriggerType parseBinanceWorkingType(BinanceWorkingType workingType) {
        throw new UnrecognizedEnumException("BinanceWorkingType", workingType.getWireValue(), getAccountType());
    }

    @Override
    public BinanceWorkingType parseInternalTriggerType(TriggerType triggerType) {
        throw new UnsupportedInternalValueException(triggerType, getAccountType());
    }

    @Override
    public PositionSide parseBinancePositionSide(BinancePositionSide positionSide) {
        throw new UnrecognizedEnumException("BinancePositionSide", positionSide.getWireValue(), getAccountType());
    }

    @Override
    public BinancePositionSide parseInternalPositionSide(PositionSide positionSide) {
        throw new UnsupportedInternalValueException(positionSide, getAccountType());
    }
}
