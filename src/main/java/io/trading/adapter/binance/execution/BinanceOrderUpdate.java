package io.trading.adapter.binance.execution;

import io.trading.adapter.binance.common.BinanceExecutionType;
import io.trading.adapter.binance.common.BinanceOrderSide;
import io.trading.adapter.binance.common.BinanceOrderStatus;
import io.trading.adapter.binance.common.BinanceOrderType;
import io.trading.adapter.binance.common.BinancePositionSide;
import io.trading.adapter.binance.common.BinanceTimeInForce;
import io.trading.adapter.binance.common.BinanceWorkingType;

import java.math.BigDecimal;

/**
 * Venue-side view of an order, decoded from a user data stream event or a REST order query.
 *
 * @param symbol              Wire symbol
 * @param clientOrderId       Client order id of the order (not of a cancel request)
 * @param venueOrderId        Venue order id
 * @param side                Order side
 * @param orderType           Venue order type
 * @param timeInForce         Venue time in force, null when not reported
 * @param executionType       What happened, null for REST order queries
 * @param orderStatus         Status after the update
 * @param quantity            Original quantity
 * @param filledQty           Cumulative filled quantity
 * @param price               Limit price, zero when not applicable
 * @param stopPrice           Trigger price, zero when not applicable
 * @param workingType         Trigger price source (futures only), may be null
 * @param avgPrice            Average fill price, may be null
 * @param lastQty             Quantity of the fill carried by the update
 * @param lastPrice           Price of the fill carried by the update
 * @param commission          Commission of the fill, may be null
 * @param commissionAsset     Commission asset of the fill, may be null
 * @param tradeId             Venue trade id, negative when the update carries no fill
 * @param maker               Whether the fill added liquidity
 * @param reduceOnly          Whether the order only reduces a position
 * @param positionSide        Position leg (futures only), may be null
 * @param eventTimeMs         Event time (UNIX milliseconds)
 * @param transactionTimeMs   Matching engine time (UNIX milliseconds)
 */
public record BinanceOrderUpdate(
    String symbol,
    String clientOrderId,
    String venueOrderId,
    BinanceOrderSide side,
    BinanceOrderType orderType,
    BinanceTimeInForce timeInForce,
    BinanceExecutionType executionType,
    BinanceOrderStatus orderStatus,
    BigDecimal quantity,
    BigDecimal filledQty,
    BigDecimal price,
    BigDecimal stopPrice,
    BinanceWorkingType workingType,
    BigDecimal avgPrice,
    BigDecimal lastQty,
    BigDecimal lastPrice,
    BigDecimal commission,
    String commissionAsset,
    long tradeId,
    boolean maker,
    boolean reduceOnly,
    BinancePositionSide positionSide,
    long eventTimeMs,
    long transactionTimeMs
) {
    public BinanceOrderUpdate {
        if (symbol == null || symbol.isEmpty()) {
            throw new IllegalArgumentException("symbol cannot be null or empty");
        }
        if (venueOrderId == null || venueOrderId.isEmpty()) {
            throw new IllegalArgumentException("venueOrderId cannot be null or empty");
        }
        if (side == null || orderType == null || orderStatus == null) {
            throw new IllegalArgumentException("side, orderType and orderStatus are required");
        }
        if (quantity == null) {
            quantity = BigDecimal.ZERO;
        }
        if (filledQty == null) {
            filledQty = BigDecimal.ZERO;
        }
    }

    public boolean hasTrade() {
        return tradeId >= 0;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for BinanceOrderUpdate.
     */
    public static class Builder {
        private String symbol;
        private String clientOrderId;
        private String venueOrderId;
        private BinanceOrderSide side;
        private BinanceOrderType orderType;
        private BinanceTimeInForce timeInForce;
        private BinanceExecutionType executionType;
        private BinanceOrderStatus orderStatus;
        private BigDecimal quantity;
        private BigDecimal filledQty;
        private BigDecimal price;
        private BigDecimal stopPrice;
        private BinanceWorkingType workingType;
        private BigDecimal avgPrice;
        private BigDecimal lastQty;
        private BigDecimal lastPrice;
        private BigDecimal commission;
        private String commissionAsset;
        private long tradeId = -1;
        private boolean maker;
        private boolean reduceOnly;
        private BinancePositionSide positionSide;
        private long eventTimeMs;
        private long transactionTimeMs;

        public Builder symbol(String symbol) {
            this.symbol = symbol;
            return this;
        }

        public Builder clientOrderId(String clientOrderId) {
            this.clientOrderId = clientOrderId;
            return this;
        }

        public Builder venueOrderId(String venueOrderId) {
            this.venueOrderId = venueOrderId;
            return this;
        }

        public Builder side(BinanceOrderSide side) {
            this.side = side;
            return this;
        }

        public Builder orderType(BinanceOrderType orderType) {
            this.orderType = orderType;
            return this;
        }

        public Builder timeInForce(BinanceTimeInForce timeInForce) {
            this.timeInForce = timeInForce;
            return this;
        }

        public Builder executionType(BinanceExecutionType executionType) {
            this.executionType = executionType;
            return this;
        }

        public Builder orderStatus(BinanceOrderStatus orderStatus) {
            this.orderStatus = orderStatus;
            return this;
        }

        public Builder quantity(BigDecimal quantity) {
            this.quantity = quantity;
            return this;
        }

        public Builder filledQty(BigDecimal filledQty) {
            this.filledQty = filledQty;
            return this;
        }

        public Builder price(BigDecimal price) {
            this.price = price;
            return this;
        }

        public Builder stopPrice(BigDecimal stopPrice) {
            this.stopPrice = stopPrice;
            return this;
        }

        public Builder workingType(BinanceWorkingType workingType) {
            this.workingType = workingType;
            return this;
        }

        public Builder avgPrice(BigDecimal avgPrice) {
            this.avgPrice = avgPrice;
            return this;
        }

        public Builder lastQty(BigDecimal lastQty) {
            this.lastQty = lastQty;
            return this;
        }

        public Builder lastPrice(BigDecimal lastPrice) {
            this.lastPrice = lastPrice;
            return this;
        }

        public Builder commission(BigDecimal commission) {
            this.commission = commission;
            return this;
        }

        public Builder commissionAsset(String commissionAsset) {
            this.commissionAsset = commissionAsset;
            return this;
        }

        public Builder tradeId(long tradeId) {
            this.tradeId = tradeId;
            return this;
        }

        public Builder maker(boolean maker) {
            this.maker = maker;
            return this;
        }

        public Builder reduceOnly(boolean reduceOnly) {
            this.reduceOnly = reduceOnly;
            return this;
        }

        public Builder positionSide(BinancePositionSide positionSide) {
            this.positionSide = positionSide;
            return this;
        }

        public Builder eventTimeMs(long eventTimeMs) {
            this.eventTimeMs = eventTimeMs;
            return this;
        }

        public Builder transactionTimeMs(long transactionTimeMs) {
            this.transactionTimeMs = transactionTimeMs;
            return this;
        }

        public BinanceOrderUpdate build() {
            return new BinanceOrderUpdate(
                symbol,
                clientOrderId,
                venueOrderId,
                side,
                orderType,
                timeInForce,
                executionType,
                orderStatus,
                quantity,
                filledQty,
                price,
                stopPrice,
                workingType,
                avgPrice,
                lastQty,
                lastPrice,
                commission,
                commissionAsset,
                tradeId,
                maker,
                reduceOnly,
                positionSide,
                eventTimeMs,
                transactionTimeMs
            );
        }
    }
}
