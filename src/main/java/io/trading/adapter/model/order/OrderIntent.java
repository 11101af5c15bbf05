package io.trading.adapter.model.order;

import io.trading.adapter.model.InstrumentId;
import io.trading.adapter.model.OrderSide;
import io.trading.adapter.model.OrderType;
import io.trading.adapter.model.PositionSide;
import io.trading.adapter.model.TimeInForce;
import io.trading.adapter.model.TrailingOffsetType;
import io.trading.adapter.model.TriggerType;

import java.math.BigDecimal;

/**
 * An order the trading core wants submitted to a venue.
 *
 * Quantities and prices are already rounded to the instrument precision.
 *
 * @param instrumentId       Target instrument
 * @param clientOrderId      Client-assigned order identifier
 * @param side               Buy or sell
 * @param orderType          Order type
 * @param quantity           Order quantity
 * @param price              Limit price, null for orders without one
 * @param triggerPrice       Trigger (or trailing activation) price, may be null
 * @param triggerType        Price source for the trigger
 * @param timeInForce        Time in force
 * @param postOnly           Whether the order must only add liquidity
 * @param reduceOnly         Whether the order may only reduce a position
 * @param displayQty         Visible quantity for iceberg orders, may be null
 * @param trailingOffset     Trailing offset, null unless a trailing stop
 * @param trailingOffsetType Unit of the trailing offset
 * @param positionSide       Position leg targeted in hedge mode, may be null
 */
public record OrderIntent(
    InstrumentId instrumentId,
    String clientOrderId,
    OrderSide side,
    OrderType orderType,
    BigDecimal quantity,
    BigDecimal price,
    BigDecimal triggerPrice,
    TriggerType triggerType,
    TimeInForce timeInForce,
    boolean postOnly,
    boolean reduceOnly,
    BigDecimal displayQty,
    BigDecimal trailingOffset,
    TrailingOffsetType trailingOffsetType,
    PositionSide positionSide
) {
    public OrderIntent {
        if (instrumentId == null) {
            throw new IllegalArgumentException("instrumentId cannot be null");
        }
        if (clientOrderId == null || clientOrderId.isEmpty()) {
            throw new IllegalArgumentException("clientOrderId cannot be null or empty");
        }
        if (side == null || side == OrderSide.NO_ORDER_SIDE) {
            throw new IllegalArgumentException("side must be BUY or SELL");
        }
        if (orderType == null) {
            throw new IllegalArgumentException("orderType cannot be null");
        }
        if (quantity == null || quantity.signum() <= 0) {
            throw new IllegalArgumentException("quantity must be positive");
        }
        if (timeInForce == null) {
            throw new IllegalArgumentException("timeInForce cannot be null");
        }
        if (triggerType == null) {
            throw new IllegalArgumentException("triggerType cannot be null");
        }
        if (orderType.hasPrice() && price == null) {
            throw new IllegalArgumentException(orderType + " order requires a price");
        }
        if (orderType.hasTriggerPrice() && triggerPrice == null) {
            throw new IllegalArgumentException(orderType + " order requires a trigger price");
        }
    }

    /**
     * Creates a new builder for OrderIntent.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for OrderIntent.
     */
    public static class Builder {
        private InstrumentId instrumentId;
        private String clientOrderId;
        private OrderSide side;
        private OrderType orderType = OrderType.MARKET;
        private BigDecimal quantity;
        private BigDecimal price;
        private BigDecimal triggerPrice;
        private TriggerType triggerType = TriggerType.DEFAULT;
        private TimeInForce timeInForce = TimeInForce.GTC;
        private boolean postOnly;
        private boolean reduceOnly;
        private BigDecimal displayQty;
        private BigDecimal trailingOffset;
        private TrailingOffsetType trailingOffsetType = TrailingOffsetType.BASIS_POINTS;
        private PositionSide positionSide;

        public Builder instrumentId(InstrumentId instrumentId) {
            this.instrumentId = instrumentId;
            return this;
        }

        public Builder clientOrderId(String clientOrderId) {
            this.clientOrderId = clientOrderId;
            return this;
        }

        public Builder side(OrderSide side) {
            this.side = side;
            return this;
        }

        public Builder orderType(OrderType orderType) {
            this.orderType = orderType;
            return this;
        }

        public Builder quantity(String quantity) {
            this.quantity = new BigDecimal(quantity);
            return this;
        }

        public Builder price(String price) {
            this.price = new BigDecimal(price);
            return this;
        }

        public Builder triggerPrice(String triggerPrice) {
            this.triggerPrice = new BigDecimal(triggerPrice);
            return this;
        }

        public Builder triggerType(TriggerType triggerType) {
            this.triggerType = triggerType;
            return this;
        }

        public Builder timeInForce(TimeInForce timeInForce) {
            this.timeInForce = timeInForce;
            return this;
        }

        public Builder postOnly(boolean postOnly) {
            this.postOnly = postOnly;
            return this;
        }

        public Builder reduceOnly(boolean reduceOnly) {
            this.reduceOnly = reduceOnly;
            return this;
        }

        public Builder displayQty(String displayQty) {
            this.displayQty = new BigDecimal(displayQty);
            return this;
        }

        public Builder trailingOffset(String trailingOffset, TrailingOffsetType trailingOffsetType) {
            this.trailingOffset = new BigDecimal(trailingOffset);
            this.trailingOffsetType = trailingOffsetType;
            return this;
        }

        public Builder positionSide(PositionSide positionSide) {
            this.positionSide = positionSide;
            return this;
        }

        public OrderIntent build() {
            return new OrderIntent(
                instrumentId,
                clientOrderId,
                side,
                orderType,
                quantity,
                price,
                triggerPrice,
                triggerType,
                timeInForce,
                postOnly,
                reduceOnly,
                displayQty,
                trailingOffset,
                trailingOffsetType,
                positionSide
            );
        }
    }
}
