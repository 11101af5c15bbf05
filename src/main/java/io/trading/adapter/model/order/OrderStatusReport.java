package io.trading.adapter.model.order;

import io.trading.adapter.model.InstrumentId;
import io.trading.adapter.model.OrderSide;
import io.trading.adapter.model.OrderStatus;
import io.trading.adapter.model.OrderType;
import io.trading.adapter.model.PositionSide;
import io.trading.adapter.model.TimeInForce;
import io.trading.adapter.model.TriggerType;

import java.math.BigDecimal;

/**
 * Venue-reported state of an order.
 *
 * @param instrumentId  Instrument of the order
 * @param clientOrderId Client order id, null for orders placed outside the system
 * @param venueOrderId  Venue-assigned order id
 * @param side          Order side
 * @param orderType     Order type
 * @param timeInForce   Time in force
 * @param orderStatus   Current status
 * @param quantity      Original quantity
 * @param filledQty     Cumulative filled quantity
 * @param price         Limit price, null when not applicable
 * @param triggerPrice  Trigger price, null when not applicable
 * @param triggerType   Trigger price source
 * @param avgPx         Average fill price, null before the first fill
 * @param postOnly      Whether the order only adds liquidity
 * @param reduceOnly    Whether the order only reduces a position
 * @param positionSide  Position leg, null outside hedge mode
 * @param tsLast        Last venue update (UNIX nanoseconds)
 * @param tsInit        Report creation time (UNIX nanoseconds)
 */
public record OrderStatusReport(
    InstrumentId instrumentId,
    String clientOrderId,
    String venueOrderId,
    OrderSide side,
    OrderType orderType,
    TimeInForce timeInForce,
    OrderStatus orderStatus,
    BigDecimal quantity,
    BigDecimal filledQty,
    BigDecimal price,
    BigDecimal triggerPrice,
    TriggerType triggerType,
    BigDecimal avgPx,
    boolean postOnly,
    boolean reduceOnly,
    PositionSide positionSide,
    long tsLast,
    long tsInit
) {
    public OrderStatusReport {
        if (instrumentId == null) {
            throw new IllegalArgumentException("instrumentId cannot be null");
        }
        if (venueOrderId == null || venueOrderId.isEmpty()) {
            throw new IllegalArgumentException("venueOrderId cannot be null or empty");
        }
        if (side == null || orderType == null || timeInForce == null || orderStatus == null) {
            throw new IllegalArgumentException("side, orderType, timeInForce and orderStatus are required");
        }
        if (quantity == null || filledQty == null) {
            throw new IllegalArgumentException("quantity and filledQty cannot be null");
        }
    }

    public boolean isTerminal() {
        return orderStatus.isTerminal();
    }

    public BigDecimal leavesQty() {
        return orderStatus.isTerminal() ? BigDecimal.ZERO : quantity.subtract(filledQty);
    }
}
