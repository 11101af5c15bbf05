package io.trading.adapter.model.order;

import io.trading.adapter.model.InstrumentId;
import io.trading.adapter.model.LiquiditySide;
import io.trading.adapter.model.OrderSide;

import java.math.BigDecimal;

/**
 * A single fill reported by the venue.
 *
 * @param instrumentId    Instrument traded
 * @param clientOrderId   Client order id, may be null
 * @param venueOrderId    Venue order id
 * @param tradeId         Venue trade id
 * @param side            Side of the filled order
 * @param lastQty         Filled quantity
 * @param lastPx          Fill price
 * @param commission      Commission amount, zero when none was charged
 * @param commissionAsset Commission asset code, null when none was charged
 * @param liquiditySide   Maker or taker
 * @param tsEvent         Fill time (UNIX nanoseconds)
 * @param tsInit          Report creation time (UNIX nanoseconds)
 */
public record TradeReport(
    InstrumentId instrumentId,
    String clientOrderId,
    String venueOrderId,
    String tradeId,
    OrderSide side,
    BigDecimal lastQty,
    BigDecimal lastPx,
    BigDecimal commission,
    String commissionAsset,
    LiquiditySide liquiditySide,
    long tsEvent,
    long tsInit
) {
    public TradeReport {
        if (instrumentId == null) {
            throw new IllegalArgumentException("instrumentId cannot be null");
        }
        if (tradeId == null || tradeId.isEmpty()) {
            throw new IllegalArgumentException("tradeId cannot be null or empty");
        }
        if (lastQty == null || lastPx == null) {
            throw new IllegalArgumentException("lastQty and lastPx cannot be null");
        }
        if (commission == null) {
            throw new IllegalArgumentException("commission cannot be null");
        }
    }
}
