package io.trading.adapter.model.order;

import java.util.Optional;

/**
 * Internal execution report: the order state plus the fill that caused it, if any.
 *
 * @param status Order state after the update
 * @param trade  Fill carried by the update, null for non-trade updates
 */
public record ExecutionReport(
    OrderStatusReport status,
    TradeReport trade
) {
    public ExecutionReport {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
    }

    public Optional<TradeReport> tradeReport() {
        return Optional.ofNullable(trade);
    }
}
