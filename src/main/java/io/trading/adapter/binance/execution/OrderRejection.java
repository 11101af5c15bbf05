package io.trading.adapter.binance.execution;

import java.util.List;

/**
 * An order refused before reaching the venue.
 *
 * @param clientOrderId Client order id of the refused order
 * @param reason        The constraint the order failed
 * @param message       Human-readable description naming the offending value
 * @param alternatives  Values the venue would accept instead, possibly empty
 */
public record OrderRejection(
    String clientOrderId,
    Reason reason,
    String message,
    List<String> alternatives
) implements TranslationResult {

    public OrderRejection {
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }

    @Override
    public boolean isAccepted() {
        return false;
    }

    /**
     * Constraint violated by a rejected order.
     */
    public enum Reason {
        UNSUPPORTED_ORDER_TYPE,
        UNSUPPORTED_TIME_IN_FORCE,
        POST_ONLY_REQUIRES_LIMIT,
        UNSUPPORTED_TRIGGER_TYPE,
        UNSUPPORTED_TRAILING_OFFSET_TYPE,
        MISSING_TRAILING_OFFSET,
        CALLBACK_RATE_OUT_OF_BOUNDS,
        POSITION_SIDE_REQUIRED,
        POSITION_SIDE_NOT_ALLOWED,
        REDUCE_ONLY_NOT_SUPPORTED,
        ICEBERG_NOT_SUPPORTED
    }
}
