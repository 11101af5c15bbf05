package io.trading.adapter.model;

/**
 * Price source used to trigger conditional orders.
 */
public enum TriggerType {
    DEFAULT,
    LAST_PRICE,
    MARK_PRICE,
    INDEX_PRICE,
    BID_ASK
}
