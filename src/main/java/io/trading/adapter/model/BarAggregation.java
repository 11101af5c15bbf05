package io.trading.adapter.model;

/**
 * Time unit of a bar specification.
 */
public enum BarAggregation {
    SECOND,
    MINUTE,
    HOUR,
    DAY,
    WEEK,
    MONTH
}
