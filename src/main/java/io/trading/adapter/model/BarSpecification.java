package io.trading.adapter.model;

/**
 * Time bar specification, e.g. 15-MINUTE.
 *
 * @param step        Number of aggregation units per bar
 * @param aggregation Aggregation unit
 */
public record BarSpecification(
    int step,
    BarAggregation aggregation
) {
    public BarSpecification {
        if (step <= 0) {
            throw new IllegalArgumentException("step must be positive");
        }
        if (aggregation == null) {
            throw new IllegalArgumentException("aggregation cannot be null");
        }
    }

    @Override
    public String toString() {
        return step + "-" + aggregation.name();
    }
}
