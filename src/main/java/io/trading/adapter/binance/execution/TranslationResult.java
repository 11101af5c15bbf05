package io.trading.adapter.binance.execution;

/**
 * Outcome of translating an order for submission: venue fields, or a rejection.
 */
public sealed interface TranslationResult permits WireOrderFields, OrderRejection {

    boolean isAccepted();
}
