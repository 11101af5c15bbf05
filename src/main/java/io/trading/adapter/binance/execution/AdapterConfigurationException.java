package io.trading.adapter.binance.execution;

/**
 * Thrown when the adapter configuration contradicts the account settings.
 * Not recoverable: the session must be reconfigured.
 */
public class AdapterConfigurationException extends RuntimeException {

    public AdapterConfigurationException(String message) {
        super(message);
    }
}
