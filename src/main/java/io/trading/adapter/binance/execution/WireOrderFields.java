package io.trading.adapter.binance.execution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Venue request parameters for a new order, in the order they are sent.
 *
 * @param parameters Parameter names to values; absent parameters are not present
 */
public record WireOrderFields(Map<String, String> parameters) implements TranslationResult {

    public static final String SYMBOL = "symbol";
    public static final String SIDE = "side";
    public static final String TYPE = "type";
    public static final String TIME_IN_FORCE = "timeInForce";
    public static final String QUANTITY = "quantity";
    public static final String PRICE = "price";
    public static final String STOP_PRICE = "stopPrice";
    public static final String WORKING_TYPE = "workingType";
    public static final String ACTIVATION_PRICE = "activationPrice";
    public static final String CALLBACK_RATE = "callbackRate";
    public static final String ICEBERG_QTY = "icebergQty";
    public static final String REDUCE_ONLY = "reduceOnly";
    public static final String POSITION_SIDE = "positionSide";
    public static final String NEW_CLIENT_ORDER_ID = "newClientOrderId";
    public static final String RECV_WINDOW = "recvWindow";

    public WireOrderFields {
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public Optional<String> get(String name) {
        return Optional.ofNullable(parameters.get(name));
    }

    public boolean has(String name) {
        return parameters.containsKey(name);
    }

    @Override
    public boolean isAccepted() {
        return true;
    }

    static Builder builder() {
        return new Builder();
    }

    /**
     * Collects parameters in insertion order, skipping null values.
     */
    static class Builder {
        private final Map<String, String> parameters = new LinkedHashMap<>();

        Builder put(String name, Object value) {
            if (value != null) {
                parameters.put(name, value.toString());
            }
            return this;
        }

        WireOrderFields build() {
            return new WireOrderFields(parameters);
        }
    }
}
