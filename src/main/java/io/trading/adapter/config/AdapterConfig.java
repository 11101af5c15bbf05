package io.trading.adapter.config;

import io.trading.adapter.binance.common.BinanceAccountType;

/**
 * Configuration for the Binance normalization layer.
 *
 * @param accountType      Product type whose enum tables and filter sets are active
 * @param logWarnings      Log per-symbol instrument parse failures at WARN (DEBUG otherwise)
 * @param warnGtdToGtc     Log a warning when GTD is downgraded to GTC
 * @param useReduceOnly    Send the reduce-only flag; cannot be combined with hedge mode
 * @param instrumentBounds Sanity bounds for tick and step sizes
 * @param recvWindowMs     Receive window sent with order requests
 */
public record AdapterConfig(
    BinanceAccountType accountType,
    boolean logWarnings,
    boolean warnGtdToGtc,
    boolean useReduceOnly,
    InstrumentBounds instrumentBounds,
    int recvWindowMs
) {
    private static final int DEFAULT_RECV_WINDOW_MS = 5000;
    private static final int MAX_RECV_WINDOW_MS = 60000;

    public AdapterConfig {
        if (accountType == null) {
            throw new IllegalArgumentException("accountType cannot be null");
        }
        if (instrumentBounds == null) {
            throw new IllegalArgumentException("instrumentBounds cannot be null");
        }
        if (recvWindowMs <= 0 || recvWindowMs > MAX_RECV_WINDOW_MS) {
            throw new IllegalArgumentException("recvWindowMs must be between 1 and " + MAX_RECV_WINDOW_MS);
        }
    }

    public static AdapterConfig defaults(BinanceAccountType accountType) {
        return builder().accountType(accountType).build();
    }

    /**
     * Parses a configuration string.
     * Format: "ACCOUNT_TYPE[:key=value,key=value]"
     * Example: "USDT_FUTURE:logWarnings=false,useReduceOnly=true,recvWindowMs=10000"
     */
    public static AdapterConfig fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("config string cannot be null or blank");
        }
        String[] parts = value.split(":", 2);
        Builder builder = builder()
            .accountType(BinanceAccountType.valueOf(parts[0].trim().toUpperCase()));

        if (parts.length == 2 && !parts[1].isBlank()) {
            for (String option : parts[1].split(",")) {
                String[] kv = option.split("=", 2);
                if (kv.length != 2) {
                    throw new IllegalArgumentException("Invalid config option: " + option);
                }
                String key = kv[0].trim();
                String optionValue = kv[1].trim();
                switch (key) {
                    case "logWarnings" -> builder.logWarnings(Boolean.parseBoolean(optionValue));
                    case "warnGtdToGtc" -> builder.warnGtdToGtc(Boolean.parseBoolean(optionValue));
                    case "useReduceOnly" -> builder.useReduceOnly(Boolean.parseBoolean(optionValue));
                    case "recvWindowMs" -> builder.recvWindowMs(Integer.parseInt(optionValue));
                    default -> throw new IllegalArgumentException("Unknown config option: " + key);
                }
            }
        }
        return builder.build();
    }

    /**
     * Creates a new builder for AdapterConfig.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for AdapterConfig.
     */
    public static class Builder {
        private BinanceAccountType accountType = BinanceAccountType.SPOT;
        private boolean logWarnings = true;
        private boolean warnGtdToGtc = true;
        private boolean useReduceOnly = true;
        private InstrumentBounds instrumentBounds = InstrumentBounds.DEFAULT;
        private int recvWindowMs = DEFAULT_RECV_WINDOW_MS;

        public Builder accountType(BinanceAccountType accountType) {
            this.accountType = accountType;
            return this;
        }

        public Builder logWarnings(boolean logWarnings) {
            this.logWarnings = logWarnings;
            return this;
        }

        public Builder warnGtdToGtc(boolean warnGtdToGtc) {
            this.warnGtdToGtc = warnGtdToGtc;
            return this;
        }

        public Builder useReduceOnly(boolean useReduceOnly) {
            this.useReduceOnly = useReduceOnly;
            return this;
        }

        public Builder instrumentBounds(InstrumentBounds instrumentBounds) {
            this.instrumentBounds = instrumentBounds;
            return this;
        }

        public Builder recvWindowMs(int recvWindowMs) {
            this.recvWindowMs = recvWindowMs;
            return this;
        }

        public AdapterConfig build() {
            return new AdapterConfig(
                accountType,
                logWarnings,
                warnGtdToGtc,
                useReduceOnly,
                instrumentBounds,
                recvWindowMs
            );
        }
    }
}
