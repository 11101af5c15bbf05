package io.trading.adapter.binance.instrument;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Optional;

/**
 * One entry of a symbol's {@code filters} array. Numeric values stay in their venue string
 * form; which fields are populated depends on {@link #filterType()}.
 *
 * Spot reports order-count caps as {@code maxNumOrders} etc., futures as {@code limit}.
 * Spot reports the minimum notional as {@code minNotional}, futures as {@code notional}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BinanceSymbolFilter(
    String filterType,
    String minPrice,
    String maxPrice,
    String tickSize,
    String multiplierUp,
    String multiplierDown,
    String bidMultiplierUp,
    String bidMultiplierDown,
    String askMultiplierUp,
    String askMultiplierDown,
    String minQty,
    String maxQty,
    String stepSize,
    String minNotional,
    String maxNotional,
    String notional,
    Integer limit,
    Integer maxNumOrders,
    Integer maxNumAlgoOrders,
    Integer maxNumIcebergOrders,
    Integer minTrailingAboveDelta,
    Integer maxTrailingAboveDelta,
    Integer minTrailingBelowDelta,
    Integer maxTrailingBelowDelta,
    String maxPosition
) {

    /**
     * The filter kind, or empty when the venue introduced a kind not known here.
     */
    public Optional<BinanceSymbolFilterType> type() {
        return BinanceSymbolFilterType.find(filterType);
    }

    public static Builder builder(BinanceSymbolFilterType filterType) {
        return new Builder(filterType);
    }

    /**
     * Builder for BinanceSymbolFilter, mostly used to assemble filters in tests.
     */
    public static class Builder {
        private final String filterType;
        private String minPrice;
        private String maxPrice;
        private String tickSize;
        private String multiplierUp;
        private String multiplierDown;
        private String bidMultiplierUp;
        private String bidMultiplierDown;
        private String askMultiplierUp;
        private String askMultiplierDown;
        private String minQty;
        private String maxQty;
        private String stepSize;
        private String minNotional;
        private String maxNotional;
        private String notional;
        private Integer limit;
        private Integer maxNumOrders;
        private Integer maxNumAlgoOrders;
        private Integer maxNumIcebergOrders;
        private Integer minTrailingAboveDelta;
        private Integer maxTrailingAboveDelta;
        private Integer minTrailingBelowDelta;
        private Integer maxTrailingBelowDelta;
        private String maxPosition;

        private Builder(BinanceSymbolFilterType filterType) {
            this.filterType = filterType.getWireValue();
        }

        public Builder price(String minPrice, String maxPrice, String tickSize) {
            this.minPrice = minPrice;
            this.maxPrice = maxPrice;
            this.tickSize = tickSize;
            return this;
        }

        public Builder multipliers(String multiplierUp, String multiplierDown) {
            this.multiplierUp = multiplierUp;
            this.multiplierDown = multiplierDown;
            return this;
        }

        public Builder sideMultipliers(String bidUp, String bidDown, String askUp, String askDown) {
            this.bidMultiplierUp = bidUp;
            this.bidMultiplierDown = bidDown;
            this.askMultiplierUp = askUp;
            this.askMultiplierDown = askDown;
            return this;
        }

        public Builder quantity(String minQty, String maxQty, String stepSize) {
            this.minQty = minQty;
            this.maxQty = maxQty;
            this.stepSize = stepSize;
            return this;
        }

        public Builder minNotional(String minNotional) {
            this.minNotional = minNotional;
            return this;
        }

        public Builder maxNotional(String maxNotional) {
            this.maxNotional = maxNotional;
            return this;
        }

        public Builder notional(String notional) {
            this.notional = notional;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder maxNumOrders(int maxNumOrders) {
            this.maxNumOrders = maxNumOrders;
            return this;
        }

        public Builder maxNumAlgoOrders(int maxNumAlgoOrders) {
            this.maxNumAlgoOrders = maxNumAlgoOrders;
            return this;
        }

        public Builder maxNumIcebergOrders(int maxNumIcebergOrders) {
            this.maxNumIcebergOrders = maxNumIcebergOrders;
            return this;
        }

        public Builder trailingDelta(int minAbove, int maxAbove, int minBelow, int maxBelow) {
            this.minTrailingAboveDelta = minAbove;
            this.maxTrailingAboveDelta = maxAbove;
            this.minTrailingBelowDelta = minBelow;
            this.maxTrailingBelowDelta = maxBelow;
            return this;
        }

        public Builder maxPosition(String maxPosition) {
            this.maxPosition = maxPosition;
            return this;
        }

        public BinanceSymbolFilter build() {
            return new BinanceSymbolFilter(
                filterType,
                minPrice,
                maxPrice,
                tickSize,
                multiplierUp,
                multiplierDown,
                bidMultiplierUp,
                bidMultiplierDown,
                askMultiplierUp,
                askMultiplierDown,
                minQty,
                maxQty,
                stepSize,
                minNotional,
                maxNotional,
                notional,
                limit,
                maxNumOrders,
                maxNumAlgoOrders,
                maxNumIcebergOrders,
                minTrailingAboveDelta,
                maxTrailingAboveDelta,
                minTrailingBelowDelta,
                maxTrailingBelowDelta,
                maxPosition
            );
        }
    }
}
