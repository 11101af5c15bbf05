package io.trading.adapter.binance.instrument;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A symbol entry of the spot {@code GET /api/v3/exchangeInfo} response.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BinanceSpotSymbolInfo(
    String symbol,
    String status,
    String baseAsset,
    Integer baseAssetPrecision,
    String quoteAsset,
    Integer quotePrecision,
    Integer quoteAssetPrecision,
    List<String> orderTypes,
    Boolean icebergAllowed,
    Boolean ocoAllowed,
    @JsonProperty("isSpotTradingAllowed") Boolean spotTradingAllowed,
    @JsonProperty("isMarginTradingAllowed") Boolean marginTradingAllowed,
    List<BinanceSymbolFilter> filters,
    List<String> permissions
) implements BinanceSymbolInfo {

    /**
     * Quote asset precision, falling back to the legacy {@code quotePrecision} field.
     */
    public int resolvedQuotePrecision() {
        if (quoteAssetPrecision != null) {
            return quoteAssetPrecision;
        }
        return quotePrecision != null ? quotePrecision : 8;
    }

    public int resolvedBasePrecision() {
        return baseAssetPrecision != null ? baseAssetPrecision : 8;
    }
}
