package io.trading.adapter.binance.instrument;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * A symbol entry of the USD-M {@code GET /fapi/v1/exchangeInfo} or COIN-M
 * {@code GET /dapi/v1/exchangeInfo} response.
 *
 * USD-M reports the trading state as {@code status}, COIN-M as {@code contractStatus};
 * only COIN-M carries {@code contractSize}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BinanceFuturesSymbolInfo(
    String symbol,
    String pair,
    String contractType,
    Long deliveryDate,
    Long onboardDate,
    String status,
    String contractStatus,
    String maintMarginPercent,
    String requiredMarginPercent,
    String baseAsset,
    String quoteAsset,
    String marginAsset,
    Integer pricePrecision,
    Integer quantityPrecision,
    Integer baseAssetPrecision,
    Integer quotePrecision,
    Integer contractSize,
    String underlyingType,
    List<BinanceSymbolFilter> filters
) implements BinanceSymbolInfo {

    /**
     * The trading state from whichever field the product line reports.
     */
    public String tradingStatus() {
        return status != null ? status : contractStatus;
    }

    public int resolvedBasePrecision() {
        return baseAssetPrecision != null ? baseAssetPrecision : 8;
    }

    public int resolvedQuotePrecision() {
        return quotePrecision != null ? quotePrecision : 8;
    }
}
