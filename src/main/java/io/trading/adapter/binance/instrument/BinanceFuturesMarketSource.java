package io.trading.adapter.binance.instrument;

import io.trading.adapter.binance.common.BinanceApiException;
import io.trading.adapter.binance.common.BinanceSymbol;

/**
 * Futures market metadata endpoints, implemented by the HTTP client.
 */
public interface BinanceFuturesMarketSource {

    /**
     * {@code GET /fapi/v1/exchangeInfo} (or {@code /dapi/v1/exchangeInfo} for COIN-M).
     *
     * @throws BinanceApiException if the venue rejects the request
     */
    BinanceFuturesExchangeInfo exchangeInfo();

    /**
     * {@code GET /fapi/v1/commissionRate} for one symbol, null when the venue has no rate.
     *
     * @throws BinanceApiException if the venue rejects the request
     */
    BinanceFeeInfo commissionRate(BinanceSymbol symbol);
}
