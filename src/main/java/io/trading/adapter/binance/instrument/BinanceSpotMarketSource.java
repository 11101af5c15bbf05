package io.trading.adapter.binance.instrument;

import io.trading.adapter.binance.common.BinanceApiException;
import io.trading.adapter.binance.common.BinanceSymbols;

import java.util.List;

/**
 * Spot market metadata endpoints, implemented by the HTTP client.
 */
public interface BinanceSpotMarketSource {

    /**
     * {@code GET /api/v3/exchangeInfo} for every symbol.
     *
     * @throws BinanceApiException if the venue rejects the request
     */
    BinanceSpotExchangeInfo exchangeInfo();

    /**
     * {@code GET /api/v3/exchangeInfo?symbols=[...]}.
     *
     * @throws BinanceApiException if the venue rejects the request
     */
    BinanceSpotExchangeInfo exchangeInfo(BinanceSymbols symbols);

    /**
     * {@code GET /sapi/v1/asset/tradeFee}. Empty on testnet.
     *
     * @throws BinanceApiException if the venue rejects the request
     */
    List<BinanceFeeInfo> tradeFees();
}
