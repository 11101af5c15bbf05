package io.trading.adapter.binance.instrument;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Decodes the venue's market metadata payloads into schema records.
 */
public class BinanceExchangeInfoDecoder {

    private static final TypeReference<List<BinanceFeeInfo>> FEE_LIST = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public BinanceExchangeInfoDecoder() {
        this.mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public BinanceSpotExchangeInfo decodeSpotExchangeInfo(String json) {
        return read(json, BinanceSpotExchangeInfo.class, "spot exchange info");
    }

    public BinanceFuturesExchangeInfo decodeFuturesExchangeInfo(String json) {
        return read(json, BinanceFuturesExchangeInfo.class, "futures exchange info");
    }

    /**
     * Decodes the spot {@code GET /sapi/v1/asset/tradeFee} array.
     */
    public List<BinanceFeeInfo> decodeTradeFees(String json) {
        try {
            return mapper.readValue(json, FEE_LIST);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to decode trade fees", e);
        }
    }

    /**
     * Decodes the futures {@code GET /fapi/v1/commissionRate} object.
     */
    public BinanceFeeInfo decodeCommissionRate(String json) {
        return read(json, BinanceFeeInfo.class, "commission rate");
    }

    private <T> T read(String json, Class<T> type, String what) {
        try {
            return mapper.readValue(json, type);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to decode " + what, e);
        }
    }
}
