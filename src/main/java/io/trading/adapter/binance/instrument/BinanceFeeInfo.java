package io.trading.adapter.binance.instrument;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Maker and taker commission of one symbol.
 *
 * Reads both the spot {@code tradeFee} entry and the futures {@code commissionRate} response.
 *
 * @param symbol          Wire symbol
 * @param makerCommission Maker commission rate as a decimal string (e.g., "0.001")
 * @param takerCommission Taker commission rate as a decimal string
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BinanceFeeInfo(
    String symbol,
    @JsonAlias("makerCommissionRate") String makerCommission,
    @JsonAlias("takerCommissionRate") String takerCommission
) {
}
