package io.trading.adapter.binance.instrument;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Fields shared by spot and futures {@code exchangeInfo} symbol entries.
 */
public interface BinanceSymbolInfo {

    String symbol();

    String baseAsset();

    String quoteAsset();

    List<BinanceSymbolFilter> filters();

    /**
     * Indexes the filters by kind. Null entries and filter kinds unknown to the adapter are dropped.
     */
    default Map<BinanceSymbolFilterType, BinanceSymbolFilter> filtersByType() {
        List<BinanceSymbolFilter> filters = filters();
        if (filters == null || filters.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<BinanceSymbolFilterType, BinanceSymbolFilter> byType = new EnumMap<>(BinanceSymbolFilterType.class);
        for (BinanceSymbolFilter filter : filters) {
            if (filter == null) {
                continue;
            }
            filter.type().ifPresent(type -> byType.put(type, filter));
        }
        return byType;
    }
}
