package io.trading.adapter.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.trading.adapter.binance.common.BinanceAccountType;

/**
 * Prometheus metrics for the Binance normalization layer.
 *
 * Tracks:
 * - Instruments loaded per account type and instrument kind
 * - Symbols skipped as not yet tradable
 * - Per-symbol parse failures
 * - Order requests rejected before reaching the venue
 * - Size of the last instrument load
 */
public class AdapterMetrics {

    private final CollectorRegistry registry;

    private final Counter instrumentsLoaded;
    private final Counter symbolsSkipped;
    private final Counter parseFailures;
    private final Counter orderRejections;
    private final Gauge lastLoadSize;

    public AdapterMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public AdapterMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.instrumentsLoaded = Counter.build()
            .name("binance_adapter_instruments_loaded_total")
            .help("Total number of instrument definitions produced")
            .labelNames("account_type", "kind")
            .register(registry);

        this.symbolsSkipped = Counter.build()
            .name("binance_adapter_symbols_skipped_total")
            .help("Total number of symbols skipped because they are not yet tradable")
            .labelNames("account_type")
            .register(registry);

        this.parseFailures = Counter.build()
            .name("binance_adapter_parse_failures_total")
            .help("Total number of symbols that failed instrument parsing")
            .labelNames("account_type")
            .register(registry);

        this.orderRejections = Counter.build()
            .name("binance_adapter_order_rejections_total")
            .help("Total number of order requests rejected before submission")
            .labelNames("account_type", "reason")
            .register(registry);

        this.lastLoadSize = Gauge.build()
            .name("binance_adapter_last_load_instruments")
            .help("Number of instruments produced by the most recent load")
            .labelNames("account_type")
            .register(registry);
    }

    public void recordInstrumentLoaded(BinanceAccountType accountType, String kind) {
        instrumentsLoaded.labels(accountType.name(), kind).inc();
    }

    public void recordSymbolSkipped(BinanceAccountType accountType) {
        symbolsSkipped.labels(accountType.name()).inc();
    }

    public void recordParseFailure(BinanceAccountType accountType) {
        parseFailures.labels(accountType.name()).inc();
    }

    public void recordOrderRejection(BinanceAccountType accountType, String reason) {
        orderRejections.labels(accountType.name(), reason).inc();
    }

    public void setLastLoadSize(BinanceAccountType accountType, int count) {
        lastLoadSize.labels(accountType.name()).set(count);
    }

    /**
     * Returns the registry the collectors are registered with.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }
}
