package io.trading.adapter.binance.instrument;

import io.trading.adapter.binance.common.BinanceAccountType;
import io.trading.adapter.config.InstrumentBounds;

import java.math.BigDecimal;
import java.util.Map;
import java.util.function.Function;

/**
 * Converts a symbol's raw venue filters into validated precisions, increments and bounds.
 *
 * Precisions are read from the decimal string itself, never through a binary float, so
 * "0.01000000" has precision 2 and "1.00000000" precision 0.
 *
 * The parser is stateless apart from its bounds and is safe to share between threads.
 */
public class BinanceFilterParser {

    private final InstrumentBounds bounds;

    public BinanceFilterParser(InstrumentBounds bounds) {
        this.bounds = bounds;
    }

    /**
     * Parses the filters of one symbol.
     *
     * @throws MissingRequiredFilterException if the tick size or step size is absent
     * @throws OutOfRangeException            if the tick size or step size fails the sanity bounds
     * @throws InstrumentParseException       if a numeric field is malformed
     */
    public ParsedFilters parse(Map<BinanceSymbolFilterType, BinanceSymbolFilter> filters, BinanceAccountType accountType) {
        BinanceSymbolFilter priceFilter = filters.get(BinanceSymbolFilterType.PRICE_FILTER);
        if (priceFilter == null || priceFilter.tickSize() == null) {
            throw new MissingRequiredFilterException(BinanceSymbolFilterType.PRICE_FILTER, "tickSize");
        }
        BinanceSymbolFilter lotSize = filters.get(BinanceSymbolFilterType.LOT_SIZE);
        if (lotSize == null || lotSize.stepSize() == null) {
            throw new MissingRequiredFilterException(BinanceSymbolFilterType.LOT_SIZE, "stepSize");
        }

        BigDecimal tickSize = decimal("tickSize", priceFilter.tickSize());
        int pricePrecision = checkIncrement("tickSize", tickSize, bounds.maxPrice());
        BigDecimal stepSize = decimal("stepSize", lotSize.stepSize());
        int sizePrecision = checkIncrement("stepSize", stepSize, bounds.maxQuantity());

        BigDecimal marketMinQuantity = null;
        BigDecimal marketMaxQuantity = null;
        BinanceSymbolFilter marketLotSize = filters.get(BinanceSymbolFilterType.MARKET_LOT_SIZE);
        if (marketLotSize != null) {
            marketMinQuantity = bound("minQty", marketLotSize.minQty(), bounds.maxQuantity());
            marketMaxQuantity = bound("maxQty", marketLotSize.maxQty(), bounds.maxQuantity());
        }

        PriceBand band = priceBand(filters, accountType);
        TrailingBounds trailing = trailingDelta(filters, accountType);

        return new ParsedFilters(
            pricePrecision,
            sizePrecision,
            tickSize.setScale(pricePrecision),
            stepSize.setScale(sizePrecision),
            bound("minPrice", priceFilter.minPrice(), bounds.maxPrice()),
            bound("maxPrice", priceFilter.maxPrice(), bounds.maxPrice()),
            bound("minQty", lotSize.minQty(), bounds.maxQuantity()),
            bound("maxQty", lotSize.maxQty(), bounds.maxQuantity()),
            minNotional(filters, accountType),
            maxNotional(filters),
            marketMinQuantity,
            marketMaxQuantity,
            band.up(),
            band.down(),
            spotOnly(filters, BinanceSymbolFilterType.ICEBERG_PARTS, accountType, BinanceSymbolFilter::limit),
            orderCap(filters.get(BinanceSymbolFilterType.MAX_NUM_ORDERS), accountType),
            orderCap(filters.get(BinanceSymbolFilterType.MAX_NUM_ALGO_ORDERS), accountType),
            spotOnly(filters, BinanceSymbolFilterType.MAX_NUM_ICEBERG_ORDERS, accountType,
                BinanceSymbolFilter::maxNumIcebergOrders),
            trailing.min(),
            trailing.max()
        );
    }

    /**
     * Number of significant decimal places in a decimal string, never negative.
     */
    public static int precisionOf(String value) {
        return Math.max(0, new BigDecimal(value).stripTrailingZeros().scale());
    }

    private int checkIncrement(String field, BigDecimal increment, BigDecimal max) {
        if (increment.signum() <= 0) {
            throw new OutOfRangeException(field, increment.toPlainString(), "must be positive");
        }
        if (increment.compareTo(max) > 0) {
            throw new OutOfRangeException(field, increment.toPlainString(), "exceeds " + max.toPlainString());
        }
        int precision = Math.max(0, increment.stripTrailingZeros().scale());
        if (precision > bounds.maxPrecision()) {
            throw new OutOfRangeException(field, increment.toPlainString(),
                "precision " + precision + " exceeds " + bounds.maxPrecision());
        }
        return precision;
    }

    /**
     * Parses an optional limit. Zero means the venue disabled the limit; values beyond the
     * sanity bound are clamped to it.
     */
    private static BigDecimal bound(String field, String value, BigDecimal max) {
        BigDecimal parsed = optionalDecimal(field, value);
        if (parsed == null) {
            return null;
        }
        return parsed.compareTo(max) > 0 ? max : parsed;
    }

    private static BigDecimal minNotional(Map<BinanceSymbolFilterType, BinanceSymbolFilter> filters,
                                          BinanceAccountType accountType) {
        BinanceSymbolFilter explicit = filters.get(BinanceSymbolFilterType.MIN_NOTIONAL);
        if (explicit != null) {
            String value = accountType.isFutures() ? explicit.notional() : explicit.minNotional();
            return optionalDecimal("minNotional", value);
        }
        BinanceSymbolFilter combined = filters.get(BinanceSymbolFilterType.NOTIONAL);
        return combined == null ? null : optionalDecimal("minNotional", combined.minNotional());
    }

    private static BigDecimal maxNotional(Map<BinanceSymbolFilterType, BinanceSymbolFilter> filters) {
        BinanceSymbolFilter combined = filters.get(BinanceSymbolFilterType.NOTIONAL);
        return combined == null ? null : optionalDecimal("maxNotional", combined.maxNotional());
    }

    private static PriceBand priceBand(Map<BinanceSymbolFilterType, BinanceSymbolFilter> filters,
                                       BinanceAccountType accountType) {
        BinanceSymbolFilter percent = filters.get(BinanceSymbolFilterType.PERCENT_PRICE);
        if (percent != null) {
            return new PriceBand(
                optionalDecimal("multiplierUp", percent.multiplierUp()),
                optionalDecimal("multiplierDown", percent.multiplierDown()));
        }
        BinanceSymbolFilter bySide = filters.get(BinanceSymbolFilterType.PERCENT_PRICE_BY_SIDE);
        if (bySide != null && accountType.isSpotOrMargin()) {
            // The widest band of the two sides
            return new PriceBand(
                max(optionalDecimal("bidMultiplierUp", bySide.bidMultiplierUp()),
                    optionalDecimal("askMultiplierUp", bySide.askMultiplierUp())),
                min(optionalDecimal("bidMultiplierDown", bySide.bidMultiplierDown()),
                    optionalDecimal("askMultiplierDown", bySide.askMultiplierDown())));
        }
        return new PriceBand(null, null);
    }

    private static TrailingBounds trailingDelta(Map<BinanceSymbolFilterType, BinanceSymbolFilter> filters,
                                           BinanceAccountType accountType) {
        BinanceSymbolFilter filter = filters.get(BinanceSymbolFilterType.TRAILING_DELTA);
        if (filter == null || !accountType.isSpotOrMargin()) {
            return new TrailingBounds(null, null);
        }
        return new TrailingBounds(
            minInt(filter.minTrailingAboveDelta(), filter.minTrailingBelowDelta()),
            maxInt(filter.maxTrailingAboveDelta(), filter.maxTrailingBelowDelta()));
    }

    private static Integer orderCap(BinanceSymbolFilter filter, BinanceAccountType accountType) {
        if (filter == null) {
            return null;
        }
        if (accountType.isFutures()) {
            return filter.limit();
        }
        return filter.maxNumOrders() != null ? filter.maxNumOrders() : filter.maxNumAlgoOrders();
    }

    private static Integer spotOnly(Map<BinanceSymbolFilterType, BinanceSymbolFilter> filters,
                                    BinanceSymbolFilterType type,
                                    BinanceAccountType accountType,
                                    Function<BinanceSymbolFilter, Integer> field) {
        BinanceSymbolFilter filter = filters.get(type);
        if (filter == null || !accountType.isSpotOrMargin()) {
            return null;
        }
        return field.apply(filter);
    }

    private static BigDecimal decimal(String field, String value) {
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            throw new InstrumentParseException("Malformed " + field + " '" + value + "'", e);
        }
    }

    /**
     * Null for absent or zero values.
     */
    private static BigDecimal optionalDecimal(String field, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        BigDecimal parsed = decimal(field, value);
        return parsed.signum() == 0 ? null : parsed;
    }

    private static BigDecimal max(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) {
            return a == null ? b : a;
        }
        return a.max(b);
    }

    private static BigDecimal min(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) {
            return a == null ? b : a;
        }
        return a.min(b);
    }

    private static Integer minInt(Integer a, Integer b) {
        if (a == null || b == null) {
            return a == null ? b : a;
        }
        return Math.min(a, b);
    }

    private static Integer maxInt(Integer a, Integer b) {
        if (a == null || b == null) {
            return a == null ? b : a;
        }
        return Math.max(a, b);
    }

    private record PriceBand(BigDecimal up, BigDecimal down) {
    }

    private record TrailingBounds(Integer min, Integer max) {
    }
}
