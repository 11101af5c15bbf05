package io.trading.adapter.binance.instrument;

import java.math.BigDecimal;

/**
 * Validated trading rules of one symbol.
 *
 * Every bound other than the increments is nullable: null means the venue imposes no
 * constraint, never zero.
 *
 * @param pricePrecision      Decimal places of the tick size
 * @param sizePrecision       Decimal places of the step size
 * @param priceIncrement      Tick size, scaled to pricePrecision
 * @param sizeIncrement       Step size, scaled to sizePrecision
 * @param minPrice            Lowest accepted price
 * @param maxPrice            Highest accepted price
 * @param minQuantity         Smallest accepted quantity
 * @param maxQuantity         Largest accepted quantity
 * @param minNotional         Smallest accepted price times quantity, in the quote currency
 * @param maxNotional         Largest accepted price times quantity, in the quote currency
 * @param marketMinQuantity   Smallest accepted market order quantity
 * @param marketMaxQuantity   Largest accepted market order quantity
 * @param priceMultiplierUp   Upper price band as a multiple of the reference price
 * @param priceMultiplierDown Lower price band as a multiple of the reference price
 * @param icebergPartsLimit   Maximum number of iceberg slices
 * @param maxNumOrders        Maximum open orders on the symbol
 * @param maxNumAlgoOrders    Maximum open conditional orders on the symbol
 * @param maxNumIcebergOrders Maximum open iceberg orders on the symbol
 * @param minTrailingDelta    Smallest trailing delta in basis points
 * @param maxTrailingDelta    Largest trailing delta in basis points
 */
public record ParsedFilters(
    int pricePrecision,
    int sizePrecision,
    BigDecimal priceIncrement,
    BigDecimal sizeIncrement,
    BigDecimal minPrice,
    BigDecimal maxPrice,
    BigDecimal minQuantity,
    BigDecimal maxQuantity,
    BigDecimal minNotional,
    BigDecimal maxNotional,
    BigDecimal marketMinQuantity,
    BigDecimal marketMaxQuantity,
    BigDecimal priceMultiplierUp,
    BigDecimal priceMultiplierDown,
    Integer icebergPartsLimit,
    Integer maxNumOrders,
    Integer maxNumAlgoOrders,
    Integer maxNumIcebergOrders,
    Integer minTrailingDelta,
    Integer maxTrailingDelta
) {
}
