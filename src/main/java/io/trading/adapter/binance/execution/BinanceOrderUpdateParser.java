package io.trading.adapter.binance.execution;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import io.trading.adapter.binance.common.BinanceExecutionType;
import io.trading.adapter.binance.common.BinanceOrderSide;
import io.trading.adapter.binance.common.BinanceOrderStatus;
import io.trading.adapter.binance.common.BinanceOrderType;
import io.trading.adapter.binance.common.BinancePositionSide;
import io.trading.adapter.binance.common.BinanceTimeInForce;
import io.trading.adapter.binance.common.BinanceWorkingType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Optional;

/**
 * Streaming parser for Binance order payloads.
 *
 * Handles the spot user data {@code executionReport} event, the futures
 * {@code ORDER_TRADE_UPDATE} event and the REST order query response. Fields are read
 * token by token with Jackson's {@link JsonParser}; no tree is built.
 */
public class BinanceOrderUpdateParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(BinanceOrderUpdateParser.class);

    private static final JsonFactory JSON_FACTORY = new JsonFactory();

    public static final String EXECUTION_REPORT = "executionReport";
    public static final String ORDER_TRADE_UPDATE = "ORDER_TRADE_UPDATE";

    /**
     * Parses a user data stream event. Events that do not describe an order (balance and
     * position updates, listen key expiry) yield empty.
     */
    public Optional<BinanceOrderUpdate> parse(String message) {
        String eventType = eventType(message);
        if (EXECUTION_REPORT.equals(eventType)) {
            return Optional.of(parseExecutionReport(message));
        }
        if (ORDER_TRADE_UPDATE.equals(eventType)) {
            return Optional.of(parseOrderTradeUpdate(message));
        }
        LOGGER.debug("Ignoring user data event {}", eventType);
        return Optional.empty();
    }

    /**
     * Returns the top-level {@code e} field, or null when the message has none.
     */
    public String eventType(String message) {
        try (JsonParser parser = JSON_FACTORY.createParser(message)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                return null;
            }
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String field = parser.getCurrentName();
                JsonToken value = parser.nextToken();
                if (value.isStructStart()) {
                    parser.skipChildren();
                } else if ("e".equals(field)) {
                    return parser.getValueAsString();
                }
            }
            return null;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read event type", e);
        }
    }

    /**
     * Parses a spot {@code executionReport} event.
     *
     * For cancellations the venue reports the cancel request id in {@code c} and the
     * cancelled order's id in {@code C}; the latter is returned as the client order id.
     */
    public BinanceOrderUpdate parseExecutionReport(String message) {
        try (JsonParser parser = JSON_FACTORY.createParser(message)) {
            expectObject(parser);
            BinanceOrderUpdate.Builder builder = BinanceOrderUpdate.builder();
            String clientOrderId = null;
            String originalClientOrderId = null;
            BinanceExecutionType executionType = null;
            BigDecimal cumulativeQty = null;
            BigDecimal cumulativeQuote = null;

            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String field = parser.getCurrentName();
                JsonToken value = parser.nextToken();
                if (value == JsonToken.VALUE_NULL) {
                    continue;
                }
                if (value.isStructStart()) {
                    parser.skipChildren();
                    continue;
                }
                switch (field) {
                    case "E" -> builder.eventTimeMs(parser.getValueAsLong());
                    case "s" -> builder.symbol(parser.getValueAsString());
                    case "c" -> clientOrderId = parser.getValueAsString();
                    case "C" -> originalClientOrderId = parser.getValueAsString();
                    case "S" -> builder.side(BinanceOrderSide.fromWire(parser.getValueAsString()));
                    case "o" -> builder.orderType(BinanceOrderType.fromWire(parser.getValueAsString()));
                    case "f" -> builder.timeInForce(BinanceTimeInForce.fromWire(parser.getValueAsString()));
                    case "q" -> builder.quantity(decimal(parser));
                    case "p" -> builder.price(decimal(parser));
                    case "P" -> builder.stopPrice(decimal(parser));
                    case "x" -> executionType = BinanceExecutionType.fromWire(parser.getValueAsString());
                    case "X" -> builder.orderStatus(BinanceOrderStatus.fromWire(parser.getValueAsString()));
                    case "i" -> builder.venueOrderId(parser.getValueAsString());
                    case "l" -> builder.lastQty(decimal(parser));
                    case "z" -> cumulativeQty = decimal(parser);
                    case "L" -> builder.lastPrice(decimal(parser));
                    case "n" -> builder.commission(decimal(parser));
                    case "N" -> builder.commissionAsset(parser.getValueAsString());
                    case "T" -> builder.transactionTimeMs(parser.getValueAsLong());
                    case "t" -> builder.tradeId(parser.getValueAsLong());
                    case "m" -> builder.maker(parser.getValueAsBoolean());
                    case "Z" -> cumulativeQuote = decimal(parser);
                    default -> {
                        // not needed
                    }
                }
            }

            boolean cancelled = executionType == BinanceExecutionType.CANCELED
                && originalClientOrderId != null
                && !originalClientOrderId.isEmpty();
            return builder
                .clientOrderId(cancelled ? originalClientOrderId : clientOrderId)
                .executionType(executionType)
                .filledQty(cumulativeQty)
                .avgPrice(averagePrice(cumulativeQuote, cumulativeQty))
                .build();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse executionReport", e);
        }
    }

    /**
     * Parses a futures {@code ORDER_TRADE_UPDATE} event. Order fields sit in the nested
     * {@code o} object.
     */
    public BinanceOrderUpdate parseOrderTradeUpdate(String message) {
        try (JsonParser parser = JSON_FACTORY.createParser(message)) {
            expectObject(parser);
            BinanceOrderUpdate.Builder builder = BinanceOrderUpdate.builder();

            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String field = parser.getCurrentName();
                JsonToken value = parser.nextToken();
                if ("o".equals(field) && value == JsonToken.START_OBJECT) {
                    parseFuturesOrder(parser, builder);
                } else if (value.isStructStart()) {
                    parser.skipChildren();
                } else if ("E".equals(field)) {
                    builder.eventTimeMs(parser.getValueAsLong());
                } else if ("T".equals(field)) {
                    builder.transactionTimeMs(parser.getValueAsLong());
                }
            }
            return builder.build();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse ORDER_TRADE_UPDATE", e);
        }
    }

    private void parseFuturesOrder(JsonParser parser, BinanceOrderUpdate.Builder builder) throws IOException {
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            String field = parser.getCurrentName();
            JsonToken value = parser.nextToken();
            if (value == JsonToken.VALUE_NULL) {
                continue;
            }
            if (value.isStructStart()) {
                parser.skipChildren();
                continue;
            }
            switch (field) {
                case "s" -> builder.symbol(parser.getValueAsString());
                case "c" -> builder.clientOrderId(parser.getValueAsString());
                case "S" -> builder.side(BinanceOrderSide.fromWire(parser.getValueAsString()));
                case "o" -> builder.orderType(BinanceOrderType.fromWire(parser.getValueAsString()));
                case "f" -> builder.timeInForce(BinanceTimeInForce.fromWire(parser.getValueAsString()));
                case "q" -> builder.quantity(decimal(parser));
                case "p" -> builder.price(decimal(parser));
                case "ap" -> builder.avgPrice(decimal(parser));
                case "sp" -> builder.stopPrice(decimal(parser));
                case "x" -> builder.executionType(BinanceExecutionType.fromWire(parser.getValueAsString()));
                case "X" -> builder.orderStatus(BinanceOrderStatus.fromWire(parser.getValueAsString()));
                case "i" -> builder.venueOrderId(parser.getValueAsString());
                case "l" -> builder.lastQty(decimal(parser));
                case "z" -> builder.filledQty(decimal(parser));
                case "L" -> builder.lastPrice(decimal(parser));
                case "N" -> builder.commissionAsset(parser.getValueAsString());
                case "n" -> builder.commission(decimal(parser));
                case "T" -> builder.transactionTimeMs(parser.getValueAsLong());
                case "t" -> builder.tradeId(parser.getValueAsLong());
                case "m" -> builder.maker(parser.getValueAsBoolean());
                case "R" -> builder.reduceOnly(parser.getValueAsBoolean());
                case "wt" -> builder.workingType(BinanceWorkingType.fromWire(parser.getValueAsString()));
                case "ps" -> builder.positionSide(BinancePositionSide.fromWire(parser.getValueAsString()));
                default -> {
                    // not needed
                }
            }
        }
    }

    /**
     * Parses a REST order query response ({@code GET /api/v3/order} or {@code GET /fapi/v1/order}).
     * The result carries no execution type and no fill.
     */
    public BinanceOrderUpdate parseOrder(String message) {
        try (JsonParser parser = JSON_FACTORY.createParser(message)) {
            expectObject(parser);
            BinanceOrderUpdate.Builder builder = BinanceOrderUpdate.builder();
            BigDecimal executedQty = null;
            BigDecimal cumulativeQuote = null;
            BigDecimal avgPrice = null;
            long updateTime = 0;

            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String field = parser.getCurrentName();
                JsonToken value = parser.nextToken();
                if (value == JsonToken.VALUE_NULL) {
                    continue;
                }
                if (value.isStructStart()) {
                    parser.skipChildren();
                    continue;
                }
                switch (field) {
                    case "symbol" -> builder.symbol(parser.getValueAsString());
                    case "orderId" -> builder.venueOrderId(parser.getValueAsString());
                    case "clientOrderId" -> builder.clientOrderId(parser.getValueAsString());
                    case "price" -> builder.price(decimal(parser));
                    case "origQty" -> builder.quantity(decimal(parser));
                    case "executedQty" -> executedQty = decimal(parser);
                    case "cummulativeQuoteQty" -> cumulativeQuote = decimal(parser);
                    case "avgPrice" -> avgPrice = decimal(parser);
                    case "status" -> builder.orderStatus(BinanceOrderStatus.fromWire(parser.getValueAsString()));
                    case "timeInForce" -> builder.timeInForce(BinanceTimeInForce.fromWire(parser.getValueAsString()));
                    case "type" -> builder.orderType(BinanceOrderType.fromWire(parser.getValueAsString()));
                    case "side" -> builder.side(BinanceOrderSide.fromWire(parser.getValueAsString()));
                    case "stopPrice" -> builder.stopPrice(decimal(parser));
                    case "reduceOnly" -> builder.reduceOnly(parser.getValueAsBoolean());
                    case "positionSide" -> builder.positionSide(BinancePositionSide.fromWire(parser.getValueAsString()));
                    case "workingType" -> builder.workingType(BinanceWorkingType.fromWire(parser.getValueAsString()));
                    case "updateTime" -> updateTime = parser.getValueAsLong();
                    default -> {
                        // not needed
                    }
                }
            }

            return builder
                .filledQty(executedQty)
                .avgPrice(avgPrice != null ? avgPrice : averagePrice(cumulativeQuote, executedQty))
                .eventTimeMs(updateTime)
                .transactionTimeMs(updateTime)
                .build();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse order response", e);
        }
    }

    private static void expectObject(JsonParser parser) throws IOException {
        if (parser.nextToken() != JsonToken.START_OBJECT) {
            throw new IllegalArgumentException("Expected a JSON object");
        }
    }

    private static BigDecimal decimal(JsonParser parser) throws IOException {
        return new BigDecimal(parser.getValueAsString());
    }

    private static BigDecimal averagePrice(BigDecimal cumulativeQuote, BigDecimal cumulativeQty) {
        if (cumulativeQuote == null || cumulativeQty == null || cumulativeQty.signum() == 0) {
            return null;
        }
        return cumulativeQuote.divide(cumulativeQty, MathContext.DECIMAL64).stripTrailingZeros();
    }
}
