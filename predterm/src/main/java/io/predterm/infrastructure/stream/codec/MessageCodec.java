package io.predterm.infrastructure.stream.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.predterm.domain.market.MarketNewsContext;
import io.predterm.domain.market.NewsItem;
import io.predterm.domain.market.OrderBookLevel;
import io.predterm.domain.market.Platform;
import io.predterm.domain.market.Trade;
import io.predterm.domain.stream.ErrorCode;
import io.predterm.domain.stream.FeedStatus;
import io.predterm.domain.stream.MessageType;
import io.predterm.domain.stream.OrderBookUpdateType;
import io.predterm.domain.stream.ServerMessage;
import io.predterm.domain.stream.Subscription;
import io.predterm.domain.stream.SubscriptionKind;
import io.predterm.util.Json;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * JSON wire format of the market stream.
 *
 * Inbound frames are objects tagged by {@code type}; field names are snake_case,
 * timestamps RFC-3339 and decimals either strings or JSON numbers.
 */
public final class MessageCodec {

    private static final TypeReference<List<OrderBookLevel>> LEVELS = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public MessageCodec() {
        this(Json.newMapper());
    }

    public MessageCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Parse one inbound frame.
     *
     * @throws MalformedFrameException if the frame cannot be turned into a message
     */
    public ServerMessage decode(String frame) {
        JsonNode node;
        try {
            node = mapper.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new MalformedFrameException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedFrameException("Frame is not a JSON object");
        }

        String tag = text(node, "type");
        MessageType type = MessageType.fromWire(tag)
            .orElseThrow(() -> new MalformedFrameException("Unknown message type: " + tag));

        try {
            return switch (type) {
                case PRICE_UPDATE -> new ServerMessage.PriceUpdate(
                    platform(node),
                    text(node, "market_id"),
                    decimal(node, "yes_price"),
                    decimal(node, "no_price"),
                    instant(node, "timestamp"));
                case ORDER_BOOK_UPDATE -> new ServerMessage.OrderBookUpdate(
                    platform(node),
                    text(node, "market_id"),
                    OrderBookUpdateType.fromWire(text(node, "update_type")),
                    levels(node, "yes_bids"),
                    levels(node, "yes_asks"),
                    levels(node, "no_bids"),
                    levels(node, "no_asks"),
                    instant(node, "timestamp"));
                case TRADE_UPDATE -> new ServerMessage.TradeUpdate(
                    platform(node),
                    text(node, "market_id"),
                    mapper.treeToValue(required(node, "trade"), Trade.class));
                case NEWS_UPDATE -> new ServerMessage.NewsUpdate(
                    mapper.treeToValue(required(node, "item"), NewsItem.class),
                    optional(node, "market_context") == null
                        ? null
                        : mapper.treeToValue(node.get("market_context"), MarketNewsContext.class));
                case SUBSCRIBED -> new ServerMessage.Subscribed(subscription(required(node, "subscription")));
                case UNSUBSCRIBED -> new ServerMessage.Unsubscribed(subscription(required(node, "subscription")));
                case ERROR -> new ServerMessage.ErrorMessage(
                    ErrorCode.fromWire(text(node, "code")),
                    node.path("message").asText(""));
                case PONG -> new ServerMessage.Pong(
                    required(node, "client_timestamp").asLong(),
                    node.path("server_timestamp").asLong(0));
                case CONNECTION_STATUS -> new ServerMessage.ConnectionStatus(
                    platform(node),
                    FeedStatus.fromWire(text(node, "status")));
            };
        } catch (JsonProcessingException e) {
            throw new MalformedFrameException("Bad " + tag + " payload: " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new MalformedFrameException("Bad " + tag + " payload: " + e.getMessage(), e);
        }
    }

    public String encodeSubscribe(Subscription subscription) {
        return command("subscribe", subscription);
    }

    public String encodeUnsubscribe(Subscription subscription) {
        return command("unsubscribe", subscription);
    }

    public String encodePing(long clientTimestamp) {
        ObjectNode root = mapper.createObjectNode();
        root.put("type", "ping");
        root.put("timestamp", clientTimestamp);
        return root.toString();
    }

    /**
     * Wire form of a subscription, e.g. {@code {"type":"trades","platform":"kalshi","market_id":"X"}}.
     */
    public ObjectNode subscriptionNode(Subscription subscription) {
        ObjectNode sub = mapper.createObjectNode();
        sub.put("type", subscription.kind().wireName());
        if (subscription.kind().isMarketScoped()) {
            sub.put("platform", subscription.platform().wireName());
            sub.put("market_id", subscription.marketId());
        }
        return sub;
    }

    private String command(String type, Subscription subscription) {
        ObjectNode root = mapper.createObjectNode();
        root.put("type", type);
        root.set("subscription", subscriptionNode(subscription));
        return root.toString();
    }

    private Subscription subscription(JsonNode node) {
        SubscriptionKind kind = SubscriptionKind.fromWire(text(node, "type"));
        if (!kind.isMarketScoped()) {
            return Subscription.globalNews();
        }
        return new Subscription(kind, platform(node), text(node, "market_id"));
    }

    private List<OrderBookLevel> levels(JsonNode node, String field) {
        JsonNode array = node.get(field);
        if (array == null || array.isNull()) {
            return List.of();
        }
        if (!array.isArray()) {
            throw new MalformedFrameException(field + " is not an array");
        }
        return mapper.convertValue(array, LEVELS);
    }

    private static Platform platform(JsonNode node) {
        return Platform.fromWire(text(node, "platform"));
    }

    private static JsonNode required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new MalformedFrameException("Missing field: " + field);
        }
        return value;
    }

    private static JsonNode optional(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = required(node, field);
        if (!value.isTextual()) {
            throw new MalformedFrameException("Field is not a string: " + field);
        }
        return value.asText();
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = required(node, field);
        if (value.isNumber()) {
            return value.decimalValue();
        }
        try {
            return new BigDecimal(value.asText().trim());
        } catch (NumberFormatException e) {
            throw new MalformedFrameException("Field is not a decimal: " + field, e);
        }
    }

    private static Instant instant(JsonNode node, String field) {
        JsonNode value = required(node, field);
        if (value.isNumber()) {
            return Instant.ofEpochMilli(value.asLong());
        }
        try {
            return OffsetDateTime.parse(value.asText()).toInstant();
        } catch (DateTimeParseException e) {
            throw new MalformedFrameException("Field is not a timestamp: " + field, e);
        }
    }
}
