package io.predterm.infrastructure.stream.codec;

import io.predterm.domain.market.Platform;
import io.predterm.domain.stream.ErrorCode;
import io.predterm.domain.stream.FeedStatus;
import io.predterm.domain.stream.OrderBookUpdateType;
import io.predterm.domain.stream.ServerMessage;
import io.predterm.domain.stream.Subscription;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class MessageCodecTest {

    private final MessageCodec codec = new MessageCodec();

    @Test
    void testDecodePriceUpdateWithStringDecimals() {
        ServerMessage msg = codec.decode("{\"type\":\"price_update\",\"platform\":\"kalshi\",\"market_id\":\"KXBTC-25\","
            + "\"yes_price\":\"0.52\",\"no_price\":\"0.48\",\"timestamp\":\"2026-03-01T12:00:00Z\"}");

        ServerMessage.PriceUpdate price = (ServerMessage.PriceUpdate) msg;
        assertEquals(Platform.KALSHI, price.platform());
        assertEquals("KXBTC-25", price.marketId());
        assertEquals(new BigDecimal("0.52"), price.yesPrice());
        assertEquals(new BigDecimal("0.48"), price.noPrice());
        assertEquals(Instant.parse("2026-03-01T12:00:00Z"), price.timestamp());
    }

    @Test
    void testDecodeNumericDecimalsAndEpochTimestamp() {
        ServerMessage.PriceUpdate price = (ServerMessage.PriceUpdate) codec.decode(
            "{\"type\":\"price_update\",\"platform\":\"polymarket\",\"market_id\":\"0xabc\","
                + "\"yes_price\":0.61,\"no_price\":0.39,\"timestamp\":1767225600000}");

        assertEquals(0, new BigDecimal("0.61").compareTo(price.yesPrice()));
        assertEquals(Instant.ofEpochMilli(1767225600000L), price.timestamp());
    }

    @Test
    void testDecodeOrderBookSnapshot() {
        ServerMessage.OrderBookUpdate book = (ServerMessage.OrderBookUpdate) codec.decode(
            "{\"type\":\"order_book_update\",\"platform\":\"kalshi\",\"market_id\":\"KXBTC-25\","
                + "\"update_type\":\"snapshot\","
                + "\"yes_bids\":[{\"price\":\"0.50\",\"quantity\":\"100\"},{\"price\":\"0.51\",\"quantity\":\"40\",\"order_count\":3}],"
                + "\"yes_asks\":[{\"price\":\"0.53\",\"quantity\":\"75\"}],"
                + "\"no_bids\":[],\"no_asks\":[],"
                + "\"timestamp\":\"2026-03-01T12:00:00Z\"}");

        assertEquals(OrderBookUpdateType.SNAPSHOT, book.updateType());
        assertEquals(2, book.yesBids().size());
        assertEquals(Integer.valueOf(3), book.yesBids().get(1).orderCount());
        assertEquals(new BigDecimal("0.51"), book.toOrderBook().yesBids().get(0).price(), "Best bid first");
    }

    @Test
    void testDecodeTradeUpdate() {
        ServerMessage.TradeUpdate update = (ServerMessage.TradeUpdate) codec.decode(
            "{\"type\":\"trade_update\",\"platform\":\"polymarket\",\"market_id\":\"0xabc\",\"trade\":{"
                + "\"id\":\"t-1\",\"market_id\":\"0xabc\",\"platform\":\"polymarket\","
                + "\"timestamp\":\"2026-03-01T12:00:05Z\",\"price\":\"0.61\",\"quantity\":\"250\","
                + "\"outcome\":\"yes\",\"side\":\"Buy\",\"transaction_hash\":\"0xfeed\"}}");

        assertEquals("t-1", update.trade().id());
        assertTrue(update.trade().isBuy());
        assertEquals(250.0, update.trade().quantityValue());
        assertEquals("0xfeed", update.trade().transactionHash());
    }

    @Test
    void testDecodeNewsWithAndWithoutContext() {
        String item = "{\"id\":\"n-1\",\"title\":\"Fed holds rates\",\"url\":\"https://example.com/a\","
            + "\"published_at\":\"2026-03-01T11:00:00Z\",\"relevance_score\":0.8}";

        ServerMessage.NewsUpdate global = (ServerMessage.NewsUpdate) codec.decode(
            "{\"type\":\"news_update\",\"item\":" + item + "}");
        ServerMessage.NewsUpdate scoped = (ServerMessage.NewsUpdate) codec.decode(
            "{\"type\":\"news_update\",\"item\":" + item
                + ",\"market_context\":{\"platform\":\"kalshi\",\"market_id\":\"FED-26\"}}");

        assertTrue(global.isGlobal());
        assertEquals("Fed holds rates", global.item().title());
        assertFalse(scoped.isGlobal());
        assertTrue(scoped.marketContext().matches(Platform.KALSHI, "FED-26"));
    }

    @Test
    void testDecodeControlMessages() {
        ServerMessage.Subscribed ack = (ServerMessage.Subscribed) codec.decode(
            "{\"type\":\"subscribed\",\"subscription\":{\"type\":\"global_news\"}}");
        assertEquals(Subscription.globalNews(), ack.subscription());

        ServerMessage.ErrorMessage error = (ServerMessage.ErrorMessage) codec.decode(
            "{\"type\":\"error\",\"code\":\"market_not_found\",\"message\":\"no such market\"}");
        assertEquals(ErrorCode.MARKET_NOT_FOUND, error.code());

        ServerMessage.ErrorMessage future = (ServerMessage.ErrorMessage) codec.decode(
            "{\"type\":\"error\",\"code\":\"quota_exceeded\",\"message\":\"slow down\"}");
        assertEquals(ErrorCode.UNKNOWN, future.code());

        ServerMessage.ConnectionStatus status = (ServerMessage.ConnectionStatus) codec.decode(
            "{\"type\":\"connection_status\",\"platform\":\"kalshi\",\"status\":\"failed\"}");
        assertEquals(FeedStatus.FAILED, status.status());
    }

    @Test
    void testMalformedFramesThrow() {
        assertThrows(MalformedFrameException.class, () -> codec.decode("{"));
        assertThrows(MalformedFrameException.class, () -> codec.decode("\"price_update\""));
        assertThrows(MalformedFrameException.class, () -> codec.decode("{\"market_id\":\"x\"}"));
        assertThrows(MalformedFrameException.class, () -> codec.decode("{\"type\":\"trade_update\",\"platform\":\"kalshi\",\"market_id\":\"x\"}"));
        assertThrows(MalformedFrameException.class, () -> codec.decode(
            "{\"type\":\"price_update\",\"platform\":\"betfair\",\"market_id\":\"x\",\"yes_price\":\"1\",\"no_price\":\"0\",\"timestamp\":\"2026-01-01T00:00:00Z\"}"));
        assertThrows(MalformedFrameException.class, () -> codec.decode(
            "{\"type\":\"price_update\",\"platform\":\"kalshi\",\"market_id\":\"x\",\"yes_price\":\"abc\",\"no_price\":\"0\",\"timestamp\":\"2026-01-01T00:00:00Z\"}"));
        assertThrows(MalformedFrameException.class, () -> codec.decode(
            "{\"type\":\"price_update\",\"platform\":\"kalshi\",\"market_id\":\"x\",\"yes_price\":\"1\",\"no_price\":\"0\",\"timestamp\":\"yesterday\"}"));
    }

    @Test
    void testEncodeCommands() {
        assertEquals("{\"type\":\"subscribe\",\"subscription\":{\"type\":\"order_book\",\"platform\":\"kalshi\",\"market_id\":\"KXBTC-25\"}}",
            codec.encodeSubscribe(Subscription.orderBook(Platform.KALSHI, "KXBTC-25")));
        assertEquals("{\"type\":\"unsubscribe\",\"subscription\":{\"type\":\"global_news\"}}",
            codec.encodeUnsubscribe(Subscription.globalNews()));
        assertEquals("{\"type\":\"ping\",\"timestamp\":1767225600000}", codec.encodePing(1767225600000L));
    }
}
