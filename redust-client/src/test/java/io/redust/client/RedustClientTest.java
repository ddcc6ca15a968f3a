package io.redust.client;

import io.netty.channel.embedded.EmbeddedChannel;
import io.redust.protocol.BulkString;
import io.redust.protocol.Errors;
import io.redust.protocol.RespArray;
import io.redust.protocol.RespInteger;
import io.redust.protocol.RespNull;
import io.redust.protocol.SimpleString;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 不经过网络，直接向处理器注入响应帧
 */
@DisplayName("RedustClient单元测试")
class RedustClientTest {

    private EmbeddedChannel channel;
    private RedustClient client;

    @BeforeEach
    void setUp() {
        ClientHandler handler = new ClientHandler();
        channel = new EmbeddedChannel(handler);
        client = new RedustClient(channel, handler, null).withTimeout(Duration.ofMillis(200));
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    private static RespArray frameOf(final Object... parts) {
        RespArray.Builder builder = RespArray.builder(parts.length);
        for (Object part : parts) {
            if (part instanceof Long) {
                builder.addInteger((Long) part);
            } else {
                builder.addBulk(part.toString());
            }
        }
        return builder.build();
    }

    @Test
    @DisplayName("GET发送请求帧并解析批量字符串")
    void testGet() {
        channel.writeInbound(BulkString.fromString("world"));

        Optional<byte[]> value = client.get("hello");

        assertEquals(frameOf("get", "hello"), channel.readOutbound());
        assertArrayEquals("world".getBytes(), value.orElseThrow());
    }

    @Test
    @DisplayName("GET空值返回空")
    void testGetMissing() {
        channel.writeInbound(RespNull.INSTANCE);

        assertFalse(client.get("missing").isPresent());
    }

    @Test
    @DisplayName("错误帧转换为异常")
    void testErrorReply() {
        channel.writeInbound(new Errors("ERR boom"));

        RedustClientException e = assertThrows(RedustClientException.class, () -> client.set("a", "b"));
        assertEquals("ERR boom", e.getMessage());
    }

    @Test
    @DisplayName("不符合预期的响应")
    void testUnexpectedReply() {
        channel.writeInbound(RespInteger.ONE);

        assertThrows(RedustClientException.class, () -> client.set("a", "b"));
    }

    @Test
    @DisplayName("等待响应超时")
    void testTimeout() {
        assertThrows(RedustClientException.class, () -> client.publish("c", "m"));
    }

    @Test
    @DisplayName("连接关闭后调用失败")
    void testClosedConnection() {
        channel.close();

        assertThrows(RedustClientException.class, () -> client.get("a"));
    }

    @Test
    @DisplayName("等待订阅确认期间到达的消息被缓存")
    void testMessageBeforeConfirmation() {
        channel.writeInbound(frameOf("subscribe", "a", 1L));
        channel.writeInbound(frameOf("message", "a", "early"));
        channel.writeInbound(frameOf("subscribe", "b", 2L));

        Subscriber subscriber = client.subscribe("a", "b");

        assertEquals(Arrays.asList("a", "b"), subscriber.getSubscribedChannels());
        Message message = subscriber.nextMessage(Duration.ofMillis(100)).orElseThrow();
        assertEquals("a", message.getChannel());
        assertEquals("early", message.getContentAsString());
        assertFalse(subscriber.nextMessage(Duration.ofMillis(50)).isPresent());
    }

    @Test
    @DisplayName("订阅后客户端不能再发送普通命令")
    void testNoPlainCommandsAfterSubscribe() {
        channel.writeInbound(frameOf("subscribe", "a", 1L));
        client.subscribe("a");

        assertThrows(IllegalStateException.class, () -> client.get("a"));
    }

    @Test
    @DisplayName("SET的响应必须是OK")
    void testSetOk() {
        channel.writeInbound(SimpleString.OK);

        assertDoesNotThrow(() -> client.set("a", "b"));
        assertEquals(frameOf("set", "a", "b"), channel.readOutbound());
    }
}
