package io.redust.server.pubsub;

import io.netty.buffer.ByteBuf;
import io.netty.channel.embedded.EmbeddedChannel;
import io.redust.core.RedisCoreImpl;
import io.redust.datastructure.RedisBytes;
import io.redust.protocol.Resp;
import io.redust.protocol.RespArray;
import io.redust.protocol.handler.RespEncoder;
import io.redust.server.connection.Connection;
import io.redust.server.shutdown.ShutdownNotifier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SubscriptionSession测试")
class SubscriptionSessionTest {

    private RedisCoreImpl redisCore;
    private EmbeddedChannel channel;
    private SubscriptionSession session;

    @BeforeEach
    void setUp() {
        redisCore = new RedisCoreImpl(4);
        channel = new EmbeddedChannel(new RespEncoder());
        Connection connection = new Connection(channel, new ShutdownNotifier().subscribe());
        session = connection.subscriptionSession(redisCore);
    }

    @AfterEach
    void tearDown() {
        session.close();
        channel.finishAndReleaseAll();
        redisCore.shutdown();
    }

    private static RespArray frameOf(final String... parts) {
        final RespArray.Builder builder = RespArray.builder(parts.length);
        for (final String part : parts) {
            builder.addBulk(part);
        }
        return builder.build();
    }

    private void publish(final String channelName, final String message) {
        redisCore.publish(RedisBytes.fromString(channelName), RedisBytes.fromString(message));
    }

    /**
     * 把写出的字节重新解码成帧，便于比较
     */
    private List<Resp> readFrames() {
        final List<Resp> frames = new ArrayList<>();
        ByteBuf buf;
        while ((buf = channel.readOutbound()) != null) {
            try {
                Resp frame;
                while ((frame = Resp.decode(buf)) != null) {
                    frames.add(frame);
                }
            } finally {
                buf.release();
            }
        }
        return frames;
    }

    @Test
    @DisplayName("进入监听状态并按顺序确认")
    void testEnterConfirmsInOrder() {
        assertEquals(SubscriptionSession.State.NOT_SUBSCRIBED, session.getState());

        session.enter(Arrays.asList("b", "a"));

        assertTrue(session.isListening());
        assertEquals(Arrays.asList("b", "a"), session.getChannels());
        assertEquals(Arrays.asList(
                RespArray.builder().addBulk("subscribe").addBulk("b").addInteger(1).build(),
                RespArray.builder().addBulk("subscribe").addBulk("a").addInteger(2).build()),
                readFrames());
    }

    @Test
    @DisplayName("多个频道轮流推送")
    void testRoundRobinAcrossChannels() {
        session.enter(Arrays.asList("a", "b"));
        readFrames();

        publish("a", "a1");
        publish("a", "a2");
        publish("a", "a3");
        publish("b", "b1");
        channel.runPendingTasks();

        assertEquals(Arrays.asList(
                frameOf("message", "a", "a1"),
                frameOf("message", "b", "b1"),
                frameOf("message", "a", "a2"),
                frameOf("message", "a", "a3")),
                readFrames());
    }

    @Test
    @DisplayName("落后的订阅者跳过丢失的消息继续接收")
    void testLaggedSubscriberContinues() {
        session.enter(Collections.singletonList("news"));
        readFrames();

        // 频道容量为4，先发6条再推送
        for (int i = 0; i < 6; i++) {
            publish("news", "m" + i);
        }
        channel.runPendingTasks();

        assertEquals(Arrays.asList(
                frameOf("message", "news", "m2"),
                frameOf("message", "news", "m3"),
                frameOf("message", "news", "m4"),
                frameOf("message", "news", "m5")),
                readFrames());
    }

    @Test
    @DisplayName("超过单轮上限的消息在后续轮次推送完")
    void testDrainBudget() {
        redisCore.shutdown();
        redisCore = new RedisCoreImpl(1024);
        Connection connection = new Connection(channel, new ShutdownNotifier().subscribe());
        session = connection.subscriptionSession(redisCore);
        session.enter(Collections.singletonList("bulk"));
        readFrames();

        final int total = SubscriptionSession.DRAIN_BUDGET * 2 + 5;
        for (int i = 0; i < total; i++) {
            publish("bulk", String.valueOf(i));
        }
        channel.runPendingTasks();

        List<Resp> frames = readFrames();
        assertEquals(total, frames.size());
        assertEquals(frameOf("message", "bulk", String.valueOf(total - 1)), frames.get(total - 1));
    }

    @Test
    @DisplayName("重复订阅同一频道不增加计数")
    void testResubscribeSameChannel() {
        session.enter(Collections.singletonList("news"));
        session.onFrame(frameOf("subscribe", "news"));

        List<Resp> frames = readFrames();
        assertEquals(RespArray.builder().addBulk("subscribe").addBulk("news").addInteger(1).build(), frames.get(1));
        assertEquals(1, redisCore.publish(RedisBytes.fromString("news"), RedisBytes.fromString("x")));
    }

    @Test
    @DisplayName("退订未订阅的频道同样回复确认")
    void testUnsubscribeUnknownChannel() {
        session.enter(Collections.singletonList("a"));
        readFrames();

        session.onFrame(frameOf("unsubscribe", "zzz", "a"));

        assertEquals(Arrays.asList(
                RespArray.builder().addBulk("unsubscribe").addBulk("zzz").addInteger(1).build(),
                RespArray.builder().addBulk("unsubscribe").addBulk("a").addInteger(0).build()),
                readFrames());
        assertTrue(session.isListening());
    }

    @Test
    @DisplayName("退订后的频道不再推送")
    void testNoMessagesAfterUnsubscribe() {
        session.enter(Arrays.asList("a", "b"));
        session.onFrame(frameOf("unsubscribe", "a"));
        readFrames();

        publish("a", "ignored");
        publish("b", "kept");
        channel.runPendingTasks();

        assertEquals(Collections.singletonList(frameOf("message", "b", "kept")), readFrames());
    }

    @Test
    @DisplayName("关闭后不再推送")
    void testCloseStopsDelivery() {
        session.enter(Collections.singletonList("a"));
        readFrames();

        session.close();

        assertEquals(0, redisCore.publish(RedisBytes.fromString("a"), RedisBytes.fromString("x")));
        channel.runPendingTasks();
        assertTrue(readFrames().isEmpty());
        assertThrows(IllegalStateException.class, () -> session.enter(Collections.singletonList("b")));
    }
}
