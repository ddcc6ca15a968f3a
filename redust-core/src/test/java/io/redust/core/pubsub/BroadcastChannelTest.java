package io.redust.core.pubsub;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BroadcastChannel单元测试")
class BroadcastChannelTest {

    @Test
    @DisplayName("每个接收方都按顺序收到全部消息")
    void testFanOutInOrder() {
        BroadcastChannel<String> channel = new BroadcastChannel<>(8);
        Receiver<String> first = channel.subscribe();
        Receiver<String> second = channel.subscribe();

        assertEquals(2, channel.send("a"));
        assertEquals(2, channel.send("b"));

        assertEquals("a", first.tryRecv().getMessage());
        assertEquals("b", first.tryRecv().getMessage());
        assertTrue(first.tryRecv().isEmpty());
        assertEquals("a", second.tryRecv().getMessage());
        assertEquals("b", second.tryRecv().getMessage());
    }

    @Test
    @DisplayName("新接收方收不到订阅之前的消息")
    void testLateSubscriberSeesOnlyNewMessages() {
        BroadcastChannel<String> channel = new BroadcastChannel<>(8);
        Receiver<String> early = channel.subscribe();
        channel.send("old");

        Receiver<String> late = channel.subscribe();
        channel.send("new");

        assertEquals("old", early.tryRecv().getMessage());
        assertEquals("new", late.tryRecv().getMessage());
        assertTrue(late.tryRecv().isEmpty());
    }

    @Test
    @DisplayName("没有接收方时消息被丢弃")
    void testSendWithoutReceivers() {
        BroadcastChannel<String> channel = new BroadcastChannel<>(4);

        assertEquals(0, channel.send("dropped"));

        Receiver<String> receiver = channel.subscribe();
        assertTrue(receiver.tryRecv().isEmpty());
    }

    @Test
    @DisplayName("落后超过容量的接收方得到LAGGED并从最旧的消息继续")
    void testLaggedReceiver() {
        BroadcastChannel<Integer> channel = new BroadcastChannel<>(4);
        Receiver<Integer> receiver = channel.subscribe();

        // 发送6条，容量4，最早的2条被覆盖
        for (int i = 0; i < 6; i++) {
            channel.send(i);
        }

        RecvResult<Integer> lagged = receiver.tryRecv();
        assertTrue(lagged.isLagged());
        assertEquals(2, lagged.getMissed());

        for (int expected = 2; expected < 6; expected++) {
            assertEquals(Integer.valueOf(expected), receiver.tryRecv().getMessage());
        }
        assertTrue(receiver.tryRecv().isEmpty());
    }

    @Test
    @DisplayName("发送不会因为慢接收方而阻塞")
    void testSendNeverBlocks() {
        BroadcastChannel<Integer> channel = new BroadcastChannel<>(1024);
        channel.subscribe();

        for (int i = 0; i < 10_000; i++) {
            assertEquals(1, channel.send(i));
        }
    }

    @Test
    @DisplayName("有新消息时通知监听器")
    void testListenerNotified() {
        BroadcastChannel<String> channel = new BroadcastChannel<>(4);
        Receiver<String> receiver = channel.subscribe();
        AtomicInteger notified = new AtomicInteger();
        receiver.setListener(notified::incrementAndGet);

        channel.send("x");
        channel.send("y");

        assertEquals(2, notified.get());
    }

    @Test
    @DisplayName("注册监听器时已有未读消息会立即通知")
    void testListenerNotifiedForPendingMessages() {
        BroadcastChannel<String> channel = new BroadcastChannel<>(4);
        Receiver<String> receiver = channel.subscribe();
        channel.send("pending");

        AtomicInteger notified = new AtomicInteger();
        receiver.setListener(notified::incrementAndGet);

        assertEquals(1, notified.get());
    }

    @Test
    @DisplayName("关闭后接收方被注销")
    void testCloseRemovesReceiver() {
        BroadcastChannel<String> channel = new BroadcastChannel<>(4);
        Receiver<String> receiver = channel.subscribe();
        assertEquals(1, channel.receiverCount());

        receiver.close();
        receiver.close();

        assertEquals(0, channel.receiverCount());
        assertTrue(receiver.isClosed());
        assertEquals(0, channel.send("x"));
        assertTrue(receiver.tryRecv().isEmpty());
    }

    @Test
    @DisplayName("容量必须为正数")
    void testInvalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new BroadcastChannel<String>(0));
    }
}
