package io.redust.server.shutdown;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ShutdownNotifier测试")
class ShutdownNotifierTest {

    @Test
    @DisplayName("广播信号到每个订阅者")
    void testNotifyAllSubscribers() {
        ShutdownNotifier notifier = new ShutdownNotifier();
        Shutdown first = notifier.subscribe();
        Shutdown second = notifier.subscribe();
        AtomicInteger fired = new AtomicInteger();
        first.onShutdown(fired::incrementAndGet);
        second.onShutdown(fired::incrementAndGet);
        assertFalse(notifier.isNotified());

        notifier.notifyShutdown();
        notifier.notifyShutdown();

        assertTrue(notifier.isNotified());
        assertTrue(first.isShutdown());
        assertTrue(second.isShutdown());
        assertEquals(2, fired.get());
        assertEquals(0, notifier.subscriberCount());
    }

    @Test
    @DisplayName("广播之后订阅立即得到已触发的信号")
    void testSubscribeAfterNotify() {
        ShutdownNotifier notifier = new ShutdownNotifier();
        notifier.notifyShutdown();

        Shutdown late = notifier.subscribe();
        AtomicInteger fired = new AtomicInteger();
        late.onShutdown(fired::incrementAndGet);

        assertTrue(late.isShutdown());
        assertEquals(1, fired.get());
    }

    @Test
    @DisplayName("注销后不再收到信号")
    void testCloseUnsubscribes() {
        ShutdownNotifier notifier = new ShutdownNotifier();
        Shutdown shutdown = notifier.subscribe();
        AtomicInteger fired = new AtomicInteger();
        shutdown.onShutdown(fired::incrementAndGet);

        shutdown.close();
        assertEquals(0, notifier.subscriberCount());

        notifier.notifyShutdown();
        assertFalse(shutdown.isShutdown());
        assertEquals(0, fired.get());
    }
}
