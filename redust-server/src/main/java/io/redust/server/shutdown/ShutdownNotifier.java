package io.redust.server.shutdown;

import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 停机广播器
 *
 * <p>服务端持有唯一实例，每个连接订阅一个 {@link Shutdown}。
 * {@link #notifyShutdown()} 只生效一次，之后订阅得到的信号已处于触发状态。
 *
 * @author redust
 * @since 1.0.0
 */
@Slf4j
public class ShutdownNotifier {

    private final Set<Shutdown> subscribers = ConcurrentHashMap.newKeySet();

    private final AtomicBoolean notified = new AtomicBoolean(false);

    public Shutdown subscribe() {
        final Shutdown shutdown = new Shutdown(this);
        subscribers.add(shutdown);
        // 1. 与notifyShutdown并发时由这里补发信号
        if (notified.get()) {
            subscribers.remove(shutdown);
            shutdown.fire();
        }
        return shutdown;
    }

    void unsubscribe(final Shutdown shutdown) {
        subscribers.remove(shutdown);
    }

    /**
     * 向所有订阅者发出停机信号
     */
    public void notifyShutdown() {
        if (!notified.compareAndSet(false, true)) {
            return;
        }
        log.info("广播停机信号, 订阅者数量: {}", subscribers.size());
        for (final Shutdown shutdown : subscribers) {
            subscribers.remove(shutdown);
            shutdown.fire();
        }
    }

    public boolean isNotified() {
        return notified.get();
    }

    public int subscriberCount() {
        return subscribers.size();
    }
}
