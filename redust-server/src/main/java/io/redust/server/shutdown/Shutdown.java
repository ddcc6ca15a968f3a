package io.redust.server.shutdown;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 单个连接持有的停机信号
 *
 * <p>由 {@link ShutdownNotifier#subscribe()} 创建。信号只会触发一次，
 * 触发后注册的回调立即执行。
 *
 * @author redust
 * @since 1.0.0
 */
public final class Shutdown implements AutoCloseable {

    private final ShutdownNotifier notifier;

    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    private final CopyOnWriteArrayList<Runnable> callbacks = new CopyOnWriteArrayList<>();

    Shutdown(final ShutdownNotifier notifier) {
        this.notifier = notifier;
    }

    /**
     * @return 是否已经收到停机信号
     */
    public boolean isShutdown() {
        return shutdown.get();
    }

    /**
     * 注册停机回调，已经收到信号时在当前线程立即执行
     */
    public void onShutdown(final Runnable callback) {
        callbacks.add(callback);
        if (shutdown.get() && callbacks.remove(callback)) {
            callback.run();
        }
    }

    void fire() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        for (final Runnable callback : callbacks) {
            if (callbacks.remove(callback)) {
                callback.run();
            }
        }
    }

    /**
     * 取消注册，之后不再接收停机信号
     */
    @Override
    public void close() {
        callbacks.clear();
        notifier.unsubscribe(this);
    }
}
