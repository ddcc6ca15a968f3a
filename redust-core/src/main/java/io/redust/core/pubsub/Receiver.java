package io.redust.core.pubsub;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

/**
 * 广播队列上的一个接收方。
 *
 * <p>读取位置和关闭状态都由所属的 {@link BroadcastChannel} 在其锁内维护。
 *
 * @param <T> 消息类型
 * @author redust
 * @since 1.0.0
 */
public final class Receiver<T> implements AutoCloseable {

    private final BroadcastChannel<T> channel;

    @Getter(AccessLevel.PACKAGE)
    @Setter(AccessLevel.PACKAGE)
    private long next;

    @Getter(AccessLevel.PACKAGE)
    private volatile Runnable listener;

    @Getter
    private volatile boolean closed;

    Receiver(final BroadcastChannel<T> channel, final long next) {
        this.channel = channel;
        this.next = next;
    }

    /**
     * 非阻塞地接收下一条消息
     *
     * @return 接收结果
     */
    public RecvResult<T> tryRecv() {
        return channel.tryRecv(this);
    }

    /**
     * 注册新消息通知。注册时如果已有未读消息，立即通知一次。
     *
     * @param listener 通知回调，可能在发送方线程上执行
     */
    public void setListener(final Runnable listener) {
        this.listener = listener;
        if (listener != null && channel.hasPending(this)) {
            listener.run();
        }
    }

    /**
     * 从广播队列注销，此后不再收到任何消息。可重复调用。
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        listener = null;
        channel.remove(this);
    }
}
