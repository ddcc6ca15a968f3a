package io.redust.core.pubsub;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 固定容量的广播队列，一个频道对应一个实例。
 *
 * <p>消息写入环形缓冲区，每个 {@link Receiver} 持有自己的读取位置。
 * 发送方从不阻塞：缓冲区写满后覆盖最旧的消息，读取位置已经被覆盖的接收方
 * 在下一次接收时得到一个 {@link RecvResult.Kind#LAGGED} 结果，随后从仍然保留的最旧消息继续。
 *
 * <p>有新消息时，接收方注册的监听器会在锁外被调用，监听器不应执行耗时操作。
 *
 * @param <T> 消息类型
 * @author redust
 * @since 1.0.0
 */
public class BroadcastChannel<T> {

    private final ReentrantLock lock = new ReentrantLock();

    private final Object[] ring;

    private final int capacity;

    /** 下一条消息的序号，也是已发送消息的总数 */
    private long tail;

    private final List<Receiver<T>> receivers = new ArrayList<>();

    public BroadcastChannel(final int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("广播容量必须大于0");
        }
        this.capacity = capacity;
        this.ring = new Object[capacity];
    }

    /**
     * 创建一个新的接收方，只能收到此后发送的消息。
     *
     * @return 接收方，不再使用时必须调用 {@link Receiver#close()}
     */
    public Receiver<T> subscribe() {
        lock.lock();
        try {
            final Receiver<T> receiver = new Receiver<>(this, tail);
            receivers.add(receiver);
            return receiver;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 向所有当前接收方发送一条消息。
     *
     * @param message 消息
     * @return 当前接收方数量，没有接收方时消息被丢弃并返回0
     */
    public int send(final T message) {
        final List<Runnable> listeners;
        final int count;
        lock.lock();
        try {
            count = receivers.size();
            if (count == 0) {
                return 0;
            }
            ring[(int) (tail % capacity)] = message;
            tail++;
            listeners = new ArrayList<>(count);
            for (final Receiver<T> receiver : receivers) {
                final Runnable listener = receiver.getListener();
                if (listener != null) {
                    listeners.add(listener);
                }
            }
        } finally {
            lock.unlock();
        }
        for (final Runnable listener : listeners) {
            listener.run();
        }
        return count;
    }

    public int receiverCount() {
        lock.lock();
        try {
            return receivers.size();
        } finally {
            lock.unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    @SuppressWarnings("unchecked")
    RecvResult<T> tryRecv(final Receiver<T> receiver) {
        lock.lock();
        try {
            final long next = receiver.getNext();
            if (receiver.isClosed() || next == tail) {
                return RecvResult.empty();
            }
            if (tail - next > capacity) {
                final long oldest = tail - capacity;
                receiver.setNext(oldest);
                return RecvResult.lagged(oldest - next);
            }
            final T message = (T) ring[(int) (next % capacity)];
            receiver.setNext(next + 1);
            return RecvResult.message(message);
        } finally {
            lock.unlock();
        }
    }

    boolean hasPending(final Receiver<T> receiver) {
        lock.lock();
        try {
            return !receiver.isClosed() && receiver.getNext() != tail;
        } finally {
            lock.unlock();
        }
    }

    void remove(final Receiver<T> receiver) {
        lock.lock();
        try {
            receivers.remove(receiver);
        } finally {
            lock.unlock();
        }
    }
}
