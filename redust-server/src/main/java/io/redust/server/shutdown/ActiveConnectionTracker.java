package io.redust.server.shutdown;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 活跃连接计数器
 *
 * <p>每个连接建立时加一，处理结束时减一。停机时服务端阻塞在
 * {@link #awaitDrained(Duration)} 上，直到计数归零，
 * 保证没有连接在响应中途被丢弃。
 *
 * @author redust
 * @since 1.0.0
 */
@Slf4j
public class ActiveConnectionTracker {

    private final ReentrantLock lock = new ReentrantLock();

    private final Condition drained = lock.newCondition();

    private int activeCount;

    public void register() {
        lock.lock();
        try {
            activeCount++;
        } finally {
            lock.unlock();
        }
    }

    public void deregister() {
        lock.lock();
        try {
            if (activeCount == 0) {
                throw new IllegalStateException("活跃连接计数已经为0");
            }
            activeCount--;
            if (activeCount == 0) {
                drained.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    public int getActiveCount() {
        lock.lock();
        try {
            return activeCount;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 等待所有连接结束
     *
     * @param timeout 最长等待时间
     * @return 计数是否已经归零
     * @throws InterruptedException 等待被中断
     */
    public boolean awaitDrained(final Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (activeCount > 0) {
                if (remaining <= 0) {
                    log.warn("等待连接结束超时, 剩余活跃连接: {}", activeCount);
                    return false;
                }
                remaining = drained.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }
}
