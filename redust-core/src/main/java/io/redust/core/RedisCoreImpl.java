package io.redust.core;

import io.redust.core.pubsub.BroadcastChannel;
import io.redust.core.pubsub.Receiver;
import io.redust.datastructure.RedisBytes;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalLong;
import java.util.TreeMap;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * 基于内存的 {@link RedisCore} 实现
 *
 * <p>键值表、过期索引、频道表和id计数器合并为一份状态，由同一把锁保护，
 * 每个操作都在锁内原子完成，锁内不做任何I/O。
 *
 * <p>过期索引按(过期时刻, 条目id)排序，同一时刻过期的多个键依靠id区分。
 * 一个名为 {@code redust-expiration} 的守护线程负责清理过期键：清理完所有已到期的键后，
 * 睡眠到最近的过期时刻；没有过期键时无限期等待。只有新设置的过期时刻早于
 * 当前最近的过期时刻时才会唤醒它。
 *
 * <p>实例创建时启动清理线程，调用 {@link #shutdown()} 后线程退出。
 *
 * @author redust
 * @since 1.0.0
 */
@Slf4j
public class RedisCoreImpl implements RedisCore {

    /** 频道默认容量 */
    public static final int DEFAULT_CHANNEL_CAPACITY = 1024;

    private static final long SHUTDOWN_JOIN_MILLIS = 3000;

    private final ReentrantLock lock = new ReentrantLock();

    /** 清理线程等待的条件 */
    private final Condition backgroundTask = lock.newCondition();

    private final Map<RedisBytes, Entry> entries = new HashMap<>();

    private final TreeMap<ExpirationKey, RedisBytes> expirations = new TreeMap<>();

    private final Map<RedisBytes, BroadcastChannel<RedisBytes>> channels = new HashMap<>();

    private long nextId;

    private boolean shutdown;

    private final int channelCapacity;

    /** 单调时钟，单位纳秒 */
    private final LongSupplier nanoClock;

    private final Thread expirationThread;

    public RedisCoreImpl() {
        this(DEFAULT_CHANNEL_CAPACITY);
    }

    public RedisCoreImpl(final int channelCapacity) {
        this(channelCapacity, System::nanoTime);
    }

    /**
     * @param channelCapacity 每个频道可缓存的消息数
     * @param nanoClock 单调时钟
     */
    public RedisCoreImpl(final int channelCapacity, final LongSupplier nanoClock) {
        if (channelCapacity <= 0) {
            throw new IllegalArgumentException("频道容量必须大于0");
        }
        this.channelCapacity = channelCapacity;
        this.nanoClock = nanoClock;
        this.expirationThread = new Thread(this::purgeExpiredTasks);
        this.expirationThread.setName("redust-expiration");
        this.expirationThread.setDaemon(true);
        this.expirationThread.start();
    }

    @Override
    public RedisBytes get(final RedisBytes key) {
        lock.lock();
        try {
            final Entry entry = entries.get(key);
            return entry == null ? null : entry.data;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void set(final RedisBytes key, final RedisBytes value, final Duration expire) {
        if (key == null || value == null) {
            throw new IllegalArgumentException("键和值不能为null");
        }
        if (expire != null && expire.isNegative()) {
            throw new IllegalArgumentException("过期时长不能为负数");
        }
        lock.lock();
        try {
            // 1. 分配新的条目id
            final long id = nextId++;

            // 2. 计算过期时刻，并判断是否早于当前最近的过期时刻
            boolean notify = false;
            long expiresAt = 0;
            if (expire != null) {
                expiresAt = deadline(nanoClock.getAsLong(), expire);
                final ExpirationKey nearest = expirations.isEmpty() ? null : expirations.firstKey();
                notify = nearest == null || nearest.when > expiresAt;
            }

            // 3. 替换旧条目，同时删除它的过期记录
            final Entry previous = entries.put(key, new Entry(id, value, expire != null, expiresAt));
            if (previous != null && previous.expires) {
                expirations.remove(new ExpirationKey(previous.expiresAt, previous.id));
            }

            // 4. 登记新的过期记录
            if (expire != null) {
                expirations.put(new ExpirationKey(expiresAt, id), key);
            }

            if (notify) {
                backgroundTask.signal();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Receiver<RedisBytes> subscribe(final RedisBytes channel) {
        lock.lock();
        try {
            return channels.computeIfAbsent(channel, name -> new BroadcastChannel<>(channelCapacity)).subscribe();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long publish(final RedisBytes channel, final RedisBytes message) {
        lock.lock();
        try {
            final BroadcastChannel<RedisBytes> feed = channels.get(channel);
            return feed == null ? 0 : feed.send(message);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return 过期索引中的记录数
     */
    public int expirationCount() {
        lock.lock();
        try {
            return expirations.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void shutdown() {
        lock.lock();
        try {
            if (shutdown) {
                return;
            }
            shutdown = true;
            backgroundTask.signal();
        } finally {
            lock.unlock();
        }

        if (Thread.currentThread() != expirationThread) {
            try {
                expirationThread.join(SHUTDOWN_JOIN_MILLIS);
                if (expirationThread.isAlive()) {
                    log.warn("过期键清理线程未能在{}ms内退出", SHUTDOWN_JOIN_MILLIS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("存储已关闭");
    }

    public boolean isShutdown() {
        lock.lock();
        try {
            return shutdown;
        } finally {
            lock.unlock();
        }
    }

    Thread getExpirationThread() {
        return expirationThread;
    }

    /**
     * 删除所有已到期的键
     *
     * @return 剩余键中最近的过期时刻，没有剩余过期键或已关闭时为空
     */
    OptionalLong purgeExpiredKeys() {
        lock.lock();
        try {
            if (shutdown) {
                return OptionalLong.empty();
            }
            final long now = nanoClock.getAsLong();
            while (!expirations.isEmpty()) {
                final Map.Entry<ExpirationKey, RedisBytes> first = expirations.firstEntry();
                if (first.getKey().when > now) {
                    return OptionalLong.of(first.getKey().when);
                }
                entries.remove(first.getValue());
                expirations.pollFirstEntry();
            }
            return OptionalLong.empty();
        } finally {
            lock.unlock();
        }
    }

    private void purgeExpiredTasks() {
        log.debug("过期键清理线程启动");
        lock.lock();
        try {
            while (!shutdown) {
                final OptionalLong next = purgeExpiredKeys();
                if (shutdown) {
                    break;
                }
                if (next.isPresent()) {
                    backgroundTask.awaitNanos(next.getAsLong() - nanoClock.getAsLong());
                } else {
                    backgroundTask.await();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            lock.unlock();
        }
        log.debug("过期键清理线程退出");
    }

    private static long deadline(final long now, final Duration expire) {
        long nanos;
        try {
            nanos = expire.toNanos();
        } catch (ArithmeticException e) {
            nanos = Long.MAX_VALUE;
        }
        final long when = now + nanos;
        return when < now ? Long.MAX_VALUE : when;
    }

    private static final class Entry {
        private final long id;
        private final RedisBytes data;
        private final boolean expires;
        private final long expiresAt;

        private Entry(final long id, final RedisBytes data, final boolean expires, final long expiresAt) {
            this.id = id;
            this.data = data;
            this.expires = expires;
            this.expiresAt = expiresAt;
        }
    }

    /**
     * 过期索引的键，先按过期时刻再按条目id排序
     */
    private static final class ExpirationKey implements Comparable<ExpirationKey> {
        private final long when;
        private final long id;

        private ExpirationKey(final long when, final long id) {
            this.when = when;
            this.id = id;
        }

        @Override
        public int compareTo(final ExpirationKey other) {
            final int byTime = Long.compare(when, other.when);
            return byTime != 0 ? byTime : Long.compare(id, other.id);
        }

        @Override
        public boolean equals(final Object obj) {
            if (!(obj instanceof ExpirationKey)) {
                return false;
            }
            final ExpirationKey other = (ExpirationKey) obj;
            return when == other.when && id == other.id;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(when) * 31 + Long.hashCode(id);
        }
    }
}
