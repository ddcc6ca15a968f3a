package io.redust.server.pubsub;

import io.redust.command.Command;
import io.redust.command.impl.Subscribe;
import io.redust.command.impl.Unknown;
import io.redust.command.impl.Unsubscribe;
import io.redust.core.RedisCore;
import io.redust.core.pubsub.Receiver;
import io.redust.core.pubsub.RecvResult;
import io.redust.datastructure.RedisBytes;
import io.redust.protocol.BulkString;
import io.redust.protocol.Resp;
import io.redust.protocol.RespArray;
import io.redust.server.connection.Connection;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 连接的订阅会话
 *
 * <p>连接执行SUBSCRIBE之后进入监听状态，直到连接关闭或收到停机信号。
 * 监听期间同时等待两类事件：
 * <ul>
 *   <li>任一订阅频道有新消息 - 推送"message"帧</li>
 *   <li>客户端发来新的帧 - 只接受SUBSCRIBE和UNSUBSCRIBE，其他命令回复未知命令错误</li>
 * </ul>
 *
 * <p>新消息通知可能来自发布方线程，推送总是切换回连接的事件循环上执行。
 * 每轮推送对各个频道轮流取一条消息，单次最多推送 {@value #DRAIN_BUDGET} 条，
 * 剩余的消息在下一轮处理，不会饿死客户端发来的帧。
 *
 * @author redust
 * @since 1.0.0
 */
@Slf4j
public class SubscriptionSession {

    /** 单轮推送的消息上限 */
    static final int DRAIN_BUDGET = 64;

    public enum State {
        NOT_SUBSCRIBED,
        LISTENING
    }

    private final RedisCore redisCore;

    private final Connection connection;

    /** 按订阅顺序排列的频道 */
    private final Map<String, Receiver<RedisBytes>> subscriptions = new LinkedHashMap<>();

    private final AtomicBoolean drainScheduled = new AtomicBoolean(false);

    private volatile State state = State.NOT_SUBSCRIBED;

    private volatile boolean closed;

    public SubscriptionSession(final RedisCore redisCore, final Connection connection) {
        this.redisCore = redisCore;
        this.connection = connection;
    }

    public boolean isListening() {
        return state == State.LISTENING;
    }

    public State getState() {
        return state;
    }

    /**
     * @return 当前订阅的频道，按订阅顺序
     */
    public List<String> getChannels() {
        return new ArrayList<>(subscriptions.keySet());
    }

    /**
     * 订阅频道并进入监听状态
     *
     * @param channels 频道名，按顺序逐个确认
     */
    public void enter(final Collection<String> channels) {
        if (closed) {
            throw new IllegalStateException("订阅会话已关闭");
        }
        state = State.LISTENING;
        subscribe(channels);
    }

    /**
     * 处理监听期间客户端发来的帧
     *
     * @param frame 客户端发来的帧
     * @throws io.redust.protocol.ProtocolException 帧结构不合法
     */
    public void onFrame(final Resp frame) {
        final Command command = Command.fromFrame(frame);
        if (command instanceof Subscribe) {
            subscribe(((Subscribe) command).getChannels());
        } else if (command instanceof Unsubscribe) {
            unsubscribe(((Unsubscribe) command).getChannels());
        } else {
            connection.writeFrame(new Unknown(command.getName()).toError());
        }
    }

    private void subscribe(final Collection<String> channels) {
        for (final String channel : channels) {
            final Receiver<RedisBytes> receiver = redisCore.subscribe(RedisBytes.fromString(channel));
            final Receiver<RedisBytes> previous = subscriptions.put(channel, receiver);
            if (previous != null) {
                previous.close();
            }
            connection.writeFrame(RespArray.builder(3)
                    .add(BulkString.SUBSCRIBE)
                    .addBulk(channel)
                    .addInteger(subscriptions.size())
                    .build());
            // 确认帧写出之后才可能推送该频道的消息
            receiver.setListener(this::scheduleDrain);
        }
    }

    private void unsubscribe(final List<String> channels) {
        final List<String> targets = channels.isEmpty()
                ? new ArrayList<>(subscriptions.keySet())
                : channels;
        for (final String channel : targets) {
            final Receiver<RedisBytes> receiver = subscriptions.remove(channel);
            if (receiver != null) {
                receiver.close();
            }
            connection.writeFrame(RespArray.builder(3)
                    .add(BulkString.UNSUBSCRIBE)
                    .addBulk(channel)
                    .addInteger(subscriptions.size())
                    .build());
        }
    }

    /**
     * 安排一轮推送，可以在任意线程调用
     */
    public void scheduleDrain() {
        if (closed) {
            return;
        }
        if (drainScheduled.compareAndSet(false, true)) {
            connection.getChannel().eventLoop().execute(this::drain);
        }
    }

    private void drain() {
        drainScheduled.set(false);
        if (closed || !connection.isActive()) {
            return;
        }

        int budget = DRAIN_BUDGET;
        boolean progressed = true;
        while (progressed && budget > 0 && connection.isWritable()) {
            progressed = false;
            // 1. 每个频道轮流取一条
            for (final Map.Entry<String, Receiver<RedisBytes>> entry : subscriptions.entrySet()) {
                if (budget <= 0) {
                    break;
                }
                final RecvResult<RedisBytes> result = entry.getValue().tryRecv();
                if (result.isMessage()) {
                    connection.write(RespArray.builder(3)
                            .add(BulkString.MESSAGE)
                            .addBulk(entry.getKey())
                            .addBulk(result.getMessage())
                            .build());
                    budget--;
                    progressed = true;
                } else if (result.isLagged()) {
                    log.debug("订阅者落后, 频道: {}, 丢失消息: {}", entry.getKey(), result.getMissed());
                    progressed = true;
                }
            }
        }
        connection.flush();

        // 2. 预算用完还有剩余，留到下一轮
        if (budget <= 0) {
            scheduleDrain();
        }
    }

    /**
     * 关闭所有接收方，可重复调用
     */
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (final Receiver<RedisBytes> receiver : subscriptions.values()) {
            receiver.close();
        }
        subscriptions.clear();
    }
}
