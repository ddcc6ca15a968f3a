package io.redust.server.connection;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.redust.core.RedisCore;
import io.redust.protocol.Resp;
import io.redust.server.pubsub.SubscriptionSession;
import io.redust.server.shutdown.Shutdown;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.SocketAddress;

/**
 * 一个客户端连接
 *
 * <p>对底层通道的帧级封装：读入方向由管道中的解码器完成分帧，
 * 这里只负责把响应帧写回客户端，并持有该连接的停机信号和订阅会话。
 * 除构造外的所有方法都只在通道所属的事件循环线程上调用。
 *
 * @author redust
 * @since 1.0.0
 */
@Slf4j
public class Connection {

    @Getter
    private final Channel channel;

    @Getter
    private final Shutdown shutdown;

    private SubscriptionSession subscriptionSession;

    public Connection(final Channel channel, final Shutdown shutdown) {
        this.channel = channel;
        this.shutdown = shutdown;
    }

    /**
     * 写入一个帧并立即刷新
     */
    public ChannelFuture writeFrame(final Resp frame) {
        return channel.writeAndFlush(frame);
    }

    /**
     * 写入一个帧但不刷新，用于批量推送
     */
    public ChannelFuture write(final Resp frame) {
        return channel.write(frame);
    }

    public void flush() {
        channel.flush();
    }

    public boolean isActive() {
        return channel.isActive();
    }

    public boolean isWritable() {
        return channel.isWritable();
    }

    public SocketAddress remoteAddress() {
        return channel.remoteAddress();
    }

    /**
     * 返回该连接的订阅会话，首次调用时创建
     */
    public SubscriptionSession subscriptionSession(final RedisCore redisCore) {
        if (subscriptionSession == null) {
            subscriptionSession = new SubscriptionSession(redisCore, this);
        }
        return subscriptionSession;
    }

    /**
     * @return 是否已经进入订阅模式
     */
    public boolean isSubscribed() {
        return subscriptionSession != null && subscriptionSession.isListening();
    }

    public SubscriptionSession getSubscriptionSession() {
        return subscriptionSession;
    }

    /**
     * 释放订阅并注销停机信号，不关闭底层通道
     */
    public void release() {
        if (subscriptionSession != null) {
            subscriptionSession.close();
        }
        shutdown.close();
    }

    public ChannelFuture close() {
        log.debug("关闭连接: {}", channel.remoteAddress());
        return channel.close();
    }
}
