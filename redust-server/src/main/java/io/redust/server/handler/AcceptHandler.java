package io.redust.server.handler;

import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.redust.server.config.RedisServerConfig;
import io.redust.server.shutdown.ActiveConnectionTracker;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * 服务端通道上的接入控制处理器
 *
 * <p>位于服务端通道的管道中，在新连接交给worker线程组之前处理：
 * <ul>
 *   <li>准入限制 - 每个连接占用一个许可，连接关闭时归还。许可用完后停止接受新连接，
 *   同一批次中多接受的连接进入等待队列，有许可归还时按顺序放行</li>
 *   <li>失败退避 - 接受连接出错时暂停接受，退避时间从初始值开始逐次翻倍，
 *   超过上限后关闭服务端通道</li>
 * </ul>
 *
 * <p>除许可归还外，所有状态只在服务端通道的事件循环上访问。
 *
 * @author redust
 * @since 1.0.0
 */
@Slf4j
public class AcceptHandler extends ChannelInboundHandlerAdapter {

    private final int maxConnections;

    private final Semaphore permits;

    private final ActiveConnectionTracker tracker;

    private final long initialBackoffNanos;

    private final long maxBackoffNanos;

    /** 已经接受但尚未放行的连接 */
    private final Deque<Channel> pending = new ArrayDeque<>();

    private long backoffNanos;

    private boolean backingOff;

    private volatile Throwable fatalError;

    public AcceptHandler(final RedisServerConfig config, final ActiveConnectionTracker tracker) {
        this.maxConnections = config.getMaxConnections();
        this.permits = new Semaphore(maxConnections);
        this.tracker = tracker;
        this.initialBackoffNanos = config.getAcceptBackoffInitial().toNanos();
        this.maxBackoffNanos = config.getAcceptBackoffMax().toNanos();
        this.backoffNanos = initialBackoffNanos;
    }

    @Override
    public void channelRead(final ChannelHandlerContext ctx, final Object msg) {
        final Channel child = (Channel) msg;
        // 1. 接受成功，退避时间复位
        backoffNanos = initialBackoffNanos;

        // 2. 有等待的连接时新连接排在后面
        if (pending.isEmpty() && permits.tryAcquire()) {
            admit(ctx, child);
        } else {
            pending.addLast(child);
            log.debug("连接数达到上限 {}, 等待空闲许可: {}", maxConnections, child.remoteAddress());
        }
        updateAutoRead(ctx);
    }

    private void admit(final ChannelHandlerContext ctx, final Channel child) {
        tracker.register();
        child.closeFuture().addListener(future -> {
            // 排在连接关闭事件之后归还许可
            if (child.isRegistered()) {
                child.eventLoop().execute(() -> release(ctx));
            } else {
                release(ctx);
            }
        });
        ctx.fireChannelRead(child);
    }

    private void release(final ChannelHandlerContext ctx) {
        permits.release();
        tracker.deregister();
        if (!ctx.executor().isShuttingDown()) {
            ctx.executor().execute(() -> admitPending(ctx));
        }
    }

    private void admitPending(final ChannelHandlerContext ctx) {
        while (!pending.isEmpty() && permits.tryAcquire()) {
            final Channel child = pending.pollFirst();
            if (!child.isOpen()) {
                permits.release();
                continue;
            }
            log.debug("放行等待中的连接: {}", child.remoteAddress());
            admit(ctx, child);
        }
        updateAutoRead(ctx);
    }

    private void updateAutoRead(final ChannelHandlerContext ctx) {
        final boolean autoRead = !backingOff && pending.isEmpty() && permits.availablePermits() > 0;
        if (ctx.channel().config().isAutoRead() != autoRead) {
            ctx.channel().config().setAutoRead(autoRead);
        }
    }

    /**
     * 服务端通道上的异常都来自接受连接
     */
    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        if (backoffNanos > maxBackoffNanos) {
            fatalError = cause;
            log.error("接受连接持续失败, 退避时间超过上限 {}ms, 关闭服务端通道",
                    TimeUnit.NANOSECONDS.toMillis(maxBackoffNanos), cause);
            ctx.close();
            return;
        }

        log.warn("接受连接失败, {}ms后重试: {}", TimeUnit.NANOSECONDS.toMillis(backoffNanos), cause.getMessage());
        backingOff = true;
        updateAutoRead(ctx);
        ctx.executor().schedule(() -> {
            backingOff = false;
            updateAutoRead(ctx);
        }, backoffNanos, TimeUnit.NANOSECONDS);
        backoffNanos *= 2;
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        // 服务端通道关闭后等待中的连接不再有机会被放行。
        // 它们还没有注册到事件循环，只能强制关闭底层socket
        Channel child;
        while ((child = pending.pollFirst()) != null) {
            child.unsafe().closeForcibly();
        }
        super.channelInactive(ctx);
    }

    /**
     * @return 导致服务端通道关闭的接受错误，没有时返回null
     */
    public Throwable getFatalError() {
        return fatalError;
    }

    public int getPendingCount() {
        return pending.size();
    }

    public int getAvailablePermits() {
        return permits.availablePermits();
    }
}
