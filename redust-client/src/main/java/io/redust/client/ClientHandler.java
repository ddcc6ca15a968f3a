package io.redust.client;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.redust.protocol.Resp;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * 客户端入站处理器，把收到的帧放入队列，由调用线程按顺序取出。
 *
 * @author redust
 * @since 1.0.0
 */
@Slf4j
class ClientHandler extends SimpleChannelInboundHandler<Resp> {

    /** 连接关闭标记 */
    private static final Object CLOSED = new Object();

    private final BlockingQueue<Object> frames = new LinkedBlockingQueue<>();

    private volatile Throwable failure;

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final Resp msg) {
        frames.offer(msg);
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        frames.offer(CLOSED);
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        log.warn("客户端连接异常: {}", cause.getMessage());
        failure = cause;
        ctx.close();
    }

    /**
     * 取出下一个帧
     *
     * @return 收到的帧，超时返回null
     * @throws RedustClientException 连接已经关闭
     */
    Resp poll(final long timeout, final TimeUnit unit) {
        final Object frame;
        try {
            frame = frames.poll(timeout, unit);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RedustClientException("等待响应时被中断", e);
        }
        if (frame == CLOSED) {
            // 放回标记，之后的读取同样失败
            frames.offer(CLOSED);
            throw new RedustClientException("connection reset by server", failure);
        }
        return (Resp) frame;
    }
}
