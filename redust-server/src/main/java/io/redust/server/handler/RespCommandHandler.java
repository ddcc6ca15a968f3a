package io.redust.server.handler;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import io.redust.command.Command;
import io.redust.core.RedisCore;
import io.redust.protocol.Errors;
import io.redust.protocol.ProtocolException;
import io.redust.protocol.Resp;
import io.redust.server.connection.Connection;
import io.redust.server.shutdown.Shutdown;
import io.redust.server.shutdown.ShutdownNotifier;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * 命令处理器，每个连接一个实例。
 *
 * <p>按到达顺序逐帧处理：解析为命令后在共享存储上执行，并把响应写回连接。
 * 连接进入订阅模式后，之后的帧全部交给订阅会话。
 *
 * <p>连接的结束方式：
 * <ul>
 *   <li>客户端在帧边界关闭连接 - 正常结束</li>
 *   <li>客户端在帧中途关闭连接 - 按连接重置处理</li>
 *   <li>协议错误 - 回复错误帧后关闭</li>
 *   <li>收到停机信号 - 当前命令完成后关闭，不再处理剩余输入</li>
 * </ul>
 *
 * @author redust
 * @since 1.0.0
 */
@Slf4j
public class RespCommandHandler extends SimpleChannelInboundHandler<Resp> {

    /** 共享存储 */
    private final RedisCore redisCore;

    private final ShutdownNotifier shutdownNotifier;

    @Getter
    private Connection connection;

    public RespCommandHandler(final RedisCore redisCore, final ShutdownNotifier shutdownNotifier) {
        if (redisCore == null) {
            throw new IllegalArgumentException("存储不能为null");
        }
        this.redisCore = redisCore;
        this.shutdownNotifier = shutdownNotifier;
    }

    @Override
    public void channelActive(final ChannelHandlerContext ctx) throws Exception {
        ensureConnection(ctx);
        log.debug("客户端已连接: {}", ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    private Connection ensureConnection(final ChannelHandlerContext ctx) {
        if (connection == null) {
            final Shutdown shutdown = shutdownNotifier.subscribe();
            connection = new Connection(ctx.channel(), shutdown);
            // 停机信号可能来自任意线程，关闭操作排在当前命令之后
            shutdown.onShutdown(() -> ctx.channel().eventLoop().execute(() -> {
                log.debug("收到停机信号, 关闭连接: {}", ctx.channel().remoteAddress());
                ctx.close();
            }));
        }
        return connection;
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final Resp msg) {
        final Connection conn = ensureConnection(ctx);
        if (conn.getShutdown().isShutdown()) {
            ctx.close();
            return;
        }

        if (conn.isSubscribed()) {
            conn.getSubscriptionSession().onFrame(msg);
            return;
        }

        final Command command = Command.fromFrame(msg);
        log.trace("执行命令: {}", command);
        command.apply(redisCore, conn);
    }

    @Override
    public void channelWritabilityChanged(final ChannelHandlerContext ctx) throws Exception {
        if (ctx.channel().isWritable() && connection != null && connection.isSubscribed()) {
            connection.getSubscriptionSession().scheduleDrain();
        }
        super.channelWritabilityChanged(ctx);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        final Throwable actual = cause instanceof DecoderException && cause.getCause() != null
                ? cause.getCause()
                : cause;

        if (actual instanceof ProtocolException) {
            log.warn("协议错误, 关闭连接 {}: {}", ctx.channel().remoteAddress(), actual.getMessage());
            if (ctx.channel().isActive()) {
                // 错误消息可能带有客户端发来的内容
                ctx.writeAndFlush(new Errors("ERR " + Errors.singleLine(String.valueOf(actual.getMessage()))))
                        .addListener(ChannelFutureListener.CLOSE);
            } else {
                ctx.close();
            }
        } else if (actual instanceof IOException) {
            log.debug("连接异常断开 {}: {}", ctx.channel().remoteAddress(), actual.getMessage());
            ctx.close();
        } else {
            log.error("命令执行失败, 关闭连接 {}", ctx.channel().remoteAddress(), actual);
            ctx.close();
        }
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        if (connection != null) {
            connection.release();
        }
        log.debug("客户端已断开: {}", ctx.channel().remoteAddress());
        super.channelInactive(ctx);
    }
}
