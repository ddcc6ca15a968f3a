package io.redust.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import io.redust.protocol.Resp;
import lombok.extern.slf4j.Slf4j;

/**
 * RESP协议编码器
 *
 * <p>连接写入侧的帧序列化。调用方通过 {@code writeAndFlush} 写出帧，
 * 编码完成并刷新到套接字后写出的Future才会完成。
 *
 * @author redust
 * @since 1.0.0
 */
@Slf4j
public class RespEncoder extends MessageToByteEncoder<Resp> {

    @Override
    protected void encode(final ChannelHandlerContext ctx, final Resp msg, final ByteBuf out) {
        msg.encode(out);
        if (log.isTraceEnabled()) {
            log.trace("编码RESP帧: {} (大小: {} bytes)", msg.getClass().getSimpleName(), out.readableBytes());
        }
    }
}
