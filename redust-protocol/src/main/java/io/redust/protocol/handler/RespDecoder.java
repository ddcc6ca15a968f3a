package io.redust.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.redust.protocol.ConnectionResetException;
import io.redust.protocol.ProtocolException;
import io.redust.protocol.Resp;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * RESP协议解码器
 *
 * <p>连接读取侧的帧边界处理。Netty的累积缓冲区充当连接的读缓冲区，
 * 初始容量由服务端的接收缓冲分配器决定（4KB起步，按需增长）。
 * 每当有字节到达就尝试取出一个完整的帧：
 * <ul>
 *     <li>数据不完整 - 保留已缓冲的字节，等待下一次读取</li>
 *     <li>校验通过 - 解析帧，只移除该帧占用的字节，剩余字节留给下一帧</li>
 *     <li>格式错误 - 丢弃后续输入，向管道抛出 {@link ProtocolException}</li>
 * </ul>
 *
 * <p>对端关闭时如果缓冲区为空，视为正常结束；如果还残留半个帧，
 * 向管道抛出 {@link ConnectionResetException}。
 *
 * @author redust
 * @since 1.0.0
 */
@Slf4j
public class RespDecoder extends ByteToMessageDecoder {

    /** 出现格式错误后不再解码 */
    private boolean failed;

    @Override
    protected void decode(final ChannelHandlerContext ctx, final ByteBuf in, final List<Object> out) {
        if (failed) {
            in.skipBytes(in.readableBytes());
            return;
        }
        try {
            final Resp resp = Resp.decode(in);
            if (resp != null) {
                out.add(resp);
                log.debug("成功解码RESP帧: {}", resp.getClass().getSimpleName());
            }
        } catch (ProtocolException e) {
            failed = true;
            in.skipBytes(in.readableBytes());
            log.debug("RESP格式错误: {}", e.getMessage());
            throw e;
        }
    }

    @Override
    protected void decodeLast(final ChannelHandlerContext ctx, final ByteBuf in, final List<Object> out)
            throws Exception {
        if (!in.isReadable()) {
            return;
        }
        decode(ctx, in, out);
        if (in.isReadable()) {
            // 连接在帧中途断开
            final int remaining = in.readableBytes();
            in.skipBytes(remaining);
            log.debug("连接关闭时仍有{}字节未组成完整帧", remaining);
            throw new ConnectionResetException();
        }
    }
}
