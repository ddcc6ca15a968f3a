package io.redust.protocol;

import io.netty.buffer.ByteBuf;

import java.nio.charset.StandardCharsets;

/**
 * 空值帧，固定编码为"$-1\r\n"。
 *
 * @author redust
 * @since 1.0.0
 */
public final class RespNull extends Resp {
    private static final byte[] NULL_BYTES = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 唯一实例 */
    public static final RespNull INSTANCE = new RespNull();

    private RespNull() {
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeBytes(NULL_BYTES);
    }

    @Override
    public String toString() {
        return "(nil)";
    }
}
