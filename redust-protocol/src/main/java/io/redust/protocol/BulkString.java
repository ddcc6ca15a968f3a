package io.redust.protocol;

import io.netty.buffer.ByteBuf;
import io.redust.datastructure.RedisBytes;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 批量字符串帧，编码为"$长度\r\n内容\r\n"。
 *
 * <p>内容是任意二进制数据，命令名和参数都以此类型传输。
 * 空值使用独立的 {@link RespNull}，本类的内容从不为null。
 *
 * @author redust
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class BulkString extends Resp {

    public static final BulkString SUBSCRIBE = fromString("subscribe");
    public static final BulkString UNSUBSCRIBE = fromString("unsubscribe");
    public static final BulkString MESSAGE = fromString("message");

    /** 字节内容 */
    private final RedisBytes content;

    public BulkString(final RedisBytes content) {
        if (content == null) {
            throw new IllegalArgumentException("BulkString内容不能为null，空值请使用RespNull");
        }
        this.content = content;
    }

    /**
     * 拷贝字节数组创建实例
     */
    public static BulkString create(final byte[] content) {
        return new BulkString(new RedisBytes(content));
    }

    /**
     * 零拷贝创建实例，调用者保证数组之后不再被修改。
     */
    public static BulkString wrapTrusted(final byte[] content) {
        return new BulkString(RedisBytes.wrapTrusted(content));
    }

    public static BulkString fromString(final String content) {
        return new BulkString(RedisBytes.fromString(content));
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        final byte[] bytes = content.getBytesUnsafe();
        byteBuf.ensureWritable(bytes.length + 16);
        byteBuf.writeByte('$');
        writeDecimal(byteBuf, bytes.length);
        byteBuf.writeBytes(CRLF);
        byteBuf.writeBytes(bytes);
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return content.getString();
    }
}
