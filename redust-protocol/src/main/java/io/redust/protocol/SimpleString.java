package io.redust.protocol;

import io.netty.buffer.ByteBuf;
import io.redust.datastructure.RedisBytes;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 简单字符串帧，编码为"+文本\r\n"。
 *
 * <p>文本不能包含'\r'或'\n'，否则编码结果会被对端拆成多个帧。
 * 常用的成功响应使用预定义常量 {@link #OK}。
 *
 * @author redust
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class SimpleString extends Resp {
    /** 预定义的成功响应 */
    public static final SimpleString OK = new SimpleString("OK");

    /** 字符串内容 */
    private final String content;

    /** 字符串的字节表示 */
    @EqualsAndHashCode.Exclude
    private final RedisBytes contentBytes;

    /**
     * @param content 单行文本
     * @throws IllegalArgumentException 文本包含'\r'或'\n'
     */
    public SimpleString(final String content) {
        this.content = requireSingleLine(content);
        this.contentBytes = RedisBytes.fromString(content);
    }

    /**
     * 工厂方法，"OK"返回缓存实例。
     *
     * @param content 字符串内容
     * @return SimpleString 实例
     */
    public static SimpleString valueOf(final String content) {
        if ("OK".equals(content)) {
            return OK;
        }
        return new SimpleString(content);
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte('+');
        byteBuf.writeBytes(contentBytes.getBytesUnsafe());
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return content;
    }
}
