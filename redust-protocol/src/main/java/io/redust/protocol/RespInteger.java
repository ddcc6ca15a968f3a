package io.redust.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 整数帧，编码为":十进制数\r\n"。
 *
 * <p>值按无符号64位整数解释：{@code content} 为负数时表示大于 {@link Long#MAX_VALUE} 的值，
 * 编码与 {@link #toString()} 均使用 {@link Long#toUnsignedString(long)}。
 * 0到127之间的实例会被缓存。
 *
 * @author redust
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class RespInteger extends Resp {
    /** 缓存上限 */
    private static final int CACHE_HIGH = 127;

    private static final RespInteger[] CACHE = new RespInteger[CACHE_HIGH + 1];

    static {
        for (int i = 0; i < CACHE.length; i++) {
            CACHE[i] = new RespInteger(i);
        }
    }

    public static final RespInteger ZERO = CACHE[0];
    public static final RespInteger ONE = CACHE[1];

    /** 按无符号解释的整数值 */
    private final long content;

    private RespInteger(final long content) {
        this.content = content;
    }

    /**
     * 工厂方法，小整数返回缓存实例。
     *
     * @param value 按无符号解释的整数值
     * @return RespInteger 实例
     */
    public static RespInteger valueOf(final long value) {
        if (value >= 0 && value <= CACHE_HIGH) {
            return CACHE[(int) value];
        }
        return new RespInteger(value);
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte(':');
        writeDecimal(byteBuf, content);
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return Long.toUnsignedString(content);
    }
}
