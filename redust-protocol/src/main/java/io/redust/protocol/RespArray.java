package io.redust.protocol;

import io.netty.buffer.ByteBuf;
import io.redust.datastructure.RedisBytes;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 数组帧，编码为"*元素个数\r\n"后依次跟随每个元素的编码。
 *
 * <p>实例不可变，只能通过 {@link #builder()} 组装。客户端发送的命令
 * 和订阅推送的消息都是由批量字符串组成的数组。
 *
 * @author redust
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class RespArray extends Resp {

    /** 预定义的空数组实例 */
    public static final RespArray EMPTY = new RespArray(Collections.emptyList());

    /** 数组内容 */
    private final List<Resp> content;

    private RespArray(final List<Resp> content) {
        this.content = content;
    }

    public static Builder builder() {
        return new Builder(4);
    }

    public static Builder builder(final int expectedSize) {
        return new Builder(expectedSize);
    }

    public int size() {
        return content.size();
    }

    public Resp get(final int index) {
        return content.get(index);
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte('*');
        writeDecimal(byteBuf, content.size());
        byteBuf.writeBytes(CRLF);
        for (final Resp element : content) {
            element.encode(byteBuf);
        }
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < content.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(content.get(i));
        }
        return sb.append(']').toString();
    }

    /**
     * 数组构建器，向数组追加元素的唯一入口。
     */
    public static final class Builder {
        private List<Resp> elements;

        private Builder(final int expectedSize) {
            this.elements = new ArrayList<>(Math.max(expectedSize, 0));
        }

        public Builder add(final Resp element) {
            if (element == null) {
                throw new IllegalArgumentException("数组元素不能为null");
            }
            ensureOpen().add(element);
            return this;
        }

        public Builder addBulk(final RedisBytes bytes) {
            return add(new BulkString(bytes));
        }

        public Builder addBulk(final String text) {
            return add(BulkString.fromString(text));
        }

        public Builder addInteger(final long value) {
            return add(RespInteger.valueOf(value));
        }

        /**
         * 完成构建，之后构建器不可再使用。
         */
        public RespArray build() {
            final List<Resp> built = ensureOpen();
            elements = null;
            if (built.isEmpty()) {
                return EMPTY;
            }
            return new RespArray(Collections.unmodifiableList(built));
        }

        private List<Resp> ensureOpen() {
            if (elements == null) {
                throw new IllegalStateException("构建器已经完成构建");
            }
            return elements;
        }
    }
}
