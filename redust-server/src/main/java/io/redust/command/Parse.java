package io.redust.command;

import io.redust.datastructure.RedisBytes;
import io.redust.protocol.BulkString;
import io.redust.protocol.ProtocolException;
import io.redust.protocol.Resp;
import io.redust.protocol.RespArray;
import io.redust.protocol.RespInteger;
import io.redust.protocol.SimpleString;

import java.nio.charset.CharacterCodingException;
import java.util.Iterator;

/**
 * 命令参数游标
 *
 * <p>按顺序取出命令数组中的各个元素，并转换成需要的类型：
 * <ul>
 *   <li>字符串 - 简单字符串，或内容为合法UTF-8的批量字符串</li>
 *   <li>字节 - 简单字符串或批量字符串</li>
 *   <li>整数 - 整数帧，或内容为十进制数字的字符串</li>
 * </ul>
 *
 * @author redust
 * @since 1.0.0
 */
public class Parse {

    private final Iterator<Resp> parts;

    /**
     * @param frame 客户端发来的帧，必须是数组
     * @throws ProtocolException 如果帧不是数组
     */
    public Parse(final Resp frame) {
        if (!(frame instanceof RespArray)) {
            throw new ProtocolException("protocol error; expected array, got " + frame);
        }
        this.parts = ((RespArray) frame).getContent().iterator();
    }

    public boolean hasRemaining() {
        return parts.hasNext();
    }

    private Resp next() {
        if (!parts.hasNext()) {
            throw new ProtocolException("protocol error; unexpected end of stream");
        }
        return parts.next();
    }

    public String nextString() {
        final Resp frame = next();
        if (frame instanceof SimpleString) {
            return ((SimpleString) frame).getContent();
        }
        if (frame instanceof BulkString) {
            try {
                return ((BulkString) frame).getContent().toUtf8String();
            } catch (CharacterCodingException e) {
                throw new ProtocolException("protocol error; invalid string", e);
            }
        }
        throw new ProtocolException("protocol error; expected simple frame or bulk frame, got " + frame);
    }

    public RedisBytes nextBytes() {
        final Resp frame = next();
        if (frame instanceof SimpleString) {
            return ((SimpleString) frame).getContentBytes();
        }
        if (frame instanceof BulkString) {
            return ((BulkString) frame).getContent();
        }
        throw new ProtocolException("protocol error; expected simple frame or bulk frame, got " + frame);
    }

    /**
     * @return 按无符号解释的整数
     */
    public long nextInt() {
        final Resp frame = next();
        if (frame instanceof RespInteger) {
            return ((RespInteger) frame).getContent();
        }
        final String text;
        if (frame instanceof SimpleString) {
            text = ((SimpleString) frame).getContent();
        } else if (frame instanceof BulkString) {
            text = ((BulkString) frame).getContent().getString();
        } else {
            throw new ProtocolException("protocol error; expected int frame but got " + frame);
        }
        if (text.isEmpty() || !text.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new ProtocolException("protocol error; invalid number");
        }
        try {
            return Long.parseUnsignedLong(text);
        } catch (NumberFormatException e) {
            throw new ProtocolException("protocol error; invalid number", e);
        }
    }

    /**
     * 确认所有元素都已取出
     *
     * @throws ProtocolException 如果还有剩余元素
     */
    public void finish() {
        if (parts.hasNext()) {
            throw new ProtocolException("protocol error; expected end of frame; but there was more!");
        }
    }
}
