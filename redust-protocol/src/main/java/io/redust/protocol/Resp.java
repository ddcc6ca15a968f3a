package io.redust.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.util.ByteProcessor;
import io.redust.datastructure.RedisBytes;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;

/**
 * RESP协议帧基类
 *
 * <p>所有帧类型的公共父类，同时提供帧的校验、解析和编码功能。
 * 构造函数仅对本包可见，帧类型的集合是封闭的：
 * <ul>
 *     <li>{@link SimpleString} - 以"+"开头的单行文本</li>
 *     <li>{@link Errors} - 以"-"开头的错误消息</li>
 *     <li>{@link RespInteger} - 以":"开头的无符号64位整数</li>
 *     <li>{@link BulkString} - 以"$"开头、带长度前缀的二进制串</li>
 *     <li>{@link RespNull} - 固定编码"$-1\r\n"</li>
 *     <li>{@link RespArray} - 以"*"开头的帧序列，唯一可以嵌套的类型</li>
 * </ul>
 *
 * <p>读取分两步进行。{@link #check(ByteBuf)} 只确认缓冲区中是否已有一个完整的帧，
 * 不创建任何对象；确认之后再由 {@link #parse(ByteBuf)} 构建帧。
 * 数据不足时抛出 {@link IncompleteFrameException}，格式错误时抛出 {@link ProtocolException}，
 * 两者从不混淆：缺少字节永远只算不完整。
 *
 * @author redust
 * @since 1.0.0
 */
@Slf4j
public abstract class Resp {
    /** 行结束符 */
    public static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 小整数的字节表示缓存 */
    private static final byte[][] NUMBERS = new byte[256][];

    /** 最大缓存数字 */
    private static final int MAX_CACHED_NUMBER = 255;

    /** 批量字符串最大长度 512MB */
    static final long PROTO_MAX_BULK_LEN = 512L * 1024 * 1024;

    /** 数组最大元素个数 */
    static final long PROTO_MAX_ARRAY_LEN = 1024L * 1024;

    static {
        for (int i = 0; i <= MAX_CACHED_NUMBER; i++) {
            NUMBERS[i] = String.valueOf(i).getBytes(StandardCharsets.US_ASCII);
        }
    }

    Resp() {
    }

    /**
     * 将帧编码写入缓冲区
     *
     * @param byteBuf 输出缓冲区
     */
    public abstract void encode(ByteBuf byteBuf);

    /**
     * 以无符号形式写入十进制数字
     *
     * @param buf 目标缓冲区
     * @param value 按无符号解释的64位整数
     */
    static void writeDecimal(final ByteBuf buf, final long value) {
        if (value >= 0 && value <= MAX_CACHED_NUMBER) {
            buf.writeBytes(NUMBERS[(int) value]);
        } else {
            buf.writeBytes(Long.toUnsignedString(value).getBytes(StandardCharsets.US_ASCII));
        }
    }

    /**
     * 从可读区域解码一个完整的帧。
     *
     * <p>先校验再解析。数据不完整时读索引保持不变并返回null；
     * 格式错误时读索引同样复位，异常继续向上抛出。
     *
     * @param buffer 输入缓冲区
     * @return 解码后的帧，数据不完整时返回null
     * @throws ProtocolException 当数据不符合RESP协议时
     */
    public static Resp decode(final ByteBuf buffer) {
        if (!buffer.isReadable()) {
            return null;
        }
        final int initialIndex = buffer.readerIndex();
        try {
            check(buffer);
        } catch (IncompleteFrameException e) {
            buffer.readerIndex(initialIndex);
            return null;
        } catch (ProtocolException e) {
            buffer.readerIndex(initialIndex);
            throw e;
        }

        // check已经走到帧末尾，parse会消费同样多的字节
        final int frameEnd = buffer.readerIndex();
        buffer.readerIndex(initialIndex);
        final Resp resp = parse(buffer);
        if (buffer.readerIndex() != frameEnd) {
            buffer.readerIndex(initialIndex);
            throw new ProtocolException("protocol error; invalid frame format");
        }
        return resp;
    }

    /**
     * 校验可读区域是否以一个完整的帧开头，成功时读索引停在帧末尾。
     *
     * @param buffer 输入缓冲区
     * @throws IncompleteFrameException 数据不完整
     * @throws ProtocolException 格式错误
     */
    public static void check(final ByteBuf buffer) {
        final byte typeIndicator = readByte(buffer);
        switch (typeIndicator) {
            case '+':
            case '-':
                readTextLine(buffer);
                return;
            case ':':
                readDecimal(buffer);
                return;
            case '$':
                if (peekByte(buffer) == '-') {
                    readNullLine(buffer);
                    return;
                }
                final int length = readLength(buffer, PROTO_MAX_BULK_LEN);
                skip(buffer, length);
                readCrlf(buffer);
                return;
            case '*':
                final int count = readLength(buffer, PROTO_MAX_ARRAY_LEN);
                for (int i = 0; i < count; i++) {
                    check(buffer);
                }
                return;
            default:
                throw invalidType(typeIndicator);
        }
    }

    /**
     * 解析一个已经通过 {@link #check(ByteBuf)} 校验的帧。
     *
     * @param buffer 输入缓冲区
     * @return 解析出的帧
     * @throws IncompleteFrameException 数据不完整
     * @throws ProtocolException 格式错误，包括简单字符串中的非法UTF-8
     */
    public static Resp parse(final ByteBuf buffer) {
        final byte typeIndicator = readByte(buffer);
        switch (typeIndicator) {
            case '+':
                return SimpleString.valueOf(readUtf8Line(buffer));
            case '-':
                return new Errors(readUtf8Line(buffer));
            case ':':
                return RespInteger.valueOf(readDecimal(buffer));
            case '$':
                if (peekByte(buffer) == '-') {
                    readNullLine(buffer);
                    return RespNull.INSTANCE;
                }
                final int length = readLength(buffer, PROTO_MAX_BULK_LEN);
                if (buffer.readableBytes() < length + 2) {
                    throw IncompleteFrameException.INSTANCE;
                }
                final byte[] content = new byte[length];
                buffer.readBytes(content);
                readCrlf(buffer);
                return BulkString.wrapTrusted(content);
            case '*':
                final int count = readLength(buffer, PROTO_MAX_ARRAY_LEN);
                final RespArray.Builder builder = RespArray.builder(count);
                for (int i = 0; i < count; i++) {
                    builder.add(parse(buffer));
                }
                return builder.build();
            default:
                throw invalidType(typeIndicator);
        }
    }

    private static ProtocolException invalidType(final byte typeIndicator) {
        log.debug("无法识别的RESP类型标识: {}", typeIndicator & 0xFF);
        return new ProtocolException("protocol error; invalid frame type byte `" + (typeIndicator & 0xFF) + "`");
    }

    private static ProtocolException invalidFormat() {
        return new ProtocolException("protocol error; invalid frame format");
    }

    private static byte readByte(final ByteBuf buffer) {
        if (!buffer.isReadable()) {
            throw IncompleteFrameException.INSTANCE;
        }
        return buffer.readByte();
    }

    private static byte peekByte(final ByteBuf buffer) {
        if (!buffer.isReadable()) {
            throw IncompleteFrameException.INSTANCE;
        }
        return buffer.getByte(buffer.readerIndex());
    }

    private static void skip(final ByteBuf buffer, final int length) {
        if (buffer.readableBytes() < length) {
            throw IncompleteFrameException.INSTANCE;
        }
        buffer.skipBytes(length);
    }

    private static void readCrlf(final ByteBuf buffer) {
        if (buffer.readableBytes() < 2) {
            throw IncompleteFrameException.INSTANCE;
        }
        if (buffer.readByte() != '\r' || buffer.readByte() != '\n') {
            throw invalidFormat();
        }
    }

    /**
     * 读取到下一个"\r\n"为止的一行，返回不含行结束符的切片。
     */
    private static ByteBuf readLine(final ByteBuf buffer) {
        final int start = buffer.readerIndex();
        final int end = buffer.writerIndex() - 1;
        int index = start;
        while (index < end) {
            // 1. 找到下一个'\r'
            final int cr = buffer.indexOf(index, end, (byte) '\r');
            if (cr < 0) {
                break;
            }
            // 2. 紧跟'\n'才算行结束
            if (buffer.getByte(cr + 1) == '\n') {
                final ByteBuf line = buffer.readSlice(cr - start);
                buffer.skipBytes(2);
                return line;
            }
            index = cr + 1;
        }
        throw IncompleteFrameException.INSTANCE;
    }

    /**
     * 简单字符串和错误消息的文本行，行内出现单独的'\r'或'\n'视为格式错误。
     */
    private static ByteBuf readTextLine(final ByteBuf buffer) {
        final ByteBuf line = readLine(buffer);
        if (line.forEachByte(ByteProcessor.FIND_CRLF) >= 0) {
            throw invalidFormat();
        }
        return line;
    }

    /**
     * 构造简单字符串和错误消息时校验文本
     *
     * @param text 单行文本
     * @return 原文本
     * @throws IllegalArgumentException 文本为null或包含'\r'、'\n'
     */
    static String requireSingleLine(final String text) {
        if (text == null) {
            throw new IllegalArgumentException("文本不能为null");
        }
        if (text.indexOf('\r') >= 0 || text.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("文本不能包含换行符");
        }
        return text;
    }

    private static String readUtf8Line(final ByteBuf buffer) {
        final ByteBuf line = readTextLine(buffer);
        final byte[] bytes = new byte[line.readableBytes()];
        line.getBytes(line.readerIndex(), bytes);
        try {
            return RedisBytes.wrapTrusted(bytes).toUtf8String();
        } catch (CharacterCodingException e) {
            throw new ProtocolException("protocol error; invalid frame format", e);
        }
    }

    /**
     * 空值行必须恰好是"-1"，其他负数长度一律视为格式错误。
     */
    private static void readNullLine(final ByteBuf buffer) {
        final ByteBuf line = readLine(buffer);
        if (line.readableBytes() != 2 || line.getByte(line.readerIndex()) != '-'
                || line.getByte(line.readerIndex() + 1) != '1') {
            throw invalidFormat();
        }
    }

    /**
     * 读取一行无符号十进制数
     *
     * @return 按无符号解释的64位整数
     */
    private static long readDecimal(final ByteBuf buffer) {
        final ByteBuf line = readLine(buffer);
        final int length = line.readableBytes();
        if (length == 0) {
            throw invalidFormat();
        }
        for (int i = 0; i < length; i++) {
            final byte b = line.getByte(line.readerIndex() + i);
            if (b < '0' || b > '9') {
                throw invalidFormat();
            }
        }
        try {
            return Long.parseUnsignedLong(line.toString(StandardCharsets.US_ASCII));
        } catch (NumberFormatException e) {
            // 超出无符号64位范围
            throw new ProtocolException("protocol error; invalid frame format", e);
        }
    }

    private static int readLength(final ByteBuf buffer, final long limit) {
        final long value = readDecimal(buffer);
        if (Long.compareUnsigned(value, limit) > 0) {
            throw new ProtocolException("protocol error; length " + Long.toUnsignedString(value)
                    + " exceeds limit " + limit);
        }
        return (int) value;
    }
}
