package io.redust.datastructure;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 不可变字节序列，用作键、值、频道名和消息体的统一载体。
 *
 * <p>服务端存储的值、发布的消息以及协议层的批量字符串都以本类表示。
 * 实例一旦创建内容不再变化，可以在多个连接和存储线程之间自由共享。
 *
 * <ul>
 *   <li>哈希值在构造时预先计算，适合作为 {@code HashMap} 的键
 *   <li>字符串形式延迟解码并缓存
 *   <li>{@link #wrapTrusted(byte[])} 为内部受信任场景提供零拷贝路径
 * </ul>
 *
 * @author redust
 * @since 1.0.0
 */
public final class RedisBytes implements Comparable<RedisBytes> {

    /** 字符串编解码使用的字符集 */
    public static final Charset CHARSET = StandardCharsets.UTF_8;

    /** 空字节序列 */
    public static final RedisBytes EMPTY = new RedisBytes(new byte[0], true);

    private final byte[] bytes;

    private final int hashCode;

    /** 延迟初始化的字符串值，可能是宽松解码的结果 */
    private volatile String stringValue;

    /** 字节已通过严格UTF-8校验 */
    private volatile boolean validUtf8;

    /**
     * 创建实例，对入参执行防御性拷贝。
     *
     * @param bytes 源字节数组，不能为null
     * @throws IllegalArgumentException 如果bytes为null
     */
    public RedisBytes(final byte[] bytes) {
        this(bytes, false);
    }

    private RedisBytes(final byte[] bytes, final boolean trusted) {
        if (bytes == null) {
            throw new IllegalArgumentException("字节数组不能为null");
        }
        this.bytes = trusted ? bytes : bytes.clone();
        this.hashCode = Arrays.hashCode(this.bytes);
    }

    /**
     * 零拷贝包装。
     *
     * <p><b>警告</b>：调用者必须保证数组在实例生命周期内不被修改。
     *
     * @param trustedBytes 受信任的字节数组
     * @return RedisBytes实例，输入为null时返回null
     */
    public static RedisBytes wrapTrusted(final byte[] trustedBytes) {
        if (trustedBytes == null) {
            return null;
        }
        return new RedisBytes(trustedBytes, true);
    }

    /**
     * 以UTF-8编码字符串创建实例。
     *
     * @param str 源字符串
     * @return RedisBytes实例，输入为null时返回null
     */
    public static RedisBytes fromString(final String str) {
        if (str == null) {
            return null;
        }
        if (str.isEmpty()) {
            return EMPTY;
        }
        final RedisBytes redisBytes = new RedisBytes(str.getBytes(CHARSET), true);
        redisBytes.stringValue = str;
        redisBytes.validUtf8 = true;
        return redisBytes;
    }

    /**
     * @return 底层字节数组的副本
     */
    public byte[] getBytes() {
        return bytes.clone();
    }

    /**
     * 获取底层数组的直接引用，调用者不得修改返回的数组。
     *
     * @return 底层字节数组
     */
    public byte[] getBytesUnsafe() {
        return bytes;
    }

    /**
     * 宽松解码，非法的UTF-8序列会被替换字符代替。
     *
     * @return 字符串值
     */
    public String getString() {
        String result = stringValue;
        if (result == null) {
            result = new String(bytes, CHARSET);
            stringValue = result;
        }
        return result;
    }

    /**
     * 严格解码，遇到非法UTF-8序列抛出异常。
     *
     * @return 字符串值
     * @throws CharacterCodingException 如果字节不是合法的UTF-8
     */
    public String toUtf8String() throws CharacterCodingException {
        // 宽松解码缓存的字符串不能代表校验结果
        if (validUtf8) {
            return stringValue;
        }
        final String decoded = CHARSET.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
        stringValue = decoded;
        validUtf8 = true;
        return decoded;
    }

    /**
     * ASCII范围内大小写不敏感的比较。
     *
     * @param other 另一个实例
     * @return 忽略大小写后是否相等
     */
    public boolean equalsIgnoreCase(final RedisBytes other) {
        if (this == other) {
            return true;
        }
        if (other == null || bytes.length != other.bytes.length) {
            return false;
        }
        for (int i = 0; i < bytes.length; i++) {
            if (toLower(bytes[i]) != toLower(other.bytes[i])) {
                return false;
            }
        }
        return true;
    }

    private static byte toLower(final byte b) {
        return b >= 'A' && b <= 'Z' ? (byte) (b + 32) : b;
    }

    public int length() {
        return bytes.length;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final RedisBytes other = (RedisBytes) obj;
        return hashCode == other.hashCode && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    /**
     * 按无符号字节的字典序比较，较短的前缀排在前面。
     */
    @Override
    public int compareTo(final RedisBytes other) {
        if (other == null) {
            return 1;
        }
        if (this == other) {
            return 0;
        }
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public String toString() {
        // 1. 只预览前16个字节，不可打印字符转义
        final StringBuilder sb = new StringBuilder();
        sb.append("RedisBytes[length=").append(bytes.length).append(", preview='");
        for (int i = 0; i < Math.min(bytes.length, 16); i++) {
            final byte b = bytes[i];
            if (b >= 32 && b <= 126) {
                sb.append((char) b);
            } else {
                sb.append("\\x").append(String.format("%02x", b & 0xFF));
            }
        }
        if (bytes.length > 16) {
            sb.append("...");
        }
        return sb.append("']").toString();
    }
}
