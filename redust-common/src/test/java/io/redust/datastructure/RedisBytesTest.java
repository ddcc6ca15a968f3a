package io.redust.datastructure;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.CharacterCodingException;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RedisBytes 单元测试
 *
 * @author redust
 */
@DisplayName("RedisBytes 单元测试")
class RedisBytesTest {

    @Nested
    @DisplayName("构造与工厂方法")
    class ConstructorTests {

        @Test
        @DisplayName("构造函数执行防御性拷贝")
        void testConstructorCopiesInput() {
            final byte[] source = "hello".getBytes(RedisBytes.CHARSET);
            final RedisBytes rb = new RedisBytes(source);

            // 修改源数组不影响实例
            source[0] = 'j';

            assertEquals("hello", rb.getString());
        }

        @Test
        @DisplayName("null 输入抛出异常")
        void testConstructorWithNull() {
            assertThrows(IllegalArgumentException.class, () -> new RedisBytes(null));
        }

        @Test
        @DisplayName("wrapTrusted 共享底层数组")
        void testWrapTrusted() {
            final byte[] source = {1, 2, 3};
            final RedisBytes rb = RedisBytes.wrapTrusted(source);

            assertSame(source, rb.getBytesUnsafe());
            assertNull(RedisBytes.wrapTrusted(null));
        }

        @Test
        @DisplayName("fromString 空字符串返回 EMPTY")
        void testFromStringEmpty() {
            assertSame(RedisBytes.EMPTY, RedisBytes.fromString(""));
            assertNull(RedisBytes.fromString(null));
        }
    }

    @Nested
    @DisplayName("字符串解码")
    class DecodeTests {

        @Test
        @DisplayName("严格解码拒绝非法 UTF-8")
        void testStrictDecodeRejectsInvalidUtf8() {
            final RedisBytes rb = new RedisBytes(new byte[]{(byte) 0xff, (byte) 0xfe});

            assertThrows(CharacterCodingException.class, rb::toUtf8String);
        }

        @Test
        @DisplayName("宽松解码之后严格解码仍然拒绝非法 UTF-8")
        void testLenientViewDoesNotBypassStrictDecode() {
            final RedisBytes rb = RedisBytes.wrapTrusted(new byte[]{'g', (byte) 0xff});

            assertEquals("g\uFFFD", rb.getString());
            assertThrows(CharacterCodingException.class, rb::toUtf8String);
            // 失败的严格解码不影响宽松视图
            assertEquals("g\uFFFD", rb.getString());
        }

        @Test
        @DisplayName("严格解码的结果被缓存")
        void testStrictDecodeIsCached() throws Exception {
            final RedisBytes rb = RedisBytes.wrapTrusted("news".getBytes(RedisBytes.CHARSET));

            assertEquals("news", rb.getString());
            final String first = rb.toUtf8String();
            assertSame(first, rb.toUtf8String());
        }

        @Test
        @DisplayName("严格解码接受多字节字符")
        void testStrictDecodeAcceptsMultibyte() throws Exception {
            final RedisBytes rb = new RedisBytes("频道".getBytes(RedisBytes.CHARSET));

            assertEquals("频道", rb.toUtf8String());
        }
    }

    @Nested
    @DisplayName("比较与哈希")
    class CompareTests {

        @Test
        @DisplayName("内容相同的实例可以作为同一个 Map 键")
        void testEqualsAndHashCode() {
            final Map<RedisBytes, String> map = new HashMap<>();
            map.put(RedisBytes.fromString("key"), "v1");

            assertEquals("v1", map.get(new RedisBytes("key".getBytes(RedisBytes.CHARSET))));
        }

        @Test
        @DisplayName("大小写不敏感比较")
        void testEqualsIgnoreCase() {
            assertTrue(RedisBytes.fromString("SUBSCRIBE").equalsIgnoreCase(RedisBytes.fromString("subscribe")));
            assertFalse(RedisBytes.fromString("get").equalsIgnoreCase(RedisBytes.fromString("set")));
            assertFalse(RedisBytes.fromString("get").equalsIgnoreCase(null));
        }

        @Test
        @DisplayName("按无符号字节字典序比较")
        void testCompareTo() {
            final RedisBytes low = new RedisBytes(new byte[]{0x01});
            final RedisBytes high = new RedisBytes(new byte[]{(byte) 0x80});

            assertTrue(low.compareTo(high) < 0);
            assertTrue(RedisBytes.fromString("ab").compareTo(RedisBytes.fromString("abc")) < 0);
            assertEquals(0, RedisBytes.fromString("abc").compareTo(RedisBytes.fromString("abc")));
        }
    }

    @Test
    @DisplayName("toString 转义不可打印字符")
    void testToStringEscapes() {
        final RedisBytes rb = new RedisBytes(new byte[]{'a', 0x00});

        assertTrue(rb.toString().contains("a\\x00"));
    }
}
