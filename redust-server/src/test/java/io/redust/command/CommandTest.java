package io.redust.command;

import io.redust.command.impl.Get;
import io.redust.command.impl.Publish;
import io.redust.command.impl.Set;
import io.redust.command.impl.Subscribe;
import io.redust.command.impl.Unknown;
import io.redust.command.impl.Unsubscribe;
import io.redust.datastructure.RedisBytes;
import io.redust.protocol.BulkString;
import io.redust.protocol.ProtocolException;
import io.redust.protocol.RespArray;
import io.redust.protocol.SimpleString;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("命令解析测试")
class CommandTest {

    private static RespArray frameOf(final String... parts) {
        final RespArray.Builder builder = RespArray.builder(parts.length);
        for (final String part : parts) {
            builder.addBulk(part);
        }
        return builder.build();
    }

    @Nested
    @DisplayName("解析已知命令")
    class KnownCommands {

        @Test
        @DisplayName("GET携带一个键")
        void testGet() {
            Command command = Command.fromFrame(frameOf("get", "hello"));

            assertEquals(new Get(RedisBytes.fromString("hello")), command);
            assertEquals(CommandType.GET, command.getType());
        }

        @Test
        @DisplayName("命令名不区分大小写")
        void testCaseInsensitiveName() {
            Command command = Command.fromFrame(frameOf("SeT", "k", "v"));

            assertTrue(command instanceof Set);
            Set set = (Set) command;
            assertEquals("k", set.getKey().getString());
            assertEquals("v", set.getValue().getString());
            assertNull(set.getExpire());
        }

        @Test
        @DisplayName("命令名可以是简单字符串")
        void testSimpleStringName() {
            RespArray frame = RespArray.builder()
                    .add(SimpleString.valueOf("PUBLISH"))
                    .addBulk("news")
                    .addBulk("hi")
                    .build();

            assertEquals(new Publish(RedisBytes.fromString("news"), RedisBytes.fromString("hi")),
                    Command.fromFrame(frame));
        }

        @Test
        @DisplayName("SUBSCRIBE接受多个频道并保持顺序")
        void testSubscribeChannels() {
            Subscribe subscribe = (Subscribe) Command.fromFrame(frameOf("subscribe", "b", "a", "c"));

            assertEquals(Arrays.asList("b", "a", "c"), subscribe.getChannels());
        }

        @Test
        @DisplayName("UNSUBSCRIBE可以不带频道")
        void testUnsubscribeWithoutChannels() {
            Unsubscribe unsubscribe = (Unsubscribe) Command.fromFrame(frameOf("unsubscribe"));

            assertTrue(unsubscribe.getChannels().isEmpty());
        }
    }

    @Nested
    @DisplayName("未知命令")
    class UnknownCommands {

        @Test
        @DisplayName("保留小写后的命令名")
        void testUnknownName() {
            Command command = Command.fromFrame(frameOf("PING", "extra", "args"));

            assertTrue(command instanceof Unknown);
            assertEquals("ping", command.getName());
            assertEquals("ERR unknown command 'ping'", ((Unknown) command).toError().getContent());
        }
    }

    @Nested
    @DisplayName("协议错误")
    class ProtocolErrors {

        @Test
        @DisplayName("顶层帧必须是数组")
        void testNonArrayFrame() {
            ProtocolException e = assertThrows(ProtocolException.class,
                    () -> Command.fromFrame(BulkString.fromString("get")));
            assertTrue(e.getMessage().startsWith("protocol error; expected array"));
        }

        @Test
        @DisplayName("多余的参数")
        void testTrailingData() {
            ProtocolException e = assertThrows(ProtocolException.class,
                    () -> Command.fromFrame(frameOf("get", "a", "b")));
            assertEquals("protocol error; expected end of frame; but there was more!", e.getMessage());
        }

        @Test
        @DisplayName("缺少参数")
        void testMissingArgument() {
            ProtocolException e = assertThrows(ProtocolException.class,
                    () -> Command.fromFrame(frameOf("set", "only-key")));
            assertEquals("protocol error; unexpected end of stream", e.getMessage());
        }

        @Test
        @DisplayName("SUBSCRIBE至少需要一个频道")
        void testSubscribeWithoutChannels() {
            assertThrows(ProtocolException.class, () -> Command.fromFrame(frameOf("subscribe")));
        }

        @Test
        @DisplayName("空数组没有命令名")
        void testEmptyArray() {
            assertThrows(ProtocolException.class, () -> Command.fromFrame(RespArray.EMPTY));
        }

        @Test
        @DisplayName("参数不能是嵌套数组")
        void testNestedArrayArgument() {
            RespArray frame = RespArray.builder()
                    .addBulk("get")
                    .add(frameOf("nested"))
                    .build();
            assertThrows(ProtocolException.class, () -> Command.fromFrame(frame));
        }
    }
}
