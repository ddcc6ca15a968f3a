package io.redust.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.embedded.EmbeddedChannel;
import io.redust.protocol.BulkString;
import io.redust.protocol.RespArray;
import io.redust.protocol.RespNull;
import io.redust.protocol.SimpleString;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class RespEncoderTest {

    private static String readOutbound(final EmbeddedChannel channel) {
        ByteBuf buf = channel.readOutbound();
        try {
            return buf.toString(StandardCharsets.US_ASCII);
        } finally {
            buf.release();
        }
    }

    @Test
    public void testEncodeResponses() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespEncoder());

        assertTrue(channel.writeOutbound(SimpleString.OK));
        assertEquals("+OK\r\n", readOutbound(channel));

        assertTrue(channel.writeOutbound(RespNull.INSTANCE));
        assertEquals("$-1\r\n", readOutbound(channel));

        assertTrue(channel.writeOutbound(BulkString.fromString("world")));
        assertEquals("$5\r\nworld\r\n", readOutbound(channel));

        channel.finish();
    }

    @Test
    public void testEncodeMessagePush() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespEncoder());

        RespArray message = RespArray.builder()
                .add(BulkString.MESSAGE)
                .addBulk("news")
                .addBulk("hi")
                .build();
        assertTrue(channel.writeOutbound(message));

        assertEquals("*3\r\n$7\r\nmessage\r\n$4\r\nnews\r\n$2\r\nhi\r\n", readOutbound(channel));
        channel.finish();
    }
}
