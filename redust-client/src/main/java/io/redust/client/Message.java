package io.redust.client;

import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * 订阅频道上收到的一条消息
 *
 * @author redust
 * @since 1.0.0
 */
@Getter
public final class Message {
    private final String channel;
    private final byte[] content;

    Message(final String channel, final byte[] content) {
        this.channel = channel;
        this.content = content;
    }

    public String getContentAsString() {
        return new String(content, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return channel + ": " + getContentAsString();
    }
}
