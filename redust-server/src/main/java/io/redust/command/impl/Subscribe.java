package io.redust.command.impl;

import io.redust.command.Command;
import io.redust.command.CommandType;
import io.redust.command.Parse;
import io.redust.core.RedisCore;
import io.redust.protocol.ProtocolException;
import io.redust.server.connection.Connection;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * SUBSCRIBE channel [channel ...]
 *
 * <p>执行后连接进入订阅模式，之后的帧都交给该连接的订阅会话处理，
 * 直到连接关闭。
 *
 * @author redust
 * @since 1.0.0
 */
@Getter
@ToString
@EqualsAndHashCode
public class Subscribe implements Command {
    private final List<String> channels;

    public Subscribe(final List<String> channels) {
        this.channels = Collections.unmodifiableList(new ArrayList<>(channels));
    }

    /**
     * 至少需要一个频道名
     */
    public static Subscribe parseFrames(final Parse parse) {
        if (!parse.hasRemaining()) {
            throw new ProtocolException("protocol error; unexpected end of stream");
        }
        final List<String> channels = new ArrayList<>();
        while (parse.hasRemaining()) {
            channels.add(parse.nextString());
        }
        return new Subscribe(channels);
    }

    @Override
    public CommandType getType() {
        return CommandType.SUBSCRIBE;
    }

    @Override
    public void apply(final RedisCore redisCore, final Connection connection) {
        connection.subscriptionSession(redisCore).enter(channels);
    }
}
