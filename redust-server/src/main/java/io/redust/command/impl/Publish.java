package io.redust.command.impl;

import io.redust.command.Command;
import io.redust.command.CommandType;
import io.redust.command.Parse;
import io.redust.core.RedisCore;
import io.redust.datastructure.RedisBytes;
import io.redust.protocol.RespInteger;
import io.redust.server.connection.Connection;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * PUBLISH channel message
 *
 * <p>返回发布时订阅该频道的接收方数量。没有订阅者时消息被丢弃，返回0。
 *
 * @author redust
 * @since 1.0.0
 */
@Getter
@ToString
@EqualsAndHashCode
public class Publish implements Command {
    private final RedisBytes channel;
    private final RedisBytes message;

    public Publish(final RedisBytes channel, final RedisBytes message) {
        this.channel = channel;
        this.message = message;
    }

    public static Publish parseFrames(final Parse parse) {
        final RedisBytes channel = parse.nextBytes();
        final RedisBytes message = parse.nextBytes();
        return new Publish(channel, message);
    }

    @Override
    public CommandType getType() {
        return CommandType.PUBLISH;
    }

    @Override
    public void apply(final RedisCore redisCore, final Connection connection) {
        final long receivers = redisCore.publish(channel, message);
        connection.writeFrame(RespInteger.valueOf(receivers));
    }
}
