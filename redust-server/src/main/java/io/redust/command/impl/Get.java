package io.redust.command.impl;

import io.redust.command.Command;
import io.redust.command.CommandType;
import io.redust.command.Parse;
import io.redust.core.RedisCore;
import io.redust.datastructure.RedisBytes;
import io.redust.protocol.BulkString;
import io.redust.protocol.RespNull;
import io.redust.server.connection.Connection;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * GET key
 *
 * <p>键存在时返回批量字符串，否则返回空值。
 *
 * @author redust
 * @since 1.0.0
 */
@Getter
@ToString
@EqualsAndHashCode
public class Get implements Command {
    private final RedisBytes key;

    public Get(final RedisBytes key) {
        this.key = key;
    }

    public static Get parseFrames(final Parse parse) {
        return new Get(parse.nextBytes());
    }

    @Override
    public CommandType getType() {
        return CommandType.GET;
    }

    @Override
    public void apply(final RedisCore redisCore, final Connection connection) {
        final RedisBytes value = redisCore.get(key);
        connection.writeFrame(value == null ? RespNull.INSTANCE : new BulkString(value));
    }
}
