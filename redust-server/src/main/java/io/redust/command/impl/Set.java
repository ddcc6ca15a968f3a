package io.redust.command.impl;

import io.redust.command.Command;
import io.redust.command.CommandType;
import io.redust.command.Parse;
import io.redust.core.RedisCore;
import io.redust.datastructure.RedisBytes;
import io.redust.protocol.SimpleString;
import io.redust.server.connection.Connection;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * SET key value
 *
 * <p>网络上只接受键和值两个参数，过期时长只能由进程内的调用方指定。
 *
 * @author redust
 * @since 1.0.0
 */
@Getter
@ToString
@EqualsAndHashCode
public class Set implements Command {
    private final RedisBytes key;
    private final RedisBytes value;
    /** 存活时长，null表示永不过期 */
    private final Duration expire;

    public Set(final RedisBytes key, final RedisBytes value) {
        this(key, value, null);
    }

    public Set(final RedisBytes key, final RedisBytes value, final Duration expire) {
        this.key = key;
        this.value = value;
        this.expire = expire;
    }

    public static Set parseFrames(final Parse parse) {
        final RedisBytes key = parse.nextBytes();
        final RedisBytes value = parse.nextBytes();
        return new Set(key, value);
    }

    @Override
    public CommandType getType() {
        return CommandType.SET;
    }

    @Override
    public void apply(final RedisCore redisCore, final Connection connection) {
        redisCore.set(key, value, expire);
        connection.writeFrame(SimpleString.OK);
    }
}
