package io.redust.command.impl;

import io.redust.command.Command;
import io.redust.command.CommandType;
import io.redust.command.Parse;
import io.redust.core.RedisCore;
import io.redust.server.connection.Connection;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * UNSUBSCRIBE [channel ...]
 *
 * <p>只在订阅模式中有意义，由订阅会话直接处理。不带频道名时退订全部频道。
 *
 * @author redust
 * @since 1.0.0
 */
@Getter
@ToString
@EqualsAndHashCode
public class Unsubscribe implements Command {
    private final List<String> channels;

    public Unsubscribe(final List<String> channels) {
        this.channels = Collections.unmodifiableList(new ArrayList<>(channels));
    }

    public static Unsubscribe parseFrames(final Parse parse) {
        final List<String> channels = new ArrayList<>();
        while (parse.hasRemaining()) {
            channels.add(parse.nextString());
        }
        return new Unsubscribe(channels);
    }

    @Override
    public CommandType getType() {
        return CommandType.UNSUBSCRIBE;
    }

    /**
     * 订阅模式之外收到UNSUBSCRIBE属于调用错误
     */
    @Override
    public void apply(final RedisCore redisCore, final Connection connection) {
        throw new IllegalStateException("`Unsubscribe` is unsupported in this context");
    }
}
