package io.redust.command.impl;

import io.redust.command.Command;
import io.redust.command.CommandType;
import io.redust.core.RedisCore;
import io.redust.protocol.Errors;
import io.redust.server.connection.Connection;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 无法识别的命令，回复错误但不关闭连接
 *
 * @author redust
 * @since 1.0.0
 */
@Getter
@ToString
@EqualsAndHashCode
public class Unknown implements Command {
    private final String commandName;

    public Unknown(final String commandName) {
        this.commandName = commandName;
    }

    @Override
    public CommandType getType() {
        return CommandType.UNKNOWN;
    }

    @Override
    public String getName() {
        return commandName;
    }

    @Override
    public void apply(final RedisCore redisCore, final Connection connection) {
        connection.writeFrame(toError());
    }

    /**
     * 命令名来自客户端，其中的换行符替换为空格
     */
    public Errors toError() {
        return new Errors("ERR unknown command '" + Errors.singleLine(commandName) + "'");
    }
}
