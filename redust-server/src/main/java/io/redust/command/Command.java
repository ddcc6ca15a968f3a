package io.redust.command;

import io.redust.command.impl.Unknown;
import io.redust.core.RedisCore;
import io.redust.protocol.Resp;
import io.redust.server.connection.Connection;

import java.util.Locale;

/**
 * 命令接口，定义了所有命令的基本行为。
 *
 * <p>命令由客户端发来的数组帧解析而来：第一个元素是命令名，其余元素是参数。
 * 执行时读取或修改共享存储，并把响应帧写回连接。
 *
 * @author redust
 * @since 1.0.0
 */
public interface Command {

    /**
     * @return 命令类型
     */
    CommandType getType();

    /**
     * @return 小写的命令名，未识别的命令返回客户端发来的原名
     */
    default String getName() {
        return getType().getName();
    }

    /**
     * 执行命令并把响应写回连接
     *
     * @param redisCore 共享存储
     * @param connection 当前连接
     */
    void apply(RedisCore redisCore, Connection connection);


    /**
     * 从客户端发来的帧解析命令
     *
     * <p>帧必须是数组，命令名不区分大小写。参数个数不足、参数类型不符，
     * 或者在预期参数之后还有多余元素，都属于协议错误。
     *
     * @param frame 客户端发来的帧
     * @return 解析出的命令
     * @throws io.redust.protocol.ProtocolException 当帧的结构不合法时
     */
    static Command fromFrame(final Resp frame) {
        final Parse parse = new Parse(frame);
        final String commandName = parse.nextString().toLowerCase(Locale.ROOT);

        final CommandType type = CommandType.findByName(commandName);
        if (type == CommandType.UNKNOWN) {
            return new Unknown(commandName);
        }

        final Command command = type.getParser().apply(parse);
        parse.finish();
        return command;
    }
}
