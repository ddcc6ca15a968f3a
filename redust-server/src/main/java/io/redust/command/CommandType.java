package io.redust.command;

import io.redust.command.impl.Get;
import io.redust.command.impl.Publish;
import io.redust.command.impl.Set;
import io.redust.command.impl.Subscribe;
import io.redust.command.impl.Unsubscribe;
import lombok.Getter;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * 支持的命令类型
 *
 * <p>每个类型持有自己的参数解析函数。命令名匹配不区分大小写，
 * 无法识别的命令统一归为 {@link #UNKNOWN}。
 *
 * @author redust
 * @since 1.0.0
 */
@Getter
public enum CommandType {
    /** GET key */
    GET("get", Get::parseFrames),
    /** SET key value */
    SET("set", Set::parseFrames),
    /** PUBLISH channel message */
    PUBLISH("publish", Publish::parseFrames),
    /** SUBSCRIBE channel [channel ...] */
    SUBSCRIBE("subscribe", Subscribe::parseFrames),
    /** UNSUBSCRIBE [channel ...] */
    UNSUBSCRIBE("unsubscribe", Unsubscribe::parseFrames),
    /** 未识别的命令 */
    UNKNOWN("unknown", null);

    private static final Map<String, CommandType> BY_NAME = new HashMap<>();

    static {
        for (final CommandType type : values()) {
            if (type.parser != null) {
                BY_NAME.put(type.name, type);
            }
        }
    }

    private final String name;

    private final Function<Parse, Command> parser;

    CommandType(final String name, final Function<Parse, Command> parser) {
        this.name = name;
        this.parser = parser;
    }

    /**
     * 按名称查找命令类型，不区分大小写
     *
     * @param name 命令名
     * @return 命令类型，未识别时返回 {@link #UNKNOWN}
     */
    public static CommandType findByName(final String name) {
        return BY_NAME.getOrDefault(name.toLowerCase(Locale.ROOT), UNKNOWN);
    }
}
