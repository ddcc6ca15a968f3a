package io.redust.core.pubsub;

import lombok.Getter;

/**
 * 一次非阻塞接收的结果：收到消息、暂无消息，或者因为落后太多而丢失了部分消息。
 *
 * @param <T> 消息类型
 * @author redust
 * @since 1.0.0
 */
@Getter
public final class RecvResult<T> {

    public enum Kind {
        /** 收到一条消息 */
        MESSAGE,
        /** 暂时没有新消息 */
        EMPTY,
        /** 接收方落后超过容量，跳过了 {@code missed} 条消息 */
        LAGGED
    }

    private static final RecvResult<?> EMPTY = new RecvResult<>(Kind.EMPTY, null, 0);

    private final Kind kind;

    private final T message;

    private final long missed;

    private RecvResult(final Kind kind, final T message, final long missed) {
        this.kind = kind;
        this.message = message;
        this.missed = missed;
    }

    static <T> RecvResult<T> message(final T message) {
        return new RecvResult<>(Kind.MESSAGE, message, 0);
    }

    static <T> RecvResult<T> lagged(final long missed) {
        return new RecvResult<>(Kind.LAGGED, null, missed);
    }

    @SuppressWarnings("unchecked")
    static <T> RecvResult<T> empty() {
        return (RecvResult<T>) EMPTY;
    }

    public boolean isMessage() {
        return kind == Kind.MESSAGE;
    }

    public boolean isLagged() {
        return kind == Kind.LAGGED;
    }

    public boolean isEmpty() {
        return kind == Kind.EMPTY;
    }
}
