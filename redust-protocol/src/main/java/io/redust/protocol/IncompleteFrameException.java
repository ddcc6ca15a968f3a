package io.redust.protocol;

/**
 * 缓冲区中的数据还不足以构成一个完整的帧。
 *
 * <p>这是正常的流程信号而不是错误：解码器捕获后等待更多字节到达。
 * 因为出现得非常频繁，使用不填充堆栈的单例。
 *
 * @author redust
 * @since 1.0.0
 */
public final class IncompleteFrameException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /** 共享实例 */
    public static final IncompleteFrameException INSTANCE = new IncompleteFrameException();

    private IncompleteFrameException() {
        super("stream ended early");
    }

    @Override
    public synchronized Throwable fillInStackTrace() {
        return this;
    }
}
