package io.redust.client;

/**
 * 客户端异常
 *
 * <p>服务端回复错误帧、响应不符合预期、连接失败或连接已关闭时抛出。
 *
 * @author redust
 * @since 1.0.0
 */
public class RedustClientException extends RuntimeException {

    public RedustClientException(final String message) {
        super(message);
    }

    public RedustClientException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
