package io.redust.protocol;

/**
 * 协议格式错误。
 *
 * <p>帧编码非法或命令结构不符合约定时抛出，服务端据此回复错误帧并关闭连接。
 *
 * @author redust
 * @since 1.0.0
 */
public class ProtocolException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public ProtocolException(final String message) {
        super(message);
    }

    public ProtocolException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
