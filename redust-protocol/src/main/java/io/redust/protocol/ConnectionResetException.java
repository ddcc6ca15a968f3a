package io.redust.protocol;

import java.io.IOException;

/**
 * 对端在一个帧传输到一半时关闭了连接。
 *
 * @author redust
 * @since 1.0.0
 */
public class ConnectionResetException extends IOException {

    private static final long serialVersionUID = 1L;

    public ConnectionResetException() {
        super("connection reset by peer");
    }
}
