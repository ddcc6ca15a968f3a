package io.redust.server;

/**
 * 服务器生命周期接口
 *
 * @author redust
 * @since 1.0.0
 */
public interface RedisServer {
    /**
     * 绑定端口并开始接受连接，立即返回
     */
    void start();

    /**
     * 停止接受连接，等待所有连接处理结束后释放资源
     */
    void stop();
}
