package io.redust.server.config;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * 服务器配置类，统一管理所有服务器配置参数。
 *
 * <p>采用Builder模式创建，每个参数都有默认值：
 * <ul>
 *   <li>网络配置：监听地址、端口、TCP参数
 *   <li>连接配置：最大连接数、接受连接失败时的退避时间
 *   <li>线程配置：boss/worker线程数
 *   <li>发布订阅配置：每个频道缓存的消息数
 * </ul>
 *
 * @author redust
 * @since 1.0.0
 */
@Data
@Builder
public class RedisServerConfig {

    /** 默认端口 */
    public static final int DEFAULT_PORT = 6379;

    // ========== 网络配置 ==========

    /**
     * 服务器监听地址，127.0.0.1仅本机访问，0.0.0.0允许所有网络访问。
     */
    @Builder.Default
    private String host = "127.0.0.1";

    /**
     * 服务器监听端口，0表示由系统分配。
     */
    @Builder.Default
    private int port = DEFAULT_PORT;

    /** TCP连接队列大小 */
    @Builder.Default
    private int backlogSize = 1024;

    /** 接收缓冲区大小（字节） */
    @Builder.Default
    private int receiveBufferSize = 32 * 1024;

    /** 发送缓冲区大小（字节） */
    @Builder.Default
    private int sendBufferSize = 32 * 1024;

    // ========== 连接配置 ==========

    /**
     * 同时服务的最大连接数。
     *
     * <p>达到上限后服务器暂停接受新连接，直到已有连接断开。
     */
    @Builder.Default
    private int maxConnections = 250;

    /** 接受连接失败后的首次退避时间，之后每次翻倍 */
    @Builder.Default
    private Duration acceptBackoffInitial = Duration.ofSeconds(1);

    /** 退避时间超过该值时放弃接受连接并关闭服务器 */
    @Builder.Default
    private Duration acceptBackoffMax = Duration.ofSeconds(64);

    /** 关闭时等待所有连接退出的最长时间 */
    @Builder.Default
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    // ========== 线程配置 ==========

    /** Boss线程组大小（接受连接），通常为1 */
    @Builder.Default
    private int bossThreadCount = 1;

    /** Worker线程组大小（处理I/O） */
    @Builder.Default
    private int workerThreadCount = Runtime.getRuntime().availableProcessors() * 2;

    // ========== 发布订阅配置 ==========

    /** 每个频道缓存的消息数，订阅者落后超过该数量时会丢失消息 */
    @Builder.Default
    private int channelCapacity = 1024;

    /**
     * 创建默认配置。
     *
     * @return 默认配置实例
     */
    public static RedisServerConfig defaultConfig() {
        return RedisServerConfig.builder().build();
    }

    /**
     * 验证配置参数的合法性
     *
     * @throws IllegalArgumentException 如果配置参数无效
     */
    public void validate() {
        if (host == null || host.trim().isEmpty()) {
            throw new IllegalArgumentException("监听地址不能为空");
        }

        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("端口号必须在0-65535范围内");
        }

        if (maxConnections <= 0) {
            throw new IllegalArgumentException("最大连接数必须大于0");
        }

        if (bossThreadCount <= 0 || workerThreadCount <= 0) {
            throw new IllegalArgumentException("线程数量必须大于0");
        }

        if (backlogSize <= 0 || receiveBufferSize <= 0 || sendBufferSize <= 0) {
            throw new IllegalArgumentException("缓冲区大小必须大于0");
        }

        if (channelCapacity <= 0) {
            throw new IllegalArgumentException("频道容量必须大于0");
        }

        if (acceptBackoffInitial == null || acceptBackoffMax == null || shutdownTimeout == null
                || acceptBackoffInitial.isNegative() || acceptBackoffInitial.isZero()
                || acceptBackoffMax.compareTo(acceptBackoffInitial) < 0 || shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("退避时间或关闭超时配置无效");
        }
    }
}
