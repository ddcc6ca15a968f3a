package io.redust.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.AdaptiveRecvByteBufAllocator;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.ServerChannel;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerSocketChannel;
import io.netty.channel.kqueue.KQueue;
import io.netty.channel.kqueue.KQueueEventLoopGroup;
import io.netty.channel.kqueue.KQueueServerSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.redust.core.RedisCore;
import io.redust.core.RedisCoreImpl;
import io.redust.protocol.handler.RespDecoder;
import io.redust.protocol.handler.RespEncoder;
import io.redust.server.config.RedisServerConfig;
import io.redust.server.handler.AcceptHandler;
import io.redust.server.handler.RespCommandHandler;
import io.redust.server.shutdown.ActiveConnectionTracker;
import io.redust.server.shutdown.ShutdownNotifier;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 基于Netty的服务器实现。
 *
 * <p>组成部分：
 * <ul>
 *   <li>boss线程组接受连接，服务端通道上的 {@link AcceptHandler} 负责准入限制和失败退避
 *   <li>worker线程组处理连接I/O，每个连接的管道为 解码器 - 编码器 - 命令处理器
 *   <li>所有连接共享同一个 {@link RedisCore}
 * </ul>
 *
 * <p>关闭流程：关闭监听端口，广播停机信号，等待活跃连接计数归零，
 * 然后释放线程组并关闭存储。
 *
 * @author redust
 * @since 1.0.0
 */
@Slf4j
@Getter
public class RedustServer implements RedisServer {

    /** 服务器配置 */
    private final RedisServerConfig config;

    /** 共享存储 */
    private final RedisCore redisCore;

    /** 停机广播器 */
    private final ShutdownNotifier shutdownNotifier = new ShutdownNotifier();

    /** 活跃连接计数 */
    private final ActiveConnectionTracker connectionTracker = new ActiveConnectionTracker();

    /** 服务端通道上的接入控制 */
    private final AcceptHandler acceptHandler;

    /** 服务器Channel类型，根据操作系统自动选择 */
    private Class<? extends ServerChannel> serverChannelClass;

    private EventLoopGroup bossGroup;

    private EventLoopGroup workerGroup;

    private volatile Channel serverChannel;

    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public RedustServer(final RedisServerConfig config) {
        this(config, new RedisCoreImpl(config.getChannelCapacity()));
    }

    public RedustServer(final RedisServerConfig config, final RedisCore redisCore) {
        config.validate();
        this.config = config;
        this.redisCore = redisCore;
        this.acceptHandler = new AcceptHandler(config, connectionTracker);
        initializeEventLoopGroups();
    }

    /**
     * 启动服务器并阻塞，直到停机信号完成或接受连接出现致命错误，
     * 返回前所有连接都已经结束。
     *
     * @param shutdownSignal 外部停机信号，例如进程中断
     * @throws IOException 接受连接持续失败导致服务器退出
     */
    public void run(final CompletableFuture<?> shutdownSignal) throws IOException {
        start();

        final CompletableFuture<Void> acceptLoopClosed = new CompletableFuture<>();
        serverChannel.closeFuture().addListener(future -> acceptLoopClosed.complete(null));

        try {
            CompletableFuture.anyOf(shutdownSignal, acceptLoopClosed).get();
        } catch (InterruptedException e) {
            log.warn("等待停机信号时被中断");
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.warn("停机信号异常完成", e.getCause());
        } finally {
            stop();
        }

        final Throwable fatal = acceptHandler.getFatalError();
        if (fatal != null) {
            throw new IOException("接受连接失败", fatal);
        }
    }

    @Override
    public void start() {
        final ServerBootstrap serverBootstrap = new ServerBootstrap();
        serverBootstrap.group(bossGroup, workerGroup)
                .channel(serverChannelClass)
                .option(ChannelOption.SO_BACKLOG, config.getBacklogSize())
                .handler(acceptHandler)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_RCVBUF, config.getReceiveBufferSize())
                .childOption(ChannelOption.SO_SNDBUF, config.getSendBufferSize())
                .childOption(ChannelOption.RCVBUF_ALLOCATOR, new AdaptiveRecvByteBufAllocator(64, 4096, 65536))
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        final ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast(new RespDecoder());
                        pipeline.addLast(new RespEncoder());
                        pipeline.addLast(new RespCommandHandler(redisCore, shutdownNotifier));
                    }
                });
        try {
            serverChannel = serverBootstrap.bind(config.getHost(), config.getPort()).sync().channel();
            log.info("Redust server started at {}:{}", config.getHost(), getPort());
        } catch (InterruptedException e) {
            log.error("Redust server start interrupted", e);
            stop();
            Thread.currentThread().interrupt();
            throw new IllegalStateException("服务器启动被中断", e);
        } catch (Exception e) {
            log.error("Redust server start error", e);
            stop();
            throw new IllegalStateException("服务器启动失败: " + e.getMessage(), e);
        }
    }

    /**
     * 优雅停止服务器，可重复调用。
     *
     * <p>按以下顺序关闭：
     * <ul>
     *   <li>关闭服务端Channel，不再接受新连接
     *   <li>广播停机信号，每个连接完成当前命令后关闭
     *   <li>等待活跃连接计数归零
     *   <li>关闭worker和boss线程组
     *   <li>关闭存储
     * </ul>
     */
    @Override
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("正在关闭服务器...");
        try {
            if (serverChannel != null) {
                serverChannel.close().sync();
            }
            shutdownNotifier.notifyShutdown();
            if (!connectionTracker.awaitDrained(config.getShutdownTimeout())) {
                log.warn("仍有 {} 个连接未结束, 强制关闭", connectionTracker.getActiveCount());
            }
            if (workerGroup != null) {
                workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).sync();
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).sync();
            }
        } catch (InterruptedException e) {
            log.error("Redust server stop interrupted", e);
            Thread.currentThread().interrupt();
        } finally {
            redisCore.shutdown();
        }
        log.info("服务器已关闭");
    }

    /**
     * @return 实际监听的端口，配置端口为0时由系统分配
     */
    public int getPort() {
        if (serverChannel == null) {
            return config.getPort();
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public int getActiveConnections() {
        return connectionTracker.getActiveCount();
    }

    private void initializeEventLoopGroups() {
        final String osName = System.getProperty("os.name").toLowerCase();

        if (Epoll.isAvailable()) {
            log.info("使用Epoll EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new EpollEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("epoll-boss"));
            this.workerGroup = new EpollEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("epoll-worker"));
            this.serverChannelClass = EpollServerSocketChannel.class;
        } else if (KQueue.isAvailable()) {
            log.info("使用KQueue EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new KQueueEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("kqueue-boss"));
            this.workerGroup = new KQueueEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("kqueue-worker"));
            this.serverChannelClass = KQueueServerSocketChannel.class;
        } else {
            log.info("使用NIO EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new NioEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("nio-boss"));
            this.workerGroup = new NioEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("nio-worker"));
            this.serverChannelClass = NioServerSocketChannel.class;
        }
    }
}
