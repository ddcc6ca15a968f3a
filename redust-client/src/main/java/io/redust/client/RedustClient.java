package io.redust.client;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.redust.datastructure.RedisBytes;
import io.redust.protocol.BulkString;
import io.redust.protocol.Errors;
import io.redust.protocol.Resp;
import io.redust.protocol.RespArray;
import io.redust.protocol.RespInteger;
import io.redust.protocol.RespNull;
import io.redust.protocol.SimpleString;
import io.redust.protocol.handler.RespDecoder;
import io.redust.protocol.handler.RespEncoder;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 同步客户端，一个实例对应一条连接。
 *
 * <p>每次调用发送一个命令并阻塞等待响应，实例不是线程安全的。
 * 调用 {@link #subscribe(String...)} 之后连接交给返回的 {@link Subscriber}，
 * 客户端本身不能再发送普通命令。
 *
 * @author redust
 * @since 1.0.0
 */
@Slf4j
public class RedustClient implements AutoCloseable {

    /** 默认的响应等待时间 */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final Channel channel;

    private final ClientHandler handler;

    /** 由connect创建时持有，关闭时释放 */
    private final EventLoopGroup group;

    private Duration timeout = DEFAULT_TIMEOUT;

    private boolean subscribed;

    RedustClient(final Channel channel, final ClientHandler handler, final EventLoopGroup group) {
        this.channel = channel;
        this.handler = handler;
        this.group = group;
    }

    /**
     * 连接到服务端
     *
     * @param host 服务端地址
     * @param port 服务端端口
     * @return 已连接的客户端
     * @throws RedustClientException 连接失败
     */
    public static RedustClient connect(final String host, final int port) {
        final EventLoopGroup group = new NioEventLoopGroup(1, new DefaultThreadFactory("redust-client"));
        final ClientHandler handler = new ClientHandler();
        final CompletableFuture<Channel> future = new CompletableFuture<>();

        final Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        final ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast(new RespDecoder());
                        pipeline.addLast(new RespEncoder());
                        pipeline.addLast(handler);
                    }
                });

        bootstrap.connect(host, port).addListener((ChannelFutureListener) connectFuture -> {
            if (connectFuture.isSuccess()) {
                future.complete(connectFuture.channel());
            } else {
                future.completeExceptionally(connectFuture.cause());
            }
        });

        try {
            final Channel channel = future.get(DEFAULT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("已连接到 {}:{}", host, port);
            return new RedustClient(channel, handler, group);
        } catch (InterruptedException e) {
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            Thread.currentThread().interrupt();
            throw new RedustClientException("连接被中断", e);
        } catch (ExecutionException | TimeoutException e) {
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            final Throwable cause = e instanceof ExecutionException ? e.getCause() : e;
            throw new RedustClientException("无法连接到 " + host + ":" + port, cause);
        }
    }

    /**
     * 设置响应等待时间
     */
    public RedustClient withTimeout(final Duration timeout) {
        this.timeout = timeout;
        return this;
    }

    /**
     * @return 键对应的值，键不存在时为空
     */
    public Optional<byte[]> get(final String key) {
        final Resp response = request(RespArray.builder(2).addBulk("get").addBulk(key).build());
        if (response instanceof BulkString) {
            return Optional.of(((BulkString) response).getContent().getBytes());
        }
        if (response instanceof RespNull) {
            return Optional.empty();
        }
        throw unexpected(response);
    }

    public void set(final String key, final String value) {
        set(key, value.getBytes(RedisBytes.CHARSET));
    }

    public void set(final String key, final byte[] value) {
        final Resp response = request(RespArray.builder(3)
                .addBulk("set")
                .addBulk(key)
                .add(BulkString.create(value))
                .build());
        if (!SimpleString.OK.equals(response)) {
            throw unexpected(response);
        }
    }

    /**
     * @return 收到消息的订阅者数量
     */
    public long publish(final String channelName, final String message) {
        return publish(channelName, message.getBytes(RedisBytes.CHARSET));
    }

    public long publish(final String channelName, final byte[] message) {
        final Resp response = request(RespArray.builder(3)
                .addBulk("publish")
                .addBulk(channelName)
                .add(BulkString.create(message))
                .build());
        if (response instanceof RespInteger) {
            return ((RespInteger) response).getContent();
        }
        throw unexpected(response);
    }

    /**
     * 订阅频道，之后只能通过返回的订阅者使用这条连接
     *
     * @param channels 至少一个频道名
     * @return 订阅者
     */
    public Subscriber subscribe(final String... channels) {
        if (channels.length == 0) {
            throw new IllegalArgumentException("至少需要一个频道");
        }
        ensureNotSubscribed();
        subscribed = true;
        final Subscriber subscriber = new Subscriber(this);
        subscriber.subscribe(channels);
        return subscriber;
    }

    /**
     * 发送请求并等待一个响应帧
     */
    private Resp request(final RespArray frame) {
        ensureNotSubscribed();
        send(frame);
        final Resp response = read(timeout);
        if (response == null) {
            throw new RedustClientException("等待响应超时: " + timeout.toMillis() + "ms");
        }
        if (response instanceof Errors) {
            throw new RedustClientException(((Errors) response).getContent());
        }
        return response;
    }

    void send(final RespArray frame) {
        try {
            channel.writeAndFlush(frame).sync();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RedustClientException("发送命令时被中断", e);
        } catch (Exception e) {
            throw new RedustClientException("发送命令失败: " + e.getMessage(), e);
        }
    }

    /**
     * @return 下一个响应帧，超时返回null
     */
    Resp read(final Duration waitFor) {
        return handler.poll(waitFor.toNanos(), TimeUnit.NANOSECONDS);
    }

    Duration getTimeout() {
        return timeout;
    }

    private void ensureNotSubscribed() {
        if (subscribed) {
            throw new IllegalStateException("连接已进入订阅模式");
        }
    }

    static RedustClientException unexpected(final Resp response) {
        if (response instanceof Errors) {
            return new RedustClientException(((Errors) response).getContent());
        }
        return new RedustClientException("unexpected frame: " + response);
    }

    public boolean isActive() {
        return channel.isActive();
    }

    @Override
    public void close() {
        channel.close().awaitUninterruptibly();
        if (group != null) {
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly();
        }
    }

    @Override
    public String toString() {
        return "RedustClient" + Arrays.asList(channel.localAddress(), channel.remoteAddress());
    }
}
