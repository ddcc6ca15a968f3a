package io.redust;

import io.redust.server.RedustServer;
import io.redust.server.config.RedisServerConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 服务器启动入口
 *
 * <p>支持的参数：
 * <ul>
 *   <li>--port 端口 - 默认6379</li>
 *   <li>--host 地址 - 默认127.0.0.1</li>
 * </ul>
 *
 * @author redust
 * @since 1.0.0
 */
@Slf4j
public class RedustServerLauncher {

    public static void main(String[] args) throws Exception {
        final RedisServerConfig config = parseArgs(args);
        final RedustServer server = new RedustServer(config);

        final CompletableFuture<Void> shutdownSignal = new CompletableFuture<>();
        final CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("收到中断信号, 正在关闭服务器...");
            shutdownSignal.complete(null);
            try {
                // 等待run返回，所有连接都已结束
                stopped.await(config.getShutdownTimeout().toMillis() + 5000, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "redust-shutdown-hook"));

        try {
            server.run(shutdownSignal);
        } finally {
            stopped.countDown();
        }
    }

    static RedisServerConfig parseArgs(final String[] args) {
        final RedisServerConfig config = RedisServerConfig.defaultConfig();
        for (int i = 0; i < args.length; i++) {
            final String arg = args[i];
            switch (arg) {
                case "--port":
                    config.setPort(parsePort(requireValue(args, ++i, arg)));
                    break;
                case "--host":
                    config.setHost(requireValue(args, ++i, arg));
                    break;
                default:
                    throw new IllegalArgumentException("未知参数: " + arg);
            }
        }
        config.validate();
        return config;
    }

    private static String requireValue(final String[] args, final int index, final String name) {
        if (index >= args.length) {
            throw new IllegalArgumentException("参数 " + name + " 缺少取值");
        }
        return args[index];
    }

    private static int parsePort(final String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("端口号不是数字: " + value, e);
        }
    }
}
