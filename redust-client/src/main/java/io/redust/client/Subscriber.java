package io.redust.client;

import io.redust.protocol.BulkString;
import io.redust.protocol.Resp;
import io.redust.protocol.RespArray;
import io.redust.protocol.RespInteger;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 处于订阅模式的连接
 *
 * <p>等待订阅确认期间收到的消息先缓存起来，由 {@link #nextMessage(Duration)} 按到达顺序返回。
 *
 * @author redust
 * @since 1.0.0
 */
public class Subscriber implements AutoCloseable {

    private final RedustClient client;

    private final Set<String> subscribedChannels = new LinkedHashSet<>();

    private final Deque<Message> bufferedMessages = new ArrayDeque<>();

    Subscriber(final RedustClient client) {
        this.client = client;
    }

    public List<String> getSubscribedChannels() {
        return new ArrayList<>(subscribedChannels);
    }

    /**
     * 等待下一条消息
     *
     * @param timeout 最长等待时间
     * @return 收到的消息，超时为空
     * @throws RedustClientException 连接已关闭或收到不符合预期的帧
     */
    public Optional<Message> nextMessage(final Duration timeout) {
        if (!bufferedMessages.isEmpty()) {
            return Optional.of(bufferedMessages.pollFirst());
        }
        final Resp frame = client.read(timeout);
        if (frame == null) {
            return Optional.empty();
        }
        final Message message = toMessage(frame);
        if (message == null) {
            throw RedustClient.unexpected(frame);
        }
        return Optional.of(message);
    }

    /**
     * 追加订阅频道，等待每个频道的确认
     */
    public void subscribe(final String... channels) {
        if (channels.length == 0) {
            throw new IllegalArgumentException("至少需要一个频道");
        }
        client.send(frameOf("subscribe", Arrays.asList(channels)));
        for (final String channel : channels) {
            expectConfirmation(BulkString.SUBSCRIBE, channel);
            subscribedChannels.add(channel);
        }
    }

    /**
     * 退订频道，不带参数时退订全部
     */
    public void unsubscribe(final String... channels) {
        final List<String> targets = channels.length == 0
                ? new ArrayList<>(subscribedChannels)
                : Arrays.asList(channels);
        client.send(frameOf("unsubscribe", Arrays.asList(channels)));
        for (final String channel : targets) {
            expectConfirmation(BulkString.UNSUBSCRIBE, channel);
            subscribedChannels.remove(channel);
        }
    }

    private void expectConfirmation(final BulkString kind, final String channel) {
        while (true) {
            final Resp frame = client.read(client.getTimeout());
            if (frame == null) {
                throw new RedustClientException("等待" + kind + "确认超时: " + channel);
            }
            final Message message = toMessage(frame);
            if (message != null) {
                bufferedMessages.addLast(message);
                continue;
            }
            if (frame instanceof RespArray) {
                final RespArray array = (RespArray) frame;
                if (array.size() == 3 && kind.equals(array.get(0))
                        && channel.equals(array.get(1).toString())
                        && array.get(2) instanceof RespInteger) {
                    return;
                }
            }
            throw RedustClient.unexpected(frame);
        }
    }

    /**
     * @return 消息帧对应的消息，其他帧返回null
     */
    private static Message toMessage(final Resp frame) {
        if (!(frame instanceof RespArray)) {
            return null;
        }
        final RespArray array = (RespArray) frame;
        if (array.size() != 3 || !BulkString.MESSAGE.equals(array.get(0))
                || !(array.get(1) instanceof BulkString) || !(array.get(2) instanceof BulkString)) {
            return null;
        }
        return new Message(array.get(1).toString(), ((BulkString) array.get(2)).getContent().getBytes());
    }

    private static RespArray frameOf(final String command, final List<String> channels) {
        final RespArray.Builder builder = RespArray.builder(channels.size() + 1).addBulk(command);
        for (final String channel : channels) {
            builder.addBulk(channel);
        }
        return builder.build();
    }

    @Override
    public void close() {
        client.close();
    }
}
