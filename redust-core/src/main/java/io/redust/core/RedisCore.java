package io.redust.core;

import io.redust.core.pubsub.Receiver;
import io.redust.datastructure.RedisBytes;

import java.time.Duration;

/**
 * 服务端共享状态的操作接口
 *
 * <p>包含键值存储、键过期和发布订阅三部分。键空间与频道空间互不相关：
 * 同名的键和频道之间没有任何联系。
 *
 * <p>实现必须是线程安全的，所有连接共享同一个实例。
 *
 * @author redust
 * @since 1.0.0
 */
public interface RedisCore {

    /**
     * 获取键的当前值
     *
     * <p>过期的键只由后台清理线程删除，因此在过期时刻之后、清理之前仍可能读到旧值。
     *
     * @param key 键
     * @return 对应的值，键不存在时返回null
     */
    RedisBytes get(RedisBytes key);

    /**
     * 设置键值，替换已有的值及其过期时间
     *
     * @param key 键
     * @param value 值
     * @param expire 存活时长，null表示永不过期
     */
    void set(RedisBytes key, RedisBytes value, Duration expire);

    /**
     * 订阅频道，频道不存在时创建
     *
     * @param channel 频道名
     * @return 接收方，只能收到订阅之后发布的消息
     */
    Receiver<RedisBytes> subscribe(RedisBytes channel);

    /**
     * 向频道发布消息
     *
     * @param channel 频道名
     * @param message 消息内容
     * @return 收到消息的订阅者数量
     */
    long publish(RedisBytes channel, RedisBytes message);

    /**
     * @return 当前存储的键数量，包括已过期但尚未清理的键
     */
    int size();

    /**
     * 关闭存储并停止后台清理线程，可重复调用
     */
    void shutdown();
}
