package io.redust.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * 错误消息帧，编码为"-消息\r\n"。
 *
 * <p>示例："-ERR unknown command 'foo'"
 *
 * <p>消息不能包含'\r'或'\n'。消息中带有客户端输入时，先用 {@link #singleLine(String)} 处理。
 *
 * @author redust
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class Errors extends Resp {
    /** 错误消息内容 */
    private final String content;

    /**
     * @param content 单行错误消息
     * @throws IllegalArgumentException 消息包含'\r'或'\n'
     */
    public Errors(final String content) {
        this.content = requireSingleLine(content);
    }

    /**
     * 把文本中的'\r'和'\n'替换为空格
     *
     * @param text 可能来自客户端的文本
     * @return 可以放进错误帧的单行文本
     */
    public static String singleLine(final String text) {
        return text.replace('\r', ' ').replace('\n', ' ');
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte('-');
        byteBuf.writeBytes(content.getBytes(StandardCharsets.UTF_8));
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return "error: " + content;
    }
}
