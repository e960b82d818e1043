package site.minikv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * RESP简单字符串类型，用于"OK"这类简短的状态响应。
 *
 * <p>内容不能包含CR或LF，否则会破坏行结构。
 *
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class SimpleString extends Resp {
    /** 预定义的成功响应 */
    public static final SimpleString OK = new SimpleString("OK");

    /** 预定义的心跳响应 */
    public static final SimpleString PONG = new SimpleString("PONG");

    /** 字符串内容 */
    private final String content;

    /** 字符串的字节表示 */
    @Getter(lombok.AccessLevel.NONE)
    @EqualsAndHashCode.Exclude
    private final byte[] contentBytes;

    /**
     * 构造函数
     *
     * @param content 字符串内容
     * @throws IllegalArgumentException 如果内容为null或包含CR/LF
     */
    public SimpleString(final String content) {
        if (content == null) {
            throw new IllegalArgumentException("简单字符串内容不能为null");
        }
        if (content.indexOf('\r') >= 0 || content.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("简单字符串不能包含CR或LF");
        }
        this.content = content;
        this.contentBytes = content.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * 工厂方法：常用字符串返回缓存实例
     *
     * @param content 字符串内容
     * @return SimpleString 实例
     */
    public static SimpleString valueOf(final String content) {
        if ("OK".equals(content)) {
            return OK;
        } else if ("PONG".equals(content)) {
            return PONG;
        }
        return new SimpleString(content);
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte('+');
        byteBuf.writeBytes(contentBytes);
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public int estimateEncodedSize() {
        return contentBytes.length + 3;
    }

    @Override
    public String toString() {
        return content;
    }
}
