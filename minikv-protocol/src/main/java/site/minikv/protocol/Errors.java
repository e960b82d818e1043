package site.minikv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * RESP错误消息类型
 *
 * <p>传输格式与简单字符串相同，只是首字节为"-"，表示这是一个错误响应。
 * 命令级错误（参数个数错误、未知命令）和协议错误的最后一条回复都使用该类型。
 *
 * <p>错误格式：
 * <ul>
 *     <li>语法："-Error message\r\n"</li>
 *     <li>示例："-unknown command 'foobar'"</li>
 * </ul>
 *
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class Errors extends Resp {
    /** 错误消息内容 */
    private final String content;

    /**
     * 创建错误消息实例，消息中的CR/LF会被替换为空格
     *
     * @param content 错误消息内容
     */
    public Errors(final String content) {
        if (content == null) {
            throw new IllegalArgumentException("错误消息不能为null");
        }
        this.content = content.replace('\r', ' ').replace('\n', ' ');
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte('-');
        byteBuf.writeBytes(content.getBytes(StandardCharsets.UTF_8));
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return content;
    }
}
