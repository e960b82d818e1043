package site.minikv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * RESP数组类型
 *
 * <p>客户端请求总是以BulkString数组的形式出现：第一个元素是命令名，其余是参数。
 * 也可用于多值响应。顶层的空数组语义（"*-1"）由 {@link RespNull} 表示。
 *
 * @since 1.0.0
 */
@EqualsAndHashCode(callSuper = false)
public final class RespArray extends Resp {
    /** 空数组的RESP编码 */
    private static final byte[] EMPTY_ARRAY_BYTES = "*0\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 预定义的空数组实例 */
    public static final RespArray EMPTY = new RespArray(new Resp[0]);

    /** 数组内容 */
    private final Resp[] content;

    /**
     * 构造函数，会复制传入的数组
     *
     * @param content 数组内容，元素不能为null
     */
    public RespArray(final Resp... content) {
        if (content == null) {
            throw new IllegalArgumentException("数组内容不能为null，空值请使用RespNull");
        }
        for (final Resp element : content) {
            if (element == null) {
                throw new IllegalArgumentException("数组元素不能为null");
            }
        }
        this.content = content.clone();
    }

    /**
     * 工厂方法
     *
     * @param content 数组内容
     * @return RespArray 实例
     */
    public static RespArray valueOf(final List<? extends Resp> content) {
        if (content.isEmpty()) {
            return EMPTY;
        }
        return new RespArray(content.toArray(new Resp[0]));
    }

    /**
     * 获取数组内容的副本
     *
     * @return 元素数组
     */
    public Resp[] getContent() {
        return content.clone();
    }

    /**
     * 元素个数
     *
     * @return 元素个数
     */
    public int size() {
        return content.length;
    }

    /**
     * 按下标获取元素
     *
     * @param index 下标
     * @return 元素
     */
    public Resp get(final int index) {
        return content[index];
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        if (content.length == 0) {
            byteBuf.writeBytes(EMPTY_ARRAY_BYTES);
            return;
        }

        byteBuf.ensureWritable(estimateEncodedSize());
        byteBuf.writeByte('*');
        writeLongAsBytes(byteBuf, content.length);
        byteBuf.writeBytes(CRLF);
        for (final Resp element : content) {
            element.encode(byteBuf);
        }
    }

    @Override
    public int estimateEncodedSize() {
        // '*' + 元素个数 + '\r\n'
        int totalSize = 13;
        for (final Resp element : content) {
            totalSize += element.estimateEncodedSize();
        }
        return totalSize;
    }

    @Override
    public String toString() {
        return Arrays.toString(content);
    }
}
