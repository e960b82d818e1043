package site.minikv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import site.minikv.datastructure.KvBytes;

import java.nio.charset.StandardCharsets;

/**
 * RESP批量字符串类型
 *
 * <p>长度前缀、二进制安全的字节负载，内容中的零字节、高位字节以及CRLF都按原样保存。
 * 内容为null时表示空值，编码为"$-1"，与长度为0的空串不同。
 *
 * <p>使用建议：
 * <ul>
 *     <li>外部数据使用 {@link #create(byte[])}，会复制输入</li>
 *     <li>解码器等可信代码使用 {@link #wrapTrusted(byte[])}，零拷贝</li>
 *     <li>常用命令名使用预定义常量</li>
 * </ul>
 *
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class BulkString extends Resp {
    /** 空值的RESP编码 */
    private static final byte[] NULL_BYTES = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 空字符串的RESP编码 */
    private static final byte[] EMPTY_BULK = "$0\r\n\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 空值实例 */
    public static final BulkString NULL = new BulkString(null);

    /** 预分配的常用命令实例 */
    public static final BulkString SET = fromString("SET");
    public static final BulkString GET = fromString("GET");
    public static final BulkString DEL = fromString("DEL");
    public static final BulkString PING = fromString("PING");

    /** 字符串内容，null表示空值 */
    private final KvBytes content;

    /**
     * 构造函数
     *
     * @param content 内容，null表示空值
     */
    public BulkString(final KvBytes content) {
        this.content = content;
    }

    /**
     * 安全模式工厂方法，会复制输入的字节数组
     *
     * @param content 字节数组内容
     * @return BulkString实例
     */
    public static BulkString create(final byte[] content) {
        return content == null ? NULL : new BulkString(new KvBytes(content));
    }

    /**
     * 基于已有字节串的工厂方法
     *
     * @param content 字节串内容
     * @return BulkString实例
     */
    public static BulkString create(final KvBytes content) {
        return content == null ? NULL : new BulkString(content);
    }

    /**
     * 零拷贝工厂方法
     *
     * <p>警告：调用者必须保证bytes数组此后不会被修改！
     *
     * @param trustedBytes 受信任的字节数组
     * @return 零拷贝的BulkString实例
     */
    public static BulkString wrapTrusted(final byte[] trustedBytes) {
        return trustedBytes == null ? NULL : new BulkString(KvBytes.wrapTrusted(trustedBytes));
    }

    /**
     * 从字符串创建BulkString的便捷工厂方法
     *
     * @param str 字符串内容
     * @return BulkString实例
     */
    public static BulkString fromString(final String str) {
        return str == null ? NULL : new BulkString(KvBytes.fromString(str));
    }

    /**
     * 是否为空值
     *
     * @return 内容为null时返回true
     */
    public boolean isNull() {
        return content == null;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        if (content == null) {
            byteBuf.writeBytes(NULL_BYTES);
            return;
        }

        final byte[] bytes = content.getBytesUnsafe();
        if (bytes.length == 0) {
            byteBuf.writeBytes(EMPTY_BULK);
            return;
        }

        byteBuf.ensureWritable(estimateEncodedSize());
        byteBuf.writeByte('$');
        writeLongAsBytes(byteBuf, bytes.length);
        byteBuf.writeBytes(CRLF);
        byteBuf.writeBytes(bytes);
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public int estimateEncodedSize() {
        if (content == null) {
            return NULL_BYTES.length;
        }
        // '$' + 长度数字(最多10位) + '\r\n' + 内容 + '\r\n'
        return content.length() + 15;
    }

    /**
     * 获取字符串内容
     *
     * @return 字符串内容，如果为空值则返回 null
     */
    @Override
    public String toString() {
        return content != null ? content.getString() : null;
    }
}
