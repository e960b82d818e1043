package site.minikv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;

/**
 * RESP协议值的基础类
 *
 * <p>所有RESP数据类型的基类，定义统一的编码接口和共享的工具方法。
 * 子类均为不可变值对象，实现基于内容的相等性。
 *
 * <p>支持的数据类型：
 * <ul>
 *     <li>{@link SimpleString} - 以"+"开头</li>
 *     <li>{@link Errors} - 以"-"开头</li>
 *     <li>{@link RespInteger} - 以":"开头</li>
 *     <li>{@link BulkString} - 以"$"开头，二进制安全</li>
 *     <li>{@link RespArray} - 以"*"开头</li>
 *     <li>{@link RespNull} - 顶层空值，编码为"*-1"</li>
 * </ul>
 *
 * <p>编码是确定性的：同一个值总是得到同一串字节，长度字段由编码器根据实际内容计算。
 *
 * @since 1.0.0
 */
public abstract class Resp {
    /** 行结束符 */
    public static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 最大缓存数字 */
    protected static final int MAX_CACHED_NUMBER = 255;

    /** 数字的字节表示缓存 */
    private static final byte[][] NUMBERS = new byte[MAX_CACHED_NUMBER + 1][];

    static {
        for (int i = 0; i <= MAX_CACHED_NUMBER; i++) {
            NUMBERS[i] = String.valueOf(i).getBytes(StandardCharsets.US_ASCII);
        }
    }

    /**
     * 以十进制ASCII写入整数，小的非负数使用缓存避免重复分配
     *
     * @param buf 目标缓冲区
     * @param value 要写入的整数值
     */
    protected static void writeLongAsBytes(final ByteBuf buf, final long value) {
        if (value >= 0 && value <= MAX_CACHED_NUMBER) {
            buf.writeBytes(NUMBERS[(int) value]);
        } else {
            buf.writeBytes(Long.toString(value).getBytes(StandardCharsets.US_ASCII));
        }
    }

    /**
     * 将当前值按RESP格式写入缓冲区
     *
     * @param byteBuf 输出缓冲区
     */
    public abstract void encode(ByteBuf byteBuf);

    /**
     * 编码后的大致字节数，用于预分配缓冲区
     *
     * @return 估算的编码大小
     */
    public int estimateEncodedSize() {
        return 64;
    }

    /**
     * 将当前值编码为独立的字节数组
     *
     * @return RESP格式的字节
     */
    public byte[] toBytes() {
        final ByteBuf buf = Unpooled.buffer(estimateEncodedSize());
        try {
            encode(buf);
            final byte[] bytes = new byte[buf.readableBytes()];
            buf.readBytes(bytes);
            return bytes;
        } finally {
            buf.release();
        }
    }
}
