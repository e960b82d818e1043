package site.minikv.protocol;

import io.netty.buffer.ByteBuf;

import java.nio.charset.StandardCharsets;

/**
 * 顶层空值，编码为"*-1\r\n"。与长度为0的BulkString以及 {@link BulkString#NULL} 都不同。
 *
 * @since 1.0.0
 */
public final class RespNull extends Resp {
    /** 唯一实例 */
    public static final RespNull INSTANCE = new RespNull();

    private static final byte[] NULL_ARRAY_BYTES = "*-1\r\n".getBytes(StandardCharsets.US_ASCII);

    private RespNull() {
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeBytes(NULL_ARRAY_BYTES);
    }

    @Override
    public int estimateEncodedSize() {
        return NULL_ARRAY_BYTES.length;
    }

    @Override
    public String toString() {
        return "(nil)";
    }
}
