package site.minikv.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import lombok.extern.slf4j.Slf4j;
import site.minikv.protocol.CodecLimits;
import site.minikv.protocol.ProtocolException;
import site.minikv.protocol.RespArray;
import site.minikv.protocol.RespRequestParser;

import java.util.List;

/**
 * RESP请求解码器
 *
 * <p>基于Netty的ByteToMessageDecoder，将任意分片到达的字节流还原为一个个 {@link RespArray} 请求。
 * 不完整的帧保留在累积缓冲区中，等待下一次读取。
 *
 * <p>遇到 {@link ProtocolException} 时：
 * <ul>
 *     <li>丢弃该连接剩余的全部输入</li>
 *     <li>此后不再解码任何数据</li>
 *     <li>异常沿pipeline传递给命令处理器，由它回复错误并关闭连接</li>
 * </ul>
 *
 * <p>每个连接需要一个独立的实例。
 *
 * @since 1.0.0
 */
@Slf4j
public class RespDecoder extends ByteToMessageDecoder {

    private final RespRequestParser parser;

    /** 是否已发生协议错误 */
    private boolean failed;

    public RespDecoder(final CodecLimits limits) {
        this.parser = new RespRequestParser(limits);
    }

    public RespDecoder() {
        this(CodecLimits.defaults());
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (failed) {
            in.skipBytes(in.readableBytes());
            return;
        }

        try {
            final RespArray request = parser.parse(in);
            if (request != null) {
                out.add(request);
                log.debug("成功解码请求: {} 个元素", request.size());
            }
        } catch (ProtocolException e) {
            failed = true;
            in.skipBytes(in.readableBytes());
            log.warn("协议错误 {}: {}", ctx.channel().remoteAddress(), e.getMessage());
            throw e;
        }
    }

    /**
     * 是否已经因为协议错误停止解码
     *
     * @return 发生过协议错误时返回true
     */
    public boolean isFailed() {
        return failed;
    }
}
