package site.minikv.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import lombok.extern.slf4j.Slf4j;
import site.minikv.protocol.Resp;

/**
 * RESP响应编码器
 *
 * <p>基于Netty的MessageToByteEncoder，将 {@link Resp} 写成RESP字节。
 * 按 {@link Resp#estimateEncodedSize()} 预分配输出缓冲区，减少扩容。
 * 编码失败时写操作的promise失败，由写入方决定是否关闭连接。
 *
 * <p>编码器无状态，可在多个连接之间共享。
 *
 * @since 1.0.0
 */
@Slf4j
@ChannelHandler.Sharable
public class RespEncoder extends MessageToByteEncoder<Resp> {

    @Override
    protected ByteBuf allocateBuffer(ChannelHandlerContext ctx, Resp msg, boolean preferDirect) {
        final int estimatedSize = msg.estimateEncodedSize();
        return preferDirect
                ? ctx.alloc().ioBuffer(estimatedSize)
                : ctx.alloc().heapBuffer(estimatedSize);
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, Resp msg, ByteBuf out) {
        msg.encode(out);
        if (log.isDebugEnabled()) {
            log.debug("成功编码RESP响应: {} (大小: {} bytes)",
                    msg.getClass().getSimpleName(), out.readableBytes());
        }
    }
}
