package site.minikv.server.handler;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import lombok.extern.slf4j.Slf4j;
import site.minikv.protocol.Errors;
import site.minikv.protocol.ProtocolException;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespArray;
import site.minikv.server.command.CommandDispatcher;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 命令处理器，负责驱动单个连接的请求-回复循环。
 *
 * <p>每个连接创建一个实例。Netty保证同一连接的事件总是在同一个命令执行线程上按顺序到达，
 * 因此回复顺序与请求顺序一致。
 *
 * <p>错误处理：
 * <ul>
 *   <li>命令级错误由 {@link CommandDispatcher} 转换成错误回复，连接继续</li>
 *   <li>协议错误尽力回复 "ERR Protocol error: 原因" 后关闭连接，该帧不会触及存储</li>
 *   <li>写失败和其他I/O异常直接关闭连接</li>
 * </ul>
 *
 * @since 1.0.0
 */
@Slf4j
public class RespCommandHandler extends SimpleChannelInboundHandler<RespArray> {

    /** 协议错误回复的前缀 */
    static final String PROTOCOL_ERROR_PREFIX = "ERR Protocol error: ";

    private final CommandDispatcher dispatcher;

    /** 写监听器在I/O线程上运行，状态只通过CAS推进，CLOSED之后不会再被改写 */
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.READING);

    public RespCommandHandler(final CommandDispatcher dispatcher) {
        if (dispatcher == null) {
            throw new IllegalArgumentException("命令分发器不能为null");
        }
        this.dispatcher = dispatcher;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        log.debug("连接建立: {}", ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RespArray msg) {
        if (!transition(ctx, ConnectionState.READING, ConnectionState.DISPATCHING)) {
            log.debug("连接已关闭，丢弃请求: {}", msg);
            return;
        }
        final Resp reply = dispatcher.dispatch(msg);

        if (!transition(ctx, ConnectionState.DISPATCHING, ConnectionState.WRITING)) {
            log.debug("连接已关闭，丢弃回复: {}", reply);
            return;
        }
        ctx.writeAndFlush(reply).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                log.warn("回复写入失败，关闭连接 {}: {}",
                        future.channel().remoteAddress(), String.valueOf(future.cause()));
                state.set(ConnectionState.CLOSED);
                future.channel().close();
            }
        });

        // 回复已按顺序排入Netty的写队列，可以读取下一个请求；写失败已置为CLOSED时保持不变
        transition(ctx, ConnectionState.WRITING, ConnectionState.READING);
    }

    /**
     * 当前连接状态
     *
     * @return 连接状态
     */
    public ConnectionState getState() {
        return state.get();
    }

    @Override
    public void channelReadComplete(ChannelHandlerContext ctx) throws Exception {
        ctx.flush();
        super.channelReadComplete(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (state.getAndSet(ConnectionState.CLOSED) == ConnectionState.CLOSED) {
            log.debug("连接已关闭，忽略后续异常: {}", String.valueOf(cause));
            return;
        }

        final ProtocolException protocolError = findProtocolException(cause);
        if (protocolError != null) {
            log.warn("协议错误，关闭连接 {}: {}", ctx.channel().remoteAddress(), protocolError.getMessage());
            ctx.writeAndFlush(new Errors(PROTOCOL_ERROR_PREFIX + protocolError.getMessage()))
                    .addListener(ChannelFutureListener.CLOSE);
            return;
        }

        if (cause instanceof IOException) {
            log.debug("连接I/O异常 {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        } else {
            log.error("连接异常 {}", ctx.channel().remoteAddress(), cause);
        }
        ctx.close();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        state.set(ConnectionState.CLOSED);
        log.debug("连接关闭: {}", ctx.channel().remoteAddress());
        super.channelInactive(ctx);
    }

    /**
     * 仅当当前状态为expected时切换到next
     *
     * @return 切换成功返回true；状态已被改变（例如已关闭）返回false
     */
    private boolean transition(ChannelHandlerContext ctx, ConnectionState expected, ConnectionState next) {
        if (!state.compareAndSet(expected, next)) {
            return false;
        }
        if (log.isDebugEnabled()) {
            log.debug("{} {} -> {}", ctx.channel().remoteAddress(), expected, next);
        }
        return true;
    }

    private static ProtocolException findProtocolException(Throwable cause) {
        if (cause instanceof ProtocolException) {
            return (ProtocolException) cause;
        }
        if (cause instanceof DecoderException && cause.getCause() instanceof ProtocolException) {
            return (ProtocolException) cause.getCause();
        }
        return null;
    }
}
