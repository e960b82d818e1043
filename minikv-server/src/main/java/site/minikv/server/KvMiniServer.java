package site.minikv.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.ServerChannel;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerSocketChannel;
import io.netty.channel.kqueue.KQueue;
import io.netty.channel.kqueue.KQueueEventLoopGroup;
import io.netty.channel.kqueue.KQueueServerSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutorGroup;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.minikv.core.KvStore;
import site.minikv.core.ShardedKvStore;
import site.minikv.protocol.CodecLimits;
import site.minikv.protocol.handler.RespDecoder;
import site.minikv.protocol.handler.RespEncoder;
import site.minikv.server.command.CommandDispatcher;
import site.minikv.server.config.KvServerConfig;
import site.minikv.server.handler.RespCommandHandler;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 基于Netty的服务器实现。
 *
 * <p>组成：
 * <ul>
 *   <li>boss/worker事件循环组，按Epoll、KQueue、NIO的顺序选择可用的传输实现</li>
 *   <li>独立的命令执行线程组，每个连接固定在其中一个线程上</li>
 *   <li>构造时创建的唯一一个存储，注入到每个连接的处理器</li>
 * </ul>
 *
 * <p>每个连接的pipeline：{@link RespDecoder} -&gt; {@link RespEncoder} -&gt; {@link RespCommandHandler}。
 *
 * @since 1.0.0
 */
@Slf4j
public class KvMiniServer implements KvServer {

    /** 关闭线程组时等待已提交任务的最长时间 */
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    /** 服务器配置 */
    @Getter
    private final KvServerConfig config;

    /** 共享的键值存储 */
    private final KvStore store;

    /** 所有连接共享的无状态分发器 */
    @Getter
    private final CommandDispatcher dispatcher;

    private final CodecLimits codecLimits;

    /** 服务器Channel类型，根据操作系统自动选择 */
    @Getter
    private Class<? extends ServerChannel> serverChannelClass;

    /** 接收连接的事件循环组 */
    private EventLoopGroup bossGroup;

    /** 处理I/O的事件循环组 */
    private EventLoopGroup workerGroup;

    /** 命令执行线程组 */
    private EventExecutorGroup commandExecutor;

    /** 服务器Channel */
    private volatile Channel serverChannel;

    private final AtomicBoolean started = new AtomicBoolean(false);

    private final AtomicBoolean stopped = new AtomicBoolean(false);

    /**
     * 使用配置创建服务器，此时尚未绑定端口。
     *
     * @param config 服务器配置
     * @throws IllegalArgumentException 如果配置不合法
     */
    public KvMiniServer(final KvServerConfig config) {
        config.validate();
        this.config = config;
        this.codecLimits = config.toCodecLimits();

        // 1. 初始化存储
        this.store = new ShardedKvStore(config.getStoreShardCount());
        this.dispatcher = new CommandDispatcher(store);

        // 2. 初始化事件循环组和命令执行器
        initializeEventLoopGroups();
        initializeCommandExecutor();
    }

    @Override
    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("服务器已停止，不能再次启动");
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("服务器已经启动");
        }

        ServerBootstrap serverBootstrap = new ServerBootstrap();
        serverBootstrap.group(bossGroup, workerGroup)
                .channel(serverChannelClass)
                .option(ChannelOption.SO_BACKLOG, config.getBacklogSize())
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_RCVBUF, config.getReceiveBufferSize())
                .childOption(ChannelOption.SO_SNDBUF, config.getSendBufferSize())
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast(new RespDecoder(codecLimits));
                        pipeline.addLast(new RespEncoder());
                        pipeline.addLast(commandExecutor, new RespCommandHandler(dispatcher));
                    }
                });
        try {
            serverChannel = serverBootstrap.bind(config.getHost(), config.getPort()).sync().channel();
            log.info("服务器已启动，监听 {}", serverChannel.localAddress());
        } catch (InterruptedException e) {
            log.error("服务器启动被中断", e);
            stop();
            Thread.currentThread().interrupt();
            throw new IllegalStateException("服务器启动被中断", e);
        } catch (Exception e) {
            // bind失败时Netty会原样抛出BindException等异常
            log.error("服务器启动失败: {}:{}", config.getHost(), config.getPort(), e);
            stop();
            throw new IllegalStateException("服务器启动失败: " + e.getMessage(), e);
        }
    }

    @Override
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        try {
            if (serverChannel != null) {
                serverChannel.close().sync();
            }
            workerGroup.shutdownGracefully(0, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS).sync();
            bossGroup.shutdownGracefully(0, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS).sync();
            commandExecutor.shutdownGracefully(0, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS).sync();
            log.info("服务器已停止");
        } catch (InterruptedException e) {
            log.error("服务器停止被中断", e);
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public KvStore getStore() {
        return store;
    }

    @Override
    public int getBoundPort() {
        final Channel channel = serverChannel;
        if (channel == null || !(channel.localAddress() instanceof InetSocketAddress)) {
            return -1;
        }
        return ((InetSocketAddress) channel.localAddress()).getPort();
    }

    private void initializeEventLoopGroups() {
        final String osName = System.getProperty("os.name").toLowerCase();

        if (Epoll.isAvailable()) {
            log.info("使用Epoll EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new EpollEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("epoll-boss"));
            this.workerGroup = new EpollEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("epoll-worker"));
            this.serverChannelClass = EpollServerSocketChannel.class;
        } else if (KQueue.isAvailable()) {
            log.info("使用KQueue EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new KQueueEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("kqueue-boss"));
            this.workerGroup = new KQueueEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("kqueue-worker"));
            this.serverChannelClass = KQueueServerSocketChannel.class;
        } else {
            log.info("使用NIO EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new NioEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("nio-boss"));
            this.workerGroup = new NioEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("nio-worker"));
            this.serverChannelClass = NioServerSocketChannel.class;
        }
    }

    private void initializeCommandExecutor() {
        log.info("命令执行线程数: {}", config.getCommandExecutorThreadCount());
        this.commandExecutor = new DefaultEventExecutorGroup(
                config.getCommandExecutorThreadCount(),
                new DefaultThreadFactory("minikv-cmd"));
    }
}
