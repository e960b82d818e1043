package site.minikv.server.config;

import lombok.Builder;
import lombok.Data;
import site.minikv.core.ShardedKvStore;
import site.minikv.protocol.CodecLimits;

/**
 * 服务器配置类，统一管理所有服务器配置参数。
 *
 * <p>采用Builder模式创建，所有字段都有默认值。主要配置包括：
 * <ul>
 *   <li>网络配置：主机地址、端口、连接参数</li>
 *   <li>线程配置：各类线程池大小</li>
 *   <li>协议限制：批量字符串、数组和协议行的长度上限</li>
 *   <li>存储配置：分片数</li>
 * </ul>
 *
 * @since 1.0.0
 */
@Data
@Builder
public class KvServerConfig {

    // ========== 网络配置 ==========

    /**
     * 服务器监听地址。
     *
     * <p>127.0.0.1仅本机访问，0.0.0.0允许所有网络访问。
     */
    @Builder.Default
    private String host = "127.0.0.1";

    /** 服务器监听端口，0表示由系统分配临时端口 */
    @Builder.Default
    private int port = 6379;

    /** TCP连接队列大小 */
    @Builder.Default
    private int backlogSize = 1024;

    /** 接收缓冲区大小（字节） */
    @Builder.Default
    private int receiveBufferSize = 32 * 1024;

    /** 发送缓冲区大小（字节） */
    @Builder.Default
    private int sendBufferSize = 32 * 1024;

    // ========== 线程配置 ==========

    /** Boss线程组大小（接受连接），通常为1 */
    @Builder.Default
    private int bossThreadCount = 1;

    /** Worker线程组大小（处理I/O），默认CPU核心数2倍 */
    @Builder.Default
    private int workerThreadCount = Runtime.getRuntime().availableProcessors() * 2;

    /**
     * 命令执行器线程数。
     *
     * <p>每个连接固定在其中一个线程上，不同连接可以并发执行命令。
     */
    @Builder.Default
    private int commandExecutorThreadCount = Runtime.getRuntime().availableProcessors();

    // ========== 协议限制 ==========

    /** 单个批量字符串的最大字节数 */
    @Builder.Default
    private int maxBulkLength = CodecLimits.DEFAULT_MAX_BULK_LENGTH;

    /** 单个请求的最大元素个数 */
    @Builder.Default
    private int maxArrayLength = CodecLimits.DEFAULT_MAX_ARRAY_LENGTH;

    /** 协议头行（含CRLF）的最大字节数 */
    @Builder.Default
    private int maxLineLength = CodecLimits.DEFAULT_MAX_LINE_LENGTH;

    /** 单个请求帧的最大字节数，未到齐的帧也计算在内 */
    @Builder.Default
    private int maxRequestLength = CodecLimits.DEFAULT_MAX_REQUEST_LENGTH;

    // ========== 存储配置 ==========

    /** 存储分片数，必须是2的幂 */
    @Builder.Default
    private int storeShardCount = ShardedKvStore.DEFAULT_SHARD_COUNT;

    // ========== 工厂方法 ==========

    /**
     * 创建默认配置。
     *
     * @return 默认配置实例
     */
    public static KvServerConfig defaultConfig() {
        return KvServerConfig.builder().build();
    }

    /**
     * 从命令行参数创建配置。
     *
     * <p>支持的参数：
     * <ul>
     *   <li>--host &lt;addr&gt;</li>
     *   <li>--port &lt;n&gt;</li>
     *   <li>--max-bulk-length &lt;bytes&gt;</li>
     *   <li>--max-request-length &lt;bytes&gt;</li>
     *   <li>--shards &lt;n&gt;</li>
     *   <li>--command-threads &lt;n&gt;</li>
     * </ul>
     *
     * @param args 命令行参数
     * @return 已校验的配置
     * @throws IllegalArgumentException 参数未知、缺少取值、不是数字或配置不合法
     */
    public static KvServerConfig fromArgs(final String[] args) {
        final KvServerConfig config = defaultConfig();
        if (args == null) {
            return config;
        }

        for (int i = 0; i < args.length; i++) {
            final String option = args[i];
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("参数缺少取值: " + option);
            }
            final String value = args[++i];
            switch (option) {
                case "--host":
                    config.setHost(value);
                    break;
                case "--port":
                    config.setPort(parseInt(option, value));
                    break;
                case "--max-bulk-length":
                    config.setMaxBulkLength(parseInt(option, value));
                    break;
                case "--max-request-length":
                    config.setMaxRequestLength(parseInt(option, value));
                    break;
                case "--shards":
                    config.setStoreShardCount(parseInt(option, value));
                    break;
                case "--command-threads":
                    config.setCommandExecutorThreadCount(parseInt(option, value));
                    break;
                default:
                    throw new IllegalArgumentException("未知参数: " + option);
            }
        }

        config.validate();
        return config;
    }

    private static int parseInt(final String option, final String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("参数" + option + "的取值不是整数: " + value, e);
        }
    }

    /**
     * 转换为编解码器限制。
     *
     * @return 编解码器限制
     */
    public CodecLimits toCodecLimits() {
        return CodecLimits.builder()
                .maxBulkLength(maxBulkLength)
                .maxArrayLength(maxArrayLength)
                .maxLineLength(maxLineLength)
                .maxRequestLength(maxRequestLength)
                .build();
    }

    /**
     * 验证配置参数的合法性
     *
     * @throws IllegalArgumentException 如果配置参数无效
     */
    public void validate() {
        if (host == null || host.trim().isEmpty()) {
            throw new IllegalArgumentException("监听地址不能为空");
        }

        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("端口号必须在0-65535范围内");
        }

        if (bossThreadCount <= 0 || workerThreadCount <= 0 || commandExecutorThreadCount <= 0) {
            throw new IllegalArgumentException("线程数量必须大于0");
        }

        if (backlogSize <= 0 || receiveBufferSize <= 0 || sendBufferSize <= 0) {
            throw new IllegalArgumentException("缓冲区大小必须大于0");
        }

        if (storeShardCount <= 0 || Integer.bitCount(storeShardCount) != 1) {
            throw new IllegalArgumentException("分片数必须是2的幂: " + storeShardCount);
        }

        toCodecLimits().validate();
    }
}
