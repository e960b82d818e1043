package site.minikv.server.handler;

/**
 * 连接状态
 *
 * <pre>
 * READING -&gt; DISPATCHING -&gt; WRITING -&gt; READING
 * 任意状态 -&gt; CLOSED
 * </pre>
 *
 * @since 1.0.0
 */
public enum ConnectionState {
    /** 等待下一个完整请求 */
    READING,
    /** 正在执行命令 */
    DISPATCHING,
    /** 回复已交给Netty写出 */
    WRITING,
    /** 连接已关闭或正在关闭，不再处理任何请求 */
    CLOSED
}
