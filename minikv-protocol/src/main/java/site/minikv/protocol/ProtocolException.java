package site.minikv.protocol;

/**
 * 流级别的帧格式错误。
 *
 * <p>一旦出现，该连接上的字节流已无法安全地重新同步，连接必须关闭。
 * 与命令级错误（参数个数错误、未知命令）不同，后者只作为普通错误回复返回。
 *
 * @since 1.0.0
 */
public class ProtocolException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ProtocolException(final String message) {
        super(message);
    }
}
