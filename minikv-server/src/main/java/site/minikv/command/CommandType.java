package site.minikv.command;

import lombok.Getter;
import site.minikv.command.impl.Ping;
import site.minikv.command.impl.key.Del;
import site.minikv.command.impl.string.Get;
import site.minikv.command.impl.string.Set;
import site.minikv.core.KvStore;
import site.minikv.datastructure.KvBytes;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 命令类型枚举，定义了系统支持的所有命令。
 *
 * <p>参数个数（arity）包含命令名本身：正数表示必须恰好这么多个，
 * 负数表示至少 |arity| 个。部分命令另有上限。
 *
 * <p>命令名匹配大小写不敏感，直接作用在原始字节上。
 *
 * @since 1.0.0
 */
@Getter
public enum CommandType {
    /** PING命令：测试服务器连接，可带一个消息 */
    PING("PING", -1, 2),
    /** SET命令：设置键值对 */
    SET("SET", 3),
    /** GET命令：获取键值 */
    GET("GET", 2),
    /** DEL命令：删除一个或多个键 */
    DEL("DEL", -2);

    /** 命令查找缓存，键是大写的命令名 */
    private static final Map<KvBytes, CommandType> COMMAND_CACHE = new HashMap<>();

    static {
        for (final CommandType type : CommandType.values()) {
            COMMAND_CACHE.put(type.commandBytes, type);
        }
    }

    /** 大写的命令名字节 */
    private final KvBytes commandBytes;

    /** 错误消息中使用的小写命令名 */
    private final String lowerName;

    private final int arity;

    /** 参数个数上限，0表示不限 */
    private final int maxArity;

    CommandType(final String commandName, final int arity) {
        this(commandName, arity, 0);
    }

    CommandType(final String commandName, final int arity, final int maxArity) {
        this.commandBytes = KvBytes.fromString(commandName);
        this.lowerName = commandName.toLowerCase(Locale.ROOT);
        this.arity = arity;
        this.maxArity = maxArity;
    }

    /**
     * 根据命令名字节查找命令类型，大小写不敏感。
     *
     * @param commandBytes 命令名字节
     * @return 对应的CommandType，如果不存在则返回null
     */
    public static CommandType findByBytes(final KvBytes commandBytes) {
        if (commandBytes == null) {
            return null;
        }

        // 1. 绝大多数客户端发送大写命令名，直接命中
        final CommandType result = COMMAND_CACHE.get(commandBytes);
        if (result != null) {
            return result;
        }

        // 2. 按ASCII转大写后再查
        return COMMAND_CACHE.get(commandBytes.toUpperAscii());
    }

    /**
     * 检查请求的元素个数（含命令名）是否符合该命令的要求。
     *
     * @param tokenCount 请求数组的元素个数
     * @return 合法返回true
     */
    public boolean acceptsArgCount(final int tokenCount) {
        if (arity >= 0) {
            return tokenCount == arity;
        }
        if (tokenCount < -arity) {
            return false;
        }
        return maxArity <= 0 || tokenCount <= maxArity;
    }

    /**
     * 使用存储创建命令实例。
     *
     * @param store 共享的键值存储
     * @return 命令实例
     */
    public Command createCommand(final KvStore store) {
        switch (this) {
            case PING:
                return new Ping();
            case SET:
                return new Set(store);
            case GET:
                return new Get(store);
            case DEL:
                return new Del(store);
            default:
                throw new IllegalArgumentException("不支持的命令类型: " + this);
        }
    }
}
