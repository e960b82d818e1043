package site.minikv.server.command;

import lombok.extern.slf4j.Slf4j;
import site.minikv.command.Command;
import site.minikv.command.CommandType;
import site.minikv.core.KvStore;
import site.minikv.datastructure.KvBytes;
import site.minikv.protocol.BulkString;
import site.minikv.protocol.Errors;
import site.minikv.protocol.Resp;
import site.minikv.protocol.RespArray;

/**
 * 命令分发器，把一个已解码的请求映射为对存储的操作并生成回复。
 *
 * <p>分发流程：
 * <ul>
 *   <li>校验请求形状（非空、全部是非空批量字符串）</li>
 *   <li>按命令名查找命令类型，未知命令返回错误回复</li>
 *   <li>校验参数个数，不符时返回错误回复</li>
 *   <li>创建命令实例并执行</li>
 * </ul>
 *
 * <p>命令级错误一律转换成 {@link Errors} 回复，不会抛出，也不会导致连接关闭。
 * 分发器本身无状态，可以被所有连接共享。
 *
 * @since 1.0.0
 */
@Slf4j
public class CommandDispatcher {

    /** 空请求错误响应 */
    static final Errors EMPTY_COMMAND_ERROR = new Errors("ERR empty command");

    /** 请求元素不是批量字符串时的错误响应 */
    static final Errors INVALID_REQUEST_ERROR = new Errors("ERR invalid request format");

    /** 命令执行中出现意外异常时的错误响应 */
    static final Errors INTERNAL_ERROR = new Errors("ERR internal error");

    private final KvStore store;

    public CommandDispatcher(final KvStore store) {
        if (store == null) {
            throw new IllegalArgumentException("存储不能为null");
        }
        this.store = store;
    }

    /**
     * 执行一个请求。
     *
     * @param request 已解码的请求
     * @return 回复，永不为null
     */
    public Resp dispatch(final RespArray request) {
        final Resp[] array = request.getContent();
        if (array.length == 0) {
            return EMPTY_COMMAND_ERROR;
        }
        for (final Resp element : array) {
            if (!(element instanceof BulkString) || ((BulkString) element).isNull()) {
                return INVALID_REQUEST_ERROR;
            }
        }

        // 1. 查找命令
        final KvBytes name = ((BulkString) array[0]).getContent();
        final CommandType commandType = CommandType.findByBytes(name);
        if (commandType == null) {
            return new Errors("unknown command '" + name.getString() + "'");
        }

        // 2. 校验参数个数
        if (!commandType.acceptsArgCount(array.length)) {
            return new Errors("wrong number of arguments for '" + commandType.getLowerName() + "'");
        }

        // 3. 创建并执行
        try {
            final Command command = commandType.createCommand(store);
            command.setContext(array);
            return command.handle();
        } catch (RuntimeException e) {
            log.error("命令执行失败: {}", commandType, e);
            return INTERNAL_ERROR;
        }
    }
}
