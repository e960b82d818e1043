package site.minikv.command;

import site.minikv.protocol.Resp;

/**
 * 命令接口，定义了所有命令的基本行为。
 *
 * <p>每个请求创建一个新的命令实例：先由分发器校验参数个数，
 * 再通过 {@link #setContext(Resp[])} 注入参数，最后调用 {@link #handle()} 执行。
 * 命令实例不会在线程间共享，共享状态只有注入的存储。
 *
 * @since 1.0.0
 */
public interface Command {

    /**
     * 获取命令类型。
     *
     * @return 命令类型枚举值
     */
    CommandType getType();

    /**
     * 设置命令参数。
     *
     * <p>数组第0个元素是命令名本身，参数个数已经过 {@link CommandType#acceptsArgCount(int)} 校验。
     *
     * @param array 请求数组的全部元素
     */
    void setContext(Resp[] array);

    /**
     * 执行命令并返回结果。
     *
     * @return 回复
     */
    Resp handle();
}
