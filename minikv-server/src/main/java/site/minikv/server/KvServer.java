package site.minikv.server;

import site.minikv.core.KvStore;

/**
 * 服务器核心接口，定义了服务器的生命周期管理。
 *
 * @since 1.0.0
 */
public interface KvServer {

    /**
     * 启动服务器并绑定端口，方法返回时已经可以接受连接。
     *
     * @throws IllegalStateException 如果服务器已经启动、已经停止或绑定失败
     */
    void start();

    /**
     * 停止服务器：关闭监听、关闭所有连接并释放线程池。
     *
     * <p>可以重复调用，第二次及之后的调用不做任何事。
     */
    void stop();

    /**
     * 获取服务器使用的存储。
     *
     * @return 键值存储
     */
    KvStore getStore();

    /**
     * 获取实际绑定的端口，配置端口为0时由系统分配。
     *
     * @return 绑定端口，未启动时返回-1
     */
    int getBoundPort();
}
