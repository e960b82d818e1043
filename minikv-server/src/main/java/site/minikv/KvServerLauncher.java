package site.minikv;

import lombok.extern.slf4j.Slf4j;
import site.minikv.server.KvMiniServer;
import site.minikv.server.KvServer;
import site.minikv.server.config.KvServerConfig;

/**
 * 服务器启动入口
 *
 * <pre>
 * java -jar minikv-server.jar --host 0.0.0.0 --port 6379 --shards 32
 * </pre>
 */
@Slf4j
public class KvServerLauncher {
    public static void main(String[] args) {
        KvServerConfig config = KvServerConfig.fromArgs(args);
        log.info("启动配置: {}", config);

        KvServer server = new KvMiniServer(config);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("正在关闭服务器...");
            server.stop();
        }, "minikv-shutdown"));

        server.start();
    }
}
