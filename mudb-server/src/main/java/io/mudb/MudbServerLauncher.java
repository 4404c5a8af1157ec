package io.mudb;

import io.mudb.server.MuServer;
import io.mudb.server.MudbServer;
import io.mudb.server.config.MuServerConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * 服务器启动入口
 *
 * <p>用法: mudb-server [--host 地址] [--port 端口] [--idle-timeout 秒] [--executor-threads 线程数]
 *
 * @author mudb
 * @since 1.0.0
 */
@Slf4j
public class MudbServerLauncher {

    public static void main(final String[] args) {
        final MuServerConfig config;
        try {
            config = MuServerConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            log.error("启动参数错误: {}", e.getMessage());
            log.error("用法: mudb-server [--host 地址] [--port 端口] [--idle-timeout 秒] [--executor-threads 线程数]");
            System.exit(1);
            return;
        }

        final MuServer server = new MudbServer(config);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("正在关闭服务器...");
            server.stop();
        }, "mudb-shutdown"));

        server.start();
    }
}
