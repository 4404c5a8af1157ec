package io.mudb.server;

import io.mudb.core.MuCore;

/**
 * 服务器接口
 *
 * @author mudb
 * @since 1.0.0
 */
public interface MuServer {

    /**
     * 绑定端口并开始接受连接，返回时端口已绑定
     */
    void start();

    /**
     * 关闭监听与所有线程组
     */
    void stop();

    /**
     * @return 服务器持有的值存储
     */
    MuCore getMuCore();

    /**
     * @return 实际绑定的端口，未启动时为配置的端口
     */
    int getPort();
}
