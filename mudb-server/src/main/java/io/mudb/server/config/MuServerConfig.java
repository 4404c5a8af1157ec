package io.mudb.server.config;

import lombok.Builder;
import lombok.Data;

/**
 * 服务器配置
 *
 * <p>采用Builder模式，所有参数都有默认值：
 * <ul>
 *   <li>网络配置：监听地址、端口、连接队列与缓冲区大小
 *   <li>线程配置：boss、worker 与命令执行线程数
 *   <li>连接配置：空闲超时，0表示不超时
 * </ul>
 *
 * @author mudb
 * @since 1.0.0
 */
@Data
@Builder
public class MuServerConfig {

    // ========== 网络配置 ==========

    /** 服务器监听地址 */
    @Builder.Default
    private String host = "127.0.0.1";

    /** 服务器监听端口，0表示由系统分配 */
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

    /** Boss线程组大小（接受连接） */
    @Builder.Default
    private int bossThreadCount = 1;

    /** Worker线程组大小（处理I/O） */
    @Builder.Default
    private int workerThreadCount = Runtime.getRuntime().availableProcessors() * 2;

    /**
     * 命令执行线程数。
     *
     * <p>Netty把每个连接固定分配给其中一个线程，同一连接上的请求按顺序执行；
     * 不同连接可以并行，共享的存储由读写锁保护。
     */
    @Builder.Default
    private int commandExecutorThreadCount = Runtime.getRuntime().availableProcessors();

    // ========== 连接配置 ==========

    /** 连接空闲超时（秒），0表示不超时 */
    @Builder.Default
    private int idleTimeoutSeconds = 0;

    /**
     * 创建默认配置
     *
     * @return 默认配置实例
     */
    public static MuServerConfig defaultConfig() {
        return MuServerConfig.builder().build();
    }

    /**
     * 从命令行参数创建配置
     *
     * <p>支持的参数：
     * <ul>
     *   <li>--host &lt;地址&gt;
     *   <li>--port &lt;端口&gt;
     *   <li>--idle-timeout &lt;秒&gt;
     *   <li>--executor-threads &lt;线程数&gt;
     * </ul>
     *
     * @param args 命令行参数
     * @return 校验过的配置
     * @throws IllegalArgumentException 参数未知、缺少取值或取值非法时
     */
    public static MuServerConfig fromArgs(final String[] args) {
        final MuServerConfig config = defaultConfig();
        for (int i = 0; i < args.length; i++) {
            final String flag = args[i];
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("参数缺少取值: " + flag);
            }
            final String value = args[++i];
            switch (flag) {
                case "--host":
                    config.setHost(value);
                    break;
                case "--port":
                    config.setPort(parseInt(flag, value));
                    break;
                case "--idle-timeout":
                    config.setIdleTimeoutSeconds(parseInt(flag, value));
                    break;
                case "--executor-threads":
                    config.setCommandExecutorThreadCount(parseInt(flag, value));
                    break;
                default:
                    throw new IllegalArgumentException("未知参数: " + flag);
            }
        }
        config.validate();
        return config;
    }

    private static int parseInt(final String flag, final String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(flag + " 需要整数，实际为: " + value, e);
        }
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

        if (idleTimeoutSeconds < 0) {
            throw new IllegalArgumentException("空闲超时不能为负数");
        }
    }
}
