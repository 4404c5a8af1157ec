package io.mudb.server;

import io.mudb.command.CommandDispatcher;
import io.mudb.core.MuCore;
import io.mudb.core.MuCoreImpl;
import io.mudb.protocol.handler.RespDecoder;
import io.mudb.protocol.handler.RespEncoder;
import io.mudb.server.config.MuServerConfig;
import io.mudb.server.handler.RespCommandHandler;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.ServerChannel;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerSocketChannel;
import io.netty.channel.kqueue.KQueue;
import io.netty.channel.kqueue.KQueueEventLoopGroup;
import io.netty.channel.kqueue.KQueueServerSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutorGroup;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;

/**
 * 基于Netty的服务器实现
 *
 * <p>线程模型：
 * <ul>
 *   <li>boss线程组接受连接，worker线程组负责I/O与编解码
 *   <li>命令处理器运行在独立的命令执行线程组上
 *   <li>所有连接共享一个 {@link MuCore}
 * </ul>
 *
 * <p>根据操作系统自动选择 Epoll、KQueue 或 NIO 传输。
 *
 * @author mudb
 * @since 1.0.0
 */
@Slf4j
@Getter
public class MudbServer implements MuServer {

    /** 服务器配置 */
    private final MuServerConfig config;

    /** 值存储 */
    private final MuCore muCore;

    /** 命令分发器，所有连接共享 */
    private final CommandDispatcher dispatcher;

    /** 服务器Channel类型 */
    private Class<? extends ServerChannel> serverChannelClass;

    /** 接收连接的事件循环组 */
    private EventLoopGroup bossGroup;

    /** 处理I/O的事件循环组 */
    private EventLoopGroup workerGroup;

    /** 命令执行线程组 */
    private EventExecutorGroup commandExecutor;

    /** 服务器Channel */
    private Channel serverChannel;

    /** 实际绑定的端口 */
    private volatile int port;

    public MudbServer(final MuServerConfig config) {
        this(config, new MuCoreImpl());
    }

    public MudbServer(final MuServerConfig config, final MuCore muCore) {
        config.validate();
        this.config = config;
        this.muCore = muCore;
        this.dispatcher = new CommandDispatcher(muCore);
        this.port = config.getPort();

        initializeEventLoopGroups();
        initializeCommandExecutor();
    }

    @Override
    public void start() {
        final ServerBootstrap serverBootstrap = new ServerBootstrap();
        serverBootstrap.group(bossGroup, workerGroup)
                .channel(serverChannelClass)
                .option(ChannelOption.SO_BACKLOG, config.getBacklogSize())
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_RCVBUF, config.getReceiveBufferSize())
                .childOption(ChannelOption.SO_SNDBUF, config.getSendBufferSize())
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        final ChannelPipeline pipeline = ch.pipeline();
                        if (config.getIdleTimeoutSeconds() > 0) {
                            pipeline.addLast(new IdleStateHandler(0, 0, config.getIdleTimeoutSeconds()));
                        }
                        pipeline.addLast(new RespDecoder());
                        pipeline.addLast(new RespEncoder());
                        pipeline.addLast(commandExecutor, new RespCommandHandler(dispatcher));
                    }
                });
        try {
            serverChannel = serverBootstrap.bind(config.getHost(), config.getPort()).sync().channel();
            port = ((InetSocketAddress) serverChannel.localAddress()).getPort();
            log.info("muDB server started at {}:{}", config.getHost(), port);
        } catch (InterruptedException e) {
            log.error("muDB server start interrupted", e);
            stop();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().sync();
            }
            if (workerGroup != null) {
                workerGroup.shutdownGracefully().sync();
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully().sync();
            }
            if (commandExecutor != null) {
                commandExecutor.shutdownGracefully().sync();
            }
            log.info("muDB server stopped");
        } catch (InterruptedException e) {
            log.error("muDB server stop interrupted", e);
            Thread.currentThread().interrupt();
        }
    }

    private void initializeEventLoopGroups() {
        final String osName = System.getProperty("os.name").toLowerCase();

        if (Epoll.isAvailable()) {
            log.info("使用Epoll EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new EpollEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("epoll-boss"));
            this.workerGroup = new EpollEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("epoll-worker"));
            this.serverChannelClass = EpollServerSocketChannel.class;
        } else if (KQueue.isAvailable()) {
            log.info("使用KQueue EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new KQueueEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("kqueue-boss"));
            this.workerGroup = new KQueueEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("kqueue-worker"));
            this.serverChannelClass = KQueueServerSocketChannel.class;
        } else {
            log.info("使用NIO EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new NioEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("nio-boss"));
            this.workerGroup = new NioEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("nio-worker"));
            this.serverChannelClass = NioServerSocketChannel.class;
        }
    }

    private void initializeCommandExecutor() {
        log.info("命令执行线程数: {}", config.getCommandExecutorThreadCount());
        this.commandExecutor = new DefaultEventExecutorGroup(
                config.getCommandExecutorThreadCount(),
                new DefaultThreadFactory("mudb-cmd"));
    }
}
