package io.mudb.cli;

import io.mudb.protocol.Resp;
import io.mudb.protocol.RespArray;
import io.mudb.protocol.handler.RespEncoder;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 基于Netty的客户端
 *
 * <p>一个客户端对应一个连接，请求严格按顺序发送：上一个回复到达之前不会发送下一个请求。
 * 等待回复超时后连接会被关闭，因为请求与回复的对应关系已经无法确定。
 *
 * @author mudb
 * @since 1.0.0
 */
@Slf4j
public class MudbClient implements AutoCloseable {

    /** 默认超时时间（毫秒） */
    public static final long DEFAULT_TIMEOUT_MILLIS = 5000L;

    @Getter
    private final String host;

    @Getter
    private final int port;

    /** 连接与等待回复的超时时间 */
    private final long timeoutMillis;

    private final ReplyHandler replyHandler = new ReplyHandler();

    private EventLoopGroup group;

    private Channel channel;

    public MudbClient(final String host, final int port) {
        this(host, port, DEFAULT_TIMEOUT_MILLIS);
    }

    public MudbClient(final String host, final int port, final long timeoutMillis) {
        this.host = host;
        this.port = port;
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * 建立连接
     *
     * @throws IOException 连接失败
     * @throws InterruptedException 等待连接时被中断
     */
    public void connect() throws IOException, InterruptedException {
        group = new NioEventLoopGroup(1, new DefaultThreadFactory("mudb-cli"));
        final Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeoutMillis)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        final ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast(new RespReplyDecoder());
                        pipeline.addLast(new RespEncoder());
                        pipeline.addLast(replyHandler);
                    }
                });

        final ChannelFuture future = bootstrap.connect(host, port).await();
        if (!future.isSuccess()) {
            group.shutdownGracefully();
            throw new IOException("无法连接到 " + host + ":" + port, future.cause());
        }
        channel = future.channel();
        log.debug("已连接到 {}:{}", host, port);
    }

    public boolean isConnected() {
        return channel != null && channel.isActive();
    }

    /**
     * 发送一个请求并等待回复
     *
     * @param args 命令名与参数
     * @return 服务端回复，错误回复也作为返回值而不是异常
     * @throws IOException 连接不可用或在等待期间断开
     * @throws TimeoutException 超时未收到回复，连接随之关闭
     * @throws InterruptedException 等待时被中断
     */
    public synchronized Resp send(final String... args)
            throws IOException, TimeoutException, InterruptedException {
        if (!isConnected()) {
            throw new IOException("未连接到服务器");
        }

        final CompletableFuture<Resp> reply = replyHandler.expect();
        channel.writeAndFlush(RespArray.ofBulkStrings(args)).addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                reply.completeExceptionally(f.cause());
            }
        });

        try {
            return reply.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IOException("请求失败: " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            log.warn("等待回复超时 ({} ms)，关闭连接", timeoutMillis);
            channel.close().awaitUninterruptibly();
            throw e;
        }
    }

    @Override
    public void close() {
        if (channel != null) {
            channel.close().syncUninterruptibly();
        }
        if (group != null) {
            group.shutdownGracefully().syncUninterruptibly();
        }
    }

    /**
     * 把收到的回复交给当前等待的请求
     */
    @ChannelHandler.Sharable
    static class ReplyHandler extends SimpleChannelInboundHandler<Resp> {

        private volatile CompletableFuture<Resp> pending;

        CompletableFuture<Resp> expect() {
            final CompletableFuture<Resp> future = new CompletableFuture<>();
            pending = future;
            return future;
        }

        @Override
        protected void channelRead0(final ChannelHandlerContext ctx, final Resp msg) {
            final CompletableFuture<Resp> future = pending;
            pending = null;
            if (future == null) {
                log.warn("收到未预期的回复: {}", msg);
                return;
            }
            future.complete(msg);
        }

        @Override
        public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
            fail(new IOException("连接已被服务器关闭"));
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
            log.debug("客户端连接异常: {}", cause.getMessage());
            fail(cause);
            ctx.close();
        }

        private void fail(final Throwable cause) {
            final CompletableFuture<Resp> future = pending;
            pending = null;
            if (future != null) {
                future.completeExceptionally(cause);
            }
        }
    }
}
