package io.mudb.server.handler;

import io.mudb.command.CommandDispatcher;
import io.mudb.protocol.Errors;
import io.mudb.protocol.Resp;
import io.mudb.protocol.RespArray;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.timeout.IdleStateEvent;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * 连接处理器，每个连接一个实例
 *
 * <p>处理流程：
 * <ul>
 *   <li>收到 {@link RespArray}：交给分发器执行，写回回复
 *   <li>收到 {@link Errors}：解码器报告的协议错误，原样写回
 *   <li>其他类型：回复不支持的请求类型
 * </ul>
 *
 * <p>处理器运行在命令执行线程组上，Netty保证同一连接的事件总在同一线程按顺序处理，
 * 因此每个回复都在下一个请求开始之前写出。
 *
 * @author mudb
 * @since 1.0.0
 */
@Slf4j
public class RespCommandHandler extends SimpleChannelInboundHandler<Resp> {

    /** 不支持的请求类型 */
    private static final Errors UNSUPPORTED_REQUEST_ERROR = new Errors("ERR unsupported request type");

    /** 共享的命令分发器 */
    private final CommandDispatcher dispatcher;

    public RespCommandHandler(final CommandDispatcher dispatcher) {
        if (dispatcher == null) {
            throw new IllegalArgumentException("CommandDispatcher不能为null");
        }
        this.dispatcher = dispatcher;
    }

    @Override
    public void channelActive(final ChannelHandlerContext ctx) throws Exception {
        log.debug("连接建立: {}", ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final Resp msg) {
        final Resp response;
        if (msg instanceof RespArray) {
            response = dispatcher.dispatch((RespArray) msg);
        } else if (msg instanceof Errors) {
            response = msg;
        } else {
            response = UNSUPPORTED_REQUEST_ERROR;
        }
        writeResponse(ctx, response);
    }

    private void writeResponse(final ChannelHandlerContext ctx, final Resp response) {
        if (!ctx.channel().isActive()) {
            log.debug("连接已关闭，丢弃回复");
            return;
        }
        ctx.writeAndFlush(response);
    }

    @Override
    public void userEventTriggered(final ChannelHandlerContext ctx, final Object evt) throws Exception {
        if (evt instanceof IdleStateEvent) {
            log.info("连接空闲超时，关闭: {}", ctx.channel().remoteAddress());
            ctx.close();
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        if (cause instanceof IOException) {
            log.debug("连接I/O异常 {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        } else {
            log.error("连接异常: {}", cause.getMessage(), cause);
        }
        ctx.close();
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) {
        log.debug("连接关闭: {}", ctx.channel().remoteAddress());
        ctx.fireChannelInactive();
    }
}
