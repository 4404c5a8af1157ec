package io.mudb.cli;

import io.mudb.protocol.Resp;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import java.util.List;

/**
 * 客户端回复解码器
 *
 * <p>服务端回复可以是任意RESP类型，直接使用 {@link Resp#decode(ByteBuf)}。
 * 格式错误时抛出的 {@link io.mudb.protocol.ProtocolException} 由Netty包装后交给后续处理器。
 *
 * @author mudb
 * @since 1.0.0
 */
public class RespReplyDecoder extends ByteToMessageDecoder {

    @Override
    protected void decode(final ChannelHandlerContext ctx, final ByteBuf in, final List<Object> out) {
        while (in.isReadable()) {
            final Resp reply = Resp.decode(in);
            if (reply == null) {
                return;
            }
            out.add(reply);
        }
    }
}
