package io.mudb.protocol.handler;

import io.mudb.protocol.BulkString;
import io.mudb.protocol.Resp;
import io.mudb.protocol.RespArray;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import lombok.extern.slf4j.Slf4j;

/**
 * RESP协议编码器
 *
 * <p>把 {@link Resp} 编码后写入连接。服务端用它写回复，客户端用它写请求。
 *
 * @author mudb
 * @since 1.0.0
 */
@Slf4j
public class RespEncoder extends MessageToByteEncoder<Resp> {

    @Override
    protected void encode(final ChannelHandlerContext ctx, final Resp msg, final ByteBuf out) {
        out.ensureWritable(estimateMessageSize(msg));
        msg.encode(out);
        if (log.isDebugEnabled()) {
            log.debug("编码RESP消息: {} ({} bytes)", msg.getClass().getSimpleName(), out.readableBytes());
        }
    }

    /**
     * 估算编码后的大小，用于预分配
     *
     * @param msg RESP消息对象
     * @return 估算的字节数
     */
    static int estimateMessageSize(final Resp msg) {
        if (msg instanceof BulkString) {
            final BulkString bulkString = (BulkString) msg;
            return bulkString.isNull() ? 5 : bulkString.getContent().length() + 16;
        }
        if (msg instanceof RespArray) {
            final Resp[] content = ((RespArray) msg).getContent();
            if (content == null) {
                return 5;
            }
            int totalSize = 16;
            for (final Resp element : content) {
                totalSize += estimateMessageSize(element);
            }
            return totalSize;
        }
        return 32;
    }
}
