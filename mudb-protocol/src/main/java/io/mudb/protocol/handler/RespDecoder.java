package io.mudb.protocol.handler;

import io.mudb.protocol.BulkString;
import io.mudb.protocol.Errors;
import io.mudb.protocol.ProtocolException;
import io.mudb.protocol.RequestBuilder;
import io.mudb.protocol.Resp;
import io.mudb.protocol.RespArray;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 服务端请求解码器
 *
 * <p>把客户端字节流切分为一个个请求，输出 {@link RespArray}。支持两种格式：
 * <ul>
 *     <li>RESP格式 - "*2\r\n$3\r\nGET\r\n$1\r\nk\r\n"</li>
 *     <li>INLINE格式 - "GET k\r\n"，按空白分隔</li>
 * </ul>
 *
 * <p>RESP数组由 {@link RequestBuilder} 增量解析，已读完的参数不会因为后续数据不完整而重复解析。
 * INLINE命令在读到整行之前不消费任何字节。
 *
 * <p>协议错误时向下游输出一个 {@link Errors}（"ERR Protocol error: ..."），然后在同一连接上继续解码：
 * <ul>
 *     <li>单行帧出错（INLINE命令，或以 + - : $ 开头的帧）时只丢弃这一行</li>
 *     <li>RESP数组内部出错时，数组的边界已不可信，丢弃字节直到下一个以 '*' 开头的行</li>
 * </ul>
 * 协议错误不会关闭连接。
 *
 * <p>非共享处理器，每个连接一个实例。
 *
 * @author mudb
 * @since 1.0.0
 */
@Slf4j
public class RespDecoder extends ByteToMessageDecoder {

    /** 最大内联命令长度限制 */
    private static final int MAX_INLINE_LENGTH = 64 * 1024;

    /** 当前连接的RESP数组解析状态 */
    private final RequestBuilder requestBuilder = new RequestBuilder();

    /** 单行帧出错后，是否正在丢弃该行的剩余部分 */
    private boolean skippingLine;

    /** RESP数组出错后，是否正在丢弃字节等待下一个数组 */
    private boolean discarding;

    /** 丢弃状态下，当前位置是否为行首 */
    private boolean atLineStart;

    @Override
    protected void decode(final ChannelHandlerContext ctx, final ByteBuf in, final List<Object> out) {
        while (in.isReadable()) {
            // 1. 协议错误后先重新同步
            if (skippingLine && !skipToLineEnd(in)) {
                return;
            }
            if (discarding && !discardUntilFrameStart(in)) {
                return;
            }
            if (!in.isReadable()) {
                return;
            }

            final boolean inArray = requestBuilder.isInProgress();
            final byte firstByte = in.getByte(in.readerIndex());

            // 2. 跳过请求之间的空行
            if (!inArray && (firstByte == '\r' || firstByte == '\n')) {
                in.skipBytes(1);
                continue;
            }

            final boolean arrayFrame = inArray || firstByte == '*';
            try {
                final RespArray request;
                if (arrayFrame || isRespType(firstByte)) {
                    request = requestBuilder.feed(in);
                } else {
                    request = decodeInlineCommand(in);
                }
                if (request == null) {
                    // 数据不完整，等待更多数据
                    return;
                }
                if (request.size() == 0) {
                    // "*0" 与 "*-1" 是空请求，不回复
                    continue;
                }
                out.add(request);
                if (log.isDebugEnabled()) {
                    log.debug("解码请求: {} 个参数", request.size());
                }
            } catch (ProtocolException e) {
                log.warn("协议错误 {}: {}", ctx.channel().remoteAddress(), e.getMessage());
                out.add(Errors.protocolError(e));
                if (arrayFrame) {
                    discarding = true;
                    atLineStart = false;
                } else {
                    skippingLine = true;
                }
            }
        }
    }

    /**
     * 丢弃当前行，包括行尾的 \n
     *
     * @param in 输入缓冲区
     * @return 已到达行尾返回true，缓冲区耗尽返回false
     */
    private boolean skipToLineEnd(final ByteBuf in) {
        final int lf = in.indexOf(in.readerIndex(), in.writerIndex(), (byte) '\n');
        if (lf < 0) {
            in.skipBytes(in.readableBytes());
            return false;
        }
        in.readerIndex(lf + 1);
        skippingLine = false;
        return true;
    }

    /**
     * 丢弃字节直到某一行以 '*' 开头
     *
     * @param in 输入缓冲区
     * @return 找到请求开头返回true，缓冲区耗尽返回false
     */
    private boolean discardUntilFrameStart(final ByteBuf in) {
        while (in.isReadable()) {
            final byte b = in.getByte(in.readerIndex());
            if (atLineStart && b == '*') {
                discarding = false;
                return true;
            }
            in.skipBytes(1);
            atLineStart = b == '\n';
        }
        return false;
    }

    /**
     * 解码INLINE格式命令（如：PING\r\n）
     *
     * @param in 输入缓冲区
     * @return 请求数组，数据不完整返回null，空行返回空数组
     */
    private RespArray decodeInlineCommand(final ByteBuf in) {
        final int startIndex = in.readerIndex();
        final int searchEnd = Math.min(in.writerIndex(), startIndex + MAX_INLINE_LENGTH + 1);

        // 1. 查找行结束符 \n
        final int lf = in.indexOf(startIndex, searchEnd, (byte) '\n');
        if (lf < 0) {
            if (searchEnd - startIndex > MAX_INLINE_LENGTH) {
                throw new ProtocolException("too big inline request");
            }
            return null;
        }

        // 2. 去掉可选的 \r
        int lineEnd = lf;
        if (lineEnd > startIndex && in.getByte(lineEnd - 1) == '\r') {
            lineEnd--;
        }
        final String commandLine = in.toString(startIndex, lineEnd - startIndex, StandardCharsets.UTF_8);
        in.readerIndex(lf + 1);

        // 3. 按空白切分参数
        final List<BulkString> parts = parseCommandParts(commandLine);
        if (parts.isEmpty()) {
            return RespArray.EMPTY;
        }
        log.debug("解析INLINE命令: {}", commandLine);
        return new RespArray(parts.toArray(new Resp[0]));
    }

    private static List<BulkString> parseCommandParts(final String commandLine) {
        final List<BulkString> parts = new ArrayList<>(4);
        final StringBuilder current = new StringBuilder();
        for (int i = 0; i < commandLine.length(); i++) {
            final char c = commandLine.charAt(i);
            if (Character.isWhitespace(c)) {
                if (current.length() > 0) {
                    parts.add(BulkString.wrapTrusted(current.toString().getBytes(StandardCharsets.UTF_8)));
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            parts.add(BulkString.wrapTrusted(current.toString().getBytes(StandardCharsets.UTF_8)));
        }
        return parts;
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        log.error("RespDecoder异常: {}", cause.getMessage(), cause);
        ctx.close();
    }

    private static boolean isRespType(final byte b) {
        return b == '+' || b == '-' || b == ':' || b == '$' || b == '*';
    }
}
