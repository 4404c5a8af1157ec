package io.mudb.protocol;

import io.mudb.datastructure.MuBytes;
import io.netty.buffer.ByteBuf;
import lombok.Getter;

/**
 * RESP错误类型，编码为 "-message\r\n"
 *
 * <p>消息文本的第一个单词是错误类别，例如 "ERR" 或 "WRONGTYPE"。
 * 消息中的 \r 和 \n 在构造时替换为空格，保证一个错误只占一行。
 *
 * @author mudb
 * @since 1.0.0
 */
@Getter
public class Errors extends Resp {
    /** 错误消息内容 */
    private final String content;

    /** 错误消息的字节表示 */
    private final MuBytes contentBytes;

    public Errors(final String content) {
        this.content = toSingleLine(content);
        this.contentBytes = MuBytes.fromString(this.content);
    }

    /**
     * 根据协议错误构造回复
     *
     * @param e 协议异常
     * @return "ERR Protocol error: ..." 错误
     */
    public static Errors protocolError(final ProtocolException e) {
        return new Errors("ERR Protocol error: " + e.getMessage());
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte('-');
        byteBuf.writeBytes(contentBytes.getBytesUnsafe());
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return "Errors[" + content + "]";
    }
}
