package io.mudb.protocol;

import io.mudb.datastructure.MuBytes;
import io.netty.buffer.ByteBuf;
import lombok.Getter;

/**
 * RESP简单字符串类型，编码为 "+text\r\n"
 *
 * <p>预定义常量：
 * <ul>
 *     <li>OK - 成功响应</li>
 *     <li>PONG - 心跳响应</li>
 * </ul>
 *
 * @author mudb
 * @since 1.0.0
 */
@Getter
public class SimpleString extends Resp {
    /** 预定义的成功响应 */
    public static final SimpleString OK = new SimpleString("OK");

    /** 预定义的心跳响应 */
    public static final SimpleString PONG = new SimpleString("PONG");

    /** 字符串内容 */
    private final String content;

    /** 字符串的字节表示 */
    private final MuBytes contentBytes;

    public SimpleString(final String content) {
        this.content = toSingleLine(content);
        this.contentBytes = MuBytes.fromString(this.content);
    }

    /**
     * 工厂方法，常用响应返回缓存实例
     *
     * @param content 字符串内容
     * @return SimpleString 实例
     */
    public static SimpleString valueOf(final String content) {
        if ("OK".equals(content)) {
            return OK;
        } else if ("PONG".equals(content)) {
            return PONG;
        }
        return new SimpleString(content);
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte('+');
        byteBuf.writeBytes(contentBytes.getBytesUnsafe());
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return "SimpleString[" + content + "]";
    }
}
