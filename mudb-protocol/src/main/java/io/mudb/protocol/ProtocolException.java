package io.mudb.protocol;

/**
 * RESP协议格式错误
 *
 * <p>解码时发现字节流不符合协议格式时抛出，例如长度前缀非数字、
 * 请求数组中出现非批量字符串元素、批量内容后缺少 \r\n 等。
 * 消息文本会被拼接进 "ERR Protocol error: " 回复中返回给客户端。
 *
 * @author mudb
 * @since 1.0.0
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(final String message) {
        super(message);
    }
}
