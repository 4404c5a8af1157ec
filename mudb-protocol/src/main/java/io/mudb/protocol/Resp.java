package io.mudb.protocol;

import io.netty.buffer.ByteBuf;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;

/**
 * RESP协议基础类
 *
 * <p>所有回复类型的基类，同时提供协议解码的公共工具方法。
 *
 * <p>支持的数据类型：
 * <ul>
 *     <li>简单字符串 - 以"+"开头</li>
 *     <li>错误消息 - 以"-"开头</li>
 *     <li>整数 - 以":"开头</li>
 *     <li>批量字符串 - 以"$"开头，长度前缀，二进制安全</li>
 *     <li>数组 - 以"*"开头</li>
 * </ul>
 *
 * <p>解码约定：
 * <ul>
 *     <li>数据不完整时返回null，读索引回到调用前的位置，等待更多数据后重试</li>
 *     <li>数据格式错误时抛出 {@link ProtocolException}，读索引同样回滚</li>
 * </ul>
 *
 * @author mudb
 * @since 1.0.0
 */
@Slf4j
public abstract class Resp {
    /** 行结束符 */
    public static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 单个批量字符串的最大长度 512MB */
    public static final int PROTO_MAX_BULK_LEN = 512 * 1024 * 1024;

    /** 单个数组的最大元素数量 */
    public static final int PROTO_MAX_ARRAY_LEN = 1024 * 1024;

    /** 数字行的最大长度，long 最多19位数字加符号 */
    static final int MAX_NUMBER_LINE = 20;

    /** 数字的字节表示缓存 */
    private static final byte[][] NUMBERS = new byte[512][];

    /** 最大缓存数字 */
    private static final int MAX_CACHED_NUMBER = 255;

    static {
        for (int i = 0; i <= MAX_CACHED_NUMBER; i++) {
            NUMBERS[i] = String.valueOf(i).getBytes(StandardCharsets.US_ASCII);
        }
        for (int i = 1; i <= MAX_CACHED_NUMBER; i++) {
            NUMBERS[i + 256] = String.valueOf(-i).getBytes(StandardCharsets.US_ASCII);
        }
    }

    /**
     * 将当前对象编码为RESP格式写入缓冲区
     *
     * @param byteBuf 输出缓冲区
     */
    public abstract void encode(ByteBuf byteBuf);

    /**
     * 写入十进制数字，常用数字走缓存
     *
     * @param buf 目标缓冲区
     * @param value 要写入的整数值
     */
    protected static void writeNumber(final ByteBuf buf, final long value) {
        if (value >= 0 && value <= MAX_CACHED_NUMBER) {
            buf.writeBytes(NUMBERS[(int) value]);
        } else if (value < 0 && value >= -MAX_CACHED_NUMBER) {
            buf.writeBytes(NUMBERS[(int) -value + 256]);
        } else {
            buf.writeBytes(Long.toString(value).getBytes(StandardCharsets.US_ASCII));
        }
    }

    /**
     * 单行类型（简单字符串、错误）的文本不能包含行结束符，把 \r 和 \n 替换为空格
     *
     * @param text 原始文本
     * @return 可以安全写入一行的文本
     */
    protected static String toSingleLine(final String text) {
        if (text.indexOf('\r') < 0 && text.indexOf('\n') < 0) {
            return text;
        }
        return text.replace('\r', ' ').replace('\n', ' ');
    }

    /**
     * 解码任意RESP类型
     * - SimpleString "+OK\r\n"
     * - Errors "-Error message\r\n"
     * - RespInteger ":0\r\n"
     * - BulkString "$6\r\nfoobar\r\n"，"$-1\r\n" 为null
     * - RespArray "*2\r\n$3\r\nfoo\r\n$3\r\nbar\r\n"，"*-1\r\n" 为null
     *
     * @param buffer 输入缓冲区
     * @return 解码后的对象，数据不完整时返回null
     * @throws ProtocolException 数据格式不符合协议时
     */
    public static Resp decode(final ByteBuf buffer) {
        final int initialIndex = buffer.readerIndex();
        try {
            return decodeValue(buffer);
        } catch (IncompleteFrameException e) {
            buffer.readerIndex(initialIndex);
            return null;
        } catch (ProtocolException e) {
            buffer.readerIndex(initialIndex);
            throw e;
        }
    }

    private static Resp decodeValue(final ByteBuf buffer) {
        requireReadable(buffer, 1);
        final byte typeIndicator = buffer.readByte();
        switch (typeIndicator) {
            case '+':
                return SimpleString.valueOf(readLine(buffer));
            case '-':
                return new Errors(readLine(buffer));
            case ':':
                return RespInteger.valueOf(readNumber(buffer));
            case '$':
                return readBulkString(buffer, true);
            case '*':
                final int count = readArrayLength(buffer);
                if (count < 0) {
                    return RespArray.NULL;
                }
                if (count == 0) {
                    return RespArray.EMPTY;
                }
                final Resp[] elements = new Resp[count];
                for (int i = 0; i < count; i++) {
                    elements[i] = decodeValue(buffer);
                }
                return new RespArray(elements);
            default:
                log.debug("无法识别的RESP类型标识: 0x{}", Integer.toHexString(typeIndicator & 0xFF));
                throw new ProtocolException("invalid type byte '" + printable(typeIndicator) + "'");
        }
    }

    /**
     * 读取数组长度行，类型标识 '*' 已被消费
     *
     * @param buffer 输入缓冲区
     * @return 元素数量，-1 表示null数组
     */
    static int readArrayLength(final ByteBuf buffer) {
        final long count = readNumber(buffer);
        if (count < -1 || count > PROTO_MAX_ARRAY_LEN) {
            throw new ProtocolException("invalid multibulk length");
        }
        return (int) count;
    }

    /**
     * 读取批量字符串，类型标识 '$' 已被消费。内容只按声明长度读取，不扫描分隔符。
     *
     * @param buffer 输入缓冲区
     * @param allowNull 是否允许 "$-1" 表示null
     * @return 批量字符串
     */
    static BulkString readBulkString(final ByteBuf buffer, final boolean allowNull) {
        final long length = readNumber(buffer);
        if (length == -1 && allowNull) {
            return BulkString.NULL;
        }
        if (length < 0 || length > PROTO_MAX_BULK_LEN) {
            throw new ProtocolException("invalid bulk length");
        }
        final int len = (int) length;
        requireReadable(buffer, len + 2);
        final byte[] content = new byte[len];
        buffer.readBytes(content);
        if (buffer.readByte() != '\r' || buffer.readByte() != '\n') {
            throw new ProtocolException("bulk string not terminated by CRLF");
        }
        return BulkString.wrapTrusted(content);
    }

    /**
     * 读取到 \r\n 为止的一行文本，用于SimpleString和Errors
     */
    static String readLine(final ByteBuf buffer) {
        final int start = buffer.readerIndex();
        final int cr = buffer.indexOf(start, buffer.writerIndex(), (byte) '\r');
        if (cr < 0 || cr + 1 >= buffer.writerIndex()) {
            throw IncompleteFrameException.INSTANCE;
        }
        final String line = buffer.toString(start, cr - start, StandardCharsets.UTF_8);
        buffer.readerIndex(cr);
        expectCrlf(buffer);
        return line;
    }

    /**
     * 读取到 \r\n 为止的十进制数字，支持负号，检查溢出
     */
    static long readNumber(final ByteBuf buffer) {
        final int start = buffer.readerIndex();
        final int searchEnd = Math.min(buffer.writerIndex(), start + MAX_NUMBER_LINE + 1);
        final int cr = buffer.indexOf(start, searchEnd, (byte) '\r');
        if (cr < 0) {
            if (searchEnd - start > MAX_NUMBER_LINE) {
                // 超长的数字行不可能再合法
                throw new ProtocolException("invalid length prefix");
            }
            throw IncompleteFrameException.INSTANCE;
        }
        if (cr + 1 >= buffer.writerIndex()) {
            throw IncompleteFrameException.INSTANCE;
        }

        final int length = cr - start;
        if (length == 0) {
            throw new ProtocolException("empty length prefix");
        }
        final boolean negative = buffer.getByte(start) == '-';
        final int digitsStart = negative ? start + 1 : start;
        if (digitsStart == cr) {
            throw new ProtocolException("invalid length prefix");
        }
        long value = 0;
        for (int i = digitsStart; i < cr; i++) {
            final byte b = buffer.getByte(i);
            if (b < '0' || b > '9') {
                throw new ProtocolException("invalid length prefix");
            }
            final int digit = b - '0';
            if (value > (Long.MAX_VALUE - digit) / 10) {
                throw new ProtocolException("number out of range");
            }
            value = value * 10 + digit;
        }

        buffer.readerIndex(cr);
        expectCrlf(buffer);
        return negative ? -value : value;
    }

    private static void expectCrlf(final ByteBuf buffer) {
        requireReadable(buffer, 2);
        if (buffer.readByte() != '\r' || buffer.readByte() != '\n') {
            throw new ProtocolException("expected CRLF");
        }
    }

    static void requireReadable(final ByteBuf buffer, final int bytes) {
        if (buffer.readableBytes() < bytes) {
            throw IncompleteFrameException.INSTANCE;
        }
    }

    static String printable(final byte b) {
        return b >= 32 && b <= 126 ? String.valueOf((char) b) : String.format("\\x%02x", b & 0xFF);
    }

    /**
     * 数据不完整的内部信号，不携带堆栈
     */
    static final class IncompleteFrameException extends RuntimeException {
        static final IncompleteFrameException INSTANCE = new IncompleteFrameException();

        private IncompleteFrameException() {
            super("incomplete frame", null, false, false);
        }
    }
}
