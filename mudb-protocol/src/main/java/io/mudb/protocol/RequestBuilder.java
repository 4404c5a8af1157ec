package io.mudb.protocol;

import io.netty.buffer.ByteBuf;

import java.util.ArrayList;
import java.util.List;

/**
 * 客户端请求的增量解析器
 *
 * <p>请求是由批量字符串组成的数组，例如 "*2\r\n$3\r\nGET\r\n$1\r\nk\r\n"。
 * 大数组可能分多次到达：已经完整读到的参数保存在本对象中并从缓冲区消费掉，
 * 下次只从尚未完成的参数继续，已消费的字节不会被重复解析。
 *
 * <p>与 {@link Resp#decode(ByteBuf)} 不同，请求中不允许出现其他类型元素，也不允许 null 批量字符串。
 *
 * <p>非线程安全，每个连接一个实例。
 *
 * @author mudb
 * @since 1.0.0
 */
public class RequestBuilder {

    /** 参数列表的初始容量上限，更大的数组随参数到达逐步扩容 */
    private static final int MAX_INITIAL_CAPACITY = 1024;

    /** 当前数组声明的参数个数 */
    private int expected;

    /** 已读到的参数，null表示没有正在解析的数组 */
    private List<Resp> args;

    /**
     * 是否有一个数组解析到一半
     *
     * @return 已读到数组头但参数尚未读完时返回true
     */
    public boolean isInProgress() {
        return args != null;
    }

    /**
     * 从缓冲区继续解析当前请求
     *
     * <p>数据不完整时只回退未完成的那一部分，已完成的参数保留。
     * 协议错误时丢弃已读到的参数，读索引回到出错部分的开头。
     *
     * @param buffer 输入缓冲区，没有进行中的数组时读索引应指向 '*'
     * @return 完整的请求；"*0" 与 "*-1" 分别返回 {@link RespArray#EMPTY} 和 {@link RespArray#NULL}；
     *         数据不完整时返回null
     * @throws ProtocolException 数据格式不符合协议时
     */
    public RespArray feed(final ByteBuf buffer) {
        while (true) {
            final int start = buffer.readerIndex();
            try {
                if (args == null) {
                    // 1. 数组头
                    final int count = readHeader(buffer);
                    if (count < 0) {
                        return RespArray.NULL;
                    }
                    if (count == 0) {
                        return RespArray.EMPTY;
                    }
                    expected = count;
                    args = new ArrayList<>(Math.min(count, MAX_INITIAL_CAPACITY));
                } else if (args.size() < expected) {
                    // 2. 逐个读取参数
                    args.add(readArgument(buffer));
                } else {
                    // 3. 参数读齐
                    final RespArray request = new RespArray(args.toArray(new Resp[0]));
                    reset();
                    return request;
                }
            } catch (Resp.IncompleteFrameException e) {
                buffer.readerIndex(start);
                return null;
            } catch (ProtocolException e) {
                buffer.readerIndex(start);
                reset();
                throw e;
            }
        }
    }

    /**
     * 放弃正在解析的数组
     */
    public void reset() {
        args = null;
        expected = 0;
    }

    private static int readHeader(final ByteBuf buffer) {
        Resp.requireReadable(buffer, 1);
        final byte first = buffer.readByte();
        if (first != '*') {
            throw new ProtocolException("expected '*', got '" + Resp.printable(first) + "'");
        }
        return Resp.readArrayLength(buffer);
    }

    private static BulkString readArgument(final ByteBuf buffer) {
        Resp.requireReadable(buffer, 1);
        final byte type = buffer.readByte();
        if (type != '$') {
            throw new ProtocolException("expected '$', got '" + Resp.printable(type) + "'");
        }
        return Resp.readBulkString(buffer, false);
    }
}
