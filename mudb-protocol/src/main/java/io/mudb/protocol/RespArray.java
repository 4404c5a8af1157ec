package io.mudb.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

import java.util.Arrays;
import java.util.List;

/**
 * RESP数组类型
 *
 * <p>预定义实例：
 * <ul>
 *     <li>EMPTY - 空数组，对应"*0\r\n"</li>
 *     <li>NULL - null数组，对应"*-1\r\n"</li>
 * </ul>
 *
 * @author mudb
 * @since 1.0.0
 */
@Getter
public class RespArray extends Resp {
    private static final byte[] NULL_ARRAY_BYTES = "*-1\r\n".getBytes();

    private static final byte[] EMPTY_ARRAY_BYTES = "*0\r\n".getBytes();

    /** 预定义的空数组实例 */
    public static final RespArray EMPTY = new RespArray(new Resp[0]);

    /** 预定义的null数组实例 */
    public static final RespArray NULL = new RespArray((Resp[]) null);

    /** 数组内容，null表示null数组 */
    private final Resp[] content;

    public RespArray(final Resp[] content) {
        this.content = content;
    }

    /**
     * 工厂方法：空数组与null数组返回缓存实例
     *
     * @param content 数组内容
     * @return RespArray 实例
     */
    public static RespArray valueOf(final Resp[] content) {
        if (content == null) {
            return NULL;
        }
        if (content.length == 0) {
            return EMPTY;
        }
        return new RespArray(content);
    }

    /**
     * 由字符串参数构造请求数组，每个参数编码为批量字符串
     *
     * @param args 参数
     * @return 请求数组
     */
    public static RespArray ofBulkStrings(final String... args) {
        final Resp[] elements = new Resp[args.length];
        for (int i = 0; i < args.length; i++) {
            elements[i] = BulkString.of(args[i]);
        }
        return valueOf(elements);
    }

    /**
     * 由元素列表构造数组
     *
     * @param elements 元素
     * @return RespArray 实例
     */
    public static RespArray of(final List<? extends Resp> elements) {
        return valueOf(elements.toArray(new Resp[0]));
    }

    public boolean isNull() {
        return content == null;
    }

    public int size() {
        return content == null ? 0 : content.length;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        // 1. 处理null数组
        if (content == null) {
            byteBuf.writeBytes(NULL_ARRAY_BYTES);
            return;
        }

        // 2. 处理空数组
        if (content.length == 0) {
            byteBuf.writeBytes(EMPTY_ARRAY_BYTES);
            return;
        }

        // 3. 写入数组头
        byteBuf.writeByte('*');
        writeNumber(byteBuf, content.length);
        byteBuf.writeBytes(CRLF);

        // 4. 按顺序编码所有元素
        for (final Resp element : content) {
            element.encode(byteBuf);
        }
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof RespArray && Arrays.equals(content, ((RespArray) obj).content);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return content == null ? "RespArray[null]" : "RespArray" + Arrays.toString(content);
    }
}
