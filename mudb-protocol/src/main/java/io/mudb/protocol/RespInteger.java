package io.mudb.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

/**
 * RESP整数类型，编码为 ":value\r\n"，取值范围为64位有符号整数
 *
 * <p>-10 到 127 之间的值使用缓存实例。
 *
 * @author mudb
 * @since 1.0.0
 */
@Getter
public class RespInteger extends Resp {
    /** 缓存的最小值 */
    private static final int CACHE_LOW = -10;

    /** 缓存的最大值 */
    private static final int CACHE_HIGH = 127;

    private static final RespInteger[] CACHE = new RespInteger[CACHE_HIGH - CACHE_LOW + 1];

    static {
        for (int i = 0; i < CACHE.length; i++) {
            CACHE[i] = new RespInteger(i + CACHE_LOW);
        }
    }

    /** 预定义的0 */
    public static final RespInteger ZERO = CACHE[-CACHE_LOW];

    /** 预定义的1 */
    public static final RespInteger ONE = CACHE[1 - CACHE_LOW];

    /** 整数值 */
    private final long content;

    public RespInteger(final long content) {
        this.content = content;
    }

    /**
     * 工厂方法，缓存范围内返回共享实例
     *
     * @param value 整数值
     * @return RespInteger 实例
     */
    public static RespInteger valueOf(final long value) {
        if (value >= CACHE_LOW && value <= CACHE_HIGH) {
            return CACHE[(int) value - CACHE_LOW];
        }
        return new RespInteger(value);
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte(':');
        writeNumber(byteBuf, content);
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof RespInteger && ((RespInteger) obj).content == content;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(content);
    }

    @Override
    public String toString() {
        return "RespInteger[" + content + "]";
    }
}
