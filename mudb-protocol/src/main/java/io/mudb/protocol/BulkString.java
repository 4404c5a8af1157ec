package io.mudb.protocol;

import io.mudb.datastructure.MuBytes;
import io.netty.buffer.ByteBuf;
import lombok.Getter;

/**
 * RESP批量字符串类型，编码为 "$len\r\nbytes\r\n"，二进制安全
 *
 * <p>内容为null时表示空回复，编码为 "$-1\r\n"。
 *
 * @author mudb
 * @since 1.0.0
 */
@Getter
public class BulkString extends Resp {
    /** null批量字符串的编码 */
    private static final byte[] NULL_BYTES = "$-1\r\n".getBytes();

    /** 空批量字符串的编码 */
    private static final byte[] EMPTY_BYTES = "$0\r\n\r\n".getBytes();

    /** 预定义的null批量字符串 */
    public static final BulkString NULL = new BulkString((MuBytes) null);

    /** 内容，null表示空回复 */
    private final MuBytes content;

    public BulkString(final MuBytes content) {
        this.content = content;
    }

    /**
     * 复制字节数组创建批量字符串
     *
     * @param content 字节内容
     */
    public BulkString(final byte[] content) {
        this.content = content == null ? null : new MuBytes(content);
    }

    /**
     * 零拷贝创建，调用者保证数组不再修改
     *
     * @param trustedContent 受信任的字节数组
     * @return BulkString 实例
     */
    public static BulkString wrapTrusted(final byte[] trustedContent) {
        if (trustedContent == null) {
            return NULL;
        }
        return new BulkString(MuBytes.wrapTrusted(trustedContent));
    }

    /**
     * 由字符串创建批量字符串
     *
     * @param value 字符串，null返回NULL
     * @return BulkString 实例
     */
    public static BulkString of(final String value) {
        return value == null ? NULL : new BulkString(MuBytes.fromString(value));
    }

    public boolean isNull() {
        return content == null;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        // 1. null 与空内容走预编码
        if (content == null) {
            byteBuf.writeBytes(NULL_BYTES);
            return;
        }
        final byte[] bytes = content.getBytesUnsafe();
        if (bytes.length == 0) {
            byteBuf.writeBytes(EMPTY_BYTES);
            return;
        }

        // 2. 长度前缀
        byteBuf.ensureWritable(bytes.length + 16);
        byteBuf.writeByte('$');
        writeNumber(byteBuf, bytes.length);
        byteBuf.writeBytes(CRLF);

        // 3. 内容原样写出
        byteBuf.writeBytes(bytes);
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof BulkString)) {
            return false;
        }
        final MuBytes other = ((BulkString) obj).content;
        return content == null ? other == null : content.equals(other);
    }

    @Override
    public int hashCode() {
        return content == null ? 0 : content.hashCode();
    }

    @Override
    public String toString() {
        return content == null ? "BulkString[null]" : "BulkString[" + content.getString() + "]";
    }
}
