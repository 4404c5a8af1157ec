package io.mudb.datastructure;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 二进制安全的不可变字节串，用作键、值以及命令参数的统一表示。
 *
 * <p>muDB中所有键和值都是任意字节序列，可以包含 {@code \r\n} 等协议分隔符，
 * 因此内部只保存 {@code byte[]}，字符串形式仅在需要时延迟生成。
 * <ul>
 *   <li>键的相等性按字节精确比较，预计算哈希值以加速HashMap查找</li>
 *   <li>命令名称池：预先创建muDB支持的命令名，解码和查表时复用</li>
 *   <li>零拷贝入口：{@link #wrapTrusted(byte[])} 仅供解码器等受信任路径使用</li>
 * </ul>
 *
 * <p>线程安全性：实例不可变，可在连接之间自由共享。
 *
 * @author mudb
 * @since 1.0.0
 */
public final class MuBytes {

    /** 字符串与字节互转使用的字符集 */
    public static final Charset CHARSET = StandardCharsets.UTF_8;

    /** 空字节串 */
    public static final MuBytes EMPTY = new MuBytes(new byte[0], true);

    /** 预览时最多展示的字节数 */
    private static final int PREVIEW_LENGTH = 16;

    /** 命令名称池，键为精确的大写命令名 */
    private static final Map<String, MuBytes> COMMAND_POOL = new ConcurrentHashMap<>(16);

    static {
        final String[] commands = {"PING", "SET", "GET", "DEL", "LPUSH", "RPUSH", "LRANGE", "LLEN"};
        for (final String cmd : commands) {
            final MuBytes bytes = new MuBytes(cmd.getBytes(CHARSET), true);
            bytes.stringValue = cmd;
            COMMAND_POOL.put(cmd, bytes);
        }
    }

    /** 底层字节数组，构造后不再修改 */
    private final byte[] bytes;

    /** 预计算的哈希值 */
    private final int hashCode;

    /** 是否为受信任数组（零拷贝） */
    private final boolean trusted;

    /** 延迟生成的字符串形式 */
    private volatile String stringValue;

    /**
     * 创建字节串，对入参执行防御性拷贝。
     *
     * @param bytes 源字节数组，不能为null
     * @throws IllegalArgumentException 如果bytes为null
     */
    public MuBytes(final byte[] bytes) {
        this(bytes, false);
    }

    private MuBytes(final byte[] bytes, final boolean trusted) {
        if (bytes == null) {
            throw new IllegalArgumentException("字节数组不能为null");
        }
        this.bytes = trusted ? bytes : bytes.clone();
        this.trusted = trusted;
        this.hashCode = Arrays.hashCode(this.bytes);
    }

    /**
     * 零拷贝创建字节串。
     *
     * <p><b>警告</b>：调用者必须保证数组此后不再被修改。
     *
     * @param trustedBytes 受信任的字节数组
     * @return 字节串实例，输入为null时返回null
     */
    public static MuBytes wrapTrusted(final byte[] trustedBytes) {
        if (trustedBytes == null) {
            return null;
        }
        return new MuBytes(trustedBytes, true);
    }

    /**
     * 由UTF-8字符串创建字节串，命中命令名称池时直接返回池中实例。
     *
     * @param str 源字符串
     * @return 字节串实例，输入为null时返回null
     */
    public static MuBytes fromString(final String str) {
        if (str == null) {
            return null;
        }
        if (str.isEmpty()) {
            return EMPTY;
        }
        // 只做精确匹配，"get" 与 "GET" 是两个不同的键
        final MuBytes pooled = COMMAND_POOL.get(str);
        if (pooled != null) {
            return pooled;
        }
        final MuBytes created = new MuBytes(str.getBytes(CHARSET), true);
        created.stringValue = str;
        return created;
    }

    /**
     * 获取字节数组。非受信任实例返回副本。
     *
     * @return 字节数组
     */
    public byte[] getBytes() {
        return trusted ? bytes : bytes.clone();
    }

    /**
     * 获取底层数组的直接引用，调用者不得修改返回值。
     *
     * @return 底层字节数组
     */
    public byte[] getBytesUnsafe() {
        return bytes;
    }

    /**
     * 获取UTF-8字符串形式，非法字节按替换字符处理。
     *
     * @return 字符串
     */
    public String getString() {
        String result = stringValue;
        if (result == null) {
            result = new String(bytes, CHARSET);
            stringValue = result;
        }
        return result;
    }

    /**
     * 返回ASCII大写形式，非字母字节保持不变。
     *
     * @return 大写字节串，本身已是大写时返回this
     */
    public MuBytes toUpperCase() {
        byte[] upper = null;
        for (int i = 0; i < bytes.length; i++) {
            final byte b = bytes[i];
            if (b >= 'a' && b <= 'z') {
                if (upper == null) {
                    upper = bytes.clone();
                }
                upper[i] = toUpper(b);
            }
        }
        return upper == null ? this : new MuBytes(upper, true);
    }

    private static byte toUpper(final byte b) {
        return b >= 'a' && b <= 'z' ? (byte) (b - 32) : b;
    }

    public int length() {
        return bytes.length;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof MuBytes)) {
            return false;
        }
        final MuBytes other = (MuBytes) obj;
        return hashCode == other.hashCode && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append("MuBytes[length=").append(bytes.length).append(", preview='");
        final int limit = Math.min(bytes.length, PREVIEW_LENGTH);
        for (int i = 0; i < limit; i++) {
            final byte b = bytes[i];
            if (b >= 32 && b <= 126) {
                sb.append((char) b);
            } else {
                sb.append("\\x").append(String.format("%02x", b & 0xFF));
            }
        }
        if (bytes.length > PREVIEW_LENGTH) {
            sb.append("...");
        }
        return sb.append("']").toString();
    }
}
