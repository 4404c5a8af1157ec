package io.mudb.cli;

import io.mudb.datastructure.MuBytes;
import io.mudb.protocol.BulkString;
import io.mudb.protocol.Errors;
import io.mudb.protocol.Resp;
import io.mudb.protocol.RespArray;
import io.mudb.protocol.RespInteger;
import io.mudb.protocol.SimpleString;

/**
 * 把服务端回复渲染为可读文本
 *
 * <p>渲染规则：
 * <ul>
 *     <li>简单字符串原样输出，例如 OK</li>
 *     <li>错误输出为 (error) 加错误信息</li>
 *     <li>整数输出为 (integer) 加数值</li>
 *     <li>批量字符串加双引号，不可打印字节转义为 \xNN</li>
 *     <li>null批量字符串与null数组输出 (nil)，空数组输出 (empty array)</li>
 *     <li>数组元素逐行编号，嵌套数组按编号宽度缩进</li>
 * </ul>
 *
 * @author mudb
 * @since 1.0.0
 */
public final class ReplyFormatter {

    private ReplyFormatter() {
    }

    public static String format(final Resp reply) {
        if (reply instanceof SimpleString) {
            return ((SimpleString) reply).getContent();
        }
        if (reply instanceof Errors) {
            return "(error) " + ((Errors) reply).getContent();
        }
        if (reply instanceof RespInteger) {
            return "(integer) " + ((RespInteger) reply).getContent();
        }
        if (reply instanceof BulkString) {
            final BulkString bulk = (BulkString) reply;
            return bulk.isNull() ? "(nil)" : quote(bulk.getContent());
        }
        if (reply instanceof RespArray) {
            return formatArray((RespArray) reply);
        }
        throw new IllegalArgumentException("不支持的回复类型: " + reply);
    }

    private static String formatArray(final RespArray array) {
        if (array.isNull()) {
            return "(nil)";
        }
        final Resp[] elements = array.getContent();
        if (elements.length == 0) {
            return "(empty array)";
        }

        final int width = String.valueOf(elements.length).length();
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < elements.length; i++) {
            if (i > 0) {
                sb.append('\n');
            }
            final String prefix = pad(String.valueOf(i + 1), width) + ") ";
            final String indent = " ".repeat(prefix.length());
            final String[] lines = format(elements[i]).split("\n", -1);
            sb.append(prefix).append(lines[0]);
            for (int j = 1; j < lines.length; j++) {
                sb.append('\n').append(indent).append(lines[j]);
            }
        }
        return sb.toString();
    }

    private static String pad(final String number, final int width) {
        return " ".repeat(width - number.length()) + number;
    }

    /**
     * 双引号包裹，转义引号、反斜杠、常见控制字符和非ASCII字节
     */
    static String quote(final MuBytes value) {
        final byte[] bytes = value.getBytesUnsafe();
        final StringBuilder sb = new StringBuilder(bytes.length + 2);
        sb.append('"');
        for (final byte b : bytes) {
            switch (b) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    if (b >= 32 && b <= 126) {
                        sb.append((char) b);
                    } else {
                        sb.append(String.format("\\x%02x", b & 0xFF));
                    }
            }
        }
        return sb.append('"').toString();
    }
}
