package io.mudb.command.impl.list;

import io.mudb.command.Command;
import io.mudb.command.CommandException;
import io.mudb.command.CommandType;
import io.mudb.core.MuCore;
import io.mudb.datastructure.MuBytes;
import io.mudb.protocol.BulkString;
import io.mudb.protocol.Resp;
import io.mudb.protocol.RespArray;

import java.util.List;

/**
 * LRANGE命令实现
 * 语法: LRANGE key start stop
 *
 * <p>下标从0开始，负数从尾部计数，两端都包含。范围为空或键不存在时回复空数组。
 *
 * @author mudb
 * @since 1.0.0
 */
public class Lrange implements Command {

    private final MuCore core;

    private MuBytes key;

    private long start;

    private long stop;

    public Lrange(final MuCore core) {
        this.core = core;
    }

    @Override
    public CommandType getType() {
        return CommandType.LRANGE;
    }

    @Override
    public void setContext(final Resp[] array) {
        key = ((BulkString) array[1]).getContent();
        start = parseIndex(((BulkString) array[2]).getContent());
        stop = parseIndex(((BulkString) array[3]).getContent());
    }

    /**
     * 解析十进制有符号整数，只接受ASCII数字和开头的负号
     */
    static long parseIndex(final MuBytes bytes) {
        final String text = bytes.getString();
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if ((c < '0' || c > '9') && !(c == '-' && i == 0)) {
                throw CommandException.notInteger();
            }
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw CommandException.notInteger();
        }
    }

    @Override
    public Resp handle() {
        final List<MuBytes> range = core.lrange(key, start, stop);
        if (range.isEmpty()) {
            return RespArray.EMPTY;
        }
        final Resp[] elements = new Resp[range.size()];
        for (int i = 0; i < elements.length; i++) {
            elements[i] = new BulkString(range.get(i));
        }
        return new RespArray(elements);
    }
}
