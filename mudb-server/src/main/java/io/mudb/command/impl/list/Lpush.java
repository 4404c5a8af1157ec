package io.mudb.command.impl.list;

import io.mudb.command.Command;
import io.mudb.command.CommandType;
import io.mudb.core.MuCore;
import io.mudb.datastructure.MuBytes;
import io.mudb.protocol.BulkString;
import io.mudb.protocol.Resp;
import io.mudb.protocol.RespInteger;

/**
 * LPUSH命令实现 - 将一个或多个值逐个插入到列表头部
 * 语法: LPUSH key value1 [value2 ...]
 *
 * <p>LPUSH k a b c 之后列表为 [c, b, a]。
 *
 * @author mudb
 * @since 1.0.0
 */
public class Lpush implements Command {

    private final MuCore core;

    private MuBytes key;

    private MuBytes[] elements;

    public Lpush(final MuCore core) {
        this.core = core;
    }

    @Override
    public CommandType getType() {
        return CommandType.LPUSH;
    }

    @Override
    public void setContext(final Resp[] array) {
        // 1. 解析键名
        key = ((BulkString) array[1]).getContent();

        // 2. 解析要插入的元素
        elements = new MuBytes[array.length - 2];
        for (int i = 2; i < array.length; i++) {
            elements[i - 2] = ((BulkString) array[i]).getContent();
        }
    }

    @Override
    public Resp handle() {
        return RespInteger.valueOf(core.lpush(key, elements));
    }
}
