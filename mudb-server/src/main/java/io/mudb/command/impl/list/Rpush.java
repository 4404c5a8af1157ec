package io.mudb.command.impl.list;

import io.mudb.command.Command;
import io.mudb.command.CommandType;
import io.mudb.core.MuCore;
import io.mudb.datastructure.MuBytes;
import io.mudb.protocol.BulkString;
import io.mudb.protocol.Resp;
import io.mudb.protocol.RespInteger;

/**
 * RPUSH命令实现 - 将一个或多个值插入到列表尾部
 * 语法: RPUSH key value1 [value2 ...]
 *
 * @author mudb
 * @since 1.0.0
 */
public class Rpush implements Command {

    private final MuCore core;

    private MuBytes key;

    private MuBytes[] elements;

    public Rpush(final MuCore core) {
        this.core = core;
    }

    @Override
    public CommandType getType() {
        return CommandType.RPUSH;
    }

    @Override
    public void setContext(final Resp[] array) {
        key = ((BulkString) array[1]).getContent();
        elements = new MuBytes[array.length - 2];
        for (int i = 2; i < array.length; i++) {
            elements[i - 2] = ((BulkString) array[i]).getContent();
        }
    }

    @Override
    public Resp handle() {
        // 整批元素在一次加锁内推入，其他连接不会看到部分结果
        return RespInteger.valueOf(core.rpush(key, elements));
    }
}
