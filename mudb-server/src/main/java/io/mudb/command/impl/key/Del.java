package io.mudb.command.impl.key;

import io.mudb.command.Command;
import io.mudb.command.CommandType;
import io.mudb.core.MuCore;
import io.mudb.datastructure.MuBytes;
import io.mudb.protocol.BulkString;
import io.mudb.protocol.Resp;
import io.mudb.protocol.RespInteger;

/**
 * DEL命令实现
 * 语法: DEL key [key ...]
 *
 * <p>回复实际删除的键数量，不存在的键不计数。
 *
 * @author mudb
 * @since 1.0.0
 */
public class Del implements Command {

    private final MuCore core;

    private MuBytes[] keys;

    public Del(final MuCore core) {
        this.core = core;
    }

    @Override
    public CommandType getType() {
        return CommandType.DEL;
    }

    @Override
    public void setContext(final Resp[] array) {
        keys = new MuBytes[array.length - 1];
        for (int i = 1; i < array.length; i++) {
            keys[i - 1] = ((BulkString) array[i]).getContent();
        }
    }

    @Override
    public Resp handle() {
        return RespInteger.valueOf(core.delete(keys));
    }
}
