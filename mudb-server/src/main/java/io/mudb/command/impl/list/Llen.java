package io.mudb.command.impl.list;

import io.mudb.command.Command;
import io.mudb.command.CommandType;
import io.mudb.core.MuCore;
import io.mudb.datastructure.MuBytes;
import io.mudb.protocol.BulkString;
import io.mudb.protocol.Resp;
import io.mudb.protocol.RespInteger;

/**
 * LLEN命令实现
 * 语法: LLEN key
 *
 * @author mudb
 * @since 1.0.0
 */
public class Llen implements Command {

    private final MuCore core;

    private MuBytes key;

    public Llen(final MuCore core) {
        this.core = core;
    }

    @Override
    public CommandType getType() {
        return CommandType.LLEN;
    }

    @Override
    public void setContext(final Resp[] array) {
        key = ((BulkString) array[1]).getContent();
    }

    @Override
    public Resp handle() {
        return RespInteger.valueOf(core.llen(key));
    }
}
