package io.mudb.command.impl.string;

import io.mudb.command.Command;
import io.mudb.command.CommandType;
import io.mudb.core.MuCore;
import io.mudb.datastructure.MuBytes;
import io.mudb.protocol.BulkString;
import io.mudb.protocol.Resp;
import io.mudb.protocol.SimpleString;

/**
 * SET命令实现
 * 语法: SET key value
 *
 * <p>无条件覆盖已有的值，包括列表。
 *
 * @author mudb
 * @since 1.0.0
 */
public class Set implements Command {

    private final MuCore core;

    private MuBytes key;

    private MuBytes value;

    public Set(final MuCore core) {
        this.core = core;
    }

    @Override
    public CommandType getType() {
        return CommandType.SET;
    }

    @Override
    public void setContext(final Resp[] array) {
        key = ((BulkString) array[1]).getContent();
        value = ((BulkString) array[2]).getContent();
    }

    @Override
    public Resp handle() {
        core.set(key, value);
        return SimpleString.OK;
    }
}
