package io.mudb.command.impl.string;

import io.mudb.command.Command;
import io.mudb.command.CommandType;
import io.mudb.core.MuCore;
import io.mudb.datastructure.MuBytes;
import io.mudb.protocol.BulkString;
import io.mudb.protocol.Resp;

/**
 * GET命令实现
 * 语法: GET key
 *
 * @author mudb
 * @since 1.0.0
 */
public class Get implements Command {

    private final MuCore core;

    private MuBytes key;

    public Get(final MuCore core) {
        this.core = core;
    }

    @Override
    public CommandType getType() {
        return CommandType.GET;
    }

    @Override
    public void setContext(final Resp[] array) {
        key = ((BulkString) array[1]).getContent();
    }

    @Override
    public Resp handle() {
        final MuBytes value = core.get(key);
        return value == null ? BulkString.NULL : new BulkString(value);
    }
}
