package io.mudb.command.impl;

import io.mudb.command.Command;
import io.mudb.command.CommandType;
import io.mudb.protocol.BulkString;
import io.mudb.protocol.Resp;
import io.mudb.protocol.SimpleString;

/**
 * PING命令实现
 * 语法: PING [message]
 *
 * <p>无参数时回复 +PONG，带参数时原样回显。
 *
 * @author mudb
 * @since 1.0.0
 */
public class Ping implements Command {

    private BulkString message;

    @Override
    public CommandType getType() {
        return CommandType.PING;
    }

    @Override
    public void setContext(final Resp[] array) {
        message = array.length > 1 ? (BulkString) array[1] : null;
    }

    @Override
    public Resp handle() {
        return message == null ? SimpleString.PONG : message;
    }
}
