package io.mudb.command;

/**
 * 命令级错误，消息文本即返回给客户端的错误回复
 *
 * @author mudb
 * @since 1.0.0
 */
public class CommandException extends RuntimeException {

    public CommandException(final String message) {
        super(message, null, false, false);
    }

    public static CommandException unknownCommand(final String name) {
        return new CommandException("ERR unknown command '" + name + "'");
    }

    public static CommandException wrongArity(final CommandType type) {
        return new CommandException("ERR wrong number of arguments for '"
                + type.getCommandName().toLowerCase() + "' command");
    }

    public static CommandException notInteger() {
        return new CommandException("ERR value is not an integer or out of range");
    }
}
