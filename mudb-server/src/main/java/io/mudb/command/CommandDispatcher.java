package io.mudb.command;

import io.mudb.core.MuCore;
import io.mudb.core.WrongTypeException;
import io.mudb.datastructure.MuBytes;
import io.mudb.protocol.BulkString;
import io.mudb.protocol.Errors;
import io.mudb.protocol.Resp;
import io.mudb.protocol.RespArray;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 命令分发器
 *
 * <p>把一个请求数组转换为一个回复：查找命令、检查元数、解析参数、执行。
 * 所有失败都转换为 {@link Errors} 回复，{@link #dispatch(RespArray)} 不抛出异常。
 * 失败的命令不会修改存储。
 *
 * <p>分发器本身无状态，所有连接共享一个实例。
 *
 * @author mudb
 * @since 1.0.0
 */
@Slf4j
public class CommandDispatcher {

    private static final Errors EMPTY_COMMAND_ERROR = new Errors("ERR empty command");

    private static final Errors INVALID_ARGUMENT_ERROR = new Errors("ERR invalid request: arguments must be bulk strings");

    private static final Errors INTERNAL_ERROR = new Errors("ERR internal error");

    @Getter
    private final MuCore muCore;

    public CommandDispatcher(final MuCore muCore) {
        if (muCore == null) {
            throw new IllegalArgumentException("MuCore不能为null");
        }
        this.muCore = muCore;
    }

    /**
     * 执行一个请求
     *
     * @param request 请求数组，第一个元素是命令名
     * @return 回复，永不为null
     */
    public Resp dispatch(final RespArray request) {
        final Resp[] array = request.getContent();
        if (array == null || array.length == 0) {
            return EMPTY_COMMAND_ERROR;
        }
        for (final Resp arg : array) {
            if (!(arg instanceof BulkString) || ((BulkString) arg).isNull()) {
                return INVALID_ARGUMENT_ERROR;
            }
        }

        final MuBytes name = ((BulkString) array[0]).getContent();
        try {
            // 1. 查找命令
            final CommandType commandType = CommandType.findByBytes(name);
            if (commandType == null) {
                throw CommandException.unknownCommand(name.getString());
            }

            // 2. 检查元数
            if (!commandType.acceptsArity(array.length)) {
                throw CommandException.wrongArity(commandType);
            }

            // 3. 解析参数并执行
            final Command command = commandType.createCommand(muCore);
            command.setContext(array);
            return command.handle();
        } catch (CommandException e) {
            return new Errors(e.getMessage());
        } catch (WrongTypeException e) {
            return new Errors("WRONGTYPE " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("命令执行失败: {}", name, e);
            return INTERNAL_ERROR;
        }
    }
}
