package io.mudb.command;

import io.mudb.protocol.Resp;

/**
 * 命令接口
 *
 * <p>每个请求创建一个新的命令实例：先由 {@link #setContext(Resp[])} 解析参数，
 * 再由 {@link #handle()} 执行。参数个数在创建命令之前已经按 {@link CommandType} 的元数检查过。
 *
 * @author mudb
 * @since 1.0.0
 */
public interface Command {

    /**
     * 获取命令类型
     *
     * @return 命令类型枚举值
     */
    CommandType getType();

    /**
     * 设置命令参数
     *
     * @param array 完整的请求数组，第0个元素是命令名
     * @throws CommandException 参数不合法时，例如下标不是整数
     */
    void setContext(Resp[] array);

    /**
     * 执行命令并返回回复
     *
     * @return RESP回复
     * @throws io.mudb.core.WrongTypeException 键持有其他类型的值时
     */
    Resp handle();
}
