package io.mudb.command;

import io.mudb.command.impl.Ping;
import io.mudb.command.impl.key.Del;
import io.mudb.command.impl.list.Llen;
import io.mudb.command.impl.list.Lpush;
import io.mudb.command.impl.list.Lrange;
import io.mudb.command.impl.list.Rpush;
import io.mudb.command.impl.string.Get;
import io.mudb.command.impl.string.Set;
import io.mudb.core.MuCore;
import io.mudb.datastructure.MuBytes;
import lombok.Getter;

import java.util.HashMap;
import java.util.Map;

/**
 * 命令类型枚举，即命令表
 *
 * <p>每个命令登记名称与元数范围。元数包含命令名本身，maxArity 为 -1 表示不设上限。
 * 查找按原始字节进行，大小写不敏感。
 *
 * @author mudb
 * @since 1.0.0
 */
@Getter
public enum CommandType {
    /** PING [message] */
    PING("PING", 1, 2),
    /** SET key value */
    SET("SET", 3, 3),
    /** GET key */
    GET("GET", 2, 2),
    /** DEL key [key ...] */
    DEL("DEL", 2, -1),
    /** LPUSH key value [value ...] */
    LPUSH("LPUSH", 3, -1),
    /** RPUSH key value [value ...] */
    RPUSH("RPUSH", 3, -1),
    /** LRANGE key start stop */
    LRANGE("LRANGE", 4, 4),
    /** LLEN key */
    LLEN("LLEN", 2, 2);

    /** 命令查找缓存，键为大写命令名 */
    private static final Map<MuBytes, CommandType> COMMAND_CACHE = new HashMap<>();

    static {
        for (final CommandType type : CommandType.values()) {
            COMMAND_CACHE.put(type.commandBytes, type);
        }
    }

    /** 命令名 */
    private final String commandName;

    /** 命令名字节 */
    private final MuBytes commandBytes;

    /** 最少参数个数，含命令名 */
    private final int minArity;

    /** 最多参数个数，含命令名，-1表示不限 */
    private final int maxArity;

    CommandType(final String commandName, final int minArity, final int maxArity) {
        this.commandName = commandName;
        this.commandBytes = MuBytes.fromString(commandName);
        this.minArity = minArity;
        this.maxArity = maxArity;
    }

    /**
     * 根据命令名字节查找命令类型，大小写不敏感
     *
     * @param commandBytes 命令名
     * @return 命令类型，不存在时返回null
     */
    public static CommandType findByBytes(final MuBytes commandBytes) {
        if (commandBytes == null) {
            return null;
        }
        // 1. 客户端通常发送大写命令名，直接命中
        final CommandType result = COMMAND_CACHE.get(commandBytes);
        if (result != null) {
            return result;
        }
        // 2. 转换为大写后再查找
        return COMMAND_CACHE.get(commandBytes.toUpperCase());
    }

    /**
     * 检查参数个数
     *
     * @param argc 请求数组长度，含命令名
     * @return 在元数范围内返回true
     */
    public boolean acceptsArity(final int argc) {
        return argc >= minArity && (maxArity < 0 || argc <= maxArity);
    }

    /**
     * 创建命令实例
     *
     * @param core 值存储
     * @return 命令实例
     */
    public Command createCommand(final MuCore core) {
        switch (this) {
            case PING:
                return new Ping();
            case SET:
                return new Set(core);
            case GET:
                return new Get(core);
            case DEL:
                return new Del(core);
            case LPUSH:
                return new Lpush(core);
            case RPUSH:
                return new Rpush(core);
            case LRANGE:
                return new Lrange(core);
            case LLEN:
                return new Llen(core);
            default:
                throw new IllegalArgumentException("不支持的命令类型: " + this);
        }
    }
}
