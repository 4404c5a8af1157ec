package io.mudb.command;

import io.mudb.core.MuCoreImpl;
import io.mudb.datastructure.MuBytes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CommandType 测试")
class CommandTypeTest {

    @Test
    @DisplayName("命令名查找大小写不敏感")
    void testFindByBytes() {
        assertEquals(CommandType.LRANGE, CommandType.findByBytes(MuBytes.fromString("LRANGE")));
        assertEquals(CommandType.LRANGE, CommandType.findByBytes(MuBytes.fromString("lrange")));
        assertEquals(CommandType.LRANGE, CommandType.findByBytes(MuBytes.fromString("LrAnGe")));
        assertNull(CommandType.findByBytes(MuBytes.fromString("LRANGEX")));
        assertNull(CommandType.findByBytes(null));
    }

    @Test
    @DisplayName("元数范围")
    void testArity() {
        assertTrue(CommandType.PING.acceptsArity(1));
        assertTrue(CommandType.PING.acceptsArity(2));
        assertFalse(CommandType.PING.acceptsArity(3));
        assertFalse(CommandType.DEL.acceptsArity(1));
        assertTrue(CommandType.DEL.acceptsArity(100));
        assertTrue(CommandType.RPUSH.acceptsArity(3));
        assertFalse(CommandType.RPUSH.acceptsArity(2));
        assertTrue(CommandType.LRANGE.acceptsArity(4));
        assertFalse(CommandType.LRANGE.acceptsArity(5));
    }

    @Test
    @DisplayName("每个命令类型都能创建对应的命令")
    void testCreateCommand() {
        final MuCoreImpl core = new MuCoreImpl();
        for (final CommandType type : CommandType.values()) {
            final Command command = type.createCommand(core);
            assertEquals(type, command.getType());
        }
    }
}
