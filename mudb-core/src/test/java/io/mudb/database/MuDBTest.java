package io.mudb.database;

import io.mudb.datastructure.DataType;
import io.mudb.datastructure.MuBytes;
import io.mudb.datastructure.MuList;
import io.mudb.datastructure.MuString;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MuDB单元测试")
class MuDBTest {

    @Test
    @DisplayName("存取删除键")
    void testPutGetDelete() {
        final MuDB db = new MuDB();
        final MuBytes key = MuBytes.fromString("k");

        db.put(key, new MuString(MuBytes.fromString("v")));

        assertEquals(DataType.STRING, db.get(key).type());
        assertNotNull(db.delete(key));
        assertNull(db.delete(key));
        assertNull(db.get(key));
    }

    @Test
    @DisplayName("键按字节精确匹配")
    void testKeyIdentity() {
        final MuDB db = new MuDB();
        db.put(MuBytes.fromString("key"), new MuList());

        assertNotNull(db.get(new MuBytes("key".getBytes(MuBytes.CHARSET))));
        assertNull(db.get(MuBytes.fromString("KEY")));
    }

    @Test
    @DisplayName("put 覆盖旧值及其类型")
    void testPutReplaces() {
        final MuDB db = new MuDB();
        final MuBytes key = MuBytes.fromString("k");
        db.put(key, new MuList());

        db.put(key, new MuString(MuBytes.fromString("v")));

        assertEquals(DataType.STRING, db.get(key).type());
    }
}
