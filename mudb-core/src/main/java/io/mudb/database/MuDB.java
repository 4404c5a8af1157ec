package io.mudb.database;

import io.mudb.datastructure.MuBytes;
import io.mudb.datastructure.MuData;

import java.util.HashMap;
import java.util.Map;

/**
 * 键空间
 *
 * <p>保存进程内的全部键值对，不做持久化。
 * 本类不是线程安全的，所有访问都经过 {@link io.mudb.core.MuCoreImpl} 的读写锁。
 *
 * @author mudb
 * @since 1.0.0
 */
public class MuDB {

    /** 底层数据存储 */
    private final Map<MuBytes, MuData> data = new HashMap<>();

    public MuData get(final MuBytes key) {
        return data.get(key);
    }

    public void put(final MuBytes key, final MuData value) {
        data.put(key, value);
    }

    /**
     * 删除指定键
     *
     * @param key 要删除的键
     * @return 删除的值，键不存在时返回null
     */
    public MuData delete(final MuBytes key) {
        return data.remove(key);
    }
}
