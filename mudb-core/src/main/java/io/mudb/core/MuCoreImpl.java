package io.mudb.core;

import io.mudb.database.MuDB;
import io.mudb.datastructure.DataType;
import io.mudb.datastructure.MuBytes;
import io.mudb.datastructure.MuData;
import io.mudb.datastructure.MuList;
import io.mudb.datastructure.MuString;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 值存储实现
 *
 * <h2>线程安全设计：</h2>
 * <ul>
 *     <li>整个键空间由一把 {@link ReentrantReadWriteLock} 保护</li>
 *     <li>GET、LRANGE、LLEN 等读操作共享读锁</li>
 *     <li>SET、DEL、LPUSH 等写操作持有写锁，多值推入在一次加锁内完成</li>
 *     <li>返回给调用方的列表都是副本</li>
 * </ul>
 *
 * @author mudb
 * @since 1.0.0
 */
public class MuCoreImpl implements MuCore {

    /** 键空间 */
    private final MuDB db = new MuDB();

    private final Lock readLock;

    private final Lock writeLock;

    public MuCoreImpl() {
        final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        this.readLock = lock.readLock();
        this.writeLock = lock.writeLock();
    }

    @Override
    public MuBytes get(final MuBytes key) {
        readLock.lock();
        try {
            final MuData data = db.get(key);
            if (data == null) {
                return null;
            }
            return asString(data).getValue();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public void set(final MuBytes key, final MuBytes value) {
        final MuString string = new MuString(value);
        writeLock.lock();
        try {
            db.put(key, string);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public boolean delete(final MuBytes key) {
        writeLock.lock();
        try {
            return db.delete(key) != null;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int delete(final MuBytes... keys) {
        writeLock.lock();
        try {
            int removed = 0;
            for (final MuBytes key : keys) {
                if (db.delete(key) != null) {
                    removed++;
                }
            }
            return removed;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int lpush(final MuBytes key, final MuBytes... values) {
        if (values.length == 0) {
            return llen(key);
        }
        writeLock.lock();
        try {
            return getOrCreateList(key).lpush(values);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int rpush(final MuBytes key, final MuBytes... values) {
        if (values.length == 0) {
            return llen(key);
        }
        writeLock.lock();
        try {
            return getOrCreateList(key).rpush(values);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public List<MuBytes> lrange(final MuBytes key, final long start, final long stop) {
        readLock.lock();
        try {
            final MuData data = db.get(key);
            if (data == null) {
                return Collections.emptyList();
            }
            return asList(data).lrange(start, stop);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public int llen(final MuBytes key) {
        readLock.lock();
        try {
            final MuData data = db.get(key);
            return data == null ? 0 : asList(data).size();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * 获取列表，键不存在时创建，调用方必须持有写锁
     */
    private MuList getOrCreateList(final MuBytes key) {
        final MuData data = db.get(key);
        if (data == null) {
            final MuList list = new MuList();
            db.put(key, list);
            return list;
        }
        return asList(data);
    }

    private static MuList asList(final MuData data) {
        if (data.type() != DataType.LIST) {
            throw new WrongTypeException(DataType.LIST, data.type());
        }
        return (MuList) data;
    }

    private static MuString asString(final MuData data) {
        if (data.type() != DataType.STRING) {
            throw new WrongTypeException(DataType.STRING, data.type());
        }
        return (MuString) data;
    }
}
