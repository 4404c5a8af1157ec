package io.mudb.core;

import io.mudb.datastructure.MuBytes;

import java.util.List;

/**
 * 值存储接口，访问共享数据的唯一入口
 *
 * <p>每个操作相对其他所有操作都是原子的，调用方不需要加锁。
 * 类型不匹配时抛出 {@link WrongTypeException}，不会做类型转换。
 *
 * @author mudb
 * @since 1.0.0
 */
public interface MuCore {

    /**
     * 读取字符串值
     *
     * @param key 键
     * @return 值，键不存在时返回null
     * @throws WrongTypeException 键持有列表
     */
    MuBytes get(MuBytes key);

    /**
     * 写入字符串值，无条件覆盖已有的值及其类型
     *
     * @param key 键
     * @param value 值
     */
    void set(MuBytes key, MuBytes value);

    /**
     * 删除一个键
     *
     * @param key 键
     * @return 键存在并被删除时返回true
     */
    boolean delete(MuBytes key);

    /**
     * 删除多个键，整个批次是一次原子操作
     *
     * @param keys 键
     * @return 实际删除的键数量
     */
    int delete(MuBytes... keys);

    /**
     * 向列表头部逐个推入元素，键不存在时创建列表
     *
     * @param key 键
     * @param values 元素，按参数顺序推入
     * @return 推入后的长度
     * @throws WrongTypeException 键持有字符串
     */
    int lpush(MuBytes key, MuBytes... values);

    /**
     * 向列表尾部逐个推入元素，键不存在时创建列表
     *
     * @param key 键
     * @param values 元素
     * @return 推入后的长度
     * @throws WrongTypeException 键持有字符串
     */
    int rpush(MuBytes key, MuBytes... values);

    /**
     * 读取列表下标范围内的元素，负数下标从尾部计数
     *
     * @param key 键
     * @param start 开始下标
     * @param stop 结束下标，包含
     * @return 元素副本，键不存在或范围为空时返回空列表
     * @throws WrongTypeException 键持有字符串
     */
    List<MuBytes> lrange(MuBytes key, long start, long stop);

    /**
     * 获取列表长度
     *
     * @param key 键
     * @return 长度，键不存在时返回0
     * @throws WrongTypeException 键持有字符串
     */
    int llen(MuBytes key);
}
