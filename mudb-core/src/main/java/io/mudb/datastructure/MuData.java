package io.mudb.datastructure;

/**
 * 键空间中的值，一个键对应一个值，类型在键被删除前保持不变
 *
 * @author mudb
 * @since 1.0.0
 */
public interface MuData {

    /**
     * 获取值的类型
     *
     * @return 类型标签
     */
    DataType type();
}
