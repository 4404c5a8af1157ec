package io.mudb.datastructure;

import lombok.Getter;

/**
 * 字符串值，内容为二进制安全的字节串
 *
 * <p>实例不可变，SET 覆盖时整体替换。
 *
 * @author mudb
 * @since 1.0.0
 */
@Getter
public final class MuString implements MuData {

    /** 字符串内容 */
    private final MuBytes value;

    public MuString(final MuBytes value) {
        if (value == null) {
            throw new IllegalArgumentException("value不能为null");
        }
        this.value = value;
    }

    @Override
    public DataType type() {
        return DataType.STRING;
    }
}
