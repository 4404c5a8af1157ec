package io.mudb.datastructure;

/**
 * 值类型标签
 *
 * @author mudb
 * @since 1.0.0
 */
public enum DataType {
    STRING("string"),
    LIST("list");

    /** 错误信息中使用的小写名称 */
    private final String displayName;

    DataType(final String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
