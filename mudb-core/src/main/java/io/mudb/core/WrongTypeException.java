package io.mudb.core;

import io.mudb.datastructure.DataType;
import lombok.Getter;

/**
 * 对持有其他类型值的键执行操作时抛出，键保持不变
 *
 * @author mudb
 * @since 1.0.0
 */
@Getter
public class WrongTypeException extends RuntimeException {

    /** 操作需要的类型 */
    private final DataType expected;

    /** 键实际持有的类型 */
    private final DataType actual;

    public WrongTypeException(final DataType expected, final DataType actual) {
        super("Operation against a key holding the wrong kind of value (expected "
                + expected + ", got " + actual + ")");
        this.expected = expected;
        this.actual = actual;
    }
}
