package io.mudb.datastructure;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MuBytes 单元测试
 *
 * 测试覆盖：
 * 1. 构造与工厂方法
 * 2. 二进制安全（包含\r\n和0字节）
 * 3. 相等性与大写转换
 */
@DisplayName("MuBytes 单元测试")
class MuBytesTest {

    @Nested
    @DisplayName("构造函数测试")
    class ConstructorTests {

        @Test
        @DisplayName("标准构造函数执行防御性拷贝")
        void testDefensiveCopy() {
            final byte[] source = "value".getBytes(MuBytes.CHARSET);
            final MuBytes bytes = new MuBytes(source);

            source[0] = 'X';

            assertEquals("value", bytes.getString());
            assertNotSame(bytes.getBytesUnsafe(), bytes.getBytes());
        }

        @Test
        @DisplayName("null 输入抛出异常")
        void testNullInput() {
            assertThrows(IllegalArgumentException.class, () -> new MuBytes(null));
            assertNull(MuBytes.wrapTrusted(null));
            assertNull(MuBytes.fromString(null));
        }

        @Test
        @DisplayName("wrapTrusted 不复制数组")
        void testWrapTrusted() {
            final byte[] source = {1, 2, 3};
            final MuBytes bytes = MuBytes.wrapTrusted(source);

            assertSame(source, bytes.getBytesUnsafe());
            assertSame(source, bytes.getBytes());
        }

        @Test
        @DisplayName("空字符串返回EMPTY常量")
        void testEmptyString() {
            assertSame(MuBytes.EMPTY, MuBytes.fromString(""));
            assertEquals(0, MuBytes.EMPTY.length());
        }
    }

    @Nested
    @DisplayName("命令名称池测试")
    class CommandPoolTests {

        @Test
        @DisplayName("大写命令名复用同一实例")
        void testPooledCommand() {
            assertSame(MuBytes.fromString("LRANGE"), MuBytes.fromString("LRANGE"));
        }

        @Test
        @DisplayName("小写字符串不会被替换成大写命令")
        void testLowerCaseIsNotPooled() {
            final MuBytes lower = MuBytes.fromString("get");

            assertEquals("get", lower.getString());
            assertNotEquals(MuBytes.fromString("GET"), lower);
        }
    }

    @Nested
    @DisplayName("比较操作测试")
    class ComparisonTests {

        @Test
        @DisplayName("按字节精确比较相等性")
        void testEquality() {
            final MuBytes a = new MuBytes(new byte[]{'k', 0, '\r', '\n'});
            final MuBytes b = new MuBytes(new byte[]{'k', 0, '\r', '\n'});
            final MuBytes c = new MuBytes(new byte[]{'k', 0, '\r'});

            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());
            assertNotEquals(a, c);
        }

        @Test
        @DisplayName("可作为HashMap键")
        void testAsMapKey() {
            final Map<MuBytes, String> map = new HashMap<>();
            map.put(MuBytes.fromString("key"), "v1");

            assertEquals("v1", map.get(new MuBytes("key".getBytes(MuBytes.CHARSET))));
        }

        @Test
        @DisplayName("toUpperCase 保留非字母字节")
        void testToUpperCase() {
            final MuBytes upper = MuBytes.fromString("rpush-1").toUpperCase();

            assertEquals("RPUSH-1", upper.getString());
            final MuBytes already = MuBytes.fromString("LLEN");
            assertSame(already, already.toUpperCase());
        }
    }

    @Test
    @DisplayName("toString 转义不可打印字节")
    void testToStringPreview() {
        final MuBytes bytes = new MuBytes(new byte[]{'a', '\r', '\n'});

        assertEquals("MuBytes[length=3, preview='a\\x0d\\x0a']", bytes.toString());
    }
}
