package io.mudb.datastructure;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * MuList 单元测试
 */
@DisplayName("MuList单元测试")
class MuListTest {

    private MuList list;

    @BeforeEach
    void setUp() {
        list = new MuList();
    }

    private static MuBytes[] values(final String... values) {
        final MuBytes[] result = new MuBytes[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = MuBytes.fromString(values[i]);
        }
        return result;
    }

    private static List<String> strings(final List<MuBytes> values) {
        return values.stream().map(MuBytes::getString).collect(Collectors.toList());
    }

    @Test
    @DisplayName("lpush 按参数顺序逐个推入头部")
    void testLpushOrder() {
        assertEquals(3, list.lpush(values("a", "b", "c")));

        assertThat(strings(list.lrange(0, -1))).containsExactly("c", "b", "a");
    }

    @Test
    @DisplayName("rpush 保持插入顺序")
    void testRpushOrder() {
        list.rpush(values("a", "b"));
        assertEquals(3, list.rpush(values("c")));

        assertThat(strings(list.lrange(0, -1))).containsExactly("a", "b", "c");
    }

    @Test
    @DisplayName("lrange 负数下标与边界裁剪")
    void testLrangeIndices() {
        list.rpush(values("a", "b", "c", "d"));

        assertThat(strings(list.lrange(-2, -1))).containsExactly("c", "d");
        assertThat(strings(list.lrange(1, 2))).containsExactly("b", "c");
        assertThat(strings(list.lrange(-100, 100))).containsExactly("a", "b", "c", "d");
        assertThat(strings(list.lrange(0, 0))).containsExactly("a");
        assertThat(list.lrange(2, 1)).isEmpty();
        assertThat(list.lrange(4, 10)).isEmpty();
        assertThat(list.lrange(-1, -2)).isEmpty();
        assertThat(list.lrange(Long.MIN_VALUE, Long.MAX_VALUE)).hasSize(4);
    }

    @Test
    @DisplayName("lrange 返回副本")
    void testLrangeReturnsCopy() {
        list.rpush(values("a"));
        final List<MuBytes> range = list.lrange(0, -1);

        range.clear();

        assertEquals(1, list.size());
    }

    @Test
    @DisplayName("空列表上的 lrange")
    void testLrangeOnEmpty() {
        assertThat(list.lrange(0, -1)).isEmpty();
        assertEquals(DataType.LIST, list.type());
    }
}
