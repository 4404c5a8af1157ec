package io.mudb.datastructure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;

/**
 * 列表值
 *
 * <p>使用LinkedList作为底层存储，支持两端推入以及按下标范围读取。
 * 本类不是线程安全的，由持有它的存储层统一加锁。
 *
 * @author mudb
 * @since 1.0.0
 */
public class MuList implements MuData {

    /** 底层存储结构 */
    private final LinkedList<MuBytes> list = new LinkedList<>();

    @Override
    public DataType type() {
        return DataType.LIST;
    }

    public int size() {
        return list.size();
    }

    /**
     * 向头部推入元素，按参数顺序逐个推入，因此 lpush(a, b, c) 之后头部为 c
     *
     * @param values 要推入的元素
     * @return 推入后的长度
     */
    public int lpush(final MuBytes... values) {
        for (final MuBytes value : values) {
            list.addFirst(value);
        }
        return list.size();
    }

    /**
     * 向尾部推入元素
     *
     * @param values 要推入的元素
     * @return 推入后的长度
     */
    public int rpush(final MuBytes... values) {
        for (final MuBytes value : values) {
            list.addLast(value);
        }
        return list.size();
    }

    /**
     * 获取下标范围内的元素，两端都包含
     *
     * <p>负数下标从尾部计数（-1为最后一个），按调用时的长度解析一次，
     * 然后裁剪到合法范围。范围为空时返回空列表。
     *
     * @param start 开始下标
     * @param stop 结束下标
     * @return 元素副本
     */
    public List<MuBytes> lrange(final long start, final long stop) {
        final int size = list.size();

        // 1. 处理负数下标
        long actualStart = start < 0 ? size + start : start;
        long actualStop = stop < 0 ? size + stop : stop;

        // 2. 边界裁剪
        actualStart = Math.max(0, actualStart);
        actualStop = Math.min(size - 1L, actualStop);

        // 3. 返回子列表副本
        if (actualStart > actualStop || actualStart >= size) {
            return Collections.emptyList();
        }
        return new ArrayList<>(list.subList((int) actualStart, (int) actualStop + 1));
    }
}
