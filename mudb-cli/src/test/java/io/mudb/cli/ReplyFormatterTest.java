package io.mudb.cli;

import io.mudb.protocol.BulkString;
import io.mudb.protocol.Errors;
import io.mudb.protocol.Resp;
import io.mudb.protocol.RespArray;
import io.mudb.protocol.RespInteger;
import io.mudb.protocol.SimpleString;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ReplyFormatter 测试")
class ReplyFormatterTest {

    @Test
    @DisplayName("标量回复")
    void testScalars() {
        assertThat(ReplyFormatter.format(SimpleString.OK)).isEqualTo("OK");
        assertThat(ReplyFormatter.format(new Errors("ERR unknown command 'foo'")))
                .isEqualTo("(error) ERR unknown command 'foo'");
        assertThat(ReplyFormatter.format(RespInteger.valueOf(-3))).isEqualTo("(integer) -3");
        assertThat(ReplyFormatter.format(BulkString.of("bar"))).isEqualTo("\"bar\"");
    }

    @Test
    @DisplayName("null与空数组")
    void testNilAndEmpty() {
        assertThat(ReplyFormatter.format(BulkString.NULL)).isEqualTo("(nil)");
        assertThat(ReplyFormatter.format(RespArray.NULL)).isEqualTo("(nil)");
        assertThat(ReplyFormatter.format(RespArray.EMPTY)).isEqualTo("(empty array)");
    }

    @Test
    @DisplayName("批量字符串转义特殊字节")
    void testQuoteEscapes() {
        final BulkString value = new BulkString(new byte[]{'a', '"', '\\', '\r', '\n', 0, (byte) 0xFF});

        assertThat(ReplyFormatter.format(value)).isEqualTo("\"a\\\"\\\\\\r\\n\\x00\\xff\"");
    }

    @Test
    @DisplayName("数组逐行编号")
    void testArray() {
        assertThat(ReplyFormatter.format(RespArray.ofBulkStrings("a", "b")))
                .isEqualTo("1) \"a\"\n2) \"b\"");
    }

    @Test
    @DisplayName("编号按最大宽度右对齐")
    void testArrayNumberAlignment() {
        final String[] values = new String[10];
        for (int i = 0; i < values.length; i++) {
            values[i] = "v" + i;
        }

        final String[] lines = ReplyFormatter.format(RespArray.ofBulkStrings(values)).split("\n");

        assertThat(lines).hasSize(10);
        assertThat(lines[0]).isEqualTo(" 1) \"v0\"");
        assertThat(lines[9]).isEqualTo("10) \"v9\"");
    }

    @Test
    @DisplayName("嵌套数组缩进")
    void testNestedArray() {
        final RespArray nested = new RespArray(new Resp[]{
                BulkString.of("a"),
                RespArray.ofBulkStrings("b", "c"),
                RespInteger.ONE
        });

        assertThat(ReplyFormatter.format(nested))
                .isEqualTo("1) \"a\"\n2) 1) \"b\"\n   2) \"c\"\n3) (integer) 1");
    }
}
