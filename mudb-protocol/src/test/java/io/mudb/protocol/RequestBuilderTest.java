package io.mudb.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RequestBuilder 测试
 *
 * 测试覆盖：
 * 1. 二进制安全的参数
 * 2. 分片到达时已完成的参数不再重复解析
 * 3. 非法请求与出错后的状态
 */
@DisplayName("RequestBuilder 测试")
class RequestBuilderTest {

    private RequestBuilder builder;

    private ByteBuf buf;

    @BeforeEach
    void setUp() {
        builder = new RequestBuilder();
        buf = Unpooled.buffer();
    }

    @AfterEach
    void tearDown() {
        buf.release();
    }

    private void append(final String s) {
        buf.writeBytes(s.getBytes(StandardCharsets.US_ASCII));
    }

    @Test
    @DisplayName("批量字符串内容按长度读取，允许包含CRLF和0字节")
    void testBinarySafeArgument() {
        append("*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$5\r\n");
        buf.writeBytes(new byte[]{'a', '\r', '\n', 0, 'b'});
        append("\r\n");

        final RespArray request = builder.feed(buf);

        assertEquals(3, request.size());
        final BulkString value = (BulkString) request.getContent()[2];
        assertArrayEquals(new byte[]{'a', '\r', '\n', 0, 'b'}, value.getContent().getBytes());
        assertFalse(buf.isReadable());
        assertFalse(builder.isInProgress());
    }

    @Test
    @DisplayName("逐字节到达时只在最后一个字节后完成解码")
    void testByteByByte() {
        final byte[] frame = "*2\r\n$4\r\nLLEN\r\n$1\r\nk\r\n".getBytes(StandardCharsets.US_ASCII);
        for (int i = 0; i < frame.length - 1; i++) {
            buf.writeByte(frame[i]);
            assertNull(builder.feed(buf));
        }
        buf.writeByte(frame[frame.length - 1]);

        assertEquals(RespArray.ofBulkStrings("LLEN", "k"), builder.feed(buf));
        assertFalse(buf.isReadable());
    }

    @Test
    @DisplayName("已完成的参数被消费，只回退未完成的部分")
    void testCompletedArgumentsAreConsumed() {
        append("*3\r\n$5\r\nRPUSH\r\n$1\r\nk\r\n$3\r\nab");

        assertNull(builder.feed(buf));
        assertTrue(builder.isInProgress());
        // 只剩下未完成的 "$3\r\nab"
        assertEquals("$3\r\nab", buf.toString(StandardCharsets.US_ASCII));

        append("c\r\n");
        assertEquals(RespArray.ofBulkStrings("RPUSH", "k", "abc"), builder.feed(buf));
        assertFalse(builder.isInProgress());
    }

    @Test
    @DisplayName("连续的请求依次解析")
    void testConsecutiveRequests() {
        append("*1\r\n$4\r\nPING\r\n*2\r\n$3\r\nGET\r\n$1\r\nk\r\n");

        assertEquals(RespArray.ofBulkStrings("PING"), builder.feed(buf));
        assertEquals(RespArray.ofBulkStrings("GET", "k"), builder.feed(buf));
        assertNull(builder.feed(buf));
    }

    @Test
    @DisplayName("空请求")
    void testEmptyRequest() {
        append("*0\r\n*-1\r\n");

        assertSame(RespArray.EMPTY, builder.feed(buf));
        assertSame(RespArray.NULL, builder.feed(buf));
    }

    @Test
    @DisplayName("请求中的非法帧")
    void testMalformedRequests() {
        final String[] malformed = {
                "+PING\r\n",
                "*1\r\n:1\r\n",
                "*1\r\n$-1\r\n",
                "*-2\r\n",
                "*x\r\n",
                "*1\r\n$3\r\nabcXY",
                "*1048577\r\n",
                "*1\r\n$536870913\r\n",
                "*" + "1".repeat(25)
        };
        for (final String input : malformed) {
            final RequestBuilder fresh = new RequestBuilder();
            final ByteBuf in = Unpooled.copiedBuffer(input, StandardCharsets.US_ASCII);
            try {
                assertThrows(ProtocolException.class, () -> fresh.feed(in), input);
                assertFalse(fresh.isInProgress(), input);
            } finally {
                in.release();
            }
        }
    }

    @Test
    @DisplayName("参数出错时读索引停在出错参数的开头")
    void testErrorPosition() {
        append("*2\r\n$3\r\nGET\r\n:1\r\n");

        final ProtocolException e = assertThrows(ProtocolException.class, () -> builder.feed(buf));

        assertEquals("expected '$', got ':'", e.getMessage());
        assertEquals(':', buf.getByte(buf.readerIndex()));
        assertFalse(builder.isInProgress());
    }

    @Test
    @DisplayName("reset 放弃解析到一半的数组")
    void testReset() {
        append("*2\r\n$3\r\nGET\r\n");
        assertNull(builder.feed(buf));
        assertTrue(builder.isInProgress());

        builder.reset();
        append("*1\r\n$4\r\nPING\r\n");

        assertFalse(builder.isInProgress());
        assertEquals(RespArray.ofBulkStrings("PING"), builder.feed(buf));
    }
}
