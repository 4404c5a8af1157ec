package io.mudb.cli;

import io.mudb.protocol.BulkString;
import io.mudb.protocol.Errors;
import io.mudb.protocol.Resp;
import io.mudb.protocol.RespArray;
import io.mudb.protocol.RespInteger;
import io.mudb.protocol.SimpleString;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MudbClient 测试")
class MudbClientTest {

    private static StubMudbServer server;

    @BeforeAll
    static void startServer() throws InterruptedException {
        server = new StubMudbServer();
    }

    @AfterAll
    static void stopServer() {
        server.close();
    }

    @Test
    @DisplayName("发送请求并接收各类回复")
    void testSendAndReceive() throws Exception {
        try (MudbClient client = new MudbClient("127.0.0.1", server.port())) {
            client.connect();

            assertThat(client.isConnected()).isTrue();
            assertThat(client.send("PING")).isSameAs(SimpleString.PONG);
            assertThat(client.send("SET", "k", "v")).isInstanceOf(SimpleString.class);
            assertThat(client.send("COUNT", "a", "b", "c")).isEqualTo(RespInteger.valueOf(3));
            assertThat(client.send("NIL")).isSameAs(BulkString.NULL);

            final Resp error = client.send("FAIL");
            assertThat(error).isInstanceOf(Errors.class);
            assertThat(((Errors) error).getContent()).isEqualTo("ERR stub failure");
        }
    }

    @Test
    @DisplayName("参数按二进制安全的批量字符串发送")
    void testArgumentsWithSpecialCharacters() throws Exception {
        try (MudbClient client = new MudbClient("127.0.0.1", server.port())) {
            client.connect();

            final Resp reply = client.send("ECHO", "a b", "line\r\nbreak", "");

            assertThat(reply).isEqualTo(RespArray.ofBulkStrings("a b", "line\r\nbreak", ""));
        }
    }

    @Test
    @DisplayName("连续请求的回复按顺序对应")
    void testSequentialRequests() throws Exception {
        try (MudbClient client = new MudbClient("127.0.0.1", server.port())) {
            client.connect();

            for (int i = 0; i < 100; i++) {
                assertThat(client.send("ECHO", "n" + i)).isEqualTo(RespArray.ofBulkStrings("n" + i));
            }
        }
    }

    @Test
    @DisplayName("等待回复超时后关闭连接")
    void testTimeoutClosesConnection() throws Exception {
        try (MudbClient client = new MudbClient("127.0.0.1", server.port(), 200)) {
            client.connect();

            assertThatThrownBy(() -> client.send("SILENT")).isInstanceOf(TimeoutException.class);
            assertThatThrownBy(() -> client.send("PING")).isInstanceOf(IOException.class);
        }
    }

    @Test
    @DisplayName("连接失败抛出IOException")
    void testConnectFailure() throws Exception {
        final int unusedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            unusedPort = socket.getLocalPort();
        }

        final MudbClient client = new MudbClient("127.0.0.1", unusedPort, 1000);
        try {
            assertThatThrownBy(client::connect).isInstanceOf(IOException.class);
            assertThat(client.isConnected()).isFalse();
        } finally {
            client.close();
        }
    }

    @Test
    @DisplayName("未连接时发送请求抛出IOException")
    void testSendWithoutConnect() {
        final MudbClient client = new MudbClient("127.0.0.1", server.port());

        assertThatThrownBy(() -> client.send("PING")).isInstanceOf(IOException.class);
        client.close();
    }
}
