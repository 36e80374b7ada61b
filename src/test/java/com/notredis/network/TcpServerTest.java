package com.notredis.network;

import com.notredis.NotRedisClient;
import com.notredis.NotRedisServer;
import com.notredis.config.ConfigTable;
import com.notredis.network.protocol.RespValue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for the TCP server with real client connections.
 */
class TcpServerTest {

    private static final int TEST_PORT = 19301;

    private NotRedisServer server;
    private NotRedisClient client;

    @BeforeEach
    void setUp() throws Exception {
        ConfigTable configuration = new ConfigTable();
        configuration.set(ConfigTable.PORT, Integer.toString(TEST_PORT));
        server = new NotRedisServer(configuration);
        server.start();

        client = new NotRedisClient("127.0.0.1", TEST_PORT);
    }

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
        if (server != null) {
            server.stop();
        }
    }

    private static Socket rawSocket() throws IOException {
        Socket socket = new Socket("127.0.0.1", TEST_PORT);
        socket.setSoTimeout(5000);
        return socket;
    }

    private static void send(Socket socket, String data) throws IOException {
        OutputStream out = socket.getOutputStream();
        out.write(data.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    private static String read(Socket socket, String expected) throws IOException {
        byte[] reply = new byte[expected.getBytes(StandardCharsets.UTF_8).length];
        new DataInputStream(socket.getInputStream()).readFully(reply);
        return new String(reply, StandardCharsets.UTF_8);
    }

    @Test
    void serverStartsAndAcceptsConnections() {
        assertThat(server.isRunning()).isTrue();
        assertThat(server.getPort()).isEqualTo(TEST_PORT);
        assertThat(client.ping()).isTrue();
    }

    @Test
    void setAndGet_basicOperation() throws IOException {
        client.set("testKey", "testValue");

        assertThat(client.get("testKey")).contains("testValue");
        assertThat(client.get("missing")).isEmpty();
    }

    @Test
    void unicodeKeyAndValue_roundTrip() throws IOException {
        String key = "key-日本語-🚀";
        String value = "value-中文-한국어-🎉";

        client.set(key, value);

        assertThat(client.get(key)).contains(value);
    }

    @Test
    void largeValue_roundTrip() throws IOException {
        char[] chars = new char[1024 * 1024];
        Arrays.fill(chars, 'x');
        String value = new String(chars);

        client.set("large", value);

        assertThat(client.get("large")).contains(value);
    }

    @Test
    void msetMgetDelIncr_overTheWire() throws IOException {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("a", "1");
        entries.put("b", "2");
        client.mset(entries);

        assertThat(client.mget("a", "nope", "b"))
            .containsExactly(Optional.of("1"), Optional.empty(), Optional.of("2"));
        assertThat(client.incr("a")).isEqualTo(2);
        assertThat(client.del("a", "b", "c")).isEqualTo(2);
        assertThat(client.del("a", "b", "c")).isZero();
    }

    @Test
    void echoAndConfig_overTheWire() throws IOException {
        assertThat(client.echo("hello")).isEqualTo("hello");
        assertThat(client.ping("hi")).isEqualTo("hi");

        client.configSet("maxclients", "10");

        assertThat(client.configGet("maxclients")).isEqualTo("10");
        assertThat(server.getConfiguration().get("maxclients")).isEqualTo("10");
    }

    @Test
    void commandError_keepsConnectionOpen() throws IOException {
        RespValue reply = client.command("NOSUCHCOMMAND", "x");

        assertThat(reply.isError()).isTrue();
        assertThat(reply.getText()).isEqualTo("ERR unknown command 'NOSUCHCOMMAND x'");
        assertThat(client.ping()).isTrue();
    }

    @Test
    void typedCall_errorReply_isIOException() throws IOException {
        client.set("word", "abc");

        assertThatThrownBy(() -> client.incr("word"))
            .isInstanceOf(IOException.class)
            .hasMessage("Server error: ERR value is not an integer or out of range");
        assertThat(client.get("word")).contains("abc");
    }

    @Test
    void splitFrame_isAnsweredOnceComplete() throws Exception {
        try (Socket socket = rawSocket()) {
            send(socket, "*2\r\n$4\r\nEC");
            Thread.sleep(50);
            send(socket, "HO\r\n$5\r\nhel");
            Thread.sleep(50);
            send(socket, "lo\r\n");

            assertThat(read(socket, "$5\r\nhello\r\n")).isEqualTo("$5\r\nhello\r\n");
        }
    }

    @Test
    void pipelinedRequests_areAnsweredInOrder() throws IOException {
        String pipeline = "*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$1\r\n1\r\n"
            + "*2\r\n$4\r\nINCR\r\n$1\r\nk\r\n"
            + "*2\r\n$3\r\nGET\r\n$1\r\nk\r\n"
            + "*1\r\n$4\r\nPING\r\n";

        RespValue first = client.sendRaw(pipeline.getBytes(StandardCharsets.UTF_8));

        assertThat(first).isEqualTo(RespValue.ok());
        assertThat(client.readReply()).isEqualTo(RespValue.integer(2));
        assertThat(client.readReply()).isEqualTo(RespValue.bulkString("2"));
        assertThat(client.readReply()).isEqualTo(RespValue.simpleString("PONG"));
    }

    @Test
    void manyPipelinedRequests_keepOrder() throws IOException {
        StringBuilder pipeline = new StringBuilder();
        int count = 500;
        for (int i = 0; i < count; i++) {
            pipeline.append("*2\r\n$4\r\nINCR\r\n$3\r\nseq\r\n");
        }

        RespValue reply = client.sendRaw(pipeline.toString().getBytes(StandardCharsets.UTF_8));
        assertThat(reply).isEqualTo(RespValue.integer(1));
        for (int i = 2; i <= count; i++) {
            assertThat(client.readReply()).isEqualTo(RespValue.integer(i));
        }
    }

    @Test
    void inlineCommand_isAccepted() throws IOException {
        try (Socket socket = rawSocket()) {
            send(socket, "PING\r\nSET  greeting  hi\r\nGET greeting\r\n");

            String expected = "+PONG\r\n+OK\r\n$2\r\nhi\r\n";
            assertThat(read(socket, expected)).isEqualTo(expected);
        }
    }

    @Test
    void quit_closesConnectionAfterReply() throws IOException {
        try (Socket socket = rawSocket()) {
            send(socket, "*1\r\n$4\r\nQUIT\r\n*1\r\n$4\r\nPING\r\n");

            assertThat(read(socket, "+OK\r\n")).isEqualTo("+OK\r\n");
            assertThat(socket.getInputStream().read()).isEqualTo(-1);
        }
    }

    @Test
    void clientQuit_closesClient() throws IOException {
        client.quit();

        assertThat(client.isClosed()).isTrue();
    }

    @Test
    void protocolError_isReportedThenConnectionCloses() throws IOException {
        try (Socket socket = rawSocket()) {
            send(socket, "*1\r\n$4\r\nPING\r\n*1\r\n$3\r\nabcXY");

            String reply = new String(socket.getInputStream().readAllBytes(), StandardCharsets.UTF_8);

            assertThat(reply).startsWith("+PONG\r\n-ERR Protocol error: ");
            assertThat(reply).endsWith("\r\n");
        }
        assertThat(client.ping()).isTrue();
    }

    @Test
    void deeplyNestedRequest_isProtocolErrorAndServerKeepsServing() throws IOException {
        String nested = String.join("", Collections.nCopies(1_000, "*1\r\n")) + ":1\r\n";
        try (Socket socket = rawSocket()) {
            send(socket, nested);

            String reply = new String(socket.getInputStream().readAllBytes(), StandardCharsets.UTF_8);

            assertThat(reply).startsWith("-ERR Protocol error: ");
        }

        try (NotRedisClient other = new NotRedisClient("127.0.0.1", TEST_PORT)) {
            assertThat(other.ping()).isTrue();
        }
        assertThat(client.ping()).isTrue();
        assertThat(server.getMetrics().getErrorCount("protocol")).isEqualTo(1);
    }

    @Test
    void nonBulkStringRequest_isCommandError() throws IOException {
        try (Socket socket = rawSocket()) {
            send(socket, ":1\r\n*1\r\n$4\r\nPING\r\n");

            String expected = "-ERR request must be an array of bulk strings (got INTEGER)\r\n+PONG\r\n";
            assertThat(read(socket, expected)).isEqualTo(expected);
        }
    }

    @Test
    void concurrentClients_areHandled() throws Exception {
        int numClients = 10;
        int opsPerClient = 100;
        ExecutorService executor = Executors.newFixedThreadPool(numClients);
        CountDownLatch latch = new CountDownLatch(numClients);
        AtomicInteger errors = new AtomicInteger(0);

        for (int c = 0; c < numClients; c++) {
            final int clientId = c;
            executor.submit(() -> {
                try (NotRedisClient own = new NotRedisClient("127.0.0.1", TEST_PORT)) {
                    for (int i = 0; i < opsPerClient; i++) {
                        String key = "client" + clientId + "-" + i;
                        own.set(key, "v" + i);
                        if (!own.get(key).equals(Optional.of("v" + i))) {
                            errors.incrementAndGet();
                        }
                        own.incr("shared");
                    }
                } catch (IOException e) {
                    errors.incrementAndGet();
                } finally {
                    latch.countDown();
                }
            });
        }

        assertThat(latch.await(30, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(errors.get()).isZero();
        assertThat(client.get("shared")).contains(Integer.toString(numClients * opsPerClient));
    }

    @Test
    void metrics_trackCommandsAndConnections() throws Exception {
        client.set("k", "v");
        client.command("NOPE");

        assertThat(server.getMetrics().getCommandCount("SET")).isEqualTo(1);
        assertThat(server.getMetrics().getErrorCount("unknown_command")).isEqualTo(1);
        assertThat(server.getMetrics().getKeyCount()).isEqualTo(1);
        assertThat(server.getConnectionCount()).isEqualTo(1);
        assertThat(server.getStore().keys()).isEqualTo(Collections.singleton("k"));
    }

    @Test
    void stop_closesServer() throws IOException {
        client.set("before", "v");

        server.stop();

        assertThat(server.isRunning()).isFalse();
        assertThatThrownBy(() -> client.set("afterStop", "value"))
            .isInstanceOf(IOException.class);
    }

    @Test
    void workerThreads_readFromSystemProperty() {
        System.setProperty("notredis.worker.threads", "3");
        try {
            if (System.getenv("NOTREDIS_WORKER_THREADS") == null) {
                assertThat(TcpServer.getConfiguredWorkerThreads()).isEqualTo(3);
            }
            System.setProperty("notredis.worker.threads", "zero");
            assertThat(TcpServer.getConfiguredWorkerThreads()).isPositive();
        } finally {
            System.clearProperty("notredis.worker.threads");
        }
    }
}
