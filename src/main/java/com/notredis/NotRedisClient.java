package com.notredis;

import com.notredis.client.ClientConfig;
import com.notredis.network.protocol.RespCodec;
import com.notredis.network.protocol.RespException;
import com.notredis.network.protocol.RespValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Blocking client for a NotRedis server.
 * One socket, one request in flight; the connection is opened on first use.
 * Not thread-safe.
 */
public class NotRedisClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(NotRedisClient.class);
    private static final int INITIAL_BUFFER_SIZE = 16 * 1024;

    private final String host;
    private final int port;
    private final ClientConfig config;

    private Socket socket;
    private InputStream in;
    private OutputStream out;
    private ByteBuffer readBuffer;
    private volatile boolean closed = false;

    /**
     * Create a client for the given server.
     *
     * @param host server host name or address
     * @param port server port
     */
    public NotRedisClient(String host, int port) {
        this(new ClientConfig(), host, port);
    }

    /**
     * Create a client with custom configuration.
     *
     * @param config the client configuration
     * @param host   server host name or address
     * @param port   server port
     */
    public NotRedisClient(ClientConfig config, String host, int port) {
        if (host == null || host.isEmpty()) {
            throw new IllegalArgumentException("Host required");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Port must be between 1 and 65535, got: " + port);
        }
        this.host = host;
        this.port = port;
        this.config = config;
        this.readBuffer = ByteBuffer.allocate(INITIAL_BUFFER_SIZE);
    }

    /**
     * Ping the server to check connectivity.
     *
     * @return true if the server answers PONG
     */
    public boolean ping() {
        try {
            RespValue reply = checked(command("PING"));
            return "PONG".equals(reply.getText());
        } catch (IOException e) {
            logger.debug("Ping failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Ping with a message, which the server sends back.
     */
    public String ping(String message) throws IOException {
        return checked(command("PING", message)).getText();
    }

    public String echo(String message) throws IOException {
        return checked(command("ECHO", message)).getText();
    }

    /**
     * Get a value by key.
     *
     * @param key the key to retrieve
     * @return the value if found, empty otherwise
     * @throws IOException if the request fails or the server answers with an error
     */
    public Optional<String> get(String key) throws IOException {
        return textOf(checked(command("GET", key)));
    }

    public void set(String key, String value) throws IOException {
        checked(command("SET", key, value));
    }

    /**
     * Get several values at once.
     *
     * @return one entry per key, in key order
     */
    public List<Optional<String>> mget(String... keys) throws IOException {
        RespValue reply = checked(command(prepend("MGET", keys)));
        List<Optional<String>> values = new ArrayList<>(keys.length);
        for (RespValue element : reply.getElements()) {
            values.add(textOf(element));
        }
        return values;
    }

    /**
     * Set several keys in one atomic step.
     */
    public void mset(Map<String, String> entries) throws IOException {
        List<String> tokens = new ArrayList<>(entries.size() * 2 + 1);
        tokens.add("MSET");
        for (Map.Entry<String, String> entry : entries.entrySet()) {
            tokens.add(entry.getKey());
            tokens.add(entry.getValue());
        }
        checked(command(tokens.toArray(new String[0])));
    }

    /**
     * Delete keys.
     *
     * @return the number of keys that existed
     */
    public long del(String... keys) throws IOException {
        return checked(command(prepend("DEL", keys))).getInteger();
    }

    public long incr(String key) throws IOException {
        return checked(command("INCR", key)).getInteger();
    }

    public String configGet(String key) throws IOException {
        return checked(command("CONFIG", "GET", key)).getText();
    }

    public void configSet(String key, String value) throws IOException {
        checked(command("CONFIG", "SET", key, value));
    }

    /**
     * Ask the server to close the connection, then close this client.
     */
    public void quit() throws IOException {
        try {
            checked(command("QUIT"));
        } finally {
            close();
        }
    }

    /**
     * Send a command as an array of bulk strings and return the reply as is.
     * Error replies are returned, not thrown.
     *
     * @param tokens command name and arguments
     * @return the server's reply
     * @throws IOException if the connection fails
     */
    public RespValue command(String... tokens) throws IOException {
        return sendRaw(RespCodec.encodeToBytes(RespValue.command(tokens)));
    }

    /**
     * Write raw bytes and read one reply.
     *
     * @param request bytes to write, sent unmodified
     * @return the first complete reply
     * @throws IOException if the connection fails or the reply cannot be decoded
     */
    public RespValue sendRaw(byte[] request) throws IOException {
        ensureOpen();
        connect();
        try {
            out.write(request);
            out.flush();
            return readReply();
        } catch (IOException e) {
            disconnect();
            throw e;
        }
    }

    /**
     * Read one more reply from the connection, for pipelined requests.
     */
    public RespValue readReply() throws IOException {
        ensureOpen();
        if (socket == null) {
            throw new IOException("Not connected");
        }
        while (true) {
            readBuffer.flip();
            RespValue reply;
            try {
                reply = RespCodec.decodeFrame(readBuffer);
            } catch (RespException e) {
                readBuffer.clear();
                throw new IOException("Malformed reply: " + e.getMessage(), e);
            }
            readBuffer.compact();
            if (reply != null) {
                return reply;
            }

            if (!readBuffer.hasRemaining()) {
                growReadBuffer();
            }
            int read = in.read(readBuffer.array(), readBuffer.arrayOffset() + readBuffer.position(),
                readBuffer.remaining());
            if (read == -1) {
                throw new EOFException("Connection closed by server");
            }
            readBuffer.position(readBuffer.position() + read);
        }
    }

    private void growReadBuffer() throws IOException {
        int capacity = readBuffer.capacity();
        if (capacity >= config.getMaxReplyBytes()) {
            throw new IOException("Reply exceeds " + config.getMaxReplyBytes() + " bytes");
        }
        ByteBuffer larger = ByteBuffer.allocate((int) Math.min((long) capacity * 2, config.getMaxReplyBytes()));
        readBuffer.flip();
        larger.put(readBuffer);
        readBuffer = larger;
    }

    private void connect() throws IOException {
        if (socket != null) {
            return;
        }
        Socket s = new Socket();
        try {
            s.setTcpNoDelay(true);
            s.connect(new InetSocketAddress(host, port), config.getConnectTimeoutMs());
            s.setSoTimeout(config.getReadTimeoutMs());
        } catch (IOException e) {
            s.close();
            throw e;
        }
        socket = s;
        in = s.getInputStream();
        out = s.getOutputStream();
        readBuffer.clear();
        logger.debug("Connected to {}:{}", host, port);
    }

    private void disconnect() {
        if (socket == null) {
            return;
        }
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Error closing socket: {}", e.getMessage());
        }
        socket = null;
        in = null;
        out = null;
    }

    private static RespValue checked(RespValue reply) throws IOException {
        if (reply.isError()) {
            throw new IOException("Server error: " + reply.getText());
        }
        return reply;
    }

    private static Optional<String> textOf(RespValue value) {
        return value.isNull() ? Optional.empty() : Optional.of(value.getText());
    }

    private static String[] prepend(String name, String[] args) {
        String[] tokens = new String[args.length + 1];
        tokens[0] = name;
        System.arraycopy(args, 0, tokens, 1, args.length);
        return tokens;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Client is closed");
        }
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            disconnect();
            logger.debug("NotRedis client closed");
        }
    }

    /**
     * Check if the client is closed.
     */
    public boolean isClosed() {
        return closed;
    }

    public boolean isConnected() {
        return socket != null;
    }

    /**
     * Command-line interface: sends one command and prints the reply.
     */
    public static void main(String[] args) {
        if (args.length < 1) {
            System.out.println("Usage: NotRedisClient <host:port> [command] [args...]");
            System.out.println("Examples:");
            System.out.println("  NotRedisClient localhost:6379 ping");
            System.out.println("  NotRedisClient localhost:6379 set greeting hello");
            System.out.println("  NotRedisClient localhost:6379 mget a b c");
            return;
        }

        String address = args[0];
        int colon = address.lastIndexOf(':');
        String host = colon > 0 ? address.substring(0, colon) : address;
        int port;
        try {
            port = colon > 0 ? Integer.parseInt(address.substring(colon + 1)) : 6379;
        } catch (NumberFormatException e) {
            System.err.println("Invalid port in " + address);
            System.exit(1);
            return;
        }

        String[] tokens = args.length == 1
            ? new String[] {"PING"}
            : Arrays.copyOfRange(args, 1, args.length);
        tokens[0] = tokens[0].toUpperCase(Locale.ROOT);

        try (NotRedisClient client = new NotRedisClient(host, port)) {
            System.out.println(format(client.command(tokens)));
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    static String format(RespValue reply) {
        switch (reply.getType()) {
            case NULL:
                return "(nil)";
            case INTEGER:
                return "(integer) " + reply.getInteger();
            case ERROR:
                return "(error) " + reply.getText();
            case BULK_STRING:
                return "\"" + reply.getText() + "\"";
            case ARRAY:
                List<RespValue> elements = reply.getElements();
                if (elements.isEmpty()) {
                    return "(empty array)";
                }
                StringBuilder sb = new StringBuilder();
                for (int i = 0; i < elements.size(); i++) {
                    if (i > 0) {
                        sb.append(System.lineSeparator());
                    }
                    sb.append(i + 1).append(") ").append(format(elements.get(i)));
                }
                return sb.toString();
            default:
                return reply.getText();
        }
    }
}
