package com.notredis.network;

import com.notredis.command.CommandDispatcher;
import com.notredis.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.channels.CancelledKeyException;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * NIO-based TCP server for NotRedis.
 * Uses a single-threaded selector event loop for accepting connections and I/O,
 * with a worker pool for command execution.
 */
public class TcpServer {

    private static final Logger logger = LoggerFactory.getLogger(TcpServer.class);
    private static final int DEFAULT_WORKER_THREADS = Math.max(4, Runtime.getRuntime().availableProcessors());

    /**
     * Get worker thread count from environment/system property, or use default.
     * Checks: NOTREDIS_WORKER_THREADS env var, notredis.worker.threads property
     */
    static int getConfiguredWorkerThreads() {
        Integer fromEnv = parseThreads("NOTREDIS_WORKER_THREADS", System.getenv("NOTREDIS_WORKER_THREADS"));
        if (fromEnv != null) {
            return fromEnv;
        }
        Integer fromProperty = parseThreads("notredis.worker.threads", System.getProperty("notredis.worker.threads"));
        if (fromProperty != null) {
            return fromProperty;
        }
        return DEFAULT_WORKER_THREADS;
    }

    private static Integer parseThreads(String source, String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            int threads = Integer.parseInt(value.trim());
            if (threads > 0) {
                logger.info("Using {}={}", source, threads);
                return threads;
            }
            logger.warn("Invalid {} value: {}, using default", source, value);
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value: {}, using default", source, value);
        }
        return null;
    }

    private final String bindAddress;
    private final int requestedPort;
    private final CommandDispatcher dispatcher;
    private final MetricsCollector metrics;
    private final AtomicBoolean running;
    private final Map<SocketChannel, ConnectionHandler> connections;
    private final ExecutorService workerPool;

    private volatile int boundPort;
    private Selector selector;
    private ServerSocketChannel serverChannel;
    private Thread serverThread;

    /**
     * Create a new TCP server.
     *
     * @param bindAddress the address to listen on
     * @param port        the port to listen on, 0 for an ephemeral port
     * @param dispatcher  executes decoded requests
     * @param metrics     the metrics collector
     */
    public TcpServer(String bindAddress, int port, CommandDispatcher dispatcher, MetricsCollector metrics) {
        this.bindAddress = bindAddress;
        this.requestedPort = port;
        this.boundPort = port;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.running = new AtomicBoolean(false);
        this.connections = new ConcurrentHashMap<>();
        int workerThreads = getConfiguredWorkerThreads();
        AtomicInteger threadIds = new AtomicInteger();
        this.workerPool = new ThreadPoolExecutor(
                workerThreads,
                workerThreads,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(workerThreads * 1000),
                r -> {
                    Thread t = new Thread(r, "notredis-worker-" + threadIds.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.CallerRunsPolicy());
        logger.info("Initialized worker pool with {} threads", workerThreads);
    }

    /**
     * Start the server on a background selector thread.
     *
     * @throws IOException if the server cannot be started
     */
    public void start() throws IOException {
        open();
        serverThread = new Thread(this::eventLoop, "notredis-server-" + boundPort);
        serverThread.start();
    }

    /**
     * Start the server and block until it's stopped.
     *
     * @throws IOException if the server cannot be started
     */
    public void startAndBlock() throws IOException {
        open();
        eventLoop();
    }

    private void open() throws IOException {
        if (running.getAndSet(true)) {
            throw new IllegalStateException("Server already running");
        }

        try {
            selector = Selector.open();
            serverChannel = ServerSocketChannel.open();
            serverChannel.configureBlocking(false);
            serverChannel.socket().setReuseAddress(true);
            serverChannel.bind(new InetSocketAddress(bindAddress, requestedPort));
            serverChannel.register(selector, SelectionKey.OP_ACCEPT);
        } catch (IOException e) {
            running.set(false);
            closeQuietly();
            throw e;
        }

        boundPort = ((InetSocketAddress) serverChannel.getLocalAddress()).getPort();
        logger.info("NotRedis server listening on {}:{}", bindAddress, boundPort);
    }

    private void eventLoop() {
        while (running.get()) {
            try {
                int ready = selector.select(1000); // 1 second timeout for clean shutdown

                if (ready == 0) {
                    continue;
                }

                Iterator<SelectionKey> keys = selector.selectedKeys().iterator();
                while (keys.hasNext()) {
                    SelectionKey key = keys.next();
                    keys.remove();

                    if (!key.isValid()) {
                        continue;
                    }

                    try {
                        if (key.isAcceptable()) {
                            accept();
                        }
                        if (key.isValid() && key.isReadable()) {
                            read(key);
                        }
                        if (key.isValid() && key.isWritable()) {
                            write(key);
                        }
                    } catch (CancelledKeyException e) {
                        logger.trace("Key cancelled while handling {}", key.channel());
                    } catch (IOException | RuntimeException e) {
                        logger.error("Error handling connection {}: {}", key.channel(), e.getMessage(), e);
                        dropConnection(key);
                    } catch (Error e) {
                        // One connection must not take the selector thread down with it
                        logger.error("Fatal error handling connection {}", key.channel(), e);
                        dropConnection(key);
                    }
                }
            } catch (IOException e) {
                if (running.get()) {
                    logger.error("Selector error: {}", e.getMessage());
                }
            }
        }

        cleanup();
    }

    private void accept() throws IOException {
        SocketChannel clientChannel = serverChannel.accept();
        if (clientChannel == null) {
            return;
        }

        clientChannel.configureBlocking(false);
        clientChannel.socket().setTcpNoDelay(true);
        clientChannel.socket().setKeepAlive(true);

        ConnectionHandler handler = new ConnectionHandler(clientChannel, dispatcher, metrics,
                this, workerPool, selector);
        connections.put(clientChannel, handler);

        SelectionKey key = clientChannel.register(selector, SelectionKey.OP_READ, handler);
        handler.attach(key);

        logger.debug("Accepted connection from {}", handler.getRemoteAddress());
    }

    private void read(SelectionKey key) {
        ConnectionHandler handler = (ConnectionHandler) key.attachment();
        if (handler == null) {
            key.cancel();
            return;
        }

        if (!handler.handleRead(key)) {
            closeConnection(key, handler);
        }
    }

    private void write(SelectionKey key) {
        ConnectionHandler handler = (ConnectionHandler) key.attachment();
        if (handler == null) {
            key.cancel();
            return;
        }

        if (!handler.handleWrite(key)) {
            closeConnection(key, handler);
        }
    }

    private void dropConnection(SelectionKey key) {
        ConnectionHandler handler = (ConnectionHandler) key.attachment();
        if (handler != null) {
            closeConnection(key, handler);
        } else {
            key.cancel();
        }
    }

    private void closeConnection(SelectionKey key, ConnectionHandler handler) {
        key.cancel();
        connections.remove((SocketChannel) key.channel());
        handler.close();
    }

    /**
     * Stop the server.
     */
    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }

        logger.info("Stopping NotRedis server on port {}", boundPort);

        // Wake up the selector to exit the event loop
        if (selector != null) {
            selector.wakeup();
        }

        if (serverThread != null && serverThread != Thread.currentThread()) {
            try {
                serverThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void cleanup() {
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(5, TimeUnit.SECONDS)) {
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }

        for (ConnectionHandler handler : connections.values()) {
            handler.close();
        }
        connections.clear();

        closeQuietly();
        logger.info("NotRedis server stopped on port {}", boundPort);
    }

    private void closeQuietly() {
        if (serverChannel != null) {
            try {
                serverChannel.close();
            } catch (IOException e) {
                logger.debug("Error closing server channel: {}", e.getMessage());
            }
        }
        if (selector != null) {
            try {
                selector.close();
            } catch (IOException e) {
                logger.debug("Error closing selector: {}", e.getMessage());
            }
        }
    }

    /**
     * Check if the server is running.
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * Get the number of open connections.
     */
    public int getConnectionCount() {
        return connections.size();
    }

    /**
     * Get the port this server is listening on. Once started this is the bound
     * port, which differs from the requested one when 0 was requested.
     */
    public int getPort() {
        return boundPort;
    }

    public String getBindAddress() {
        return bindAddress;
    }

    // Called by ConnectionHandler when a connection closes itself
    void removeConnection(SocketChannel channel) {
        connections.remove(channel);
    }
}
