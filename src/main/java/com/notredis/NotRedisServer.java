package com.notredis;

import com.notredis.command.CommandDispatcher;
import com.notredis.config.ConfigTable;
import com.notredis.config.ServerConfig;
import com.notredis.core.InMemoryStore;
import com.notredis.core.KVStore;
import com.notredis.core.StorageEngine;
import com.notredis.network.TcpServer;
import com.notredis.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.CountDownLatch;

/**
 * NotRedis server entry point.
 * Wires the configuration table, the store, the dispatcher and the TCP server together.
 */
public class NotRedisServer {

    private static final Logger logger = LoggerFactory.getLogger(NotRedisServer.class);
    public static final String VERSION = "1.0.0";

    private final ConfigTable configuration;
    private final KVStore store;
    private final MetricsCollector metrics;
    private final CommandDispatcher dispatcher;
    private final TcpServer tcpServer;
    private final CountDownLatch shutdownLatch;

    /**
     * Create a server listening where the configuration says.
     *
     * @param configuration the configuration table; "bind" and "port" are read once here
     */
    public NotRedisServer(ConfigTable configuration) {
        this(configuration, new InMemoryStore(), new MetricsCollector());
    }

    /**
     * Create a server with custom store and metrics.
     *
     * @param configuration the configuration table
     * @param store         the key-value store to use
     * @param metrics       the metrics collector to use
     */
    public NotRedisServer(ConfigTable configuration, KVStore store, MetricsCollector metrics) {
        this.configuration = configuration;
        this.store = store;
        this.metrics = metrics;
        this.shutdownLatch = new CountDownLatch(1);
        this.dispatcher = new CommandDispatcher(new StorageEngine(store), configuration);
        this.tcpServer = new TcpServer(configuration.getBindAddress(), configuration.getPort(), dispatcher, metrics);
        metrics.bindKeyCount(store::size);
    }

    /**
     * Start the server.
     */
    public void start() throws IOException {
        logger.info("Starting NotRedis Server v{}", VERSION);
        tcpServer.start();
        logger.info("NotRedis Server started successfully on {}:{}", tcpServer.getBindAddress(), getPort());
    }

    /**
     * Start the server and block until stopped.
     */
    public void startAndBlock() throws IOException, InterruptedException {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received");
            stop();
        }, "notredis-shutdown"));

        start();
        shutdownLatch.await();
    }

    /**
     * Stop the server.
     */
    public void stop() {
        if (shutdownLatch.getCount() == 0) {
            return;
        }
        logger.info("Stopping NotRedis Server");
        tcpServer.stop();
        logger.info("{}", metrics.summary());
        shutdownLatch.countDown();
        logger.info("NotRedis Server stopped");
    }

    /**
     * Check if the server is running.
     */
    public boolean isRunning() {
        return tcpServer.isRunning();
    }

    /**
     * Get the port the server listens on.
     */
    public int getPort() {
        return tcpServer.getPort();
    }

    public ConfigTable getConfiguration() {
        return configuration;
    }

    public KVStore getStore() {
        return store;
    }

    public MetricsCollector getMetrics() {
        return metrics;
    }

    public CommandDispatcher getDispatcher() {
        return dispatcher;
    }

    /**
     * Get the number of open connections.
     */
    public int getConnectionCount() {
        return tcpServer.getConnectionCount();
    }

    /**
     * Main entry point.
     */
    public static void main(String[] args) {
        ServerConfig serverConfig = ServerConfig.parse(args);
        if (serverConfig.isHelpRequested()) {
            printHelp();
            return;
        }
        if (serverConfig.isVersionRequested()) {
            System.out.println("NotRedis Server v" + VERSION);
            return;
        }

        ConfigTable configuration;
        try {
            configuration = serverConfig.load(System.in);
        } catch (IOException e) {
            exitWithError("Cannot read configuration: " + e.getMessage());
            return;
        }

        printBanner();
        ensureLogsDirectory();

        NotRedisServer server = new NotRedisServer(configuration);
        try {
            server.startAndBlock();
        } catch (IOException e) {
            logger.error("Failed to start server: {}", e.getMessage());
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void ensureLogsDirectory() {
        File logsDir = new File("logs");
        if (!logsDir.exists()) {
            if (logsDir.mkdir()) {
                logger.info("Created logs directory");
            } else {
                logger.warn("Failed to create logs directory, file logging may not work");
            }
        }
    }

    private static void printBanner() {
        System.out.println();
        System.out.println("  _   _       _   ____          _ _");
        System.out.println(" | \\ | | ___ | |_|  _ \\ ___  __| (_)___");
        System.out.println(" |  \\| |/ _ \\| __| |_) / _ \\/ _` | / __|");
        System.out.println(" | |\\  | (_) | |_|  _ <  __/ (_| | \\__ \\");
        System.out.println(" |_| \\_|\\___/ \\__|_| \\_\\___|\\__,_|_|___/");
        System.out.println();
        System.out.println("  In-memory Key-Value Store v" + VERSION);
        System.out.println();
    }

    private static void exitWithError(String message) {
        System.err.println("Error: " + message);
        System.err.println("Use --help for usage information");
        System.exit(1);
    }

    private static void printHelp() {
        System.out.println("NotRedis Server - In-memory Key-Value Store");
        System.out.println();
        System.out.println("Usage: notredis [config-file] [--key value ...] [-]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  config-file                  Config file of \"key value\" lines (default: ./redis.conf)");
        System.out.println("  --<key> <value>              Set a config key, overriding the file and stdin");
        System.out.println("  -                            Read more config lines from standard input");
        System.out.println("  -h, --help                   Show this help message");
        System.out.println("  -v, --version                Show version");
        System.out.println();
        System.out.println("Config keys:");
        System.out.println("  port <port>                  Port to listen on (default: " + ConfigTable.DEFAULT_PORT + ")");
        System.out.println("  bind <address>               Address to listen on (default: " + ConfigTable.DEFAULT_BIND + ")");
        System.out.println();
        System.out.println("Environment:");
        System.out.println("  NOTREDIS_WORKER_THREADS      Worker pool size (default: max(4, cpus))");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  notredis /etc/redis/redis.conf");
        System.out.println("  notredis --port 6380 --bind 0.0.0.0");
        System.out.println("  echo \"port 6380\" | notredis -");
        System.out.println();
    }
}
