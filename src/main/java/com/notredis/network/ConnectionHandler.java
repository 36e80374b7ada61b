package com.notredis.network;

import com.notredis.command.CommandDispatcher;
import com.notredis.command.CommandException;
import com.notredis.command.CommandType;
import com.notredis.network.protocol.RespCodec;
import com.notredis.network.protocol.RespException;
import com.notredis.network.protocol.RespValue;
import com.notredis.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.SocketChannel;
import java.util.LinkedList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ExecutorService;

/**
 * Handles individual client connections.
 * Frames requests out of the read buffer on the selector thread, executes them
 * one at a time on the worker pool and queues the encoded replies in request order.
 */
public class ConnectionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionHandler.class);
    private static final int BUFFER_SIZE = 64 * 1024;
    private static final int MAX_QUEUED_RESPONSES = 10_000;
    private static final int MAX_QUEUED_COMMANDS = 10_000;
    static final int MAX_READ_BUFFER_SIZE = 64 * 1024 * 1024;

    private final SocketChannel channel;
    private final CommandDispatcher dispatcher;
    private final MetricsCollector metrics;
    private final TcpServer server;
    private final ExecutorService workerPool;
    private final Selector selector;
    private ByteBuffer readBuffer; // grows up to MAX_READ_BUFFER_SIZE
    private final ByteBuffer writeBuffer;
    private final String clientAddress;
    private final Queue<ByteBuffer> pendingResponses;
    private final Queue<Pending> pendingCommands;
    private ByteBuffer currentResponse; // Track partial write progress
    private boolean closed = false;
    private volatile SelectionKey selectionKey;
    private boolean commandInProgress = false;
    private boolean writeInProgress = false;

    // Set once QUIT or a protocol error has been answered; the connection closes after the flush
    private volatile boolean closeAfterFlush = false;
    // Selector thread only: input after a protocol error is dropped
    private boolean discardInput = false;

    // Lock for protecting interestOps modifications
    private final Object interestOpsLock = new Object();

    /**
     * A framed request, or the protocol error that ended framing, waiting for a worker.
     */
    private static final class Pending {
        final RespValue request;
        final String protocolError;

        private Pending(RespValue request, String protocolError) {
            this.request = request;
            this.protocolError = protocolError;
        }

        static Pending request(RespValue request) {
            return new Pending(request, null);
        }

        static Pending protocolError(String message) {
            return new Pending(null, message);
        }
    }

    public ConnectionHandler(SocketChannel channel, CommandDispatcher dispatcher, MetricsCollector metrics,
            TcpServer server, ExecutorService workerPool, Selector selector) {
        this.channel = channel;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.server = server;
        this.workerPool = workerPool;
        this.selector = selector;
        this.readBuffer = ByteBuffer.allocateDirect(BUFFER_SIZE);
        this.writeBuffer = ByteBuffer.allocateDirect(BUFFER_SIZE);
        this.clientAddress = getClientAddress();
        this.pendingResponses = new LinkedList<>();
        this.pendingCommands = new LinkedList<>();
        metrics.connectionOpened();
        logger.debug("New connection from {}", clientAddress);
    }

    private String getClientAddress() {
        try {
            return String.valueOf(channel.getRemoteAddress());
        } catch (IOException e) {
            return "unknown";
        }
    }

    /**
     * Remember the key this connection is registered under, so worker threads
     * can request write interest.
     */
    void attach(SelectionKey key) {
        this.selectionKey = key;
    }

    /**
     * Handle a read event from the selector.
     *
     * @param key the selection key
     * @return true if the connection should continue, false to close
     */
    public boolean handleRead(SelectionKey key) {
        if (this.selectionKey == null) {
            this.selectionKey = key;
        }

        try {
            int bytesRead = channel.read(readBuffer);
            if (bytesRead == -1) {
                logger.debug("Client {} disconnected", clientAddress);
                return false;
            }

            if (discardInput || closeAfterFlush) {
                readBuffer.clear();
                return true;
            }

            if (bytesRead > 0) {
                if (!processReadBuffer()) {
                    return false;
                }

                // Whatever is left after framing is one incomplete request
                if (!discardInput && readBuffer.position() == readBuffer.capacity()) {
                    growReadBuffer();
                }
            }
            return !isClosed();
        } catch (IOException e) {
            logger.warn("Read error from {}: {}", clientAddress, e.getMessage());
            return false;
        }
    }

    /**
     * Frame and queue every complete request in the read buffer.
     *
     * @return false if the connection was closed because its queue overflowed
     */
    private boolean processReadBuffer() {
        readBuffer.flip();

        boolean open = true;
        try {
            RespValue request;
            while (open && (request = RespCodec.decodeFrame(readBuffer)) != null) {
                open = enqueue(Pending.request(request));
            }
        } catch (RespException e) {
            logger.warn("Protocol error from {} (closing connection): {}", clientAddress, e.getMessage());
            open = rejectInput(e.getMessage());
        }

        if (!open || discardInput) {
            readBuffer.clear();
        } else {
            readBuffer.compact();
        }
        return open;
    }

    private boolean rejectInput(String message) {
        discardInput = true;
        return enqueue(Pending.protocolError(message));
    }

    private boolean enqueue(Pending pending) {
        synchronized (pendingCommands) {
            if (pendingCommands.size() >= MAX_QUEUED_COMMANDS) {
                logger.error("Command queue overflow for {}, closing connection", clientAddress);
                close();
                return false;
            }
            pendingCommands.offer(pending);
        }
        processNextCommand();
        return true;
    }

    /**
     * Process the next request in the queue if one is not already being processed.
     * Requests of one connection run one at a time, so replies keep request order.
     */
    private void processNextCommand() {
        synchronized (pendingCommands) {
            if (closeAfterFlush) {
                pendingCommands.clear();
                return;
            }
            if (commandInProgress || pendingCommands.isEmpty()) {
                return;
            }

            Pending pending = pendingCommands.poll();
            commandInProgress = true;
            workerPool.submit(() -> {
                try {
                    process(pending);
                } finally {
                    synchronized (pendingCommands) {
                        commandInProgress = false;
                    }
                    processNextCommand();
                }
            });
        }
    }

    /**
     * Execute one request on a worker thread and queue its reply.
     */
    private void process(Pending pending) {
        if (pending.protocolError != null) {
            metrics.recordError("protocol");
            queueResponseAsync(RespValue.error("ERR Protocol error: " + singleLine(pending.protocolError)), true);
            return;
        }

        long startTime = System.nanoTime();
        String name = "unknown";
        try {
            List<String> tokens = CommandDispatcher.tokenize(pending.request);
            CommandType type = CommandDispatcher.resolve(tokens);
            name = type.name();
            RespValue reply = dispatcher.dispatch(type, tokens);
            metrics.recordCommand(name, System.nanoTime() - startTime);
            queueResponseAsync(reply, type == CommandType.QUIT);
        } catch (CommandException e) {
            logger.debug("Command {} from {} failed: {}", name, clientAddress, e.getMessage());
            metrics.recordError(e.getKind().name());
            queueResponseAsync(e.toReply(), false);
        } catch (RuntimeException e) {
            logger.error("Error processing command {} from {}: {}", name, clientAddress, e.toString(), e);
            metrics.recordError("internal");
            queueResponseAsync(RespValue.error("ERR internal error"), false);
        }
    }

    /**
     * Queue a reply from a worker thread and wake up the selector.
     *
     * @param reply      the reply to send
     * @param closeAfter close the connection once this reply has been written
     */
    private void queueResponseAsync(RespValue reply, boolean closeAfter) {
        ByteBuffer encoded = RespCodec.encode(reply);

        synchronized (this) {
            if (closed) {
                return; // Connection closed, discard response
            }

            if (pendingResponses.size() >= MAX_QUEUED_RESPONSES) {
                logger.error("Response queue overflow for {}, closing connection", clientAddress);
                close();
                return;
            }

            pendingResponses.offer(encoded);
            if (closeAfter) {
                closeAfterFlush = true;
            }

            SelectionKey key = selectionKey;
            if (!writeInProgress && key != null && key.isValid()) {
                writeInProgress = true;
                synchronized (interestOpsLock) {
                    if (key.isValid()) {
                        key.interestOps(key.interestOps() | SelectionKey.OP_WRITE);
                    }
                }
                // Wake up selector so it notices the interest ops change
                selector.wakeup();
            }
        }
    }

    private void drainToWriteBuffer() {
        while (writeBuffer.hasRemaining()) {
            if (currentResponse == null || !currentResponse.hasRemaining()) {
                currentResponse = pendingResponses.poll();
                if (currentResponse == null) {
                    break;
                }
            }

            int toWrite = Math.min(writeBuffer.remaining(), currentResponse.remaining());
            if (toWrite > 0) {
                int oldLimit = currentResponse.limit();
                currentResponse.limit(currentResponse.position() + toWrite);
                writeBuffer.put(currentResponse);
                currentResponse.limit(oldLimit);
            }
        }
    }

    /**
     * Handle a write event from the selector.
     *
     * @param key the selection key
     * @return true if the connection should continue, false to close
     */
    public boolean handleWrite(SelectionKey key) {
        synchronized (this) {
            try {
                drainToWriteBuffer();
                writeBuffer.flip();
                channel.write(writeBuffer);
                writeBuffer.compact();

                boolean allWritten = writeBuffer.position() == 0
                        && pendingResponses.isEmpty()
                        && (currentResponse == null || !currentResponse.hasRemaining());

                if (allWritten) {
                    writeInProgress = false;
                    currentResponse = null;
                    if (closeAfterFlush) {
                        logger.debug("Closing {} after final reply", clientAddress);
                        return false;
                    }
                    synchronized (interestOpsLock) {
                        if (key.isValid()) {
                            key.interestOps(key.interestOps() & ~SelectionKey.OP_WRITE);
                        }
                    }
                }
                return true;
            } catch (IOException e) {
                logger.warn("Write error to {}: {}", clientAddress, e.getMessage());
                return false;
            }
        }
    }

    /**
     * Grow the read buffer to accommodate a larger request.
     * The buffer is in write mode before and after, with unread bytes at the start.
     * At the size limit the request is rejected as a protocol error instead.
     */
    private void growReadBuffer() {
        int currentCapacity = readBuffer.capacity();
        if (currentCapacity >= MAX_READ_BUFFER_SIZE) {
            logger.warn("Request from {} exceeds {} bytes, closing connection", clientAddress, MAX_READ_BUFFER_SIZE);
            rejectInput("request exceeds " + MAX_READ_BUFFER_SIZE + " bytes");
            readBuffer.clear();
            return;
        }

        int preservedBytes = readBuffer.position();
        int newCapacity = (int) Math.min((long) currentCapacity * 2, MAX_READ_BUFFER_SIZE);
        logger.debug("Growing read buffer from {} to {} bytes for {} (preserving {} bytes)",
                currentCapacity, newCapacity, clientAddress, preservedBytes);

        ByteBuffer newBuffer = ByteBuffer.allocateDirect(newCapacity);
        readBuffer.flip();
        newBuffer.put(readBuffer);
        readBuffer = newBuffer;
    }

    private static String singleLine(String text) {
        return text.replace('\r', ' ').replace('\n', ' ');
    }

    /**
     * Close this connection and release resources.
     * Idempotent and thread-safe.
     */
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }

        try {
            channel.close();
        } catch (IOException e) {
            logger.debug("Error closing connection: {}", e.getMessage());
        }

        if (server != null) {
            server.removeConnection(channel);
        }

        metrics.connectionClosed();
        logger.debug("Connection closed: {}", clientAddress);
    }

    public boolean isClosed() {
        synchronized (this) {
            return closed;
        }
    }

    public String getRemoteAddress() {
        return clientAddress;
    }
}
