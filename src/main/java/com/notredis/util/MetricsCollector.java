package com.notredis.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.IntSupplier;

/**
 * Metrics collector for NotRedis.
 * Tracks commands per name, latency, errors per kind, connections and key count.
 */
public class MetricsCollector {

    private static final String COMMANDS = "notredis.commands";
    private static final String LATENCY = "notredis.latency";
    private static final String ERRORS = "notredis.errors";

    private final MeterRegistry registry;

    // Gauges
    private final LongAdder activeConnections;
    private final LongAdder totalConnections;

    /**
     * Create a metrics collector with a simple registry.
     */
    public MetricsCollector() {
        this(new SimpleMeterRegistry());
    }

    /**
     * Create a metrics collector with a custom registry.
     *
     * @param registry the Micrometer registry to use
     */
    public MetricsCollector(MeterRegistry registry) {
        this.registry = registry;
        this.activeConnections = new LongAdder();
        this.totalConnections = new LongAdder();

        Gauge.builder("notredis.connections", activeConnections, LongAdder::sum)
            .description("Active connections")
            .register(registry);

        Gauge.builder("notredis.connections.total", totalConnections, LongAdder::sum)
            .description("Connections accepted since start")
            .register(registry);
    }

    /**
     * Report the store's key count through a gauge.
     *
     * @param keyCount supplier of the current number of keys
     */
    public void bindKeyCount(IntSupplier keyCount) {
        // Gauges hold their state weakly and nothing else references the supplier
        Gauge.builder("notredis.keys", keyCount, IntSupplier::getAsInt)
            .description("Number of keys in the store")
            .strongReference(true)
            .register(registry);
    }

    // Command recording

    public void recordCommand(String command, long durationNanos) {
        String name = command.toLowerCase(Locale.ROOT);
        Counter.builder(COMMANDS)
            .tag("command", name)
            .description("Commands executed")
            .register(registry)
            .increment();
        Timer.builder(LATENCY)
            .tag("command", name)
            .description("Command latency")
            .register(registry)
            .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordError(String kind) {
        Counter.builder(ERRORS)
            .tag("kind", kind.toLowerCase(Locale.ROOT))
            .description("Failed requests")
            .register(registry)
            .increment();
    }

    // Connection tracking

    public void connectionOpened() {
        activeConnections.increment();
        totalConnections.increment();
    }

    public void connectionClosed() {
        activeConnections.decrement();
    }

    // Getters for metrics values

    public long getTotalCommands() {
        return (long) registry.find(COMMANDS).counters().stream()
            .mapToDouble(Counter::count)
            .sum();
    }

    public long getCommandCount(String command) {
        Counter counter = registry.find(COMMANDS).tag("command", command.toLowerCase(Locale.ROOT)).counter();
        return counter != null ? (long) counter.count() : 0;
    }

    public long getTotalErrors() {
        return (long) registry.find(ERRORS).counters().stream()
            .mapToDouble(Counter::count)
            .sum();
    }

    public long getErrorCount(String kind) {
        Counter counter = registry.find(ERRORS).tag("kind", kind.toLowerCase(Locale.ROOT)).counter();
        return counter != null ? (long) counter.count() : 0;
    }

    public long getActiveConnections() {
        return activeConnections.sum();
    }

    public long getTotalConnections() {
        return totalConnections.sum();
    }

    public long getKeyCount() {
        Gauge gauge = registry.find("notredis.keys").gauge();
        return gauge != null ? (long) gauge.value() : 0;
    }

    public double getMeanLatencyMs() {
        long count = 0;
        double totalMs = 0;
        for (Timer timer : registry.find(LATENCY).timers()) {
            count += timer.count();
            totalMs += timer.totalTime(TimeUnit.MILLISECONDS);
        }
        return count > 0 ? totalMs / count : 0.0;
    }

    /**
     * Get the underlying registry.
     *
     * @return the MeterRegistry
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Print a summary of current metrics.
     *
     * @return formatted metrics string
     */
    public String summary() {
        return String.format(
            "NotRedis Metrics Summary%n" +
            "========================%n" +
            "Commands: %d (errors=%d)%n" +
            "Connections: %d active, %d total%n" +
            "Keys: %d%n" +
            "Latency (mean): %.3fms",
            getTotalCommands(), getTotalErrors(),
            getActiveConnections(), getTotalConnections(),
            getKeyCount(),
            getMeanLatencyMs()
        );
    }
}
