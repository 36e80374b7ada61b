package com.notredis.core;

import com.notredis.command.CommandException;
import com.notredis.network.protocol.RespValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class StorageEngineTest {

    private InMemoryStore store;
    private StorageEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryStore();
        engine = new StorageEngine(store);
    }

    private RespValue run(String... tokens) {
        return engine.execute(Arrays.asList(tokens));
    }

    private CommandException failure(String... tokens) {
        try {
            run(tokens);
        } catch (CommandException e) {
            return e;
        }
        throw new AssertionError("expected a CommandException for " + Arrays.toString(tokens));
    }

    @Test
    void setThenGet_returnsLastWrite() {
        assertThat(run("SET", "k", "v1")).isEqualTo(RespValue.ok());
        run("SET", "k", "v2");

        assertThat(run("GET", "k")).isEqualTo(RespValue.bulkString("v2"));
    }

    @Test
    void get_absentKey_returnsNull() {
        assertThat(run("GET", "missing")).isEqualTo(RespValue.nullValue());
    }

    @Test
    void commandNames_areCaseInsensitive() {
        run("set", "k", "v");

        assertThat(run("gEt", "k")).isEqualTo(RespValue.bulkString("v"));
    }

    @Test
    void del_isIdempotent() {
        run("SET", "a", "1");
        run("SET", "b", "2");

        assertThat(run("DEL", "a", "b", "c")).isEqualTo(RespValue.integer(2));
        assertThat(run("DEL", "a", "b", "c")).isEqualTo(RespValue.integer(0));
        assertThat(run("GET", "a")).isEqualTo(RespValue.nullValue());
    }

    @Test
    void incr_absentKey_returnsOneAndStoresNumber() {
        assertThat(run("INCR", "n")).isEqualTo(RespValue.integer(1));
        assertThat(run("GET", "n")).isEqualTo(RespValue.bulkString("1"));
    }

    @Test
    void incr_numericText_returnsIntegerAndKeepsText() {
        run("SET", "n", "10");

        assertThat(run("INCR", "n")).isEqualTo(RespValue.integer(11));
        assertThat(run("GET", "n")).isEqualTo(RespValue.bulkString("11"));
    }

    @Test
    void incr_nonNumericText_isNotAnIntegerAndLeavesValue() {
        run("SET", "n", "abc");

        CommandException e = failure("INCR", "n");

        assertThat(e.getKind()).isEqualTo(CommandException.Kind.NOT_AN_INTEGER);
        assertThat(e.toReply().getText()).isEqualTo("ERR value is not an integer or out of range");
        assertThat(run("GET", "n")).isEqualTo(RespValue.bulkString("abc"));
    }

    @Test
    void incr_atMaxValue_isOverflow() {
        run("SET", "n", Long.toString(Long.MAX_VALUE));

        CommandException e = failure("INCR", "n");

        assertThat(e.getKind()).isEqualTo(CommandException.Kind.INCREMENT_OVERFLOW);
        assertThat(run("GET", "n")).isEqualTo(RespValue.bulkString(Long.toString(Long.MAX_VALUE)));
    }

    @Test
    void msetThenMget_alignsWithKeys() {
        assertThat(run("MSET", "a", "1", "b", "2")).isEqualTo(RespValue.ok());

        RespValue reply = run("MGET", "a", "missing", "b");

        assertThat(reply).isEqualTo(RespValue.array(
            RespValue.bulkString("1"),
            RespValue.nullValue(),
            RespValue.bulkString("2")));
    }

    @Test
    void mset_repeatedKey_lastPairWins() {
        run("MSET", "a", "1", "a", "2");

        assertThat(run("GET", "a")).isEqualTo(RespValue.bulkString("2"));
    }

    @Test
    void mset_oddArguments_isRejectedWithoutMutation() {
        CommandException e = failure("MSET", "a", "1", "b");

        assertThat(e.getKind()).isEqualTo(CommandException.Kind.SYNTAX_ERROR);
        assertThat(store.size()).isZero();
    }

    @Test
    void wrongArity_isSyntaxError() {
        assertThat(failure("GET").getKind()).isEqualTo(CommandException.Kind.SYNTAX_ERROR);
        assertThat(failure("GET", "a", "b").getKind()).isEqualTo(CommandException.Kind.SYNTAX_ERROR);
        assertThat(failure("SET", "a").getKind()).isEqualTo(CommandException.Kind.SYNTAX_ERROR);
        assertThat(failure("MGET").getKind()).isEqualTo(CommandException.Kind.SYNTAX_ERROR);
        assertThat(failure("MSET").getKind()).isEqualTo(CommandException.Kind.SYNTAX_ERROR);
        assertThat(failure("DEL").getKind()).isEqualTo(CommandException.Kind.SYNTAX_ERROR);
        assertThat(failure("INCR", "a", "b").getKind()).isEqualTo(CommandException.Kind.SYNTAX_ERROR);
    }

    @Test
    void nonDataCommand_isNotAvailable() {
        assertThat(failure("PING").getKind()).isEqualTo(CommandException.Kind.NOT_AVAILABLE);
        assertThat(failure("NOPE").getKind()).isEqualTo(CommandException.Kind.NOT_AVAILABLE);
    }

    @Test
    void concurrentIncr_countsEveryCall() throws Exception {
        int numThreads = 8;
        int callsPerThread = 500;
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        List<Future<Long>> lastReplies = new ArrayList<>();

        try {
            for (int t = 0; t < numThreads; t++) {
                lastReplies.add(executor.submit(() -> {
                    long last = 0;
                    for (int i = 0; i < callsPerThread; i++) {
                        long value = run("INCR", "hits").getInteger();
                        assertThat(value).isGreaterThan(last);
                        last = value;
                    }
                    return last;
                }));
            }

            List<Long> lasts = new ArrayList<>();
            for (Future<Long> future : lastReplies) {
                lasts.add(future.get(30, TimeUnit.SECONDS));
            }

            assertThat(run("GET", "hits"))
                .isEqualTo(RespValue.bulkString(Long.toString((long) numThreads * callsPerThread)));
            assertThat(lasts).hasSize(numThreads).contains((long) numThreads * callsPerThread);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void concurrentSetGetIncr_neverTearsValues() throws Exception {
        int numThreads = 8;
        int roundsPerThread = 300;
        long base = 1_000_000L;
        long maxIncrements = (long) numThreads * roundsPerThread;
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        List<Future<?>> results = new ArrayList<>();

        try {
            for (int t = 0; t < numThreads; t++) {
                long own = (t + 1) * base;
                results.add(executor.submit(() -> {
                    for (int i = 0; i < roundsPerThread; i++) {
                        assertThat(run("SET", "mixed", Long.toString(own))).isEqualTo(RespValue.ok());

                        long incremented = run("INCR", "mixed").getInteger();
                        assertWritten(incremented, base, numThreads, maxIncrements);

                        RespValue read = run("GET", "mixed");
                        assertThat(read.isBulkString()).isTrue();
                        assertWritten(Long.parseLong(read.getText()), base, numThreads, maxIncrements);
                    }
                    return null;
                }));
            }

            for (Future<?> future : results) {
                future.get(30, TimeUnit.SECONDS);
            }

            RespValue last = run("GET", "mixed");
            assertWritten(Long.parseLong(last.getText()), base, numThreads, maxIncrements);
            assertThat(store.get("mixed")).hasValueSatisfying(value -> assertThat(value.isText()).isTrue());
        } finally {
            executor.shutdownNow();
        }
    }

    // Every value must be one thread's SET value plus some number of INCRs
    private static void assertWritten(long value, long base, int numThreads, long maxIncrements) {
        assertThat(value / base).isBetween(1L, (long) numThreads);
        assertThat(value % base).isBetween(0L, maxIncrements);
    }
}
