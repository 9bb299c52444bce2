package io.github.manjago.talos.replay;

import io.github.manjago.talos.core.Instruction;
import io.github.manjago.talos.cost.CostOracle;
import io.github.manjago.talos.cost.TritonCostModel;
import io.github.manjago.talos.encode.BlockEncoder;
import io.github.manjago.talos.encode.FeatureTensor;
import io.github.manjago.talos.ir.BlockReader;
import io.github.manjago.talos.ir.TestBlocks;
import io.github.manjago.talos.lowering.NaiveLowering;
import io.github.manjago.talos.select.OutcomeRecord;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Replay log")
class ReplayLogTest {

    @TempDir
    Path tempDir;

    private List<OutcomeRecord> records;

    @BeforeEach
    void setUp() throws Exception {
        BlockEncoder encoder = new BlockEncoder();
        CostOracle oracle = new CostOracle(new TritonCostModel());
        NaiveLowering lowering = new NaiveLowering();

        records = new ArrayList<>();
        for (BlockReader.ParsedBlock parsed : TestBlocks.sample()) {
            FeatureTensor tensor = encoder.encode(parsed.block(), parsed.entry());
            List<Instruction> baseline = lowering.lower(parsed.block());
            long cost = oracle.cost(baseline);
            records.add(new OutcomeRecord(tensor, baseline, cost, baseline, cost, false, "v" + records.size()));
        }
    }

    private Path writeLog(String name, List<OutcomeRecord> toWrite) throws IOException {
        Path file = tempDir.resolve(name);
        try (ReplayLog log = ReplayLog.open(file, 100)) {
            for (OutcomeRecord record : toWrite) {
                assertTrue(log.append(record));
            }
        }
        return file;
    }

    @Test
    @DisplayName("Records read back in append order")
    void readBack() throws Exception {
        Path file = writeLog("replay.log", records);

        List<OutcomeRecord> read = ReplayLog.read(file);

        assertEquals(records, read);
    }

    @Test
    @DisplayName("Writer counts what it wrote")
    void counters() throws Exception {
        Path file = tempDir.resolve("counted.log");
        ReplayLog log = ReplayLog.open(file, 100);
        log.append(records.get(0));
        log.append(records.get(1));
        log.close();

        assertEquals(2, log.getWritten());
        assertEquals(0, log.getDropped());
        assertEquals(0, log.getFailed());
        assertEquals(file, log.getPath());
    }

    @Test
    @DisplayName("Appending to a closed log drops the record")
    void closedDrops() throws Exception {
        ReplayLog log = ReplayLog.open(tempDir.resolve("closed.log"), 1);
        log.close();

        assertFalse(log.append(records.get(0)));
        assertEquals(1, log.getDropped());
    }

    @Test
    @DisplayName("Records appended while closing are written or counted as dropped")
    void appendRacingClose() throws Exception {
        Path file = tempDir.resolve("race.log");
        ReplayLog log = ReplayLog.open(file, 1000);
        int threads = 4;
        int perThread = 50;
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();
        ExecutorService producers = Executors.newFixedThreadPool(threads);
        for (int t = 0; t < threads; t++) {
            producers.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    if (log.append(records.get(i % records.size()))) {
                        accepted.incrementAndGet();
                    }
                }
                return null;
            });
        }
        start.countDown();
        log.close();
        producers.shutdown();
        assertTrue(producers.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(threads * perThread, log.getWritten() + log.getDropped());
        assertEquals(accepted.get(), log.getWritten());
        assertEquals(0, log.getFailed());
        assertEquals(log.getWritten(), ReplayLog.read(file).size());
    }

    @Test
    @DisplayName("Failed write cuts the torn frame and stops the writer")
    void writeFailure() throws Exception {
        Path file = tempDir.resolve("failing.log");
        long twoFrames = Files.size(writeLog("two.log", records.subList(0, 2)));

        ReplayLog log = ReplayLog.open(file, 100, channel -> new FailingChannel(channel, 3));
        for (int i = 0; i < 5; i++) {
            log.append(records.get(i));
        }
        log.close();

        assertEquals(2, log.getWritten());
        assertTrue(log.getFailed() >= 1);
        assertEquals(5, log.getWritten() + log.getDropped() + log.getFailed());
        assertEquals(twoFrames, Files.size(file));
        assertEquals(records.subList(0, 2), ReplayLog.read(file));
    }

    /**
     * Writes half a buffer and fails on the {@code failAt}-th write, delegating everything else.
     */
    private static final class FailingChannel implements SeekableByteChannel {

        private final SeekableByteChannel delegate;
        private final int failAt;
        private int writes;

        FailingChannel(SeekableByteChannel delegate, int failAt) {
            this.delegate = delegate;
            this.failAt = failAt;
        }

        @Override
        public int write(ByteBuffer src) throws IOException {
            if (++writes == failAt) {
                ByteBuffer half = src.duplicate();
                half.limit(src.position() + src.remaining() / 2);
                delegate.write(half);
                throw new IOException("disk full");
            }
            return delegate.write(src);
        }

        @Override
        public int read(ByteBuffer dst) throws IOException {
            return delegate.read(dst);
        }

        @Override
        public long position() throws IOException {
            return delegate.position();
        }

        @Override
        public SeekableByteChannel position(long newPosition) throws IOException {
            delegate.position(newPosition);
            return this;
        }

        @Override
        public long size() throws IOException {
            return delegate.size();
        }

        @Override
        public SeekableByteChannel truncate(long size) throws IOException {
            delegate.truncate(size);
            return this;
        }

        @Override
        public boolean isOpen() {
            return delegate.isOpen();
        }

        @Override
        public void close() throws IOException {
            delegate.close();
        }
    }

    @Test
    @DisplayName("Reopening appends after existing records")
    void reopenAppends() throws Exception {
        Path file = writeLog("append.log", records.subList(0, 2));
        try (ReplayLog log = ReplayLog.open(file, 10)) {
            log.append(records.get(2));
        }

        assertEquals(records.subList(0, 3), ReplayLog.read(file));
    }

    @Test
    @DisplayName("Torn tail stops reading and is cut off on open")
    void tornTail() throws Exception {
        Path file = writeLog("torn.log", records.subList(0, 3));
        long intact = Files.size(file);
        Files.write(file, new byte[]{0, 0, 0x10, 0, 1, 2, 3}, StandardOpenOption.APPEND);

        assertEquals(records.subList(0, 3), ReplayLog.read(file));

        try (ReplayLog log = ReplayLog.open(file, 10)) {
            assertEquals(intact, Files.size(file));
            log.append(records.get(3));
        }
        assertEquals(records.subList(0, 4), ReplayLog.read(file));
    }

    @Test
    @DisplayName("Checksum mismatch stops reading at the damaged frame")
    void corruptChecksum() throws Exception {
        long firstFrame = Files.size(writeLog("first.log", records.subList(0, 1)));
        Path file = writeLog("corrupt.log", records.subList(0, 3));
        byte[] bytes = Files.readAllBytes(file);
        // inside the payload of the second frame
        bytes[(int) firstFrame + 50] ^= 0x55;
        Files.write(file, bytes);

        assertEquals(records.subList(0, 1), ReplayLog.read(file));
    }

    @Test
    @DisplayName("Missing log reads as empty")
    void missingFile() throws Exception {
        assertTrue(ReplayLog.read(tempDir.resolve("none.log")).isEmpty());
    }

    @Test
    @DisplayName("Recent records are the newest ones")
    void readRecent() throws Exception {
        Path file = writeLog("recent.log", records);

        assertEquals(records.subList(records.size() - 2, records.size()), ReplayLog.readRecent(file, 2));
        assertEquals(records, ReplayLog.readRecent(file, 1000));
    }

    @Test
    @DisplayName("Capacity must be positive")
    void capacity() {
        assertThrows(IllegalArgumentException.class, () -> ReplayLog.open(tempDir.resolve("x.log"), 0));
    }

    @Nested
    @DisplayName("OutcomeCodec")
    class Codec {

        @Test
        @DisplayName("Round trip keeps tensor, code and costs")
        void roundTrip() throws Exception {
            OutcomeRecord record = records.get(0);
            OutcomeRecord decoded = OutcomeCodec.decode(OutcomeCodec.encode(record));

            assertEquals(record, decoded);
            assertEquals(record.blockId(), decoded.blockId());
        }

        @Test
        @DisplayName("Truncated payload is rejected")
        void truncated() {
            byte[] bytes = OutcomeCodec.encode(records.get(0));
            byte[] truncated = new byte[bytes.length / 2];
            System.arraycopy(bytes, 0, truncated, 0, truncated.length);

            assertThrows(IOException.class, () -> OutcomeCodec.decode(truncated));
        }

        @Test
        @DisplayName("Unknown version is rejected")
        void unknownVersion() {
            byte[] bytes = OutcomeCodec.encode(records.get(0));
            bytes[3] = 9;

            assertThrows(IOException.class, () -> OutcomeCodec.decode(bytes));
        }
    }
}
