package io.github.manjago.talos.replay;

import io.github.manjago.talos.select.OutcomeRecord;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;
import java.util.zip.CRC32;

/**
 * Append-only log of outcome records.
 * <p>
 * Producers hand records to a bounded queue and return at once; a single writer thread
 * appends frames {@code [int length][payload][long crc32]}. A full queue drops the record
 * with a warning, compilation never waits for the disk. Write failures are logged and
 * counted, never thrown at producers. After the first failed write the writer cuts the
 * file back to its last complete frame and writes nothing more; later records count as
 * failed or dropped. Every appended record ends up counted exactly once.
 * <p>
 * A crash can only leave a torn last frame. Readers stop at the first truncated or
 * corrupt frame, and opening a log for appending cuts such a tail off first.
 */
public final class ReplayLog implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ReplayLog.class);

    /** Frames longer than this are treated as corruption. */
    static final int MAX_FRAME = 1 << 24;

    private static final byte[] POISON = new byte[0];

    private final Path path;
    private final BlockingQueue<byte[]> queue;
    private final SeekableByteChannel out;
    private final Thread writer;

    /** Guards {@link #closed} so no record is queued behind the shutdown marker. */
    private final Object lock = new Object();
    private boolean closed;
    private volatile boolean broken;

    /** End of the last complete frame; writer thread only. */
    private long committed;

    private final AtomicLong written = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    private ReplayLog(Path path, int capacity, SeekableByteChannel out, long committed) {
        this.path = path;
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.out = out;
        this.committed = committed;
        this.writer = new Thread(this::drain, "talos-replay-writer");
        this.writer.setDaemon(true);
    }

    /**
     * Open {@code path} for appending, creating it if needed.
     *
     * @param capacity records that may wait for the writer
     */
    public static ReplayLog open(@NotNull Path path, int capacity) throws IOException {
        return open(path, capacity, UnaryOperator.identity());
    }

    static ReplayLog open(Path path, int capacity, UnaryOperator<SeekableByteChannel> channels) throws IOException {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1: " + capacity);
        }
        if (Files.exists(path)) {
            long valid = scan(path, null);
            long size = Files.size(path);
            if (valid < size) {
                log.warn("Replay log {} has a damaged tail, truncating {} bytes at offset {}",
                        path, size - valid, valid);
                try (FileChannel channel = FileChannel.open(path, StandardOpenOption.WRITE)) {
                    channel.truncate(valid);
                }
            }
        }
        SeekableByteChannel out = channels.apply(
                FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE));
        long end = out.size();
        out.position(end);
        ReplayLog replayLog = new ReplayLog(path, capacity, out, end);
        replayLog.writer.start();
        log.debug("Replay log {} open (queue {})", path, capacity);
        return replayLog;
    }

    /**
     * Queue {@code record} for writing.
     *
     * @return false if it was dropped because the queue is full or the log is closed
     */
    public boolean append(@NotNull OutcomeRecord record) {
        byte[] payload = OutcomeCodec.encode(record);
        synchronized (lock) {
            if (closed || broken) {
                dropped.incrementAndGet();
                log.warn("Replay log {}, dropped record for {}", closed ? "closed" : "failed", record.blockId());
                return false;
            }
            if (!queue.offer(payload)) {
                long count = dropped.incrementAndGet();
                log.warn("Replay queue full, dropped record for {} ({} dropped so far)", record.blockId(), count);
                return false;
            }
        }
        return true;
    }

    private void drain() {
        try {
            while (true) {
                byte[] payload = queue.take();
                if (payload == POISON) {
                    break;
                }
                writeFrame(payload);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            List<byte[]> pending = new ArrayList<>();
            queue.drainTo(pending);
            long lost = pending.stream().filter(payload -> payload != POISON).count();
            failed.addAndGet(lost);
            log.warn("Replay writer interrupted, {} records not written", lost);
        } finally {
            try {
                out.close();
            } catch (IOException e) {
                log.error("Failed to close replay log {}", path, e);
            }
        }
    }

    private void writeFrame(byte[] payload) {
        if (broken) {
            failed.incrementAndGet();
            return;
        }
        CRC32 crc = new CRC32();
        crc.update(payload);
        ByteBuffer frame = ByteBuffer.allocate(Integer.BYTES + payload.length + Long.BYTES);
        frame.putInt(payload.length).put(payload).putLong(crc.getValue()).flip();
        try {
            while (frame.hasRemaining()) {
                out.write(frame);
            }
            committed += frame.limit();
            written.incrementAndGet();
        } catch (IOException e) {
            broken = true;
            failed.incrementAndGet();
            log.error("Failed to append to replay log {}, no further records will be written", path, e);
            cutBack();
        }
    }

    private void cutBack() {
        try {
            out.truncate(committed);
            out.position(committed);
        } catch (IOException e) {
            log.error("Failed to cut replay log {} back to offset {}, readers stop at the torn frame",
                    path, committed, e);
        }
    }

    /**
     * Write everything queued so far and stop the writer.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
        }
        try {
            queue.put(POISON);
            writer.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writer.interrupt();
        }
        log.debug("Replay log {} closed: {} written, {} dropped, {} failed",
                path, written.get(), dropped.get(), failed.get());
    }

    public long getWritten() {
        return written.get();
    }

    public long getDropped() {
        return dropped.get();
    }

    public long getFailed() {
        return failed.get();
    }

    public Path getPath() {
        return path;
    }

    // ========== Reading ==========

    /**
     * All intact records of the log, oldest first. Reading stops at the first damaged frame.
     */
    public static List<OutcomeRecord> read(@NotNull Path path) throws IOException {
        List<OutcomeRecord> records = new ArrayList<>();
        if (!Files.exists(path)) {
            return records;
        }
        scan(path, records);
        log.debug("Read {} records from {}", records.size(), path);
        return records;
    }

    /**
     * The last {@code limit} intact records.
     */
    public static List<OutcomeRecord> readRecent(@NotNull Path path, int limit) throws IOException {
        List<OutcomeRecord> records = read(path);
        return records.size() <= limit ? records : new ArrayList<>(records.subList(records.size() - limit, records.size()));
    }

    /**
     * Walk the frames of {@code path}, collecting records when {@code sink} is given.
     *
     * @return length of the intact prefix in bytes
     */
    private static long scan(Path path, List<OutcomeRecord> sink) throws IOException {
        long offset = 0;
        try (InputStream stream = new BufferedInputStream(Files.newInputStream(path));
             DataInputStream in = new DataInputStream(stream)) {
            while (true) {
                int first = in.read();
                if (first < 0) {
                    return offset;
                }
                byte[] payload;
                try {
                    int length = (first << 24) | (in.readUnsignedByte() << 16)
                            | (in.readUnsignedByte() << 8) | in.readUnsignedByte();
                    if (length < 0 || length > MAX_FRAME) {
                        log.warn("{}: corrupt frame length {} at offset {}, stopping", path, length, offset);
                        return offset;
                    }
                    payload = new byte[length];
                    in.readFully(payload);
                    long expected = in.readLong();
                    CRC32 crc = new CRC32();
                    crc.update(payload);
                    if (crc.getValue() != expected) {
                        log.warn("{}: checksum mismatch at offset {}, stopping", path, offset);
                        return offset;
                    }
                } catch (EOFException e) {
                    log.warn("{}: truncated frame at offset {}, stopping", path, offset);
                    return offset;
                }
                if (sink != null) {
                    try {
                        sink.add(OutcomeCodec.decode(payload));
                    } catch (IOException e) {
                        log.warn("{}: undecodable record at offset {}, stopping: {}", path, offset, e.getMessage());
                        return offset;
                    }
                }
                offset += Integer.BYTES + payload.length + Long.BYTES;
            }
        }
    }
}
