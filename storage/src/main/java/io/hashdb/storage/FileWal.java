package io.hashdb.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;

/**
 * File-backed WAL that appends header+payload records to segment files.
 * <p>
 * Properties:
 *  - On construction it creates the directory if needed and opens a segment for append
 *    ("00000001.log", "00000002.log", ...). A non-empty newest segment is never appended
 *    to again, so a torn tail left by a crash cannot hide later records.
 *  - append() writes the bytes and calls force(true) before returning.
 *  - rotateIfNeeded() opens the next segment once rotateBytes were written.
 *  - The reader walks every segment oldest first, validating magic/version/length and
 *    CRC. A truncated or corrupt record ends its segment; reading resumes with the next.
 */
public class FileWal implements Wal {
    private static final String SUFFIX = ".log";

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment = 0;

    public FileWal(Path dir, long rotateBytes) {
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new DurableStoreException("cannot create WAL directory " + dir, e);
        }
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] serializedRecord) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(serializedRecord);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true);
            writtenInSegment += serializedRecord.length;
        } catch (IOException e) {
            throw new DurableStoreException("WAL append failed", e);
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        try {
            ch.close();
            int index = Integer.parseInt(current.getFileName().toString().replace(SUFFIX, ""));
            current = dir.resolve(String.format("%08d%s", index + 1, SUFFIX));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
        } catch (IOException e) {
            throw new DurableStoreException("WAL rotation failed", e);
        }
    }

    @Override
    public WalReader openReader() {
        return new Reader(segments(dir));
    }

    @Override
    public synchronized void close() {
        try {
            if (ch != null) ch.close();
        } catch (IOException e) {
            throw new DurableStoreException("WAL close failed", e);
        }
    }

    private void openNewestOrCreate() {
        List<Path> segs = segments(dir);
        try {
            if (segs.isEmpty()) {
                current = dir.resolve(String.format("%08d%s", 1, SUFFIX));
            } else {
                Path newest = segs.get(segs.size() - 1);
                int index = Integer.parseInt(newest.getFileName().toString().replace(SUFFIX, ""));
                current = Files.size(newest) == 0 ? newest : dir.resolve(String.format("%08d%s", index + 1, SUFFIX));
            }
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = ch.size();
            ch.position(writtenInSegment);
        } catch (IOException e) {
            throw new DurableStoreException("cannot open WAL segment " + current, e);
        }
    }

    private static List<Path> segments(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(SUFFIX))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new DurableStoreException("cannot list WAL directory " + dir, e);
        }
    }

    /** Sequential reader over all segments used during recovery. */
    private static final class Reader implements WalReader {
        private final Deque<Path> remaining;
        private FileChannel ch;
        private long pos = 0;

        Reader(List<Path> segments) {
            this.remaining = new ArrayDeque<>(segments);
        }

        @Override
        public byte[] next() {
            while (true) {
                if (ch == null) {
                    Path seg = remaining.poll();
                    if (seg == null) return null;
                    try {
                        ch = FileChannel.open(seg, READ);
                        pos = 0;
                    } catch (IOException e) {
                        throw new DurableStoreException("cannot open WAL segment " + seg, e);
                    }
                }
                byte[] payload = readRecord();
                if (payload != null) return payload;
                closeCurrent();
            }
        }

        /** Next record of the open segment, or null at its end or at the first bad record. */
        private byte[] readRecord() {
            try {
                ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
                int read = ch.read(hdr, pos);
                if (read <= 0) return null;
                if (read < RecordCodec.HEADER_BYTES) return null;
                hdr.flip();
                short magic = hdr.getShort();
                byte ver = hdr.get();
                int len = hdr.getInt();
                int crc = hdr.getInt();
                if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) return null;
                ByteBuffer payload = ByteBuffer.allocate(len);
                int r2 = len == 0 ? 0 : ch.read(payload, pos + RecordCodec.HEADER_BYTES);
                if (r2 < len) return null;
                byte[] bytes = payload.array();
                if (RecordCodec.crc32(bytes) != crc) return null;
                pos += RecordCodec.HEADER_BYTES + (long) len;
                return bytes;
            } catch (IOException e) {
                throw new DurableStoreException("WAL read failed", e);
            }
        }

        private void closeCurrent() {
            try {
                if (ch != null) ch.close();
            } catch (IOException e) {
                throw new DurableStoreException("WAL close failed", e);
            } finally {
                ch = null;
            }
        }

        @Override
        public void close() {
            closeCurrent();
        }
    }
}
