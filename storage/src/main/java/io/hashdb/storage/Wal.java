package io.hashdb.storage;

/**
 * Write-Ahead Log abstraction backing the file store.
 * <p>
 * Contract:
 *  - append() is atomic at record granularity: a partial write is treated
 *    as absent during recovery (reader stops at first corrupt/truncated record).
 *  - append() must fsync the record before returning.
 */
public interface Wal extends AutoCloseable {

    /**
     * Append a single serialized record and fsync it.
     *
     * @param serializedRecord header+payload bytes, from RecordCodec.encode(...)
     */
    void append(byte[] serializedRecord);

    /** Start a new segment once the current one reached the configured size. */
    void rotateIfNeeded();

    /**
     * Open a sequential reader over all segments, oldest first.
     * The reader stops at the first corrupt header, truncated payload or bad CRC.
     */
    WalReader openReader();

    @Override
    void close();

    interface WalReader extends AutoCloseable {

        /**
         * @return next valid payload (NOT including header), or null at the end of the
         *         log or at a corrupt tail.
         */
        byte[] next();

        @Override
        void close();
    }
}
