package io.hashdb.storage.flush;

/** Result of closing the pending batch. */
public record FlushTicket(long flushId, long storedFlushId) {}
