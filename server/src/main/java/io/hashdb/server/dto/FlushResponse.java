package io.hashdb.server.dto;

public class FlushResponse {
    public long flushId;
    public long storedFlushId;
}
