package io.hashdb.server.dto;

public class FlushStatusResponse {
    public long storedFlushId;
    public long storingFlushId;
    public long lastFlushId;
    public long pendingToFlushNodes;
    public long pendingToFlushPrograms;
    public long storingNodes;
    public long storingPrograms;
    public String proverId;
}
