package io.hashdb.server.dto;

/**
 * JSON form of the server settings. Absent fields keep the value they had before the
 * file was applied.
 */
public class JsonConfig {
    public Integer grpcPort;
    public Integer adminPort;
    public String dataDir;
    public String proverId;
    public Long flushIntervalMs;
    public Boolean autoFlush;
    public String writerMode;
    public Long dbReadTimeoutMs;
    public Long walRotateBytes;
}
