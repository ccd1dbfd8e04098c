package io.hashdb.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hashdb.server.dto.JsonConfig;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Server configuration parsed from CLI args, optionally seeded from a JSON file.
 *
 * Supports:
 *  - grpcPort:        HashDBService port
 *  - adminPort:       admin HTTP port (health, flush status, manual flush)
 *  - dataDir:         directory holding the write-ahead log
 *  - proverId:        instance id reported by GetFlushStatus (random UUID when null)
 *  - flushIntervalMs: tick interval of the in-process durable writer
 *  - autoFlush:       whether each writer tick closes the pending batch
 *  - writerMode:      INTERNAL (in-process writer) or EXTERNAL (outside collector acks)
 *  - dbReadTimeoutMs: deadline for durable-store reads on cache miss
 *  - walRotateBytes:  WAL segment size before rotation
 */
public record ServerConfig(
        int grpcPort,
        int adminPort,
        String dataDir,
        String proverId,
        long flushIntervalMs,
        boolean autoFlush,
        WriterMode writerMode,
        long dbReadTimeoutMs,
        long walRotateBytes
) {

    public enum WriterMode { INTERNAL, EXTERNAL }

    public static ServerConfig defaults() {
        return new ServerConfig(50061, 8080, "./data", null, 1000L, false, WriterMode.INTERNAL,
                2000L, 64L * 1024 * 1024);
    }

    /**
     * Small CLI parser.
     *
     * Supported flags:
     *   --grpc-port,  -g  <port>
     *   --admin-port, -p  <port>
     *   --data-dir,   -d  <path>
     *   --prover-id       <id>
     *   --flush-interval-ms <ms>
     *   --auto-flush
     *   --writer-mode     internal|external
     *   --db-read-timeout-ms <ms>
     *   --wal-rotate-bytes <bytes>
     *   --config,     -c  <json file>   applied in place; later flags override it
     *   --help,       -h
     *
     * @throws IllegalArgumentException on unknown flags, missing or malformed values
     */
    public static ServerConfig fromArgs(String[] args) {
        var b = new Builder(defaults());

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();
                case "--grpc-port", "-g" -> b.grpcPort = parsePort(args[i], value(args, i++));
                case "--admin-port", "-p" -> b.adminPort = parsePort(args[i], value(args, i++));
                case "--data-dir", "-d" -> b.dataDir = value(args, i++);
                case "--prover-id" -> b.proverId = value(args, i++);
                case "--flush-interval-ms" -> b.flushIntervalMs = parsePositive(args[i], value(args, i++));
                case "--auto-flush" -> b.autoFlush = true;
                case "--writer-mode" -> b.writerMode = parseMode(value(args, i++));
                case "--db-read-timeout-ms" -> b.dbReadTimeoutMs = parsePositive(args[i], value(args, i++));
                case "--wal-rotate-bytes" -> b.walRotateBytes = parsePositive(args[i], value(args, i++));
                case "--config", "-c" -> b.apply(readJson(Path.of(value(args, i++))));
                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        return b.build();
    }

    /** Read a JSON settings file. */
    public static JsonConfig readJson(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            return mapper.readValue(path.toFile(), JsonConfig.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read config file " + path, e);
        }
    }

    // ---------- parsing helpers ----------

    /** Value following flag {@code args[i]}. */
    private static String value(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
        return args[i + 1];
    }

    private static int parsePort(String flag, String raw) {
        try {
            int port = Integer.parseInt(raw);
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("Invalid " + flag + ": " + raw);
            }
            return port;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + flag + ": " + raw, e);
        }
    }

    private static long parsePositive(String flag, String raw) {
        try {
            long v = Long.parseLong(raw);
            if (v <= 0) {
                throw new IllegalArgumentException(flag + " must be > 0: " + raw);
            }
            return v;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + flag + ": " + raw, e);
        }
    }

    private static WriterMode parseMode(String raw) {
        return switch (raw.trim().toLowerCase()) {
            case "internal" -> WriterMode.INTERNAL;
            case "external" -> WriterMode.EXTERNAL;
            default -> throw new IllegalArgumentException("writer mode must be internal or external: " + raw);
        };
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: hashdb-server [options]

            Options:
              --grpc-port,  -g        gRPC port (default: 50061)
              --admin-port, -p        Admin HTTP port (default: 8080)
              --data-dir,   -d        WAL directory (default: ./data)
              --prover-id             Instance id (default: random UUID)
              --flush-interval-ms     Durable writer tick interval (default: 1000)
              --auto-flush            Close the pending batch on every writer tick
              --writer-mode           internal | external (default: internal)
              --db-read-timeout-ms    Durable read deadline (default: 2000)
              --wal-rotate-bytes      WAL segment size (default: 67108864)
              --config,     -c        JSON settings file; later flags override it
              --help,       -h        Show this help message
            """);
        System.exit(0);
    }

    private static final class Builder {
        int grpcPort;
        int adminPort;
        String dataDir;
        String proverId;
        long flushIntervalMs;
        boolean autoFlush;
        WriterMode writerMode;
        long dbReadTimeoutMs;
        long walRotateBytes;

        Builder(ServerConfig base) {
            grpcPort = base.grpcPort();
            adminPort = base.adminPort();
            dataDir = base.dataDir();
            proverId = base.proverId();
            flushIntervalMs = base.flushIntervalMs();
            autoFlush = base.autoFlush();
            writerMode = base.writerMode();
            dbReadTimeoutMs = base.dbReadTimeoutMs();
            walRotateBytes = base.walRotateBytes();
        }

        void apply(JsonConfig json) {
            if (json.grpcPort != null) grpcPort = parsePort("grpcPort", json.grpcPort.toString());
            if (json.adminPort != null) adminPort = parsePort("adminPort", json.adminPort.toString());
            if (json.dataDir != null) dataDir = json.dataDir;
            if (json.proverId != null) proverId = json.proverId;
            if (json.flushIntervalMs != null) flushIntervalMs = parsePositive("flushIntervalMs", json.flushIntervalMs.toString());
            if (json.autoFlush != null) autoFlush = json.autoFlush;
            if (json.writerMode != null) writerMode = parseMode(json.writerMode);
            if (json.dbReadTimeoutMs != null) dbReadTimeoutMs = parsePositive("dbReadTimeoutMs", json.dbReadTimeoutMs.toString());
            if (json.walRotateBytes != null) walRotateBytes = parsePositive("walRotateBytes", json.walRotateBytes.toString());
        }

        ServerConfig build() {
            return new ServerConfig(grpcPort, adminPort, dataDir, proverId, flushIntervalMs, autoFlush,
                    writerMode, dbReadTimeoutMs, walRotateBytes);
        }
    }
}
