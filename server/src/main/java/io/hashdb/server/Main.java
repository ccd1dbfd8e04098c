package io.hashdb.server;

import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.hashdb.server.grpc.GrpcHashDbService;
import io.hashdb.storage.DeadlineDurableStore;
import io.hashdb.storage.DurableStore;
import io.hashdb.storage.FileDurableStore;
import io.hashdb.storage.FileWal;
import io.hashdb.storage.NodeStore;
import io.hashdb.storage.ProgramStore;
import io.hashdb.storage.flush.DurableWriter;
import io.hashdb.storage.flush.FlushPipeline;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for a hash database node.
 *
 * Responsibilities:
 *  - Parse configuration from CLI (and an optional JSON file).
 *  - Wire storage: WAL, durable store with read deadline, flush pipeline, node/program stores.
 *  - Create HashDbService and expose it over gRPC.
 *  - Start the admin HTTP server.
 *  - Start the durable writer unless an external collector acknowledges batches.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) throws IOException {
        configureLogging();

        ServerConfig cfg;
        try {
            cfg = ServerConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.exit(1);
            return;
        }

        // ------ Storage layer ------
        var wal = new FileWal(Path.of(cfg.dataDir(), "wal"), cfg.walRotateBytes());
        DurableStore durable = new DeadlineDurableStore(new FileDurableStore(wal),
                Duration.ofMillis(cfg.dbReadTimeoutMs()));

        String proverId = cfg.proverId() != null ? cfg.proverId() : UUID.randomUUID().toString();
        var pipeline = new FlushPipeline(proverId);
        var nodes = new NodeStore(pipeline, durable);
        var programs = new ProgramStore(pipeline, durable);
        var service = new HashDbService(nodes, programs, pipeline);

        // ------ Transports ------
        Server grpcServer = ServerBuilder
                .forPort(cfg.grpcPort())
                .addService(new GrpcHashDbService(service))
                .build();
        var admin = new AdminServer(cfg.adminPort(), service);

        // ------ Durable writer ------
        DurableWriter writer = null;
        if (cfg.writerMode() == ServerConfig.WriterMode.INTERNAL) {
            writer = new DurableWriter(pipeline, durable, Duration.ofMillis(cfg.flushIntervalMs()), cfg.autoFlush());
            writer.start();
        }

        grpcServer.start();
        admin.start();
        log.info(String.format("hashdb %s listening on grpc://0.0.0.0:%d, admin http://0.0.0.0:%d (writer=%s, stateRoot=%s)",
                proverId, cfg.grpcPort(), cfg.adminPort(), cfg.writerMode(),
                durable.stateRoot().isEmpty() ? "<none>" : durable.stateRoot()));

        DurableWriter finalWriter = writer;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                grpcServer.shutdown();
                admin.stop();
                if (finalWriter != null) {
                    finalWriter.stop();
                }
                durable.close();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "shutdown failed", e);
            }
        }, "hashdb-shutdown"));

        try {
            grpcServer.awaitTermination();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Failed to load logging.properties: " + e.getMessage());
        }
    }
}
