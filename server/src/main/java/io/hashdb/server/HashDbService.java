package io.hashdb.server;

import io.hashdb.core.FieldElementTuple;
import io.hashdb.core.HashDbException;
import io.hashdb.core.ReadLog;
import io.hashdb.core.ResultCode;
import io.hashdb.core.hash.Scalars;
import io.hashdb.core.smt.GetResult;
import io.hashdb.core.smt.SetResult;
import io.hashdb.core.smt.Smt;
import io.hashdb.storage.NodeStore;
import io.hashdb.storage.ProgramStore;
import io.hashdb.storage.flush.FlushData;
import io.hashdb.storage.flush.FlushPipeline;
import io.hashdb.storage.flush.FlushStatus;
import io.hashdb.storage.flush.FlushTicket;

import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Application service for hash database operations.
 * <p>
 * Responsibilities:
 *  - Hide the engine, stores and flush pipeline from the transport layer.
 *  - Parse client value strings.
 *  - Turn engine/store failures into result codes: no HashDbException escapes.
 * <p>
 * Malformed client input (bad value string, bad hash string, LoadDB hash mismatch)
 * raises IllegalArgumentException so the transport can report it as a bad request.
 */
public class HashDbService {
    private static final Logger log = Logger.getLogger(HashDbService.class.getName());

    private final Smt smt;
    private final NodeStore nodes;
    private final ProgramStore programs;
    private final FlushPipeline pipeline;

    public HashDbService(NodeStore nodes, ProgramStore programs, FlushPipeline pipeline) {
        this.nodes = Objects.requireNonNull(nodes, "nodes");
        this.programs = Objects.requireNonNull(programs, "programs");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.smt = new Smt(nodes);
    }

    // ---------- tree ----------

    public GetReply get(FieldElementTuple root, FieldElementTuple key, boolean withReadLog) {
        try {
            GetResult r = smt.get(root, key, withReadLog ? new ReadLog() : null);
            return new GetReply(ResultCode.SUCCESS, r);
        } catch (HashDbException e) {
            logFailure("get", e);
            return new GetReply(e.code(), null);
        }
    }

    /**
     * @param value decimal string (or 0x-hex); zero deletes the key
     */
    public SetReply set(FieldElementTuple oldRoot, FieldElementTuple key, String value,
                        boolean persistent, boolean withReadLog) {
        BigInteger scalar = Scalars.parse(value);
        try {
            SetResult r = smt.set(oldRoot, key, scalar, persistent, withReadLog ? new ReadLog() : null);
            return new SetReply(ResultCode.SUCCESS, r);
        } catch (HashDbException e) {
            logFailure("set", e);
            return new SetReply(e.code(), null);
        }
    }

    // ---------- programs ----------

    public ResultCode setProgram(FieldElementTuple key, byte[] data, boolean persistent) {
        programs.set(key, data, persistent);
        return ResultCode.SUCCESS;
    }

    public ProgramReply getProgram(FieldElementTuple key) {
        try {
            return new ProgramReply(ResultCode.SUCCESS, programs.get(key));
        } catch (HashDbException e) {
            logFailure("getProgram", e);
            return new ProgramReply(e.code(), new byte[0]);
        }
    }

    // ---------- bulk import ----------

    public ResultCode loadDb(Map<String, long[]> input, boolean persistent) {
        try {
            nodes.load(input, persistent);
            return ResultCode.SUCCESS;
        } catch (HashDbException e) {
            logFailure("loadDB", e);
            return e.code();
        }
    }

    public ResultCode loadProgramDb(Map<String, byte[]> input, boolean persistent) {
        programs.load(input, persistent);
        return ResultCode.SUCCESS;
    }

    // ---------- flush ----------

    public FlushTicket flush() {
        return pipeline.flush();
    }

    public FlushStatus flushStatus() {
        return pipeline.status();
    }

    public FlushDataReply flushData(long flushId) {
        if (flushId < 0) {
            throw new IllegalArgumentException("flushId must be >= 0");
        }
        try {
            return new FlushDataReply(ResultCode.SUCCESS, pipeline.getFlushData(flushId));
        } catch (HashDbException e) {
            logFailure("getFlushData", e);
            return new FlushDataReply(e.code(), new FlushData(pipeline.status().storedFlushId(), null));
        }
    }

    public AckReply acknowledge(long flushId) {
        try {
            return new AckReply(ResultCode.SUCCESS, pipeline.acknowledge(flushId));
        } catch (HashDbException e) {
            logFailure("ackFlushData", e);
            return new AckReply(e.code(), pipeline.status().storedFlushId());
        }
    }

    private static void logFailure(String op, HashDbException e) {
        if (e.code() == ResultCode.DB_ERROR || e.code() == ResultCode.INTERNAL_ERROR) {
            log.log(Level.WARNING, op + " failed: " + e.code(), e);
        } else {
            log.fine(op + " -> " + e.code() + ": " + e.getMessage());
        }
    }

    // ---------- view models ----------

    /** {@code result} is null unless {@code code} is SUCCESS. */
    public record GetReply(ResultCode code, GetResult result) {}

    /** {@code result} is null unless {@code code} is SUCCESS. */
    public record SetReply(ResultCode code, SetResult result) {}

    public record ProgramReply(ResultCode code, byte[] data) {}

    public record FlushDataReply(ResultCode code, FlushData data) {}

    public record AckReply(ResultCode code, long storedFlushId) {}
}
