package io.hashdb.server.grpc;

import com.google.protobuf.ByteString;
import com.google.protobuf.Empty;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import io.hashdb.core.FieldElementTuple;
import io.hashdb.core.ResultCode;
import io.hashdb.core.hash.Scalars;
import io.hashdb.core.smt.GetResult;
import io.hashdb.core.smt.SetResult;
import io.hashdb.server.HashDbService;
import io.hashdb.server.RequestLogger;
import io.hashdb.storage.flush.FlushBatch;
import io.hashdb.storage.flush.FlushStatus;
import io.hashdb.storage.flush.FlushTicket;

import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * gRPC adapter exposing {@link HashDbService} as HashDBService.
 * <p>
 * Responsibilities:
 *  - Decode protobuf requests (Fea limbs, value strings, import maps) into service calls.
 *  - Encode service replies; details=false leaves only the root and result fields set.
 *  - Map IllegalArgumentException to INVALID_ARGUMENT, everything else unexpected to INTERNAL.
 *  - Log every call through RequestLogger.
 * <p>
 * Engine outcomes travel in the response's result code, not as gRPC status.
 */
public final class GrpcHashDbService extends HashDBServiceGrpc.HashDBServiceImplBase {

    private static final HexFormat HEX = HexFormat.of();

    private final HashDbService service;

    public GrpcHashDbService(HashDbService service) {
        this.service = service;
    }

    @Override
    public void set(HashDbProto.SetRequest request, StreamObserver<HashDbProto.SetResponse> responseObserver) {
        handle("Set", responseObserver, r -> r.getResult().getCode().name(), () -> {
            HashDbService.SetReply reply = service.set(
                    fromFea(request.getOldRoot()),
                    fromFea(request.getKey()),
                    request.getValue(),
                    request.getPersistent(),
                    request.getGetDbReadLog()
            );
            var b = HashDbProto.SetResponse.newBuilder().setResult(toProto(reply.code()));
            SetResult r = reply.result();
            if (r == null) {
                return b.build();
            }
            b.setNewRoot(toFea(r.newRoot()));
            if (request.getDetails()) {
                b.setOldRoot(toFea(r.oldRoot()))
                        .setKey(toFea(r.key()))
                        .putAllSiblings(toSiblings(r.siblings()))
                        .setInsKey(toFea(r.insKey()))
                        .setInsValue(Scalars.format(r.insValue()))
                        .setIsOld0(r.isOld0())
                        .setOldValue(Scalars.format(r.oldValue()))
                        .setNewValue(Scalars.format(r.newValue()))
                        .setMode(r.mode().wireName())
                        .setProofHashCounter(r.proofHashCounter());
            }
            if (r.readLog() != null) {
                b.putAllDbReadLog(toFeLists(r.readLog().entries()));
            }
            return b.build();
        });
    }

    @Override
    public void get(HashDbProto.GetRequest request, StreamObserver<HashDbProto.GetResponse> responseObserver) {
        handle("Get", responseObserver, r -> r.getResult().getCode().name(), () -> {
            HashDbService.GetReply reply = service.get(
                    fromFea(request.getRoot()),
                    fromFea(request.getKey()),
                    request.getGetDbReadLog()
            );
            var b = HashDbProto.GetResponse.newBuilder().setResult(toProto(reply.code()));
            GetResult r = reply.result();
            if (r == null) {
                return b.build();
            }
            b.setValue(Scalars.format(r.value()));
            if (request.getDetails()) {
                b.setRoot(toFea(r.root()))
                        .setKey(toFea(r.key()))
                        .putAllSiblings(toSiblings(r.siblings()))
                        .setInsKey(toFea(r.insKey()))
                        .setInsValue(Scalars.format(r.insValue()))
                        .setIsOld0(r.isOld0())
                        .setProofHashCounter(r.proofHashCounter());
            }
            if (r.readLog() != null) {
                b.putAllDbReadLog(toFeLists(r.readLog().entries()));
            }
            return b.build();
        });
    }

    @Override
    public void setProgram(HashDbProto.SetProgramRequest request,
                           StreamObserver<HashDbProto.SetProgramResponse> responseObserver) {
        handle("SetProgram", responseObserver, r -> r.getResult().getCode().name(), () -> {
            ResultCode code = service.setProgram(fromFea(request.getKey()),
                    request.getData().toByteArray(), request.getPersistent());
            return HashDbProto.SetProgramResponse.newBuilder().setResult(toProto(code)).build();
        });
    }

    @Override
    public void getProgram(HashDbProto.GetProgramRequest request,
                           StreamObserver<HashDbProto.GetProgramResponse> responseObserver) {
        handle("GetProgram", responseObserver, r -> r.getResult().getCode().name(), () -> {
            HashDbService.ProgramReply reply = service.getProgram(fromFea(request.getKey()));
            return HashDbProto.GetProgramResponse.newBuilder()
                    .setData(ByteString.copyFrom(reply.data()))
                    .setResult(toProto(reply.code()))
                    .build();
        });
    }

    @Override
    public void loadDB(HashDbProto.LoadDBRequest request, StreamObserver<Empty> responseObserver) {
        handle("LoadDB", responseObserver, r -> "CODE_SUCCESS", () -> {
            Map<String, long[]> input = new LinkedHashMap<>();
            request.getInputDbMap().forEach((k, v) -> input.put(k, toLongs(v.getFeList())));
            ResultCode code = service.loadDb(input, request.getPersistent());
            if (code == ResultCode.SMT_INVALID_DATA_SIZE) {
                throw new IllegalArgumentException("node entries must hold 12 limbs");
            }
            if (code != ResultCode.SUCCESS) {
                throw new IllegalStateException("LoadDB failed: " + code);
            }
            return Empty.getDefaultInstance();
        });
    }

    @Override
    public void loadProgramDB(HashDbProto.LoadProgramDBRequest request, StreamObserver<Empty> responseObserver) {
        handle("LoadProgramDB", responseObserver, r -> "CODE_SUCCESS", () -> {
            Map<String, byte[]> input = new LinkedHashMap<>();
            request.getInputProgramDbMap().forEach((k, v) -> input.put(k, v.toByteArray()));
            service.loadProgramDb(input, request.getPersistent());
            return Empty.getDefaultInstance();
        });
    }

    @Override
    public void flush(Empty request, StreamObserver<HashDbProto.FlushResponse> responseObserver) {
        handle("Flush", responseObserver, r -> r.getResult().getCode().name(), () -> {
            FlushTicket t = service.flush();
            return HashDbProto.FlushResponse.newBuilder()
                    .setFlushId(t.flushId())
                    .setStoredFlushId(t.storedFlushId())
                    .setResult(toProto(ResultCode.SUCCESS))
                    .build();
        });
    }

    @Override
    public void getFlushStatus(Empty request, StreamObserver<HashDbProto.GetFlushStatusResponse> responseObserver) {
        handle("GetFlushStatus", responseObserver, r -> "CODE_SUCCESS", () -> {
            FlushStatus s = service.flushStatus();
            return HashDbProto.GetFlushStatusResponse.newBuilder()
                    .setStoredFlushId(s.storedFlushId())
                    .setStoringFlushId(s.storingFlushId())
                    .setLastFlushId(s.lastFlushId())
                    .setPendingToFlushNodes(s.pendingToFlushNodes())
                    .setPendingToFlushProgram(s.pendingToFlushPrograms())
                    .setStoringNodes(s.storingNodes())
                    .setStoringProgram(s.storingPrograms())
                    .setProverId(s.proverId())
                    .build();
        });
    }

    @Override
    public void getFlushData(HashDbProto.GetFlushDataRequest request,
                             StreamObserver<HashDbProto.GetFlushDataResponse> responseObserver) {
        handle("GetFlushData", responseObserver, r -> r.getResult().getCode().name(), () -> {
            HashDbService.FlushDataReply reply = service.flushData(request.getFlushId());
            var b = HashDbProto.GetFlushDataResponse.newBuilder()
                    .setStoredFlushId(reply.data().storedFlushId())
                    .setFlushId(reply.data().flushId())
                    .setResult(toProto(reply.code()));
            FlushBatch batch = reply.data().batch();
            if (batch != null) {
                batch.nodeInserts().forEach((k, v) -> b.addNodes(entry(k, encodeNode(v))));
                batch.nodeUpdates().forEach((k, v) -> b.addNodesUpdate(entry(k, encodeNode(v))));
                batch.programInserts().forEach((k, v) -> b.addProgram(entry(k, HEX.formatHex(v))));
                batch.programUpdates().forEach((k, v) -> b.addProgramUpdate(entry(k, HEX.formatHex(v))));
                b.setNodesStateRoot(batch.stateRoot());
            }
            return b.build();
        });
    }

    @Override
    public void ackFlushData(HashDbProto.AckFlushDataRequest request,
                             StreamObserver<HashDbProto.AckFlushDataResponse> responseObserver) {
        handle("AckFlushData", responseObserver, r -> r.getResult().getCode().name(), () -> {
            HashDbService.AckReply reply = service.acknowledge(request.getFlushId());
            return HashDbProto.AckFlushDataResponse.newBuilder()
                    .setStoredFlushId(reply.storedFlushId())
                    .setResult(toProto(reply.code()))
                    .build();
        });
    }

    // ---------- plumbing ----------

    private static <T> void handle(String method, StreamObserver<T> observer,
                                   Function<T, String> outcome, Supplier<T> body) {
        long start = System.nanoTime();
        try {
            T resp = body.get();
            observer.onNext(resp);
            observer.onCompleted();
            RequestLogger.logRpc(method, outcome.apply(resp), elapsedMillis(start), null);
        } catch (IllegalArgumentException iae) {
            observer.onError(Status.INVALID_ARGUMENT.withDescription(iae.getMessage()).asException());
            RequestLogger.logRpc(method, "INVALID_ARGUMENT", elapsedMillis(start), null);
        } catch (Exception e) {
            observer.onError(Status.INTERNAL.withDescription(e.getMessage()).asException());
            RequestLogger.logRpc(method, "INTERNAL", elapsedMillis(start), e);
        }
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    // ---------- conversions ----------

    static FieldElementTuple fromFea(HashDbProto.Fea fea) {
        return new FieldElementTuple(fea.getFe0(), fea.getFe1(), fea.getFe2(), fea.getFe3());
    }

    static HashDbProto.Fea toFea(FieldElementTuple t) {
        return HashDbProto.Fea.newBuilder()
                .setFe0(t.fe0())
                .setFe1(t.fe1())
                .setFe2(t.fe2())
                .setFe3(t.fe3())
                .build();
    }

    static HashDbProto.ResultCode toProto(ResultCode code) {
        HashDbProto.ResultCode.Code c = switch (code) {
            case SUCCESS -> HashDbProto.ResultCode.Code.CODE_SUCCESS;
            case DB_KEY_NOT_FOUND -> HashDbProto.ResultCode.Code.CODE_DB_KEY_NOT_FOUND;
            case DB_ERROR -> HashDbProto.ResultCode.Code.CODE_DB_ERROR;
            case INTERNAL_ERROR -> HashDbProto.ResultCode.Code.CODE_INTERNAL_ERROR;
            case SMT_INVALID_DATA_SIZE -> HashDbProto.ResultCode.Code.CODE_SMT_INVALID_DATA_SIZE;
        };
        return HashDbProto.ResultCode.newBuilder().setCode(c).build();
    }

    private static Map<Long, HashDbProto.SiblingList> toSiblings(List<FieldElementTuple> siblings) {
        Map<Long, HashDbProto.SiblingList> out = new LinkedHashMap<>();
        for (int level = 0; level < siblings.size(); level++) {
            out.put((long) level, HashDbProto.SiblingList.newBuilder()
                    .addAllSibling(siblings.get(level).toList())
                    .build());
        }
        return out;
    }

    private static Map<String, HashDbProto.FeList> toFeLists(Map<String, long[]> entries) {
        Map<String, HashDbProto.FeList> out = new LinkedHashMap<>();
        entries.forEach((k, v) -> {
            var fl = HashDbProto.FeList.newBuilder();
            for (long limb : v) {
                fl.addFe(limb);
            }
            out.put(k, fl.build());
        });
        return out;
    }

    private static long[] toLongs(List<Long> limbs) {
        long[] out = new long[limbs.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = limbs.get(i);
        }
        return out;
    }

    private static HashDbProto.FlushData entry(String key, String value) {
        return HashDbProto.FlushData.newBuilder().setKey(key).setValue(value).build();
    }

    /** Twelve limbs as 16 lowercase hex digits each, limb 0 first. */
    static String encodeNode(long[] limbs) {
        StringBuilder sb = new StringBuilder(limbs.length * 16);
        for (long limb : limbs) {
            sb.append(String.format("%016x", limb));
        }
        return sb.toString();
    }
}
