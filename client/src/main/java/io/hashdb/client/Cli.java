package io.hashdb.client;

import com.google.protobuf.ByteString;
import com.google.protobuf.Empty;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.StatusRuntimeException;
import io.hashdb.core.FieldElementTuple;
import io.hashdb.server.grpc.HashDBServiceGrpc;
import io.hashdb.server.grpc.HashDbProto;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.concurrent.TimeUnit;

/**
 * Simple CLI for interacting with a running hash database node over gRPC.
 *
 * Usage:
 *   hashdb-cli [--target host:port] get <root> <key>
 *   hashdb-cli [--target host:port] set <root> <key> <value> [--transient]
 *   hashdb-cli [--target host:port] flush
 *   hashdb-cli [--target host:port] status
 *   hashdb-cli [--target host:port] program-get <key>
 *   hashdb-cli [--target host:port] program-set <key> <hexdata> [--transient]
 *
 * Roots and keys are 64-digit hex hash strings ("0" is the empty tree).
 */
public final class Cli {

    private static final String DEFAULT_TARGET = "localhost:50061";

    private final HashDBServiceGrpc.HashDBServiceBlockingStub stub;
    private final PrintStream out;

    public Cli(HashDBServiceGrpc.HashDBServiceBlockingStub stub, PrintStream out) {
        this.stub = stub;
        this.out = out;
    }

    public static void main(String[] args) {
        String target = DEFAULT_TARGET;
        String[] rest = args;
        if (args.length >= 1 && "--target".equals(args[0])) {
            if (args.length < 2) {
                usageAndExit("--target requires a value");
            }
            target = args[1];
            rest = Arrays.copyOfRange(args, 2, args.length);
        }

        ManagedChannel channel = ManagedChannelBuilder.forTarget(target).usePlaintext().build();
        try {
            new Cli(HashDBServiceGrpc.newBlockingStub(channel).withDeadlineAfter(30, TimeUnit.SECONDS), System.out)
                    .run(rest);
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (StatusRuntimeException e) {
            System.err.println("rpc failed: " + e.getStatus());
            System.exit(2);
        } finally {
            channel.shutdownNow();
        }
    }

    /** Execute one command. */
    public void run(String[] rest) {
        if (rest.length == 0) {
            throw new CliException("missing command");
        }
        boolean persistent = !Arrays.asList(rest).contains("--transient");
        String[] a = Arrays.stream(rest).filter(s -> !"--transient".equals(s)).toArray(String[]::new);

        switch (a[0]) {
            case "get" -> {
                require(a, 3, "get requires <root> <key>");
                get(hash(a[1]), hash(a[2]));
            }
            case "set" -> {
                require(a, 4, "set requires <root> <key> <value>");
                set(hash(a[1]), hash(a[2]), a[3], persistent);
            }
            case "flush" -> flush();
            case "status" -> status();
            case "program-get" -> {
                require(a, 2, "program-get requires <key>");
                programGet(hash(a[1]));
            }
            case "program-set" -> {
                require(a, 3, "program-set requires <key> <hexdata>");
                programSet(hash(a[1]), a[2], persistent);
            }
            default -> throw new CliException("unknown command: " + a[0]);
        }
    }

    private void get(HashDbProto.Fea root, HashDbProto.Fea key) {
        HashDbProto.GetResponse r = stub.get(HashDbProto.GetRequest.newBuilder()
                .setRoot(root).setKey(key).build());
        checkResult(r.getResult());
        out.println(r.getValue());
    }

    private void set(HashDbProto.Fea root, HashDbProto.Fea key, String value, boolean persistent) {
        HashDbProto.SetResponse r = stub.set(HashDbProto.SetRequest.newBuilder()
                .setOldRoot(root).setKey(key).setValue(value).setPersistent(persistent).setDetails(true).build());
        checkResult(r.getResult());
        out.println(hex(r.getNewRoot()) + " " + r.getMode());
    }

    private void flush() {
        HashDbProto.FlushResponse r = stub.flush(Empty.getDefaultInstance());
        out.println("flushId=" + r.getFlushId() + " storedFlushId=" + r.getStoredFlushId());
    }

    private void status() {
        HashDbProto.GetFlushStatusResponse s = stub.getFlushStatus(Empty.getDefaultInstance());
        out.printf("stored=%d storing=%d last=%d pendingNodes=%d pendingPrograms=%d storingNodes=%d storingPrograms=%d prover=%s%n",
                s.getStoredFlushId(), s.getStoringFlushId(), s.getLastFlushId(),
                s.getPendingToFlushNodes(), s.getPendingToFlushProgram(),
                s.getStoringNodes(), s.getStoringProgram(), s.getProverId());
    }

    private void programGet(HashDbProto.Fea key) {
        HashDbProto.GetProgramResponse r = stub.getProgram(HashDbProto.GetProgramRequest.newBuilder()
                .setKey(key).build());
        checkResult(r.getResult());
        out.println(HexFormat.of().formatHex(r.getData().toByteArray()));
    }

    private void programSet(HashDbProto.Fea key, String hexData, boolean persistent) {
        byte[] data;
        try {
            data = HexFormat.of().parseHex(hexData.startsWith("0x") ? hexData.substring(2) : hexData);
        } catch (IllegalArgumentException e) {
            throw new CliException("program data must be hex: " + hexData);
        }
        HashDbProto.SetProgramResponse r = stub.setProgram(HashDbProto.SetProgramRequest.newBuilder()
                .setKey(key).setData(ByteString.copyFrom(data)).setPersistent(persistent).build());
        checkResult(r.getResult());
        out.println("OK");
    }

    // ---------- helpers ----------

    private static void require(String[] a, int n, String msg) {
        if (a.length != n) {
            throw new CliException(msg);
        }
    }

    private static void checkResult(HashDbProto.ResultCode result) {
        if (result.getCode() != HashDbProto.ResultCode.Code.CODE_SUCCESS) {
            throw new CliException("server answered " + result.getCode());
        }
    }

    private static HashDbProto.Fea hash(String s) {
        FieldElementTuple t;
        try {
            t = FieldElementTuple.parse(s);
        } catch (IllegalArgumentException e) {
            throw new CliException(e.getMessage());
        }
        return HashDbProto.Fea.newBuilder()
                .setFe0(t.fe0()).setFe1(t.fe1()).setFe2(t.fe2()).setFe3(t.fe3())
                .build();
    }

    private static String hex(HashDbProto.Fea fea) {
        return new FieldElementTuple(fea.getFe0(), fea.getFe1(), fea.getFe2(), fea.getFe3()).toHex();
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  hashdb-cli [--target host:port] get <root> <key>
                  hashdb-cli [--target host:port] set <root> <key> <value> [--transient]
                  hashdb-cli [--target host:port] flush
                  hashdb-cli [--target host:port] status
                  hashdb-cli [--target host:port] program-get <key>
                  hashdb-cli [--target host:port] program-set <key> <hexdata> [--transient]
                """);
        System.exit(1);
    }

    public static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
