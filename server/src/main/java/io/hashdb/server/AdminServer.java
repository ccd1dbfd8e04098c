package io.hashdb.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hashdb.server.dto.FlushResponse;
import io.hashdb.server.dto.FlushStatusResponse;
import io.hashdb.storage.flush.FlushStatus;
import io.hashdb.storage.flush.FlushTicket;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Small HTTP adapter for operators.
 *
 * Path layout:
 *   - GET  /admin/health        {"status":"ok"}
 *   - GET  /admin/flush-status  flush ids, pending/storing counts, prover id
 *   - POST /admin/flush         closes the pending batch, returns its id
 */
public final class AdminServer {

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final HashDbService service;

    public AdminServer(int port, HashDbService service) {
        this.service = service;
        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(this::route)
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- handlers ----------

    private void route(HttpServerExchange ex) {
        long start = System.nanoTime();
        String path = ex.getRequestPath();
        String method = ex.getRequestMethod().toString();
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        int status = 500;
        Throwable error = null;
        try {
            switch (path) {
                case "/admin/health" -> status = "GET".equals(method)
                        ? send(ex, 200, Map.of("status", "ok"))
                        : send(ex, 405, Map.of("error", "method not allowed"));
                case "/admin/flush-status" -> status = "GET".equals(method)
                        ? send(ex, 200, toDto(service.flushStatus()))
                        : send(ex, 405, Map.of("error", "method not allowed"));
                case "/admin/flush" -> status = "POST".equals(method)
                        ? send(ex, 200, toDto(service.flush()))
                        : send(ex, 405, Map.of("error", "method not allowed"));
                default -> status = send(ex, 404, Map.of("error", "not found"));
            }
        } catch (Exception e) {
            error = e;
            status = send(ex, 500, Map.of("error", e.getClass().getSimpleName(),
                    "message", String.valueOf(e.getMessage())));
        }
        long totalMs = (System.nanoTime() - start) / 1_000_000L;
        RequestLogger.logHttp(method, path, status, totalMs, error);
    }

    private static FlushStatusResponse toDto(FlushStatus s) {
        var dto = new FlushStatusResponse();
        dto.storedFlushId = s.storedFlushId();
        dto.storingFlushId = s.storingFlushId();
        dto.lastFlushId = s.lastFlushId();
        dto.pendingToFlushNodes = s.pendingToFlushNodes();
        dto.pendingToFlushPrograms = s.pendingToFlushPrograms();
        dto.storingNodes = s.storingNodes();
        dto.storingPrograms = s.storingPrograms();
        dto.proverId = s.proverId();
        return dto;
    }

    private static FlushResponse toDto(FlushTicket t) {
        var dto = new FlushResponse();
        dto.flushId = t.flushId();
        dto.storedFlushId = t.storedFlushId();
        return dto;
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private int send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
            return code;
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
            return 500;
        }
    }
}
