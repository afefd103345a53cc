package de.bycsitsm.support;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process HTTP server answering provider API calls with canned responses.
 * Responses are keyed by method and decoded path; several responses for the
 * same key are served in order, the last one repeatedly.
 */
public final class StubHttpServer implements AutoCloseable {

    public record RecordedRequest(String method, String path, String query, String authorization,
                                  String prefer, String contentType, String body) {
    }

    private record Response(int status, String body) {
    }

    private final HttpServer server;
    private final Map<String, Deque<Response>> responses = new ConcurrentHashMap<>();
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();

    private StubHttpServer(HttpServer server) {
        this.server = server;
        server.createContext("/", this::handle);
    }

    public static StubHttpServer start() throws IOException {
        var server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        var stub = new StubHttpServer(server);
        server.start();
        return stub;
    }

    public String baseUrl() {
        return "http://" + server.getAddress().getHostString() + ":" + server.getAddress().getPort();
    }

    public void respond(String method, String path, int status, String body) {
        responses.computeIfAbsent(method + " " + path, key -> new ArrayDeque<>()).add(new Response(status, body));
    }

    public List<RecordedRequest> requests() {
        return requests;
    }

    public RecordedRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }

    private void handle(HttpExchange exchange) throws IOException {
        var method = exchange.getRequestMethod();
        var path = exchange.getRequestURI().getPath();
        var body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        var headers = exchange.getRequestHeaders();
        requests.add(new RecordedRequest(
                method,
                path,
                exchange.getRequestURI().getQuery(),
                headers.getFirst("Authorization"),
                headers.getFirst("Prefer"),
                headers.getFirst("Content-Type"),
                body));

        var queue = responses.get(method + " " + path);
        Response response;
        if (queue == null || queue.isEmpty()) {
            response = new Response(404, "{\"error\":\"not found\"}");
        } else {
            synchronized (queue) {
                response = queue.size() > 1 ? queue.poll() : queue.peek();
            }
        }

        if (response.body().isEmpty()) {
            exchange.sendResponseHeaders(response.status(), -1);
        } else {
            var bytes = response.body().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(response.status(), bytes.length);
            try (var out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        }
        exchange.close();
    }

    @Override
    public void close() {
        server.stop(0);
    }
}
