package io.platformvm.core.rpc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.core.instrument.MeterRegistry;
import io.platformvm.core.metrics.AcceptanceCounter;
import io.platformvm.core.metrics.ApiInterceptor;
import io.platformvm.core.metrics.Metric;
import io.platformvm.core.metrics.MetricSet;
import io.platformvm.core.metrics.MetricsScraper;
import io.platformvm.core.metrics.StakeGauge;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-only HTTP view of the node's metrics:
 * {@code /metrics} (plain-text scrape), {@code /acceptance} (JSON of the platform
 * counters and gauges) and {@code /health}. Every request is timed by the metric
 * set's {@link ApiInterceptor}.
 */
public final class MetricsServer {
    private static final Logger LOG = Logger.getLogger(MetricsServer.class.getName());

    private final MetricSet metrics;
    private final MeterRegistry registry;
    private final String bindAddress;
    private final int port;
    private final String authToken;
    private final ObjectMapper mapper = new ObjectMapper();
    private HttpServer server;
    private ExecutorService executor;

    public MetricsServer(MetricSet metrics, MeterRegistry registry, String bindAddress, int port, String authToken) {
        this.metrics = metrics;
        this.registry = registry;
        this.bindAddress = (bindAddress == null || bindAddress.isBlank()) ? "127.0.0.1" : bindAddress;
        this.port = port;
        this.authToken = (authToken == null || authToken.isBlank()) ? null : authToken;
    }

    public void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("Metrics server already running");
        }
        if (!metrics.isInitialized()) {
            throw new IllegalStateException("Metrics must be initialized before serving them");
        }
        server = HttpServer.create(new InetSocketAddress(bindAddress, port), 0);
        server.createContext("/metrics", new ScrapeHandler());
        server.createContext("/acceptance", new AcceptanceHandler());
        server.createContext("/health", new HealthHandler());
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();
        LOG.info(() -> "Metrics server listening on http://" + bindAddress + ':' + port + (authToken != null ? " (auth required)" : ""));
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    private int ensureAuthorized(HttpExchange exchange) throws IOException {
        if (authToken == null) {
            return -1;
        }
        List<String> authHeaders = exchange.getRequestHeaders().get("Authorization");
        if (authHeaders != null) {
            for (String header : authHeaders) {
                if (header != null && header.equals("Bearer " + authToken)) {
                    return -1;
                }
            }
        }
        String apiKey = exchange.getRequestHeaders().getFirst("X-API-Key");
        if (apiKey != null && apiKey.equals(authToken)) {
            return -1;
        }
        exchange.getResponseHeaders().set("WWW-Authenticate", "Bearer");
        return sendError(exchange, 401, "unauthorized", "Missing or invalid credentials");
    }

    /** GET-only, authorized, intercepted; subclasses write the response and return its status. */
    abstract class GetHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod();
            String path = exchange.getHttpContext().getPath();
            ApiInterceptor interceptor = metrics.apiInterceptor();
            var sample = interceptor.start();
            int status = 500;
            try {
                if (!"GET".equalsIgnoreCase(method)) {
                    status = sendError(exchange, 405, "method_not_allowed", "Use GET for this endpoint");
                    return;
                }
                status = ensureAuthorized(exchange);
                if (status != -1) {
                    return;
                }
                status = respond(exchange);
            } catch (Exception e) {
                LOG.log(Level.WARNING, path + " handler failed", e);
                status = sendError(exchange, 500, "internal_error", "Unexpected server error");
            } finally {
                interceptor.stop(sample, method, path, status);
                exchange.close();
            }
        }

        abstract int respond(HttpExchange exchange) throws IOException;
    }

    final class ScrapeHandler extends GetHandler {
        @Override
        int respond(HttpExchange exchange) throws IOException {
            byte[] payload = MetricsScraper.scrape(registry).getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            exchange.sendResponseHeaders(200, payload.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(payload);
            }
            return 200;
        }
    }

    final class AcceptanceHandler extends GetHandler {
        @Override
        int respond(HttpExchange exchange) throws IOException {
            ObjectNode resp = mapper.createObjectNode();
            for (Metric metric : metrics.metrics()) {
                String name = metric.descriptor().fullName();
                if (metric instanceof AcceptanceCounter counter) {
                    resp.put(name, counter.count());
                } else if (metric instanceof StakeGauge gauge) {
                    resp.put(name, gauge.value());
                }
            }
            return sendJson(exchange, 200, resp);
        }
    }

    final class HealthHandler extends GetHandler {
        @Override
        int respond(HttpExchange exchange) throws IOException {
            ObjectNode resp = mapper.createObjectNode();
            resp.put("status", "ok");
            resp.put("initialized", metrics.isInitialized());
            return sendJson(exchange, 200, resp);
        }
    }

    private int sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = mapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
        return status;
    }

    private int sendError(HttpExchange exchange, int status, String code, String message) throws IOException {
        ObjectNode node = mapper.createObjectNode();
        node.put("error", code);
        node.put("message", message);
        return sendJson(exchange, status, node);
    }
}
