package io.layermesh.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.layermesh.config.HostConfig;
import io.layermesh.error.AuthorizationException;
import io.layermesh.error.LookupException;
import io.layermesh.error.ProtocolException;
import io.layermesh.error.SerializationException;
import io.layermesh.layer.Layer;
import io.layermesh.layer.QueryRequest;
import io.layermesh.layer.QueryResponse;
import io.layermesh.util.Jsons;
import io.layermesh.util.Stages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Hosts a layer over HTTP: {@code POST /} takes a request envelope and answers with the
 * response envelope. Every request runs against a fresh fork of the hosted layer.
 */
public final class LayerHttpServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(LayerHttpServer.class);

    private final Layer layer;
    private final HostConfig config;
    private final HttpServer server;

    private LayerHttpServer(Layer layer, HostConfig config, HttpServer server) {
        this.layer = layer;
        this.config = config;
        this.server = server;
    }

    public static LayerHttpServer start(Layer layer, HostConfig config) throws IOException {
        if (layer == null) {
            throw new IllegalArgumentException("hosted layer is required");
        }
        HostConfig safe = config == null ? HostConfig.defaults() : config;
        HttpServer server = HttpServer.create(new InetSocketAddress(safe.bind(), safe.port()), 0);
        LayerHttpServer host = new LayerHttpServer(layer, safe, server);
        server.createContext("/", host::handle);
        server.start();
        LOG.info("Layer '{}' listening on http://{}:{}/", layer.getName(), safe.bind(), host.port());
        return host;
    }

    public int port() {
        return server.getAddress().getPort();
    }

    public Layer layer() {
        return layer;
    }

    @Override
    public void close() {
        server.stop(0);
        LOG.info("Layer '{}' stopped", layer.getName());
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                writeJson(exchange, Map.of("error", "method not allowed"), 405);
                return;
            }
            if (!"/".equals(exchange.getRequestURI().getPath())) {
                writeJson(exchange, Map.of("error", "not found"), 404);
                return;
            }
            QueryRequest request = readRequest(exchange);
            QueryResponse response = layer.fork().receiveQuery(request).toCompletableFuture().join();
            writeJson(exchange, response, 200);
        } catch (RuntimeException e) {
            Throwable cause = e instanceof CompletionException ? Stages.unwrap(e) : e;
            int status = statusFor(cause);
            LOG.warn("Query from {} failed with {}: {}", exchange.getRemoteAddress(), status, cause.getMessage());
            writeJson(exchange, Map.of("error", String.valueOf(cause.getMessage())), status);
        }
    }

    private QueryRequest readRequest(HttpExchange exchange) throws IOException {
        byte[] body;
        try (InputStream in = exchange.getRequestBody()) {
            body = in.readNBytes(config.maxBodyBytes() + 1);
        }
        if (body.length > config.maxBodyBytes()) {
            throw new ProtocolException("Request body exceeds " + config.maxBodyBytes() + " bytes");
        }
        JsonNode envelope = Jsons.readTree(new String(body, StandardCharsets.UTF_8));
        if (envelope == null || !envelope.isObject()) {
            throw new ProtocolException("A request envelope must be a JSON object");
        }
        try {
            return Jsons.mapper().treeToValue(envelope, QueryRequest.class);
        } catch (IOException e) {
            throw new ProtocolException("Malformed request envelope: " + e.getMessage(), e);
        }
    }

    static int statusFor(Throwable error) {
        if (error instanceof AuthorizationException) {
            return 403;
        }
        if (error instanceof LookupException) {
            return 404;
        }
        if (error instanceof ProtocolException
                || error instanceof SerializationException
                || error instanceof IllegalArgumentException) {
            return 400;
        }
        return 500;
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toCompactJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
