package io.layermesh.http;

import com.fasterxml.jackson.databind.JsonNode;
import io.layermesh.error.AuthorizationException;
import io.layermesh.error.LayerMeshException;
import io.layermesh.error.LookupException;
import io.layermesh.error.ProtocolException;
import io.layermesh.layer.Layer;
import io.layermesh.layer.QueryRequest;
import io.layermesh.layer.QueryResponse;
import io.layermesh.layer.QueryTransport;
import io.layermesh.util.Jsons;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletionStage;

/**
 * Posts request envelopes to a hosted layer. The local parent layer only describes the remote
 * surface (which items exist there); the query itself runs on the host.
 */
public final class HttpQueryTransport implements QueryTransport {
    private final URI endpoint;
    private final HttpClient http;
    private final Duration requestTimeout;

    public HttpQueryTransport(URI endpoint) {
        this(endpoint, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), Duration.ofSeconds(30));
    }

    public HttpQueryTransport(URI endpoint, HttpClient http, Duration requestTimeout) {
        if (endpoint == null) {
            throw new IllegalArgumentException("endpoint is required");
        }
        this.endpoint = endpoint;
        this.http = http;
        this.requestTimeout = requestTimeout;
    }

    public URI endpoint() {
        return endpoint;
    }

    @Override
    public CompletionStage<QueryResponse> deliver(Layer parent, QueryRequest request) {
        return post(Jsons.toCompactJson(request)).thenApply(HttpQueryTransport::parseResponse);
    }

    /**
     * Posts a raw envelope and yields the raw response body.
     */
    public CompletionStage<String> post(String envelope) {
        HttpRequest httpRequest = HttpRequest.newBuilder(endpoint)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(envelope, StandardCharsets.UTF_8))
                .build();
        return http.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8))
                .thenApply(HttpQueryTransport::checkStatus);
    }

    private static String checkStatus(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status / 100 == 2) {
            return response.body();
        }
        String message = errorMessage(response.body(), status);
        if (status == 403) {
            throw new AuthorizationException(message);
        }
        if (status == 404) {
            throw new LookupException(message);
        }
        throw new RemoteQueryException(message, status);
    }

    private static String errorMessage(String body, int status) {
        try {
            JsonNode node = Jsons.readTree(body);
            if (node != null && node.hasNonNull("error")) {
                return node.get("error").asText();
            }
        } catch (IllegalArgumentException e) {
            return "Hosted layer answered " + status + ": " + body;
        }
        return "Hosted layer answered " + status;
    }

    private static QueryResponse parseResponse(String body) {
        try {
            return Jsons.mapper().readValue(body, QueryResponse.class);
        } catch (IOException e) {
            throw new ProtocolException("Malformed response envelope: " + e.getMessage(), e);
        }
    }

    /**
     * A hosted layer answered with an error status other than 403 and 404.
     */
    public static final class RemoteQueryException extends LayerMeshException {
        private final int status;

        public RemoteQueryException(String message, int status) {
            super(message);
            this.status = status;
        }

        public int status() {
            return status;
        }
    }
}
