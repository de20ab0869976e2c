package io.layermesh.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.layermesh.config.HostConfig;
import io.layermesh.example.ClockLayer;
import io.layermesh.http.HttpQueryTransport;
import io.layermesh.http.LayerHttpServer;
import io.layermesh.layer.Layer;
import io.layermesh.layer.IntrospectionOptions;
import io.layermesh.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "layermesh",
        mixinStandardHelpOptions = true,
        description = "LayerMesh query host and client",
        subcommands = {
                LayerMeshCommand.ServeCommand.class,
                LayerMeshCommand.QueryCommand.class,
                LayerMeshCommand.IntrospectCommand.class
        }
)
public final class LayerMeshCommand implements Runnable {
    static final String DEFAULT_SOURCE = "frontend";

    @Option(names = {"--config-dir"}, description = "Directory holding layermesh-settings.json", defaultValue = ".")
    String configDir;

    @Override
    public void run() {
        System.out.println("Use subcommands: serve | query | introspect");
    }

    HostConfig hostConfig() {
        Path dir = configDir == null || configDir.isBlank() ? Paths.get(".") : Paths.get(configDir);
        return HostConfig.load(dir);
    }

    static ObjectNode envelope(JsonNode query, String source) {
        ObjectNode envelope = Jsons.nodes().objectNode();
        envelope.set("query", query);
        envelope.put("source", source);
        return envelope;
    }

    static String post(String url, ObjectNode envelope) {
        HttpQueryTransport transport = new HttpQueryTransport(URI.create(url));
        return transport.post(Jsons.toCompactJson(envelope)).toCompletableFuture().join();
    }

    @Command(name = "serve", description = "Host the example Clock layer over HTTP")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        LayerMeshCommand parent;

        @Option(names = {"--bind"}, description = "Bind address (default from settings)")
        String bind;

        @Option(names = {"--port"}, description = "Bind port (default from settings)")
        Integer port;

        @Option(names = {"--name"}, description = "Hosted layer name (default from settings)")
        String name;

        @Override
        public Integer call() throws Exception {
            HostConfig config = parent.hostConfig().withBind(bind).withPort(port).withLayerName(name);
            Layer layer = ClockLayer.create(config.layerName());
            try (LayerHttpServer server = LayerHttpServer.start(layer, config)) {
                System.out.println("Layer '" + layer.getName() + "' listening on http://" + config.bind() + ":" + server.port() + "/");
                Thread.currentThread().join();
            }
            return 0;
        }
    }

    @Command(name = "query", description = "Send one query envelope to a hosted layer and print the response")
    static final class QueryCommand implements Callable<Integer> {
        @Option(names = {"--url"}, description = "Hosted layer URL", defaultValue = "http://127.0.0.1:6789/")
        String url;

        @Option(names = {"--query"}, required = true, description = "Query as JSON, e.g. {\"Clock=>\": {\"getTime=>result\": {\"()\": []}}}")
        String query;

        @Option(names = {"--source"}, description = "Name of the sending layer", defaultValue = DEFAULT_SOURCE)
        String source;

        @Override
        public Integer call() {
            String response = post(url, envelope(Jsons.readTree(query), source));
            System.out.println(Jsons.toJson(Jsons.readTree(response)));
            return 0;
        }
    }

    @Command(name = "introspect", description = "Print the exposed surface of a hosted layer")
    static final class IntrospectCommand implements Callable<Integer> {
        @Option(names = {"--url"}, description = "Hosted layer URL", defaultValue = "http://127.0.0.1:6789/")
        String url;

        @Option(names = {"--source"}, description = "Name of the sending layer", defaultValue = DEFAULT_SOURCE)
        String source;

        @Override
        public Integer call() {
            String response = post(url, envelope(introspectionQuery(), source));
            System.out.println(Jsons.toJson(Jsons.readTree(response)));
            return 0;
        }
    }

    static JsonNode introspectionQuery() {
        Map<String, Object> exposedOnly = Map.of("filter", IntrospectionOptions.EXPOSED_FILTER);
        Map<String, Object> call = Map.of("()", List.of(Map.of("items", exposedOnly, "properties", exposedOnly)));
        return Jsons.mapper().valueToTree(Map.of(Layer.INTROSPECT_METHOD + "=>", call));
    }
}
