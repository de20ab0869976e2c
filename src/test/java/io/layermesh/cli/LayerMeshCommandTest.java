package io.layermesh.cli;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.layermesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

final class LayerMeshCommandTest {

    @Test
    void introspectionQueryAsksForTheExposedSurface() {
        Assertions.assertEquals(Jsons.readTree("{\"$introspect=>\": {\"()\": [{\"items\": {\"filter\": \"$isExposed\"}, "
                        + "\"properties\": {\"filter\": \"$isExposed\"}}]}}"),
                LayerMeshCommand.introspectionQuery());
    }

    @Test
    void envelopeCarriesQueryAndSource() {
        ObjectNode envelope = LayerMeshCommand.envelope(Jsons.readTree("{\"Clock=>\": true}"), "frontend");

        Assertions.assertEquals(Jsons.readTree("{\"query\": {\"Clock=>\": true}, \"source\": \"frontend\"}"), envelope);
    }

    @Test
    void subcommandOptionsAreParsed() {
        CommandLine cli = new CommandLine(new LayerMeshCommand());

        CommandLine.ParseResult parsed = cli.parseArgs("--config-dir", "/tmp", "query", "--query", "{}", "--source", "web");

        Assertions.assertEquals("/tmp", ((LayerMeshCommand) cli.getCommand()).configDir);
        LayerMeshCommand.QueryCommand query = (LayerMeshCommand.QueryCommand) parsed.subcommand().commandSpec().userObject();
        Assertions.assertEquals("{}", query.query);
        Assertions.assertEquals("web", query.source);
        Assertions.assertEquals("http://127.0.0.1:6789/", query.url);
    }

    @Test
    void queryOptionIsRequired() {
        CommandLine cli = new CommandLine(new LayerMeshCommand());

        Assertions.assertThrows(CommandLine.MissingParameterException.class, () -> cli.parseArgs("query"));
    }
}
