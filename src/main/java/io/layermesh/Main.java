package io.layermesh;

import io.layermesh.cli.LayerMeshCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new LayerMeshCommand()).execute(args);
        System.exit(code);
    }
}
