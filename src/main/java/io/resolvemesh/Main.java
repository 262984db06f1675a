package io.resolvemesh;

import io.resolvemesh.cli.ResolveMeshCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new ResolveMeshCommand()).execute(args);
        System.exit(code);
    }
}
