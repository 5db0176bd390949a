package io.conductor;

import io.conductor.cli.ConductorCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new ConductorCommand()).execute(args);
        System.exit(code);
    }
}
