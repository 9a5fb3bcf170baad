package io.agentswarm;

import io.agentswarm.cli.SwarmCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new SwarmCommand()).execute(args);
        System.exit(code);
    }
}
