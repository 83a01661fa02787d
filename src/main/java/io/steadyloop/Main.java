package io.steadyloop;

import io.steadyloop.cli.SteadyLoopCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new SteadyLoopCommand()).execute(args);
        System.exit(code);
    }
}
