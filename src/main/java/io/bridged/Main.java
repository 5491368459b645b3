package io.bridged;

import io.bridged.cli.BridgeCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new BridgeCommand()).execute(args);
        System.exit(code);
    }
}
