package io.macroq;

import io.macroq.cli.MacroQCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new MacroQCommand()).execute(args);
        System.exit(code);
    }
}
