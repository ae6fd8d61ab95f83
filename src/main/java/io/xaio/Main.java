package io.xaio;

import io.xaio.cli.XaioCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = XaioCommand.commandLine().execute(args);
        System.exit(code);
    }
}
