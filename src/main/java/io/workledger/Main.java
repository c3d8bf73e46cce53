package io.workledger;

import io.workledger.cli.WorkLedgerCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = WorkLedgerCommand.newCommandLine().execute(args);
        System.exit(code);
    }
}
