package io.workqueue;

import io.workqueue.cli.WorkQueueCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new WorkQueueCommand()).execute(args);
        System.exit(code);
    }
}
