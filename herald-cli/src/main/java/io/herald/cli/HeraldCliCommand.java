package io.herald.cli;

import picocli.CommandLine.Command;

@Command(name = "herald", mixinStandardHelpOptions = true, description = "Scheduled multi-channel newsletter delivery")
public final class HeraldCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
