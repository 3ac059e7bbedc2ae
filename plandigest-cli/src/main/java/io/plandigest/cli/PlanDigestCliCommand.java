package io.plandigest.cli;

import picocli.CommandLine.Command;

@Command(name = "plandigest", mixinStandardHelpOptions = true, description = "Plan run analytics for the execution platform")
public final class PlanDigestCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
