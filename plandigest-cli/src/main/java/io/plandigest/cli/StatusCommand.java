package io.plandigest.cli;

import io.plandigest.core.config.model.PlanDigestConfig;
import io.plandigest.core.config.model.SourceConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and record source status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            PlanDigestConfig config = context.configService().load(context.configPath());
            SourceConfig source = config.source();
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Record source: " + sourceKind(source));
            if (source.usesSnapshot()) {
                System.out.println("Snapshot file: " + source.snapshotFile());
            }
            System.out.println("API base: " + source.resolvedApiBase());
            System.out.println("API key configured: " + source.configured());
            System.out.println("Organization configured: " + (source.orgId() != null && !source.orgId().isBlank()));
            System.out.println("Page limit: " + source.pageLimit());
            System.out.println("Analysis profile: " + config.analysis().profile());
            return 0;
        } catch (Exception e) {
            return CommandFailures.report("Status command failed", e);
        }
    }

    private static String sourceKind(SourceConfig source) {
        if (source.usesSnapshot()) {
            return "snapshot";
        }
        return source.configured() ? "http" : "not configured";
    }
}
