package io.plandigest.app;

import io.plandigest.cli.AnalyzeCommand;
import io.plandigest.cli.CliContext;
import io.plandigest.cli.OnboardCommand;
import io.plandigest.cli.PlanDigestCliCommand;
import io.plandigest.cli.PlanRunsCommand;
import io.plandigest.cli.PlansCommand;
import io.plandigest.cli.StatusCommand;
import io.plandigest.core.config.ConfigPaths;
import io.plandigest.core.config.ConfigService;
import io.plandigest.core.source.RecordSources;
import java.nio.file.Path;
import java.time.Clock;
import picocli.CommandLine;

public final class PlanDigestApplication {

    private PlanDigestApplication() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String... args) {
        return buildCommandLine(new ConfigService(), ConfigPaths.defaultConfigPath(), Clock.systemUTC()).execute(args);
    }

    static CommandLine buildCommandLine(ConfigService configService, Path configPath, Clock clock) {
        CliContext context = new CliContext(configService, configPath, RecordSources::fromConfig, clock);

        CommandLine commandLine = new CommandLine(new PlanDigestCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("analyze", new AnalyzeCommand(context));
        commandLine.addSubcommand("plans", new PlansCommand(context));
        commandLine.addSubcommand("plan-runs", new PlanRunsCommand(context));
        return commandLine;
    }
}
