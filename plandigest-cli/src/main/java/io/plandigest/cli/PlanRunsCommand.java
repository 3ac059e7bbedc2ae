package io.plandigest.cli;

import io.plandigest.core.config.model.PlanDigestConfig;
import io.plandigest.core.model.PlanRun;
import io.plandigest.core.model.RunState;
import io.plandigest.core.model.WindowParser;
import io.plandigest.core.report.ReportJson;
import io.plandigest.core.source.RecordSource;
import io.plandigest.core.source.RecordSourceException;
import io.plandigest.core.source.RunQuery;
import java.time.Instant;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "plan-runs", description = "Inspect plan runs known to the record source")
public final class PlanRunsCommand implements Runnable {
    private final CliContext context;

    public PlanRunsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public void run() {
        System.err.println("Specify a subcommand: list or get");
    }

    @Command(name = "list", description = "List plan runs, newest first")
    int list(
        @Option(names = "--plan-id", description = "Only runs of this plan") String planId,
        @Option(names = "--state", description = "Only runs in this state, e.g. COMPLETE or FAILED") String state,
        @Option(names = "--since", description = "Only runs created at or after this time") String since,
        @Option(names = {"-l", "--limit"}, defaultValue = "20", description = "Maximum number of runs") int limit,
        @Option(names = "--json", description = "Print runs as JSON") boolean json
    ) {
        try {
            RunState runState = parseState(state);
            Instant start = since == null ? null : new WindowParser().parse(since, context.clock());
            List<PlanRun> runs = openSource().listRuns(new RunQuery(planId, runState, start, null, limit));
            if (json) {
                System.out.println(new ReportJson().toPrettyJson(runs));
                return 0;
            }
            if (runs.isEmpty()) {
                System.out.println("No plan runs found.");
            }
            for (PlanRun run : runs) {
                System.out.println(
                    run.id() + "  " + run.planId() + "  " + run.runState()
                        + "  " + run.createdAt()
                        + (run.hasDuration() ? "  " + run.durationSeconds() + "s" : "")
                );
            }
            return 0;
        } catch (Exception e) {
            return CommandFailures.report("Plan run listing failed", e);
        }
    }

    @Command(name = "get", description = "Show one plan run as JSON")
    int get(@Parameters(index = "0", arity = "1", description = "Plan run id") String runId) {
        try {
            PlanRun run = openSource().getRun(runId);
            System.out.println(new ReportJson().toPrettyJson(run));
            return 0;
        } catch (RecordSourceException e) {
            if (e.notFound()) {
                System.err.println("Plan run not found: " + runId);
                return CommandFailures.FAILURE;
            }
            return CommandFailures.report("Plan run lookup failed", e);
        } catch (Exception e) {
            return CommandFailures.report("Plan run lookup failed", e);
        }
    }

    private static RunState parseState(String raw) {
        if (raw == null) {
            return null;
        }
        RunState parsed = RunState.parse(raw);
        if (parsed == RunState.UNKNOWN) {
            throw new IllegalArgumentException("unknown run state: " + raw);
        }
        return parsed;
    }

    private RecordSource openSource() throws Exception {
        PlanDigestConfig config = context.configService().load(context.configPath());
        return context.sourceFactory().create(config.source());
    }
}
