package io.plandigest.cli;

import io.plandigest.core.config.model.PlanDigestConfig;
import io.plandigest.core.model.Plan;
import io.plandigest.core.report.ReportJson;
import io.plandigest.core.source.RecordSource;
import io.plandigest.core.source.RecordSourceException;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "plans", description = "Inspect plans known to the record source")
public final class PlansCommand implements Runnable {
    private final CliContext context;

    public PlansCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public void run() {
        System.err.println("Specify a subcommand: list or get");
    }

    @Command(name = "list", description = "List the most recently created plans")
    int list(
        @Option(names = {"-l", "--limit"}, defaultValue = "20", description = "Maximum number of plans") int limit,
        @Option(names = "--json", description = "Print plans as JSON") boolean json
    ) {
        try {
            if (limit < 1) {
                throw new IllegalArgumentException("limit must be at least 1");
            }
            List<Plan> plans = openSource().listPlans(limit);
            if (json) {
                System.out.println(new ReportJson().toPrettyJson(plans));
                return 0;
            }
            if (plans.isEmpty()) {
                System.out.println("No plans found.");
            }
            for (Plan plan : plans) {
                System.out.println(plan.id() + "  " + plan.createdAt() + "  " + plan.name());
            }
            return 0;
        } catch (Exception e) {
            return CommandFailures.report("Plan listing failed", e);
        }
    }

    @Command(name = "get", description = "Show one plan as JSON")
    int get(@Parameters(index = "0", arity = "1", description = "Plan id") String planId) {
        try {
            Plan plan = openSource().getPlan(planId);
            System.out.println(new ReportJson().toPrettyJson(plan));
            return 0;
        } catch (RecordSourceException e) {
            if (e.notFound()) {
                System.err.println("Plan not found: " + planId);
                return CommandFailures.FAILURE;
            }
            return CommandFailures.report("Plan lookup failed", e);
        } catch (Exception e) {
            return CommandFailures.report("Plan lookup failed", e);
        }
    }

    private RecordSource openSource() throws Exception {
        PlanDigestConfig config = context.configService().load(context.configPath());
        return context.sourceFactory().create(config.source());
    }
}
