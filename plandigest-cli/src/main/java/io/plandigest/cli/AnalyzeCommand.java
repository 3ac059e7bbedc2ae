package io.plandigest.cli;

import io.plandigest.core.analysis.AnalysisProfile;
import io.plandigest.core.analysis.PlanRunAnalyzer;
import io.plandigest.core.config.model.PlanDigestConfig;
import io.plandigest.core.model.AnalysisWindow;
import io.plandigest.core.model.WindowParser;
import io.plandigest.core.report.AnalysisReport;
import io.plandigest.core.report.ReportJson;
import io.plandigest.core.source.RecordSource;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "analyze", description = "Analyze plan runs in a time window (default: last 24 hours)")
public final class AnalyzeCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--today", description = "Analyze runs since midnight UTC")
    boolean today;

    @Option(names = "--yesterday", description = "Analyze runs from the previous UTC day")
    boolean yesterday;

    @Option(names = "--since", description = "Window start, e.g. '2025-01-15', '3 days ago', 'yesterday'")
    String since;

    @Option(names = "--until", description = "Window end (default: now)")
    String until;

    @Option(names = "--with-tools", description = "Include tool usage and tool performance sections")
    boolean withTools;

    @Option(names = "--json", description = "Print the full report as JSON")
    boolean json;

    @Option(names = {"-p", "--profile"}, description = "Report profile: standard or compact")
    String profile;

    public AnalyzeCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            PlanDigestConfig config = context.configService().load(context.configPath());
            AnalysisWindow window = resolveWindow();
            AnalysisProfile analysisProfile = AnalysisProfile
                .named(profile != null ? profile : config.analysis().profile())
                .withTopTools(config.analysis().topTools());

            RecordSource source = context.sourceFactory().create(config.source());
            PlanRunAnalyzer analyzer = new PlanRunAnalyzer(
                source,
                context.clock(),
                analysisProfile,
                config.source().pageLimit() > 0 ? config.source().pageLimit() : PlanRunAnalyzer.DEFAULT_FETCH_LIMIT
            );
            AnalysisReport report = analyzer.analyze(window, withTools);
            if (json) {
                System.out.println(new ReportJson().toPrettyJson(report));
            } else {
                System.out.print(new DigestFormatter().format(report));
            }
            return 0;
        } catch (Exception e) {
            return CommandFailures.report("Analysis failed", e);
        }
    }

    private AnalysisWindow resolveWindow() {
        int shortcuts = (today ? 1 : 0) + (yesterday ? 1 : 0) + (since != null ? 1 : 0);
        if (shortcuts > 1) {
            throw new IllegalArgumentException("use only one of --today, --yesterday or --since");
        }
        if ((today || yesterday) && until != null) {
            throw new IllegalArgumentException("--until requires --since");
        }
        if (today) {
            return AnalysisWindow.today(context.clock());
        }
        if (yesterday) {
            return AnalysisWindow.yesterday(context.clock());
        }
        return new WindowParser().resolve(since, until, context.clock());
    }
}
