package io.plandigest.core.report;

import io.plandigest.core.model.AnalysisWindow;
import java.time.Instant;

public record ReportWindow(Instant since, Instant until) {

    public static ReportWindow of(AnalysisWindow window) {
        return new ReportWindow(window.since(), window.until());
    }
}
