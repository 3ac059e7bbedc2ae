package io.plandigest.core.analysis;

import io.plandigest.core.model.PlanRun;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

public final class TemporalDistribution {

    public SortedMap<Integer, Integer> hourly(List<PlanRun> runs) {
        SortedMap<Integer, Integer> counts = new TreeMap<>();
        for (PlanRun run : runs) {
            if (run.completedAt() != null) {
                int hour = run.completedAt().atZone(ZoneOffset.UTC).getHour();
                counts.merge(hour, 1, Integer::sum);
            }
        }
        return counts;
    }

    public SortedMap<String, Integer> daily(List<PlanRun> runs) {
        SortedMap<String, Integer> counts = new TreeMap<>();
        for (PlanRun run : runs) {
            if (run.completedAt() != null) {
                String date = LocalDate.ofInstant(run.completedAt(), ZoneOffset.UTC).toString();
                counts.merge(date, 1, Integer::sum);
            }
        }
        return counts;
    }
}
